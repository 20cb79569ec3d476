package ai.regen.parse;

/** A contiguous piece of a parsed document: either unmanaged text or a marker region. */
public sealed interface Segment permits Segment.Verbatim, Region {

    /** Exact text this segment contributes to the document. */
    String text();

    /** Text outside any marker; always passed through unchanged. */
    record Verbatim(String text) implements Segment {}
}
