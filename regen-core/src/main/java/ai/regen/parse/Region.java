package ai.regen.parse;

import ai.regen.marker.MarkerKind;
import org.jetbrains.annotations.Nullable;

/**
 * One marker as found in a document. The delimiter lines are kept verbatim, line terminators included, so that a
 * region whose content is not replaced reserializes byte-for-byte.
 *
 * @param indent leading whitespace of the start delimiter line
 * @param rawContent text between the delimiter lines as currently on disk
 * @param baselineContent last body the engine produced for this marker, or null when unknown
 */
public record Region(
        MarkerKind kind,
        String id,
        String startDelimiter,
        String endDelimiter,
        String indent,
        Span span,
        String rawContent,
        @Nullable String baselineContent)
        implements Segment {

    @Override
    public String text() {
        return startDelimiter + rawContent + endDelimiter;
    }

    /** True when the body no longer matches the last generated output. */
    public boolean isModified() {
        return baselineContent != null && !baselineContent.equals(rawContent);
    }

    public Region withBaseline(@Nullable String baseline) {
        return new Region(kind, id, startDelimiter, endDelimiter, indent, span, rawContent, baseline);
    }

    public Region withContent(String content) {
        return new Region(kind, id, startDelimiter, endDelimiter, indent, span, content, baselineContent);
    }
}
