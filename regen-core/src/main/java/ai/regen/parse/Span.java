package ai.regen.parse;

/**
 * Location of a region in the parsed text.
 *
 * @param startLine 0-based line of the start delimiter
 * @param endLine 0-based line of the end delimiter
 * @param startOffset char offset of the start delimiter line
 * @param endOffset char offset just past the end delimiter line
 */
public record Span(int startLine, int endLine, int startOffset, int endOffset) {}
