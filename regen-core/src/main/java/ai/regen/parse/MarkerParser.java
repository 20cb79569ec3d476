package ai.regen.parse;

import ai.regen.lang.LanguageProfile;
import ai.regen.marker.MarkerKind;
import ai.regen.util.IndentUtil;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scans source text into regions delimited by comment tokens of the form {@code <kind:id:start>} /
 * {@code <kind:id:end>}.
 *
 * <p>A delimiter must be the only thing on its line apart from the comment syntax and surrounding whitespace. Start
 * and end tokens are matched with a LIFO stack. Nesting one marker inside another is rejected, as are duplicate ids,
 * unknown kinds and unbalanced tokens; any of these fails the whole parse.
 */
public final class MarkerParser {
    private static final Logger logger = LogManager.getLogger(MarkerParser.class);

    private static final Pattern TOKEN =
            Pattern.compile("<([A-Za-z_][A-Za-z0-9_-]*):([A-Za-z0-9_.\\-]+):(start|end)>");

    private MarkerParser() {
        // utility class
    }

    /** A recognised delimiter line. */
    record Delimiter(MarkerKind kind, String id, boolean start) {}

    private record Open(MarkerKind kind, String id, String line, String indent, int lineNo, int offset) {}

    /**
     * Parses {@code text} as the content of {@code file}.
     *
     * @throws ParseException if the marker structure is malformed; no partial document is returned
     */
    public static ParsedDocument parse(String file, String text, LanguageProfile profile) throws ParseException {
        var lines = splitLinesKeepingTerminators(text);
        var segments = new ArrayList<Segment>();
        var verbatim = new StringBuilder();
        var body = new StringBuilder();
        Deque<Open> stack = new ArrayDeque<>();
        Set<String> seenIds = new HashSet<>();

        int offset = 0;
        for (int lineNo = 0; lineNo < lines.size(); lineNo++) {
            var line = lines.get(lineNo);
            var delimiter = recognise(stripTerminator(line), profile, lineNo + 1);

            if (delimiter.isEmpty()) {
                (stack.isEmpty() ? verbatim : body).append(line);
            } else if (delimiter.get().start()) {
                var d = delimiter.get();
                var open = stack.peek();
                if (open != null) {
                    throw new ParseException(
                            ParseException.Reason.NESTED_MARKER,
                            "marker %s:%s starts inside %s:%s, which opened on line %d"
                                    .formatted(d.kind(), d.id(), open.kind(), open.id(), open.lineNo() + 1),
                            lineNo + 1);
                }
                if (!seenIds.add(d.id())) {
                    throw new ParseException(
                            ParseException.Reason.DUPLICATE_ID, "marker id '" + d.id() + "' is used twice", lineNo + 1);
                }
                if (!verbatim.isEmpty()) {
                    segments.add(new Segment.Verbatim(verbatim.toString()));
                    verbatim.setLength(0);
                }
                var indent = line.substring(0, IndentUtil.countLeadingWhitespace(stripTerminator(line)));
                stack.push(new Open(d.kind(), d.id(), line, indent, lineNo, offset));
                body.setLength(0);
            } else {
                var d = delimiter.get();
                var open = stack.peek();
                if (open == null) {
                    throw new ParseException(
                            ParseException.Reason.UNBALANCED_MARKER,
                            "end of %s:%s without a matching start".formatted(d.kind(), d.id()),
                            lineNo + 1);
                }
                if (open.kind() != d.kind() || !open.id().equals(d.id())) {
                    throw new ParseException(
                            ParseException.Reason.UNBALANCED_MARKER,
                            "end of %s:%s does not match open marker %s:%s from line %d"
                                    .formatted(d.kind(), d.id(), open.kind(), open.id(), open.lineNo() + 1),
                            lineNo + 1);
                }
                stack.pop();
                var span = new Span(open.lineNo(), lineNo, open.offset(), offset + line.length());
                segments.add(new Region(
                        open.kind(), open.id(), open.line(), line, open.indent(), span, body.toString(), null));
                body.setLength(0);
            }
            offset += line.length();
        }

        var unclosed = stack.peek();
        if (unclosed != null) {
            throw new ParseException(
                    ParseException.Reason.UNBALANCED_MARKER,
                    "marker %s:%s is never closed".formatted(unclosed.kind(), unclosed.id()),
                    unclosed.lineNo() + 1);
        }
        if (!verbatim.isEmpty()) {
            segments.add(new Segment.Verbatim(verbatim.toString()));
        }

        var document = new ParsedDocument(file, profile, detectLineSeparator(text), text, segments);
        logger.debug("Parsed {} as {}: {} markers", file, profile.name(), seenIds.size());
        return document;
    }

    /** Renders a delimiter line body (without indentation or terminator) in the profile's comment syntax. */
    public static String delimiter(LanguageProfile profile, MarkerKind kind, String id, boolean start) {
        return profile.comment("<" + kind.token() + ":" + id + ":" + (start ? "start" : "end") + ">");
    }

    /**
     * Finds the first line of {@code text} that would be read as a marker delimiter, including tokens of an unknown
     * kind. Text that is spliced into a document must not contain one, or the document no longer parses.
     *
     * @return the 1-based line number within {@code text}, or empty if no line looks like a delimiter
     */
    public static OptionalInt findDelimiterLine(String text, LanguageProfile profile) {
        var lines = splitLinesKeepingTerminators(text);
        for (int i = 0; i < lines.size(); i++) {
            try {
                if (recognise(stripTerminator(lines.get(i)), profile, i + 1).isPresent()) {
                    return OptionalInt.of(i + 1);
                }
            } catch (ParseException e) {
                // an unknown kind is still a delimiter-shaped line
                return OptionalInt.of(i + 1);
            }
        }
        return OptionalInt.empty();
    }

    static Optional<Delimiter> recognise(String line, LanguageProfile profile, int lineNo) throws ParseException {
        var trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        var comment = profile.commentText(trimmed);
        if (comment.isEmpty()) {
            return Optional.empty();
        }
        var matcher = TOKEN.matcher(comment.get().strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        var kindToken = matcher.group(1);
        var kind = MarkerKind.fromToken(kindToken);
        if (kind.isEmpty()) {
            throw new ParseException(
                    ParseException.Reason.UNKNOWN_KIND, "unknown marker kind '" + kindToken + "'", lineNo);
        }
        return Optional.of(new Delimiter(kind.get(), matcher.group(2), "start".equals(matcher.group(3))));
    }

    /** Splits text into lines, each keeping its terminator ({@code \n} or {@code \r\n}); the last may have none. */
    static List<String> splitLinesKeepingTerminators(String text) {
        var lines = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    static String stripTerminator(String line) {
        if (line.endsWith("\r\n")) {
            return line.substring(0, line.length() - 2);
        }
        if (line.endsWith("\n")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    static String detectLineSeparator(String text) {
        int nl = text.indexOf('\n');
        if (nl > 0 && text.charAt(nl - 1) == '\r') {
            return "\r\n";
        }
        return "\n";
    }
}
