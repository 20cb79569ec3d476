package ai.regen.rewrite;

import ai.regen.util.IndentUtil;
import com.google.common.base.Splitter;
import java.util.List;

/**
 * Converts between a logical body (lines joined by {@code \n}, no trailing separator, indentation relative to the
 * marker) and the raw text stored between two delimiter lines.
 */
final class BodyFormatter {
    private static final Splitter LINES = Splitter.onPattern("\\r?\\n");

    private BodyFormatter() {
        // utility class
    }

    /** Indents each non-blank line to the marker column and terminates every line with {@code lineSeparator}. */
    static String format(String logical, String indent, String lineSeparator) {
        if (logical.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder(logical.length() + 16);
        for (var line : lines(logical)) {
            if (!line.isBlank()) {
                sb.append(indent).append(line);
            }
            sb.append(lineSeparator);
        }
        return sb.toString();
    }

    /** Inverse of {@link #format}: strips up to the marker column of indentation and normalizes separators. */
    static String unformat(String raw, String indent) {
        if (raw.isEmpty()) {
            return "";
        }
        var lines = lines(raw);
        var sb = new StringBuilder(raw.length());
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            var line = lines.get(i);
            if (!line.isBlank()) {
                sb.append(IndentUtil.stripIndent(line, indent.length()));
            }
        }
        return sb.toString();
    }

    static List<String> lines(String text) {
        var parts = LINES.splitToList(text);
        // a trailing separator terminates the last line rather than starting a new one
        if (parts.size() > 1 && parts.get(parts.size() - 1).isEmpty()) {
            return parts.subList(0, parts.size() - 1);
        }
        return parts;
    }
}
