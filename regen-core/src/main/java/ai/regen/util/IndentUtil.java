package ai.regen.util;

import java.util.List;

/** Column arithmetic for marker bodies: measuring, shifting and stripping leading whitespace. */
public final class IndentUtil {
    private IndentUtil() {
        // utility
    }

    /** Leading whitespace characters of a single line, not counting a line terminator. */
    public static int countLeadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i)) && line.charAt(i) != '\n') {
            i++;
        }
        return i;
    }

    /**
     * Smallest leading-whitespace count over the non-blank lines. Returns -1 if every line is blank.
     */
    public static int minimumIndent(List<String> lines) {
        int min = -1;
        for (var line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int indent = countLeadingWhitespace(line);
            if (min < 0 || indent < min) {
                min = indent;
            }
        }
        return min;
    }

    /**
     * Shifts every non-blank line right so that the least indented one starts at {@code indent.length()}.
     * Lines already at or beyond that column are returned unchanged, as is a block with no non-blank line.
     * The added prefix is taken from the tail of {@code indent}, so tabs stay tabs.
     */
    public static List<String> shiftToColumn(List<String> lines, String indent) {
        int min = minimumIndent(lines);
        if (min < 0 || min >= indent.length()) {
            return lines;
        }
        var prefix = indent.substring(min);
        return lines.stream().map(l -> l.isBlank() ? l : prefix + l).toList();
    }

    /**
     * Removes up to {@code width} leading whitespace characters from a line.
     */
    public static String stripIndent(String line, int width) {
        int n = Math.min(countLeadingWhitespace(line), width);
        return line.substring(n);
    }
}
