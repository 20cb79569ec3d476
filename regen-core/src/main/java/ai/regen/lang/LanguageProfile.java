package ai.regen.lang;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Comment syntax of one target language, used to recognise and render marker delimiters.
 *
 * @param id stable internal name, e.g. {@code JAVA}
 * @param name display name
 * @param extensions lower-case file extensions without the leading dot
 * @param lineComment line comment prefix, or null if the language has none
 * @param blockOpen block comment opener, or null
 * @param blockClose block comment closer, non-null exactly when {@code blockOpen} is
 */
public record LanguageProfile(
        String id,
        String name,
        Set<String> extensions,
        @Nullable String lineComment,
        @Nullable String blockOpen,
        @Nullable String blockClose) {

    public LanguageProfile {
        extensions = Set.copyOf(extensions);
        if ((blockOpen == null) != (blockClose == null)) {
            throw new IllegalArgumentException("Block comment delimiters must be given together for " + id);
        }
        if (lineComment == null && blockOpen == null) {
            throw new IllegalArgumentException("Language " + id + " needs at least one comment syntax");
        }
    }

    public boolean handles(String extension) {
        return extensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Strips the comment syntax from a trimmed line. Returns the text inside the comment, or empty if the line is not
     * a single comment in this language. Block syntax is tried first so that an opener which extends the line
     * prefix (Lua's {@code --[[}) is not mistaken for a line comment.
     */
    public Optional<String> commentText(String trimmedLine) {
        if (blockOpen != null
                && blockClose != null
                && trimmedLine.startsWith(blockOpen)
                && trimmedLine.endsWith(blockClose)
                && trimmedLine.length() >= blockOpen.length() + blockClose.length()) {
            return Optional.of(
                    trimmedLine.substring(blockOpen.length(), trimmedLine.length() - blockClose.length()));
        }
        if (lineComment != null && trimmedLine.startsWith(lineComment)) {
            return Optional.of(trimmedLine.substring(lineComment.length()));
        }
        return Optional.empty();
    }

    /** Wraps a marker token in this language's preferred comment form (line comment when available). */
    public String comment(String token) {
        if (lineComment != null) {
            return lineComment + " " + token;
        }
        return blockOpen + " " + token + " " + blockClose;
    }

    @Override
    public String toString() {
        return name;
    }
}
