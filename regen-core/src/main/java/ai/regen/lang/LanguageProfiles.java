package ai.regen.lang;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of supported target languages. Adding a language is an edit to {@link #ALL}; nothing else in the
 * engine branches on language.
 */
public final class LanguageProfiles {
    public static final LanguageProfile RUST = cStyle("RUST", "Rust", Set.of("rs"));
    public static final LanguageProfile JAVA = cStyle("JAVA", "Java", Set.of("java"));
    public static final LanguageProfile KOTLIN = cStyle("KOTLIN", "Kotlin", Set.of("kt", "kts"));
    public static final LanguageProfile SCALA = cStyle("SCALA", "Scala", Set.of("scala", "sc"));
    public static final LanguageProfile GO = cStyle("GO", "Go", Set.of("go"));
    public static final LanguageProfile C_CPP =
            cStyle("C_CPP", "C/C++", Set.of("c", "h", "cpp", "hpp", "cc", "hh", "cxx", "hxx"));
    public static final LanguageProfile C_SHARP = cStyle("C_SHARP", "C#", Set.of("cs"));
    public static final LanguageProfile JAVASCRIPT =
            cStyle("JAVASCRIPT", "JavaScript", Set.of("js", "mjs", "cjs", "jsx"));
    public static final LanguageProfile TYPESCRIPT = cStyle("TYPESCRIPT", "TypeScript", Set.of("ts", "tsx"));
    public static final LanguageProfile SWIFT = cStyle("SWIFT", "Swift", Set.of("swift"));
    public static final LanguageProfile DART = cStyle("DART", "Dart", Set.of("dart"));
    public static final LanguageProfile JSONC =
            new LanguageProfile("JSONC", "JSON", Set.of("json", "jsonc"), "//", null, null);

    public static final LanguageProfile PYTHON = hashStyle("PYTHON", "Python", Set.of("py", "pyi"));
    public static final LanguageProfile RUBY = hashStyle("RUBY", "Ruby", Set.of("rb"));
    public static final LanguageProfile SHELL = hashStyle("SHELL", "Shell", Set.of("sh", "bash", "zsh"));
    public static final LanguageProfile YAML = hashStyle("YAML", "YAML", Set.of("yaml", "yml"));
    public static final LanguageProfile TOML = hashStyle("TOML", "TOML", Set.of("toml"));

    public static final LanguageProfile SQL = new LanguageProfile("SQL", "SQL", Set.of("sql"), "--", "/*", "*/");
    public static final LanguageProfile LUA = new LanguageProfile("LUA", "Lua", Set.of("lua"), "--", "--[[", "]]");

    public static final LanguageProfile MARKUP = new LanguageProfile(
            "MARKUP", "HTML/XML", Set.of("html", "htm", "xml", "xhtml", "vue", "svg"), null, "<!--", "-->");
    public static final LanguageProfile CSS =
            new LanguageProfile("CSS", "CSS", Set.of("css", "scss", "less"), null, "/*", "*/");

    public static final List<LanguageProfile> ALL = List.of(
            RUST, JAVA, KOTLIN, SCALA, GO, C_CPP, C_SHARP, JAVASCRIPT, TYPESCRIPT, SWIFT, DART, JSONC, PYTHON, RUBY,
            SHELL, YAML, TOML, SQL, LUA, MARKUP, CSS);

    private LanguageProfiles() {
        // utility class
    }

    public static List<LanguageProfile> all() {
        return ALL;
    }

    /**
     * Looks up the profile for a file extension. The extension is case-insensitive and may carry a leading dot.
     */
    public static Optional<LanguageProfile> forExtension(String extension) {
        var normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        if (normalized.isBlank()) {
            return Optional.empty();
        }
        var lower = normalized.toLowerCase(Locale.ROOT);
        return ALL.stream().filter(p -> p.extensions().contains(lower)).findFirst();
    }

    public static Optional<LanguageProfile> forPath(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        var name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return forExtension(name.substring(dot + 1));
    }

    public static Optional<LanguageProfile> forId(String id) {
        return ALL.stream().filter(p -> p.id().equalsIgnoreCase(id)).findFirst();
    }

    private static LanguageProfile cStyle(String id, String name, Set<String> extensions) {
        return new LanguageProfile(id, name, extensions, "//", "/*", "*/");
    }

    private static LanguageProfile hashStyle(String id, String name, Set<String> extensions) {
        return new LanguageProfile(id, name, extensions, "#", null, null);
    }
}
