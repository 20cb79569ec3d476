package ai.regen.parse;

import ai.regen.lang.LanguageProfile;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Ordered regions interleaved with verbatim text, bound to one file and one language. Built from on-disk text for a
 * single rewrite cycle and then discarded.
 */
public final class ParsedDocument {
    private final String file;
    private final LanguageProfile profile;
    private final String lineSeparator;
    private final String source;
    private final List<Segment> segments;

    ParsedDocument(String file, LanguageProfile profile, String lineSeparator, String source, List<Segment> segments) {
        this.file = file;
        this.profile = profile;
        this.lineSeparator = lineSeparator;
        this.source = source;
        this.segments = List.copyOf(segments);
    }

    public String file() {
        return file;
    }

    public LanguageProfile profile() {
        return profile;
    }

    /** Dominant line separator of the source, used for newly generated lines. */
    public String lineSeparator() {
        return lineSeparator;
    }

    /** The text this document was parsed from. */
    public String source() {
        return source;
    }

    public List<Segment> segments() {
        return segments;
    }

    public List<Region> regions() {
        return segments.stream()
                .filter(Region.class::isInstance)
                .map(Region.class::cast)
                .toList();
    }

    public Optional<Region> region(String id) {
        return regions().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    /** Concatenates all segments. Equal to {@link #source()} until a region is replaced. */
    public String render() {
        var sb = new StringBuilder(source.length());
        segments.forEach(s -> sb.append(s.text()));
        return sb.toString();
    }

    /** Returns a copy whose regions carry the baselines supplied by {@code baselineForId}. */
    public ParsedDocument withBaselines(Function<String, @Nullable String> baselineForId) {
        var bound = segments.stream()
                .map(s -> s instanceof Region r ? (Segment) r.withBaseline(baselineForId.apply(r.id())) : s)
                .toList();
        return new ParsedDocument(file, profile, lineSeparator, source, bound);
    }

    /** Returns a copy with the region {@code id} replaced. */
    public ParsedDocument withRegion(Region replacement) {
        var replaced = segments.stream()
                .map(s -> s instanceof Region r && r.id().equals(replacement.id()) ? (Segment) replacement : s)
                .toList();
        return new ParsedDocument(file, profile, lineSeparator, source, replaced);
    }

    @Override
    public String toString() {
        return "ParsedDocument[" + file + ", " + profile.name() + ", regions=" + regions().size() + "]";
    }
}
