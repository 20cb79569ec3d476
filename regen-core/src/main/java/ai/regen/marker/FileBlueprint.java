package ai.regen.marker;

import ai.regen.marker.MarkerType.Guard;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Marker definitions for one generated file, supplied by the orchestrating tool alongside the model.
 *
 * @param markers definitions in the order they appear in a freshly scaffolded file
 * @param skeleton optional text for scaffolding a new file; a line consisting of {@code {{marker:id}}} (plus
 *     indentation) is replaced by that marker's delimiters
 */
public record FileBlueprint(List<MarkerDefinition> markers, @Nullable String skeleton) {

    public FileBlueprint {
        markers = markers == null ? List.of() : List.copyOf(markers);
        var seen = new LinkedHashMap<String, MarkerDefinition>();
        for (var definition : markers) {
            if (seen.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalArgumentException("Duplicate marker id in blueprint: " + definition.id());
            }
        }
    }

    public FileBlueprint(List<MarkerDefinition> markers) {
        this(markers, null);
    }

    public static FileBlueprint empty() {
        return new FileBlueprint(List.of(), null);
    }

    public Optional<MarkerDefinition> definition(String id) {
        return markers.stream().filter(d -> d.id().equals(id)).findFirst();
    }

    /**
     * Definition to use for a parsed marker. Guards without an explicit definition are treated as plain guards; other
     * kinds without one have no definition.
     */
    public Optional<MarkerDefinition> resolve(MarkerKind kind, String id) {
        var explicit = definition(id);
        if (explicit.isPresent() || kind != MarkerKind.GUARD) {
            return explicit;
        }
        return Optional.of(MarkerDefinition.guard(Guard.of(id)));
    }

    public Map<String, MarkerDefinition> byId() {
        var map = new LinkedHashMap<String, MarkerDefinition>();
        markers.forEach(d -> map.put(d.id(), d));
        return map;
    }
}
