package ai.regen.generate;

import ai.regen.api.ModelSnapshot;
import ai.regen.api.TemplateRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Variable scope for rendering: locally bound names (template parameters, iteration variables) shadow model keys.
 * A dotted name whose first segment is local walks into the local value, so {@code item.name} reads a field of the
 * current iteration item.
 */
final class Bindings implements TemplateRenderer.VariableLookup {
    private final Map<String, JsonNode> locals;
    private final ModelSnapshot model;

    Bindings(Map<String, JsonNode> locals, ModelSnapshot model) {
        this.locals = Map.copyOf(locals);
        this.model = model;
    }

    static Bindings of(ModelSnapshot model) {
        return new Bindings(Map.of(), model);
    }

    Bindings with(String name, JsonNode value) {
        var copy = new HashMap<>(locals);
        copy.put(name, value);
        return new Bindings(copy, model);
    }

    ModelSnapshot model() {
        return model;
    }

    @Override
    public Optional<JsonNode> lookup(String name) {
        int dot = name.indexOf('.');
        var head = dot < 0 ? name : name.substring(0, dot);
        var local = locals.get(head);
        if (local == null) {
            return model.lookup(name);
        }
        if (dot < 0) {
            return Optional.of(local);
        }
        return Optional.ofNullable(walk(local, name.substring(dot + 1)));
    }

    private static @Nullable JsonNode walk(JsonNode node, String path) {
        JsonNode current = node;
        for (var segment : path.split("\\.", -1)) {
            if (current == null) {
                return null;
            }
            if (current.isArray() && !segment.isEmpty() && segment.chars().allMatch(Character::isDigit)) {
                current = current.get(Integer.parseInt(segment));
            } else if (current.isObject()) {
                current = current.get(segment);
            } else {
                return null;
            }
        }
        return current;
    }
}
