package ai.regen.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable view of the upstream model (scene graph, schema, ...) that drives generation.
 *
 * <p>Values are addressed by dotted keys such as {@code schema.fields} or {@code screens.0.title}; a numeric segment
 * indexes into an array. Keys containing a literal dot cannot be addressed.
 */
public final class ModelSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern DOT = Pattern.compile("\\.");
    private static final ModelSnapshot EMPTY = new ModelSnapshot(JsonNodeFactory.instance.objectNode());

    private final ObjectNode root;

    private ModelSnapshot(ObjectNode root) {
        this.root = root;
    }

    public static ModelSnapshot empty() {
        return EMPTY;
    }

    /** Builds a snapshot from plain Java values (maps, lists, strings, numbers, booleans). */
    public static ModelSnapshot of(Map<String, ?> values) {
        JsonNode tree = MAPPER.valueToTree(values);
        if (!(tree instanceof ObjectNode obj)) {
            throw new IllegalArgumentException("Model values must convert to a JSON object");
        }
        return new ModelSnapshot(obj);
    }

    public static ModelSnapshot fromTree(ObjectNode root) {
        return new ModelSnapshot(root.deepCopy());
    }

    public static ModelSnapshot fromJson(String json) throws JsonProcessingException {
        var tree = MAPPER.readTree(json);
        if (!(tree instanceof ObjectNode obj)) {
            throw new IllegalArgumentException("Model JSON must be an object, got " + tree.getNodeType());
        }
        return new ModelSnapshot(obj);
    }

    /**
     * Resolves a dotted key. An explicit JSON null is returned as a {@code NullNode}; a missing key is empty. The
     * returned node is a copy.
     */
    public Optional<JsonNode> lookup(String key) {
        if (key.isBlank()) {
            return Optional.empty();
        }
        JsonNode current = root;
        for (String segment : DOT.split(key, -1)) {
            current = child(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current.deepCopy());
    }

    public boolean contains(String key) {
        return lookup(key).isPresent();
    }

    /** Returns a copy of this snapshot with {@code key} set to {@code value}, creating intermediate objects. */
    public ModelSnapshot with(String key, Object value) {
        var segments = List.of(DOT.split(key, -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Invalid model key: '" + key + "'");
        }
        ObjectNode copy = root.deepCopy();
        ObjectNode parent = copy;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            var next = parent.get(segment);
            if (next instanceof ObjectNode obj) {
                parent = obj;
            } else {
                parent = parent.putObject(segment);
            }
        }
        parent.set(segments.get(segments.size() - 1), MAPPER.valueToTree(value));
        return new ModelSnapshot(copy);
    }

    /** Top-level keys in document order. */
    public List<String> keys() {
        var keys = new ArrayList<String>();
        root.fieldNames().forEachRemaining(keys::add);
        return keys;
    }

    /** Defensive copy of the underlying tree. */
    public ObjectNode tree() {
        return root.deepCopy();
    }

    public String toJson() {
        return root.toString();
    }

    private static @Nullable JsonNode child(JsonNode node, String segment) {
        if (node instanceof ObjectNode obj) {
            return obj.get(segment);
        }
        if (node instanceof ArrayNode arr && isIndex(segment)) {
            return arr.get(Integer.parseInt(segment));
        }
        return null;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ModelSnapshot other && root.equals(other.root));
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "ModelSnapshot" + root;
    }
}
