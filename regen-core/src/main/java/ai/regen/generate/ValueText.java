package ai.regen.generate;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Converts model values to the text substituted into generated code.
 *
 * <p>Strings are emitted without quotes, arrays as their elements joined by {@code ", "}, objects as
 * {@code {key: value, ...}} and null as {@code null}.
 */
public final class ValueText {
    private ValueText() {
        // utility class
    }

    public static String of(JsonNode value) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isArray()) {
            return StreamSupport.stream(value.spliterator(), false)
                    .map(ValueText::of)
                    .collect(Collectors.joining(", "));
        }
        if (value.isObject()) {
            var parts = new ArrayList<String>();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                parts.add(field.getKey() + ": " + of(field.getValue()));
            }
            return "{" + String.join(", ", parts) + "}";
        }
        if (value.isNull() || value.isMissingNode()) {
            return "null";
        }
        return value.asText();
    }

    /** Truthiness used by conditions: false, null, 0, "", "false", and empty containers are false. */
    public static boolean truthy(JsonNode value) {
        if (value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0.0;
        }
        if (value.isTextual()) {
            var text = value.textValue();
            return !text.isEmpty() && !"false".equalsIgnoreCase(text);
        }
        if (value.isContainerNode()) {
            return value.size() > 0;
        }
        return true;
    }
}
