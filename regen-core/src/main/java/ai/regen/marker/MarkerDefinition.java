package ai.regen.marker;

import ai.regen.marker.MarkerType.Conditional;
import ai.regen.marker.MarkerType.ConditionalStrategy;
import ai.regen.marker.MarkerType.Guard;
import org.jetbrains.annotations.Nullable;

/**
 * Out-of-band definition of one marker: its attributes and, for non-guard markers, where its content comes from.
 *
 * @param source null for guards and for switch conditionals, whose alternatives carry the text
 */
public record MarkerDefinition(MarkerType type, @Nullable ContentSource source) {

    public MarkerDefinition {
        if (type == null) {
            throw new IllegalArgumentException("Marker definition needs a type");
        }
        if (type instanceof Guard && source != null) {
            throw new IllegalArgumentException(
                    "Guard " + type.id() + " is developer-owned and takes no content source");
        }
        if (source == null && requiresSource(type)) {
            throw new IllegalArgumentException("Marker " + type.id() + " needs a content source");
        }
    }

    public static MarkerDefinition guard(Guard guard) {
        return new MarkerDefinition(guard, null);
    }

    public static MarkerDefinition of(MarkerType type, ContentSource source) {
        return new MarkerDefinition(type, source);
    }

    public String id() {
        return type.id();
    }

    public MarkerKind kind() {
        return type.markerKind();
    }

    private static boolean requiresSource(MarkerType type) {
        if (type instanceof Guard) {
            return false;
        }
        return !(type instanceof Conditional c && c.strategy() == ConditionalStrategy.SWITCH);
    }
}
