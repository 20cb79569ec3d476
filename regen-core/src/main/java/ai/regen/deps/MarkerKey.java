package ai.regen.deps;

import java.util.Comparator;

/** Identifies one marker instance: a file plus the marker id within it. */
public record MarkerKey(String file, String markerId) implements Comparable<MarkerKey> {
    private static final Comparator<MarkerKey> ORDER =
            Comparator.comparing(MarkerKey::file).thenComparing(MarkerKey::markerId);

    public MarkerKey {
        if (file == null || markerId == null) {
            throw new IllegalArgumentException("file and markerId are required");
        }
    }

    @Override
    public int compareTo(MarkerKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return file + "#" + markerId;
    }
}
