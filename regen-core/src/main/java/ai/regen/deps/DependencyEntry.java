package ai.regen.deps;

/** One recorded edge: the marker {@code markerId} in {@code file} reads {@code modelKey}. */
public record DependencyEntry(String modelKey, String file, String markerId) {
    public MarkerKey marker() {
        return new MarkerKey(file, markerId);
    }
}
