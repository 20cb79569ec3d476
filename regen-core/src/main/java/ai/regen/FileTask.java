package ai.regen;

import ai.regen.marker.FileBlueprint;

/**
 * One file to keep in sync with the model.
 *
 * @param path file path relative to the engine's root, using {@code /} separators
 */
public record FileTask(String path, FileBlueprint blueprint) {
    public FileTask {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File task needs a path");
        }
        path = path.replace('\\', '/');
        blueprint = blueprint == null ? FileBlueprint.empty() : blueprint;
    }
}
