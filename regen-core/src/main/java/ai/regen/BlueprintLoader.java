package ai.regen;

import ai.regen.marker.FileBlueprint;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads blueprints from JSON. The document maps file paths to blueprints:
 *
 * <pre>{@code
 * {
 *   "files": {
 *     "src/widget.rs": {
 *       "markers": [
 *         { "type": { "kind": "generated", "id": "fields", "strategy": "replace" },
 *           "source": { "type": "template", "text": "{{schema.fields}}" } }
 *       ]
 *     }
 *   }
 * }
 * }</pre>
 *
 * Enum values are case-insensitive.
 */
public final class BlueprintLoader {
    private static final Logger logger = LogManager.getLogger(BlueprintLoader.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private BlueprintLoader() {
        // utility class
    }

    record BlueprintFile(Map<String, FileBlueprint> files) {
        BlueprintFile {
            files = files == null ? Map.of() : files;
        }
    }

    /** Blueprints keyed by file path, in document order. */
    public static Map<String, FileBlueprint> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            var blueprints = read(in);
            logger.debug("Loaded {} blueprints from {}", blueprints.size(), path);
            return blueprints;
        }
    }

    public static Map<String, FileBlueprint> read(InputStream in) throws IOException {
        var parsed = MAPPER.readValue(in, BlueprintFile.class);
        return new LinkedHashMap<>(parsed.files());
    }

    public static Map<String, FileBlueprint> parse(String json) throws IOException {
        var parsed = MAPPER.readValue(json, BlueprintFile.class);
        return new LinkedHashMap<>(parsed.files());
    }

    /** Reads a single blueprint, as opposed to the per-file map. */
    public static FileBlueprint parseBlueprint(String json) throws IOException {
        return MAPPER.readValue(json, FileBlueprint.class);
    }
}
