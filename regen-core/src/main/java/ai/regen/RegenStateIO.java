package ai.regen;

import ai.regen.deps.DependencyEntry;
import ai.regen.deps.DependencyTracker;
import ai.regen.deps.MarkerKey;
import ai.regen.rewrite.BaselineStore;
import ai.regen.util.AtomicFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Persistence of the engine's cross-run state as JSON: the dependency triples and the baseline bodies.
 *
 * <p>Losing the file is harmless; the next run regenerates every marker and reports hand-edited bodies as untracked
 * content instead of overwriting them.
 */
public final class RegenStateIO {
    private static final Logger logger = LogManager.getLogger(RegenStateIO.class);

    static final int FORMAT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private RegenStateIO() {}

    /* ================= DTOs ================= */

    public record StateDto(int version, List<BaselineEntryDto> baselines, List<DependencyEntry> dependencies) {}

    public record BaselineEntryDto(String file, String markerId, String body) {}

    /* ================= Public API ================= */

    /** Writes the state, creating parent directories if necessary. */
    public static void save(BaselineStore baselines, DependencyTracker tracker, Path file) throws IOException {
        AtomicFiles.writeString(file, MAPPER.writeValueAsString(toDto(baselines, tracker)));
        logger.debug("Saved regeneration state ({} baselines) to {}", baselines.size(), file);
    }

    /**
     * Reads a state file. Returns empty if the file is missing or was written in an incompatible format; other I/O
     * failures propagate.
     */
    public static Optional<StateDto> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            logger.debug("Regeneration state file does not exist: {}", file);
            return Optional.empty();
        }
        StateDto dto;
        try {
            dto = MAPPER.readValue(file.toFile(), StateDto.class);
        } catch (MismatchedInputException e) {
            logger.warn("Regeneration state at {} appears incompatible ({}); ignoring it", file, e.getMessage());
            return Optional.empty();
        }
        if (dto.version() != FORMAT_VERSION) {
            logger.warn(
                    "Regeneration state at {} has version {}, expected {}; ignoring it",
                    file,
                    dto.version(),
                    FORMAT_VERSION);
            return Optional.empty();
        }
        logger.debug("Loaded regeneration state from {}", file);
        return Optional.of(dto);
    }

    /* ================= Converters ================= */

    public static StateDto toDto(BaselineStore baselines, DependencyTracker tracker) {
        var entries = new ArrayList<BaselineEntryDto>(baselines.size());
        baselines.snapshot()
                .forEach((key, body) -> entries.add(new BaselineEntryDto(key.file(), key.markerId(), body)));
        return new StateDto(FORMAT_VERSION, entries, tracker.entries());
    }

    /** Replaces the contents of {@code baselines} and {@code tracker} with {@code dto}. */
    public static void apply(StateDto dto, BaselineStore baselines, DependencyTracker tracker) {
        Map<MarkerKey, String> loaded = new HashMap<>();
        for (var entry : dto.baselines()) {
            loaded.put(new MarkerKey(entry.file(), entry.markerId()), entry.body());
        }
        baselines.restore(loaded);
        tracker.restore(dto.dependencies());
    }
}
