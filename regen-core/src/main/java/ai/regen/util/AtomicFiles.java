package ai.regen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Whole-file replacement that never leaves a half-written target behind. */
public final class AtomicFiles {
    private static final Logger logger = LogManager.getLogger(AtomicFiles.class);

    private AtomicFiles() {
        // utility class
    }

    /**
     * Writes {@code text} as UTF-8 to a temp file next to {@code target}, then moves it into place. The move is atomic
     * where the file system supports it.
     */
    public static void writeString(Path target, String text) throws IOException {
        var dir = target.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }

        Path temp = Files.createTempFile(dir != null ? dir : Path.of("."), target.getFileName() + ".", ".tmp");
        try {
            Files.writeString(temp, text, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                logger.debug("Atomic move not supported for {}, falling back to plain move", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
