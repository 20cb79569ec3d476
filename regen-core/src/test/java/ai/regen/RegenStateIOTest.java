package ai.regen;

import static org.junit.jupiter.api.Assertions.*;

import ai.regen.deps.DependencyTracker;
import ai.regen.deps.MarkerKey;
import ai.regen.rewrite.BaselineStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegenStateIOTest {

    @TempDir
    Path dir;

    @Test
    void testSaveAndLoad() throws IOException {
        var baselines = new BaselineStore();
        baselines.put("src/a.rs", "props", "    a, b\n");
        baselines.put("src/b.rs", "body", "x\r\n");
        var tracker = new DependencyTracker();
        tracker.recordFile("src/a.rs", Map.of("props", List.of("schema.fields")));
        tracker.recordFile("src/b.rs", Map.of("body", List.of("schema", "theme")));

        var file = dir.resolve("nested/state.json");
        RegenStateIO.save(baselines, tracker, file);
        assertTrue(Files.exists(file));

        var restoredBaselines = new BaselineStore();
        restoredBaselines.put("stale.rs", "gone", "old");
        var restoredTracker = new DependencyTracker();
        RegenStateIO.apply(RegenStateIO.load(file).orElseThrow(), restoredBaselines, restoredTracker);

        assertEquals(baselines.snapshot(), restoredBaselines.snapshot());
        assertNull(restoredBaselines.get("stale.rs", "gone"));
        assertEquals(tracker.entries(), restoredTracker.entries());
        assertEquals(
                Set.of(new MarkerKey("src/a.rs", "props"), new MarkerKey("src/b.rs", "body")),
                Set.copyOf(restoredTracker.affected(List.of("schema.fields"))));
    }

    @Test
    void testMissingFile() throws IOException {
        assertTrue(RegenStateIO.load(dir.resolve("absent.json")).isEmpty());
    }

    @Test
    void testIncompatibleFilesAreIgnored() throws IOException {
        var wrongVersion = dir.resolve("v2.json");
        Files.writeString(wrongVersion, "{\"version\": 2, \"baselines\": [], \"dependencies\": []}");
        assertTrue(RegenStateIO.load(wrongVersion).isEmpty());

        var wrongShape = dir.resolve("shape.json");
        Files.writeString(wrongShape, "[1, 2, 3]");
        assertTrue(RegenStateIO.load(wrongShape).isEmpty());
    }
}
