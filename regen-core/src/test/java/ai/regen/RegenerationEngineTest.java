package ai.regen;

import static org.junit.jupiter.api.Assertions.*;

import ai.regen.api.GenerationException;
import ai.regen.api.ModelSnapshot;
import ai.regen.deps.MarkerKey;
import ai.regen.generate.ContentGenerator;
import ai.regen.generate.GeneratorRegistry;
import ai.regen.generate.MarkerContentGenerator;
import ai.regen.marker.ContentSource;
import ai.regen.marker.FileBlueprint;
import ai.regen.marker.MarkerDefinition;
import ai.regen.marker.MarkerType.Generated;
import ai.regen.marker.MarkerType.GenerationStrategy;
import ai.regen.marker.MarkerType.Guard;
import ai.regen.parse.ParseException;
import ai.regen.rewrite.ChangeSet;
import ai.regen.rewrite.Conflict;
import ai.regen.rewrite.ConflictResolver;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegenerationEngineTest {

    private static final String SOURCE =
            """
            struct Props {
                // <generated:props:start>
                // <generated:props:end>
            }

            fn logic() {
                // <guard:logic:start>
                // placeholder
                // <guard:logic:end>
            }
            """;

    private static final FileBlueprint BLUEPRINT = new FileBlueprint(List.of(
            MarkerDefinition.of(
                    new Generated("props", GenerationStrategy.REPLACE, List.of()),
                    ContentSource.template("{{schema.fields}}")),
            MarkerDefinition.guard(Guard.of("logic"))));

    private static final FileTask PROPS = new FileTask("src/props.rs", BLUEPRINT);

    @TempDir
    Path root;

    private final List<RegenerationEngine> engines = new ArrayList<>();

    @AfterEach
    void tearDown() {
        engines.forEach(RegenerationEngine::close);
    }

    private RegenerationEngine engine() {
        return engine(new GeneratorRegistry());
    }

    private RegenerationEngine engine(GeneratorRegistry functions) {
        var engine = new RegenerationEngine(root, new RegenConfig(2, "\n"), functions);
        engines.add(engine);
        return engine;
    }

    private static ModelSnapshot fields(String... names) {
        return ModelSnapshot.of(Map.of("schema", Map.of("fields", List.of(names)), "theme", "dark"));
    }

    private void write(String file, String text) throws IOException {
        var path = root.resolve(file);
        Files.createDirectories(path.getParent());
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }

    private String read(String file) throws IOException {
        return Files.readString(root.resolve(file), StandardCharsets.UTF_8);
    }

    @Test
    void testGuardSurvivesIncrementalRegeneration() throws IOException {
        write(PROPS.path(), SOURCE);
        var engine = engine();

        var first = engine.regenerate(PROPS, fields("a", "b"), ChangeSet.all());
        assertInstanceOf(FileOutcome.Rewritten.class, first);
        assertTrue(read(PROPS.path()).contains("    // <generated:props:start>\n    a, b\n"));

        write(PROPS.path(), read(PROPS.path()).replace("    // placeholder\n", "    do_work();\n"));
        var second = engine.regenerate(PROPS, fields("a", "b", "c"), ChangeSet.of("schema.fields"));

        assertInstanceOf(FileOutcome.Rewritten.class, second);
        var text = read(PROPS.path());
        assertTrue(text.contains("    a, b, c\n"));
        assertTrue(text.contains("    // <guard:logic:start>\n    do_work();\n    // <guard:logic:end>\n"));
        assertTrue(engine.conflicts().isEmpty());
    }

    @Test
    void testUnrelatedChangeDoesNotTouchTheFile() throws IOException {
        write(PROPS.path(), SOURCE);
        var engine = engine();
        engine.regenerate(PROPS, fields("a"), ChangeSet.all());
        var before = read(PROPS.path());

        var outcome = engine.regenerate(PROPS, fields("a"), ChangeSet.of("theme"));

        assertEquals(new FileOutcome.Unchanged(PROPS.path(), null), outcome);
        assertEquals(before, read(PROPS.path()));
        assertEquals(
                Set.of("schema.fields"),
                engine.dependencies().dependenciesOf(new MarkerKey(PROPS.path(), "props")));
    }

    @Test
    void testFailuresAreIsolatedPerFile() throws IOException {
        write("src/a.rs", SOURCE);
        var broken = "fn main() {\n    // <generated:props:start>\n}\n";
        write("src/b.rs", broken);
        write("docs/readme.unknown", "text");
        var tasks = List.of(
                new FileTask("src/a.rs", BLUEPRINT),
                new FileTask("src/b.rs", BLUEPRINT),
                new FileTask("docs/readme.unknown", BLUEPRINT),
                new FileTask("src/missing.rs", BLUEPRINT));

        var report = engine().regenerateAll(tasks, fields("a"), ChangeSet.all());

        var outcomes = report.outcomes();
        assertEquals(4, outcomes.size());
        assertInstanceOf(FileOutcome.Rewritten.class, outcomes.get(0));
        assertEquals(FileOutcome.FailureReason.PARSE_ERROR, ((FileOutcome.Failed) outcomes.get(1)).reason());
        assertTrue(((FileOutcome.Failed) outcomes.get(1)).message().contains("never closed"));
        assertEquals(
                FileOutcome.FailureReason.UNSUPPORTED_EXTENSION, ((FileOutcome.Failed) outcomes.get(2)).reason());
        assertEquals(FileOutcome.FailureReason.NOT_FOUND, ((FileOutcome.Failed) outcomes.get(3)).reason());

        assertEquals(broken, read("src/b.rs"));
        assertEquals(3, report.failures().size());
        assertEquals(1, report.statistics().filesRewritten());
        assertEquals(3, report.statistics().filesFailed());
        assertEquals(1, report.statistics().markersRegenerated());
    }

    @Test
    void testManyFilesInParallel() throws IOException {
        var tasks = new ArrayList<FileTask>();
        for (int i = 0; i < 12; i++) {
            var task = new FileTask("src/file" + i + ".rs", BLUEPRINT);
            write(task.path(), SOURCE);
            tasks.add(task);
        }
        var engine = engine();

        var report = engine.regenerateAll(tasks, fields("x", "y"), ChangeSet.all());

        assertEquals(12, report.statistics().filesRewritten());
        for (int i = 0; i < tasks.size(); i++) {
            assertEquals(tasks.get(i).path(), report.outcomes().get(i).file());
            assertTrue(read(tasks.get(i).path()).contains("    x, y\n"));
        }
        assertEquals(12, engine.dependencies().affected(List.of("schema")).size());
    }

    @Test
    void testConflictIsReportedAndResolved() throws IOException, ParseException {
        write(PROPS.path(), SOURCE);
        var engine = engine();
        engine.regenerate(PROPS, fields("a", "b"), ChangeSet.all());
        var edited = read(PROPS.path()).replace("    a, b\n", "    a, b, custom\n");
        write(PROPS.path(), edited);

        var report = engine.regenerateAll(List.of(PROPS), fields("a", "b", "c"), ChangeSet.of("schema.fields"));

        assertEquals(edited, read(PROPS.path()));
        assertEquals(1, report.conflicts().size());
        Conflict conflict = engine.conflicts().get(0);
        assertEquals(report.conflicts().get(0), conflict);
        assertEquals(Conflict.Reason.EDITED_SINCE_LAST_RUN, conflict.reason());

        // still reported while unresolved
        engine.regenerate(PROPS, fields("a", "b", "c"), ChangeSet.of("schema.fields"));
        assertEquals(1, engine.conflicts().size());

        var resolution = engine.resolveConflict(conflict, new ConflictResolver.AcceptProposed());
        assertTrue(resolution.changed());
        assertTrue(read(PROPS.path()).contains("    a, b, c\n"));
        assertTrue(engine.conflicts().isEmpty());

        var after = engine.regenerate(PROPS, fields("a", "b", "c"), ChangeSet.of("schema.fields"));
        assertInstanceOf(FileOutcome.Unchanged.class, after);
        assertTrue(engine.conflicts().isEmpty());
    }

    @Test
    void testGenerationErrorLeavesOtherMarkersWorking() throws IOException {
        var blueprint = new FileBlueprint(List.of(
                MarkerDefinition.of(
                        new Generated("props", GenerationStrategy.REPLACE, List.of()),
                        ContentSource.template("{{schema.fields}}")),
                MarkerDefinition.of(
                        new Generated("footer", GenerationStrategy.REPLACE, List.of()),
                        ContentSource.function("broken", "site"))));
        var task = new FileTask("src/page.rs", blueprint);
        write(
                task.path(),
                """
                // <generated:props:start>
                // <generated:props:end>
                // <generated:footer:start>
                // <generated:footer:end>
                """);
        var functions = new GeneratorRegistry().register("broken", request -> {
            throw new GenerationException(GenerationException.Reason.FUNCTION_FAILED, "no footer today");
        });

        var report = engine(functions).regenerateAll(List.of(task), fields("a"), ChangeSet.all());

        assertEquals(1, report.errors().size());
        assertEquals("footer", report.errors().get(0).markerId());
        assertEquals(GenerationException.Reason.FUNCTION_FAILED, report.errors().get(0).reason());
        assertTrue(read(task.path()).contains("// <generated:props:start>\na\n"));
    }

    @Test
    void testScaffoldCreatesAndFillsFile() throws IOException {
        var blueprint = new FileBlueprint(
                List.of(
                        MarkerDefinition.of(
                                new Generated("body", GenerationStrategy.REPLACE, List.of()),
                                ContentSource.template("return '{{theme}}'")),
                        MarkerDefinition.guard(new Guard("custom", false, "pass"))),
                """
                def main():
                    {{marker:body}}

                def custom():
                    {{marker:custom}}
                """);
        var task = new FileTask("gen/main.py", blueprint);
        var engine = engine();

        var outcome = engine.scaffold(task, fields());

        assertInstanceOf(FileOutcome.Rewritten.class, outcome);
        assertEquals(
                """
                def main():
                    # <generated:body:start>
                    return 'dark'
                    # <generated:body:end>

                def custom():
                    # <guard:custom:start>
                    pass
                    # <guard:custom:end>
                """,
                read(task.path()));
        assertThrows(FileAlreadyExistsException.class, () -> engine.scaffold(task, fields()));
    }

    @Test
    void testStateSurvivesRestart() throws IOException {
        write(PROPS.path(), SOURCE);
        var stateFile = root.resolve(".regen/state.json");
        var first = engine();
        first.regenerate(PROPS, fields("a"), ChangeSet.all());
        first.saveState(stateFile);

        var restarted = engine();
        assertTrue(restarted.loadState(stateFile));
        assertEquals(first.baselines().snapshot(), restarted.baselines().snapshot());
        assertEquals(
                new FileOutcome.Unchanged(PROPS.path(), null),
                restarted.regenerate(PROPS, fields("a"), ChangeSet.of("theme")));

        // without state every marker is untracked and gets evaluated
        var fresh = engine();
        assertFalse(fresh.loadState(root.resolve("absent.json")));
        var outcome = (FileOutcome.Unchanged) fresh.regenerate(PROPS, fields("a"), ChangeSet.of("theme"));
        assertNotNull(outcome.result());
        assertEquals(Set.of("props"), outcome.result().evaluated());
        assertEquals("    a\n", fresh.baselines().get(PROPS.path(), "props"));
    }

    @Test
    void testCancelSkipsFilesNotYetStarted() throws IOException {
        var engineRef = new AtomicReference<RegenerationEngine>();
        var cancelOnce = new AtomicBoolean(true);
        var delegate = new MarkerContentGenerator(new GeneratorRegistry());
        ContentGenerator generator = new ContentGenerator() {
            @Override
            public String generate(MarkerDefinition definition, String existingBody, ModelSnapshot model)
                    throws GenerationException {
                if (cancelOnce.getAndSet(false)) {
                    engineRef.get().cancel();
                }
                return delegate.generate(definition, existingBody, model);
            }

            @Override
            public Set<String> dependencyKeys(MarkerDefinition definition) {
                return delegate.dependencyKeys(definition);
            }
        };
        var engine = new RegenerationEngine(root, new RegenConfig(1, "\n"), generator);
        engines.add(engine);
        engineRef.set(engine);
        var tasks = new ArrayList<FileTask>();
        for (int i = 0; i < 3; i++) {
            var task = new FileTask("src/f" + i + ".rs", BLUEPRINT);
            write(task.path(), SOURCE);
            tasks.add(task);
        }

        var report = engine.regenerateAll(tasks, fields("a"), ChangeSet.all());

        assertInstanceOf(FileOutcome.Rewritten.class, report.outcomes().get(0));
        assertEquals(new FileOutcome.Skipped("src/f1.rs"), report.outcomes().get(1));
        assertEquals(new FileOutcome.Skipped("src/f2.rs"), report.outcomes().get(2));
        assertEquals(SOURCE, read("src/f2.rs"));
        assertEquals(2, report.statistics().filesSkipped());

        // the next run starts uncancelled
        var rerun = engine.regenerateAll(tasks, fields("a"), ChangeSet.all());
        assertInstanceOf(FileOutcome.Unchanged.class, rerun.outcomes().get(0));
        assertInstanceOf(FileOutcome.Rewritten.class, rerun.outcomes().get(1));
        assertInstanceOf(FileOutcome.Rewritten.class, rerun.outcomes().get(2));
    }

    @Test
    void testListenerSeesEveryFile() throws IOException {
        write(PROPS.path(), SOURCE);
        var events = new ArrayList<String>();
        var listener = new RegenerationListener() {
            @Override
            public void onStart(int fileCount) {
                events.add("start " + fileCount);
            }

            @Override
            public void onFileResult(FileOutcome outcome) {
                events.add("file " + outcome.file());
            }

            @Override
            public void onProgress(int completed, int total) {
                events.add(completed + "/" + total);
            }

            @Override
            public void onDone(RegenerationReport report) {
                events.add("done " + report.outcomes().size());
            }
        };

        engine().regenerateAll(List.of(PROPS), fields("a"), ChangeSet.all(), listener);

        assertEquals(List.of("start 1", "file src/props.rs", "1/1", "done 1"), events);
    }

    @Test
    void testForgetDropsAllStateForFile() throws IOException {
        write(PROPS.path(), SOURCE);
        var engine = engine();
        engine.regenerate(PROPS, fields("a"), ChangeSet.all());
        assertNotNull(engine.baselines().get(PROPS.path(), "props"));

        engine.forget(PROPS.path());

        assertNull(engine.baselines().get(PROPS.path(), "props"));
        assertTrue(engine.dependencies().affected(List.of("schema.fields")).isEmpty());
    }

    @Test
    void testBlankGuardWithDefaultIsSeededOnUnrelatedChange() throws IOException {
        var blueprint = new FileBlueprint(List.of(
                MarkerDefinition.of(
                        new Generated("props", GenerationStrategy.REPLACE, List.of()),
                        ContentSource.template("{{schema.fields}}")),
                MarkerDefinition.guard(new Guard("logic", false, "todo!()"))));
        var task = new FileTask("src/logic.rs", blueprint);
        write(task.path(), SOURCE);
        var engine = engine();
        engine.regenerate(task, fields("a"), ChangeSet.all());
        write(task.path(), read(task.path()).replace("    // placeholder\n", ""));

        var outcome = engine.regenerate(task, fields("a"), ChangeSet.of("theme"));

        var rewritten = assertInstanceOf(FileOutcome.Rewritten.class, outcome);
        assertEquals(Set.of("logic"), rewritten.result().seededGuards());
        assertTrue(read(task.path()).contains("    // <guard:logic:start>\n    todo!()\n    // <guard:logic:end>\n"));
    }

    @Test
    void testFileEditedDuringRunIsNotOverwritten() throws IOException {
        var editOnce = new AtomicBoolean(true);
        var edited = SOURCE.replace("    // placeholder\n", "    typed_meanwhile();\n");
        var delegate = new MarkerContentGenerator(new GeneratorRegistry());
        ContentGenerator generator = new ContentGenerator() {
            @Override
            public String generate(MarkerDefinition definition, String existingBody, ModelSnapshot model)
                    throws GenerationException {
                if (editOnce.getAndSet(false)) {
                    try {
                        write(PROPS.path(), edited);
                    } catch (IOException e) {
                        throw new IllegalStateException(e);
                    }
                }
                return delegate.generate(definition, existingBody, model);
            }

            @Override
            public Set<String> dependencyKeys(MarkerDefinition definition) {
                return delegate.dependencyKeys(definition);
            }
        };
        var engine = new RegenerationEngine(root, new RegenConfig(1, "\n"), generator);
        engines.add(engine);
        write(PROPS.path(), SOURCE);

        var outcome = engine.regenerate(PROPS, fields("a"), ChangeSet.all());

        var failed = assertInstanceOf(FileOutcome.Failed.class, outcome);
        assertEquals(FileOutcome.FailureReason.MODIFIED_ON_DISK, failed.reason());
        assertEquals(edited, read(PROPS.path()));
        assertNull(engine.baselines().get(PROPS.path(), "props"));

        // the next run starts from the edited file
        assertInstanceOf(FileOutcome.Rewritten.class, engine.regenerate(PROPS, fields("a"), ChangeSet.all()));
        assertTrue(read(PROPS.path()).contains("    typed_meanwhile();\n"));
        assertTrue(read(PROPS.path()).contains("    a\n"));
    }
}
