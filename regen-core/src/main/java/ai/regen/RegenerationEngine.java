package ai.regen;

import static java.util.Objects.requireNonNull;

import ai.regen.api.ModelSnapshot;
import ai.regen.deps.DependencyTracker;
import ai.regen.generate.ContentGenerator;
import ai.regen.generate.GeneratorRegistry;
import ai.regen.generate.MarkerContentGenerator;
import ai.regen.generate.PlaceholderTemplateRenderer;
import ai.regen.lang.LanguageProfiles;
import ai.regen.marker.FileBlueprint;
import ai.regen.marker.MarkerKind;
import ai.regen.marker.MarkerType.Guard;
import ai.regen.parse.MarkerParser;
import ai.regen.parse.ParseException;
import ai.regen.parse.ParsedDocument;
import ai.regen.rewrite.BaselineStore;
import ai.regen.rewrite.ChangeSet;
import ai.regen.rewrite.Conflict;
import ai.regen.rewrite.ConflictReporter;
import ai.regen.rewrite.ConflictResolver;
import ai.regen.rewrite.DocumentScaffolder;
import ai.regen.rewrite.RewriteResult;
import ai.regen.rewrite.Rewriter;
import ai.regen.util.AtomicFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.IntFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps a set of files in sync with a model.
 *
 * <p>A run parses every task's file in parallel, records the markers' dependencies in a single step, works out which
 * markers the change set affects, and rewrites the files holding affected markers in parallel. Baselines and conflicts
 * are committed as each rewrite completes. A file that cannot be read or parsed is reported as failed and left
 * untouched; the other files are still processed.
 *
 * <p>Runs are serialized. {@link #cancel()} may be called from any thread and stops the current run before its next
 * file task starts.
 */
public final class RegenerationEngine implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RegenerationEngine.class);

    private final Path root;
    private final ContentGenerator generator;
    private final Rewriter rewriter;
    private final DependencyTracker tracker = new DependencyTracker();
    private final BaselineStore baselines = new BaselineStore();
    private final ConflictReporter conflicts = new ConflictReporter();
    private final ConflictResolver resolver = new ConflictResolver(baselines, conflicts);
    private final ExecutorService executor;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public RegenerationEngine(Path root, RegenConfig config, ContentGenerator generator) {
        this.root = root;
        this.generator = generator;
        this.rewriter = new Rewriter(generator);
        this.executor = Executors.newFixedThreadPool(config.parallelism(), new WorkerThreadFactory());
    }

    public RegenerationEngine(Path root, RegenConfig config, GeneratorRegistry functions) {
        this(
                root,
                config,
                new MarkerContentGenerator(new PlaceholderTemplateRenderer(), functions, config.iterationSeparator()));
    }

    /** Daemon worker threads named {@code regen-worker-N}. */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final ThreadFactory delegate = Executors.defaultThreadFactory();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            var t = delegate.newThread(r);
            t.setDaemon(true);
            t.setName("regen-worker-" + counter.incrementAndGet());
            return t;
        }
    }

    /** A file that parsed, with the dependency keys of its markers. */
    private record ParsedFile(FileTask task, ParsedDocument document, Map<String, Set<String>> keysByMarker) {}

    /** Result of the parse phase for one task: a parsed file or a final outcome. */
    private record ParseStep(@Nullable ParsedFile parsed, @Nullable FileOutcome outcome) {}

    @Blocking
    public FileOutcome regenerate(FileTask task, ModelSnapshot model, ChangeSet changes) {
        return regenerateAll(List.of(task), model, changes).outcomes().get(0);
    }

    @Blocking
    public RegenerationReport regenerateAll(List<FileTask> tasks, ModelSnapshot model, ChangeSet changes) {
        return regenerateAll(tasks, model, changes, RegenerationListener.NONE);
    }

    @Blocking
    public synchronized RegenerationReport regenerateAll(
            List<FileTask> tasks, ModelSnapshot model, ChangeSet changes, RegenerationListener listener) {
        long start = System.nanoTime();
        cancelled.set(false);
        listener.onStart(tasks.size());
        logger.debug("Regenerating {} files for {}", tasks.size(), changes);

        // parse
        var parseTasks = new ArrayList<Callable<ParseStep>>(tasks.size());
        tasks.forEach(task -> parseTasks.add(() -> parse(task)));
        List<ParseStep> steps = runTasks(
                parseTasks,
                i -> new ParseStep(null, skipped(tasks.get(i))),
                (i, cause) -> new ParseStep(null, internalError(tasks.get(i).path(), cause)));

        // record
        for (var step : steps) {
            if (step.parsed() != null) {
                tracker.recordFile(step.parsed().task().path(), step.parsed().keysByMarker());
            }
        }

        // rewrite the files that need it
        var outcomes = new FileOutcome[tasks.size()];
        var rewriteIndexes = new ArrayList<Integer>();
        var rewriteFiles = new ArrayList<String>();
        var rewriteTasks = new ArrayList<Callable<FileOutcome>>();
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            if (step.outcome() != null) {
                outcomes[i] = step.outcome();
                continue;
            }
            var parsed = requireNonNull(step.parsed());
            var file = parsed.task().path();
            var affected = changes.isAll() ? Set.<String>of() : tracker.affectedIn(file, changes.keys());
            if (!changes.isAll() && affected.isEmpty() && !needsRewrite(parsed.document(), parsed.task().blueprint())) {
                outcomes[i] = new FileOutcome.Unchanged(file, null);
                continue;
            }
            rewriteIndexes.add(i);
            rewriteFiles.add(file);
            rewriteTasks.add(() -> rewrite(parsed, model, affected, changes.isAll()));
        }
        var rewritten = runTasks(
                rewriteTasks,
                j -> new FileOutcome.Skipped(rewriteFiles.get(j)),
                (j, cause) -> internalError(rewriteFiles.get(j), cause));
        for (int j = 0; j < rewritten.size(); j++) {
            outcomes[rewriteIndexes.get(j)] = rewritten.get(j);
        }

        var ordered = List.of(outcomes);
        for (int i = 0; i < ordered.size(); i++) {
            listener.onFileResult(ordered.get(i));
            listener.onProgress(i + 1, ordered.size());
        }
        var statistics = GenerationStatistics.of(ordered, Duration.ofNanos(System.nanoTime() - start));
        var report = new RegenerationReport(ordered, statistics);
        logger.info("Regeneration finished: {}", statistics);
        listener.onDone(report);
        return report;
    }

    /** Stops the current run before its next file task starts. Files already being processed finish normally. */
    public void cancel() {
        if (!cancelled.getAndSet(true)) {
            logger.info("Regeneration cancelled");
        }
    }

    /**
     * Creates a new file from its blueprint and fills it from the model.
     *
     * @throws FileAlreadyExistsException if the file exists
     * @throws IllegalArgumentException if no language handles the file's extension
     */
    @Blocking
    public FileOutcome scaffold(FileTask task, ModelSnapshot model) throws IOException {
        var path = resolve(task);
        if (Files.exists(path)) {
            throw new FileAlreadyExistsException(path.toString());
        }
        var profile = LanguageProfiles.forPath(path)
                .orElseThrow(() -> new IllegalArgumentException("No language profile for " + task.path()));
        var text = DocumentScaffolder.scaffold(task.blueprint(), profile, "\n");
        var parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        AtomicFiles.writeString(path, text);
        logger.debug("Scaffolded {} with {} markers", task.path(), task.blueprint().markers().size());
        return regenerate(task, model, ChangeSet.all());
    }

    /**
     * Applies a decision to an outstanding conflict and writes the file.
     *
     * @throws IllegalStateException if the conflict is stale
     */
    @Blocking
    public synchronized ConflictResolver.Resolution resolveConflict(
            Conflict conflict, ConflictResolver.Decision decision) throws IOException, ParseException {
        var path = root.resolve(conflict.file());
        var profile = LanguageProfiles.forPath(path)
                .orElseThrow(() -> new IllegalArgumentException("No language profile for " + conflict.file()));
        var document = MarkerParser.parse(conflict.file(), Files.readString(path, StandardCharsets.UTF_8), profile);
        var resolution = resolver.resolve(document, conflict, decision);
        if (resolution.changed()) {
            if (!Files.readString(path, StandardCharsets.UTF_8).equals(document.source())) {
                throw new IllegalStateException(
                        conflict.file() + " changed on disk while resolving " + conflict.markerId());
            }
            AtomicFiles.writeString(path, resolution.text());
        }
        return resolution;
    }

    /** Outstanding conflicts across all files. */
    public List<Conflict> conflicts() {
        return conflicts.report();
    }

    public ConflictReporter conflictReporter() {
        return conflicts;
    }

    public DependencyTracker dependencies() {
        return tracker;
    }

    public BaselineStore baselines() {
        return baselines;
    }

    /** Stops tracking a file, typically because it was deleted. */
    public synchronized void forget(String file) {
        tracker.forgetFile(file);
        baselines.forgetFile(file);
        conflicts.forgetFile(file);
    }

    @Blocking
    public synchronized void saveState(Path stateFile) throws IOException {
        RegenStateIO.save(baselines, tracker, stateFile);
    }

    /** Restores state saved by {@link #saveState}. Returns false, keeping the current state, if there was none. */
    @Blocking
    public synchronized boolean loadState(Path stateFile) throws IOException {
        var dto = RegenStateIO.load(stateFile);
        if (dto.isEmpty()) {
            return false;
        }
        RegenStateIO.apply(dto.get(), baselines, tracker);
        logger.info("Restored state for {} markers from {}", baselines.size(), stateFile);
        return true;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private Path resolve(FileTask task) {
        return root.resolve(task.path());
    }

    private ParseStep parse(FileTask task) {
        var file = task.path();
        var path = resolve(task);
        var profile = LanguageProfiles.forPath(path);
        if (profile.isEmpty()) {
            return failed(file, FileOutcome.FailureReason.UNSUPPORTED_EXTENSION, "no language profile", null);
        }
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return failed(file, FileOutcome.FailureReason.NOT_FOUND, "file does not exist", e);
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", file, e.getMessage());
            return failed(file, FileOutcome.FailureReason.IO_ERROR, e.getMessage(), e);
        }
        ParsedDocument document;
        try {
            document = MarkerParser.parse(file, text, profile.get());
        } catch (ParseException e) {
            logger.warn("Could not parse {}: {}", file, e.getMessage());
            return failed(file, FileOutcome.FailureReason.PARSE_ERROR, e.getMessage(), e);
        }
        var bound = document.withBaselines(id -> baselines.get(file, id));

        var keys = new LinkedHashMap<String, Set<String>>();
        for (var region : bound.regions()) {
            if (region.kind() == MarkerKind.GUARD) {
                continue;
            }
            task.blueprint()
                    .resolve(region.kind(), region.id())
                    .filter(d -> d.kind() == region.kind())
                    .ifPresent(d -> keys.put(region.id(), generator.dependencyKeys(d)));
        }
        return new ParseStep(new ParsedFile(task, bound, keys), null);
    }

    private FileOutcome rewrite(ParsedFile parsed, ModelSnapshot model, Set<String> affected, boolean all) {
        var file = parsed.task().path();
        var result = rewriter.rewrite(parsed.document(), parsed.task().blueprint(), model, affected, all);
        if (result.changed()) {
            var path = resolve(parsed.task());
            try {
                if (!Files.readString(path, StandardCharsets.UTF_8).equals(parsed.document().source())) {
                    logger.warn("{} changed on disk during regeneration; leaving it as it is", file);
                    return new FileOutcome.Failed(
                            file,
                            FileOutcome.FailureReason.MODIFIED_ON_DISK,
                            "file changed on disk during regeneration",
                            null);
                }
                AtomicFiles.writeString(path, result.text());
            } catch (IOException e) {
                logger.warn("Could not write {}: {}", file, e.getMessage());
                return new FileOutcome.Failed(file, FileOutcome.FailureReason.IO_ERROR, e.getMessage(), e);
            }
        }
        commit(parsed, result);
        return result.changed() ? new FileOutcome.Rewritten(file, result) : new FileOutcome.Unchanged(file, result);
    }

    private void commit(ParsedFile parsed, RewriteResult result) {
        var file = parsed.task().path();
        var present = new HashSet<String>();
        parsed.document().regions().forEach(r -> present.add(r.id()));
        baselines.forFile(file).keySet().stream()
                .filter(id -> !present.contains(id))
                .forEach(id -> baselines.remove(file, id));
        baselines.putAll(file, result.baselineUpdates());
        conflicts.update(file, result.evaluated(), result.conflicts());
    }

    /** True when a marker has no baseline yet, or a blank guard still waits for its default content. */
    private static boolean needsRewrite(ParsedDocument document, FileBlueprint blueprint) {
        for (var region : document.regions()) {
            if (region.kind() != MarkerKind.GUARD) {
                if (region.baselineContent() == null) {
                    return true;
                }
                continue;
            }
            if (!region.rawContent().isBlank()) {
                continue;
            }
            var definition = blueprint.resolve(MarkerKind.GUARD, region.id()).orElse(null);
            if (definition != null
                    && definition.type() instanceof Guard guard
                    && guard.defaultContent() != null
                    && !guard.defaultContent().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs {@code callables} on the worker pool and returns their results in submission order. A task not yet started
     * when the run is cancelled yields {@code onSkip}; a task that throws is logged and yields {@code onFailure}.
     */
    private <T> List<T> runTasks(
            List<Callable<T>> callables, IntFunction<T> onSkip, BiFunction<Integer, Throwable, T> onFailure) {
        var futures = new ArrayList<Future<T>>(callables.size());
        for (int i = 0; i < callables.size(); i++) {
            final int idx = i;
            var callable = callables.get(i);
            futures.add(executor.submit(() -> cancelled.get() ? onSkip.apply(idx) : callable.call()));
        }

        var results = new ArrayList<T>(callables.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                results.add(onSkip.apply(i));
            } catch (CancellationException e) {
                results.add(onSkip.apply(i));
            } catch (ExecutionException e) {
                var cause = e.getCause() == null ? e : e.getCause();
                logger.error("Error during file processing", cause);
                results.add(onFailure.apply(i, cause));
            }
        }
        return results;
    }

    private static ParseStep failed(
            String file, FileOutcome.FailureReason reason, @Nullable String message, @Nullable Throwable cause) {
        var text = message == null ? reason.name() : message;
        return new ParseStep(null, new FileOutcome.Failed(file, reason, text, cause));
    }

    private static FileOutcome internalError(String file, Throwable cause) {
        return new FileOutcome.Failed(
                file, FileOutcome.FailureReason.INTERNAL_ERROR, "internal error: " + cause.getMessage(), cause);
    }

    private static FileOutcome skipped(FileTask task) {
        return new FileOutcome.Skipped(task.path());
    }
}
