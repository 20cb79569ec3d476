package ai.regen;

import java.time.Duration;
import java.util.List;

/** Totals for one regeneration run. */
public record GenerationStatistics(
        int filesProcessed,
        int filesRewritten,
        int filesUnchanged,
        int filesFailed,
        int filesSkipped,
        int markersEvaluated,
        int markersRegenerated,
        int guardsSeeded,
        int conflicts,
        int errors,
        int generatorInvocations,
        Duration elapsed) {

    public static GenerationStatistics of(List<FileOutcome> outcomes, Duration elapsed) {
        int rewritten = 0, unchanged = 0, failed = 0, skipped = 0;
        int evaluated = 0, regenerated = 0, seeded = 0, conflicts = 0, errors = 0, invocations = 0;
        for (var outcome : outcomes) {
            var result = outcome instanceof FileOutcome.Rewritten r
                    ? r.result()
                    : outcome instanceof FileOutcome.Unchanged u ? u.result() : null;
            if (outcome instanceof FileOutcome.Rewritten) {
                rewritten++;
            } else if (outcome instanceof FileOutcome.Unchanged) {
                unchanged++;
            } else if (outcome instanceof FileOutcome.Failed) {
                failed++;
            } else {
                skipped++;
            }
            if (result != null) {
                evaluated += result.evaluated().size();
                regenerated += result.regenerated().size();
                seeded += result.seededGuards().size();
                conflicts += result.conflicts().size();
                errors += result.errors().size();
                invocations += result.generatorInvocations();
            }
        }
        return new GenerationStatistics(
                outcomes.size(),
                rewritten,
                unchanged,
                failed,
                skipped,
                evaluated,
                regenerated,
                seeded,
                conflicts,
                errors,
                invocations,
                elapsed);
    }

    @Override
    public String toString() {
        return ("%d files (%d rewritten, %d unchanged, %d failed, %d skipped), "
                        + "%d markers regenerated, %d conflicts, %d errors in %d ms")
                .formatted(
                        filesProcessed,
                        filesRewritten,
                        filesUnchanged,
                        filesFailed,
                        filesSkipped,
                        markersRegenerated,
                        conflicts,
                        errors,
                        elapsed.toMillis());
    }
}
