package ai.regen.rewrite;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of rewriting one document. Nothing is written or committed by the rewriter itself; the caller writes
 * {@link #text()} when {@link #changed()} and commits {@link #baselineUpdates()}.
 *
 * @param evaluated non-guard markers whose content was computed this cycle
 * @param regenerated markers whose body was replaced
 * @param baselineUpdates new baseline per marker id
 * @param generatorInvocations number of times the content generator was called
 */
public record RewriteResult(
        String file,
        String text,
        boolean changed,
        Set<String> evaluated,
        Set<String> regenerated,
        Set<String> seededGuards,
        List<Conflict> conflicts,
        List<GenerationError> errors,
        Map<String, String> baselineUpdates,
        int generatorInvocations) {

    public RewriteResult {
        evaluated = Set.copyOf(evaluated);
        regenerated = Set.copyOf(regenerated);
        seededGuards = Set.copyOf(seededGuards);
        conflicts = List.copyOf(conflicts);
        errors = List.copyOf(errors);
        baselineUpdates = Map.copyOf(baselineUpdates);
    }
}
