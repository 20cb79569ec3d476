package ai.regen;

import ai.regen.rewrite.Conflict;
import ai.regen.rewrite.GenerationError;
import java.util.ArrayList;
import java.util.List;

/** Per-file outcomes of one run, in task order, with their totals. */
public record RegenerationReport(List<FileOutcome> outcomes, GenerationStatistics statistics) {
    public RegenerationReport {
        outcomes = List.copyOf(outcomes);
    }

    /** Conflicts found during this run. */
    public List<Conflict> conflicts() {
        var out = new ArrayList<Conflict>();
        outcomes.forEach(o -> {
            if (o instanceof FileOutcome.Rewritten r) {
                out.addAll(r.result().conflicts());
            } else if (o instanceof FileOutcome.Unchanged u && u.result() != null) {
                out.addAll(u.result().conflicts());
            }
        });
        return out;
    }

    public List<GenerationError> errors() {
        var out = new ArrayList<GenerationError>();
        outcomes.forEach(o -> {
            if (o instanceof FileOutcome.Rewritten r) {
                out.addAll(r.result().errors());
            } else if (o instanceof FileOutcome.Unchanged u && u.result() != null) {
                out.addAll(u.result().errors());
            }
        });
        return out;
    }

    public List<FileOutcome.Failed> failures() {
        return outcomes.stream()
                .filter(FileOutcome.Failed.class::isInstance)
                .map(FileOutcome.Failed.class::cast)
                .toList();
    }
}
