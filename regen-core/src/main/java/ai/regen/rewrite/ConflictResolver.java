package ai.regen.rewrite;

import ai.regen.parse.ParsedDocument;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Applies a caller's decision to an outstanding conflict. */
public final class ConflictResolver {
    private static final Logger logger = LogManager.getLogger(ConflictResolver.class);

    /** How to settle a conflict. */
    public sealed interface Decision permits AcceptProposed, KeepExisting, ManualMerge {}

    /** Overwrite the hand edit with the proposed body. */
    public record AcceptProposed() implements Decision {}

    /** Keep the hand edit and adopt it as the new baseline. */
    public record KeepExisting() implements Decision {}

    /**
     * Write a body the caller merged by hand.
     *
     * @param body logical body, indented relative to the marker
     */
    public record ManualMerge(String body) implements Decision {}

    /**
     * @param text the document with the decision applied
     * @param baseline the body to record as the marker's new baseline
     */
    public record Resolution(String text, boolean changed, String baseline) {}

    private final BaselineStore baselines;
    private final ConflictReporter reporter;

    public ConflictResolver(BaselineStore baselines, ConflictReporter reporter) {
        this.baselines = baselines;
        this.reporter = reporter;
    }

    /**
     * Applies {@code decision} to {@code document}, records the new baseline and withdraws the conflict.
     *
     * @throws IllegalStateException if the conflict is no longer outstanding, the marker is gone or its body changed
     *     since the conflict was reported
     */
    public Resolution resolve(ParsedDocument document, Conflict conflict, Decision decision) {
        if (!reporter.get(conflict.file(), conflict.markerId()).map(conflict::equals).orElse(false)) {
            throw new IllegalStateException("Conflict on " + conflict.markerId() + " in " + conflict.file()
                    + " is not outstanding");
        }
        var region = document.region(conflict.markerId())
                .orElseThrow(() -> new IllegalStateException(
                        "Marker " + conflict.markerId() + " no longer exists in " + conflict.file()));
        if (!region.rawContent().equals(conflict.existing())) {
            throw new IllegalStateException("Marker " + conflict.markerId() + " in " + conflict.file()
                    + " changed since the conflict was reported");
        }

        String body;
        if (decision instanceof AcceptProposed) {
            body = conflict.proposed();
        } else if (decision instanceof ManualMerge merge) {
            body = BodyFormatter.format(merge.body(), region.indent(), document.lineSeparator());
        } else {
            body = conflict.existing();
        }
        var updated = document.withRegion(region.withContent(body));
        var text = updated.render();

        baselines.put(conflict.file(), conflict.markerId(), body);
        if (!reporter.remove(conflict)) {
            throw new IllegalStateException("Conflict on " + conflict.markerId() + " in " + conflict.file()
                    + " was withdrawn while it was being resolved");
        }
        logger.info(
                "Resolved conflict {}#{} with {}",
                conflict.file(),
                conflict.markerId(),
                decision.getClass().getSimpleName());
        return new Resolution(text, !text.equals(document.source()), body);
    }
}
