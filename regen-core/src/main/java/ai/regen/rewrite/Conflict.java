package ai.regen.rewrite;

import ai.regen.deps.MarkerKey;
import ai.regen.marker.MarkerKind;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import org.jetbrains.annotations.Nullable;

/**
 * A generated marker whose body was edited by hand while a regeneration wanted to replace it. The file keeps the
 * edited body until the conflict is resolved.
 *
 * @param reason why the body counts as a hand edit
 * @param baseline last body the engine wrote, null if none was recorded
 * @param existing body currently on disk
 * @param proposed body the regeneration would have written
 */
public record Conflict(
        String file,
        String markerId,
        MarkerKind kind,
        Reason reason,
        @Nullable String baseline,
        String existing,
        String proposed) {

    public enum Reason {
        /** The body differs from the last body the engine wrote. */
        EDITED_SINCE_LAST_RUN,
        /** No baseline is recorded and the body holds text the engine did not produce. */
        UNTRACKED_CONTENT
    }

    private static final int CONTEXT_LINES = 3;

    public MarkerKey key() {
        return new MarkerKey(file, markerId);
    }

    /** Unified diff from the on-disk body to the proposed one, for display to whoever resolves the conflict. */
    public String unifiedDiff() {
        var existingLines = BodyFormatter.lines(existing);
        var proposedLines = BodyFormatter.lines(proposed);
        var patch = DiffUtils.diff(existingLines, proposedLines);
        var title = file + "#" + markerId;
        var diff = UnifiedDiffUtils.generateUnifiedDiff(
                title + " (existing)", title + " (proposed)", existingLines, patch, CONTEXT_LINES);
        return String.join("\n", diff);
    }
}
