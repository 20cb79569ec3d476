package ai.regen.generate;

import ai.regen.marker.MarkerType.ImportMergeStrategy;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;

/** Combines the import entries already in a file with the entries the model requires. */
public final class ImportListMerger {
    private ImportListMerger() {
        // utility class
    }

    public static List<String> merge(ImportMergeStrategy strategy, List<String> existing, List<String> required) {
        var current = entries(existing);
        var wanted = entries(required);
        return switch (strategy) {
            case KEEP_EXISTING -> {
                var out = new LinkedHashSet<>(current);
                out.addAll(wanted);
                yield List.copyOf(out);
            }
            case REPLACE -> List.copyOf(wanted);
            case MERGE, INTERACTIVE -> {
                var out = new TreeSet<>(current);
                out.addAll(wanted);
                yield List.copyOf(out);
            }
        };
    }

    /** Trimmed, non-blank lines of {@code lines}, de-duplicated in first-seen order. */
    static LinkedHashSet<String> entries(List<String> lines) {
        var out = new LinkedHashSet<String>();
        for (var line : lines) {
            var trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    static List<String> lines(String body) {
        if (body.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(List.of(body.split("\\r?\\n", -1)));
    }
}
