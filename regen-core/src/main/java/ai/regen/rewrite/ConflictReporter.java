package ai.regen.rewrite;

import ai.regen.deps.MarkerKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Outstanding conflicts, at most one per marker. A conflict stays reported until the marker is regenerated cleanly or
 * the conflict is resolved.
 */
public final class ConflictReporter {
    private static final Logger logger = LogManager.getLogger(ConflictReporter.class);

    private final Map<MarkerKey, Conflict> conflicts = new ConcurrentSkipListMap<>();

    public void add(Conflict conflict) {
        var previous = conflicts.put(conflict.key(), conflict);
        if (previous == null) {
            logger.warn(
                    "Conflict in {}: marker {} was edited by hand and not regenerated",
                    conflict.file(),
                    conflict.markerId());
        }
    }

    /**
     * Records the outcome of one file's rewrite: markers that were evaluated lose any earlier conflict, then the new
     * conflicts are added.
     */
    public void update(String file, Collection<String> evaluatedIds, Collection<Conflict> found) {
        evaluatedIds.forEach(id -> conflicts.remove(new MarkerKey(file, id)));
        found.forEach(this::add);
    }

    public Optional<Conflict> get(String file, String markerId) {
        return Optional.ofNullable(conflicts.get(new MarkerKey(file, markerId)));
    }

    public List<Conflict> reportFor(String file) {
        return conflicts.values().stream().filter(c -> c.file().equals(file)).toList();
    }

    /** Every outstanding conflict, ordered by file and marker id. */
    public List<Conflict> report() {
        return new ArrayList<>(conflicts.values());
    }

    /** Returns every outstanding conflict and forgets them. */
    public List<Conflict> drain() {
        var out = new ArrayList<Conflict>();
        for (var key : new ArrayList<>(conflicts.keySet())) {
            var conflict = conflicts.remove(key);
            if (conflict != null) {
                out.add(conflict);
            }
        }
        return out;
    }

    boolean remove(Conflict conflict) {
        return conflicts.remove(conflict.key(), conflict);
    }

    public void forgetFile(String file) {
        conflicts.keySet().removeIf(k -> k.file().equals(file));
    }

    public void clear() {
        conflicts.clear();
    }

    public int size() {
        return conflicts.size();
    }
}
