package ai.regen.deps;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.TreeMultimap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Records which model keys each marker reads and answers which markers a set of changed keys affects.
 *
 * <p>Keys are dotted paths and match hierarchically in both directions: a change to {@code schema} affects a marker
 * that reads {@code schema.fields}, and a change to {@code schema.fields.name} affects a marker that reads
 * {@code schema}. Sibling keys sharing a textual prefix ({@code schema} and {@code schemas}) do not match.
 *
 * <p>Thread-safe: parse workers may record while other threads query.
 */
public final class DependencyTracker {
    private static final Logger logger = LogManager.getLogger(DependencyTracker.class);

    private final TreeMultimap<String, MarkerKey> byModelKey = TreeMultimap.create();
    private final SetMultimap<MarkerKey, String> byMarker = HashMultimap.create();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** Replaces the recorded keys of one marker. */
    public void record(MarkerKey marker, Collection<String> modelKeys) {
        lock.writeLock().lock();
        try {
            forgetLocked(marker);
            for (var key : modelKeys) {
                byModelKey.put(key, marker);
                byMarker.put(marker, key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces everything recorded for {@code file} in one step, so markers removed from the file stop being reported.
     *
     * @param keysByMarker model keys per marker id present in the file now
     */
    public void recordFile(String file, Map<String, ? extends Collection<String>> keysByMarker) {
        lock.writeLock().lock();
        try {
            forgetFileLocked(file);
            keysByMarker.forEach((markerId, keys) -> {
                var marker = new MarkerKey(file, markerId);
                for (var key : keys) {
                    byModelKey.put(key, marker);
                    byMarker.put(marker, key);
                }
            });
            logger.trace("Recorded dependencies for {} markers in {}", keysByMarker.size(), file);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void forgetFile(String file) {
        lock.writeLock().lock();
        try {
            forgetFileLocked(file);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Every marker that reads one of {@code changedKeys}, under the hierarchical matching rule. */
    public SortedSet<MarkerKey> affected(Collection<String> changedKeys) {
        lock.readLock().lock();
        try {
            var out = new TreeSet<MarkerKey>();
            for (var changed : changedKeys) {
                // the changed key itself and everything below it
                out.addAll(byModelKey.get(changed));
                var below = byModelKey.asMap().subMap(changed + ".", true, changed + "/", false);
                below.values().forEach(out::addAll);
                // everything above it
                int dot = changed.lastIndexOf('.');
                while (dot > 0) {
                    out.addAll(byModelKey.get(changed.substring(0, dot)));
                    dot = changed.lastIndexOf('.', dot - 1);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** {@link #affected} restricted to {@code file}, returning marker ids. */
    public SortedSet<String> affectedIn(String file, Collection<String> changedKeys) {
        var ids = new TreeSet<String>();
        for (var marker : affected(changedKeys)) {
            if (marker.file().equals(file)) {
                ids.add(marker.markerId());
            }
        }
        return ids;
    }

    public Set<String> dependenciesOf(MarkerKey marker) {
        lock.readLock().lock();
        try {
            return ImmutableSortedSet.copyOf(byMarker.get(marker));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Markers recorded as reading exactly {@code modelKey}. */
    public Set<MarkerKey> markersFor(String modelKey) {
        lock.readLock().lock();
        try {
            return ImmutableSortedSet.copyOf(byModelKey.get(modelKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DependencyEntry> entries() {
        lock.readLock().lock();
        try {
            var out = new ArrayList<DependencyEntry>(byModelKey.size());
            byModelKey.forEach((key, marker) -> out.add(new DependencyEntry(key, marker.file(), marker.markerId())));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Replaces all state with {@code entries}, as loaded from a previous run. */
    public void restore(Collection<DependencyEntry> entries) {
        lock.writeLock().lock();
        try {
            byModelKey.clear();
            byMarker.clear();
            for (var entry : entries) {
                byModelKey.put(entry.modelKey(), entry.marker());
                byMarker.put(entry.marker(), entry.modelKey());
            }
            logger.debug("Restored {} dependency entries", entries.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byModelKey.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void forgetLocked(MarkerKey marker) {
        for (var key : byMarker.removeAll(marker)) {
            byModelKey.remove(key, marker);
        }
    }

    private void forgetFileLocked(String file) {
        var markers = byMarker.keySet().stream()
                .filter(m -> m.file().equals(file))
                .toList();
        markers.forEach(this::forgetLocked);
    }
}
