package ai.regen.rewrite;

import ai.regen.deps.MarkerKey;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;

/**
 * Last body written for each generated marker, exactly as it appears on disk. A body that differs from its baseline
 * has been edited by hand since the previous cycle.
 */
public final class BaselineStore {
    private final Map<MarkerKey, String> baselines = new ConcurrentHashMap<>();

    public @Nullable String get(String file, String markerId) {
        return baselines.get(new MarkerKey(file, markerId));
    }

    public void put(String file, String markerId, String body) {
        baselines.put(new MarkerKey(file, markerId), body);
    }

    public void putAll(String file, Map<String, String> bodiesById) {
        bodiesById.forEach((id, body) -> put(file, id, body));
    }

    public void remove(String file, String markerId) {
        baselines.remove(new MarkerKey(file, markerId));
    }

    /** Baselines of one file keyed by marker id. */
    public Map<String, String> forFile(String file) {
        var out = new TreeMap<String, String>();
        baselines.forEach((key, body) -> {
            if (key.file().equals(file)) {
                out.put(key.markerId(), body);
            }
        });
        return out;
    }

    public void forgetFile(String file) {
        baselines.keySet().removeIf(k -> k.file().equals(file));
    }

    public Map<MarkerKey, String> snapshot() {
        return new TreeMap<>(baselines);
    }

    public void restore(Map<MarkerKey, String> loaded) {
        baselines.clear();
        baselines.putAll(loaded);
    }

    public int size() {
        return baselines.size();
    }
}
