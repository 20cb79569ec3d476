package ai.regen.rewrite;

import ai.regen.api.ModelSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * The model keys that changed since the last cycle. {@link #all()} stands for "everything", used for a first run or a
 * forced full regeneration.
 */
public final class ChangeSet {
    private static final ChangeSet ALL = new ChangeSet(true, Set.of());
    private static final ChangeSet NONE = new ChangeSet(false, Set.of());

    private final boolean all;
    private final Set<String> keys;

    private ChangeSet(boolean all, Set<String> keys) {
        this.all = all;
        this.keys = keys;
    }

    public static ChangeSet all() {
        return ALL;
    }

    public static ChangeSet none() {
        return NONE;
    }

    public static ChangeSet of(Collection<String> keys) {
        return keys.isEmpty() ? NONE : new ChangeSet(false, Collections.unmodifiableSortedSet(new TreeSet<>(keys)));
    }

    public static ChangeSet of(String... keys) {
        return of(Arrays.asList(keys));
    }

    /**
     * Keys whose values differ between two models. Objects are compared field by field; any other value, arrays
     * included, is compared as a whole and reported under its own key.
     */
    public static ChangeSet between(ModelSnapshot before, ModelSnapshot after) {
        var changed = new TreeSet<String>();
        diff("", before.tree(), after.tree(), changed);
        return of(changed);
    }

    public boolean isAll() {
        return all;
    }

    public boolean isEmpty() {
        return !all && keys.isEmpty();
    }

    /** The changed keys; empty for {@link #all()}. */
    public Set<String> keys() {
        return keys;
    }

    private static void diff(String prefix, JsonNode before, JsonNode after, Set<String> changed) {
        if (before.isObject() && after.isObject()) {
            var names = new TreeSet<String>();
            before.fieldNames().forEachRemaining(names::add);
            after.fieldNames().forEachRemaining(names::add);
            for (var name : names) {
                var key = prefix.isEmpty() ? name : prefix + "." + name;
                var b = before.get(name);
                var a = after.get(name);
                if (b == null || a == null) {
                    changed.add(key);
                } else {
                    diff(key, b, a, changed);
                }
            }
            return;
        }
        if (!before.equals(after) && !prefix.isEmpty()) {
            changed.add(prefix);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChangeSet other && all == other.all && keys.equals(other.keys);
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(all) * 31 + keys.hashCode();
    }

    @Override
    public String toString() {
        if (all) {
            return "ChangeSet[all]";
        }
        return "ChangeSet[" + String.join(", ", keys) + "]";
    }
}
