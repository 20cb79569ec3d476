package ai.regen.generate;

import ai.regen.api.GeneratorFunction;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Named generator functions available to {@code function} content sources. Safe for concurrent use. */
public final class GeneratorRegistry {
    private static final Logger logger = LogManager.getLogger(GeneratorRegistry.class);

    private final Map<String, GeneratorFunction> functions = new ConcurrentHashMap<>();

    public GeneratorRegistry register(String name, GeneratorFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Generator function name must not be blank");
        }
        var previous = functions.put(name, function);
        if (previous != null) {
            logger.debug("Replaced generator function {}", name);
        }
        return this;
    }

    public boolean unregister(String name) {
        return functions.remove(name) != null;
    }

    public Optional<GeneratorFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }
}
