package ai.regen;

import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Engine settings.
 *
 * <ul>
 *   <li>{@code REGEN_PARALLELISM}: number of worker threads for per-file work. Defaults to the number of available
 *       processors.
 *   <li>{@code REGEN_ITERATION_SEPARATOR}: text placed between instances of an iterated template when the template
 *       does not set its own. Defaults to a newline. The escapes {@code \n} and {@code \t} are understood.
 * </ul>
 *
 * @param parallelism worker thread count, at least 1
 * @param iterationSeparator default separator for iterated templates
 */
public record RegenConfig(int parallelism, String iterationSeparator) {
    private static final Logger logger = LogManager.getLogger(RegenConfig.class);

    static final String PARALLELISM_ENV = "REGEN_PARALLELISM";
    static final String SEPARATOR_ENV = "REGEN_ITERATION_SEPARATOR";

    public RegenConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        if (iterationSeparator == null) {
            throw new IllegalArgumentException("iterationSeparator must not be null");
        }
    }

    public static RegenConfig defaults() {
        return new RegenConfig(Runtime.getRuntime().availableProcessors(), "\n");
    }

    public static RegenConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads the settings from {@code env}; unset or blank variables keep their defaults. */
    public static RegenConfig fromEnvironment(Map<String, String> env) {
        var config = defaults();
        var parallelism = env.get(PARALLELISM_ENV);
        if (parallelism != null && !parallelism.isBlank()) {
            int value;
            try {
                value = Integer.parseInt(parallelism.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PARALLELISM_ENV + " is not a number: " + parallelism, e);
            }
            config = new RegenConfig(value, config.iterationSeparator());
            logger.info("{} override in effect; parallelism: {}", PARALLELISM_ENV, value);
        }
        var separator = env.get(SEPARATOR_ENV);
        if (separator != null) {
            var unescaped = separator.replace("\\n", "\n").replace("\\t", "\t");
            config = new RegenConfig(config.parallelism(), unescaped);
            logger.info("{} override in effect; iteration separator: {}", SEPARATOR_ENV, separator);
        }
        return config;
    }
}
