package ai.regen.marker;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Attributes of one marker. Each variant carries only its own attributes; dispatch over the variants is exhaustive.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MarkerType.Guard.class, name = "guard"),
    @JsonSubTypes.Type(value = MarkerType.Generated.class, name = "generated"),
    @JsonSubTypes.Type(value = MarkerType.Conditional.class, name = "conditional"),
    @JsonSubTypes.Type(value = MarkerType.Import.class, name = "import"),
    @JsonSubTypes.Type(value = MarkerType.Template.class, name = "template")
})
public sealed interface MarkerType
        permits MarkerType.Guard,
                MarkerType.Generated,
                MarkerType.Conditional,
                MarkerType.Import,
                MarkerType.Template {

    String id();

    MarkerKind markerKind();

    /**
     * True when the strategy throws away the current body. Only such markers can destroy a manual edit, so only they
     * report a divergence from the baseline as a conflict.
     */
    boolean discardsExistingContent();

    enum GenerationStrategy {
        REPLACE,
        MERGE,
        IF_EMPTY,
        APPEND,
        PREPEND
    }

    enum ConditionalStrategy {
        INCLUDE,
        EXCLUDE,
        SWITCH
    }

    enum ImportType {
        MODULE,
        DEPENDENCY,
        LOCAL,
        NAMESPACE
    }

    enum ImportMergeStrategy {
        KEEP_EXISTING,
        REPLACE,
        MERGE,
        /** Proposes the merged list but never overwrites a diverged body without a caller decision. */
        INTERACTIVE
    }

    /** Developer-owned section; never regenerated. */
    record Guard(String id, boolean preserveIndent, @Nullable String defaultContent) implements MarkerType {
        public Guard {
            requireId(id);
        }

        public static Guard of(String id) {
            return new Guard(id, false, null);
        }

        @Override
        public MarkerKind markerKind() {
            return MarkerKind.GUARD;
        }

        @Override
        public boolean discardsExistingContent() {
            return false;
        }
    }

    record Generated(String id, GenerationStrategy strategy, List<String> dependencyKeys) implements MarkerType {
        public Generated {
            requireId(id);
            strategy = strategy == null ? GenerationStrategy.REPLACE : strategy;
            dependencyKeys = dependencyKeys == null ? List.of() : List.copyOf(dependencyKeys);
        }

        @Override
        public MarkerKind markerKind() {
            return MarkerKind.GENERATED;
        }

        @Override
        public boolean discardsExistingContent() {
            return strategy == GenerationStrategy.REPLACE;
        }
    }

    /**
     * @param condition expression over model keys; for {@code SWITCH} it selects a key of {@code alternatives}
     * @param alternatives named template bodies, used by {@code SWITCH} only; {@code default} is the fallback
     */
    record Conditional(
            String id, String condition, ConditionalStrategy strategy, Map<String, String> alternatives)
            implements MarkerType {
        public Conditional {
            requireId(id);
            if (condition == null || condition.isBlank()) {
                throw new IllegalArgumentException("Conditional marker " + id + " needs a condition");
            }
            strategy = strategy == null ? ConditionalStrategy.INCLUDE : strategy;
            alternatives = alternatives == null ? Map.of() : Map.copyOf(alternatives);
        }

        public Conditional(String id, String condition, ConditionalStrategy strategy) {
            this(id, condition, strategy, Map.of());
        }

        @Override
        public MarkerKind markerKind() {
            return MarkerKind.CONDITIONAL;
        }

        @Override
        public boolean discardsExistingContent() {
            return true;
        }
    }

    /** The id is the delimiter id; by convention the lower-case import type name. */
    record Import(String id, ImportType importType, ImportMergeStrategy mergeStrategy) implements MarkerType {
        public Import {
            requireId(id);
            importType = importType == null ? ImportType.MODULE : importType;
            mergeStrategy = mergeStrategy == null ? ImportMergeStrategy.MERGE : mergeStrategy;
        }

        @Override
        public MarkerKind markerKind() {
            return MarkerKind.IMPORT;
        }

        @Override
        public boolean discardsExistingContent() {
            return mergeStrategy == ImportMergeStrategy.REPLACE || mergeStrategy == ImportMergeStrategy.INTERACTIVE;
        }
    }

    record Template(String id, Map<String, TemplateParameter> parameters, @Nullable IterationSettings iteration)
            implements MarkerType {
        public Template {
            requireId(id);
            // keep declaration order for deterministic error reporting
            parameters = parameters == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }

        @Override
        public MarkerKind markerKind() {
            return MarkerKind.TEMPLATE;
        }

        @Override
        public boolean discardsExistingContent() {
            return true;
        }
    }

    enum ParameterType {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        ARRAY,
        OBJECT;

        public boolean accepts(JsonNode value) {
            return switch (this) {
                case STRING -> value.isTextual();
                case INTEGER -> value.isIntegralNumber();
                case FLOAT -> value.isNumber();
                case BOOLEAN -> value.isBoolean();
                case ARRAY -> value.isArray();
                case OBJECT -> value.isObject();
            };
        }
    }

    /**
     * @param defaultValue used when the model has no value for the parameter
     * @param sourceKey model key to read; defaults to {@code name}
     */
    record TemplateParameter(
            String name,
            ParameterType type,
            @Nullable JsonNode defaultValue,
            boolean required,
            @Nullable String description,
            @Nullable String sourceKey) {
        public TemplateParameter {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Template parameter needs a name");
            }
            type = type == null ? ParameterType.STRING : type;
        }

        public static TemplateParameter required(String name, ParameterType type) {
            return new TemplateParameter(name, type, null, true, null, null);
        }

        public String modelKey() {
            return sourceKey == null || sourceKey.isBlank() ? name : sourceKey;
        }
    }

    /**
     * @param dataSource model key of the array to iterate
     * @param itemVar variable bound to the current item
     * @param indexVar optional variable bound to the zero-based index
     * @param separator text placed between instances; null means the configured default
     */
    record IterationSettings(
            String dataSource, String itemVar, @Nullable String indexVar, @Nullable String separator) {
        public IterationSettings {
            if (dataSource == null || dataSource.isBlank()) {
                throw new IllegalArgumentException("Iteration needs a data source");
            }
            itemVar = itemVar == null || itemVar.isBlank() ? "item" : itemVar;
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Marker id must not be blank");
        }
    }
}
