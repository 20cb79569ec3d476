package ai.regen.generate;

import ai.regen.api.GenerationException;
import ai.regen.api.GenerationException.Reason;
import ai.regen.api.GeneratorFunction;
import ai.regen.api.ModelSnapshot;
import ai.regen.api.TemplateRenderer;
import ai.regen.marker.ContentSource;
import ai.regen.marker.ContentSource.FunctionCall;
import ai.regen.marker.ContentSource.StaticText;
import ai.regen.marker.ContentSource.TemplateText;
import ai.regen.marker.MarkerDefinition;
import ai.regen.marker.MarkerType;
import ai.regen.marker.MarkerType.Conditional;
import ai.regen.marker.MarkerType.Generated;
import ai.regen.marker.MarkerType.Import;
import ai.regen.marker.MarkerType.Template;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Default {@link ContentGenerator}: dispatches on the marker variant and its strategy. */
public final class MarkerContentGenerator implements ContentGenerator {
    private static final Logger logger = LogManager.getLogger(MarkerContentGenerator.class);

    private final TemplateRenderer renderer;
    private final GeneratorRegistry functions;
    private final String defaultSeparator;

    public MarkerContentGenerator(TemplateRenderer renderer, GeneratorRegistry functions, String defaultSeparator) {
        this.renderer = renderer;
        this.functions = functions;
        this.defaultSeparator = defaultSeparator;
    }

    public MarkerContentGenerator(GeneratorRegistry functions) {
        this(new PlaceholderTemplateRenderer(), functions, "\n");
    }

    @Override
    public String generate(MarkerDefinition definition, String existingBody, ModelSnapshot model)
            throws GenerationException {
        var type = definition.type();
        var source = definition.source();
        var scope = Bindings.of(model);
        logger.trace("Generating {} {}", type.markerKind(), type.id());
        if (type instanceof Generated g) {
            return fold(g, existingBody, render(g, requireSource(g, source), existingBody, scope));
        }
        if (type instanceof Conditional c) {
            return conditional(c, source, existingBody, scope);
        }
        if (type instanceof Import i) {
            return imports(i, requireSource(i, source), existingBody, scope);
        }
        if (type instanceof Template t) {
            return template(t, requireSource(t, source), existingBody, model);
        }
        throw new IllegalArgumentException("Guard " + type.id() + " is never generated");
    }

    @Override
    public Set<String> dependencyKeys(MarkerDefinition definition) {
        var keys = new LinkedHashSet<String>();
        var source = definition.source();
        var type = definition.type();
        if (type instanceof Generated g) {
            keys.addAll(g.dependencyKeys());
            keys.addAll(sourceKeys(source, Set.of()));
        } else if (type instanceof Conditional c) {
            keys.addAll(ConditionEvaluator.referencedKeys(c.condition()));
            keys.addAll(sourceKeys(source, Set.of()));
            c.alternatives().values().forEach(alt -> keys.addAll(renderer.referencedVariables(alt)));
        } else if (type instanceof Import) {
            keys.addAll(sourceKeys(source, Set.of()));
        } else if (type instanceof Template t) {
            var locals = new LinkedHashSet<>(t.parameters().keySet());
            t.parameters().values().forEach(p -> keys.add(p.modelKey()));
            var iteration = t.iteration();
            if (iteration != null) {
                keys.add(iteration.dataSource());
                locals.add(iteration.itemVar());
                if (iteration.indexVar() != null) {
                    locals.add(iteration.indexVar());
                }
            }
            keys.addAll(sourceKeys(source, locals));
        }
        return keys;
    }

    private Set<String> sourceKeys(@Nullable ContentSource source, Set<String> locals) {
        if (source == null) {
            return Set.of();
        }
        if (source instanceof FunctionCall f) {
            return new LinkedHashSet<>(f.dependencyKeys());
        }
        var keys = new LinkedHashSet<String>();
        if (source instanceof TemplateText t) {
            for (var name : renderer.referencedVariables(t.text())) {
                int dot = name.indexOf('.');
                if (!locals.contains(dot < 0 ? name : name.substring(0, dot))) {
                    keys.add(name);
                }
            }
        }
        return keys;
    }

    private String render(MarkerType type, ContentSource source, String existingBody, Bindings scope)
            throws GenerationException {
        if (source instanceof TemplateText t) {
            return renderer.render(t.text(), scope);
        }
        if (source instanceof FunctionCall f) {
            return call(type, f, existingBody, scope);
        }
        return ((StaticText) source).text();
    }

    private String call(MarkerType type, FunctionCall call, String existingBody, Bindings scope)
            throws GenerationException {
        GeneratorFunction function = functions.lookup(call.name())
                .orElseThrow(() -> new GenerationException(
                        Reason.UNKNOWN_FUNCTION, "no generator function named '" + call.name() + "'"));
        String result;
        try {
            result = function.generate(new GeneratorFunction.GenerationRequest(type.id(), existingBody, scope.model()));
        } catch (RuntimeException e) {
            logger.warn("Generator function {} failed for marker {}", call.name(), type.id(), e);
            throw new GenerationException(
                    Reason.FUNCTION_FAILED, "generator function '" + call.name() + "' failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new GenerationException(
                    Reason.FUNCTION_FAILED, "generator function '" + call.name() + "' returned no content");
        }
        return result;
    }

    private static ContentSource requireSource(MarkerType type, @Nullable ContentSource source)
            throws GenerationException {
        if (source == null) {
            throw new GenerationException(Reason.NO_DEFINITION, "marker " + type.id() + " has no content source");
        }
        return source;
    }

    static String fold(Generated marker, String existing, String fresh) {
        return switch (marker.strategy()) {
            case REPLACE -> fresh;
            case IF_EMPTY -> existing.isBlank() ? fresh : existing;
            case MERGE -> {
                var merged = new LinkedHashSet<String>();
                for (var line : ImportListMerger.lines(existing)) {
                    if (!line.isBlank()) {
                        merged.add(line);
                    }
                }
                for (var line : ImportListMerger.lines(fresh)) {
                    if (!line.isBlank()) {
                        merged.add(line);
                    }
                }
                yield String.join("\n", merged);
            }
            case APPEND -> {
                if (existing.isBlank()) {
                    yield fresh;
                }
                yield existing.stripTrailing().endsWith(fresh.strip()) ? existing : existing + "\n" + fresh;
            }
            case PREPEND -> {
                if (existing.isBlank()) {
                    yield fresh;
                }
                yield existing.stripLeading().startsWith(fresh.strip()) ? existing : fresh + "\n" + existing;
            }
        };
    }

    private String conditional(
            Conditional marker, @Nullable ContentSource source, String existingBody, Bindings scope)
            throws GenerationException {
        switch (marker.strategy()) {
            case INCLUDE -> {
                return ConditionEvaluator.test(marker.condition(), scope)
                        ? render(marker, requireSource(marker, source), existingBody, scope)
                        : "";
            }
            case EXCLUDE -> {
                return ConditionEvaluator.test(marker.condition(), scope)
                        ? ""
                        : render(marker, requireSource(marker, source), existingBody, scope);
            }
            case SWITCH -> {
                var selected = ConditionEvaluator.select(marker.condition(), scope);
                var alternative = marker.alternatives().get(selected);
                if (alternative == null) {
                    alternative = marker.alternatives().get("default");
                }
                if (alternative != null) {
                    return renderer.render(alternative, scope);
                }
                if (source != null) {
                    return render(marker, source, existingBody, scope);
                }
                throw new GenerationException(
                        Reason.NO_MATCHING_ALTERNATIVE,
                        "no alternative for '" + selected + "' in switch marker " + marker.id());
            }
        }
        throw new AssertionError(marker.strategy());
    }

    private String imports(Import marker, ContentSource source, String existingBody, Bindings scope)
            throws GenerationException {
        var required = importEntries(marker, source, existingBody, scope);
        var merged = ImportListMerger.merge(marker.mergeStrategy(), ImportListMerger.lines(existingBody), required);
        return String.join("\n", merged);
    }

    /**
     * A template consisting of a single placeholder that names an array yields one entry per element; anything else
     * yields one entry per rendered line.
     */
    private List<String> importEntries(Import marker, ContentSource source, String existingBody, Bindings scope)
            throws GenerationException {
        if (source instanceof TemplateText t) {
            var m = PlaceholderTemplateRenderer.PLACEHOLDER.matcher(t.text().strip());
            if (m.matches()) {
                var value = scope.lookup(m.group(1));
                if (value.isPresent() && value.get().isArray()) {
                    var out = new ArrayList<String>();
                    value.get().forEach(v -> out.add(ValueText.of(v)));
                    return out;
                }
            }
        }
        return ImportListMerger.lines(render(marker, source, existingBody, scope));
    }

    private String template(Template marker, ContentSource source, String existingBody, ModelSnapshot model)
            throws GenerationException {
        var params = new HashMap<String, JsonNode>();
        for (var parameter : marker.parameters().values()) {
            Optional<JsonNode> value = model.lookup(parameter.modelKey()).filter(v -> !v.isNull());
            if (value.isEmpty() && parameter.defaultValue() != null) {
                value = Optional.of(parameter.defaultValue());
            }
            if (value.isEmpty()) {
                if (parameter.required()) {
                    throw new GenerationException(
                            Reason.MISSING_PARAMETER,
                            "template " + marker.id() + " requires parameter '" + parameter.name() + "'");
                }
                params.put(parameter.name(), TextNode.valueOf(""));
                continue;
            }
            if (!parameter.type().accepts(value.get())) {
                throw new GenerationException(
                        Reason.INVALID_PARAMETER,
                        "template " + marker.id() + " parameter '" + parameter.name() + "' expects "
                                + parameter.type().name().toLowerCase(Locale.ROOT) + " but got "
                                + value.get().getNodeType().name().toLowerCase(Locale.ROOT));
            }
            params.put(parameter.name(), value.get());
        }
        var scope = new Bindings(params, model);
        var iteration = marker.iteration();
        if (iteration == null) {
            return render(marker, source, existingBody, scope);
        }

        var data = model.lookup(iteration.dataSource())
                .orElseThrow(() -> new GenerationException(
                        Reason.MISSING_DATA_SOURCE,
                        "template " + marker.id() + " iterates over missing key '" + iteration.dataSource() + "'"));
        if (!data.isArray()) {
            throw new GenerationException(
                    Reason.INVALID_DATA_SOURCE,
                    "template " + marker.id() + " data source '" + iteration.dataSource() + "' is not an array");
        }
        var separator = iteration.separator() != null ? iteration.separator() : defaultSeparator;
        var instances = new ArrayList<String>(data.size());
        for (int i = 0; i < data.size(); i++) {
            var itemScope = scope.with(iteration.itemVar(), data.get(i));
            if (iteration.indexVar() != null) {
                itemScope = itemScope.with(iteration.indexVar(), IntNode.valueOf(i));
            }
            instances.add(render(marker, source, existingBody, itemScope));
        }
        return String.join(separator, instances);
    }
}
