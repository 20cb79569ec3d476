package ai.regen.marker;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/** Where the fresh body of a non-guard marker comes from. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContentSource.StaticText.class, name = "static"),
    @JsonSubTypes.Type(value = ContentSource.TemplateText.class, name = "template"),
    @JsonSubTypes.Type(value = ContentSource.FunctionCall.class, name = "function")
})
public sealed interface ContentSource
        permits ContentSource.StaticText, ContentSource.TemplateText, ContentSource.FunctionCall {

    /** Emitted as-is. */
    record StaticText(String text) implements ContentSource {
        public StaticText {
            text = text == null ? "" : text;
        }
    }

    /** Rendered by the template renderer against the model and any bound template variables. */
    record TemplateText(String text) implements ContentSource {
        public TemplateText {
            text = text == null ? "" : text;
        }
    }

    /**
     * Computed by a generator function registered under {@code name}.
     *
     * @param dependencyKeys model keys the function reads; the function body is opaque to dependency tracking
     */
    record FunctionCall(String name, List<String> dependencyKeys) implements ContentSource {
        public FunctionCall {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Function source needs a name");
            }
            dependencyKeys = dependencyKeys == null ? List.of() : List.copyOf(dependencyKeys);
        }
    }

    static ContentSource text(String text) {
        return new StaticText(text);
    }

    static ContentSource template(String text) {
        return new TemplateText(text);
    }

    static ContentSource function(String name, String... dependencyKeys) {
        return new FunctionCall(name, List.of(dependencyKeys));
    }
}
