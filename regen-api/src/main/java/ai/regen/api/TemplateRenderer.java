package ai.regen.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import java.util.Set;

/** Literal-text substitution collaborator used by the content generator for template bodies. */
public interface TemplateRenderer {

    /** Resolves variable names referenced by a template. */
    @FunctionalInterface
    interface VariableLookup {
        Optional<JsonNode> lookup(String name);
    }

    /**
     * Substitutes every variable reference in {@code template}.
     *
     * @throws GenerationException with {@link GenerationException.Reason#MISSING_VARIABLE} when a reference cannot be
     *     resolved
     */
    String render(String template, VariableLookup variables) throws GenerationException;

    /** Names of the variables {@code template} refers to, in first-appearance order. */
    Set<String> referencedVariables(String template);
}
