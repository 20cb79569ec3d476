package ai.regen.api;

/**
 * User-supplied content generator backing a function content source. Implementations must be pure and must not
 * block; a thrown exception fails only the marker being generated.
 */
@FunctionalInterface
public interface GeneratorFunction {

    String generate(GenerationRequest request) throws GenerationException;

    /**
     * @param markerId id of the marker being generated
     * @param existingBody current body of the marker with the marker indentation removed
     * @param model the model snapshot for this generation pass
     */
    record GenerationRequest(String markerId, String existingBody, ModelSnapshot model) {}
}
