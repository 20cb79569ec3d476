package ai.regen.generate;

import ai.regen.api.GenerationException;
import ai.regen.api.ModelSnapshot;
import ai.regen.marker.MarkerDefinition;
import java.util.Set;

/**
 * Produces fresh marker bodies from the model.
 *
 * <p>Bodies are exchanged in logical form: lines joined by {@code \n}, relative indentation only, no trailing line
 * separator. Placing them in a file is the rewriter's job.
 */
public interface ContentGenerator {

    /**
     * Computes the proposed body for a non-guard marker.
     *
     * @param existingBody the marker's current logical body, read by folding strategies such as merge and append
     */
    String generate(MarkerDefinition definition, String existingBody, ModelSnapshot model) throws GenerationException;

    /** Model keys whose change can alter what {@link #generate} returns for {@code definition}. */
    Set<String> dependencyKeys(MarkerDefinition definition);
}
