package ai.regen.rewrite;

import ai.regen.api.GenerationException;

/** A marker whose content could not be produced; its previous body was kept. */
public record GenerationError(String file, String markerId, GenerationException.Reason reason, String message) {

    static GenerationError of(String file, String markerId, GenerationException e) {
        return new GenerationError(file, markerId, e.reason(), e.getMessage());
    }

    @Override
    public String toString() {
        return file + "#" + markerId + ": " + reason + " " + message;
    }
}
