package ai.regen.marker;

import java.util.Arrays;
import java.util.Optional;

/** The closed set of marker kinds, as written in delimiter tokens. */
public enum MarkerKind {
    GUARD("guard"),
    GENERATED("generated"),
    CONDITIONAL("conditional"),
    IMPORT("import"),
    TEMPLATE("template");

    private final String token;

    MarkerKind(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<MarkerKind> fromToken(String token) {
        return Arrays.stream(values()).filter(k -> k.token.equals(token)).findFirst();
    }

    @Override
    public String toString() {
        return token;
    }
}
