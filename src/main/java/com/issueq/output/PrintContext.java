package com.issueq.output;

import java.util.Map;
import java.util.Objects;

/**
 * Source text a tree was parsed from plus the values of its variables, keyed by bare name.
 */
public record PrintContext(String text, Map<String, String> variableValues) {

    public PrintContext {
        Objects.requireNonNull(text, "text");
        variableValues = variableValues == null ? Map.of() : Map.copyOf(variableValues);
    }

    public static PrintContext of(String text) {
        return new PrintContext(text, Map.of());
    }
}
