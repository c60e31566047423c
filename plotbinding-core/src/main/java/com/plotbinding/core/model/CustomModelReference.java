package com.plotbinding.core.model;

import java.util.Objects;

/**
 * Reference to a user-defined model whose client-side behavior ships as source code.
 *
 * <p>Requires the compiler component only when the implementation still has to be
 * compiled in the browser.
 *
 * @param id model id
 * @param implementation client-side implementation
 */
public record CustomModelReference(String id, Implementation implementation) implements ModelReference {

    public CustomModelReference {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(implementation, "implementation must not be null");
    }

    @Override
    public boolean requiresWidgets() {
        return false;
    }

    @Override
    public boolean requiresCompiler() {
        return implementation.kind().requiresCompilation();
    }

    /**
     * Source of a custom model implementation.
     *
     * @param kind source language
     * @param code source text
     */
    public record Implementation(ImplementationKind kind, String code) {

        public Implementation {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(code, "code must not be null");
        }

        public static Implementation coffeeScript(String code) {
            return new Implementation(ImplementationKind.COFFEE_SCRIPT, code);
        }

        public static Implementation javaScript(String code) {
            return new Implementation(ImplementationKind.JAVASCRIPT, code);
        }
    }
}
