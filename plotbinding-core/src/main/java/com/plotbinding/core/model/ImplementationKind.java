package com.plotbinding.core.model;

/**
 * Source languages a custom model implementation can be written in.
 */
public enum ImplementationKind {
    /** CoffeeScript source, compiled in the browser by the compiler component */
    COFFEE_SCRIPT(true),

    /** Plain JavaScript, usable as is */
    JAVASCRIPT(false);

    private final boolean requiresCompilation;

    ImplementationKind(boolean requiresCompilation) {
        this.requiresCompilation = requiresCompilation;
    }

    public boolean requiresCompilation() {
        return requiresCompilation;
    }
}
