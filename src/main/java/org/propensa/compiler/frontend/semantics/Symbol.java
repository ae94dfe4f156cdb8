package org.propensa.compiler.frontend.semantics;

/**
 * A named entry of the {@link SymbolTable}.
 *
 * @param name        The declared name.
 * @param type        Whether the name denotes a species or a rate constant.
 * @param signedIndex {@code index + 1} for species, {@code -(index + 1)} for rates.
 */
public record Symbol(String name, Type type, int signedIndex) {

    /**
     * The kind of a symbol.
     */
    public enum Type {
        SPECIES,
        RATE
    }

    /**
     * @return The zero-based position of the symbol within its own list.
     */
    public int index() {
        return Math.abs(signedIndex) - 1;
    }
}
