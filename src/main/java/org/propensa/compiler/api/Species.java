package org.propensa.compiler.api;

/**
 * A chemical species of a reaction network.
 *
 * @param name  The species name, used as an enum constant in generated code.
 * @param index The zero-based position in the species list (row of the stoichiometric matrix).
 */
public record Species(String name, int index) {
}
