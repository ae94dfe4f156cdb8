package org.propensa.compiler.api;

/**
 * A named rate constant. Generated code refers to it by name only.
 *
 * @param name  The constant name.
 * @param value The finite numeric value.
 */
public record RateConstant(String name, double value) {
}
