package org.propensa.compiler.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw compiler input: reaction strings, species names and rate constants.
 * <p>
 * Rates are given as property/value pairs, e.g. {@code ["k", 1, "mu", 1e-3]}, exactly as they
 * appear in a model file. Nothing is checked here; the compiler validates the model before use.
 * Null entries are preserved so that validation can report them.
 *
 * @param reactions Reactions of the form {@code "X+Y > k*X*Y > Z"}.
 * @param species   Species names in matrix row order.
 * @param rates     Alternating rate names and numeric values.
 */
public record ReactionModel(List<String> reactions, List<String> species, List<Object> rates) {

    public ReactionModel {
        reactions = copyOf(reactions);
        species = copyOf(species);
        rates = copyOf(rates);
    }

    /**
     * Starts a fluent builder, convenient for tests and programmatic use.
     * @return A new, empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * Fluent builder for {@link ReactionModel}.
     */
    public static final class Builder {
        private final List<String> reactions = new ArrayList<>();
        private final List<String> species = new ArrayList<>();
        private final List<Object> rates = new ArrayList<>();

        private Builder() {
        }

        public Builder reaction(String reaction) {
            reactions.add(reaction);
            return this;
        }

        public Builder species(String... names) {
            Collections.addAll(species, names);
            return this;
        }

        public Builder rate(String name, double value) {
            rates.add(name);
            rates.add(value);
            return this;
        }

        public ReactionModel build() {
            return new ReactionModel(reactions, species, rates);
        }
    }
}
