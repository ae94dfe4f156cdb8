package org.propensa.compiler.frontend.parser;

import java.util.List;

/**
 * One reaction split into its three segments.
 *
 * @param position    1-based position of the reaction in the input list.
 * @param text        The reaction exactly as given.
 * @param reactants   Reactant tokens, whitespace and empty-set symbol removed; empty for {@code @}.
 * @param propensity  The propensity expression with whitespace removed.
 * @param products    Product tokens, whitespace and empty-set symbol removed; empty for {@code @}.
 * @param rawSegments The three segments as they appear in {@code text}, used for notation output.
 */
public record ReactionSpec(int position,
                           String text,
                           List<String> reactants,
                           String propensity,
                           List<String> products,
                           RawSegments rawSegments) {

    public ReactionSpec {
        reactants = List.copyOf(reactants);
        products = List.copyOf(products);
    }

    /**
     * The untouched text between the separators.
     */
    public record RawSegments(String from, String propensity, String to) {
    }
}
