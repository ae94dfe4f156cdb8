package org.propensa.compiler;

import org.propensa.compiler.api.RateConstant;
import org.propensa.compiler.api.Species;
import org.propensa.compiler.backend.matrix.AssembledNetwork;
import org.propensa.compiler.frontend.parser.ReactionSpec;

import java.util.List;

/**
 * The checked network before code generation.
 *
 * @param species   The species in row order of the matrices.
 * @param rates     The rate constants.
 * @param reactions The split reactions.
 * @param network   N, H, G and the rewritten propensities.
 */
public record NetworkAnalysis(List<Species> species,
                              List<RateConstant> rates,
                              List<ReactionSpec> reactions,
                              AssembledNetwork network) {

    public int reactionCount() {
        return reactions.size();
    }
}
