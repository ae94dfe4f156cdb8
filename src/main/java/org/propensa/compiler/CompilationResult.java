package org.propensa.compiler;

import org.propensa.compiler.api.RateConstant;
import org.propensa.compiler.api.Species;
import org.propensa.compiler.backend.matrix.BooleanMatrix;
import org.propensa.compiler.backend.matrix.SparseIntMatrix;
import org.propensa.compiler.frontend.parser.ReactionSpec;
import org.propensa.compiler.frontend.rewrite.RewrittenPropensity;

import java.util.List;

/**
 * Everything produced by one compilation.
 *
 * @param species       The species in row order of the matrices.
 * @param rates         The rate constants.
 * @param reactions     The split reactions.
 * @param propensities  The rewritten propensity of each reaction.
 * @param stoichiometry The stoichiometric matrix N (species x reactions).
 * @param dependencies  The dependency indicator H (species x reactions).
 * @param graph         The dependency graph G (reactions x (species + reactions)).
 * @param source        The generated C source.
 * @param latex         The LaTeX listing of the reactions.
 */
public record CompilationResult(List<Species> species,
                                List<RateConstant> rates,
                                List<ReactionSpec> reactions,
                                List<RewrittenPropensity> propensities,
                                SparseIntMatrix stoichiometry,
                                BooleanMatrix dependencies,
                                BooleanMatrix graph,
                                String source,
                                String latex) {

    public int reactionCount() {
        return reactions.size();
    }
}
