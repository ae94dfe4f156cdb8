package org.propensa.compiler.backend.matrix;

import org.propensa.compiler.frontend.rewrite.RewrittenPropensity;

import java.util.List;

/**
 * The matrices of a compiled reaction network.
 *
 * @param stoichiometry Species x reactions net change matrix N.
 * @param dependencies  Species x reactions indicator H of species read by each propensity.
 * @param graph         Reactions x (species + reactions) dependency graph G.
 * @param propensities  Rewritten propensity of each reaction, in reaction order.
 */
public record AssembledNetwork(SparseIntMatrix stoichiometry,
                               BooleanMatrix dependencies,
                               BooleanMatrix graph,
                               List<RewrittenPropensity> propensities) {

    public AssembledNetwork {
        propensities = List.copyOf(propensities);
    }
}
