package org.propensa.compiler.backend.matrix;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.propensa.compiler.CompilationException;
import org.propensa.compiler.CompilationException.ErrorCode;
import org.propensa.compiler.api.Species;
import org.propensa.compiler.frontend.parser.ReactionSpec;
import org.propensa.compiler.frontend.rewrite.PropensityRewriter;
import org.propensa.compiler.frontend.rewrite.RewrittenPropensity;
import org.propensa.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the stoichiometric matrix N, the dependency indicator H and the dependency graph G
 * from split reactions.
 * <p>
 * Column {@code i} of N holds -1 per reactant occurrence and +1 per product occurrence of reaction
 * {@code i}; repeated species accumulate. Column {@code i} of H marks the species read by the
 * propensity of reaction {@code i}. The graph is {@code G = nonzero([H', H'*|N|])}: row {@code i}
 * lists the species reaction {@code i} reads, followed by every reaction whose firing changes one
 * of those species.
 */
public class NetworkAssembler {

    private static final Logger log = LoggerFactory.getLogger(NetworkAssembler.class);

    private final SymbolTable symbolTable;
    private final PropensityRewriter rewriter;

    public NetworkAssembler(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
        this.rewriter = new PropensityRewriter(symbolTable);
    }

    /**
     * Assembles the matrices. Reactions are processed in order and the first unresolved species aborts.
     *
     * @param reactions The split reactions.
     * @return N, H, G and the rewritten propensities.
     * @throws CompilationException If a reactant or product is not a declared species.
     */
    public AssembledNetwork assemble(List<ReactionSpec> reactions) throws CompilationException {
        int speciesCount = symbolTable.getSpecies().size();
        int reactionCount = reactions.size();

        SparseIntMatrix.Builder n = SparseIntMatrix.builder(speciesCount, reactionCount);
        BooleanMatrix.Builder h = BooleanMatrix.builder(speciesCount, reactionCount);
        List<RewrittenPropensity> propensities = new ArrayList<>(reactionCount);

        for (int i = 0; i < reactionCount; i++) {
            ReactionSpec reaction = reactions.get(i);
            IntList from = resolve(reaction.reactants(), reaction);
            IntList to = resolve(reaction.products(), reaction);

            for (int s : from) {
                n.add(s, i, -1);
            }
            for (int s : to) {
                n.add(s, i, 1);
            }

            RewrittenPropensity propensity = rewriter.rewrite(reaction.propensity());
            for (int s : propensity.dependencies()) {
                h.set(s, i);
            }
            propensities.add(propensity);
        }

        SparseIntMatrix stoichiometry = n.build();
        BooleanMatrix dependencies = h.build();
        BooleanMatrix graph = dependencyGraph(stoichiometry, propensities);

        log.debug("Assembled {} species x {} reactions: nnz(N)={}, nnz(G)={}",
                speciesCount, reactionCount, stoichiometry.nonZeroCount(), graph.nonZeroCount());
        return new AssembledNetwork(stoichiometry, dependencies, graph, propensities);
    }

    private IntList resolve(List<String> tokens, ReactionSpec reaction) throws CompilationException {
        IntList indices = new IntArrayList(tokens.size());
        for (String token : tokens) {
            Species species = symbolTable.resolveSpecies(token).orElseThrow(() -> new CompilationException(
                    ErrorCode.UNKNOWN_SPECIES,
                    "Unknown species '" + token + "' in reaction #" + reaction.position() + ".",
                    reaction.position(), token));
            indices.add(species.index());
        }
        return indices;
    }

    private static BooleanMatrix dependencyGraph(SparseIntMatrix stoichiometry, List<RewrittenPropensity> propensities) {
        int speciesCount = stoichiometry.rows();
        int reactionCount = stoichiometry.columns();

        // reactions changing each species, i.e. the nonzero pattern of the rows of N
        List<IntList> changedBy = new ArrayList<>(speciesCount);
        for (int s = 0; s < speciesCount; s++) {
            changedBy.add(new IntArrayList());
        }
        int[] jc = stoichiometry.jc();
        int[] ir = stoichiometry.ir();
        for (int j = 0; j < reactionCount; j++) {
            for (int k = jc[j]; k < jc[j + 1]; k++) {
                changedBy.get(ir[k]).add(j);
            }
        }

        BooleanMatrix.Builder g = BooleanMatrix.builder(reactionCount, speciesCount + reactionCount);
        for (int i = 0; i < reactionCount; i++) {
            for (int s : propensities.get(i).dependencies()) {
                g.set(i, s);
                for (int j : changedBy.get(s)) {
                    g.set(i, speciesCount + j);
                }
            }
        }
        return g.build();
    }
}
