package org.propensa.compiler.backend.matrix;

import org.propensa.compiler.CompilationException;
import org.propensa.compiler.CompilationException.ErrorCode;
import org.propensa.compiler.api.ReactionModel;
import org.propensa.compiler.backend.emit.GeneratorOptions;
import org.propensa.compiler.frontend.parser.ReactionSpec;
import org.propensa.compiler.frontend.parser.ReactionSplitter;
import org.propensa.compiler.frontend.semantics.ModelValidator;
import org.propensa.compiler.frontend.semantics.SymbolTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link NetworkAssembler}: stoichiometry, dependency indicator and the two blocks
 * of the dependency graph.
 */
@Tag("unit")
class NetworkAssemblerTest {

    private static AssembledNetwork assemble(ReactionModel model) throws CompilationException {
        SymbolTable table = ModelValidator.validate(model, GeneratorOptions.defaults().functionPrefix());
        List<ReactionSpec> reactions = new ArrayList<>();
        for (int i = 0; i < model.reactions().size(); i++) {
            reactions.add(ReactionSplitter.split(model.reactions().get(i), i + 1));
        }
        return new NetworkAssembler(table).assemble(reactions);
    }

    private static ReactionModel twoSpeciesModel() {
        return ReactionModel.builder()
                .species("X", "Y")
                .rate("k", 1).rate("mu", 1e-3).rate("kk", 1e-4)
                .reaction("@ > k*vol > X")
                .reaction("@ > k*vol > Y")
                .reaction("X > mu*X > @")
                .reaction("Y > mu*Y > @")
                .reaction("X+Y > kk*X*Y/vol > @")
                .build();
    }

    @Test
    void bimolecularDecay_columnAndDependencies() throws CompilationException {
        AssembledNetwork network = assemble(ReactionModel.builder()
                .species("X", "Y").rate("kk", 1e-4)
                .reaction("X+Y > kk*X*Y/vol > @")
                .build());

        assertThat(network.stoichiometry().column(0)).containsExactly(-1, -1);
        assertThat(network.propensities().get(0).dependencies().toIntArray()).containsExactly(0, 1);
        assertThat(network.dependencies().get(0, 0)).isTrue();
        assertThat(network.dependencies().get(1, 0)).isTrue();
    }

    @Test
    void stoichiometryHasOneColumnPerReactionAndOneRowPerSpecies() throws CompilationException {
        AssembledNetwork network = assemble(twoSpeciesModel());

        assertThat(network.stoichiometry().rows()).isEqualTo(2);
        assertThat(network.stoichiometry().columns()).isEqualTo(5);
        assertThat(network.stoichiometry().toDense()).isDeepEqualTo(new int[][]{
                {1, 0, -1, 0, -1},
                {0, 1, 0, -1, -1}
        });
    }

    @Test
    void dependencyGraphOfTwoSpeciesModel() throws CompilationException {
        AssembledNetwork network = assemble(twoSpeciesModel());

        assertThat(network.graph().rows()).isEqualTo(5);
        assertThat(network.graph().columns()).isEqualTo(7);
        assertThat(network.graph().toDense()).isDeepEqualTo(new boolean[][]{
                {false, false, false, false, false, false, false},
                {false, false, false, false, false, false, false},
                {true, false, true, false, true, false, true},
                {false, true, false, true, false, true, false},
                {true, true, true, true, true, true, true}
        });
    }

    @Test
    void dependencyGraphBlocksMatchTheirDefinition() throws CompilationException {
        AssembledNetwork network = assemble(ReactionModel.builder()
                .species("A", "B", "AB", "C")
                .rate("k1", 1).rate("k2", 2).rate("k3", 3)
                .reaction("A+B > k1*A*B > AB")
                .reaction("AB > k2*AB > A+B")
                .reaction("AB+C > k3*AB*C > C+C")
                .reaction("C > k1*vol > @")
                .build());

        BooleanMatrix h = network.dependencies();
        SparseIntMatrix n = network.stoichiometry();
        BooleanMatrix g = network.graph();
        int species = n.rows();
        int reactions = n.columns();

        for (int i = 0; i < reactions; i++) {
            for (int s = 0; s < species; s++) {
                assertThat(g.get(i, s)).as("G[%d,%d]", i, s).isEqualTo(h.get(s, i));
            }
            for (int j = 0; j < reactions; j++) {
                boolean shared = false;
                for (int s = 0; s < species; s++) {
                    shared |= h.get(s, i) && n.get(s, j) != 0;
                }
                assertThat(g.get(i, species + j)).as("G[%d,%d]", i, species + j).isEqualTo(shared);
            }
        }
    }

    @Test
    void repeatedSpeciesAccumulate() throws CompilationException {
        AssembledNetwork network = assemble(ReactionModel.builder()
                .species("X", "X2").rate("k", 1)
                .reaction("X+X > k*X*(X-1)/2 > X2")
                .build());

        assertThat(network.stoichiometry().column(0)).containsExactly(-2, 1);
    }

    @Test
    void noOpReaction_hasZeroColumn() throws CompilationException {
        AssembledNetwork network = assemble(ReactionModel.builder()
                .species("X").rate("k", 1)
                .reaction("X > k*X > X")
                .build());

        assertThat(network.stoichiometry().column(0)).containsExactly(0);
        assertThat(network.graph().get(0, 0)).isTrue();
        assertThat(network.graph().get(0, 1)).isFalse();
    }

    @Test
    void dependenciesIgnoreSpeciesNamesInsideOtherNames() throws CompilationException {
        AssembledNetwork network = assemble(ReactionModel.builder()
                .species("B", "BA").rate("k", 1)
                .reaction("BA > k*BA > B")
                .build());

        assertThat(network.dependencies().get(0, 0)).isFalse();
        assertThat(network.dependencies().get(1, 0)).isTrue();
    }

    @Test
    void unknownReactant_reportsTokenAndPosition() {
        CompilationException e = catchThrowableOfType(() -> assemble(ReactionModel.builder()
                .species("X").rate("k", 1)
                .reaction("@ > k > X")
                .reaction("X+Z > k*X > @")
                .build()), CompilationException.class);

        assertThat(e.getCode()).isEqualTo(ErrorCode.UNKNOWN_SPECIES);
        assertThat(e.getOffendingName()).isEqualTo("Z");
        assertThat(e.getReactionPosition()).isEqualTo(2);
        assertThat(e.getMessage()).isEqualTo("Unknown species 'Z' in reaction #2.");
    }

    @Test
    void rateUsedAsProduct_isUnknownSpecies() {
        CompilationException e = catchThrowableOfType(() -> assemble(ReactionModel.builder()
                .species("X").rate("k", 1)
                .reaction("X > k*X > k")
                .build()), CompilationException.class);

        assertThat(e.getCode()).isEqualTo(ErrorCode.UNKNOWN_SPECIES);
        assertThat(e.getOffendingName()).isEqualTo("k");
    }

    @Test
    void reactantsAreResolvedBeforeProducts() {
        CompilationException e = catchThrowableOfType(() -> assemble(ReactionModel.builder()
                .species("X").rate("k", 1)
                .reaction("P > k > Q")
                .build()), CompilationException.class);

        assertThat(e.getOffendingName()).isEqualTo("P");
    }
}
