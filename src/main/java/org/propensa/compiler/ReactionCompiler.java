package org.propensa.compiler;

import org.propensa.compiler.api.ReactionModel;
import org.propensa.compiler.backend.emit.GeneratorOptions;
import org.propensa.compiler.backend.emit.PropensitySourceGenerator;
import org.propensa.compiler.backend.latex.LatexRenderer;
import org.propensa.compiler.backend.matrix.AssembledNetwork;
import org.propensa.compiler.backend.matrix.NetworkAssembler;
import org.propensa.compiler.frontend.parser.ReactionSpec;
import org.propensa.compiler.frontend.parser.ReactionSplitter;
import org.propensa.compiler.frontend.semantics.ModelValidator;
import org.propensa.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a reaction network into its stoichiometric matrix, its dependency graph and the C
 * source of its propensity functions.
 * <p>
 * The phases run in order: declarations are validated, reactions are split, matrices are
 * assembled, then the source and the LaTeX listing are generated. The first error aborts the
 * compilation. A compiler holds no state between calls.
 */
public class ReactionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ReactionCompiler.class);

    private final String functionPrefix;
    private final PropensitySourceGenerator generator;

    public ReactionCompiler() {
        this(GeneratorOptions.defaults());
    }

    public ReactionCompiler(GeneratorOptions options) {
        this(options, Clock.systemDefaultZone());
    }

    public ReactionCompiler(GeneratorOptions options, Clock clock) {
        this.functionPrefix = options.functionPrefix();
        this.generator = new PropensitySourceGenerator(options, clock);
    }

    /**
     * Compiles the model.
     *
     * @param model The reactions, species and rates.
     * @return N, H, G, the generated source and the LaTeX listing.
     * @throws CompilationException On the first invalid declaration or reaction.
     */
    public CompilationResult compile(ReactionModel model) throws CompilationException {
        NetworkAnalysis analysis = analyze(model);
        AssembledNetwork network = analysis.network();

        String source = generator.generate(
                analysis.species(), analysis.rates(), analysis.reactions(), network.propensities());
        String latex = LatexRenderer.render(analysis.reactions());

        log.debug("Compiled {} reactions into {} characters of C source", analysis.reactionCount(), source.length());
        return new CompilationResult(
                analysis.species(),
                analysis.rates(),
                analysis.reactions(),
                network.propensities(),
                network.stoichiometry(),
                network.dependencies(),
                network.graph(),
                source,
                latex);
    }

    /**
     * Runs validation, splitting and matrix assembly only. No source or listing is generated.
     *
     * @param model The reactions, species and rates.
     * @return The symbols, split reactions and assembled matrices.
     * @throws CompilationException On the first invalid declaration or reaction.
     */
    public NetworkAnalysis analyze(ReactionModel model) throws CompilationException {
        SymbolTable symbolTable = ModelValidator.validate(model, functionPrefix);
        log.debug("Validated {} species and {} rates", symbolTable.getSpecies().size(), symbolTable.getRates().size());

        List<ReactionSpec> reactions = split(model.reactions());
        AssembledNetwork network = new NetworkAssembler(symbolTable).assemble(reactions);
        return new NetworkAnalysis(symbolTable.getSpecies(), symbolTable.getRates(), reactions, network);
    }

    /**
     * Splits all reactions. Fails on the first malformed reaction.
     */
    static List<ReactionSpec> split(List<String> reactions) throws CompilationException {
        List<ReactionSpec> result = new ArrayList<>(reactions.size());
        for (int i = 0; i < reactions.size(); i++) {
            result.add(ReactionSplitter.split(reactions.get(i), i + 1));
        }
        return result;
    }
}
