package org.propensa.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.propensa.cli.CommandLineInterface;
import org.propensa.compiler.CompilationException;
import org.propensa.compiler.CompilationResult;
import org.propensa.compiler.NetworkAnalysis;
import org.propensa.compiler.ReactionCompiler;
import org.propensa.compiler.api.RateConstant;
import org.propensa.compiler.api.ReactionModel;
import org.propensa.compiler.api.Species;
import org.propensa.compiler.backend.emit.GeneratorOptions;
import org.propensa.compiler.backend.matrix.BooleanMatrix;
import org.propensa.compiler.backend.matrix.SparseIntMatrix;
import org.propensa.compiler.io.GeneratedFileWriter;
import org.propensa.compiler.io.ModelLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Compiles a model file and prints the stoichiometric matrix and dependency graph.
 * <p>
 * The generated C source is written to {@code --output} (or printed with {@code --format source}),
 * the LaTeX listing to {@code --latex}. Existing files are only replaced if they were generated.
 */
@Command(
    name = "compile",
    description = "Compile a reaction network model into C propensity functions"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Model file (HOCON with species, rates and reactions)"
    )
    private File modelFile;

    @Option(
        names = {"-o", "--output"},
        description = "Destination of the generated C source"
    )
    private Path output;

    @Option(
        names = {"--latex"},
        description = "Destination of the LaTeX reaction listing"
    )
    private Path latexOutput;

    @Option(
        names = {"--format"},
        description = "Output format: json, summary, source (default: json)"
    )
    private String format = "json";

    @Option(
        names = {"--no-timestamp"},
        description = "Omit the generation timestamp from the C source"
    )
    private boolean noTimestamp;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    enum OutputFormat {
        JSON,
        SUMMARY,
        SOURCE
    }

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final OutputFormat outputFormat;
        try {
            outputFormat = OutputFormat.valueOf(format.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            err.println("Error: unknown format '" + format + "' (expected json, summary or source)");
            err.flush();
            return 2;
        }

        try {
            final Config config = parent.getConfig();
            GeneratorOptions options = GeneratorOptions.fromConfig(config.getConfig("propensa.generator"));
            if (noTimestamp) {
                options = options.withTimestamp(false);
            }

            final ReactionModel model = ModelLoader.load(modelFile);
            final CompilationResult result = new ReactionCompiler(options).compile(model);
            log.info("Compiled {} reactions over {} species from {}",
                    result.reactionCount(), result.species().size(), modelFile);

            final GeneratedFileWriter writer = new GeneratedFileWriter(target ->
                    err.println("Warning: will not overwrite existing file " + target + " (not generated by propensa)"));
            if (output != null) {
                writer.write(output, result.source());
            }
            if (latexOutput != null) {
                writer.write(latexOutput, result.latex() + "\n");
            }

            switch (outputFormat) {
                case JSON -> out.println(toJson(result));
                case SUMMARY -> printSummary(result, out);
                case SOURCE -> out.print(result.source());
            }
            out.flush();
            return 0;

        } catch (CompilationException | IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error writing output: " + e.getMessage());
            return 1;
        } finally {
            err.flush();
        }
    }

    static void printSummary(CompilationResult result, PrintWriter out) {
        printSummary(result.species(), result.rates(), result.reactionCount(),
                result.stoichiometry(), result.graph(), out);
    }

    static void printSummary(NetworkAnalysis analysis, PrintWriter out) {
        printSummary(analysis.species(), analysis.rates(), analysis.reactionCount(),
                analysis.network().stoichiometry(), analysis.network().graph(), out);
    }

    private static void printSummary(List<Species> species, List<RateConstant> rates, int reactions,
                                     SparseIntMatrix n, BooleanMatrix g, PrintWriter out) {
        out.printf("Species:   %d %s%n", species.size(), species.stream().map(Species::name).toList());
        out.printf("Rates:     %d %s%n", rates.size(), rates.stream().map(RateConstant::name).toList());
        out.printf("Reactions: %d%n", reactions);
        out.printf("N: %dx%d, %d nonzeros%n", n.rows(), n.columns(), n.nonZeroCount());
        out.printf("G: %dx%d, %d nonzeros%n", g.rows(), g.columns(), g.nonZeroCount());
    }

    static String toJson(CompilationResult result) {
        final JsonObject root = new JsonObject();

        final JsonArray species = new JsonArray();
        result.species().forEach(s -> species.add(s.name()));
        root.add("species", species);

        final JsonArray rates = new JsonArray();
        for (RateConstant rate : result.rates()) {
            final JsonObject entry = new JsonObject();
            entry.addProperty("name", rate.name());
            entry.addProperty("value", rate.value());
            rates.add(entry);
        }
        root.add("rates", rates);

        final JsonArray propensities = new JsonArray();
        result.propensities().forEach(p -> propensities.add(p.expression()));
        root.add("propensities", propensities);

        root.add("N", matrixJson(result.stoichiometry()));
        root.add("G", matrixJson(result.graph()));

        final Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(root);
    }

    private static JsonObject matrixJson(SparseIntMatrix matrix) {
        final JsonObject json = shape(matrix.rows(), matrix.columns(), matrix.jc(), matrix.ir());
        json.add("pr", array(matrix.pr()));
        final JsonArray dense = new JsonArray();
        for (int[] row : matrix.toDense()) {
            dense.add(array(row));
        }
        json.add("dense", dense);
        return json;
    }

    private static JsonObject matrixJson(BooleanMatrix matrix) {
        final JsonObject json = shape(matrix.rows(), matrix.columns(), matrix.jc(), matrix.ir());
        final JsonArray dense = new JsonArray();
        for (boolean[] row : matrix.toDense()) {
            final JsonArray values = new JsonArray();
            for (boolean value : row) {
                values.add(value ? 1 : 0);
            }
            dense.add(values);
        }
        json.add("dense", dense);
        return json;
    }

    private static JsonObject shape(int rows, int columns, int[] jc, int[] ir) {
        final JsonObject json = new JsonObject();
        json.addProperty("rows", rows);
        json.addProperty("columns", columns);
        json.add("jc", array(jc));
        json.add("ir", array(ir));
        return json;
    }

    private static JsonArray array(int[] values) {
        final JsonArray array = new JsonArray();
        for (int value : values) {
            array.add(value);
        }
        return array;
    }
}
