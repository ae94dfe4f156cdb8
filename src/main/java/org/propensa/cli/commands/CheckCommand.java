package org.propensa.cli.commands;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.propensa.cli.CommandLineInterface;
import org.propensa.compiler.CompilationException;
import org.propensa.compiler.NetworkAnalysis;
import org.propensa.compiler.ReactionCompiler;
import org.propensa.compiler.backend.emit.GeneratorOptions;
import org.propensa.compiler.io.ModelLoader;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Validates a model file and assembles its matrices without generating code or writing files.
 */
@Command(
    name = "check",
    description = "Validate a reaction network model and print a summary"
)
public class CheckCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Model file (HOCON with species, rates and reactions)"
    )
    private File modelFile;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final GeneratorOptions options =
                    GeneratorOptions.fromConfig(parent.getConfig().getConfig("propensa.generator"));
            final NetworkAnalysis analysis = new ReactionCompiler(options).analyze(ModelLoader.load(modelFile));
            out.println("OK: " + modelFile);
            CompileCommand.printSummary(analysis, out);
            out.flush();
            return 0;
        } catch (CompilationException e) {
            final String where = e.getReactionPosition() > 0 ? " [reaction #" + e.getReactionPosition() + "]" : "";
            err.println(e.getCode() + where + ": " + e.getMessage());
            err.flush();
            return 1;
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
