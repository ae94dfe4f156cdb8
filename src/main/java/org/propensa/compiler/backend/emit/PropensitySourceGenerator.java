package org.propensa.compiler.backend.emit;

import org.propensa.compiler.api.RateConstant;
import org.propensa.compiler.api.Species;
import org.propensa.compiler.frontend.parser.ReactionSpec;
import org.propensa.compiler.frontend.rewrite.RewrittenPropensity;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Generates the C translation unit implementing the propensity plugin contract of the
 * stochastic solvers: a static table of {@code PropensityFun} handed out by
 * {@code ALLOC_propensities} and released (as a no-op) by {@code FREE_propensities}.
 * <p>
 * The output depends only on the inputs, except for the single timestamp line.
 */
public class PropensitySourceGenerator {

    /**
     * First line of every generated file. A file starting with this line may be overwritten.
     */
    public static final String MARKER = "/* [Remove/modify this line not to overwrite this file] */";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String PARAMETERS =
            "(const int *xstate,double time,double vol,\n"
                    + "             const double *ldata,const double *gdata,int sd)";

    private final GeneratorOptions options;
    private final Clock clock;

    public PropensitySourceGenerator(GeneratorOptions options) {
        this(options, Clock.systemDefaultZone());
    }

    public PropensitySourceGenerator(GeneratorOptions options, Clock clock) {
        this.options = options;
        this.clock = clock;
    }

    /**
     * Generates the source text.
     *
     * @param species      Species in enum order.
     * @param rates        Rate constants in declaration order.
     * @param reactions    The reactions, echoed in the header comment.
     * @param propensities The rewritten propensity of each reaction.
     * @return The complete C source.
     */
    public String generate(List<Species> species,
                           List<RateConstant> rates,
                           List<ReactionSpec> reactions,
                           List<RewrittenPropensity> propensities) {
        if (reactions.size() != propensities.size()) {
            throw new IllegalArgumentException("Expected one propensity per reaction, got "
                    + propensities.size() + " for " + reactions.size() + " reactions");
        }
        int count = reactions.size();
        StringBuilder out = new StringBuilder(1024 + 256 * count);

        out.append(MARKER).append('\n');
        if (options.timestamp()) {
            out.append("/* Generated by propensa ")
                    .append(LocalDateTime.now(clock).format(TIMESTAMP)).append(" */\n");
        }
        out.append('\n');

        out.append("/* Reactions:\n");
        for (ReactionSpec reaction : reactions) {
            out.append("     ").append(commentSafe(reaction.text())).append('\n');
        }
        out.append("*/\n\n");

        for (String include : options.includes()) {
            out.append("#include \"").append(include).append("\"\n");
        }
        out.append('\n');

        if (!species.isEmpty()) {
            out.append("enum Species {");
            for (int i = 0; i < species.size(); i++) {
                out.append(i == 0 ? "\n  " : ",\n  ").append(species.get(i).name());
            }
            out.append("\n};\n\n");
        }

        out.append("const int NR = ").append(count).append("; /* number of reactions */\n\n");

        out.append("/* rate constants */\n");
        for (RateConstant rate : rates) {
            out.append("const double ").append(rate.name()).append(" = ")
                    .append(formatValue(rate.value())).append(";\n");
        }
        out.append('\n');

        out.append("/* forward declaration */\n");
        for (int i = 1; i <= count; i++) {
            out.append("double ").append(functionName(i)).append(PARAMETERS).append(";\n");
        }
        out.append('\n');

        out.append("/* static propensity vector */\n");
        out.append("static PropensityFun ptr[] = {");
        if (count == 0) {
            // C does not allow an empty initializer list
            out.append("NULL");
        }
        for (int i = 1; i <= count; i++) {
            out.append(i == 1 ? "" : ",").append(functionName(i));
        }
        out.append("};\n\n");

        out.append("/* propensity definitions */\n");
        for (int i = 1; i <= count; i++) {
            out.append("double ").append(functionName(i)).append(PARAMETERS).append("\n{\n")
                    .append("  return ").append(propensities.get(i - 1).expression()).append(";\n}\n\n");
        }

        out.append("/* solver interface */\n");
        out.append("PropensityFun *ALLOC_propensities(size_t Mreactions)\n");
        out.append("{\n");
        out.append("  if (Mreactions > NR) PERROR(\"Wrong number of reactions.\");\n");
        out.append("  return ptr;\n}\n\n");
        out.append("void FREE_propensities(PropensityFun *ptr)\n");
        out.append("{ /* do nothing since a static array was used */ }\n");

        return out.toString();
    }

    /**
     * @return The name of the propensity function of the reaction at the given 1-based position.
     */
    public String functionName(int position) {
        return options.functionPrefix() + position;
    }

    /**
     * Formats a rate value as a C floating literal that reads back to exactly the same double.
     */
    static String formatValue(double value) {
        return Double.toString(value);
    }

    private static String commentSafe(String text) {
        return text.replace("*/", "* /");
    }
}
