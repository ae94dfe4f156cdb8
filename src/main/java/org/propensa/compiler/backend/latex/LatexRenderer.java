package org.propensa.compiler.backend.latex;

import org.propensa.compiler.frontend.parser.ReactionSpec;

import java.util.List;

/**
 * Renders reactions as a LaTeX {@code align} block, one {@code from -> to} row per reaction with
 * the propensity written above the arrow.
 */
public final class LatexRenderer {

    private static final String EMPTY_SET = "\\emptyset";

    private LatexRenderer() {}

    public static String render(List<ReactionSpec> reactions) {
        StringBuilder out = new StringBuilder();
        out.append("\\begin{align}\n");
        out.append("  \\left. \\begin{array}{rcl}\n");
        for (ReactionSpec reaction : reactions) {
            ReactionSpec.RawSegments segments = reaction.rawSegments();
            out.append("    ")
                    .append(side(segments.from()))
                    .append(" & \\xrightarrow{").append(segments.propensity()).append("} & ")
                    .append(side(segments.to()))
                    .append("\t\\\\\n");
        }
        out.append("  \\end{array} \\right\\}.\n");
        out.append("\\end{align}");
        return out.toString();
    }

    // a side without species, written as '@' or left blank, is the empty set
    private static String side(String segment) {
        if (segment.isBlank()) {
            return segment + EMPTY_SET;
        }
        return segment.replace("@", EMPTY_SET);
    }
}
