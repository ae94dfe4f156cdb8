package org.propensa.compiler.frontend.parser;

import org.propensa.compiler.CompilationException;
import org.propensa.compiler.CompilationException.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits reaction strings of the form {@code "X+Y > propensity > Z"}.
 */
public final class ReactionSplitter {

    /** Separates reactants, propensity and products. */
    public static final char SEPARATOR = '>';
    /** Joins the species of one side. */
    public static final char JOIN = '+';
    /** Denotes an empty side. */
    public static final char EMPTY_SET = '@';

    private ReactionSplitter() {}

    /**
     * Splits one reaction into reactants, propensity and products.
     *
     * @param text     The reaction string.
     * @param position The 1-based position of the reaction, used in error messages.
     * @return The split reaction.
     * @throws CompilationException If the reaction does not contain exactly two separators.
     */
    public static ReactionSpec split(String text, int position) throws CompilationException {
        if (text == null) {
            throw new CompilationException(ErrorCode.MALFORMED_REACTION,
                    "Reaction #" + position + " is missing.", position, null);
        }
        int first = text.indexOf(SEPARATOR);
        int last = text.lastIndexOf(SEPARATOR);
        if (first < 0 || first == last || text.indexOf(SEPARATOR, first + 1) != last) {
            throw new CompilationException(ErrorCode.MALFORMED_REACTION,
                    "Each reaction must contain exactly 2 '" + SEPARATOR + "' (reaction #" + position + ": '"
                            + text + "').", position, null);
        }
        String from = text.substring(0, first);
        String propensity = text.substring(first + 1, last);
        String to = text.substring(last + 1);

        return new ReactionSpec(position, text,
                splitTerms(strip(from, true)),
                strip(propensity, false),
                splitTerms(strip(to, true)),
                new ReactionSpec.RawSegments(from, propensity, to));
    }

    /**
     * Splits a side of a reaction at each {@link #JOIN}. An empty segment yields an empty list;
     * empty tokens between two joins are kept.
     *
     * @param segment The stripped segment, e.g. {@code "X+Y"}.
     * @return The tokens in order of appearance.
     */
    public static List<String> splitTerms(String segment) {
        List<String> terms = new ArrayList<>();
        if (segment.isEmpty()) {
            return terms;
        }
        int start = 0;
        for (int i = 0; i <= segment.length(); i++) {
            if (i == segment.length() || segment.charAt(i) == JOIN) {
                terms.add(segment.substring(start, i));
                start = i + 1;
            }
        }
        return terms;
    }

    private static String strip(String segment, boolean dropEmptySet) {
        StringBuilder sb = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (Character.isWhitespace(c) || (dropEmptySet && c == EMPTY_SET)) {
                continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
