package org.propensa.compiler.frontend.rewrite;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.propensa.compiler.frontend.semantics.Symbol;
import org.propensa.compiler.frontend.semantics.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites propensity expressions into C, replacing species by {@code xstate[<species>]} and
 * keeping rate constants as named constants.
 * <p>
 * Resolution runs in two passes. First every symbol, longest name first, is replaced by a marker
 * {@code $[n]} where {@code n} is its signed index. Markers consist of {@code $ [ ] -} and digits
 * only, so no identifier can match inside one, and a short name is never matched inside a longer
 * one that was already replaced. The second pass expands the markers left to right.
 * <p>
 * A name only matches as a whole symbol: the characters around an occurrence must not be letters,
 * digits or {@code _}. Thus species {@code e} is not found in {@code 1e-3} or in {@code exp(...)}.
 */
public class PropensityRewriter {

    /** Name of the state-vector argument of the generated propensity functions. */
    public static final String STATE_VARIABLE = "xstate";

    private static final String IDENTIFIER_CHAR = "[A-Za-z0-9_]";
    private static final Pattern STATE_ACCESS = Pattern.compile(
            Pattern.quote(STATE_VARIABLE) + "\\[([A-Za-z_][A-Za-z0-9_]*)\\]");

    private final SymbolTable symbolTable;
    private final List<SymbolPattern> patterns = new ArrayList<>();

    private record SymbolPattern(Symbol symbol, Pattern pattern) {
    }

    public PropensityRewriter(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
        for (Symbol symbol : symbolTable.symbolsByDecreasingLength()) {
            Pattern pattern = Pattern.compile(
                    "(?<!" + IDENTIFIER_CHAR + ")" + Pattern.quote(symbol.name()) + "(?!" + IDENTIFIER_CHAR + ")");
            patterns.add(new SymbolPattern(symbol, pattern));
        }
    }

    /**
     * Rewrites one propensity expression.
     *
     * @param expression The expression as written in the reaction.
     * @return The C expression and the species it depends on.
     */
    public RewrittenPropensity rewrite(String expression) {
        // a literal '$' is doubled so that it cannot be taken for a marker
        String text = expression.replace("$", "$$");
        IntSortedSet dependencies = new IntRBTreeSet();

        for (SymbolPattern entry : patterns) {
            Matcher matcher = entry.pattern().matcher(text);
            if (!matcher.find()) {
                continue;
            }
            Symbol symbol = entry.symbol();
            if (symbol.type() == Symbol.Type.SPECIES) {
                dependencies.add(symbol.index());
            }
            text = matcher.replaceAll(Matcher.quoteReplacement("$[" + symbol.signedIndex() + "]"));
        }

        return new RewrittenPropensity(expandMarkers(text), new IntArrayList(dependencies));
    }

    /**
     * Reverses {@link #rewrite(String)}: replaces every state access by the bare species name.
     *
     * @param rewritten A rewritten expression.
     * @return The expression in terms of species and rate names.
     */
    public static String restore(String rewritten) {
        return STATE_ACCESS.matcher(rewritten).replaceAll("$1");
    }

    private String expandMarkers(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        int offset = 0;
        while (true) {
            int start = text.indexOf('$', offset);
            if (start < 0) {
                break;
            }
            out.append(text, offset, start);
            if (text.charAt(start + 1) == '$') {
                out.append('$');
                offset = start + 2;
                continue;
            }
            int end = text.indexOf(']', start + 2);

            Symbol symbol = symbolTable.bySignedIndex(Integer.parseInt(text.substring(start + 2, end)));
            if (symbol.type() == Symbol.Type.SPECIES) {
                out.append(STATE_VARIABLE).append('[').append(symbol.name()).append(']');
            } else {
                out.append(symbol.name());
            }
            offset = end + 1;
        }
        out.append(text, offset, text.length());
        return out.toString();
    }
}
