package org.propensa.compiler.frontend.rewrite;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * A propensity expression after name resolution.
 *
 * @param expression   The C expression with species replaced by state accesses.
 * @param dependencies Zero-based indices of the species the expression reads, sorted and unique.
 */
public record RewrittenPropensity(String expression, IntList dependencies) {
}
