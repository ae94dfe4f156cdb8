package org.propensa.compiler.frontend.semantics;

import org.propensa.compiler.CompilationException;
import org.propensa.compiler.CompilationException.ErrorCode;
import org.propensa.compiler.api.RateConstant;
import org.propensa.compiler.api.ReactionModel;
import org.propensa.compiler.api.Species;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks the species and rate declarations of a {@link ReactionModel} before any reaction is
 * examined. Conditions are checked in a fixed order and the first violation aborts.
 */
public final class ModelValidator {

    /**
     * Argument names of the generated propensity functions. Species and rates must not shadow them.
     */
    public static final Set<String> RESERVED_IDENTIFIERS =
            Set.of("xstate", "time", "vol", "ldata", "gdata", "sd");

    /**
     * File-scope names of the generated unit and its solver headers.
     */
    public static final Set<String> GENERATED_GLOBALS = Set.of(
            "NR", "ptr", "PropensityFun", "ALLOC_propensities", "FREE_propensities", "PERROR", "NULL", "size_t");

    // C99/C11 keywords
    private static final Set<String> C_KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else",
            "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long", "register",
            "restrict", "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
            "union", "unsigned", "void", "volatile", "while", "_Bool", "_Complex", "_Imaginary",
            "_Alignas", "_Alignof", "_Atomic", "_Generic", "_Noreturn", "_Static_assert", "_Thread_local");

    // Excludes every character of the rewriter's marker alphabet ('$', '[', ']', '-').
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private ModelValidator() {}

    /**
     * Validates the declarations and builds the symbol table over them.
     *
     * @param model          The raw model.
     * @param functionPrefix Prefix of the generated propensity functions; {@code prefix<n>} is taken.
     * @return A symbol table over the validated species and rates.
     * @throws CompilationException If any declaration is invalid.
     */
    public static SymbolTable validate(ReactionModel model, String functionPrefix) throws CompilationException {
        List<String> speciesNames = checkSpecies(model.species());
        List<RateConstant> rates = checkRates(model.rates());
        List<String> rateNames = rates.stream().map(RateConstant::name).toList();

        checkUnique(speciesNames, "Species");
        checkUnique(rateNames, "Rate");

        for (String name : rateNames) {
            if (speciesNames.contains(name)) {
                throw new CompilationException(ErrorCode.NAME_CLASH,
                        "Species and rates must use different names: '" + name + "'.", name);
            }
        }

        checkReserved(speciesNames, "Species");
        checkReserved(rateNames, "Rates");

        checkIdentifiers(speciesNames, "species");
        checkIdentifiers(rateNames, "rate");

        Pattern functionName = Pattern.compile(Pattern.quote(functionPrefix) + "[0-9]+");
        checkGenerated(speciesNames, "Species", functionName);
        checkGenerated(rateNames, "Rates", functionName);

        List<Species> species = new ArrayList<>(speciesNames.size());
        for (int i = 0; i < speciesNames.size(); i++) {
            species.add(new Species(speciesNames.get(i), i));
        }
        return new SymbolTable(species, rates);
    }

    private static List<String> checkSpecies(List<String> species) throws CompilationException {
        for (int i = 0; i < species.size(); i++) {
            String name = species.get(i);
            if (name == null || name.isEmpty()) {
                throw new CompilationException(ErrorCode.INVALID_SPECIES,
                        "Species must be non-empty strings (entry #" + (i + 1) + ").");
            }
        }
        return species;
    }

    private static List<RateConstant> checkRates(List<Object> rates) throws CompilationException {
        if (rates.size() % 2 != 0) {
            throw new CompilationException(ErrorCode.INVALID_RATES,
                    "Rates must be specified as property/value-pairs (got " + rates.size() + " entries).");
        }
        List<RateConstant> result = new ArrayList<>(rates.size() / 2);
        for (int i = 0; i < rates.size(); i += 2) {
            Object name = rates.get(i);
            Object value = rates.get(i + 1);
            if (!(name instanceof String rateName) || rateName.isEmpty()) {
                throw new CompilationException(ErrorCode.INVALID_RATES,
                        "Rates must be specified as property/value-pairs: expected a name at entry #" + (i + 1) + ".");
            }
            if (!(value instanceof Number number) || !Double.isFinite(number.doubleValue())) {
                throw new CompilationException(ErrorCode.INVALID_RATES,
                        "Rate '" + rateName + "' must have a finite numeric value, got: " + value + ".", rateName);
            }
            result.add(new RateConstant(rateName, number.doubleValue()));
        }
        return result;
    }

    private static void checkUnique(List<String> names, String kind) throws CompilationException {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new CompilationException(ErrorCode.DUPLICATE_NAME,
                        kind + " names must be unique: '" + name + "' is declared twice.", name);
            }
        }
    }

    private static void checkReserved(List<String> names, String kind) throws CompilationException {
        Set<String> clashes = new LinkedHashSet<>(names);
        clashes.retainAll(RESERVED_IDENTIFIERS);
        if (!clashes.isEmpty()) {
            String first = clashes.iterator().next();
            throw new CompilationException(ErrorCode.RESERVED_NAME,
                    kind + " should not clash with propensity input arguments: '" + first + "'.", first);
        }
    }

    private static void checkIdentifiers(List<String> names, String kind) throws CompilationException {
        for (String name : names) {
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new CompilationException(ErrorCode.INVALID_IDENTIFIER,
                        "Invalid " + kind + " name '" + name + "': only letters, digits and '_' are allowed"
                                + " and the name must not start with a digit.", name);
            }
            if (C_KEYWORDS.contains(name)) {
                throw new CompilationException(ErrorCode.INVALID_IDENTIFIER,
                        "Invalid " + kind + " name '" + name + "': C keywords cannot be used as names.", name);
            }
        }
    }

    private static void checkGenerated(List<String> names, String kind, Pattern functionName)
            throws CompilationException {
        for (String name : names) {
            if (GENERATED_GLOBALS.contains(name) || functionName.matcher(name).matches()) {
                throw new CompilationException(ErrorCode.RESERVED_NAME,
                        kind + " should not clash with names of the generated code: '" + name + "'.", name);
            }
        }
    }
}
