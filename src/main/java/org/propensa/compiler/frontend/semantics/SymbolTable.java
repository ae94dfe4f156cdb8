package org.propensa.compiler.frontend.semantics;

import org.propensa.compiler.api.RateConstant;
import org.propensa.compiler.api.Species;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves species and rate names to signed indices. Species map to positive indices
 * ({@code index + 1}), rates to negative ones ({@code -(index + 1)}), so a single integer
 * identifies any symbol.
 * <p>
 * The table is read-only after construction and may be shared between threads.
 */
public class SymbolTable {

    private final List<Species> species;
    private final List<RateConstant> rates;
    private final Map<String, Symbol> symbols = new HashMap<>();
    private final List<Symbol> byDecreasingLength;

    /**
     * Builds the table. Names are assumed to be validated: unique, and disjoint between species and rates.
     *
     * @param species The species in row order.
     * @param rates   The rate constants in declaration order.
     */
    public SymbolTable(List<Species> species, List<RateConstant> rates) {
        this.species = List.copyOf(species);
        this.rates = List.copyOf(rates);

        List<Symbol> ordered = new ArrayList<>(species.size() + rates.size());
        for (int i = 0; i < this.species.size(); i++) {
            ordered.add(new Symbol(this.species.get(i).name(), Symbol.Type.SPECIES, i + 1));
        }
        for (int i = 0; i < this.rates.size(); i++) {
            ordered.add(new Symbol(this.rates.get(i).name(), Symbol.Type.RATE, -(i + 1)));
        }
        for (Symbol symbol : ordered) {
            symbols.put(symbol.name(), symbol);
        }
        // stable sort: equal lengths keep species-then-rates declaration order
        ordered.sort(Comparator.comparingInt((Symbol s) -> s.name().length()).reversed());
        this.byDecreasingLength = List.copyOf(ordered);
    }

    /**
     * Resolves a name to its symbol.
     * @param name The name to look up.
     * @return The symbol, or empty if the name is neither a species nor a rate.
     */
    public Optional<Symbol> resolve(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * Resolves a name that must denote a species.
     * @param name The name to look up.
     * @return The species, or empty if the name is unknown or denotes a rate.
     */
    public Optional<Species> resolveSpecies(String name) {
        Symbol symbol = symbols.get(name);
        if (symbol == null || symbol.type() != Symbol.Type.SPECIES) {
            return Optional.empty();
        }
        return Optional.of(species.get(symbol.index()));
    }

    /**
     * Looks up a symbol by its signed index.
     * @param signedIndex Positive for species, negative for rates, never zero.
     * @return The symbol.
     * @throws IllegalArgumentException If no symbol has this index.
     */
    public Symbol bySignedIndex(int signedIndex) {
        if (signedIndex > 0 && signedIndex <= species.size()) {
            return symbols.get(species.get(signedIndex - 1).name());
        }
        if (signedIndex < 0 && -signedIndex <= rates.size()) {
            return symbols.get(rates.get(-signedIndex - 1).name());
        }
        throw new IllegalArgumentException("No symbol with index " + signedIndex);
    }

    /**
     * @return All symbols, longest names first.
     */
    public List<Symbol> symbolsByDecreasingLength() {
        return byDecreasingLength;
    }

    public List<Species> getSpecies() {
        return species;
    }

    public List<RateConstant> getRates() {
        return rates;
    }
}
