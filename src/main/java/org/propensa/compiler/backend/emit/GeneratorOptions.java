package org.propensa.compiler.backend.emit;

import com.typesafe.config.Config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Options of the {@link PropensitySourceGenerator}.
 *
 * @param includes       Header files included by the generated unit, in order.
 * @param functionPrefix Prefix of the propensity function names; reaction {@code i} gets {@code prefix + i}.
 * @param timestamp      Whether to emit the generation timestamp line.
 */
public record GeneratorOptions(List<String> includes, String functionPrefix, boolean timestamp) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public GeneratorOptions {
        includes = List.copyOf(includes);
        if (functionPrefix == null || !IDENTIFIER.matcher(functionPrefix).matches()) {
            throw new IllegalArgumentException("functionPrefix must be a C identifier, got: " + functionPrefix);
        }
    }

    /**
     * @return The options matching the solver plugin headers.
     */
    public static GeneratorOptions defaults() {
        return new GeneratorOptions(List.of("propensities.h", "report.h"), "rFun", true);
    }

    /**
     * Reads the options from a {@code generator} configuration block.
     *
     * @param config Configuration with the keys {@code includes}, {@code function-prefix} and {@code timestamp}.
     * @return The options.
     */
    public static GeneratorOptions fromConfig(Config config) {
        return new GeneratorOptions(
                config.getStringList("includes"),
                config.getString("function-prefix"),
                config.getBoolean("timestamp"));
    }

    /**
     * @return A copy with the timestamp line switched on or off.
     */
    public GeneratorOptions withTimestamp(boolean enabled) {
        return new GeneratorOptions(includes, functionPrefix, enabled);
    }
}
