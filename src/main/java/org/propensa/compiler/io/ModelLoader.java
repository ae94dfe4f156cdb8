package org.propensa.compiler.io;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.propensa.compiler.api.ReactionModel;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@link ReactionModel} from a HOCON model file:
 * <pre>
 * species = [X, Y]
 * rates = [k, 1, mu, 1e-3, kk, 1e-4]
 * reactions = [
 *   "@ > k*vol > X"
 *   "X+Y > kk*X*Y/vol > @"
 * ]
 * </pre>
 * Only the shape of the file is checked here; the compiler validates the content. Unquoted
 * HOCON values keep their type, so {@code [k, "1"]} yields a string value that the compiler rejects.
 * {@code rates} may be omitted.
 */
public final class ModelLoader {

    private ModelLoader() {}

    /**
     * Loads a model file.
     *
     * @param file The HOCON file.
     * @return The raw model.
     * @throws IllegalArgumentException If the file does not exist.
     * @throws ConfigException          If the file cannot be parsed, lacks {@code species} or {@code reactions},
     *                                  or one of their entries is not a string.
     */
    public static ReactionModel load(File file) {
        if (!file.exists()) {
            throw new IllegalArgumentException("Model file not found: " + file.getAbsolutePath());
        }
        return fromConfig(ConfigFactory.parseFile(file).resolve());
    }

    /**
     * Builds a model from an already parsed configuration.
     */
    public static ReactionModel fromConfig(Config model) {
        List<String> species = strings(model, "species");
        List<String> reactions = strings(model, "reactions");
        List<Object> rates = new ArrayList<>();
        if (model.hasPath("rates")) {
            for (ConfigValue value : model.getList("rates")) {
                rates.add(value.unwrapped());
            }
        }
        return new ReactionModel(reactions, species, rates);
    }

    private static List<String> strings(Config model, String path) {
        List<String> result = new ArrayList<>();
        List<ConfigValue> values = model.getList(path);
        for (int i = 0; i < values.size(); i++) {
            ConfigValue value = values.get(i);
            if (value.valueType() != ConfigValueType.STRING) {
                throw new ConfigException.WrongType(value.origin(), path + "[" + (i + 1) + "]",
                        "STRING (quote the name)", value.valueType().name());
            }
            result.add((String) value.unwrapped());
        }
        return result;
    }
}
