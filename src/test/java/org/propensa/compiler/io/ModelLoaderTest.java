package org.propensa.compiler.io;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.propensa.compiler.api.ReactionModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModelLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsSpeciesRatesAndReactionsInOrder() throws IOException {
        Path file = tempDir.resolve("model.conf");
        Files.writeString(file, """
            species = [X, Y]
            rates = [k, 1, mu, 1e-3]
            reactions = [
              "@ > k*vol > X"
              "X+Y > mu*X*Y > @"
            ]
            """);

        ReactionModel model = ModelLoader.load(file.toFile());

        assertThat(model.species()).containsExactly("X", "Y");
        assertThat(model.reactions()).containsExactly("@ > k*vol > X", "X+Y > mu*X*Y > @");
        assertThat(model.rates()).hasSize(4);
        assertThat(model.rates().get(0)).isEqualTo("k");
        assertThat(((Number) model.rates().get(1)).doubleValue()).isEqualTo(1.0);
        assertThat(model.rates().get(2)).isEqualTo("mu");
        assertThat(((Number) model.rates().get(3)).doubleValue()).isEqualTo(1e-3);
    }

    @Test
    void ratesMayBeOmitted() {
        ReactionModel model = ModelLoader.fromConfig(ConfigFactory.parseString(
                "species = [A], reactions = [\"A > 1 > @\"]"));

        assertThat(model.rates()).isEmpty();
    }

    @Test
    void quotedRateValueStaysAString() {
        ReactionModel model = ModelLoader.fromConfig(ConfigFactory.parseString(
                "species = [A], rates = [k, \"one\"], reactions = []"));

        assertThat(model.rates().get(1)).isEqualTo("one");
    }

    @Test
    void unquotedNonStringSpecies_namesItsType() {
        assertThatThrownBy(() -> ModelLoader.fromConfig(ConfigFactory.parseString(
                "species = [A, 3], reactions = []")))
                .isInstanceOf(ConfigException.WrongType.class)
                .hasMessageContaining("species[2]")
                .hasMessageContaining("NUMBER");
        assertThatThrownBy(() -> ModelLoader.fromConfig(ConfigFactory.parseString(
                "species = [true], reactions = []")))
                .hasMessageContaining("BOOLEAN");
        assertThatThrownBy(() -> ModelLoader.fromConfig(ConfigFactory.parseString(
                "species = [A], reactions = [null]")))
                .isInstanceOf(ConfigException.WrongType.class)
                .hasMessageContaining("reactions[1]")
                .hasMessageContaining("NULL");
    }

    @Test
    void missingFile_isIllegalArgument() {
        assertThatThrownBy(() -> ModelLoader.load(new File(tempDir.toFile(), "absent.conf")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.conf");
    }

    @Test
    void missingSpecies_isConfigException() {
        assertThatThrownBy(() -> ModelLoader.fromConfig(ConfigFactory.parseString("reactions = []")))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
