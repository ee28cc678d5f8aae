package io.validata.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.validata.core.engine.locale.YamlMessageStore;
import io.validata.core.error.ConfigLoadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for YAML configuration loading and the environment overlay. */
@DisplayName("ConfigLoaderTest")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("validata.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    // --- YAML ---

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        void fullFile() throws IOException {
            Path config = write("""
                    validator:
                      locale: FR
                      parallelism: 3
                      max-depth: 8
                    """);

            ValidatorConfig loaded = ConfigLoader.load(config, NO_ENV);

            assertThat(loaded.locale()).isEqualTo("fr");
            assertThat(loaded.parallelism()).isEqualTo(3);
            assertThat(loaded.maxDepth()).isEqualTo(8);
            assertThat(loaded.uniquenessChecker()).isNull();
            assertThat(loaded.listener()).isNull();
        }

        @Test
        @DisplayName("missing keys keep the builder defaults")
        void defaults() throws IOException {
            ValidatorConfig loaded = ConfigLoader.load(write("validator: {}\n"), NO_ENV);

            assertThat(loaded.locale()).isEqualTo(ValidatorConfig.DEFAULT_LOCALE);
            assertThat(loaded.maxDepth()).isEqualTo(ValidatorConfig.DEFAULT_MAX_DEPTH);
            assertThat(loaded.parallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
            assertThat(loaded.messageStore()).isSameAs(YamlMessageStore.bundled());
        }

        @Test
        void emptyFile() throws IOException {
            assertThat(ConfigLoader.load(write(""), NO_ENV).locale()).isEqualTo("en");
        }

        @Test
        @DisplayName("a messages directory replaces the bundled store")
        void messagesDirectory() throws IOException {
            Path messages = Files.createDirectory(tempDir.resolve("messages"));
            Files.writeString(messages.resolve("es.yaml"), "required: \"El campo %s es obligatorio\"\n");
            Path config = write("validator:\n  locale: es\n  messages: " + messages + "\n");

            ValidatorConfig loaded = ConfigLoader.load(config, NO_ENV);

            assertThat(loaded.messageStore().lookup("es", "required")).contains("El campo %s es obligatorio");
            assertThat(loaded.messageStore().lookup("en", "required")).contains("The %s field is required");
        }
    }

    // --- Environment ---

    @Nested
    @DisplayName("environment overlay")
    class Environment {

        @Test
        @DisplayName("set variables win over YAML")
        void envWins() throws IOException {
            Path config = write("""
                    validator:
                      locale: en
                      parallelism: 2
                      max-depth: 4
                    """);
            Map<String, String> env = Map.of(
                    ConfigLoader.ENV_LOCALE, " fr ",
                    ConfigLoader.ENV_PARALLELISM, "6",
                    ConfigLoader.ENV_MAX_DEPTH, "12");

            ValidatorConfig loaded = ConfigLoader.load(config, env::get);

            assertThat(loaded.locale()).isEqualTo("fr");
            assertThat(loaded.parallelism()).isEqualTo(6);
            assertThat(loaded.maxDepth()).isEqualTo(12);
        }

        @Test
        @DisplayName("blank variables are treated as unset")
        void blankIgnored() throws IOException {
            Path config = write("validator:\n  locale: fr\n");

            ValidatorConfig loaded = ConfigLoader.load(config, Map.of(ConfigLoader.ENV_LOCALE, "   ")::get);

            assertThat(loaded.locale()).isEqualTo("fr");
        }

        @Test
        void nonNumericEnv() throws IOException {
            Path config = write("validator: {}\n");

            assertThatThrownBy(() -> ConfigLoader.load(config, Map.of(ConfigLoader.ENV_PARALLELISM, "many")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("VALIDATA_PARALLELISM must be an integer, got: many");
        }
    }

    // --- Failures ---

    @Test
    void missingFile() {
        Path absent = tempDir.resolve("absent.yaml");

        assertThatThrownBy(() -> ConfigLoader.load(absent, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessage("Configuration file not found: " + absent);
    }

    @Test
    void malformedYaml() throws IOException {
        Path config = write("validator: [unclosed");

        assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageStartingWith("Failed to parse YAML configuration");
    }

    @ParameterizedTest
    @ValueSource(strings = {"parallelism: lots", "max-depth: 2.5", "parallelism: \"4\""})
    @DisplayName("non-integer numbers are rejected")
    void nonIntegers(String line) throws IOException {
        Path config = write("validator:\n  " + line + "\n");

        assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("must be an integer");
    }

    @ParameterizedTest
    @ValueSource(strings = {"parallelism: 0", "max-depth: -1"})
    @DisplayName("out-of-range values are rejected")
    void outOfRange(String line) throws IOException {
        Path config = write("validator:\n  " + line + "\n");

        assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageStartingWith("Invalid configuration in ");
    }

    @Test
    @DisplayName("a missing messages directory is a configuration error")
    void missingMessagesDirectory() throws IOException {
        Path config = write("validator:\n  messages: " + tempDir.resolve("nope") + "\n");

        assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Message directory not found");
    }
}
