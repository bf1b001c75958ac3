package io.keyserver.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Config validation")
class ConfigValidationTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws Exception {
        Path configFile = tempDir.resolve("test-config.yaml");
        Files.writeString(configFile, yaml);
        return configFile;
    }

    private static ServerConfig load(Path path) {
        return ConfigLoader.load(path, Map.<String, String>of()::get);
    }

    @Test
    @DisplayName("port above 65535 is rejected")
    void portTooLarge() throws Exception {
        Path config = writeConfig("""
                server:
                  port: 65536
                """);

        assertThatThrownBy(() -> load(config))
                .isInstanceOfSatisfying(ConfigLoadException.class, e -> assertThat(e.key()).hasValue("server.port"))
                .hasMessageContaining("65536");
    }

    @Test
    @DisplayName("negative port is rejected")
    void negativePort() throws Exception {
        Path config = writeConfig("""
                server:
                  port: -1
                """);

        assertThatThrownBy(() -> load(config)).isInstanceOf(ConfigLoadException.class);
    }

    @Test
    @DisplayName("port 0 selects an ephemeral port")
    void ephemeralPort() throws Exception {
        Path config = writeConfig("""
                server:
                  port: 0
                """);

        assertThat(load(config).port()).isZero();
    }

    @Test
    @DisplayName("non-integer port is rejected")
    void textPort() throws Exception {
        Path config = writeConfig("""
                server:
                  port: http
                """);

        assertThatThrownBy(() -> load(config))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.port")
                .hasMessageContaining("integer");
    }

    @Test
    @DisplayName("zero body limit is rejected")
    void zeroBodyLimit() throws Exception {
        Path config = writeConfig("""
                server:
                  max-body-bytes: 0
                """);

        assertThatThrownBy(() -> load(config))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.max-body-bytes");
    }

    @Test
    @DisplayName("unknown logging format is rejected")
    void loggingFormat() throws Exception {
        Path config = writeConfig("""
                logging:
                  format: xml
                """);

        assertThatThrownBy(() -> load(config))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("logging.format")
                .hasMessageContaining("xml");
    }

    @Test
    @DisplayName("relative health path is rejected while health is enabled")
    void relativeHealthPath() throws Exception {
        Path config = writeConfig("""
                health:
                  path: health
                """);

        assertThatThrownBy(() -> load(config))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("health.path");
    }

    @Test
    @DisplayName("blank host is rejected")
    void blankHost() throws Exception {
        Path config = writeConfig("""
                server:
                  host: ""
                """);

        assertThatThrownBy(() -> load(config))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.host");
    }

    @Test
    @DisplayName("unknown logging level is rejected")
    void loggingLevel() throws Exception {
        Path config = writeConfig("""
                logging:
                  level: LOUD
                """);

        assertThatThrownBy(() -> load(config))
                .isInstanceOfSatisfying(ConfigLoadException.class, e -> assertThat(e.key()).hasValue("logging.level"))
                .hasMessageContaining("LOUD");
    }

    @Test
    @DisplayName("logging level is case-insensitive")
    void loggingLevelCase() throws Exception {
        Path config = writeConfig("""
                logging:
                  level: warn
                """);

        assertThat(load(config).loggingLevel()).isEqualTo("warn");
    }

    @Test
    @DisplayName("parse failures carry no key")
    void parseFailureHasNoKey() throws Exception {
        Path config = writeConfig("server: [unclosed");

        assertThatThrownBy(() -> load(config))
                .isInstanceOfSatisfying(ConfigLoadException.class, e -> assertThat(e.key()).isEmpty());
    }
}
