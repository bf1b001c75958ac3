package io.keyserver.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    private static ServerConfig loadWithoutEnv(Path path) {
        return ConfigLoader.load(path, Map.<String, String>of()::get);
    }

    @Nested
    @DisplayName("YAML loading")
    class YamlLoading {

        @Test
        @DisplayName("minimal config fills every other key with its default")
        void minimalConfig() throws Exception {
            ServerConfig config = loadWithoutEnv(resource("config/minimal-config.yaml"));

            assertThat(config.port()).isEqualTo(9090);
            assertThat(config.host()).isEqualTo("0.0.0.0");
            assertThat(config.maxBodyBytes()).isEqualTo(1_048_576);
            assertThat(config.healthEnabled()).isTrue();
            assertThat(config.healthPath()).isEqualTo("/health");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }

        @Test
        @DisplayName("full config sets every key")
        void fullConfig() throws Exception {
            ServerConfig config = loadWithoutEnv(resource("config/full-config.yaml"));

            assertThat(config)
                    .isEqualTo(ServerConfig.builder()
                            .host("127.0.0.1")
                            .port(8443)
                            .maxBodyBytes(65536)
                            .healthEnabled(false)
                            .healthPath("/healthz")
                            .loggingFormat("text")
                            .loggingLevel("DEBUG")
                            .build());
        }

        @Test
        @DisplayName("empty file yields the defaults")
        void emptyFile() throws Exception {
            Path file = tempDir.resolve("empty.yaml");
            Files.writeString(file, "");

            assertThat(loadWithoutEnv(file)).isEqualTo(ServerConfig.builder().build());
        }

        @Test
        @DisplayName("missing file is reported with a hint")
        void missingFile() {
            assertThatThrownBy(() -> loadWithoutEnv(tempDir.resolve("nope.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("unparseable YAML is reported")
        void invalidYaml() throws Exception {
            Path file = tempDir.resolve("bad.yaml");
            Files.writeString(file, "this is: not: valid: yaml: {{{}}}");

            assertThatThrownBy(() -> loadWithoutEnv(file))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        @DisplayName("a scalar document is not a configuration")
        void scalarRoot() throws Exception {
            Path file = tempDir.resolve("scalar.yaml");
            Files.writeString(file, "just a string\n");

            assertThatThrownBy(() -> loadWithoutEnv(file))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("mapping");
        }
    }

    @Nested
    @DisplayName("resolveConfigPath")
    class ResolveConfigPath {

        @Test
        void defaultsToWorkingDirectoryFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("keyserver-rest.yaml"));
        }

        @Test
        void explicitPath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/keyserver/rest.yaml"}))
                    .isEqualTo(Path.of("/etc/keyserver/rest.yaml"));
        }

        @Test
        void missingArgument() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config");
        }
    }
}
