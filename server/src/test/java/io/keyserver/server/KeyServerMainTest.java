package io.keyserver.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.keyserver.server.config.ConfigLoadException;
import io.keyserver.server.http.RestServer;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("KeyServerMain")
class KeyServerMainTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("run starts a server on the configured listener")
    void runStartsServer() throws Exception {
        Path config = tempDir.resolve("keyserver-rest.yaml");
        Files.writeString(config, """
                server:
                  host: 127.0.0.1
                  port: 0
                logging:
                  format: text
                """);

        RestServer server = KeyServerMain.run(new String[] {"--config", config.toString()});
        try {
            assertThat(server.port()).isPositive();
            assertThat(server.routes().size()).isEqualTo(8);
        } finally {
            server.stop();
        }
    }

    @Test
    @DisplayName("run propagates configuration failures to main")
    void runFailsOnBadConfig() {
        assertThatThrownBy(() -> KeyServerMain.run(
                        new String[] {"--config", tempDir.resolve("absent.yaml").toString()}))
                .isInstanceOf(ConfigLoadException.class);
    }

    @Test
    @DisplayName("validation failures are described with their key")
    void describeNamesKey() {
        ConfigLoadException e = ConfigLoadException.invalidValue("server.port", "must be between 0 and 65535", 70000);

        assertThat(KeyServerMain.describe(e))
                .startsWith("invalid configuration key server.port: ")
                .contains("70000");
    }

    @Test
    @DisplayName("other failures keep their message")
    void describeOther() {
        assertThat(KeyServerMain.describe(new IllegalArgumentException("--config requires a file path argument")))
                .isEqualTo("--config requires a file path argument");
    }
}
