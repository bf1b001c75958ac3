package io.keyserver.server.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.keyserver.server.config.ConfigLoadException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Full startup through {@link RestServer#start(String[])}. */
@DisplayName("RestServer startup")
class RestServerStartupTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws Exception {
        Path configFile = tempDir.resolve("keyserver-rest.yaml");
        Files.writeString(configFile, yaml);
        return configFile;
    }

    @Test
    @DisplayName("serves every route against the unimplemented backend")
    void startsWithUnimplementedBackend() throws Exception {
        Path config = writeConfig("""
                server:
                  host: 127.0.0.1
                  port: 0
                health:
                  path: /live
                logging:
                  format: text
                  level: INFO
                """);

        RestServer server = RestServer.start(new String[] {"--config", config.toString()});
        try {
            assertThat(server.routes().size()).isEqualTo(8);
            assertThat(server.config().healthPath()).isEqualTo("/live");

            HttpClient client = HttpClient.newHttpClient();
            HttpResponse<String> bound = client.send(
                    HttpRequest.newBuilder()
                            .uri(URI.create("http://127.0.0.1:" + server.port() + "/v2/steps?page_size=5"))
                            .GET()
                            .build(),
                    HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> health = client.send(
                    HttpRequest.newBuilder()
                            .uri(URI.create("http://127.0.0.1:" + server.port() + "/live"))
                            .GET()
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(bound.statusCode()).isEqualTo(501);
            assertThat(new ObjectMapper().readTree(bound.body()).get("type").asText())
                    .isEqualTo("urn:keyserver:rest:backend:unimplemented");
            assertThat(health.statusCode()).isEqualTo(200);
            assertThat(new ObjectMapper().readTree(health.body()).get("routes").asInt()).isEqualTo(8);
        } finally {
            server.stop();
        }
    }

    @Test
    @DisplayName("invalid configuration fails startup")
    void invalidConfig() throws Exception {
        Path config = writeConfig("""
                server:
                  port: 99999
                """);

        assertThatThrownBy(() -> RestServer.start(new String[] {"--config", config.toString()}))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("server.port");
    }

    @Test
    @DisplayName("missing configuration file fails startup")
    void missingConfig() {
        assertThatThrownBy(() -> RestServer.start(
                        new String[] {"--config", tempDir.resolve("absent.yaml").toString()}))
                .isInstanceOf(ConfigLoadException.class);
    }
}
