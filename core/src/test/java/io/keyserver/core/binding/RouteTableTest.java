package io.keyserver.core.binding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.keyserver.core.model.GetEntryRequest;
import io.keyserver.core.model.HttpMethod;
import io.keyserver.core.spi.KeyServer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RouteTable")
class RouteTableTest {

    private static RouteBinding<KeyServer, GetEntryRequest, Object> binding(
            String name, String pattern, HttpMethod method) {
        return new RouteBinding<>(
                name, pattern, method, GetEntryRequest::new, ParameterParser.none(), (b, c, m) -> null, List.of());
    }

    @Test
    @DisplayName("same path with different methods is allowed")
    void differentMethods() {
        RouteTable<KeyServer> table = RouteTable.<KeyServer>builder()
                .add(binding("A", "/v2/users/{user_id}", HttpMethod.GET))
                .add(binding("B", "/v2/users/{user_id}", HttpMethod.PUT))
                .build();

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.find("/v2/users/{user_id}", HttpMethod.PUT))
                .hasValueSatisfying(b -> assertThat(b.name()).isEqualTo("B"));
    }

    @Test
    @DisplayName("duplicate method and path is rejected at build time")
    void duplicateRejected() {
        RouteTable.Builder<KeyServer> builder =
                RouteTable.<KeyServer>builder().add(binding("A", "/v2/seh", HttpMethod.GET));

        assertThatThrownBy(() -> builder.add(binding("B", "/v2/seh", HttpMethod.GET)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("GET /v2/seh")
                .hasMessageContaining("A");
    }

    @Test
    @DisplayName("bindings keep registration order and are read-only")
    void readOnly() {
        RouteTable<KeyServer> table = RouteTable.<KeyServer>builder()
                .add(binding("first", "/b", HttpMethod.GET))
                .add(binding("second", "/a", HttpMethod.GET))
                .build();

        assertThat(table.bindings()).extracting(RouteBinding::name).containsExactly("first", "second");
        assertThatThrownBy(() -> table.bindings().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("path pattern must be absolute")
    void relativePattern() {
        assertThatThrownBy(() -> binding("bad", "v2/seh", HttpMethod.GET))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
