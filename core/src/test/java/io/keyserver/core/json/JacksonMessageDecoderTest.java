package io.keyserver.core.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.keyserver.core.error.BindingException;
import io.keyserver.core.error.MessageDecodeException;
import io.keyserver.core.model.GetEntryRequest;
import io.keyserver.core.model.Timestamp;
import io.keyserver.core.model.UpdateEntryRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JacksonMessageDecoder")
class JacksonMessageDecoderTest {

    private final JacksonMessageDecoder decoder = new JacksonMessageDecoder();

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("decodes a signed key with a structured creation time")
    void signedKey() {
        String key = Base64.getEncoder().encodeToString(new byte[] {1, 2, 3});
        UpdateEntryRequest message = new UpdateEntryRequest();

        decoder.decode(
                bytes("{\"signed_key\": {\"key\": {\"app_id\": \"gmail\", \"key\": \"" + key
                        + "\", \"creation_time\": {\"seconds\": 1431993516, \"nanos\": 7}}}}"),
                message);

        assertThat(message.getSignedKey().getKey().getAppId()).isEqualTo("gmail");
        assertThat(message.getSignedKey().getKey().getKey()).containsExactly(1, 2, 3);
        assertThat(message.getSignedKey().getKey().getCreationTime()).isEqualTo(new Timestamp(1431993516L, 7));
    }

    @Test
    @DisplayName("body fields overwrite values already on the message")
    void overwritesExistingFields() {
        GetEntryRequest message = new GetEntryRequest();
        message.setUserId("alice@example.com");
        message.setEpoch(3);

        decoder.decode(bytes("{\"epoch\": 9}"), message);

        assertThat(message.getUserId()).isEqualTo("alice@example.com");
        assertThat(message.getEpoch()).isEqualTo(9);
    }

    @Test
    @DisplayName("unknown fields are ignored")
    void unknownFieldsIgnored() {
        GetEntryRequest message = new GetEntryRequest();

        decoder.decode(bytes("{\"app_id\": \"gmail\", \"color\": \"blue\"}"), message);

        assertThat(message.getAppId()).isEqualTo("gmail");
    }

    @Test
    @DisplayName("malformed JSON is a decode failure")
    void malformed() {
        assertThatThrownBy(() -> decoder.decode(bytes("{\"app_id\": "), new GetEntryRequest()))
                .isInstanceOfSatisfying(MessageDecodeException.class, e -> assertThat(e.stage())
                        .isEqualTo(BindingException.Stage.DECODE))
                .hasMessageContaining("GetEntryRequest");
    }

    @Test
    @DisplayName("trailing tokens are rejected")
    void trailingTokens() {
        assertThatThrownBy(() -> decoder.decode(bytes("{} {}"), new GetEntryRequest()))
                .isInstanceOf(MessageDecodeException.class);
    }

    @Test
    @DisplayName("an RFC3339 string where a timestamp object is expected is rejected")
    void stringTimestampRejected() {
        assertThatThrownBy(() -> decoder.decode(
                        bytes("{\"signed_key\": {\"key\": {\"creation_time\": \"2015-05-18T23:58:36Z\"}}}"),
                        new UpdateEntryRequest()))
                .isInstanceOf(MessageDecodeException.class);
    }
}
