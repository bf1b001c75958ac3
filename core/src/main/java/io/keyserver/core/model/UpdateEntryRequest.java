package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Publishes a new signed key for a user. The key's {@code creation_time}
 * arrives on the wire as an RFC3339 string and is rewritten to a
 * {@link Timestamp} object before decoding.
 */
public final class UpdateEntryRequest implements RequestMessage {

    @JsonProperty("user_id")
    private String userId = "";

    @JsonProperty("signed_key")
    private SignedKey signedKey;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public SignedKey getSignedKey() {
        return signedKey;
    }

    public void setSignedKey(SignedKey signedKey) {
        this.signedKey = signedKey;
    }

    @Override
    public String toString() {
        return "UpdateEntryRequest[userId=" + userId + ", signedKey=" + signedKey + "]";
    }
}
