package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A {@link Key} together with the signature over it. Binary fields travel as base64. */
public final class SignedKey {

    @JsonProperty("key")
    private Key key;

    @JsonProperty("signature")
    private byte[] signature;

    public Key getKey() {
        return key;
    }

    public void setKey(Key key) {
        this.key = key;
    }

    public byte[] getSignature() {
        return signature;
    }

    public void setSignature(byte[] signature) {
        this.signature = signature;
    }

    @Override
    public String toString() {
        return "SignedKey[key=" + key + ", signature=" + (signature != null ? signature.length : 0) + " bytes]";
    }
}
