package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A public key registered for one application of a user. */
public final class Key {

    @JsonProperty("app_id")
    private String appId = "";

    @JsonProperty("format")
    private String format = "";

    @JsonProperty("key")
    private byte[] key;

    @JsonProperty("creation_time")
    private Timestamp creationTime;

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public byte[] getKey() {
        return key;
    }

    public void setKey(byte[] key) {
        this.key = key;
    }

    public Timestamp getCreationTime() {
        return creationTime;
    }

    public void setCreationTime(Timestamp creationTime) {
        this.creationTime = creationTime;
    }

    @Override
    public String toString() {
        return "Key[appId=" + appId + ", format=" + format + ", creationTime=" + creationTime + "]";
    }
}
