package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Looks up a user's entry at an epoch. {@code epoch} is an unsigned 64-bit
 * value; zero means "latest".
 */
public final class GetEntryRequest implements RequestMessage {

    @JsonProperty("user_id")
    private String userId = "";

    @JsonProperty("epoch")
    private long epoch;

    @JsonProperty("app_id")
    private String appId = "";

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public long getEpoch() {
        return epoch;
    }

    public void setEpoch(long epoch) {
        this.epoch = epoch;
    }

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    @Override
    public String toString() {
        return "GetEntryRequest[userId=" + userId + ", epoch=" + Long.toUnsignedString(epoch) + ", appId=" + appId
                + "]";
    }
}
