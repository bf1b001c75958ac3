package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Pages through the history of a user's entry starting at {@code start_epoch}. */
public final class ListEntryHistoryRequest implements RequestMessage {

    @JsonProperty("user_id")
    private String userId = "";

    @JsonProperty("start_epoch")
    private long startEpoch;

    @JsonProperty("page_size")
    private int pageSize;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public long getStartEpoch() {
        return startEpoch;
    }

    public void setStartEpoch(long startEpoch) {
        this.startEpoch = startEpoch;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public String toString() {
        return "ListEntryHistoryRequest[userId=" + userId + ", startEpoch=" + Long.toUnsignedString(startEpoch)
                + ", pageSize=" + pageSize + "]";
    }
}
