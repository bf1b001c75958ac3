package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Pages through committed entry updates, starting at {@code start_commitment_timestamp}. */
public final class ListUpdateRequest implements RequestMessage {

    @JsonProperty("start_commitment_timestamp")
    private long startCommitmentTimestamp;

    @JsonProperty("page_size")
    private int pageSize;

    public long getStartCommitmentTimestamp() {
        return startCommitmentTimestamp;
    }

    public void setStartCommitmentTimestamp(long startCommitmentTimestamp) {
        this.startCommitmentTimestamp = startCommitmentTimestamp;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public String toString() {
        return "ListUpdateRequest[startCommitmentTimestamp=" + Long.toUnsignedString(startCommitmentTimestamp)
                + ", pageSize=" + pageSize + "]";
    }
}
