package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Pages through signed epoch heads starting at {@code start_epoch}. */
public final class ListSehRequest implements RequestMessage {

    @JsonProperty("start_epoch")
    private long startEpoch;

    @JsonProperty("page_size")
    private int pageSize;

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
        return "ListSehRequest[startEpoch=" + Long.toUnsignedString(startEpoch) + ", pageSize=" + pageSize + "]";
    }
}
