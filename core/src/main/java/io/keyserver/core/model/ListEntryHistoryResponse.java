package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One page of a user's entry history; {@code next_start} is zero on the last page. */
public record ListEntryHistoryResponse(
        @JsonProperty("values") List<GetEntryResponse> values, @JsonProperty("next_start") long nextStart) {

    public ListEntryHistoryResponse {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
