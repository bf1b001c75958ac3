package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One page of serialized committed entry updates; {@code next_start} is zero on the last page. */
public record ListUpdateResponse(@JsonProperty("updates") List<byte[]> updates, @JsonProperty("next_start") long nextStart) {

    public ListUpdateResponse {
        updates = updates == null ? List.of() : List.copyOf(updates);
    }
}
