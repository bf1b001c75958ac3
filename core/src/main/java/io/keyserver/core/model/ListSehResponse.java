package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One page of serialized signed epoch heads; {@code next_start} is zero on the last page. */
public record ListSehResponse(@JsonProperty("heads") List<byte[]> heads, @JsonProperty("next_start") long nextStart) {

    public ListSehResponse {
        heads = heads == null ? List.of() : List.copyOf(heads);
    }
}
