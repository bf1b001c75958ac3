package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One page of serialized tree steps; {@code next_start} is zero on the last page. */
public record ListStepsResponse(@JsonProperty("steps") List<byte[]> steps, @JsonProperty("next_start") long nextStart) {

    public ListStepsResponse {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
