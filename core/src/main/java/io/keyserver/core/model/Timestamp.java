package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Point in time as whole seconds since the Unix epoch plus a non-negative
 * nanosecond remainder. This is the decoded form of a rewritten RFC3339 value.
 */
public final class Timestamp {

    @JsonProperty("seconds")
    private long seconds;

    @JsonProperty("nanos")
    private int nanos;

    public Timestamp() {}

    public Timestamp(long seconds, int nanos) {
        this.seconds = seconds;
        this.nanos = nanos;
    }

    public static Timestamp of(Instant instant) {
        return new Timestamp(instant.getEpochSecond(), instant.getNano());
    }

    public long getSeconds() {
        return seconds;
    }

    public void setSeconds(long seconds) {
        this.seconds = seconds;
    }

    public int getNanos() {
        return nanos;
    }

    public void setNanos(int nanos) {
        this.nanos = nanos;
    }

    @JsonIgnore
    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds, nanos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Timestamp that)) return false;
        return seconds == that.seconds && nanos == that.nanos;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(seconds) + nanos;
    }

    @Override
    public String toString() {
        return "Timestamp[seconds=" + seconds + ", nanos=" + nanos + "]";
    }
}
