package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user's entry at an epoch together with the serialized profile it commits to.
 *
 * @param epoch   epoch the entry was read at
 * @param entry   serialized entry
 * @param profile serialized profile, absent when the caller may not see it
 */
public record GetEntryResponse(
        @JsonProperty("epoch") long epoch,
        @JsonProperty("entry") byte[] entry,
        @JsonProperty("profile") byte[] profile) {}
