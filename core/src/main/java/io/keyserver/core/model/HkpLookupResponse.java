package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HKP lookup result: the armored key material and the content type it should be
 * served with.
 */
public record HkpLookupResponse(
        @JsonProperty("content_type") String contentType, @JsonProperty("body") String body) {}
