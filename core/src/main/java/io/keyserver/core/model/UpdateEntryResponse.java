package io.keyserver.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Result of an update: the entry as it was committed. */
public record UpdateEntryResponse(@JsonProperty("proof") GetEntryResponse proof) {}
