package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outbound authentication scheme for scheduled pulls. */
public enum AuthType {
    @JsonProperty("none")
    NONE,
    @JsonProperty("api_key")
    API_KEY,
    @JsonProperty("bearer")
    BEARER
}
