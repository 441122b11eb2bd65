package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How ingestion for a source is started. A source has exactly one. */
public enum TriggerMode {
    @JsonProperty("blob_trigger")
    BLOB_TRIGGER,
    @JsonProperty("scheduled_pull")
    SCHEDULED_PULL
}
