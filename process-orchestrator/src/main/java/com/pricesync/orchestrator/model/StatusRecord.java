package com.pricesync.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last-run record as stored on disk, one file per process.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusRecord {

    @JsonProperty("process_name")
    private String processName;

    /** ISO-8601, UTC */
    @JsonProperty("timestamp_utc")
    private String timestampUtc;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("message")
    private String message;
}
