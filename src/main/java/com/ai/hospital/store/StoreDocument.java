package com.ai.hospital.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top-level JSON layout: {@code {"appointments": {...}, "counter": n, "last_updated": "..."}}.
 * {@code revision} is bumped on every commit; documents written without it read as 0.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreDocument {

    private Map<String, StoredAppointment> appointments = new LinkedHashMap<>();

    private long counter;

    @JsonProperty("last_updated")
    private String lastUpdated;

    private long revision;
}
