package com.retailops.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreAvailability(
        @JsonProperty("store_id") String storeId,
        @JsonProperty("store_name") String storeName,
        String city,
        String state,
        @JsonProperty("distance_miles") double distanceMiles,
        @JsonProperty("on_hand") int onHand,
        int reserved,
        int available,
        @JsonProperty("last_updated") String lastUpdated
) {}
