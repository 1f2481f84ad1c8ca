package com.retailops.backend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Reservation(
        @JsonProperty("reservation_id") @JsonAlias("id") String id,
        String sku,
        @JsonProperty("store_id") String storeId,
        int qty,
        String status,
        @JsonProperty("on_hand") Integer onHand,
        Integer reserved,
        @JsonProperty("last_updated") String lastUpdated
) {}
