package com.retailops.backend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Transfer(
        @JsonProperty("transfer_id") @JsonAlias("id") String id,
        @JsonProperty("from_store") String fromStore,
        @JsonProperty("to_store") String toStore,
        String sku,
        int qty,
        String status,
        @JsonProperty("inbound_status") String inboundStatus,
        @JsonProperty("expected_date") String expectedDate
) {}
