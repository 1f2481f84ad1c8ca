package com.retailops.backend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Ticket(
        @JsonProperty("ticket_id") @JsonAlias("id") String id,
        @JsonProperty("store_id") String storeId,
        String category,
        String severity,
        String status,
        @JsonProperty("opened_date") String openedDate
) {}
