package com.retailops.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InventoryAvailability(
        String sku,
        @JsonProperty("query_store_id") String queryStoreId,
        @JsonProperty("radius_miles") double radiusMiles,
        List<StoreAvailability> stores,
        @JsonProperty("upstream_status") int upstreamStatus
) {
    public InventoryAvailability {
        stores = stores == null ? List.of() : List.copyOf(stores);
    }

    public InventoryAvailability withUpstreamStatus(int status) {
        return new InventoryAvailability(sku, queryStoreId, radiusMiles, stores, status);
    }
}
