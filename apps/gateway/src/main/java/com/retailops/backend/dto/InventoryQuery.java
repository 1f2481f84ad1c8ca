package com.retailops.backend.dto;

public record InventoryQuery(String sku, String storeId, double radiusMiles) {}
