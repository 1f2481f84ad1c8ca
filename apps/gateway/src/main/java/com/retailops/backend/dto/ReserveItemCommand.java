package com.retailops.backend.dto;

public record ReserveItemCommand(String sku, String storeId, int qty) {}
