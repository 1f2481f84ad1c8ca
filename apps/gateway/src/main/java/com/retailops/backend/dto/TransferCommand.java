package com.retailops.backend.dto;

public record TransferCommand(String sku, String fromStore, String toStore, int qty, String reason) {}
