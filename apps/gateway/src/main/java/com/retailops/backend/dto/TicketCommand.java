package com.retailops.backend.dto;

public record TicketCommand(String storeId, String category, String severity, String description) {}
