package com.retailops.tools;

import com.retailops.auth.Role;

import java.util.Map;
import java.util.Set;

public record ToolDefinition(
        String name,
        String description,
        ToolClassification classification,
        Set<Role> allowedRoles,
        Map<String, Object> inputSchema
) {
    public boolean isWrite() {
        return classification == ToolClassification.WRITE;
    }
}
