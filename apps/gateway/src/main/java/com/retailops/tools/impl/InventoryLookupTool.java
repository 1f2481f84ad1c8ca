package com.retailops.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.backend.RetailCoreClient;
import com.retailops.backend.dto.InventoryAvailability;
import com.retailops.backend.dto.InventoryQuery;
import com.retailops.catalog.SkuCatalog;
import com.retailops.tools.ActionRequest;
import com.retailops.tools.GatewayToolComponent;
import com.retailops.tools.ReadTool;
import com.retailops.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

@GatewayToolComponent
@RequiredArgsConstructor
public class InventoryLookupTool implements ReadTool {

    static final double DEFAULT_RADIUS_MILES = 25.0;

    private final RetailCoreClient retailCore;
    private final SkuCatalog catalog;
    private final ObjectMapper mapper;

    @Override
    public String name() {
        return "inventory_lookup";
    }

    @Override
    public String description() {
        return "Look up on-hand and available units of a SKU at a store and at nearby stores within a radius.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "sku", Map.of("type", "string", "minLength", 1),
                        "store_id", Map.of("type", "string", "minLength", 1, "description", "Origin store, e.g. 'ST002'"),
                        "radius_miles", Map.of("type", "number", "exclusiveMinimum", 0, "default", DEFAULT_RADIUS_MILES)
                ),
                "required", List.of("sku", "store_id")
        );
    }

    @Override
    public void validate(Map<String, Object> args) {
        catalog.requireKnown(ToolArgs.str(args, "sku"));
    }

    @Override
    public Map<String, Object> read(ActionRequest request) {
        Map<String, Object> args = request.arguments();
        InventoryQuery query = new InventoryQuery(
                ToolArgs.str(args, "sku"),
                ToolArgs.str(args, "store_id"),
                ToolArgs.doubleOr(args, "radius_miles", DEFAULT_RADIUS_MILES));
        InventoryAvailability availability = retailCore.lookupInventory(query, request.role().role());
        return mapper.convertValue(availability, new TypeReference<Map<String, Object>>() {});
    }
}
