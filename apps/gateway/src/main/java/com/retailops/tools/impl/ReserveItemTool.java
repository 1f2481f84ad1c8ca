package com.retailops.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.auth.Role;
import com.retailops.backend.RetailCoreClient;
import com.retailops.backend.dto.Reservation;
import com.retailops.backend.dto.ReserveItemCommand;
import com.retailops.catalog.SkuCatalog;
import com.retailops.config.GatewayProperties;
import com.retailops.tools.ActionRequest;
import com.retailops.tools.GatewayToolComponent;
import com.retailops.tools.WriteTool;
import com.retailops.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hold units of a SKU at a store for a customer. Associates only.
 */
@GatewayToolComponent
@RequiredArgsConstructor
public class ReserveItemTool implements WriteTool {

    private final RetailCoreClient retailCore;
    private final SkuCatalog catalog;
    private final GatewayProperties props;
    private final ObjectMapper mapper;

    @Override
    public String name() {
        return "reserve_item";
    }

    @Override
    public String description() {
        return "Reserve units of a SKU at a store (store hold). Returns a preview first; "
                + "call again with the confirmation_token to place the hold.";
    }

    @Override
    public Set<Role> allowedRoles() {
        return EnumSet.of(Role.ASSOCIATE);
    }

    @Override
    public Map<String, Object> parametersSchema() {
        GatewayProperties.Guardrails g = props.getGuardrails();
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "sku", Map.of("type", "string", "minLength", 1),
                        "store_id", Map.of("type", "string", "minLength", 1),
                        "qty", Map.of("type", "integer", "minimum", g.getMinQty(), "maximum", g.getMaxQty())
                ),
                "required", List.of("sku", "store_id", "qty")
        );
    }

    @Override
    public void validate(Map<String, Object> args) {
        catalog.requireKnown(ToolArgs.str(args, "sku"));
    }

    @Override
    public String describeEffect(Map<String, Object> args) {
        int qty = ToolArgs.intOr(args, "qty", 0);
        return "Reserve " + qty + (qty == 1 ? " unit" : " units") + " of " + ToolArgs.str(args, "sku")
                + " at store " + ToolArgs.str(args, "store_id") + ".";
    }

    @Override
    public WriteOutcome execute(ActionRequest request, String idempotencyKey) {
        Map<String, Object> args = request.arguments();
        ReserveItemCommand command = new ReserveItemCommand(
                ToolArgs.str(args, "sku"), ToolArgs.str(args, "store_id"), ToolArgs.intOr(args, "qty", 0));
        Reservation reservation = retailCore.reserveItem(command, request.role().role(), idempotencyKey);
        return new WriteOutcome("reserved", reservation.id(),
                mapper.convertValue(reservation, new TypeReference<Map<String, Object>>() {}));
    }

    @Override
    public String rejectionFallback(Map<String, Object> args) {
        return "Run inventory_lookup for " + ToolArgs.str(args, "sku") + " near " + ToolArgs.str(args, "store_id")
                + " with a larger radius_miles and reserve at a store that has stock.";
    }
}
