package com.retailops.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.auth.Role;
import com.retailops.backend.RetailCoreClient;
import com.retailops.backend.dto.Transfer;
import com.retailops.backend.dto.TransferCommand;
import com.retailops.catalog.SkuCatalog;
import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
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
 * Move stock between stores. Merchandising only.
 */
@GatewayToolComponent
@RequiredArgsConstructor
public class CreateTransferTool implements WriteTool {

    private final RetailCoreClient retailCore;
    private final SkuCatalog catalog;
    private final GatewayProperties props;
    private final ObjectMapper mapper;

    @Override
    public String name() {
        return "create_transfer";
    }

    @Override
    public String description() {
        return "Create a stock transfer of a SKU from one store to another. Returns a preview first; "
                + "call again with the confirmation_token to create it.";
    }

    @Override
    public Set<Role> allowedRoles() {
        return EnumSet.of(Role.MERCH);
    }

    @Override
    public Map<String, Object> parametersSchema() {
        GatewayProperties.Guardrails g = props.getGuardrails();
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "sku", Map.of("type", "string", "minLength", 1),
                        "from_store", Map.of("type", "string", "minLength", 1),
                        "to_store", Map.of("type", "string", "minLength", 1),
                        "qty", Map.of("type", "integer", "minimum", g.getMinQty(), "maximum", g.getMaxQty()),
                        "reason", Map.of("type", "string", "description", "Optional note for the receiving store")
                ),
                "required", List.of("sku", "from_store", "to_store", "qty")
        );
    }

    @Override
    public void validate(Map<String, Object> args) {
        if (ToolArgs.str(args, "from_store").equalsIgnoreCase(ToolArgs.str(args, "to_store"))) {
            throw new GatewayException(ErrorKind.INVALID_ARGUMENTS,
                    "create_transfer: from_store and to_store must differ.");
        }
        catalog.requireKnown(ToolArgs.str(args, "sku"));
    }

    @Override
    public String describeEffect(Map<String, Object> args) {
        int qty = ToolArgs.intOr(args, "qty", 0);
        String reason = ToolArgs.str(args, "reason");
        return "Transfer " + qty + (qty == 1 ? " unit" : " units") + " of " + ToolArgs.str(args, "sku")
                + " from store " + ToolArgs.str(args, "from_store") + " to store " + ToolArgs.str(args, "to_store")
                + (reason == null || reason.isEmpty() ? "." : " (reason: " + ToolArgs.truncate(reason, 80) + ").");
    }

    @Override
    public WriteOutcome execute(ActionRequest request, String idempotencyKey) {
        Map<String, Object> args = request.arguments();
        TransferCommand command = new TransferCommand(
                ToolArgs.str(args, "sku"),
                ToolArgs.str(args, "from_store"),
                ToolArgs.str(args, "to_store"),
                ToolArgs.intOr(args, "qty", 0),
                ToolArgs.str(args, "reason"));
        Transfer transfer = retailCore.createTransfer(command, request.role().role(), idempotencyKey);
        return new WriteOutcome("created", transfer.id(),
                mapper.convertValue(transfer, new TypeReference<Map<String, Object>>() {}));
    }

    @Override
    public String rejectionFallback(Map<String, Object> args) {
        return "Check stock at " + ToolArgs.str(args, "from_store")
                + " with inventory_lookup and retry with a smaller qty or another source store.";
    }
}
