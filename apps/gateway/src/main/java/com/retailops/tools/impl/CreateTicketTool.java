package com.retailops.tools.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.auth.Role;
import com.retailops.backend.RetailCoreClient;
import com.retailops.backend.dto.Ticket;
import com.retailops.backend.dto.TicketCommand;
import com.retailops.tools.ActionRequest;
import com.retailops.tools.GatewayToolComponent;
import com.retailops.tools.WriteTool;
import com.retailops.tools.support.ToolArgs;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@GatewayToolComponent
@RequiredArgsConstructor
public class CreateTicketTool implements WriteTool {

    private final RetailCoreClient retailCore;
    private final ObjectMapper mapper;

    @Override
    public String name() {
        return "create_ticket";
    }

    @Override
    public String description() {
        return "Open a support ticket for a store. Returns a preview first; "
                + "call again with the confirmation_token to open it.";
    }

    @Override
    public Set<Role> allowedRoles() {
        return EnumSet.of(Role.SUPPORT);
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "category", Map.of("type", "string", "minLength", 1, "description", "e.g. 'POS', 'Inventory'"),
                        "severity", Map.of("type", "string", "minLength", 1, "description", "e.g. 'low', 'high'"),
                        "store_id", Map.of("type", "string", "minLength", 1),
                        "description", Map.of("type", "string", "minLength", 1)
                ),
                "required", List.of("category", "severity", "store_id", "description")
        );
    }

    @Override
    public String describeEffect(Map<String, Object> args) {
        return "Open a " + ToolArgs.str(args, "severity") + " " + ToolArgs.str(args, "category")
                + " ticket for store " + ToolArgs.str(args, "store_id") + ": "
                + ToolArgs.truncate(ToolArgs.str(args, "description"), 120);
    }

    @Override
    public WriteOutcome execute(ActionRequest request, String idempotencyKey) {
        Map<String, Object> args = request.arguments();
        TicketCommand command = new TicketCommand(
                ToolArgs.str(args, "store_id"),
                ToolArgs.str(args, "category"),
                ToolArgs.str(args, "severity"),
                ToolArgs.str(args, "description"));
        Ticket ticket = retailCore.createTicket(command, request.role().role(), idempotencyKey);
        return new WriteOutcome("created", ticket.id(),
                mapper.convertValue(ticket, new TypeReference<Map<String, Object>>() {}));
    }
}
