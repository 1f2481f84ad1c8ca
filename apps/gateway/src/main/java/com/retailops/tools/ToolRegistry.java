package com.retailops.tools;

import com.retailops.auth.Role;
import com.retailops.auth.RoleContext;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Static tool name -> definition mapping. Written only in the constructor, read-only afterwards,
 * so concurrent lookups need no locking.
 */
@Component
@Slf4j
public class ToolRegistry {
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private final Map<String, GatewayTool> tools = new LinkedHashMap<>();
    private final Map<String, GatewayTool> lookup = new LinkedHashMap<>();
    private final Map<String, ToolDefinition> definitions = new LinkedHashMap<>();

    public ToolRegistry(List<GatewayTool> toolBeans) {
        log.debug("Initializing ToolRegistry with {} tool bean(s)", toolBeans.size());
        for (GatewayTool tool : toolBeans) {
            ToolDefinition def = define(tool);
            String lower = def.name().toLowerCase(Locale.ROOT);
            if (lookup.containsKey(lower)) {
                // 大小写不同的重名会让 lookup 互相覆盖
                throw new IllegalStateException("Duplicate tool name (case-insensitive): '" + def.name() + "'");
            }
            tools.put(def.name(), tool);
            lookup.put(def.name(), tool);
            lookup.put(lower, tool);
            definitions.put(def.name(), def);
            log.debug("Registered tool '{}' ({}, roles={})", def.name(), def.classification(), def.allowedRoles());
        }
        log.info("[TOOLS] registered {}", definitions.keySet());
    }

    /** 启动期校验：名称、schema、角色集合、读写分类与实现接口一致 */
    private static ToolDefinition define(GatewayTool tool) {
        String name = Objects.requireNonNull(tool.name(), "tool.name() must not be null").trim();
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid tool name '" + name + "', expected " + NAME_PATTERN.pattern());
        }

        Map<String, Object> schema = tool.parametersSchema();
        if (schema == null || !"object".equals(schema.get("type"))) {
            throw new IllegalStateException("Tool '" + name + "' must declare an object parameter schema");
        }

        Set<Role> roles = tool.allowedRoles();
        if (roles == null || roles.isEmpty()) {
            throw new IllegalStateException("Tool '" + name + "' allows no role at all");
        }

        ToolClassification classification = tool.classification();
        boolean consistent = classification == ToolClassification.WRITE
                ? tool instanceof WriteTool
                : tool instanceof ReadTool;
        if (!consistent) {
            throw new IllegalStateException("Tool '" + name + "' is classified " + classification
                    + " but implements " + tool.getClass().getSimpleName() + " without the matching interface");
        }

        return new ToolDefinition(name, tool.description(), classification,
                Collections.unmodifiableSet(EnumSet.copyOf(roles)), schema);
    }

    public Optional<GatewayTool> get(String name) {
        if (name == null) {
            log.debug("Tool lookup requested with null name");
            return Optional.empty();
        }
        GatewayTool tool = lookup.get(name);
        if (tool != null) {
            return Optional.of(tool);
        }
        GatewayTool normalized = lookup.get(name.trim().toLowerCase(Locale.ROOT));
        if (normalized != null) {
            log.debug("Resolved tool '{}' via case-insensitive match", name);
        } else {
            log.debug("Tool '{}' not found in registry", name);
        }
        return Optional.ofNullable(normalized);
    }

    public ToolDefinition lookup(String name) {
        GatewayTool tool = get(name).orElseThrow(() ->
                new GatewayException(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + name));
        return definitions.get(tool.name());
    }

    public void authorize(ToolDefinition definition, RoleContext role) {
        if (!definition.allowedRoles().contains(role.role())) {
            log.debug("[AUTHZ-DENY] tool={} role={}", definition.name(), role.role());
            List<String> allowed = definition.allowedRoles().stream().map(Role::wireName).toList();
            throw new GatewayException(ErrorKind.PERMISSION_DENIED,
                    definition.name() + " requires role " + String.join(" or ", allowed)
                            + "; caller role is " + role.role().wireName() + ".",
                    "Ask a " + String.join("/", allowed) + " user to run " + definition.name() + ".");
        }
    }

    public GatewayTool tool(String name) {
        return tools.get(lookup(name).name());
    }

    /** 对外目录：name / description / classification / roles / schema */
    public List<Map<String, Object>> catalog() {
        return definitions.values().stream().map(def -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", def.name());
            entry.put("description", def.description());
            entry.put("classification", def.classification().name());
            entry.put("allowed_roles", def.allowedRoles().stream().map(Role::wireName).toList());
            entry.put("parameters", def.inputSchema());
            return entry;
        }).toList();
    }
}
