package com.retailops.tools;

import com.retailops.auth.Role;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public interface GatewayTool {
    String name();

    String description();

    ToolClassification classification();

    /** 默认所有角色可用；写工具必须覆盖 */
    default Set<Role> allowedRoles() {
        return EnumSet.allOf(Role.class);
    }

    /** JSON-schema 风格的参数描述，顶层 type 必须是 object */
    Map<String, Object> parametersSchema();

    /**
     * Tool-specific guardrails that go beyond the schema (known SKU, distinct stores...).
     * Runs after schema validation and before any preview or backend call.
     */
    default void validate(Map<String, Object> args) {
    }
}
