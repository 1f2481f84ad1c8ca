package com.retailops.tools;

import com.retailops.auth.RoleContext;

import java.util.Map;

/**
 * A normalized tool call: control keys removed from {@code arguments}, role resolved.
 */
public record ActionRequest(
        String tool,
        RoleContext role,
        Map<String, Object> arguments,
        String confirmationToken,
        String idempotencyKey
) {
    public ActionRequest {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public boolean hasConfirmationToken() {
        return confirmationToken != null && !confirmationToken.isBlank();
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }
}
