package com.retailops.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Wire shape of {@code POST /tools/call}. Role, token and idempotency key may also be
 * carried inside {@code arguments} for callers that can only set tool arguments.
 */
public record ToolCallRequest(
        String name,
        Map<String, Object> arguments,
        @JsonProperty("confirmation_token") String confirmationToken,
        @JsonProperty("idempotency_key") String idempotencyKey
) {
    public static ToolCallRequest of(String name, Map<String, Object> arguments) {
        return new ToolCallRequest(name, arguments, null, null);
    }

    public ToolCallRequest withConfirmationToken(String token) {
        return new ToolCallRequest(name, arguments, token, idempotencyKey);
    }

    public ToolCallRequest withIdempotencyKey(String key) {
        return new ToolCallRequest(name, arguments, confirmationToken, key);
    }
}
