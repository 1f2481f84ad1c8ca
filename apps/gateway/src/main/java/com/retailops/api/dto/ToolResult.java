package com.retailops.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailops.confirm.Preview;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import com.retailops.errors.Outcome;

import java.time.Instant;
import java.util.Map;

/**
 * One structured answer per tool call: {@code ok} (read), {@code preview},
 * {@code reserved}/{@code created} (confirmed write) or {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        String status,
        String tool,
        Boolean reused,
        String token,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("effect_summary") String effectSummary,
        String id,
        Instant timestamp,
        @JsonProperty("idempotency_key") String idempotencyKey,
        Map<String, Object> data,
        @JsonProperty("error_kind") ErrorKind errorKind,
        Outcome outcome,
        String message,
        @JsonProperty("retry_hint") String retryHint,
        String fallback
) {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_PREVIEW = "preview";
    public static final String STATUS_ERROR = "error";

    public static ToolResult ok(String tool, Map<String, Object> data) {
        return new ToolResult(STATUS_OK, tool, null, null, null, null, null, null, null, data,
                null, null, null, null, null);
    }

    public static ToolResult preview(Preview preview) {
        return new ToolResult(STATUS_PREVIEW, preview.request().tool(), null, preview.token(), preview.expiresAt(),
                preview.effectSummary(), null, null, null, null, null, null, null, null, null);
    }

    public static ToolResult executed(String tool, String status, String id, Instant timestamp,
                                      String idempotencyKey, Map<String, Object> data) {
        return new ToolResult(status, tool, false, null, null, null, id, timestamp, idempotencyKey, data,
                null, null, null, null, null);
    }

    public static ToolResult error(String tool, GatewayException ex) {
        return error(tool, ex, null);
    }

    public static ToolResult error(String tool, GatewayException ex, String idempotencyKey) {
        ErrorKind kind = ex.kind();
        return new ToolResult(STATUS_ERROR, tool, null, null, null, null, null, null, idempotencyKey, null,
                kind, kind.outcome(), ex.getMessage(), kind.retryHint(), ex.fallback());
    }

    /** 账本重放：同一结果，标记 reused */
    public ToolResult asReplay() {
        return new ToolResult(status, tool, true, token, expiresAt, effectSummary, id, timestamp, idempotencyKey,
                data, errorKind, outcome, message, retryHint, fallback);
    }

    @JsonIgnore
    public boolean isError() {
        return STATUS_ERROR.equals(status);
    }
}
