package com.retailops.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailops.api.dto.ToolResult;
import com.retailops.errors.ErrorKind;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerEntry(
        String key,
        String tool,
        LedgerStatus status,
        ToolResult result,
        @JsonProperty("error_kind") ErrorKind errorKind,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    static LedgerEntry pending(String key, String tool, Instant now) {
        return new LedgerEntry(key, tool, LedgerStatus.PENDING, null, null, null, now, now);
    }

    LedgerEntry succeeded(ToolResult result, Instant now) {
        return new LedgerEntry(key, tool, LedgerStatus.SUCCEEDED, result, null, null, createdAt, now);
    }

    LedgerEntry failed(ErrorKind kind, String message, Instant now) {
        return new LedgerEntry(key, tool, LedgerStatus.FAILED, null, kind, message, createdAt, now);
    }
}
