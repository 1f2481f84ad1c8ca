package com.retailops.ledger;

import com.retailops.api.dto.ToolResult;
import com.retailops.errors.ErrorKind;

import java.util.Optional;

public interface IdempotencyLedger {

    /**
     * Claim a key. Concurrent calls for one key are serialized: exactly one gets PROCEED.
     * A FAILED entry may be claimed again since nothing happened on the backend.
     */
    BeginOutcome begin(String key, String tool);

    /** 仅 PROCEED 的持有者调用 */
    void complete(String key, ToolResult result);

    void fail(String key, ErrorKind kind, String message);

    Optional<LedgerEntry> lookup(String key);
}
