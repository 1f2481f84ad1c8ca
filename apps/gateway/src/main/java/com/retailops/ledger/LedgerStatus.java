package com.retailops.ledger;

public enum LedgerStatus {
    PENDING,
    SUCCEEDED,
    FAILED
}
