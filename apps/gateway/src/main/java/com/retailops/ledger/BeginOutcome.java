package com.retailops.ledger;

/**
 * Answer to {@link IdempotencyLedger#begin}. Only {@link Type#PROCEED} allows a backend call.
 */
public record BeginOutcome(Type type, LedgerEntry entry) {

    public enum Type { PROCEED, ALREADY_PENDING, ALREADY_SUCCEEDED }

    public static BeginOutcome proceed(LedgerEntry entry) {
        return new BeginOutcome(Type.PROCEED, entry);
    }

    public static BeginOutcome alreadyPending(LedgerEntry entry) {
        return new BeginOutcome(Type.ALREADY_PENDING, entry);
    }

    public static BeginOutcome alreadySucceeded(LedgerEntry entry) {
        return new BeginOutcome(Type.ALREADY_SUCCEEDED, entry);
    }
}
