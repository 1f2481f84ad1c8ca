package com.retailops.confirm;

/**
 * Per-token lifecycle. NONE is implicit (no entry in the table).
 * <pre>
 * NONE -> PREVIEWED -> CONFIRMED   (terminal, success)
 * NONE -> PREVIEWED -> EXPIRED     (terminal, discarded)
 * </pre>
 */
public enum PreviewState {
    PREVIEWED,
    CONFIRMED,
    EXPIRED;

    public boolean canTransitionTo(PreviewState next) {
        return this == PREVIEWED && (next == CONFIRMED || next == EXPIRED);
    }
}
