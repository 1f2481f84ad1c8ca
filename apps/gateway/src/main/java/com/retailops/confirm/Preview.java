package com.retailops.confirm;

import com.retailops.tools.ActionRequest;

import java.time.Instant;

/**
 * One issued preview. {@code ledgerKey} is set when the token is confirmed and stays with
 * the token, so a repeated confirm finds the same ledger entry whatever key it derives itself.
 */
public record Preview(
        String token,
        ActionRequest request,
        String canonicalArguments,
        String effectSummary,
        Instant issuedAt,
        Instant expiresAt,
        PreviewState state,
        String ledgerKey
) {
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    Preview transitionTo(PreviewState next) {
        return transitionTo(next, ledgerKey);
    }

    Preview confirmedWith(String key) {
        return transitionTo(PreviewState.CONFIRMED, key);
    }

    private Preview transitionTo(PreviewState next, String key) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal preview transition " + state + " -> " + next + " for token " + token);
        }
        return new Preview(token, request, canonicalArguments, effectSummary, issuedAt, expiresAt, next, key);
    }
}
