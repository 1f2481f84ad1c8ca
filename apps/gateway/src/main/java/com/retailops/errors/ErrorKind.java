package com.retailops.errors;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    UNAUTHENTICATED_ROLE(HttpStatus.UNAUTHORIZED, Outcome.NOTHING_HAPPENED, "none",
            "Send the role in the X-DEMO-ROLE header or as arguments.role (associate, merch or support)."),
    ROLE_MISMATCH(HttpStatus.BAD_REQUEST, Outcome.NOTHING_HAPPENED, "none",
            "Send the role either in the header or in arguments.role, not two different values."),
    UNKNOWN_TOOL(HttpStatus.NOT_FOUND, Outcome.NOTHING_HAPPENED, "none",
            "List the available tools with GET /tools."),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, Outcome.NOTHING_HAPPENED, "none",
            "Hand the action to a user whose role is allowed to run this tool."),
    INVALID_ARGUMENTS(HttpStatus.BAD_REQUEST, Outcome.NOTHING_HAPPENED, "fix_arguments",
            "Correct the arguments and call the tool again."),
    TOKEN_NOT_FOUND(HttpStatus.NOT_FOUND, Outcome.NOTHING_HAPPENED, "new_preview",
            "Call the tool again without a token to get a new preview."),
    TOKEN_EXPIRED(HttpStatus.GONE, Outcome.NOTHING_HAPPENED, "new_preview",
            "Call the tool again without a token to get a new preview."),
    REQUEST_MISMATCH(HttpStatus.CONFLICT, Outcome.NOTHING_HAPPENED, "none",
            "Confirm with exactly the arguments shown in the preview, or request a new preview."),
    IN_FLIGHT(HttpStatus.ACCEPTED, Outcome.UNKNOWN, "recheck",
            "Re-check GET /tools/ledger/{idempotency_key} before sending the action again."),
    BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, Outcome.NOTHING_HAPPENED, "retry",
            "Retry shortly; nothing was changed in RetailCore."),
    BACKEND_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, Outcome.NOTHING_HAPPENED, "retry",
            "Retry shortly; the lookup did not complete."),
    BACKEND_AMBIGUOUS(HttpStatus.ACCEPTED, Outcome.UNKNOWN, "recheck",
            "Do not resend. Re-check GET /tools/ledger/{idempotency_key} or ask an operator to verify in RetailCore."),
    BACKEND_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, Outcome.REJECTED, "none",
            "Review the RetailCore message and adjust the request.");

    private final HttpStatus httpStatus;
    private final Outcome outcome;
    private final String retryHint;
    private final String defaultFallback;

    ErrorKind(HttpStatus httpStatus, Outcome outcome, String retryHint, String defaultFallback) {
        this.httpStatus = httpStatus;
        this.outcome = outcome;
        this.retryHint = retryHint;
        this.defaultFallback = defaultFallback;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }

    public Outcome outcome() {
        return outcome;
    }

    public String retryHint() {
        return retryHint;
    }

    public String defaultFallback() {
        return defaultFallback;
    }
}
