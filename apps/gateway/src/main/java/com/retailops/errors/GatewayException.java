package com.retailops.errors;

/**
 * Single failure type used inside the gateway. The router turns it into a structured
 * {@code ToolResult}; it never escapes to the HTTP layer as an exception.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final String fallback;

    public GatewayException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public GatewayException(ErrorKind kind, String message, String fallback) {
        this(kind, message, fallback, null);
    }

    public GatewayException(ErrorKind kind, String message, String fallback, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.fallback = fallback;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** 具体的补救动作；未指定时使用 kind 的默认值 */
    public String fallback() {
        return fallback != null ? fallback : kind.defaultFallback();
    }
}
