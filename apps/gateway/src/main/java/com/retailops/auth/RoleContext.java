package com.retailops.auth;

import java.util.Objects;

/**
 * Normalized caller role, built once per request and passed to every later check.
 */
public record RoleContext(Role role, Source source) {

    public enum Source { HEADER, ARGUMENT, BOTH }

    public RoleContext {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(source, "source");
    }
}
