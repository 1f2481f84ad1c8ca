package com.retailops.auth;

import java.util.Locale;
import java.util.Optional;

public enum Role {
    ASSOCIATE,
    MERCH,
    SUPPORT;

    /** 线上传输用的小写名（与 RetailCore 的 X-DEMO-ROLE 取值一致） */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Role> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
