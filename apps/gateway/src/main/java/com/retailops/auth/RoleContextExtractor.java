package com.retailops.auth;

import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;

@Component
@Slf4j
public class RoleContextExtractor {

    /**
     * Resolve the caller role from the transport header and/or the {@code role} argument.
     * Either may be absent; when both are present they must name the same role.
     * No default role is ever assumed.
     */
    public RoleContext extract(String headerRole, String argumentRole) {
        boolean hasHeader = headerRole != null && !headerRole.isBlank();
        boolean hasArgument = argumentRole != null && !argumentRole.isBlank();

        if (!hasHeader && !hasArgument) {
            log.debug("[ROLE] no role supplied");
            throw new GatewayException(ErrorKind.UNAUTHENTICATED_ROLE, "No role supplied. Expected one of: " + allowed());
        }

        Role fromHeader = hasHeader ? require(headerRole, "header") : null;
        Role fromArgument = hasArgument ? require(argumentRole, "argument") : null;

        if (fromHeader != null && fromArgument != null) {
            if (fromHeader != fromArgument) {
                log.debug("[ROLE] mismatch header={} argument={}", fromHeader, fromArgument);
                throw new GatewayException(ErrorKind.ROLE_MISMATCH,
                        "Header role '" + fromHeader.wireName() + "' does not match argument role '"
                                + fromArgument.wireName() + "'.");
            }
            return new RoleContext(fromHeader, RoleContext.Source.BOTH);
        }
        return fromHeader != null
                ? new RoleContext(fromHeader, RoleContext.Source.HEADER)
                : new RoleContext(fromArgument, RoleContext.Source.ARGUMENT);
    }

    private static Role require(String raw, String where) {
        Optional<Role> parsed = Role.parse(raw);
        if (parsed.isEmpty()) {
            throw new GatewayException(ErrorKind.UNAUTHENTICATED_ROLE,
                    "Invalid " + where + " role '" + raw + "'. Expected one of: " + allowed());
        }
        return parsed.get();
    }

    private static String allowed() {
        return Arrays.stream(Role.values()).map(Role::wireName).toList().toString();
    }
}
