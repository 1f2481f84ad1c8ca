package com.retailops.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.tools.ActionRequest;
import com.retailops.tools.support.JsonCanonicalizer;
import lombok.RequiredArgsConstructor;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Ledger key = sha256(tool | canonical(args) | discriminator). The discriminator is the
 * client-supplied idempotency key when present, otherwise the confirmation token, so two
 * confirmations of the same preview collapse onto one key.
 */
@Component
@RequiredArgsConstructor
public class IdempotencyKeys {

    private final ObjectMapper mapper;

    public Optional<String> derive(ActionRequest request) {
        String discriminator;
        if (request.hasIdempotencyKey()) {
            discriminator = "idem:" + request.idempotencyKey().trim();
        } else if (request.hasConfirmationToken()) {
            discriminator = "token:" + request.confirmationToken().trim();
        } else {
            return Optional.empty();
        }
        String canonical = JsonCanonicalizer.canonicalize(mapper, request.arguments());
        return Optional.of(DigestUtils.sha256Hex(request.tool() + "|" + canonical + "|" + discriminator));
    }
}
