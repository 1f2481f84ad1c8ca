package com.retailops.confirm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import com.retailops.tools.ActionRequest;
import com.retailops.tools.support.JsonCanonicalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the table of live previews. Every state change for a token happens inside
 * {@link ConcurrentMap#compute}, so two confirms racing on one token have exactly one winner.
 */
@Component
@Slf4j
public class ConfirmationStateMachine {

    private static final int TOKEN_BYTES = 24;

    private final ConcurrentMap<String, Preview> previews = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Duration previewTtl;

    public ConfirmationStateMachine(Clock clock, ObjectMapper mapper, GatewayProperties props) {
        this.clock = clock;
        this.mapper = mapper;
        this.previewTtl = props.getConfirm().getPreviewTtl();
        if (previewTtl == null || previewTtl.isNegative() || previewTtl.isZero()) {
            throw new IllegalStateException("retail.gateway.confirm.preview-ttl must be positive, got " + previewTtl);
        }
    }

    /**
     * Issue a preview for a write. Never contacts the backend.
     */
    public Preview preview(ActionRequest request, String effectSummary) {
        Instant now = clock.instant();
        String canonical = canonical(request);
        Preview preview;
        String token;
        do {
            token = newToken();
            preview = new Preview(token, request, canonical, effectSummary, now, now.plus(previewTtl), PreviewState.PREVIEWED, null);
        } while (previews.putIfAbsent(token, preview) != null);

        log.debug("[PREVIEW-ISSUE] tool={} role={} expiresAt={} live={}",
                request.tool(), request.role().role(), preview.expiresAt(), previews.size());
        return preview;
    }

    /**
     * Consume a token for the given request and bind it to {@code ledgerKey}.
     * A token that is already CONFIRMED for the same tool, role and arguments comes back as a
     * {@code repeat} carrying the ledger key bound by the first confirm.
     *
     * @throws GatewayException TOKEN_NOT_FOUND, TOKEN_EXPIRED or REQUEST_MISMATCH
     */
    public ValidatedRequest confirm(String token, ActionRequest request, String ledgerKey) {
        if (token == null || token.isBlank()) {
            throw new GatewayException(ErrorKind.TOKEN_NOT_FOUND, "No confirmation token supplied.");
        }
        Instant now = clock.instant();
        String canonical = canonical(request);
        AtomicReference<GatewayException> failure = new AtomicReference<>();
        AtomicReference<String> boundKey = new AtomicReference<>();

        previews.compute(token, (key, current) -> {
            if (current == null) {
                failure.set(new GatewayException(ErrorKind.TOKEN_NOT_FOUND, "Unknown confirmation token."));
                return null;
            }
            if (current.state() == PreviewState.CONFIRMED) {
                if (mismatch(current, request, canonical) != null) {
                    failure.set(new GatewayException(ErrorKind.TOKEN_NOT_FOUND,
                            "Confirmation token was already used for " + current.request().tool() + "."));
                } else {
                    boundKey.set(current.ledgerKey());
                }
                return current;
            }
            if (current.state() == PreviewState.EXPIRED || current.isExpiredAt(now)) {
                Preview expired = current.state() == PreviewState.EXPIRED
                        ? current : current.transitionTo(PreviewState.EXPIRED);
                log.debug("[PREVIEW-EXPIRED] tool={} expiredAt={}", expired.request().tool(), expired.expiresAt());
                failure.set(new GatewayException(ErrorKind.TOKEN_EXPIRED,
                        "Confirmation token expired at " + current.expiresAt() + "."));
                // 过期即丢弃
                return null;
            }
            String mismatch = mismatch(current, request, canonical);
            if (mismatch != null) {
                // token 不消耗：合法调用方仍可用原参数确认
                failure.set(new GatewayException(ErrorKind.REQUEST_MISMATCH,
                        "Confirmation does not match the previewed action: " + mismatch + "."));
                return current;
            }
            return current.confirmedWith(ledgerKey);
        });

        GatewayException error = failure.get();
        if (error != null) {
            log.debug("[CONFIRM-FAIL] tool={} kind={} msg={}", request.tool(), error.kind(), error.getMessage());
            throw error;
        }
        if (boundKey.get() != null) {
            log.debug("[CONFIRM-REPEAT] tool={} key={}", request.tool(), boundKey.get());
            return new ValidatedRequest(request, token, now, boundKey.get(), true);
        }
        log.debug("[CONFIRM-OK] tool={} role={}", request.tool(), request.role().role());
        return new ValidatedRequest(request, token, now, ledgerKey, false);
    }

    /** 只读查看（顺带惰性清理过期项） */
    public Optional<Preview> lookup(String token) {
        if (token == null) return Optional.empty();
        Instant now = clock.instant();
        Preview p = previews.get(token);
        if (p != null && p.isExpiredAt(now)) {
            previews.remove(token, p);
            return Optional.empty();
        }
        return Optional.ofNullable(p);
    }

    @Scheduled(fixedDelayString = "${retail.gateway.confirm.sweep-interval-ms:60000}")
    public void sweepExpired() {
        Instant now = clock.instant();
        int[] removed = {0};
        previews.forEach((token, preview) -> {
            if (preview.isExpiredAt(now) && previews.remove(token, preview)) {
                removed[0]++;
            }
        });
        if (removed[0] > 0) {
            log.debug("[PREVIEW-SWEEP] removed={} live={}", removed[0], previews.size());
        }
    }

    public int livePreviews() {
        return previews.size();
    }

    private String mismatch(Preview preview, ActionRequest request, String canonical) {
        ActionRequest original = preview.request();
        if (!Objects.equals(original.tool(), request.tool())) {
            return "tool " + request.tool() + " != " + original.tool();
        }
        if (original.role().role() != request.role().role()) {
            return "role " + request.role().role().wireName() + " != " + original.role().role().wireName();
        }
        if (!Objects.equals(preview.canonicalArguments(), canonical)) {
            return "arguments differ";
        }
        return null;
    }

    private String canonical(ActionRequest request) {
        return JsonCanonicalizer.canonicalize(mapper, request.arguments());
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
