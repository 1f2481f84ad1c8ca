package com.retailops.ledger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.retailops.api.dto.ToolResult;
import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process ledger. Entries expire {@code retention} after their last write, which also
 * bounds how long an ambiguous (PENDING) write blocks its key.
 */
@Component
@Slf4j
public class CaffeineIdempotencyLedger implements IdempotencyLedger {

    private final Cache<String, LedgerEntry> entries;
    private final Clock clock;

    public CaffeineIdempotencyLedger(GatewayProperties props, Clock clock) {
        this.clock = clock;
        Duration retention = props.getLedger().getRetention();
        long maxSize = Math.max(64, props.getLedger().getMaximumSize());
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maxSize)
                .build();
        log.info("[LEDGER] retention={} maximumSize={}", retention, maxSize);
    }

    @Override
    public BeginOutcome begin(String key, String tool) {
        AtomicReference<BeginOutcome> outcome = new AtomicReference<>();
        entries.asMap().compute(key, (k, current) -> {
            if (current == null || current.status() == LedgerStatus.FAILED) {
                LedgerEntry pending = LedgerEntry.pending(k, tool, clock.instant());
                outcome.set(BeginOutcome.proceed(pending));
                return pending;
            }
            outcome.set(current.status() == LedgerStatus.SUCCEEDED
                    ? BeginOutcome.alreadySucceeded(current)
                    : BeginOutcome.alreadyPending(current));
            return current;
        });
        log.debug("[LEDGER-BEGIN] tool={} key={} outcome={}", tool, key, outcome.get().type());
        return outcome.get();
    }

    @Override
    public void complete(String key, ToolResult result) {
        Instant now = clock.instant();
        entries.asMap().compute(key, (k, current) -> {
            if (current == null) {
                log.warn("[LEDGER-COMPLETE] key={} was evicted before completion; recording result anyway", k);
                return LedgerEntry.pending(k, result.tool(), now).succeeded(result, now);
            }
            if (current.status() != LedgerStatus.PENDING) {
                throw new IllegalStateException("Ledger key " + k + " is " + current.status() + ", cannot complete");
            }
            return current.succeeded(result, now);
        });
        log.debug("[LEDGER-COMPLETE] key={} status={}", key, result.status());
    }

    @Override
    public void fail(String key, ErrorKind kind, String message) {
        Instant now = clock.instant();
        entries.asMap().computeIfPresent(key, (k, current) -> {
            if (current.status() != LedgerStatus.PENDING) {
                throw new IllegalStateException("Ledger key " + k + " is " + current.status() + ", cannot fail");
            }
            return current.failed(kind, message, now);
        });
        log.debug("[LEDGER-FAIL] key={} kind={}", key, kind);
    }

    @Override
    public Optional<LedgerEntry> lookup(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(entries.getIfPresent(key));
    }
}
