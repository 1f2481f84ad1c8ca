package com.retailops.ledger;

import com.retailops.api.dto.ToolResult;
import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import com.retailops.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineIdempotencyLedgerTest {

    private MutableClock clock;
    private CaffeineIdempotencyLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T15:00:00Z"));
        ledger = new CaffeineIdempotencyLedger(new GatewayProperties(), clock);
    }

    private ToolResult reserved(String key) {
        return ToolResult.executed("reserve_item", "reserved", "R123", clock.instant(), key, Map.of("reservation_id", "R123"));
    }

    @Test
    void firstBeginProceedsSecondSeesPending() {
        assertThat(ledger.begin("k1", "reserve_item").type()).isEqualTo(BeginOutcome.Type.PROCEED);

        BeginOutcome again = ledger.begin("k1", "reserve_item");
        assertThat(again.type()).isEqualTo(BeginOutcome.Type.ALREADY_PENDING);
        assertThat(again.entry().status()).isEqualTo(LedgerStatus.PENDING);
    }

    @Test
    void completedEntryIsReturnedOnBegin() {
        ledger.begin("k1", "reserve_item");
        ledger.complete("k1", reserved("k1"));

        BeginOutcome again = ledger.begin("k1", "reserve_item");
        assertThat(again.type()).isEqualTo(BeginOutcome.Type.ALREADY_SUCCEEDED);
        assertThat(again.entry().result().id()).isEqualTo("R123");
        assertThat(ledger.lookup("k1")).get().extracting(LedgerEntry::status).isEqualTo(LedgerStatus.SUCCEEDED);
    }

    @Test
    void failedEntryCanBeClaimedAgain() {
        ledger.begin("k1", "reserve_item");
        ledger.fail("k1", ErrorKind.BACKEND_REJECTED, "no stock");

        LedgerEntry failed = ledger.lookup("k1").orElseThrow();
        assertThat(failed.status()).isEqualTo(LedgerStatus.FAILED);
        assertThat(failed.errorKind()).isEqualTo(ErrorKind.BACKEND_REJECTED);

        assertThat(ledger.begin("k1", "reserve_item").type()).isEqualTo(BeginOutcome.Type.PROCEED);
    }

    @Test
    void completingASucceededEntryIsIllegal() {
        ledger.begin("k1", "reserve_item");
        ledger.complete("k1", reserved("k1"));

        assertThatThrownBy(() -> ledger.complete("k1", reserved("k1")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void lookupOfUnknownKeyIsEmpty() {
        assertThat(ledger.lookup("missing")).isEmpty();
        assertThat(ledger.lookup(null)).isEmpty();
    }

    @Test
    void concurrentBeginsGrantExactlyOneProceed() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BeginOutcome.Type>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return ledger.begin("shared", "create_transfer").type();
                }));
            }
            start.countDown();
            int proceeds = 0;
            for (Future<BeginOutcome.Type> f : results) {
                if (f.get(5, TimeUnit.SECONDS) == BeginOutcome.Type.PROCEED) proceeds++;
            }
            assertThat(proceeds).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
