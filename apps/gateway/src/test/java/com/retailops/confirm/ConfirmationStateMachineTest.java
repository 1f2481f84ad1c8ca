package com.retailops.confirm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailops.auth.Role;
import com.retailops.auth.RoleContext;
import com.retailops.config.GatewayProperties;
import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import com.retailops.support.MutableClock;
import com.retailops.tools.ActionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfirmationStateMachineTest {

    private MutableClock clock;
    private ConfirmationStateMachine machine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T15:00:00Z"));
        GatewayProperties props = new GatewayProperties();
        props.getConfirm().setPreviewTtl(Duration.ofMinutes(5));
        machine = new ConfirmationStateMachine(clock, new ObjectMapper(), props);
    }

    private static ActionRequest reserve(Role role, int qty, String token) {
        return new ActionRequest("reserve_item", new RoleContext(role, RoleContext.Source.HEADER),
                Map.of("sku", "AST-LIN-BLZ-SND-M", "store_id", "ST002", "qty", qty), token, null);
    }

    private static ErrorKind kindOf(Throwable t) {
        return ((GatewayException) t).kind();
    }

    @Test
    void previewIssuesUniqueTokenWithTtl() {
        Preview a = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");
        Preview b = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");

        assertThat(a.token()).isNotEqualTo(b.token());
        assertThat(a.state()).isEqualTo(PreviewState.PREVIEWED);
        assertThat(a.expiresAt()).isEqualTo(Instant.parse("2026-03-02T15:05:00Z"));
        assertThat(machine.livePreviews()).isEqualTo(2);
    }

    @Test
    void secondConfirmIsARepeatBoundToTheFirstLedgerKey() {
        Preview p = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");

        ValidatedRequest first = machine.confirm(p.token(), reserve(Role.ASSOCIATE, 1, p.token()), "key-1");
        assertThat(first.token()).isEqualTo(p.token());
        assertThat(first.repeat()).isFalse();
        assertThat(machine.lookup(p.token())).get()
                .satisfies(stored -> {
                    assertThat(stored.state()).isEqualTo(PreviewState.CONFIRMED);
                    assertThat(stored.ledgerKey()).isEqualTo("key-1");
                });

        ValidatedRequest second = machine.confirm(p.token(), reserve(Role.ASSOCIATE, 1, p.token()), "key-2");
        assertThat(second.repeat()).isTrue();
        assertThat(second.ledgerKey()).isEqualTo("key-1");
    }

    @Test
    void usedTokenWithOtherArgumentsIsNotFound() {
        Preview p = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");
        machine.confirm(p.token(), reserve(Role.ASSOCIATE, 1, p.token()), "key-1");

        assertThatThrownBy(() -> machine.confirm(p.token(), reserve(Role.ASSOCIATE, 2, p.token()), "key-1"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("already used")
                .extracting(ConfirmationStateMachineTest::kindOf)
                .isEqualTo(ErrorKind.TOKEN_NOT_FOUND);
    }

    @Test
    void unknownTokenIsNotFound() {
        assertThatThrownBy(() -> machine.confirm("nope", reserve(Role.ASSOCIATE, 1, "nope"), "key-1"))
                .extracting(ConfirmationStateMachineTest::kindOf)
                .isEqualTo(ErrorKind.TOKEN_NOT_FOUND);
    }

    @Test
    void confirmAtOrAfterExpiryFailsAndDropsTheToken() {
        Preview p = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");
        clock.advance(Duration.ofMinutes(5));

        assertThatThrownBy(() -> machine.confirm(p.token(), reserve(Role.ASSOCIATE, 1, p.token()), "key-1"))
                .extracting(ConfirmationStateMachineTest::kindOf)
                .isEqualTo(ErrorKind.TOKEN_EXPIRED);
        assertThat(machine.livePreviews()).isZero();

        // 已丢弃：再来一次只能是 not found
        assertThatThrownBy(() -> machine.confirm(p.token(), reserve(Role.ASSOCIATE, 1, p.token()), "key-1"))
                .extracting(ConfirmationStateMachineTest::kindOf)
                .isEqualTo(ErrorKind.TOKEN_NOT_FOUND);
    }

    @Test
    void mismatchedArgumentsDoNotConsumeTheToken() {
        Preview p = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");

        assertThatThrownBy(() -> machine.confirm(p.token(), reserve(Role.ASSOCIATE, 2, p.token()), "key-1"))
                .hasMessageContaining("arguments differ")
                .extracting(ConfirmationStateMachineTest::kindOf)
                .isEqualTo(ErrorKind.REQUEST_MISMATCH);

        assertThat(machine.confirm(p.token(), reserve(Role.ASSOCIATE, 1, p.token()), "key-1")).isNotNull();
    }

    @Test
    void differentRoleIsAMismatch() {
        Preview p = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");

        assertThatThrownBy(() -> machine.confirm(p.token(), reserve(Role.MERCH, 1, p.token()), "key-1"))
                .hasMessageContaining("role")
                .extracting(ConfirmationStateMachineTest::kindOf)
                .isEqualTo(ErrorKind.REQUEST_MISMATCH);
    }

    @Test
    void sweepRemovesOnlyExpiredPreviews() {
        Preview old = machine.preview(reserve(Role.ASSOCIATE, 1, null), "old");
        clock.advance(Duration.ofMinutes(3));
        Preview fresh = machine.preview(reserve(Role.ASSOCIATE, 2, null), "fresh");
        clock.advance(Duration.ofMinutes(3));

        machine.sweepExpired();

        assertThat(machine.lookup(old.token())).isEmpty();
        assertThat(machine.lookup(fresh.token())).isPresent();
        assertThat(machine.livePreviews()).isEqualTo(1);
    }

    @Test
    void concurrentConfirmsHaveExactlyOneWinner() throws Exception {
        Preview p = machine.preview(reserve(Role.ASSOCIATE, 1, null), "Reserve 1 unit");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    // 其余确认方拿到的是 repeat，不能再执行
                    return !machine.confirm(p.token(), reserve(Role.ASSOCIATE, 1, p.token()), "key-1").repeat();
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void nonPositiveTtlIsRejectedAtStartup() {
        GatewayProperties props = new GatewayProperties();
        props.getConfirm().setPreviewTtl(Duration.ZERO);
        assertThatThrownBy(() -> new ConfirmationStateMachine(clock, new ObjectMapper(), props))
                .isInstanceOf(IllegalStateException.class);
    }
}
