package com.ryuqq.invoker.application.completion;

import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.outcome.Cancelled;
import com.ryuqq.invoker.core.outcome.InvocationOutcome;
import com.ryuqq.invoker.core.outcome.Succeeded;
import com.ryuqq.invoker.core.statemachine.InvocationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PendingInvocation 단위 테스트.
 *
 * <p>완료 토큰의 상태 전환, 1회 정산, endInvoke 1회 보장을 검증합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
class PendingInvocationTest {

    private static final OperationName OPERATION = OperationName.of("getOrderTotal");

    private Object issuer;
    private PendingInvocation pending;

    @BeforeEach
    void setUp() {
        issuer = new Object();
        pending = PendingInvocation.begin(issuer, OPERATION, CorrelationToken.of("req-1"), "state");
    }

    @Test
    void begin_PENDING_상태로_생성() {
        // then
        assertThat(pending.getStatus()).isEqualTo(InvocationStatus.PENDING);
        assertThat(pending.isCompleted()).isFalse();
        assertThat(pending.getOperation()).isEqualTo(OPERATION);
        assertThat(pending.getCorrelationToken()).isEqualTo(CorrelationToken.of("req-1"));
        assertThat(pending.getAsyncState()).isEqualTo("state");
        assertThat(pending.isIssuedBy(issuer)).isTrue();
        assertThat(pending.isIssuedBy(new Object())).isFalse();
    }

    @Test
    void settle_결과의_종료_상태로_전환() throws Exception {
        // given
        InvocationOutcome outcome = new Succeeded(42, List.of(), Duration.ZERO);

        // when
        pending.settle(outcome);

        // then
        assertThat(pending.getStatus()).isEqualTo(InvocationStatus.SUCCEEDED);
        assertThat(pending.isCompleted()).isTrue();
        assertThat(pending.awaitOutcome()).isSameAs(outcome);
    }

    @Test
    void settle_두_번째_정산은_예외() {
        // given
        pending.settle(new Cancelled(List.of(), Duration.ZERO));

        // when & then
        assertThatThrownBy(() -> pending.settle(new Succeeded(1, List.of(), Duration.ZERO)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("terminal state");
        assertThat(pending.getStatus()).isEqualTo(InvocationStatus.CANCELLED);
    }

    @Test
    void awaitOutcome_정산될_때까지_대기() throws Exception {
        // given
        AtomicReference<InvocationOutcome> observed = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                observed.set(pending.awaitOutcome());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        waiter.start();

        // when
        InvocationOutcome outcome = new Succeeded("late", List.of(), Duration.ofMillis(1));
        pending.settle(outcome);

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(observed.get()).isSameAs(outcome);
    }

    @Test
    void markEnded_최초_1회만_true() {
        assertThat(pending.markEnded()).isTrue();
        assertThat(pending.markEnded()).isFalse();
        assertThat(pending.toString()).contains("ended=true");
    }

    @Test
    void begin_필수_인자_검증() {
        assertThatThrownBy(() -> PendingInvocation.begin(null, OPERATION, CorrelationToken.none(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("issuer cannot be null");
        assertThatThrownBy(() -> PendingInvocation.begin(issuer, null, CorrelationToken.none(), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PendingInvocation.begin(issuer, OPERATION, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pending.settle(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
