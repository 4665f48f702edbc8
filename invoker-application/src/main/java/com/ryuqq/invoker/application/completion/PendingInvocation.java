package com.ryuqq.invoker.application.completion;

import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.outcome.InvocationOutcome;
import com.ryuqq.invoker.core.statemachine.InvocationStatus;
import com.ryuqq.invoker.core.statemachine.StatusTransition;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Legacy begin/end 프로토콜의 진행 중 Invocation 토큰.
 *
 * <p><strong>상태:</strong></p>
 * <ul>
 *   <li>생성 시 PENDING</li>
 *   <li>{@link #settle(InvocationOutcome)} 호출 시 결과 상태로 정확히 한 번 전이</li>
 *   <li>{@link #markEnded()}로 endInvoke 소비 여부를 기록 (한 번만 성공)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> settle은 한 번만 허용되며, 두 번째 호출은
 * {@link IllegalStateException}을 발생시킵니다 (종료 상태에서 전이 불가).</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class PendingInvocation {

    private final Object issuer;
    private final OperationName operation;
    private final CorrelationToken correlationToken;
    private final Object asyncState;
    private final CountDownLatch settled = new CountDownLatch(1);
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private InvocationStatus status = InvocationStatus.PENDING;
    private volatile InvocationOutcome outcome;

    private PendingInvocation(Object issuer, OperationName operation,
                              CorrelationToken correlationToken, Object asyncState) {
        if (issuer == null) {
            throw new IllegalArgumentException("issuer cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (correlationToken == null) {
            throw new IllegalArgumentException("correlationToken cannot be null");
        }
        this.issuer = issuer;
        this.operation = operation;
        this.correlationToken = correlationToken;
        this.asyncState = asyncState;
    }

    /**
     * PENDING 상태의 토큰 생성.
     *
     * @param issuer 토큰을 발급한 브리지 (endInvoke에서 소유권 확인에 사용)
     * @param operation Operation 이름
     * @param correlationToken 호출자 토큰
     * @param asyncState 호출자 상태 (null 가능)
     * @return PendingInvocation
     */
    public static PendingInvocation begin(Object issuer, OperationName operation,
                                          CorrelationToken correlationToken, Object asyncState) {
        return new PendingInvocation(issuer, operation, correlationToken, asyncState);
    }

    /**
     * 결과 확정.
     *
     * @param outcome 종료 결과
     * @throws IllegalArgumentException outcome이 null인 경우
     * @throws IllegalStateException 이미 확정된 경우
     */
    public void settle(InvocationOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        synchronized (this) {
            status = StatusTransition.transition(status, outcome.status());
            this.outcome = outcome;
        }
        settled.countDown();
    }

    /**
     * 결과가 확정될 때까지 대기.
     *
     * @return 종료 결과
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public InvocationOutcome awaitOutcome() throws InterruptedException {
        settled.await();
        return outcome;
    }

    /**
     * endInvoke 소비 표시.
     *
     * @return 처음 호출된 경우 true, 이미 소비된 경우 false
     */
    public boolean markEnded() {
        return ended.compareAndSet(false, true);
    }

    public boolean isIssuedBy(Object candidate) {
        return issuer == candidate;
    }

    public boolean isCompleted() {
        return settled.getCount() == 0;
    }

    public synchronized InvocationStatus getStatus() {
        return status;
    }

    public OperationName getOperation() {
        return operation;
    }

    public CorrelationToken getCorrelationToken() {
        return correlationToken;
    }

    public Object getAsyncState() {
        return asyncState;
    }

    @Override
    public String toString() {
        return "PendingInvocation{operation=" + operation.getValue()
            + ", status=" + getStatus()
            + ", ended=" + ended.get() + "}";
    }
}
