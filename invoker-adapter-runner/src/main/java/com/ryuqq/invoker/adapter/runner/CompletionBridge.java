package com.ryuqq.invoker.adapter.runner;

import com.ryuqq.invoker.application.completion.CompletionCallback;
import com.ryuqq.invoker.application.completion.CompletionInvoker;
import com.ryuqq.invoker.application.completion.PendingInvocation;
import com.ryuqq.invoker.application.invoker.InvocationResult;
import com.ryuqq.invoker.application.invoker.OperationInvoker;
import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.outcome.Cancelled;
import com.ryuqq.invoker.core.outcome.Failed;
import com.ryuqq.invoker.core.outcome.FailureKind;
import com.ryuqq.invoker.core.outcome.Faulted;
import com.ryuqq.invoker.core.outcome.InvocationException;
import com.ryuqq.invoker.core.outcome.InvocationOutcome;
import com.ryuqq.invoker.core.outcome.Succeeded;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Legacy begin/end 완료 프로토콜 브리지.
 *
 * <p>{@link OperationInvoker}를 감싸 콜백 기반 2단계 API를 제공합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>beginInvoke: PendingInvocation 발급 → invoke 시작 → 결과 준비 시 토큰 확정 후 콜백 스케줄링</li>
 *   <li>endInvoke: 토큰 소유권/중복 호출 확인 → 결과 대기 → 결과 종류에 맞는 예외 재발생 또는 정상 반환</li>
 * </ol>
 *
 * <p><strong>블로킹 정책:</strong> endInvoke는 완료 전에 호출되면 완료될 때까지 호출 스레드를 블로킹합니다.
 * 동기 방식의 레거시 호출자와의 호환을 위한 것이며, 콜백 안에서 호출하면 블로킹되지 않습니다.</p>
 *
 * <p><strong>콜백 스케줄링:</strong> 콜백은 callbackExecutor에서 정확히 한 번 실행됩니다.
 * 기본 executor는 결과를 완료시킨 스레드에서 바로 실행하므로, 즉시 정산되는 Operation은
 * beginInvoke가 반환되기 전에 콜백이 실행됩니다. executor가 작업을 거부하면 완료 스레드에서
 * 바로 실행합니다. 콜백이 던진 예외는 로그만 남깁니다.</p>
 *
 * <p><strong>재발생 규칙 (endInvoke):</strong></p>
 * <ul>
 *   <li>Succeeded → (반환값, 출력 인자) 반환</li>
 *   <li>Faulted → 원본 BusinessFault 그대로</li>
 *   <li>Cancelled → {@link CancellationException}</li>
 *   <li>Failed → {@link InvocationException}</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class CompletionBridge implements CompletionInvoker {

    private static final Logger log = LoggerFactory.getLogger(CompletionBridge.class);

    private final OperationInvoker invoker;
    private final Executor callbackExecutor;

    /**
     * 생성자 (콜백은 완료 스레드에서 실행).
     *
     * @param invoker 감쌀 Invoker
     * @throws IllegalArgumentException invoker가 null인 경우
     */
    public CompletionBridge(OperationInvoker invoker) {
        this(invoker, Runnable::run);
    }

    /**
     * 생성자 (콜백 executor 지정).
     *
     * @param invoker 감쌀 Invoker
     * @param callbackExecutor 콜백 실행 executor
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CompletionBridge(OperationInvoker invoker, Executor callbackExecutor) {
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (callbackExecutor == null) {
            throw new IllegalArgumentException("callbackExecutor cannot be null");
        }
        this.invoker = invoker;
        this.callbackExecutor = callbackExecutor;
    }

    @Override
    public PendingInvocation beginInvoke(Object instance, Object[] inputs, CorrelationToken correlationToken,
                                         CompletionCallback onComplete, Object asyncState) {
        CorrelationToken token = correlationToken == null ? CorrelationToken.none() : correlationToken;
        PendingInvocation pending = PendingInvocation.begin(this, operationName(), token, asyncState);

        CompletionStage<InvocationOutcome> stage;
        try {
            stage = invoker.invoke(instance, inputs, token);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Invoker threw instead of returning an outcome for {}", operationName().getValue(), e);
            stage = CompletableFuture.completedFuture(bridgeFailure(e));
        }

        stage.whenComplete((outcome, error) -> complete(pending, outcome == null ? bridgeFailure(error) : outcome, onComplete));
        return pending;
    }

    @Override
    public InvocationResult endInvoke(PendingInvocation pending) {
        if (pending == null) {
            throw new IllegalArgumentException("pending cannot be null");
        }
        if (!pending.isIssuedBy(this)) {
            throw new IllegalArgumentException("PendingInvocation was not issued by this bridge: " + pending);
        }
        if (!pending.markEnded()) {
            throw new IllegalStateException("endInvoke has already been called for " + pending.getOperation().getValue());
        }

        InvocationOutcome outcome = await(pending);

        if (outcome instanceof Succeeded succeeded) {
            return InvocationResult.from(succeeded);
        }
        if (outcome instanceof Faulted faulted) {
            throw faulted.fault();
        }
        if (outcome instanceof Cancelled) {
            throw new CancellationException(pending.getOperation().getValue() + ": operation was cancelled");
        }
        if (outcome instanceof Failed failed) {
            throw failed.failure();
        }
        throw new IllegalStateException("Unknown outcome: " + outcome);
    }

    private void complete(PendingInvocation pending, InvocationOutcome outcome, CompletionCallback onComplete) {
        pending.settle(outcome);
        if (onComplete == null) {
            return;
        }
        try {
            callbackExecutor.execute(() -> runCallback(pending, onComplete));
        } catch (RejectedExecutionException e) {
            log.warn("Callback executor rejected the completion callback for {}, running it inline",
                pending.getOperation().getValue(), e);
            runCallback(pending, onComplete);
        }
    }

    private void runCallback(PendingInvocation pending, CompletionCallback onComplete) {
        try {
            onComplete.onComplete(pending);
        } catch (RuntimeException e) {
            log.error("Completion callback for {} threw an exception", pending.getOperation().getValue(), e);
        }
    }

    private InvocationOutcome await(PendingInvocation pending) {
        try {
            return pending.awaitOutcome();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationException(FailureKind.INFRASTRUCTURE, pending.getOperation(),
                "interrupted while waiting for the invocation to complete", e);
        }
    }

    /**
     * 브리지 기계장치 자체의 실패를 Failed 결과로 변환.
     */
    private Failed bridgeFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return new Failed(InvocationException.infrastructure(operationName(), cause),
            InvocationOutcome.snapshot(invoker.operation().newOutputBuffer()), Duration.ZERO);
    }

    private OperationName operationName() {
        return invoker.operation().name();
    }
}
