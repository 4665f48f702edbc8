package com.ryuqq.invoker.adapter.runner;

import com.ryuqq.invoker.application.invoker.OperationInvoker;
import com.ryuqq.invoker.core.classifier.FailureClassifier;
import com.ryuqq.invoker.core.compiler.CompiledThunk;
import com.ryuqq.invoker.core.compiler.OperationCompiler;
import com.ryuqq.invoker.core.model.BoundOperation;
import com.ryuqq.invoker.core.model.CorrelationToken;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.outcome.Failed;
import com.ryuqq.invoker.core.outcome.InvocationException;
import com.ryuqq.invoker.core.outcome.InvocationOutcome;
import com.ryuqq.invoker.core.telemetry.InvocationTelemetry;
import com.ryuqq.invoker.core.telemetry.noop.NoOpInvocationTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 동기/비동기 Operation을 모두 지원하는 Invoker 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>디스패치 전 검증 (대상 인스턴스 null, 입력 개수 불일치 → 즉시 Failed)</li>
 *   <li>메모이즈된 CompiledThunk 조회 (없으면 컴파일 후 게시)</li>
 *   <li>출력 버퍼 할당 (출력 슬롯 기본값)</li>
 *   <li>계측 활성 시 Invoked 이벤트 보고</li>
 *   <li>thunk 호출 (동기 예외는 실패한 계산으로 변환)</li>
 *   <li>pending 핸들이면 정산 시점까지 stage 합성으로 일시 중단 (스레드 블로킹 없음)</li>
 *   <li>FailureClassifier로 분류 후 종료 이벤트 1회 보고</li>
 * </ol>
 *
 * <p><strong>공유 상태:</strong> Operation당 하나의 CompiledThunk만 공유합니다.
 * 경쟁 상황에서 중복 컴파일을 허용하며, thunk는 불변이므로 volatile 게시만으로 충분합니다.</p>
 *
 * <p><strong>예외 정책:</strong> 반환된 stage는 예외로 완료되지 않습니다. 대상이 동기적으로 던진
 * {@link Error}도 실패한 계산으로 분류되며, {@link VirtualMachineError}만 호출자에게 전파됩니다.
 * 텔레메트리 구현체의 예외는 격리되어 로그만 남깁니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class TaskOperationInvoker implements OperationInvoker {

    private static final Logger log = LoggerFactory.getLogger(TaskOperationInvoker.class);

    private final BoundOperation operation;
    private final OperationCompiler compiler;
    private final FailureClassifier classifier;
    private final InvocationTelemetry telemetry;
    private final InvokerConfig config;

    private volatile CompiledThunk thunk;

    /**
     * 생성자 (텔레메트리 없음, 기본 설정).
     *
     * @param operation 대상 Operation
     */
    public TaskOperationInvoker(BoundOperation operation) {
        this(operation, new NoOpInvocationTelemetry());
    }

    /**
     * 생성자 (기본 컴파일러, 기본 설정).
     *
     * @param operation 대상 Operation
     * @param telemetry 텔레메트리 수집기
     */
    public TaskOperationInvoker(BoundOperation operation, InvocationTelemetry telemetry) {
        this(operation, OperationCompiler.staticBinding(), telemetry, new InvokerConfig());
    }

    /**
     * 생성자.
     *
     * @param operation 대상 Operation
     * @param compiler thunk 컴파일러
     * @param telemetry 텔레메트리 수집기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TaskOperationInvoker(BoundOperation operation, OperationCompiler compiler,
                                InvocationTelemetry telemetry, InvokerConfig config) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (compiler == null) {
            throw new IllegalArgumentException("compiler cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.operation = operation;
        this.compiler = compiler;
        this.classifier = new FailureClassifier();
        this.telemetry = telemetry;
        this.config = config;
    }

    @Override
    public BoundOperation operation() {
        return operation;
    }

    @Override
    public Object[] allocateInputs() {
        return operation.newInputBuffer();
    }

    @Override
    public CompletionStage<InvocationOutcome> invoke(Object instance, Object[] inputs, CorrelationToken correlationToken) {
        CorrelationToken token = correlationToken == null ? CorrelationToken.none() : correlationToken;

        InvocationException rejection = validateInput(instance, inputs);
        if (rejection != null) {
            log.debug("Rejected invocation before dispatch: {}", rejection.getMessage());
            return CompletableFuture.completedFuture(failedBeforeDispatch(rejection));
        }

        try {
            return dispatch(instance, inputs, token);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Invoker failed to dispatch {}", operation.name().getValue(), e);
            return CompletableFuture.completedFuture(
                failedBeforeDispatch(InvocationException.infrastructure(operation.name(), e)));
        }
    }

    /**
     * 디스패치 전 입력 검증.
     *
     * @return 검증 실패 예외, 통과 시 null
     */
    private InvocationException validateInput(Object instance, Object[] inputs) {
        if (instance == null) {
            return InvocationException.invalidState(operation.name(), "no service instance to invoke the operation on");
        }
        int expected = operation.inputCount();
        int actual = inputs == null ? 0 : inputs.length;
        if (actual != expected) {
            return InvocationException.argumentMismatch(operation.name(), expected, actual);
        }
        return null;
    }

    private CompletionStage<InvocationOutcome> dispatch(Object instance, Object[] inputs, CorrelationToken token) {
        CompiledThunk compiled = ensureCompiled();
        Object[] outputs = operation.newOutputBuffer();
        boolean instrumented = config.instrumentationEnabled() && telemetry.isEnabled();
        long startNanos = System.nanoTime();

        if (instrumented) {
            emit("Invoked", () -> telemetry.operationInvoked(operation.name(), token));
        }

        CompletableFuture<?> pending = start(compiled, instance, inputs, outputs);

        // 즉시 정산된 경우 일시 중단하지 않음
        if (pending.isDone()) {
            return CompletableFuture.completedFuture(settle(pending, outputs, token, instrumented, startNanos));
        }
        return pending.handle((ignoredValue, ignoredError) -> settle(pending, outputs, token, instrumented, startNanos));
    }

    /**
     * thunk를 호출하고 결과를 계산 핸들로 정규화.
     */
    private CompletableFuture<?> start(CompiledThunk compiled, Object instance, Object[] inputs, Object[] outputs) {
        try {
            Object raw = compiled.call(instance, inputs, outputs);
            if (compiled.getReturnKind().isAsync()) {
                return (CompletableFuture<?>) raw;
            }
            return CompletableFuture.completedFuture(raw);
        } catch (Throwable e) {
            // Error도 비동기 경로와 동일하게 실패한 계산으로 취급
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * 정산된 핸들 분류 및 종료 이벤트 보고.
     */
    private InvocationOutcome settle(CompletableFuture<?> settled, Object[] outputs, CorrelationToken token,
                                     boolean instrumented, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        InvocationOutcome outcome;
        try {
            outcome = classifier.classify(operation, settled, outputs, elapsed);
        } catch (RuntimeException e) {
            log.error("Failed to classify the result of {}", operation.name().getValue(), e);
            outcome = new Failed(InvocationException.infrastructure(operation.name(), e),
                InvocationOutcome.snapshot(outputs), elapsed);
        }

        if (instrumented) {
            recordTerminal(outcome, token);
        }
        return outcome;
    }

    private void recordTerminal(InvocationOutcome outcome, CorrelationToken token) {
        OperationName name = operation.name();
        Duration elapsed = outcome.elapsed();
        switch (outcome.status()) {
            case SUCCEEDED -> emit("Completed", () -> telemetry.operationCompleted(name, token, elapsed));
            case FAULTED -> emit("Faulted", () -> telemetry.operationFaulted(name, token, elapsed));
            case FAILED -> emit("Failed", () -> telemetry.operationFailed(name, token, elapsed));
            case CANCELLED -> recordCancellation(name, token, elapsed);
            default -> throw new IllegalStateException("Outcome is not terminal: " + outcome.status());
        }
    }

    private void recordCancellation(OperationName name, CorrelationToken token, Duration elapsed) {
        switch (config.cancellationEventPolicy()) {
            case REPORT_AS_FAILED -> emit("Failed", () -> telemetry.operationFailed(name, token, elapsed));
            case REPORT_AS_CANCELLED -> emit("Cancelled", () -> telemetry.operationCancelled(name, token, elapsed));
            case SUPPRESS -> log.debug("Cancelled {} without a terminal telemetry event", name.getValue());
        }
    }

    /**
     * 텔레메트리 호출 (예외 격리).
     */
    private void emit(String event, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Telemetry sink failed to record {} event for {}", event, operation.name().getValue(), e);
        }
    }

    private CompiledThunk ensureCompiled() {
        CompiledThunk current = thunk;
        if (current == null) {
            current = compiler.compile(operation);
            if (current == null) {
                throw new IllegalStateException("compiler returned no thunk for " + operation.name().getValue());
            }
            thunk = current; // 완전히 생성된 뒤에 게시
        }
        return current;
    }

    private Failed failedBeforeDispatch(InvocationException failure) {
        return new Failed(failure, InvocationOutcome.snapshot(operation.newOutputBuffer()), Duration.ZERO);
    }

    CompiledThunk compiledThunkOrNull() {
        return thunk;
    }

    @Override
    public String toString() {
        return "TaskOperationInvoker{" + operation + "}";
    }
}
