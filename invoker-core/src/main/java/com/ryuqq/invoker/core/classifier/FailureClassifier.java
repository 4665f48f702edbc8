package com.ryuqq.invoker.core.classifier;

import com.ryuqq.invoker.core.contract.BusinessFault;
import com.ryuqq.invoker.core.model.BoundOperation;
import com.ryuqq.invoker.core.outcome.Cancelled;
import com.ryuqq.invoker.core.outcome.Failed;
import com.ryuqq.invoker.core.outcome.FailureKind;
import com.ryuqq.invoker.core.outcome.Faulted;
import com.ryuqq.invoker.core.outcome.InvocationException;
import com.ryuqq.invoker.core.outcome.InvocationOutcome;
import com.ryuqq.invoker.core.outcome.Succeeded;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 정산된 비동기 계산을 종료 결과로 분류하는 순수 함수.
 *
 * <p><strong>우선순위 (상호 배타적):</strong></p>
 * <ol>
 *   <li>비즈니스 Fault로 정산 → {@link Faulted} (Fault 원본 그대로)</li>
 *   <li>Fault 없이 취소됨 → {@link Cancelled}</li>
 *   <li>그 밖의 오류 → {@link Failed} (Operation 이름 컨텍스트로 감싸고 원인 보존).
 *       같은 Operation의 INFRASTRUCTURE {@link InvocationException}만 감싸지 않고 그대로 사용</li>
 *   <li>정상 정산 → {@link Succeeded} (선언된 경우 반환값 포함)</li>
 * </ol>
 *
 * <p><strong>예외 언래핑:</strong> {@link CompletionException}, {@link ExecutionException}은
 * 원인이 있는 한 벗겨낸 뒤 분류합니다. 원인으로 BusinessFault를 가진 취소도 Fault로 분류합니다.</p>
 *
 * <p><strong>부수 효과 없음:</strong> 같은 종료 상태의 핸들에 대해 항상 같은 결과를 반환합니다.
 * 반환값 추출은 성공이 확인된 뒤에만 수행합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class FailureClassifier {

    /**
     * 정산된 핸들 분류.
     *
     * @param operation 대상 Operation (반환값 선언 여부와 이름 컨텍스트에 사용)
     * @param settled 정산 완료된 계산
     * @param outputs 출력 버퍼 (분류 시점의 스냅샷이 결과에 담김)
     * @param elapsed 경과 시간
     * @return 종료 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException settled가 아직 정산되지 않은 경우
     */
    public InvocationOutcome classify(BoundOperation operation, CompletableFuture<?> settled,
                                      Object[] outputs, Duration elapsed) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (settled == null) {
            throw new IllegalArgumentException("settled cannot be null");
        }
        if (!settled.isDone()) {
            throw new IllegalStateException(operation.name().getValue() + ": cannot classify an unsettled computation");
        }

        List<Object> outputList = InvocationOutcome.snapshot(outputs);

        if (!settled.isCompletedExceptionally()) {
            Object returnValue = operation.returnKind().declaresValue() ? settled.join() : null;
            return new Succeeded(returnValue, outputList, elapsed);
        }

        Throwable error = unwrap(failureOf(settled));

        BusinessFault fault = findFault(error);
        if (fault != null) {
            return new Faulted(fault, outputList, elapsed);
        }

        if (settled.isCancelled() || error instanceof CancellationException) {
            return new Cancelled(outputList, elapsed);
        }

        if (error instanceof InvocationException invocationException
            && invocationException.getKind() == FailureKind.INFRASTRUCTURE
            && operation.name().equals(invocationException.getOperation())) {
            return new Failed(invocationException, outputList, elapsed);
        }
        return new Failed(InvocationException.infrastructure(operation.name(), error), outputList, elapsed);
    }

    private static Throwable failureOf(CompletableFuture<?> settled) {
        try {
            settled.join();
        } catch (CancellationException | CompletionException e) {
            return e;
        }
        throw new IllegalStateException("computation reported exceptional completion but joined normally");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static BusinessFault findFault(Throwable error) {
        if (error instanceof BusinessFault fault) {
            return fault;
        }
        if (error instanceof CancellationException && error.getCause() instanceof BusinessFault fault) {
            return fault;
        }
        return null;
    }
}
