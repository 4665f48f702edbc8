package com.ryuqq.invoker.core.compiler;

import com.ryuqq.invoker.core.contract.OperationBinding;
import com.ryuqq.invoker.core.model.OperationName;
import com.ryuqq.invoker.core.model.ReturnKind;
import com.ryuqq.invoker.core.outcome.InvocationException;

import java.util.concurrent.CompletionStage;

/**
 * 하나의 BoundOperation에 고정된 호출 thunk.
 *
 * <p>모든 필드가 final인 불변 객체이므로, volatile 참조를 통해 게시되면
 * 다른 스레드에서 부분 초기화된 상태로 관찰될 수 없습니다.</p>
 *
 * <p><strong>원시 결과 (raw result):</strong></p>
 * <ul>
 *   <li>NONE: 항상 null (바인딩의 반환값은 버림)</li>
 *   <li>VALUE: 바인딩의 반환값</li>
 *   <li>ASYNC_NONE / ASYNC_VALUE: {@link java.util.concurrent.CompletableFuture} (pending 핸들)</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class CompiledThunk {

    private final OperationName operationName;
    private final OperationBinding binding;
    private final ReturnKind returnKind;
    private final int inputCount;
    private final int outputCount;

    CompiledThunk(OperationName operationName, OperationBinding binding, ReturnKind returnKind,
                  int inputCount, int outputCount) {
        this.operationName = operationName;
        this.binding = binding;
        this.returnKind = returnKind;
        this.inputCount = inputCount;
        this.outputCount = outputCount;
    }

    /**
     * 대상 Operation 호출.
     *
     * @param instance 대상 인스턴스
     * @param inputs 입력 인자 (null은 빈 배열로 취급)
     * @param outputs 출력 버퍼
     * @return 원시 결과 (값, null, 또는 CompletableFuture)
     * @throws InvocationException 비동기 Operation이 CompletionStage를 반환하지 않은 경우, 버퍼 크기가 맞지 않는 경우
     * @throws Exception 대상 Operation이 던진 예외
     */
    public Object call(Object instance, Object[] inputs, Object[] outputs) throws Exception {
        Object[] arguments = inputs == null ? new Object[0] : inputs;
        if (arguments.length != inputCount) {
            throw InvocationException.argumentMismatch(operationName, inputCount, arguments.length);
        }
        if (outputs == null || outputs.length != outputCount) {
            throw InvocationException.infrastructure(operationName,
                "output buffer must have " + outputCount + " slot(s)");
        }

        Object raw = binding.invoke(instance, arguments, outputs);

        if (!returnKind.isAsync()) {
            return returnKind.declaresValue() ? raw : null;
        }
        if (raw == null) {
            throw InvocationException.infrastructure(operationName,
                "asynchronous operation returned no pending computation");
        }
        if (!(raw instanceof CompletionStage<?> stage)) {
            throw InvocationException.infrastructure(operationName,
                "asynchronous operation returned " + raw.getClass().getName() + " instead of a CompletionStage");
        }
        return stage.toCompletableFuture();
    }

    public OperationName getOperationName() {
        return operationName;
    }

    public ReturnKind getReturnKind() {
        return returnKind;
    }

    public int getInputCount() {
        return inputCount;
    }

    public int getOutputCount() {
        return outputCount;
    }
}
