package com.ryuqq.invoker.core.compiler;

import com.ryuqq.invoker.core.model.BoundOperation;

/**
 * 정적 바인딩 컴파일러.
 *
 * <p>BoundOperation에 등록된 {@link com.ryuqq.invoker.core.contract.OperationBinding}과
 * 생성 시점에 결정된 시그니처(입출력 슬롯 수, 반환 형태)로 thunk를 구성합니다.
 * 런타임 타입 검사나 코드 생성은 하지 않습니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class StaticBindingCompiler implements OperationCompiler {

    @Override
    public CompiledThunk compile(BoundOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return new CompiledThunk(
            operation.name(),
            operation.binding(),
            operation.returnKind(),
            operation.inputCount(),
            operation.outputCount()
        );
    }
}
