package com.ryuqq.invoker.core.compiler;

import com.ryuqq.invoker.core.model.BoundOperation;

/**
 * BoundOperation을 재사용 가능한 {@link CompiledThunk}로 컴파일하는 Binder.
 *
 * <p><strong>동시성 정책:</strong> 여러 호출자가 같은 BoundOperation을 동시에 컴파일할 수 있습니다.
 * 생성된 thunk는 모두 동작이 동일하므로 어느 것이 최종적으로 게시되어도 정확성에 영향이 없습니다.
 * 구현체는 완전히 생성된 thunk만 반환해야 합니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperationCompiler {

    /**
     * thunk 컴파일.
     *
     * @param operation 대상 Operation
     * @return 완전히 생성된 CompiledThunk
     * @throws IllegalArgumentException operation이 null인 경우
     */
    CompiledThunk compile(BoundOperation operation);

    /**
     * 정적 바인딩 기반 기본 컴파일러.
     *
     * @return StaticBindingCompiler 인스턴스
     */
    static OperationCompiler staticBinding() {
        return new StaticBindingCompiler();
    }
}
