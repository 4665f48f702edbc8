package com.ryuqq.invoker.core.model;

/**
 * Operation의 반환 형태.
 *
 * <p>값 반환 여부와 비동기 여부는 {@link BoundOperation} 생성 시점에 결정되며,
 * Invocation마다 런타임 타입 검사를 하지 않습니다.</p>
 *
 * <pre>
 *              | 값 없음      | 값 있음
 * -------------+-------------+--------------
 *  동기         | NONE        | VALUE
 *  비동기       | ASYNC_NONE  | ASYNC_VALUE
 * </pre>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public enum ReturnKind {

    /**
     * 동기, 반환값 없음.
     */
    NONE(false, false),

    /**
     * 동기, 반환값 있음.
     */
    VALUE(false, true),

    /**
     * 비동기 (CompletionStage), 반환값 없음.
     */
    ASYNC_NONE(true, false),

    /**
     * 비동기 (CompletionStage), 반환값 있음.
     */
    ASYNC_VALUE(true, true);

    private final boolean async;
    private final boolean declaresValue;

    ReturnKind(boolean async, boolean declaresValue) {
        this.async = async;
        this.declaresValue = declaresValue;
    }

    /**
     * 비동기 반환 여부.
     *
     * @return 대상 Operation이 CompletionStage를 반환하면 true
     */
    public boolean isAsync() {
        return async;
    }

    /**
     * 반환값 선언 여부.
     *
     * @return 성공 시 반환값을 추출해야 하면 true
     */
    public boolean declaresValue() {
        return declaresValue;
    }
}
