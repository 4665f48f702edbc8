package com.ryuqq.invoker.core.model;

import java.util.Arrays;

/**
 * 단일 Invocation 요청.
 *
 * <p>대상 인스턴스(Operation을 소유한 receiver)와 순서가 있는 입력 인자,
 * 그리고 호출자가 전달한 CorrelationToken으로 구성됩니다.</p>
 *
 * <p>입력 개수 검증은 Invoker가 디스패치 직전에 수행하므로,
 * 이 record는 instance/inputs의 null을 허용합니다.</p>
 *
 * @param instance 대상 인스턴스 (null 가능, Invoker에서 INVALID_STATE로 처리)
 * @param inputs 입력 인자 (null 가능, 입력 슬롯이 0개일 때만 유효)
 * @param correlationToken 상관관계 토큰
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record InvocationRequest(
    Object instance,
    Object[] inputs,
    CorrelationToken correlationToken
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException correlationToken이 null인 경우
     */
    public InvocationRequest {
        if (correlationToken == null) {
            throw new IllegalArgumentException("correlationToken cannot be null (use CorrelationToken.none())");
        }
    }

    /**
     * CorrelationToken 없이 요청 생성.
     *
     * @param instance 대상 인스턴스
     * @param inputs 입력 인자
     * @return InvocationRequest 인스턴스
     */
    public static InvocationRequest of(Object instance, Object... inputs) {
        return new InvocationRequest(instance, inputs, CorrelationToken.none());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InvocationRequest that)) return false;
        return instance == that.instance
            && Arrays.equals(inputs, that.inputs)
            && correlationToken.equals(that.correlationToken);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * System.identityHashCode(instance) + Arrays.hashCode(inputs)) + correlationToken.hashCode();
    }

    @Override
    public String toString() {
        return "InvocationRequest{instance=" + instance
            + ", inputs=" + Arrays.toString(inputs)
            + ", correlationToken=" + correlationToken + "}";
    }
}
