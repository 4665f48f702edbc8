package com.ryuqq.invoker.core.model;

/**
 * Operation 시그니처의 위치 기반 파라미터 슬롯.
 *
 * <p>입력 슬롯과 출력(by-reference) 슬롯 모두 이 타입으로 표현합니다.
 * 슬롯 타입은 기본값 결정에만 사용되며, 호출 시점의 타입 검사는 하지 않습니다.</p>
 *
 * @param name 슬롯 이름 (진단용)
 * @param type 슬롯 타입 (primitive 허용)
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record ParameterSlot(
    String name,
    Class<?> type
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null/blank이거나 type이 null 또는 void인 경우
     */
    public ParameterSlot {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == void.class || type == Void.class) {
            throw new IllegalArgumentException("type cannot be void (slot: " + name + ")");
        }
    }

    /**
     * ParameterSlot 생성.
     *
     * @param name 슬롯 이름
     * @param type 슬롯 타입
     * @return ParameterSlot 인스턴스
     */
    public static ParameterSlot of(String name, Class<?> type) {
        return new ParameterSlot(name, type);
    }

    /**
     * 슬롯의 기본값.
     *
     * <p>참조 타입은 null, primitive 타입은 해당 타입의 0 값(false, '\0' 포함)입니다.</p>
     *
     * @return 기본값
     */
    public Object defaultValue() {
        if (!type.isPrimitive()) {
            return null;
        }
        if (type == boolean.class) return Boolean.FALSE;
        if (type == char.class) return '\0';
        if (type == byte.class) return (byte) 0;
        if (type == short.class) return (short) 0;
        if (type == int.class) return 0;
        if (type == long.class) return 0L;
        if (type == float.class) return 0.0f;
        return 0.0d;
    }
}
