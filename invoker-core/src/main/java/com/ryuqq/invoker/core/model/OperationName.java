package com.ryuqq.invoker.core.model;

import java.util.regex.Pattern;

/**
 * 바인딩된 Operation의 이름.
 *
 * <p>OperationName은 Invoker 테이블의 키이자, 텔레메트리 이벤트와
 * 실패 메시지에 붙는 Operation 식별자로 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>OperationName.of("getOrderTotal")</li>
 *   <li>OperationName.of("OrderService.cancelOrder")</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영문자/언더스코어/$로 시작, 이후 영숫자, 점(.), 하이픈(-), 언더스코어(_), $ 허용</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class OperationName {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$.\\-]*$");

    private final String value;

    private OperationName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("OperationName length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("OperationName contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * OperationName 생성.
     *
     * @param value Operation 이름
     * @return OperationName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationName of(String value) {
        return new OperationName(value);
    }

    /**
     * Operation 이름 조회.
     *
     * @return Operation 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationName that = (OperationName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OperationName{" + value + '}';
    }
}
