package com.ryuqq.invoker.core.model;

/**
 * 호출자가 전달하는 상관관계(correlation) 토큰.
 *
 * <p>하나의 Invocation에서 발생하는 텔레메트리 이벤트(Invoked, Completed 등)를
 * 서로 연결하는 불투명(opaque) 식별자입니다. 스레드 로컬이나 전역 컨텍스트에서
 * 읽어오지 않고, 항상 {@code invoke}/{@code beginInvoke}의 파라미터로 명시적으로 전달됩니다.</p>
 *
 * <p>토큰이 없는 호출자는 {@link #none()}을 사용합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가 ({@link #none()} 제외)</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public final class CorrelationToken {

    private static final CorrelationToken NONE = new CorrelationToken();

    private final String value;

    private CorrelationToken() {
        this.value = "";
    }

    private CorrelationToken(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationToken cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CorrelationToken length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * CorrelationToken 생성.
     *
     * @param value 토큰 값 (예: 요청 메시지의 activity id)
     * @return CorrelationToken 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CorrelationToken of(String value) {
        return new CorrelationToken(value);
    }

    /**
     * 토큰이 없는 호출을 나타내는 인스턴스.
     *
     * @return 빈 CorrelationToken (singleton)
     */
    public static CorrelationToken none() {
        return NONE;
    }

    /**
     * 토큰 존재 여부 확인.
     *
     * @return {@link #none()}이 아니면 true
     */
    public boolean isPresent() {
        return this != NONE;
    }

    /**
     * 토큰 값 조회.
     *
     * @return 토큰 값 ({@link #none()}인 경우 빈 문자열)
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationToken that = (CorrelationToken) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return isPresent() ? "CorrelationToken{" + value + '}' : "CorrelationToken{none}";
    }
}
