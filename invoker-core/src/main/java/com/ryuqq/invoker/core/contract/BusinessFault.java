package com.ryuqq.invoker.core.contract;

/**
 * 비즈니스 Fault.
 *
 * <p>원격 호출자에게 의미가 있도록 신뢰 경계를 넘어 전달되는 구조화된 오류입니다.
 * 인프라 실패와 구분되며, Invoker는 이 예외를 절대 감싸지 않고 그대로 전달합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>OrderNotFound (ORD-404)</li>
 *   <li>InsufficientBalance (PAY-001)</li>
 * </ul>
 *
 * <p>서비스는 이 클래스를 상속한 Fault 타입을 정의하여 동기적으로 던지거나,
 * 반환한 CompletionStage를 이 예외로 완료시킵니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public abstract class BusinessFault extends RuntimeException {

    private final String faultCode;

    /**
     * 생성자.
     *
     * @param faultCode Fault 코드 (예: ORD-404)
     * @param message Fault 메시지
     * @throws IllegalArgumentException faultCode가 null이거나 빈 문자열인 경우
     */
    protected BusinessFault(String faultCode, String message) {
        this(faultCode, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param faultCode Fault 코드
     * @param message Fault 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException faultCode가 null이거나 빈 문자열인 경우
     */
    protected BusinessFault(String faultCode, String message, Throwable cause) {
        super(message, cause);
        if (faultCode == null || faultCode.isBlank()) {
            throw new IllegalArgumentException("faultCode cannot be null or blank");
        }
        this.faultCode = faultCode;
    }

    /**
     * Fault 코드 조회.
     *
     * @return Fault 코드
     */
    public String getFaultCode() {
        return faultCode;
    }
}
