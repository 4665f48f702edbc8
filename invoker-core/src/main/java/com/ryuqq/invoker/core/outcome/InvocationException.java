package com.ryuqq.invoker.core.outcome;

import com.ryuqq.invoker.core.model.OperationName;

/**
 * Invocation 실패 예외.
 *
 * <p>{@link Failed} 결과가 보관하고, Legacy Completion Bridge의 {@code endInvoke}가
 * 다시 던지는 예외입니다. 메시지는 항상 {@code "<operation>: <detail>"} 형식이며,
 * 원인 예외는 {@link #getCause()}로 보존됩니다.</p>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public class InvocationException extends RuntimeException {

    private final FailureKind kind;
    private final OperationName operation;

    /**
     * 생성자.
     *
     * @param kind 실패 종류
     * @param operation Operation 이름
     * @param detail 상세 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException kind 또는 operation이 null인 경우
     */
    public InvocationException(FailureKind kind, OperationName operation, String detail, Throwable cause) {
        super(format(operation, detail), cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.operation = operation;
    }

    /**
     * 입력 개수 불일치.
     *
     * @param operation Operation 이름
     * @param expected 선언된 입력 슬롯 수
     * @param actual 전달된 입력 수 (null 입력은 0)
     * @return InvocationException (ARGUMENT_MISMATCH)
     */
    public static InvocationException argumentMismatch(OperationName operation, int expected, int actual) {
        return new InvocationException(FailureKind.ARGUMENT_MISMATCH, operation,
            String.format("expected %d input parameter(s) but received %d", expected, actual), null);
    }

    /**
     * 잘못된 호출 상태 (대상 인스턴스 없음 등).
     *
     * @param operation Operation 이름
     * @param detail 상세 메시지
     * @return InvocationException (INVALID_STATE)
     */
    public static InvocationException invalidState(OperationName operation, String detail) {
        return new InvocationException(FailureKind.INVALID_STATE, operation, detail, null);
    }

    /**
     * 인프라 실패 (원인 보존).
     *
     * @param operation Operation 이름
     * @param cause 원인
     * @return InvocationException (INFRASTRUCTURE)
     */
    public static InvocationException infrastructure(OperationName operation, Throwable cause) {
        String detail = cause == null
            ? "operation failed"
            : "operation failed with " + cause.getClass().getName()
                + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
        return new InvocationException(FailureKind.INFRASTRUCTURE, operation, detail, cause);
    }

    /**
     * 인프라 실패 (원인 없음).
     *
     * @param operation Operation 이름
     * @param detail 상세 메시지
     * @return InvocationException (INFRASTRUCTURE)
     */
    public static InvocationException infrastructure(OperationName operation, String detail) {
        return new InvocationException(FailureKind.INFRASTRUCTURE, operation, detail, null);
    }

    public FailureKind getKind() {
        return kind;
    }

    public OperationName getOperation() {
        return operation;
    }

    private static String format(OperationName operation, String detail) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return operation.getValue() + ": " + detail;
    }
}
