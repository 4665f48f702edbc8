package com.ryuqq.invoker.core.outcome;

import com.ryuqq.invoker.core.statemachine.InvocationStatus;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Invocation 종료 결과.
 *
 * <p>InvocationOutcome은 네 가지 종료 상태 중 정확히 하나를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 정상 완료 (선언된 경우 반환값 포함)</li>
 *   <li>{@link Faulted}: 비즈니스 Fault (원본 그대로 전달)</li>
 *   <li>{@link Cancelled}: 취소됨 (추가 정보 없음)</li>
 *   <li>{@link Failed}: 인프라 실패 (Operation 이름 컨텍스트로 감싼 예외)</li>
 * </ul>
 *
 * <p><strong>공통 불변식:</strong> outputs의 길이는 모든 경로에서 항상
 * Operation의 출력 슬롯 수와 같습니다. 디스패치 전에 실패한 경우 기본값으로 채워집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Succeeded succeeded) {
 *     Object value = succeeded.returnValue();
 * } else if (outcome instanceof Faulted faulted) {
 *     BusinessFault fault = faulted.fault();
 * } else if (outcome instanceof Failed failed) {
 *     FailureKind kind = failed.failure().getKind();
 * }
 * </pre>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public sealed interface InvocationOutcome permits Succeeded, Faulted, Cancelled, Failed {

    /**
     * 종료 상태 조회.
     *
     * @return SUCCEEDED, FAULTED, CANCELLED, FAILED 중 하나
     */
    InvocationStatus status();

    /**
     * 출력(by-reference) 인자 조회.
     *
     * @return 출력 슬롯 수 길이의 불변 리스트 (null 원소 허용)
     */
    List<Object> outputs();

    /**
     * 경과 시간 조회.
     *
     * @return Invocation 시작부터 정산까지의 시간 (계측 비활성 시 {@link Duration#ZERO})
     */
    Duration elapsed();

    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    default boolean isFaulted() {
        return this instanceof Faulted;
    }

    default boolean isCancelled() {
        return this instanceof Cancelled;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 출력 버퍼의 스냅샷 생성.
     *
     * <p>null 원소를 허용하는 불변 리스트를 반환합니다 ({@code List.copyOf}는 null을 거부하므로 사용하지 않음).</p>
     *
     * @param outputs 출력 버퍼
     * @return 불변 리스트
     * @throws IllegalArgumentException outputs가 null인 경우
     */
    static List<Object> snapshot(Object[] outputs) {
        if (outputs == null) {
            throw new IllegalArgumentException("outputs cannot be null");
        }
        return Collections.unmodifiableList(Arrays.asList(outputs.clone()));
    }

    /**
     * 공통 필드 검증 (구현 record의 compact constructor에서 사용).
     */
    static List<Object> requireOutputs(List<Object> outputs) {
        if (outputs == null) {
            throw new IllegalArgumentException("outputs cannot be null");
        }
        return Collections.unmodifiableList(Arrays.asList(outputs.toArray()));
    }

    /**
     * 경과 시간 검증 (구현 record의 compact constructor에서 사용).
     */
    static Duration requireElapsed(Duration elapsed) {
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must be non-negative (current: " + elapsed + ")");
        }
        return elapsed;
    }
}
