package com.ryuqq.invoker.core.contract;

/**
 * 대상 Operation에 대한 정적 타입 바인딩.
 *
 * <p>Operation당 하나의 구현(주로 람다)을 등록하여, 런타임 리플렉션 없이
 * 위치 기반 입력을 전달하고 위치 기반 출력을 돌려받습니다.</p>
 *
 * <p><strong>반환값 규칙 ({@link com.ryuqq.invoker.core.model.ReturnKind}):</strong></p>
 * <ul>
 *   <li>NONE: 반환값은 무시됩니다 (보통 null 반환)</li>
 *   <li>VALUE: 반환값이 그대로 결과값이 됩니다</li>
 *   <li>ASYNC_NONE / ASYNC_VALUE: {@link java.util.concurrent.CompletionStage}를 반환해야 합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * OperationBinding binding = (instance, inputs, outputs) -> {
 *     OrderService service = (OrderService) instance;
 *     outputs[0] = "KRW";
 *     return service.getOrderTotal((String) inputs[0], (Boolean) inputs[1]);
 * };
 * }</pre>
 *
 * @author Invoker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperationBinding {

    /**
     * 대상 Operation 호출.
     *
     * @param instance 대상 인스턴스 (non-null 보장)
     * @param inputs 입력 인자 (입력 슬롯 수와 길이 일치 보장)
     * @param outputs 출력 버퍼 (출력 슬롯 수 크기, 기본값으로 초기화됨)
     * @return 반환값, 없음(null), 또는 CompletionStage
     * @throws Exception 대상 Operation이 던진 예외 (BusinessFault 포함)
     */
    Object invoke(Object instance, Object[] inputs, Object[] outputs) throws Exception;
}
