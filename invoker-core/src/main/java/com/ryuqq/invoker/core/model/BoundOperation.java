package com.ryuqq.invoker.core.model;

import com.ryuqq.invoker.core.contract.OperationBinding;

import java.util.ArrayList;
import java.util.List;

/**
 * 바인딩이 완료된 대상 Operation.
 *
 * <p>라우팅/바인딩 단계에서 해석된 Operation 하나를 표현하는 불변 객체입니다.
 * Operation당 한 번 생성되어 모든 Invocation이 공유합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>name: Operation 이름 (텔레메트리, 실패 메시지에 사용)</li>
 *   <li>inputSlots: 순서가 있는 입력 파라미터 슬롯</li>
 *   <li>outputSlots: 순서가 있는 출력(by-reference) 파라미터 슬롯</li>
 *   <li>returnKind: 반환 형태 (NONE, VALUE, ASYNC_NONE, ASYNC_VALUE)</li>
 *   <li>binding: 실제 대상을 호출하는 정적 타입 바인딩</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * BoundOperation operation = BoundOperation.builder("getOrderTotal", binding)
 *     .input("orderId", String.class)
 *     .input("includeTax", boolean.class)
 *     .output("currency", String.class)
 *     .returns(ReturnKind.ASYNC_VALUE)
 *     .build();
 * }</pre>
 *
 * @param name Operation 이름
 * @param inputSlots 입력 슬롯 (불변)
 * @param outputSlots 출력 슬롯 (불변)
 * @param returnKind 반환 형태
 * @param binding 대상 호출 바인딩
 *
 * @author Invoker Team
 * @since 1.0.0
 */
public record BoundOperation(
    OperationName name,
    List<ParameterSlot> inputSlots,
    List<ParameterSlot> outputSlots,
    ReturnKind returnKind,
    OperationBinding binding
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public BoundOperation {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (inputSlots == null) {
            throw new IllegalArgumentException("inputSlots cannot be null");
        }
        if (outputSlots == null) {
            throw new IllegalArgumentException("outputSlots cannot be null");
        }
        if (returnKind == null) {
            throw new IllegalArgumentException("returnKind cannot be null");
        }
        if (binding == null) {
            throw new IllegalArgumentException("binding cannot be null");
        }
        inputSlots = List.copyOf(inputSlots);
        outputSlots = List.copyOf(outputSlots);
    }

    /**
     * Builder 생성.
     *
     * @param name Operation 이름
     * @param binding 대상 호출 바인딩
     * @return Builder (기본 returnKind: NONE)
     */
    public static Builder builder(String name, OperationBinding binding) {
        return new Builder(OperationName.of(name), binding);
    }

    /**
     * 입력 슬롯 개수.
     *
     * @return 선언된 입력 슬롯 수
     */
    public int inputCount() {
        return inputSlots.size();
    }

    /**
     * 출력 슬롯 개수.
     *
     * @return 선언된 출력 슬롯 수
     */
    public int outputCount() {
        return outputSlots.size();
    }

    /**
     * 기본값으로 채워진 입력 버퍼 생성.
     *
     * @return 입력 슬롯 수 크기의 새 배열
     */
    public Object[] newInputBuffer() {
        return defaults(inputSlots);
    }

    /**
     * 기본값으로 채워진 출력 버퍼 생성.
     *
     * @return 출력 슬롯 수 크기의 새 배열
     */
    public Object[] newOutputBuffer() {
        return defaults(outputSlots);
    }

    private static Object[] defaults(List<ParameterSlot> slots) {
        Object[] buffer = new Object[slots.size()];
        for (int i = 0; i < buffer.length; i++) {
            buffer[i] = slots.get(i).defaultValue();
        }
        return buffer;
    }

    @Override
    public String toString() {
        return "BoundOperation{" + name.getValue()
            + ", inputs=" + inputSlots.size()
            + ", outputs=" + outputSlots.size()
            + ", returns=" + returnKind + "}";
    }

    /**
     * BoundOperation Builder.
     */
    public static final class Builder {

        private final OperationName name;
        private final OperationBinding binding;
        private final List<ParameterSlot> inputs = new ArrayList<>();
        private final List<ParameterSlot> outputs = new ArrayList<>();
        private ReturnKind returnKind = ReturnKind.NONE;

        private Builder(OperationName name, OperationBinding binding) {
            this.name = name;
            this.binding = binding;
        }

        public Builder input(String slotName, Class<?> type) {
            inputs.add(ParameterSlot.of(slotName, type));
            return this;
        }

        public Builder output(String slotName, Class<?> type) {
            outputs.add(ParameterSlot.of(slotName, type));
            return this;
        }

        public Builder returns(ReturnKind returnKind) {
            this.returnKind = returnKind;
            return this;
        }

        public BoundOperation build() {
            return new BoundOperation(name, inputs, outputs, returnKind, binding);
        }
    }
}
