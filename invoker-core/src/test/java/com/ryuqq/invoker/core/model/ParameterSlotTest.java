package com.ryuqq.invoker.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ParameterSlot 테스트.
 *
 * @author Invoker Team
 * @since 1.0.0
 */
class ParameterSlotTest {

    @Test
    void 참조_타입의_기본값은_null() {
        assertThat(ParameterSlot.of("orderId", String.class).defaultValue()).isNull();
        assertThat(ParameterSlot.of("quantity", Integer.class).defaultValue()).isNull();
    }

    @Test
    void 기본_타입의_기본값은_0_또는_false() {
        assertThat(ParameterSlot.of("a", int.class).defaultValue()).isEqualTo(0);
        assertThat(ParameterSlot.of("b", long.class).defaultValue()).isEqualTo(0L);
        assertThat(ParameterSlot.of("c", boolean.class).defaultValue()).isEqualTo(false);
        assertThat(ParameterSlot.of("d", double.class).defaultValue()).isEqualTo(0.0d);
        assertThat(ParameterSlot.of("e", float.class).defaultValue()).isEqualTo(0.0f);
        assertThat(ParameterSlot.of("f", char.class).defaultValue()).isEqualTo('\0');
        assertThat(ParameterSlot.of("g", byte.class).defaultValue()).isEqualTo((byte) 0);
        assertThat(ParameterSlot.of("h", short.class).defaultValue()).isEqualTo((short) 0);
    }

    @Test
    void void_타입은_거부() {
        assertThatThrownBy(() -> ParameterSlot.of("nothing", void.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be void");
        assertThatThrownBy(() -> ParameterSlot.of("nothing", Void.class))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 이름과_타입은_필수() {
        assertThatThrownBy(() -> ParameterSlot.of(" ", String.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name cannot be null or blank");
        assertThatThrownBy(() -> ParameterSlot.of("orderId", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("type cannot be null");
    }
}
