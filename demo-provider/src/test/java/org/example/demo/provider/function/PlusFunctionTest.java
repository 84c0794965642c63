package org.example.demo.provider.function;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlusFunctionTest {

    private final PlusFunction plus = new PlusFunction();

    @Test
    void keepsTheArgumentWidth() {
        assertThat(plus.call(new Object[]{1L, 2L})).isEqualTo(3L);
        assertThat(plus.call(new Object[]{1, 2})).isEqualTo(3);
        assertThat(plus.call(new Object[]{1.5d, 2.25d})).isEqualTo(3.75d);
    }

    @Test
    void overflowIsAnError() {
        assertThatThrownBy(() -> plus.call(new Object[]{Long.MAX_VALUE, 1L}))
                .isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> plus.call(new Object[]{Integer.MAX_VALUE, 1}))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void divideRejectsZero() {
        CheckedDivideFunction divide = new CheckedDivideFunction();

        assertThat(divide.call(new Object[]{9d, 3d})).isEqualTo(3d);
        assertThatThrownBy(() -> divide.call(new Object[]{1d, 0d}))
                .isInstanceOf(ArithmeticException.class)
                .hasMessage("division by zero");
    }
}
