package com.frosted.tracer.simulation;

import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.syntax.node.BinaryOperator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperatorsTest {

    private static Operators operators(Language language) {
        return new Operators(language, new ValueFormatter(language));
    }

    private final Operators python = operators(Language.PYTHON_LIKE);
    private final Operators javaScript = operators(Language.JAVASCRIPT_LIKE);
    private final Operators java = operators(Language.JAVA_LIKE);

    @Test
    void pythonRepeatsSequences() {
        assertThat(python.binary(BinaryOperator.MULTIPLY, "ab", 3L, 1)).isEqualTo("ababab");
        assertThat(python.binary(BinaryOperator.MULTIPLY, 2L, new ArrayList<>(List.of(0L)), 1))
                .isEqualTo(List.of(0L, 0L));
    }

    @Test
    void hugeRepeatIsRefused() {
        assertThatThrownBy(() -> python.binary(BinaryOperator.MULTIPLY, "ab", 1_000_000_000L, 3))
                .isInstanceOfSatisfying(SimulationFault.class,
                        fault -> assertThat(fault.getFault().getKind()).isEqualTo(FaultKind.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void integerOverflowFallsBackToFloatingPoint() {
        assertThat(python.binary(BinaryOperator.POWER, 2L, 10L, 1)).isEqualTo(1024L);
        assertThat(python.binary(BinaryOperator.POWER, 2L, 100L, 1)).isInstanceOf(Double.class);
        assertThat(java.binary(BinaryOperator.ADD, Long.MAX_VALUE, 1L, 1)).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void moduloFollowsTheLanguage() {
        assertThat(python.binary(BinaryOperator.MODULO, -7L, 3L, 1)).isEqualTo(2L);
        assertThat(java.binary(BinaryOperator.MODULO, -7L, 3L, 1)).isEqualTo(-1L);
    }

    @Test
    void divisionByZeroInEveryLanguage() {
        for (Operators operators : List.of(python, javaScript, java)) {
            assertThatThrownBy(() -> operators.binary(BinaryOperator.DIVIDE, 1L, 0L, 4))
                    .isInstanceOfSatisfying(SimulationFault.class, fault -> {
                        assertThat(fault.getFault().getKind()).isEqualTo(FaultKind.DIVISION_BY_ZERO);
                        assertThat(fault.getFault().getLine()).isEqualTo(4);
                    });
        }
    }

    @Test
    void negativeIndicesOnlyInPython() {
        assertThat(python.index(-1L, 3, 1)).isEqualTo(2);
        assertThatThrownBy(() -> javaScript.index(-1L, 3, 1))
                .isInstanceOfSatisfying(SimulationFault.class,
                        fault -> assertThat(fault.getFault().getKind()).isEqualTo(FaultKind.INDEX_OUT_OF_RANGE));
    }

    @Test
    void membership() {
        RangeValue range = new RangeValue(0, 5, 1);

        assertThat(python.binary(BinaryOperator.IN, 3L, range, 1)).isEqualTo(true);
        assertThat(python.binary(BinaryOperator.NOT_IN, "z", "abc", 1)).isEqualTo(true);
    }

    @Test
    void truthiness() {
        assertThat(python.isTruthy(new ArrayList<>())).isFalse();
        assertThat(javaScript.isTruthy(new ArrayList<>())).isTrue();
        assertThat(python.isTruthy("")).isFalse();
        assertThat(python.isTruthy(NoneValue.NONE)).isFalse();
    }

    @Test
    void javaStringConcatenationAcceptsAnything() {
        assertThat(java.binary(BinaryOperator.ADD, "x=", 1.5, 1)).isEqualTo("x=1.5");
        assertThatThrownBy(() -> python.binary(BinaryOperator.ADD, "x=", 1L, 1))
                .isInstanceOf(SimulationFault.class);
    }
}
