package com.deepansh.react.tool;

import com.deepansh.react.tool.impl.CalculatorTool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class CalculatorToolTest {

    private final CalculatorTool tool = new CalculatorTool();

    @Test
    void getName_returnsCalculator() {
        assertThat(tool.getName()).isEqualTo("calculator");
        assertThat(tool.getUsage()).isEqualTo("calculator[expression]");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2 + 3 * 4        | Result: 14",
            "(2 + 3) * 4      | Result: 20",
            "2^3^2            | Result: 512",
            "-2^2             | Result: -4",
            "sqrt(16) + 5     | Result: 9",
            "10 / 4           | Result: 2.5",
            "7 - -3           | Result: 10",
            "what is 6*7?     | Result: 42"
    })
    void invoke_evaluatesExpressions(String expression, String expected) {
        assertThat(tool.invoke(expression)).isEqualTo(expected);
    }

    @Test
    void invoke_fractionalPower() {
        String result = tool.invoke("29^0.23");
        assertThat(result).startsWith("Result: 2.1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2 +", "(1 + 2", "1 / 0", "sqrt(-4)", "hello", "2 3", "1.5 2 + 1"})
    void invoke_malformedOrUndefined_returnsExplanationInsteadOfThrowing(String expression) {
        assertThat(tool.invoke(expression)).startsWith("Could not evaluate");
    }

    @Test
    void invoke_deeplyNestedParentheses_returnsExplanationInsteadOfOverflowing() {
        String expression = "(".repeat(3000) + "1" + ")".repeat(3000);

        assertThat(tool.invoke(expression))
                .startsWith("Could not evaluate")
                .contains("expression nested too deeply");
    }

    @Test
    void invoke_longUnaryAndSqrtChains_areCapped() {
        assertThat(tool.invoke("-".repeat(5000) + "1")).contains("expression nested too deeply");
        assertThat(tool.invoke("sqrt".repeat(5000) + "16")).contains("expression nested too deeply");
        assertThat(tool.invoke("2" + "^1".repeat(5000))).contains("expression nested too deeply");
    }

    @Test
    void invoke_nestingWithinLimit_isEvaluated() {
        String expression = "(".repeat(50) + "6*7" + ")".repeat(50);

        assertThat(tool.invoke(expression)).isEqualTo("Result: 42");
    }
}
