package com.frosted.tracer.simulation;

import com.frosted.tracer.model.ControlFlow;
import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.SimulationResult;
import com.frosted.tracer.model.Step;
import com.frosted.tracer.syntax.ParseResult;
import com.frosted.tracer.syntax.SyntaxParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BraceLanguageSimulationTest {

    private final SyntaxParser parser = new SyntaxParser();
    private final ExecutionSimulator simulator = new ExecutionSimulator();

    private SimulationResult simulate(String code, Language language) {
        ParseResult parsed = parser.parse(code, language);
        assertThat(parsed.getErrors()).as("parse errors").isEmpty();
        return simulator.simulate(parsed.getTree());
    }

    private static Step last(SimulationResult result) {
        return result.getTrace().step(result.getTrace().size() - 1);
    }

    @Nested
    class JavaScript {

        private SimulationResult run(String code) {
            return simulate(code, Language.JAVASCRIPT_LIKE);
        }

        @Test
        @DisplayName("Counting for loop runs its update silently between iterations")
        void countingLoop() {
            SimulationResult result = run("let total = 0;\nfor (let i = 1; i <= 3; i++) {\n  total += i;\n}\n"
                    + "console.log(\"total: \" + total);\n");

            assertThat(result.isCompletedSuccessfully()).isTrue();
            assertThat(result.getTrace().getSteps()).extracting(Step::getDescription).containsExactly(
                    "Set total to 0", "Start loop",
                    "Iteration 1", "Update total to 1",
                    "Iteration 2", "Update total to 3",
                    "Iteration 3", "Update total to 6",
                    "Loop finished", "Print total: 6");
            assertThat(result.getTrace().getOutput()).isEqualTo("total: 6\n");
            assertThat(last(result).variable("total").getType()).isEqualTo("number");
        }

        @Test
        @DisplayName("Function declarations can be called before their line")
        void hoisting() {
            SimulationResult result = run("console.log(double(4));\nfunction double(x) {\n  return x * 2;\n}\n");

            assertThat(result.isCompletedSuccessfully()).isTrue();
            assertThat(result.getTrace().getOutput()).isEqualTo("8\n");
            assertThat(result.getTrace().getSteps())
                    .extracting(step -> step.getControlFlow() == null ? null : step.getControlFlow().getKind())
                    .contains(ControlFlow.Kind.CALL_ENTER, ControlFlow.Kind.CALL_RETURN);
        }

        @Test
        void constCannotChange() {
            SimulationResult result = run("const a = 1;\na = 2;\n");

            assertThat(result.getFault().getKind()).isEqualTo(FaultKind.TYPE_MISMATCH);
            assertThat(result.getFault().getLine()).isEqualTo(2);
        }

        @Test
        void looseAndStrictEquality() {
            SimulationResult result = run("let a = 1 == '1';\nlet b = 1 === '1';\n");

            Step step = last(result);
            assertThat(step.variable("a").getValue()).isEqualTo("true");
            assertThat(step.variable("b").getValue()).isEqualTo("false");
            assertThat(step.variable("b").getType()).isEqualTo("boolean");
        }

        @Test
        void divisionKeepsWholeNumbersWhole() {
            SimulationResult result = run("let x = 7 / 2;\nlet y = 6 / 2;\n");

            Step step = last(result);
            assertThat(step.variable("x").getValue()).isEqualTo("3.5");
            assertThat(step.variable("y").getValue()).isEqualTo("3");
        }

        @Test
        void undeclaredAssignmentCreatesGlobal() {
            SimulationResult result = run("count = 5;\nconsole.log(count);\n");

            assertThat(result.isCompletedSuccessfully()).isTrue();
            assertThat(result.getTrace().getOutput()).isEqualTo("5\n");
        }

        @Test
        void arrayPushAndLength() {
            SimulationResult result = run("let xs = [1, 2];\nxs.push(3);\nconsole.log(xs.length);\n");

            assertThat(result.isCompletedSuccessfully()).isTrue();
            assertThat(result.getTrace().getOutput()).isEqualTo("3\n");
            assertThat(last(result).variable("xs").getValue()).isEqualTo("[1, 2, 3]");
        }

        @Test
        void divisionByZeroFaults() {
            SimulationResult result = run("let x = 1;\nlet y = x / 0;\n");

            assertThat(result.getFault().getKind()).isEqualTo(FaultKind.DIVISION_BY_ZERO);
            assertThat(result.getFault().getLine()).isEqualTo(2);
        }

        @Test
        void forbiddenCallIsRefused() {
            SimulationResult result = run("let name = prompt('name?');\n");

            assertThat(result.getTrace().isEmpty()).isTrue();
            assertThat(result.getFault().getKind()).isEqualTo(FaultKind.UNSUPPORTED_CONSTRUCT);
        }
    }

    @Nested
    class Java {

        private SimulationResult run(String code) {
            return simulate(code, Language.JAVA_LIKE);
        }

        @Test
        @DisplayName("main runs after the class is read, and its calls nest")
        void mainMethod() {
            SimulationResult result = run("public class Main {\n"
                    + "    static int square(int n) {\n"
                    + "        return n * n;\n"
                    + "    }\n"
                    + "    public static void main(String[] args) {\n"
                    + "        int x = square(3);\n"
                    + "        System.out.println(x);\n"
                    + "    }\n"
                    + "}\n");

            assertThat(result.isCompletedSuccessfully()).isTrue();
            assertThat(result.getTrace().getOutput()).isEqualTo("9\n");
            assertThat(result.getTrace().getSteps()).extracting(Step::getDescription).containsExactly(
                    "Call main([])", "Call square(3)", "Return 9 from square", "Set x to 9", "Print 9",
                    "Return from main");
            Step inSquare = result.getTrace().step(1);
            assertThat(inSquare.getCallStack()).isEqualTo("main -> square");
            assertThat(inSquare.getFrame().getLocals().get("n").getType()).isEqualTo("int");
            Step inMain = result.getTrace().step(3);
            assertThat(inMain.getFrame().getFunctionName()).isEqualTo("main");
            assertThat(inMain.getFrame().getLocals().get("args").getType()).isEqualTo("String[]");
        }

        @Test
        @DisplayName("int values wrap around at 32 bits")
        void intOverflow() {
            SimulationResult result = run("int big = 2147483647;\nbig = big + 1;\nSystem.out.println(big);\n");

            assertThat(result.getTrace().getOutput()).isEqualTo("-2147483648\n");
        }

        @Test
        void integerDivisionTruncates() {
            SimulationResult result = run("int a = 7 / 2;\ndouble b = 7 / 2.0;\n");

            Step step = last(result);
            assertThat(step.variable("a").getValue()).isEqualTo("3");
            assertThat(step.variable("b").getValue()).isEqualTo("3.5");
            assertThat(step.variable("b").getType()).isEqualTo("double");
        }

        @Test
        void doubleDoesNotFitInInt() {
            SimulationResult result = run("int n = 2.5;\n");

            assertThat(result.getFault().getKind()).isEqualTo(FaultKind.TYPE_MISMATCH);
        }

        @Test
        void conditionMustBeBoolean() {
            SimulationResult result = run("int n = 1;\nif (n) {\n}\n");

            assertThat(result.getFault().getKind()).isEqualTo(FaultKind.TYPE_MISMATCH);
            assertThat(result.getFault().getLine()).isEqualTo(2);
        }

        @Test
        void enhancedForOverArray() {
            SimulationResult result = run("int[] xs = {1, 2, 3};\nint sum = 0;\nfor (int x : xs) {\n    sum += x;\n}\n"
                    + "System.out.println(sum);\n");

            assertThat(result.isCompletedSuccessfully()).isTrue();
            assertThat(result.getTrace().getOutput()).isEqualTo("6\n");
            assertThat(last(result).variable("x")).as("loop variable ends with its block").isNull();
        }

        @Test
        void finalCannotChange() {
            SimulationResult result = run("final int k = 1;\nk = 2;\n");

            assertThat(result.getFault().getKind()).isEqualTo(FaultKind.TYPE_MISMATCH);
            assertThat(result.getFault().getMessage()).isEqualTo("'k' is a constant and cannot change");
        }

        @Test
        void assigningUndeclaredName() {
            SimulationResult result = run("y = 3;\n");

            assertThat(result.getFault().getKind()).isEqualTo(FaultKind.UNDEFINED_NAME);
        }

        @Test
        void stringConcatenation() {
            SimulationResult result = run("String s = \"n=\" + 5;\n");

            Step step = last(result);
            assertThat(step.variable("s").getValue()).isEqualTo("\"n=5\"");
            assertThat(step.variable("s").getType()).isEqualTo("String");
        }
    }
}
