package com.frosted.tracer.simulation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frosted.tracer.model.ControlFlow;
import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.RuntimeFault;
import com.frosted.tracer.model.SimulationResult;
import com.frosted.tracer.model.Step;
import com.frosted.tracer.syntax.ParseResult;
import com.frosted.tracer.syntax.SyntaxParser;
import com.frosted.tracer.syntax.SyntaxTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionSimulatorTest {

    private final SyntaxParser parser = new SyntaxParser();
    private final ExecutionSimulator simulator = new ExecutionSimulator();

    private SyntaxTree tree(String code) {
        ParseResult parsed = parser.parse(code, Language.PYTHON_LIKE);
        assertThat(parsed.getErrors()).as("parse errors").isEmpty();
        return parsed.getTree();
    }

    private SimulationResult simulate(String code) {
        return simulator.simulate(tree(code));
    }

    private static List<ControlFlow.Kind> controlFlow(SimulationResult result) {
        return result.getTrace().getSteps().stream()
                .filter(step -> step.getControlFlow() != null)
                .map(step -> step.getControlFlow().getKind())
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("A counting loop shows each iteration with the loop variable changing")
    void rangeLoop() {
        SimulationResult result = simulate("for i in range(3):\n    print(i)\n");

        assertThat(result.isCompletedSuccessfully()).isTrue();
        assertThat(result.getTrace().getOutput()).isEqualTo("0\n1\n2\n");
        assertThat(controlFlow(result)).containsExactly(
                ControlFlow.Kind.ENTER_LOOP,
                ControlFlow.Kind.LOOP_ITERATION, ControlFlow.Kind.LOOP_ITERATION, ControlFlow.Kind.LOOP_ITERATION,
                ControlFlow.Kind.EXIT_LOOP);

        List<Step> iterations = result.getTrace().getSteps().stream()
                .filter(step -> step.getControlFlow() != null
                        && step.getControlFlow().getKind() == ControlFlow.Kind.LOOP_ITERATION)
                .collect(Collectors.toList());
        for (int n = 0; n < 3; n++) {
            Step step = iterations.get(n);
            assertThat(step.getControlFlow().getIteration()).isEqualTo(n + 1);
            assertThat(step.variable("i").getValue()).isEqualTo(String.valueOf(n));
            assertThat(step.variable("i").getType()).isEqualTo("int");
            assertThat(step.variable("i").isChanged()).isTrue();
            assertThat(step.getDescription()).isEqualTo("Iteration " + (n + 1) + ": i = " + n);
        }

        Step print = result.getTrace().step(2);
        assertThat(print.getDescription()).isEqualTo("Print 0");
        assertThat(print.getLine()).isEqualTo(2);
        assertThat(print.getOutput()).isEqualTo("0\n");
        assertThat(print.variable("i").isChanged()).isFalse();
    }

    @Test
    @DisplayName("Division by zero stops the run on the faulting line")
    void divisionByZero() {
        SimulationResult result = simulate("x = 1 / 0\n");

        RuntimeFault fault = result.getFault();
        assertThat(fault.getKind()).isEqualTo(FaultKind.DIVISION_BY_ZERO);
        assertThat(fault.getLine()).isEqualTo(1);
        assertThat(result.getTrace().size()).isEqualTo(1);
        assertThat(result.getTrace().step(0).getLine()).isEqualTo(1);
        assertThat(result.getTrace().step(0).variable("x")).isNull();
    }

    @Test
    @DisplayName("An endless loop stops at the step budget")
    void endlessLoop() {
        SimulationResult result = simulate("x = 0\nwhile True:\n    x += 1\n");

        assertThat(result.getTrace().size()).isEqualTo(ExecutionSimulator.STEP_BUDGET);
        assertThat(result.getFault().getKind()).isEqualTo(FaultKind.STEP_BUDGET_EXCEEDED);
        List<Step> steps = result.getTrace().getSteps();
        for (int i = 0; i < steps.size(); i++) {
            assertThat(steps.get(i).getNumber()).isEqualTo(i);
        }
    }

    @Test
    void oneBranchStepPerCondition() {
        SimulationResult result = simulate("for i in range(4):\n    if i % 2 == 0:\n        print(i)\n");

        List<Step> branches = result.getTrace().getSteps().stream()
                .filter(step -> step.getControlFlow() != null
                        && step.getControlFlow().getKind() == ControlFlow.Kind.BRANCH_TAKEN)
                .collect(Collectors.toList());
        assertThat(branches).hasSize(4);
        assertThat(branches).extracting(step -> step.getControlFlow().getBranch())
                .containsExactly(true, false, true, false);
        assertThat(result.getTrace().getOutput()).isEqualTo("0\n2\n");
    }

    @Test
    void elseBranch() {
        SimulationResult result = simulate("x = 2\nif x > 3:\n    print('big')\nelse:\n    print('small')\n");

        assertThat(result.getTrace().getSteps()).extracting(Step::getDescription).containsExactly(
                "Set x to 2", "Condition is false, run the else branch", "Print small");
        assertThat(result.getTrace().step(2).getLine()).isEqualTo(5);
    }

    @Test
    @DisplayName("Calls push a frame and return to the caller")
    void functionCall() {
        SimulationResult result = simulate("def add(a, b):\n    return a + b\n\nresult = add(2, 3)\nprint(result)\n");

        assertThat(result.isCompletedSuccessfully()).isTrue();
        assertThat(result.getTrace().getSteps()).extracting(Step::getDescription).containsExactly(
                "Define function add(a, b)", "Call add(2, 3)", "Return 5 from add", "Set result to 5", "Print 5");

        Step enter = result.getTrace().step(1);
        assertThat(enter.getControlFlow()).isEqualTo(ControlFlow.callEnter("add"));
        assertThat(enter.getFrame().getFunctionName()).isEqualTo("add");
        assertThat(enter.getFrame().getReturnLine()).isEqualTo(4);
        assertThat(enter.getFrame().getLocals()).containsOnlyKeys("a", "b");
        assertThat(enter.getCallStack()).isEqualTo("main -> add");

        Step exit = result.getTrace().step(2);
        assertThat(exit.getControlFlow()).isEqualTo(ControlFlow.callReturn("add"));
        assertThat(exit.getLine()).isEqualTo(2);

        Step after = result.getTrace().step(3);
        assertThat(after.getFrame()).isNull();
        assertThat(after.getCallStack()).isEqualTo("main");
        assertThat(after.variable("result").getValue()).isEqualTo("5");
    }

    @Test
    void recursionWithBaseCase() {
        SimulationResult result = simulate(
                "def fact(n):\n    if n <= 1:\n        return 1\n    return n * fact(n - 1)\n\nprint(fact(5))\n");

        assertThat(result.isCompletedSuccessfully()).isTrue();
        assertThat(result.getTrace().getOutput()).isEqualTo("120\n");
        assertThat(result.getTrace().getSteps()).extracting(Step::getCallStack)
                .contains("main -> fact -> fact -> fact -> fact -> fact");
    }

    @Test
    @DisplayName("Recursion without a base case stops at the frame limit")
    void unboundRecursion() {
        SimulationResult result = simulate("def f(n):\n    return f(n + 1)\n\nf(0)\n");

        assertThat(result.getFault().getKind()).isEqualTo(FaultKind.UNBOUND_RECURSION);
        assertThat(result.getFault().getLine()).isEqualTo(2);
        long enters = result.getTrace().getSteps().stream()
                .filter(step -> step.getControlFlow() != null
                        && step.getControlFlow().getKind() == ControlFlow.Kind.CALL_ENTER)
                .count();
        assertThat(enters).isEqualTo(ExecutionSimulator.MAX_FRAMES);
    }

    @Test
    void breakLeavesTheLoop() {
        SimulationResult result = simulate(
                "n = 0\nwhile True:\n    n += 1\n    if n == 3:\n        break\nprint(n)\n");

        assertThat(result.isCompletedSuccessfully()).isTrue();
        assertThat(result.getTrace().getOutput()).isEqualTo("3\n");
        assertThat(controlFlow(result)).filteredOn(kind -> kind == ControlFlow.Kind.EXIT_LOOP).hasSize(1);
        assertThat(result.getTrace().getSteps()).extracting(Step::getDescription).contains("Break out of the loop");
    }

    @Test
    @DisplayName("Returning from inside a loop closes the loop before the call returns")
    void returnLeavesTheLoop() {
        SimulationResult result = simulate("def f():\n    for i in range(3):\n        return i\nprint(f())\n");

        assertThat(result.isCompletedSuccessfully()).isTrue();
        assertThat(result.getTrace().getOutput()).isEqualTo("0\n");
        assertThat(controlFlow(result)).containsExactly(
                ControlFlow.Kind.CALL_ENTER,
                ControlFlow.Kind.ENTER_LOOP,
                ControlFlow.Kind.LOOP_ITERATION,
                ControlFlow.Kind.EXIT_LOOP,
                ControlFlow.Kind.CALL_RETURN);
        Step exit = result.getTrace().getSteps().stream()
                .filter(step -> step.getControlFlow() != null
                        && step.getControlFlow().getKind() == ControlFlow.Kind.EXIT_LOOP)
                .findFirst().orElseThrow();
        assertThat(exit.getLine()).isEqualTo(2);
        assertThat(exit.getCallStack()).isEqualTo("main -> f");
    }

    @Test
    void returnClosesEveryEnclosingLoop() {
        SimulationResult result = simulate("def find(grid):\n    for row in grid:\n        for x in row:\n"
                + "            if x == 2:\n                return x\n    return 0\nprint(find([[1, 2], [3]]))\n");

        assertThat(result.isCompletedSuccessfully()).isTrue();
        assertThat(result.getTrace().getOutput()).isEqualTo("2\n");
        List<Step> exits = result.getTrace().getSteps().stream()
                .filter(step -> step.getControlFlow() != null
                        && step.getControlFlow().getKind() == ControlFlow.Kind.EXIT_LOOP)
                .collect(Collectors.toList());
        assertThat(exits).extracting(Step::getLine).containsExactly(3, 2);
        assertThat(controlFlow(result)).filteredOn(kind -> kind == ControlFlow.Kind.ENTER_LOOP).hasSize(2);
        assertThat(controlFlow(result)).endsWith(
                ControlFlow.Kind.EXIT_LOOP, ControlFlow.Kind.EXIT_LOOP, ControlFlow.Kind.CALL_RETURN);
    }

    @Test
    void framesCarryTheirRecursionLevel() {
        SimulationResult result = simulate(
                "def fact(n):\n    if n <= 1:\n        return 1\n    return n * fact(n - 1)\n\nprint(fact(3))\n");

        List<Integer> levels = result.getTrace().getSteps().stream()
                .filter(step -> step.getControlFlow() != null
                        && step.getControlFlow().getKind() == ControlFlow.Kind.CALL_ENTER)
                .map(step -> step.getFrame().getRecursionLevel())
                .collect(Collectors.toList());
        assertThat(levels).containsExactly(0, 1, 2);
    }

    @Test
    void listOperations() {
        SimulationResult result = simulate("xs = [3, 1]\nxs.append(2)\nprint(len(xs), max(xs), xs)\n");

        assertThat(result.isCompletedSuccessfully()).isTrue();
        assertThat(result.getTrace().getOutput()).isEqualTo("3 3 [3, 1, 2]\n");
        assertThat(result.getTrace().step(1).variable("xs").getValue()).isEqualTo("[3, 1, 2]");
        assertThat(result.getTrace().step(1).variable("xs").isChanged()).isTrue();
    }

    @Test
    void indexOutOfRange() {
        SimulationResult result = simulate("xs = [1, 2]\nprint(xs[5])\n");

        assertThat(result.getFault().getKind()).isEqualTo(FaultKind.INDEX_OUT_OF_RANGE);
        assertThat(result.getFault().getLine()).isEqualTo(2);
        assertThat(result.getTrace().size()).isEqualTo(2);
    }

    @Test
    void typeMismatch() {
        SimulationResult result = simulate("x = 'a' + 1\n");

        assertThat(result.getFault().getKind()).isEqualTo(FaultKind.TYPE_MISMATCH);
    }

    @Test
    void undefinedNameAtRuntime() {
        SimulationResult result = simulate("print(missing)\n");

        assertThat(result.getFault().getKind()).isEqualTo(FaultKind.UNDEFINED_NAME);
        assertThat(result.getFault().getMessage()).contains("missing");
    }

    @Test
    @DisplayName("Unsupported constructs are refused before anything runs")
    void refusal() {
        SimulationResult imported = simulate("import math\nx = 1\n");
        SimulationResult input = simulate("x = 1\ny = input()\n");

        assertThat(imported.getTrace().isEmpty()).isTrue();
        assertThat(imported.getFault().getKind()).isEqualTo(FaultKind.UNSUPPORTED_CONSTRUCT);
        assertThat(imported.getFault().getMessage()).isEqualTo("Import statement is not supported by the tracer (line 1)");
        assertThat(input.getTrace().isEmpty()).isTrue();
        assertThat(input.getFault().getMessage()).isEqualTo("Calling input() is not supported by the tracer (line 2)");
    }

    @Test
    @DisplayName("Simulating the same tree twice gives identical traces")
    void deterministic() throws Exception {
        SyntaxTree tree = tree("total = 0\nfor n in [1, 2, 3]:\n    total += n\nprint(total)\n");
        ObjectMapper mapper = new ObjectMapper();

        String first = mapper.writeValueAsString(simulator.simulate(tree));
        String second = mapper.writeValueAsString(simulator.simulate(tree));

        assertThat(first).isEqualTo(second);
        assertThat(simulator.simulate(tree).getTrace()).isEqualTo(simulator.simulate(tree).getTrace());
    }

    @Test
    void floatDivisionAndFloorDivision() {
        SimulationResult result = simulate("a = 7 / 2\nb = 7 // 2\nc = -7 % 3\n");

        Step last = result.getTrace().step(2);
        assertThat(last.variable("a").getValue()).isEqualTo("3.5");
        assertThat(last.variable("a").getType()).isEqualTo("float");
        assertThat(last.variable("b").getValue()).isEqualTo("3");
        assertThat(last.variable("c").getValue()).isEqualTo("2");
    }

    @Test
    void stringValuesAreQuotedInSnapshots() {
        SimulationResult result = simulate("name = 'Ada'\nshout = name.upper()\n");

        Step last = result.getTrace().step(1);
        assertThat(last.variable("name").getValue()).isEqualTo("'Ada'");
        assertThat(last.variable("shout").getValue()).isEqualTo("'ADA'");
        assertThat(last.variable("shout").getType()).isEqualTo("str");
    }
}
