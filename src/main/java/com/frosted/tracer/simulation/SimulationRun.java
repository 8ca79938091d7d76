package com.frosted.tracer.simulation;

import com.frosted.tracer.model.ControlFlow;
import com.frosted.tracer.model.ExecutionTrace;
import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.FrameSnapshot;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.RuntimeFault;
import com.frosted.tracer.model.SimulationResult;
import com.frosted.tracer.model.Step;
import com.frosted.tracer.model.VariableSnapshot;
import com.frosted.tracer.syntax.SyntaxTree;
import com.frosted.tracer.syntax.node.AssignmentNode;
import com.frosted.tracer.syntax.node.BinaryOpNode;
import com.frosted.tracer.syntax.node.BinaryOperator;
import com.frosted.tracer.syntax.node.BlockNode;
import com.frosted.tracer.syntax.node.CallNode;
import com.frosted.tracer.syntax.node.ExpressionStatementNode;
import com.frosted.tracer.syntax.node.ForEachNode;
import com.frosted.tracer.syntax.node.ForNode;
import com.frosted.tracer.syntax.node.FunctionDeclNode;
import com.frosted.tracer.syntax.node.IdentifierNode;
import com.frosted.tracer.syntax.node.IfNode;
import com.frosted.tracer.syntax.node.IndexAccessNode;
import com.frosted.tracer.syntax.node.ListLiteralNode;
import com.frosted.tracer.syntax.node.LiteralNode;
import com.frosted.tracer.syntax.node.MemberAccessNode;
import com.frosted.tracer.syntax.node.NewArrayNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.ReturnNode;
import com.frosted.tracer.syntax.node.UnaryOpNode;
import com.frosted.tracer.syntax.node.VariableDeclNode;
import com.frosted.tracer.syntax.node.WhileNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One walk over a syntax tree, recording a step for every visible action. Holds all mutable
 * state of the simulated program, so each run gets a fresh instance.
 */
final class SimulationRun {
    private static final String GLOBAL_FRAME = "main";

    private final SyntaxTree tree;
    private final Language language;
    private final int stepBudget;
    private final ValueFormatter formatter;
    private final Operators operators;
    private final Builtins builtins;
    private final RecursionTracker recursionTracker;
    private final StringBuilder consoleOutput = new StringBuilder();
    private final List<Step> steps = new ArrayList<>();
    private final CallFrame globals = new CallFrame(GLOBAL_FRAME, 0, 0);
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final Map<String, FunctionDeclNode> methods = new HashMap<>();
    private int printedUpTo;
    private boolean faultRecorded;

    SimulationRun(SyntaxTree tree, int stepBudget, int maxFrames) {
        this.tree = tree;
        this.language = tree.getLanguage();
        this.stepBudget = stepBudget;
        this.formatter = new ValueFormatter(language);
        this.operators = new Operators(language, formatter);
        this.builtins = new Builtins(language, formatter, operators, consoleOutput);
        this.recursionTracker = new RecursionTracker(maxFrames);
    }

    SimulationResult run() {
        RuntimeFault fault = null;
        try {
            List<Integer> program = tree.getRoot().getStatements();
            hoistFunctions(program, globals);
            for (int statement : program) {
                executeStatement(statement);
            }
            FunctionDeclNode main = methods.get("main");
            if (language == Language.JAVA_LIKE && main != null) {
                List<Object> args = new ArrayList<>();
                for (int i = 0; i < main.getParameters().size(); i++) {
                    args.add(new ArrayList<>());
                }
                executeMethod(main, args, main.getStartLine());
            }
        } catch (SimulationFault e) {
            fault = e.getFault();
            if (!faultRecorded) {
                recordFault(fault);
            }
        } catch (ControlSignal signal) {
            // a return or break outside any function or loop ends the program
        } catch (StackOverflowError e) {
            int line = steps.isEmpty() ? 1 : steps.get(steps.size() - 1).getLine();
            fault = new RuntimeFault(FaultKind.UNBOUND_RECURSION, line,
                    "The program nests too deeply to trace; check that the recursion stops");
        }
        return new SimulationResult(new ExecutionTrace(steps), fault);
    }

    // ---- statements ----

    private void executeStatement(int id) {
        try {
            dispatch(tree.node(id));
        } catch (SimulationFault e) {
            if (!faultRecorded) {
                faultRecorded = true;
                recordFault(e.getFault());
            }
            throw e;
        }
    }

    private void dispatch(Node node) {
        int line = node.getStartLine();
        switch (node.kind()) {
            case FUNCTION_DECL:
                handleFunctionDeclaration((FunctionDeclNode) node);
                break;
            case VARIABLE_DECL:
                handleVariableDeclaration((VariableDeclNode) node, true);
                break;
            case ASSIGNMENT:
                handleAssignment((AssignmentNode) node, true);
                break;
            case EXPRESSION_STATEMENT:
                handleExpressionStatement((ExpressionStatementNode) node);
                break;
            case IF:
                handleIfStatement((IfNode) node);
                break;
            case WHILE:
                handleWhileLoop((WhileNode) node);
                break;
            case FOR:
                handleForLoop((ForNode) node);
                break;
            case FOR_EACH:
                handleForEachLoop((ForEachNode) node);
                break;
            case RETURN: {
                ReturnNode ret = (ReturnNode) node;
                Object value = ret.hasValue() ? evaluateExpression(ret.getValue()) : NoneValue.NONE;
                throw new ControlSignal.Return(value, line);
            }
            case BREAK:
                recordStep(line, "Break out of the loop", null);
                throw new ControlSignal.Break();
            case CONTINUE:
                recordStep(line, "Skip to the next iteration", null);
                throw new ControlSignal.Continue();
            case PASS:
                recordStep(line, "Do nothing", null);
                break;
            case BLOCK:
                executeBlock((BlockNode) node);
                break;
            default:
                throw new SimulationFault(FaultKind.UNSUPPORTED_CONSTRUCT, line,
                        "This statement is not supported by the tracer");
        }
    }

    private void executeBlock(BlockNode block) {
        boolean scoped = language == Language.JAVA_LIKE;
        if (scoped) getCurrentFrame().enterBlock();
        try {
            for (int statement : block.getStatements()) {
                executeStatement(statement);
            }
        } finally {
            if (scoped) getCurrentFrame().exitBlock();
        }
    }

    /** Runs a loop part (initialisation, update) without recording a step for it. */
    private void executeSilently(int id) {
        Node node = tree.node(id);
        switch (node.kind()) {
            case VARIABLE_DECL:
                handleVariableDeclaration((VariableDeclNode) node, false);
                break;
            case ASSIGNMENT:
                handleAssignment((AssignmentNode) node, false);
                break;
            case EXPRESSION_STATEMENT:
                evaluateExpression(((ExpressionStatementNode) node).getExpression());
                break;
            default:
                executeStatement(id);
        }
    }

    private void handleFunctionDeclaration(FunctionDeclNode function) {
        switch (language) {
            case PYTHON_LIKE:
                getCurrentFrame().declare(function.getName(), new FunctionValue(function), null, false);
                recordStep(function.getStartLine(),
                        "Define function " + function.getName() + "(" + String.join(", ", function.getParameters()) + ")",
                        null);
                break;
            case JAVASCRIPT_LIKE:
                Object bound = getCurrentFrame().get(function.getName());
                if (!(bound instanceof FunctionValue) || ((FunctionValue) bound).getDeclaration() != function) {
                    getCurrentFrame().declare(function.getName(), new FunctionValue(function), null, false);
                }
                break;
            default:
                // methods were collected before the run
                break;
        }
    }

    /** JavaScript function declarations and Java methods are usable before their line is reached. */
    private void hoistFunctions(List<Integer> statements, CallFrame frame) {
        for (int id : statements) {
            Node node = tree.node(id);
            if (!(node instanceof FunctionDeclNode)) continue;
            FunctionDeclNode function = (FunctionDeclNode) node;
            if (language == Language.JAVASCRIPT_LIKE) {
                frame.declare(function.getName(), new FunctionValue(function), null, false);
            } else if (language == Language.JAVA_LIKE) {
                methods.put(function.getName(), function);
            }
        }
    }

    private void handleVariableDeclaration(VariableDeclNode declaration, boolean record) {
        int line = declaration.getStartLine();
        String name = declaration.getName();
        String type = declaration.getDeclaredType();
        Object value = declaration.hasInitializer()
                ? evaluateExpression(declaration.getInitializer())
                : defaultValue(type);
        value = convert(value, type, name, line);
        getCurrentFrame().declare(name, value, type, declaration.isConstant());
        if (record) {
            String description = declaration.hasInitializer()
                    ? "Set " + name + " to " + formatter.inspect(value)
                    : "Declare " + name;
            recordStep(line, description, null);
        }
    }

    private void handleAssignment(AssignmentNode assignment, boolean record) {
        int line = assignment.getStartLine();
        Node target = tree.node(assignment.getTarget());
        BinaryOperator compound = assignment.getCompoundOperator();
        Object value;
        if (compound != null) {
            Object current = evaluateExpression(target.getId());
            value = operators.binary(compound, current, evaluateExpression(assignment.getValue()), line);
            if (language == Language.JAVA_LIKE && current instanceof Long && value instanceof Double) {
                // compound assignment casts back to the variable's type
                value = ((Double) value).longValue();
            }
        } else {
            value = evaluateExpression(assignment.getValue());
        }
        String shown = assignTo(target, value, line);
        if (record) {
            recordStep(line, (compound != null ? "Update " : "Set ") + shown, null);
        }
    }

    /** Stores the value and returns "name to value" for the step description. */
    private String assignTo(Node target, Object value, int line) {
        if (target instanceof IdentifierNode) {
            String name = ((IdentifierNode) target).getName();
            Object stored = updateVariable(name, value, line);
            return name + " to " + formatter.inspect(stored);
        }
        if (target instanceof IndexAccessNode) {
            IndexAccessNode access = (IndexAccessNode) target;
            Object container = evaluateExpression(access.getTarget());
            Object index = evaluateExpression(access.getIndex());
            if (!(container instanceof List)) {
                throw operators.mismatch(line, "Cannot change an item of " + operators.describe(container));
            }
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) container;
            int position = operators.index(index, list.size(), line);
            Object stored = value;
            Node owner = tree.node(access.getTarget());
            if (owner instanceof IdentifierNode) {
                String arrayType = declaredTypeOf(((IdentifierNode) owner).getName());
                if (arrayType != null && arrayType.endsWith("[]")) {
                    stored = convert(value, arrayType.substring(0, arrayType.length() - 2),
                            ((IdentifierNode) owner).getName() + "[" + position + "]", line);
                }
            }
            list.set(position, stored);
            return describeTarget(access.getTarget()) + "[" + formatter.inspect(index) + "] to " + formatter.inspect(stored);
        }
        throw new SimulationFault(FaultKind.UNSUPPORTED_CONSTRUCT, line, "Cannot assign to this expression");
    }

    private void handleExpressionStatement(ExpressionStatementNode statement) {
        int line = statement.getStartLine();
        Node expression = tree.node(statement.getExpression());
        int outputBefore = consoleOutput.length();
        Object value = evaluateExpression(expression.getId());
        String description;
        if (consoleOutput.length() > outputBefore && isPrintCall(expression)) {
            String printed = consoleOutput.substring(outputBefore);
            description = "Print " + (printed.endsWith("\n") ? printed.substring(0, printed.length() - 1) : printed);
        } else if (expression instanceof CallNode) {
            description = "Call " + describeTarget(((CallNode) expression).getCallee())
                    + (value != NoneValue.NONE ? ", result " + formatter.inspect(value) : "");
        } else {
            description = "Evaluate to " + formatter.inspect(value);
        }
        recordStep(line, description, null);
    }

    private boolean isPrintCall(Node expression) {
        if (!(expression instanceof CallNode)) return false;
        String name = describeTarget(((CallNode) expression).getCallee());
        return name.equals("print") || name.equals("console.log") || name.startsWith("System.out.print");
    }

    private void handleIfStatement(IfNode ifNode) {
        int line = ifNode.getStartLine();
        boolean taken = operators.condition(evaluateExpression(ifNode.getCondition()), line);
        String description;
        if (taken) {
            description = "Condition is true, run the if branch";
        } else if (!ifNode.hasElse()) {
            description = "Condition is false, skip the if branch";
        } else if (tree.node(ifNode.getElseBranch()) instanceof IfNode) {
            description = "Condition is false, check the next condition";
        } else {
            description = "Condition is false, run the else branch";
        }
        recordStep(line, description, ControlFlow.branchTaken(taken));
        if (taken) {
            executeStatement(ifNode.getThenBranch());
        } else if (ifNode.hasElse()) {
            executeStatement(ifNode.getElseBranch());
        }
    }

    private void handleWhileLoop(WhileNode loop) {
        int line = loop.getStartLine();
        recordStep(line, "Start loop", ControlFlow.enterLoop());
        int iteration = 0;
        while (true) {
            if (!operators.condition(evaluateExpression(loop.getCondition()), line)) {
                recordStep(line, "Loop finished", ControlFlow.exitLoop());
                return;
            }
            iteration++;
            recordStep(line, "Iteration " + iteration, ControlFlow.loopIteration(iteration));
            if (!runLoopBody(loop.getBody(), line)) {
                return;
            }
        }
    }

    private void handleForLoop(ForNode loop) {
        int line = loop.getStartLine();
        boolean scoped = language == Language.JAVA_LIKE;
        if (scoped) getCurrentFrame().enterBlock();
        try {
            if (loop.getInit() != Node.NONE) {
                executeSilently(loop.getInit());
            }
            recordStep(line, "Start loop", ControlFlow.enterLoop());
            int iteration = 0;
            while (true) {
                if (loop.getCondition() != Node.NONE
                        && !operators.condition(evaluateExpression(loop.getCondition()), line)) {
                    recordStep(line, "Loop finished", ControlFlow.exitLoop());
                    return;
                }
                iteration++;
                recordStep(line, "Iteration " + iteration, ControlFlow.loopIteration(iteration));
                if (!runLoopBody(loop.getBody(), line)) {
                    return;
                }
                if (loop.getUpdate() != Node.NONE) {
                    executeSilently(loop.getUpdate());
                }
            }
        } finally {
            if (scoped) getCurrentFrame().exitBlock();
        }
    }

    private void handleForEachLoop(ForEachNode loop) {
        int line = loop.getStartLine();
        List<Object> items = operators.iterate(evaluateExpression(loop.getIterable()), line);
        boolean scoped = language == Language.JAVA_LIKE;
        if (scoped) getCurrentFrame().enterBlock();
        try {
            recordStep(line, "Start loop", ControlFlow.enterLoop());
            for (int i = 0; i < items.size(); i++) {
                Object item = convert(items.get(i), loop.getDeclaredType(), loop.getVariable(), line);
                if (language == Language.PYTHON_LIKE) {
                    getCurrentFrame().set(loop.getVariable(), item);
                } else {
                    getCurrentFrame().declare(loop.getVariable(), item, loop.getDeclaredType(), false);
                }
                recordStep(line, "Iteration " + (i + 1) + ": " + loop.getVariable() + " = " + formatter.inspect(item),
                        ControlFlow.loopIteration(i + 1));
                if (!runLoopBody(loop.getBody(), line)) {
                    return;
                }
            }
            recordStep(line, "Loop finished", ControlFlow.exitLoop());
        } finally {
            if (scoped) getCurrentFrame().exitBlock();
        }
    }

    /**
     * Runs one iteration; false when the body left the loop with {@code break}. A {@code return}
     * closes the loop before it travels on to the enclosing call.
     */
    private boolean runLoopBody(int body, int loopLine) {
        try {
            executeStatement(body);
            return true;
        } catch (ControlSignal.Continue next) {
            return true;
        } catch (ControlSignal.Break exit) {
            recordStep(loopLine, "Loop finished", ControlFlow.exitLoop());
            return false;
        } catch (ControlSignal.Return ret) {
            if (steps.size() < stepBudget) {
                recordStep(loopLine, "Leave loop", ControlFlow.exitLoop());
            }
            throw ret;
        }
    }

    // ---- calls ----

    private Object executeMethod(FunctionDeclNode function, List<Object> args, int callLine) {
        String name = function.getName();
        if (args.size() != function.getParameters().size()) {
            int expected = function.getParameters().size();
            throw new SimulationFault(FaultKind.TYPE_MISMATCH, callLine, name + "() takes " + expected
                    + " argument" + (expected == 1 ? "" : "s") + " but got " + args.size());
        }
        if (!recursionTracker.canCall()) {
            throw new SimulationFault(FaultKind.UNBOUND_RECURSION, callLine,
                    "Too many nested calls (limit " + recursionTracker.getActiveFrames()
                            + "); check that the recursion reaches a base case");
        }
        int recursionLevel = recursionTracker.startCall(name);
        CallFrame frame = new CallFrame(name, callLine, recursionLevel);
        try {
            for (int i = 0; i < args.size(); i++) {
                String type = function.getParameterType(i);
                String parameter = function.getParameters().get(i);
                frame.declare(parameter, convert(args.get(i), type, parameter, callLine), type, false);
            }
            callStack.push(frame);
            BlockNode body = tree.node(function.getBody(), BlockNode.class);
            hoistFunctions(body.getStatements(), frame);

            recordStep(function.getStartLine(), "Call " + name + "(" + describeArguments(args) + ")",
                    ControlFlow.callEnter(name));

            Object returnValue = NoneValue.NONE;
            int returnLine = function.getEndLine();
            boolean returned = false;
            try {
                executeStatement(body.getId());
            } catch (ControlSignal.Return ret) {
                returnValue = ret.value;
                returnLine = ret.line;
                returned = true;
            } catch (ControlSignal stray) {
                // break/continue outside a loop ends the function
            }
            String returnType = function.getReturnType();
            if (returnType != null && !function.isVoid()) {
                if (!returned) {
                    throw new SimulationFault(FaultKind.TYPE_MISMATCH, returnLine,
                            name + "() ended without returning a " + returnType);
                }
                returnValue = convert(returnValue, returnType, "the result of " + name + "()", returnLine);
            }
            String description = returnValue == NoneValue.NONE
                    ? "Return from " + name
                    : "Return " + formatter.inspect(returnValue) + " from " + name;
            recordStep(returnLine, description, ControlFlow.callReturn(name));
            return returnValue;
        } finally {
            if (!callStack.isEmpty() && callStack.peek() == frame) {
                callStack.pop();
            }
            recursionTracker.endCall(name);
        }
    }

    private Object handleMethodCall(CallNode call) {
        int line = call.getStartLine();
        Node callee = tree.node(call.getCallee());
        if (callee instanceof IdentifierNode) {
            String name = ((IdentifierNode) callee).getName();
            FunctionDeclNode function = resolveFunction(name);
            if (function != null) {
                return executeMethod(function, evaluateArguments(call), line);
            }
            if (isDefined(name)) {
                throw operators.mismatch(line, name + " is " + operators.describe(getVariableValue(name, line))
                        + ", not a function");
            }
            if (Builtins.isFunction(language, name)) {
                return builtins.callFunction(name, evaluateArguments(call), line);
            }
            throw new SimulationFault(FaultKind.UNDEFINED_NAME, line, "'" + name + "' is not defined");
        }
        if (callee instanceof MemberAccessNode) {
            MemberAccessNode member = (MemberAccessNode) callee;
            String qualified = qualifiedName(member);
            if (qualified != null && Builtins.isQualifiedFunction(language, qualified)) {
                return builtins.callQualified(qualified, evaluateArguments(call), line);
            }
            Object target = evaluateExpression(member.getTarget());
            return builtins.callMethod(target, member.getMember(), evaluateArguments(call), line);
        }
        throw new SimulationFault(FaultKind.UNSUPPORTED_CONSTRUCT, line, "This kind of call is not supported");
    }

    private FunctionDeclNode resolveFunction(String name) {
        if (language == Language.JAVA_LIKE) {
            return methods.get(name);
        }
        if (!isDefined(name)) {
            return null;
        }
        Object value = getVariableValue(name, 0);
        return value instanceof FunctionValue ? ((FunctionValue) value).getDeclaration() : null;
    }

    private List<Object> evaluateArguments(CallNode call) {
        List<Object> args = new ArrayList<>(call.getArguments().size());
        for (int argument : call.getArguments()) {
            args.add(evaluateExpression(argument));
        }
        return args;
    }

    /** "System.out.println" for a chain of plain names that are not program variables, else null. */
    private String qualifiedName(MemberAccessNode member) {
        Node target = tree.node(member.getTarget());
        if (target instanceof IdentifierNode) {
            String root = ((IdentifierNode) target).getName();
            return isDefined(root) ? null : root + "." + member.getMember();
        }
        if (target instanceof MemberAccessNode) {
            String prefix = qualifiedName((MemberAccessNode) target);
            return prefix == null ? null : prefix + "." + member.getMember();
        }
        return null;
    }

    // ---- expressions ----

    private Object evaluateExpression(int id) {
        Node node = tree.node(id);
        int line = node.getStartLine();
        switch (node.kind()) {
            case LITERAL: {
                Object value = ((LiteralNode) node).getValue();
                return value == null ? NoneValue.NONE : value;
            }
            case IDENTIFIER:
                return getVariableValue(((IdentifierNode) node).getName(), line);
            case BINARY_OP:
                return evaluateBinaryExpression((BinaryOpNode) node);
            case UNARY_OP: {
                UnaryOpNode unary = (UnaryOpNode) node;
                return operators.unary(unary.getOperator(), evaluateExpression(unary.getOperand()), line);
            }
            case LIST_LITERAL: {
                List<Integer> elements = ((ListLiteralNode) node).getElements();
                Operators.checkSize(elements.size(), line);
                List<Object> list = new ArrayList<>(elements.size());
                for (int element : elements) {
                    list.add(evaluateExpression(element));
                }
                return list;
            }
            case NEW_ARRAY: {
                NewArrayNode array = (NewArrayNode) node;
                Object size = evaluateExpression(array.getSize());
                if (!(size instanceof Long) || (Long) size < 0) {
                    throw operators.mismatch(line, "An array size must be a whole number of at least 0, not "
                            + formatter.inspect(size));
                }
                Operators.checkSize((Long) size, line);
                List<Object> list = new ArrayList<>();
                Object initial = defaultValue(array.getElementType());
                for (long i = 0; i < (Long) size; i++) {
                    list.add(initial);
                }
                return list;
            }
            case INDEX_ACCESS:
                return evaluateIndexAccess((IndexAccessNode) node);
            case MEMBER_ACCESS: {
                MemberAccessNode member = (MemberAccessNode) node;
                return builtins.property(evaluateExpression(member.getTarget()), member.getMember(), line);
            }
            case EXPRESSION_CALL:
                return handleMethodCall((CallNode) node);
            default:
                throw new SimulationFault(FaultKind.UNSUPPORTED_CONSTRUCT, line,
                        "This expression is not supported by the tracer");
        }
    }

    private Object evaluateBinaryExpression(BinaryOpNode binary) {
        int line = binary.getStartLine();
        BinaryOperator operator = binary.getOperator();
        Object left = evaluateExpression(binary.getLeft());
        if (operator.isLogical()) {
            if (language == Language.JAVA_LIKE) {
                boolean l = operators.condition(left, line);
                if (operator == BinaryOperator.AND ? !l : l) {
                    return l;
                }
                return operators.condition(evaluateExpression(binary.getRight()), line);
            }
            boolean truthy = operators.isTruthy(left);
            if (operator == BinaryOperator.AND ? !truthy : truthy) {
                return left;
            }
            return evaluateExpression(binary.getRight());
        }
        return operators.binary(operator, left, evaluateExpression(binary.getRight()), line);
    }

    private Object evaluateIndexAccess(IndexAccessNode access) {
        int line = access.getStartLine();
        Object container = evaluateExpression(access.getTarget());
        Object index = evaluateExpression(access.getIndex());
        if (container instanceof List) {
            List<?> list = (List<?>) container;
            return list.get(operators.index(index, list.size(), line));
        }
        if (container instanceof String) {
            String text = (String) container;
            return String.valueOf(text.charAt(operators.index(index, text.length(), line)));
        }
        if (container instanceof RangeValue) {
            RangeValue range = (RangeValue) container;
            return range.get(operators.index(index, (int) Math.min(range.size(), Integer.MAX_VALUE), line));
        }
        throw operators.mismatch(line, "Cannot index into " + operators.describe(container));
    }

    // ---- variables ----

    private CallFrame getCurrentFrame() {
        return callStack.isEmpty() ? globals : callStack.peek();
    }

    private boolean isDefined(String name) {
        return getCurrentFrame().has(name) || globals.has(name)
                || language == Language.PYTHON_LIKE && name.equals("__name__");
    }

    private Object getVariableValue(String name, int line) {
        CallFrame frame = getCurrentFrame();
        if (frame.has(name)) return frame.get(name);
        if (globals.has(name)) return globals.get(name);
        if (language == Language.PYTHON_LIKE && name.equals("__name__")) return "__main__";
        throw new SimulationFault(FaultKind.UNDEFINED_NAME, line, "'" + name + "' is not defined");
    }

    private String declaredTypeOf(String name) {
        CallFrame frame = getCurrentFrame();
        if (frame.has(name)) return frame.declaredType(name);
        return globals.has(name) ? globals.declaredType(name) : null;
    }

    /** Assigns to an existing variable (or creates one where the language allows) and returns the stored value. */
    private Object updateVariable(String name, Object value, int line) {
        CallFrame frame = getCurrentFrame();
        CallFrame owner = frame.has(name) ? frame : globals.has(name) ? globals : null;
        if (language == Language.PYTHON_LIKE) {
            frame.set(name, value);
            return value;
        }
        if (owner == null) {
            if (language == Language.JAVA_LIKE) {
                throw new SimulationFault(FaultKind.UNDEFINED_NAME, line,
                        "'" + name + "' is not declared; add a type such as int " + name);
            }
            globals.set(name, value);
            return value;
        }
        if (owner.isConstant(name)) {
            throw new SimulationFault(FaultKind.TYPE_MISMATCH, line, "'" + name + "' is a constant and cannot change");
        }
        Object stored = convert(value, owner.declaredType(name), name, line);
        owner.set(name, stored);
        return stored;
    }

    private Object defaultValue(String type) {
        if (language != Language.JAVA_LIKE || type == null) {
            return NoneValue.NONE;
        }
        switch (type) {
            case "int":
            case "long":
            case "short":
            case "byte":
                return 0L;
            case "double":
            case "float":
                return 0.0;
            case "boolean":
                return false;
            case "char":
                return "\0";
            default:
                return NoneValue.NONE;
        }
    }

    /** Fits a value into a Java declared type; other languages store values unchanged. */
    private Object convert(Object value, String type, String name, int line) {
        if (language != Language.JAVA_LIKE || type == null) {
            return value;
        }
        switch (type) {
            case "int":
            case "short":
            case "byte":
                if (value instanceof Long) return (long) (int) (long) (Long) value;
                break;
            case "long":
                if (value instanceof Long) return value;
                break;
            case "double":
            case "float":
                if (value instanceof Long) return ((Long) value).doubleValue();
                if (value instanceof Double) return value;
                break;
            case "boolean":
                if (value instanceof Boolean) return value;
                break;
            case "char":
                if (value instanceof String && ((String) value).length() == 1) return value;
                break;
            case "String":
                if (value instanceof String || value == NoneValue.NONE) return value;
                break;
            default:
                if (!type.endsWith("[]") || value instanceof List || value == NoneValue.NONE) return value;
                break;
        }
        throw operators.mismatch(line, "Cannot store " + operators.describe(value) + " in " + name
                + ", which holds a " + type);
    }

    // ---- steps ----

    private void recordStep(int line, String description, ControlFlow controlFlow) {
        if (steps.size() >= stepBudget) {
            throw new SimulationFault(FaultKind.STEP_BUDGET_EXCEEDED, line,
                    "Stopped after " + stepBudget + " steps; the program may never finish");
        }
        Map<String, VariableSnapshot> variables = snapshot(globals);
        FrameSnapshot frame = null;
        if (!callStack.isEmpty()) {
            CallFrame top = callStack.peek();
            frame = new FrameSnapshot(top.getName(), snapshot(top), top.getCallLine(), top.getRecursionLevel());
        }
        String output = null;
        if (consoleOutput.length() > printedUpTo) {
            output = consoleOutput.substring(printedUpTo);
            printedUpTo = consoleOutput.length();
        }
        steps.add(new Step(steps.size(), line, description, variables, controlFlow, frame, describeCallStack(), output));
    }

    /** A final step at the faulting line, when the budget still allows one. */
    private void recordFault(RuntimeFault fault) {
        if (fault.getKind() == FaultKind.STEP_BUDGET_EXCEEDED || steps.size() >= stepBudget) {
            return;
        }
        recordStep(fault.getLine(), fault.getMessage(), null);
    }

    private Map<String, VariableSnapshot> snapshot(CallFrame frame) {
        Map<String, VariableSnapshot> previous = frame.getLastSnapshot();
        Map<String, VariableSnapshot> current = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : frame.getLocals().entrySet()) {
            String name = entry.getKey();
            VariableSnapshot state = new VariableSnapshot(
                    formatter.typeOf(entry.getValue(), frame.declaredType(name)),
                    formatter.inspect(entry.getValue()), true);
            if (state.sameState(previous.get(name))) {
                state = new VariableSnapshot(state.getType(), state.getValue(), false);
            }
            current.put(name, state);
        }
        frame.setLastSnapshot(current);
        return current;
    }

    private String describeCallStack() {
        StringBuilder sb = new StringBuilder();
        if (language != Language.JAVA_LIKE || callStack.isEmpty()) {
            sb.append(GLOBAL_FRAME);
        }
        Iterator<CallFrame> it = callStack.descendingIterator();
        while (it.hasNext()) {
            if (sb.length() > 0) sb.append(" -> ");
            sb.append(it.next().getName());
        }
        return sb.toString();
    }

    private String describeArguments(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(formatter.inspect(args.get(i)));
        }
        return sb.toString();
    }

    /** Source-like name of a callee or assignment target: {@code xs}, {@code console.log}, {@code grid[...]}. */
    private String describeTarget(int id) {
        Node node = tree.node(id);
        if (node instanceof IdentifierNode) {
            return ((IdentifierNode) node).getName();
        }
        if (node instanceof MemberAccessNode) {
            MemberAccessNode member = (MemberAccessNode) node;
            return describeTarget(member.getTarget()) + "." + member.getMember();
        }
        if (node instanceof IndexAccessNode) {
            return describeTarget(((IndexAccessNode) node).getTarget()) + "[...]";
        }
        if (node instanceof CallNode) {
            return describeTarget(((CallNode) node).getCallee()) + "(...)";
        }
        return "value";
    }
}
