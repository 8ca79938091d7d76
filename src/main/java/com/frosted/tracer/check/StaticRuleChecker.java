package com.frosted.tracer.check;

import com.frosted.tracer.model.ErrorKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.Severity;
import com.frosted.tracer.model.SourceText;
import com.frosted.tracer.model.StaticError;
import com.frosted.tracer.syntax.SyntaxTree;
import com.frosted.tracer.syntax.node.AssignmentNode;
import com.frosted.tracer.syntax.node.BlockNode;
import com.frosted.tracer.syntax.node.ExpressionStatementNode;
import com.frosted.tracer.syntax.node.ForEachNode;
import com.frosted.tracer.syntax.node.ForNode;
import com.frosted.tracer.syntax.node.FunctionDeclNode;
import com.frosted.tracer.syntax.node.IdentifierNode;
import com.frosted.tracer.syntax.node.IfNode;
import com.frosted.tracer.syntax.node.LiteralNode;
import com.frosted.tracer.syntax.node.MemberAccessNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.NodeKind;
import com.frosted.tracer.syntax.node.ReturnNode;
import com.frosted.tracer.syntax.node.VariableDeclNode;
import com.frosted.tracer.syntax.node.WhileNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based checks over a parsed tree: undefined names, body delimiters, indentation,
 * missing returns, unreachable code, misplaced returns and constant reassignment.
 *
 * <p>Stateless; every call walks the tree once with its own scope stack.
 */
public final class StaticRuleChecker {
    private static final Logger LOGGER = LoggerFactory.getLogger(StaticRuleChecker.class);

    private static final Map<Language, Set<String>> BUILTINS = new HashMap<>();

    static {
        BUILTINS.put(Language.PYTHON_LIKE, Set.of(
                "print", "len", "range", "str", "int", "float", "bool", "abs", "min", "max", "sum",
                "round", "list", "dict", "set", "tuple", "type", "input", "open", "sorted", "reversed",
                "enumerate", "zip", "isinstance", "map", "filter", "any", "all", "chr", "ord",
                "__name__", "eval", "exec"));
        BUILTINS.put(Language.JAVASCRIPT_LIKE, Set.of(
                "console", "Math", "parseInt", "parseFloat", "String", "Number", "Boolean", "Array",
                "Object", "JSON", "NaN", "Infinity", "isNaN", "alert", "prompt", "require", "fetch",
                "document", "window", "eval", "setTimeout"));
        BUILTINS.put(Language.JAVA_LIKE, Set.of(
                "System", "Math", "Integer", "Double", "Long", "Boolean", "Character", "String",
                "Arrays", "List", "ArrayList", "Scanner", "Collections", "Objects"));
    }

    public List<StaticError> check(SyntaxTree tree) {
        Run run = new Run(tree);
        run.checkProgram();
        List<StaticError> errors = new ArrayList<>(run.errors);
        errors.sort(StaticError.ORDER);
        LOGGER.debug("Rule check of {} found {} problems", tree.getLanguage(), errors.size());
        return errors;
    }

    /** State of one check. */
    private static final class Run {
        private final SyntaxTree tree;
        private final Language language;
        private final SourceText source;
        private final Set<String> builtins;
        private final Set<String> topLevelNames = new HashSet<>();
        private final Deque<Scope> scopes = new ArrayDeque<>();
        private final Set<StaticError> errors = new HashSet<>();
        private int functionDepth;

        Run(SyntaxTree tree) {
            this.tree = tree;
            this.language = tree.getLanguage();
            this.source = tree.getSource();
            this.builtins = BUILTINS.get(language);
        }

        void checkProgram() {
            List<Integer> statements = tree.getRoot().getStatements();
            collectTopLevel(statements);
            scopes.push(new Scope(false));
            if (language != Language.PYTHON_LIKE) {
                for (int id : statements) {
                    Node node = tree.node(id);
                    if (node instanceof FunctionDeclNode) {
                        scopes.peek().declare(((FunctionDeclNode) node).getName(), false);
                    }
                }
            }
            visitStatements(statements);
        }

        /** Names bound anywhere at top level outside functions; visible from function bodies. */
        private void collectTopLevel(List<Integer> statements) {
            Deque<Integer> pending = new ArrayDeque<>(statements);
            while (!pending.isEmpty()) {
                Node node = tree.node(pending.pop());
                if (node instanceof FunctionDeclNode) {
                    topLevelNames.add(((FunctionDeclNode) node).getName());
                    continue;
                }
                if (node instanceof VariableDeclNode) {
                    topLevelNames.add(((VariableDeclNode) node).getName());
                } else if (node instanceof AssignmentNode) {
                    Node target = tree.node(((AssignmentNode) node).getTarget());
                    if (target instanceof IdentifierNode) {
                        topLevelNames.add(((IdentifierNode) target).getName());
                    }
                } else if (node instanceof ForEachNode) {
                    topLevelNames.add(((ForEachNode) node).getVariable());
                }
                pending.addAll(node.children());
            }
        }

        // ---- statements ----

        private void visitStatements(List<Integer> statements) {
            for (int id : statements) {
                visitStatement(id);
            }
        }

        private void visitStatement(int id) {
            Node node = tree.node(id);
            switch (node.kind()) {
                case VARIABLE_DECL: {
                    VariableDeclNode declaration = (VariableDeclNode) node;
                    visitExpression(declaration.getInitializer());
                    scopes.peek().declare(declaration.getName(), declaration.isConstant());
                    break;
                }
                case ASSIGNMENT:
                    visitAssignment((AssignmentNode) node);
                    break;
                case FUNCTION_DECL:
                    visitFunction((FunctionDeclNode) node);
                    break;
                case IF: {
                    IfNode ifNode = (IfNode) node;
                    visitExpression(ifNode.getCondition());
                    visitBody(ifNode.getThenBranch());
                    if (ifNode.hasElse()) {
                        visitBody(ifNode.getElseBranch());
                    }
                    break;
                }
                case WHILE: {
                    WhileNode whileNode = (WhileNode) node;
                    visitExpression(whileNode.getCondition());
                    visitBody(whileNode.getBody());
                    break;
                }
                case FOR: {
                    ForNode forNode = (ForNode) node;
                    pushBlockScope();
                    if (forNode.getInit() != Node.NONE) visitStatement(forNode.getInit());
                    visitExpression(forNode.getCondition());
                    if (forNode.getUpdate() != Node.NONE) visitStatement(forNode.getUpdate());
                    visitBody(forNode.getBody());
                    popBlockScope();
                    break;
                }
                case FOR_EACH: {
                    ForEachNode forEach = (ForEachNode) node;
                    visitExpression(forEach.getIterable());
                    pushBlockScope();
                    scopes.peek().declare(forEach.getVariable(), false);
                    visitBody(forEach.getBody());
                    popBlockScope();
                    break;
                }
                case EXPRESSION_STATEMENT:
                    visitExpression(((ExpressionStatementNode) node).getExpression());
                    break;
                case RETURN:
                    if (functionDepth == 0 && language != Language.JAVA_LIKE) {
                        report(Severity.ERROR, node, ErrorKind.RETURN_OUTSIDE_FUNCTION,
                                "'return' can only be used inside a function",
                                "Remove the return or move this code into a function");
                    }
                    visitExpression(((ReturnNode) node).getValue());
                    break;
                case BLOCK:
                    pushBlockScope();
                    visitBlock((BlockNode) node);
                    popBlockScope();
                    break;
                default:
                    break;
            }
        }

        private void visitAssignment(AssignmentNode assignment) {
            visitExpression(assignment.getValue());
            Node target = tree.node(assignment.getTarget());
            if (!(target instanceof IdentifierNode)) {
                visitExpression(target.getId());
                return;
            }
            String name = ((IdentifierNode) target).getName();
            Scope owner = lookup(name);
            if (owner != null) {
                if (owner.isConstant(name)) {
                    report(Severity.ERROR, target, ErrorKind.CONST_REASSIGNMENT,
                            "'" + name + "' is a constant and cannot be changed",
                            "Declare '" + name + "' without " + (language == Language.JAVA_LIKE ? "final" : "const")
                                    + ", or use a new variable");
                }
                return;
            }
            boolean visibleGlobal = functionDepth > 0 && topLevelNames.contains(name) || builtins.contains(name);
            switch (language) {
                case PYTHON_LIKE:
                    if (assignment.getCompoundOperator() != null && !visibleGlobal) {
                        reportUndefined(target, name);
                    }
                    scopes.peek().declare(name, false);
                    break;
                case JAVASCRIPT_LIKE:
                    if (!visibleGlobal) {
                        report(Severity.WARNING, target, ErrorKind.UNDEFINED_VARIABLE,
                                "'" + name + "' is assigned without being declared",
                                "Declare it first: let " + name + " = ...");
                        scopes.getLast().declare(name, false);
                    }
                    break;
                default:
                    if (!visibleGlobal) {
                        report(Severity.ERROR, target, ErrorKind.UNDEFINED_VARIABLE,
                                "'" + name + "' is assigned but was never declared",
                                "Declare it with a type first, for example: int " + name + " = ...;");
                        scopes.peek().declare(name, false);
                    }
                    break;
            }
        }

        private void visitFunction(FunctionDeclNode function) {
            scopes.peek().declare(function.getName(), false);
            Scope scope = new Scope(true);
            for (String parameter : function.getParameters()) {
                scope.declare(parameter, false);
            }
            scopes.push(scope);
            functionDepth++;
            visitBlock(tree.node(function.getBody(), BlockNode.class));
            functionDepth--;
            scopes.pop();
            checkReturns(function);
        }

        /** A branch or loop body: a block, or an else-if chain. */
        private void visitBody(int id) {
            Node node = tree.node(id);
            if (node instanceof BlockNode) {
                pushBlockScope();
                visitBlock((BlockNode) node);
                popBlockScope();
            } else {
                visitStatement(id);
            }
        }

        private void visitBlock(BlockNode block) {
            checkDelimiter(block);
            checkIndentation(block);
            checkReachability(block);
            visitStatements(block.getStatements());
        }

        // ---- block rules ----

        private void checkDelimiter(BlockNode block) {
            if (block.isDelimited() || block.getStatements().isEmpty() && language != Language.PYTHON_LIKE) {
                return;
            }
            int headerColumn = block.getHeaderColumn();
            if (language == Language.PYTHON_LIKE) {
                errors.add(StaticError.error(block.getHeaderLine(), headerColumn, ErrorKind.MISSING_DELIMITER,
                        "The line starting this block must end with ':'", "Add ':' at the end of the line"));
            } else {
                errors.add(StaticError.warning(block.getHeaderLine(), headerColumn, ErrorKind.MISSING_DELIMITER,
                        "This body has no braces, so only its first statement belongs to it",
                        "Wrap the body in { }"));
            }
        }

        private void checkIndentation(BlockNode block) {
            Severity severity = language == Language.PYTHON_LIKE ? Severity.ERROR : Severity.WARNING;
            int headerIndent = indentationOf(block.getHeaderLine());
            int expectedColumn = -1;
            int previousLine = block.getHeaderLine();
            for (int id : block.getStatements()) {
                Node statement = tree.node(id);
                int line = statement.getStartLine();
                boolean ownLine = line > previousLine && isFirstOnLine(statement);
                previousLine = Math.max(previousLine, statement.getEndLine());
                if (!ownLine) {
                    continue;
                }
                if (language != Language.PYTHON_LIKE && statement.getColumn() <= headerIndent) {
                    report(Severity.WARNING, statement, ErrorKind.BAD_INDENTATION,
                            "This line belongs to the block above but is not indented",
                            "Indent it further than the line that opens the block");
                    continue;
                }
                if (expectedColumn < 0) {
                    expectedColumn = statement.getColumn();
                } else if (statement.getColumn() != expectedColumn) {
                    report(severity, statement, ErrorKind.BAD_INDENTATION,
                            "This line is not lined up with the rest of its block",
                            "Indent it to column " + expectedColumn + " like the lines around it");
                }
            }
        }

        private void checkReachability(BlockNode block) {
            boolean exited = false;
            for (int id : block.getStatements()) {
                Node statement = tree.node(id);
                if (exited) {
                    report(Severity.WARNING, statement, ErrorKind.UNREACHABLE_CODE,
                            "This code never runs because the block already ended above",
                            "Remove it or move it before the " + exitWord(block));
                    return;
                }
                NodeKind kind = statement.kind();
                exited = kind == NodeKind.RETURN || kind == NodeKind.BREAK || kind == NodeKind.CONTINUE;
            }
        }

        private String exitWord(BlockNode block) {
            for (int id : block.getStatements()) {
                NodeKind kind = tree.node(id).kind();
                if (kind == NodeKind.RETURN) return "return";
                if (kind == NodeKind.BREAK) return "break";
                if (kind == NodeKind.CONTINUE) return "continue";
            }
            return "exit";
        }

        // ---- returns ----

        private void checkReturns(FunctionDeclNode function) {
            BlockNode body = tree.node(function.getBody(), BlockNode.class);
            boolean declaresValue = language == Language.JAVA_LIKE && function.getReturnType() != null
                    && !function.isVoid();
            boolean returnsValue = declaresValue || returnsValueSomewhere(body.getId());
            if (returnsValue && !alwaysReturns(body.getId())) {
                report(Severity.WARNING, function, ErrorKind.MISSING_RETURN,
                        "'" + function.getName() + "' does not return a value on every path",
                        "Add a return statement at the end of '" + function.getName() + "'");
            }
        }

        private boolean returnsValueSomewhere(int id) {
            Node node = tree.node(id);
            if (node instanceof ReturnNode) {
                return ((ReturnNode) node).hasValue();
            }
            if (node instanceof FunctionDeclNode) {
                return false;
            }
            for (int child : node.children()) {
                if (returnsValueSomewhere(child)) return true;
            }
            return false;
        }

        private boolean alwaysReturns(int id) {
            Node node = tree.node(id);
            switch (node.kind()) {
                case RETURN:
                    return true;
                case BLOCK:
                    for (int statement : ((BlockNode) node).getStatements()) {
                        if (alwaysReturns(statement)) return true;
                    }
                    return false;
                case IF: {
                    IfNode ifNode = (IfNode) node;
                    return ifNode.hasElse() && alwaysReturns(ifNode.getThenBranch())
                            && alwaysReturns(ifNode.getElseBranch());
                }
                case WHILE: {
                    WhileNode whileNode = (WhileNode) node;
                    return isLiteralTrue(whileNode.getCondition()) && !containsBreak(whileNode.getBody());
                }
                default:
                    return false;
            }
        }

        private boolean isLiteralTrue(int id) {
            Node node = tree.node(id);
            return node instanceof LiteralNode && Boolean.TRUE.equals(((LiteralNode) node).getValue());
        }

        private boolean containsBreak(int id) {
            Node node = tree.node(id);
            if (node.kind() == NodeKind.BREAK) return true;
            if (node.kind() == NodeKind.WHILE || node.kind() == NodeKind.FOR
                    || node.kind() == NodeKind.FOR_EACH || node.kind() == NodeKind.FUNCTION_DECL) {
                return false;
            }
            for (int child : node.children()) {
                if (containsBreak(child)) return true;
            }
            return false;
        }

        // ---- expressions ----

        private void visitExpression(int id) {
            if (id == Node.NONE) {
                return;
            }
            Node node = tree.node(id);
            if (node instanceof IdentifierNode) {
                String name = ((IdentifierNode) node).getName();
                if (!isDefined(name)) {
                    reportUndefined(node, name);
                }
                return;
            }
            if (node instanceof MemberAccessNode) {
                visitExpression(((MemberAccessNode) node).getTarget());
                return;
            }
            for (int child : node.children()) {
                visitExpression(child);
            }
        }

        private boolean isDefined(String name) {
            return lookup(name) != null || builtins.contains(name)
                    || (functionDepth > 0 && topLevelNames.contains(name));
        }

        private Scope lookup(String name) {
            for (Scope scope : scopes) {
                if (scope.declares(name)) return scope;
            }
            return null;
        }

        private void reportUndefined(Node node, String name) {
            String similar = similarName(name);
            String fix = similar != null
                    ? "Did you mean '" + similar + "'?"
                    : "Create '" + name + "' before this line";
            report(Severity.ERROR, node, ErrorKind.UNDEFINED_VARIABLE, "'" + name + "' is not defined", fix);
        }

        /** A visible name within two edits of the given one, for typo suggestions. */
        private String similarName(String name) {
            Set<String> candidates = new HashSet<>(builtins);
            for (Scope scope : scopes) {
                candidates.addAll(scope.names());
            }
            if (functionDepth > 0) {
                candidates.addAll(topLevelNames);
            }
            String best = null;
            int bestDistance = 3;
            for (Iterator<String> it = candidates.stream().sorted().iterator(); it.hasNext(); ) {
                String candidate = it.next();
                int distance = editDistance(name, candidate);
                if (distance > 0 && distance < bestDistance) {
                    best = candidate;
                    bestDistance = distance;
                }
            }
            return best != null && name.length() > 2 ? best : null;
        }

        private static int editDistance(String a, String b) {
            int[] previous = new int[b.length() + 1];
            int[] current = new int[b.length() + 1];
            for (int j = 0; j <= b.length(); j++) previous[j] = j;
            for (int i = 1; i <= a.length(); i++) {
                current[0] = i;
                for (int j = 1; j <= b.length(); j++) {
                    int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                    current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
                }
                int[] swap = previous;
                previous = current;
                current = swap;
            }
            return previous[b.length()];
        }

        // ---- helpers ----

        /** Brace languages scope declarations per block; Python-like and JavaScript-like per function. */
        private void pushBlockScope() {
            if (language == Language.JAVA_LIKE) {
                scopes.push(new Scope(false));
            }
        }

        private void popBlockScope() {
            if (language == Language.JAVA_LIKE) {
                scopes.pop();
            }
        }

        private int indentationOf(int line) {
            if (!source.isValidLine(line)) {
                return 0;
            }
            String text = source.line(line);
            int column = 1;
            while (column <= text.length() && Character.isWhitespace(text.charAt(column - 1))) {
                column++;
            }
            return column;
        }

        private boolean isFirstOnLine(Node statement) {
            return indentationOf(statement.getStartLine()) == statement.getColumn();
        }

        private void report(Severity severity, Node node, ErrorKind kind, String message, String fix) {
            errors.add(new StaticError(node.getStartLine(), node.getColumn(), kind, severity, message, fix));
        }
    }
}
