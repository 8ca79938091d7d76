package com.frosted.tracer.simulation;

import com.frosted.tracer.model.ExecutionTrace;
import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.model.RuntimeFault;
import com.frosted.tracer.model.SimulationResult;
import com.frosted.tracer.syntax.SyntaxTree;
import com.frosted.tracer.syntax.node.CallNode;
import com.frosted.tracer.syntax.node.ErrorNode;
import com.frosted.tracer.syntax.node.IdentifierNode;
import com.frosted.tracer.syntax.node.MemberAccessNode;
import com.frosted.tracer.syntax.node.Node;
import com.frosted.tracer.syntax.node.UnsupportedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a parsed snippet step by step and records what a learner would see. Stateless; every
 * call starts a fresh run, so one instance may be shared.
 */
public final class ExecutionSimulator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionSimulator.class);

    /** Steps recorded before a run is stopped as endless. */
    public static final int STEP_BUDGET = 1000;
    /** Simulated call frames allowed at once. */
    public static final int MAX_FRAMES = 200;

    public SimulationResult simulate(SyntaxTree tree) {
        RuntimeFault refusal = refusal(tree);
        if (refusal != null) {
            LOGGER.warn("Refusing to simulate {} code: {}", tree.getLanguage(), refusal.getMessage());
            return new SimulationResult(ExecutionTrace.empty(), refusal);
        }
        SimulationResult result = new SimulationRun(tree, STEP_BUDGET, MAX_FRAMES).run();
        LOGGER.debug("Simulated {} steps of {} code, fault: {}", result.getTrace().size(), tree.getLanguage(),
                result.getFault() != null ? result.getFault().getKind() : "none");
        return result;
    }

    /**
     * Checks the whole tree before anything runs. Returns the fault for the first construct the
     * tracer will not simulate, or {@code null} when the program is fully supported.
     */
    RuntimeFault refusal(SyntaxTree tree) {
        Language language = tree.getLanguage();
        Set<Integer> callees = new HashSet<>();
        List<Node> nodes = tree.walk();
        for (Node node : nodes) {
            if (node instanceof CallNode) {
                // System.out in System.out.println is part of the callee's name
                Node callee = tree.node(((CallNode) node).getCallee());
                while (callee instanceof MemberAccessNode) {
                    callees.add(callee.getId());
                    callee = tree.node(((MemberAccessNode) callee).getTarget());
                }
            }
        }
        for (Node node : nodes) {
            String problem = null;
            if (node instanceof UnsupportedNode) {
                problem = capitalize(((UnsupportedNode) node).getConstruct()) + " is not supported by the tracer";
            } else if (node instanceof ErrorNode) {
                problem = "The code has a syntax error on line " + node.getStartLine();
            } else if (node instanceof CallNode) {
                problem = refusedCall(tree, (CallNode) node);
            } else if (node instanceof MemberAccessNode && !callees.contains(node.getId())) {
                String member = ((MemberAccessNode) node).getMember();
                if (!Builtins.isProperty(language, member)) {
                    problem = "Reading ." + member + " is not supported by the tracer";
                }
            }
            if (problem != null) {
                return new RuntimeFault(FaultKind.UNSUPPORTED_CONSTRUCT, 1, problem + " (line " + node.getStartLine() + ")");
            }
        }
        return null;
    }

    private static String refusedCall(SyntaxTree tree, CallNode call) {
        Language language = tree.getLanguage();
        Node callee = tree.node(call.getCallee());
        if (callee instanceof IdentifierNode) {
            String name = ((IdentifierNode) callee).getName();
            return Builtins.FORBIDDEN.contains(name) ? "Calling " + name + "() is not supported by the tracer" : null;
        }
        if (callee instanceof MemberAccessNode) {
            MemberAccessNode member = (MemberAccessNode) callee;
            String qualified = plainName(tree, member);
            if (qualified != null && Builtins.isQualifiedFunction(language, qualified)) {
                return null;
            }
            if (Builtins.isMethod(language, member.getMember())) {
                return null;
            }
            return "Calling " + (qualified != null ? qualified : "." + member.getMember()) + "() is not supported by the tracer";
        }
        return "This kind of call is not supported by the tracer";
    }

    /** Dotted name of a member chain over plain identifiers, e.g. {@code System.out.println}. */
    private static String plainName(SyntaxTree tree, MemberAccessNode member) {
        Node target = tree.node(member.getTarget());
        if (target instanceof IdentifierNode) {
            return ((IdentifierNode) target).getName() + "." + member.getMember();
        }
        if (target instanceof MemberAccessNode) {
            String prefix = plainName(tree, (MemberAccessNode) target);
            return prefix == null ? null : prefix + "." + member.getMember();
        }
        return null;
    }

    private static String capitalize(String text) {
        if (text == null || text.isEmpty()) return "This construct";
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
