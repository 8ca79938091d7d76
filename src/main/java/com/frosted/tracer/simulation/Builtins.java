package com.frosted.tracer.simulation;

import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.syntax.node.BinaryOperator;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The library functions and methods a traced program may call, per language. Anything outside
 * these lists is refused before the run starts.
 */
final class Builtins {
    /** I/O and dynamic-code functions that are never simulated. */
    static final Set<String> FORBIDDEN = Set.of("open", "input", "eval", "exec", "require", "fetch", "prompt", "alert");

    private static final Map<Language, Set<String>> FUNCTIONS = new EnumMap<>(Language.class);
    private static final Map<Language, Set<String>> QUALIFIED = new EnumMap<>(Language.class);
    private static final Map<Language, Set<String>> METHODS = new EnumMap<>(Language.class);

    static {
        FUNCTIONS.put(Language.PYTHON_LIKE,
                Set.of("print", "len", "range", "str", "int", "float", "abs", "min", "max", "sum"));
        FUNCTIONS.put(Language.JAVASCRIPT_LIKE, Set.of("String", "parseInt"));
        FUNCTIONS.put(Language.JAVA_LIKE, Set.of());

        QUALIFIED.put(Language.PYTHON_LIKE, Set.of());
        QUALIFIED.put(Language.JAVASCRIPT_LIKE, Set.of("console.log", "Math.max", "Math.min", "Math.abs",
                "Math.floor", "Math.ceil", "Math.round", "Math.sqrt", "Math.pow"));
        QUALIFIED.put(Language.JAVA_LIKE, Set.of("System.out.println", "System.out.print", "Math.max", "Math.min",
                "Math.abs", "Math.pow", "Math.sqrt", "Integer.parseInt"));

        METHODS.put(Language.PYTHON_LIKE, Set.of("append", "pop", "upper", "lower"));
        METHODS.put(Language.JAVASCRIPT_LIKE, Set.of("push", "pop", "toUpperCase", "toLowerCase"));
        METHODS.put(Language.JAVA_LIKE, Set.of("length", "charAt", "toUpperCase", "toLowerCase"));
    }

    private final Language language;
    private final ValueFormatter formatter;
    private final Operators operators;
    private final StringBuilder output;

    Builtins(Language language, ValueFormatter formatter, Operators operators, StringBuilder output) {
        this.language = language;
        this.formatter = formatter;
        this.operators = operators;
        this.output = output;
    }

    static boolean isFunction(Language language, String name) {
        return FUNCTIONS.get(language).contains(name);
    }

    static boolean isQualifiedFunction(Language language, String qualifiedName) {
        return QUALIFIED.get(language).contains(qualifiedName);
    }

    static boolean isMethod(Language language, String name) {
        return METHODS.get(language).contains(name);
    }

    /** Only {@code .length} may be read as a property, and only in the brace languages. */
    static boolean isProperty(Language language, String name) {
        return language != Language.PYTHON_LIKE && "length".equals(name);
    }

    Object callFunction(String name, List<Object> args, int line) {
        switch (name) {
            case "print":
                output.append(joined(args)).append('\n');
                return NoneValue.NONE;
            case "len":
                arity(name, args, 1, line);
                return length(args.get(0), "len()", line);
            case "range":
                return range(args, line);
            case "str":
            case "String":
                arity(name, args, 1, line);
                return formatter.display(args.get(0));
            case "int":
                arity(name, args, 1, line);
                return toInt(args.get(0), line);
            case "float":
                arity(name, args, 1, line);
                return toFloat(args.get(0), line);
            case "abs":
                arity(name, args, 1, line);
                return abs(args.get(0), line);
            case "min":
                return extreme(args, BinaryOperator.LESS, name, line);
            case "max":
                return extreme(args, BinaryOperator.GREATER, name, line);
            case "sum":
                arity(name, args, 1, line);
                return sum(args.get(0), line);
            case "parseInt":
                arity(name, args, 1, line);
                return parseIntLenient(formatter.display(args.get(0)));
            default:
                throw unsupported(name, line);
        }
    }

    Object callQualified(String name, List<Object> args, int line) {
        switch (name) {
            case "console.log":
                output.append(joined(args)).append('\n');
                return NoneValue.NONE;
            case "System.out.println":
                if (args.size() > 1) throw wrongArity(name, 1, args.size(), line);
                output.append(args.isEmpty() ? "" : formatter.display(args.get(0))).append('\n');
                return NoneValue.NONE;
            case "System.out.print":
                arity(name, args, 1, line);
                output.append(formatter.display(args.get(0)));
                return NoneValue.NONE;
            case "Math.max":
                return mathExtreme(args, BinaryOperator.GREATER, name, line);
            case "Math.min":
                return mathExtreme(args, BinaryOperator.LESS, name, line);
            case "Math.abs":
                arity(name, args, 1, line);
                return abs(args.get(0), line);
            case "Math.floor":
                arity(name, args, 1, line);
                return whole(Math.floor(number(args.get(0), name, line)));
            case "Math.ceil":
                arity(name, args, 1, line);
                return whole(Math.ceil(number(args.get(0), name, line)));
            case "Math.round":
                arity(name, args, 1, line);
                return whole(Math.floor(number(args.get(0), name, line) + 0.5));
            case "Math.sqrt":
                arity(name, args, 1, line);
                return Math.sqrt(number(args.get(0), name, line));
            case "Math.pow":
                arity(name, args, 2, line);
                return Math.pow(number(args.get(0), name, line), number(args.get(1), name, line));
            case "Integer.parseInt":
                arity(name, args, 1, line);
                return toInt(args.get(0), line);
            default:
                throw unsupported(name, line);
        }
    }

    Object callMethod(Object target, String method, List<Object> args, int line) {
        switch (method) {
            case "append":
            case "push": {
                List<Object> list = list(target, method, line);
                if (method.equals("append")) arity(method, args, 1, line);
                Operators.checkSize((long) list.size() + args.size(), line);
                list.addAll(args);
                return method.equals("append") ? NoneValue.NONE : (Object) (long) list.size();
            }
            case "pop": {
                List<Object> list = list(target, method, line);
                if (args.size() > (language == Language.PYTHON_LIKE ? 1 : 0)) {
                    throw wrongArity(method, 0, args.size(), line);
                }
                if (list.isEmpty()) {
                    if (language == Language.JAVASCRIPT_LIKE) return NoneValue.NONE;
                    throw new SimulationFault(FaultKind.INDEX_OUT_OF_RANGE, line, "Cannot pop from an empty list");
                }
                int index = args.isEmpty() ? list.size() - 1 : operators.index(args.get(0), list.size(), line);
                return list.remove(index);
            }
            case "upper":
            case "toUpperCase":
                arity(method, args, 0, line);
                return string(target, method, line).toUpperCase(Locale.ROOT);
            case "lower":
            case "toLowerCase":
                arity(method, args, 0, line);
                return string(target, method, line).toLowerCase(Locale.ROOT);
            case "length":
                arity(method, args, 0, line);
                return (long) string(target, method, line).length();
            case "charAt": {
                arity(method, args, 1, line);
                String text = string(target, method, line);
                return String.valueOf(text.charAt(operators.index(args.get(0), text.length(), line)));
            }
            default:
                throw unsupported(method, line);
        }
    }

    Object property(Object target, String name, int line) {
        if ("length".equals(name)) {
            return length(target, ".length", line);
        }
        throw unsupported(name, line);
    }

    private String joined(List<Object> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(formatter.display(args.get(i)));
        }
        return sb.toString();
    }

    private long length(Object value, String what, int line) {
        if (value instanceof String) return ((String) value).length();
        if (value instanceof List) return ((List<?>) value).size();
        if (value instanceof RangeValue) return ((RangeValue) value).size();
        throw operators.mismatch(line, what + " does not work on " + operators.describe(value));
    }

    private RangeValue range(List<Object> args, int line) {
        if (args.isEmpty() || args.size() > 3) {
            throw wrongArity("range", 1, args.size(), line);
        }
        long[] bounds = new long[args.size()];
        for (int i = 0; i < args.size(); i++) {
            if (!(args.get(i) instanceof Long)) {
                throw operators.mismatch(line, "range() needs whole numbers, not " + operators.describe(args.get(i)));
            }
            bounds[i] = (Long) args.get(i);
        }
        long step = bounds.length == 3 ? bounds[2] : 1;
        if (step == 0) {
            throw operators.mismatch(line, "range() step must not be zero");
        }
        return bounds.length == 1 ? new RangeValue(0, bounds[0], 1) : new RangeValue(bounds[0], bounds[1], step);
    }

    private Object toInt(Object value, int line) {
        if (value instanceof Long) return value;
        if (value instanceof Boolean) return (Boolean) value ? 1L : 0L;
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw operators.mismatch(line, "Cannot convert " + formatter.inspect(value) + " to a whole number");
            }
            return (long) d;
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw operators.mismatch(line, "Cannot convert " + formatter.inspect(value) + " to a whole number");
            }
        }
        throw operators.mismatch(line, "Cannot convert " + operators.describe(value) + " to a whole number");
    }

    private Object toFloat(Object value, int line) {
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw operators.mismatch(line, "Cannot convert " + formatter.inspect(value) + " to a number");
            }
        }
        return ((Number) operators.toNumber(value, "float()", line)).doubleValue();
    }

    private static Object parseIntLenient(String text) {
        String trimmed = text.trim();
        int end = 0;
        if (end < trimmed.length() && (trimmed.charAt(end) == '-' || trimmed.charAt(end) == '+')) end++;
        int digitsStart = end;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end)) && end - digitsStart < 18) end++;
        if (end == digitsStart) {
            return Double.NaN;
        }
        return Long.parseLong(trimmed.substring(0, end));
    }

    private Object abs(Object value, int line) {
        Object number = operators.toNumber(value, "abs", line);
        if (number instanceof Long) {
            long l = (Long) number;
            return l == Long.MIN_VALUE ? (Object) Math.abs((double) l) : (Object) Math.abs(l);
        }
        return Math.abs((Double) number);
    }

    private Object extreme(List<Object> args, BinaryOperator better, String name, int line) {
        List<Object> candidates = args.size() == 1 ? operators.iterate(args.get(0), line) : args;
        if (candidates.isEmpty()) {
            throw operators.mismatch(line, name + "() needs at least one value");
        }
        Object best = candidates.get(0);
        for (Object candidate : candidates.subList(1, candidates.size())) {
            if ((Boolean) operators.binary(better, candidate, best, line)) {
                best = candidate;
            }
        }
        return best;
    }

    private Object mathExtreme(List<Object> args, BinaryOperator better, String name, int line) {
        if (language == Language.JAVA_LIKE) {
            arity(name, args, 2, line);
        } else if (args.isEmpty()) {
            return better == BinaryOperator.GREATER ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        for (Object arg : args) {
            operators.toNumber(arg, name, line);
        }
        Object best = extreme(args.size() == 1 ? List.of(args.get(0), args.get(0)) : args, better, name, line);
        if (language == Language.JAVA_LIKE && (args.get(0) instanceof Double || args.get(1) instanceof Double)) {
            return ((Number) best).doubleValue();
        }
        return best;
    }

    private Object sum(Object iterable, int line) {
        Object total = 0L;
        for (Object item : operators.iterate(iterable, line)) {
            total = operators.binary(BinaryOperator.ADD, total, item, line);
        }
        return total;
    }

    private double number(Object value, String name, int line) {
        return ((Number) operators.toNumber(value, name, line)).doubleValue();
    }

    private static Object whole(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || Math.abs(value) >= 9.0e18) {
            return value;
        }
        return (long) value;
    }

    @SuppressWarnings("unchecked")
    private List<Object> list(Object target, String method, int line) {
        if (target instanceof List) {
            return (List<Object>) target;
        }
        throw operators.mismatch(line, "'" + method + "' works on a list, not " + operators.describe(target));
    }

    private String string(Object target, String method, int line) {
        if (target instanceof String) {
            return (String) target;
        }
        throw operators.mismatch(line, "'" + method + "' works on text, not " + operators.describe(target));
    }

    private void arity(String name, List<Object> args, int expected, int line) {
        if (args.size() != expected) {
            throw wrongArity(name, expected, args.size(), line);
        }
    }

    private SimulationFault wrongArity(String name, int expected, int actual, int line) {
        return new SimulationFault(FaultKind.TYPE_MISMATCH, line,
                name + "() takes " + expected + " argument" + (expected == 1 ? "" : "s") + " but got " + actual);
    }

    private static SimulationFault unsupported(String name, int line) {
        return new SimulationFault(FaultKind.UNSUPPORTED_CONSTRUCT, line, "'" + name + "' is not supported by the tracer");
    }
}
