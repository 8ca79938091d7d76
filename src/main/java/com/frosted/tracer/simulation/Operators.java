package com.frosted.tracer.simulation;

import com.frosted.tracer.model.FaultKind;
import com.frosted.tracer.model.Language;
import com.frosted.tracer.syntax.node.BinaryOperator;
import com.frosted.tracer.syntax.node.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Arithmetic, comparison and truthiness with the rules a beginner sees in each language.
 * Integers are {@link Long}, floating point values {@link Double}.
 */
final class Operators {
    static final int MAX_COLLECTION_SIZE = 100_000;

    private final Language language;
    private final ValueFormatter formatter;

    Operators(Language language, ValueFormatter formatter) {
        this.language = language;
        this.formatter = formatter;
    }

    boolean isTruthy(Object value) {
        if (value == null || value == NoneValue.NONE) return false;
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Long) return (Long) value != 0;
        if (value instanceof Double) {
            double d = (Double) value;
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String) return !((String) value).isEmpty();
        if (value instanceof List) {
            return language == Language.JAVASCRIPT_LIKE || !((List<?>) value).isEmpty();
        }
        if (value instanceof RangeValue) return ((RangeValue) value).size() > 0;
        return true;
    }

    /** Truthiness of a condition; Java-like code only accepts booleans there. */
    boolean condition(Object value, int line) {
        if (language == Language.JAVA_LIKE && !(value instanceof Boolean)) {
            throw mismatch(line, "A condition must be true or false, not " + describe(value));
        }
        return isTruthy(value);
    }

    Object unary(UnaryOperator operator, Object operand, int line) {
        switch (operator) {
            case NOT:
                if (language == Language.JAVA_LIKE && !(operand instanceof Boolean)) {
                    throw mismatch(line, "'!' needs true or false, not " + describe(operand));
                }
                return !isTruthy(operand);
            case NEGATE: {
                Object number = toNumber(operand, "-", line);
                if (number instanceof Long) {
                    long l = (Long) number;
                    return l == Long.MIN_VALUE ? (Object) (-(double) l) : (Object) (-l);
                }
                return -(Double) number;
            }
            default:
                return toNumber(operand, "+", line);
        }
    }

    /** All binary operators except the short-circuiting {@code and} / {@code or}. */
    Object binary(BinaryOperator operator, Object left, Object right, int line) {
        switch (operator) {
            case ADD:
                return add(left, right, line);
            case SUBTRACT:
            case MULTIPLY:
            case POWER:
                if (operator == BinaryOperator.MULTIPLY && language == Language.PYTHON_LIKE) {
                    Object repeated = repeat(left, right, line);
                    if (repeated != null) return repeated;
                }
                return arithmetic(operator, left, right, line);
            case DIVIDE:
                return divide(left, right, line);
            case FLOOR_DIVIDE:
                return floorDivide(left, right, line);
            case MODULO:
                return modulo(left, right, line);
            case EQUAL:
                return language == Language.JAVASCRIPT_LIKE ? looseEquals(left, right) : valueEquals(left, right);
            case NOT_EQUAL:
                return !(language == Language.JAVASCRIPT_LIKE ? looseEquals(left, right) : valueEquals(left, right));
            case STRICT_EQUAL:
                return strictEquals(left, right);
            case STRICT_NOT_EQUAL:
                return !strictEquals(left, right);
            case LESS:
                return compare(left, right, operator, line) < 0;
            case LESS_EQUAL:
                return compare(left, right, operator, line) <= 0;
            case GREATER:
                return compare(left, right, operator, line) > 0;
            case GREATER_EQUAL:
                return compare(left, right, operator, line) >= 0;
            case IN:
                return contains(right, left, line);
            case NOT_IN:
                return !contains(right, left, line);
            default:
                throw new SimulationFault(FaultKind.UNSUPPORTED_CONSTRUCT, line,
                        "The operator '" + operator.getSymbol() + "' is not supported here");
        }
    }

    private Object add(Object left, Object right, int line) {
        if (left instanceof String || right instanceof String) {
            if (language == Language.PYTHON_LIKE && !(left instanceof String && right instanceof String)) {
                throw mismatch(line, "Cannot add " + describe(left) + " and " + describe(right)
                        + "; convert the number with str() first");
            }
            String joined = formatter.concatenated(left) + formatter.concatenated(right);
            checkSize(joined.length(), line);
            return joined;
        }
        if (left instanceof List && right instanceof List) {
            if (language == Language.PYTHON_LIKE) {
                List<Object> joined = new ArrayList<>((List<?>) left);
                joined.addAll((List<?>) right);
                checkSize(joined.size(), line);
                return joined;
            }
            if (language == Language.JAVASCRIPT_LIKE) {
                return formatter.concatenated(left) + formatter.concatenated(right);
            }
        }
        return arithmetic(BinaryOperator.ADD, left, right, line);
    }

    /** {@code "ab" * 3} and {@code [0] * 3}, or {@code null} when the operands are not that shape. */
    private Object repeat(Object left, Object right, int line) {
        Object sequence = left instanceof Long ? right : left;
        Object count = left instanceof Long ? left : right;
        if (!(count instanceof Long) || !(sequence instanceof String || sequence instanceof List)) {
            return null;
        }
        long times = Math.max(0, (Long) count);
        long size = sequence instanceof String ? ((String) sequence).length() : ((List<?>) sequence).size();
        if (size > 0) {
            checkSize(times, line);
        }
        checkSize(size * times, line);
        if (sequence instanceof String) {
            return ((String) sequence).repeat((int) times);
        }
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < times; i++) {
            out.addAll((List<?>) sequence);
        }
        return out;
    }

    private Object arithmetic(BinaryOperator operator, Object left, Object right, int line) {
        Object a = toNumber(left, operator.getSymbol(), line);
        Object b = toNumber(right, operator.getSymbol(), line);
        if (a instanceof Long && b instanceof Long) {
            long x = (Long) a;
            long y = (Long) b;
            if (language == Language.JAVA_LIKE) {
                switch (operator) {
                    case ADD: return x + y;
                    case SUBTRACT: return x - y;
                    case MULTIPLY: return x * y;
                    default: return Math.pow(x, y);
                }
            }
            try {
                switch (operator) {
                    case ADD: return Math.addExact(x, y);
                    case SUBTRACT: return Math.subtractExact(x, y);
                    case MULTIPLY: return Math.multiplyExact(x, y);
                    default:
                        return y >= 0 ? (Object) power(x, y) : (Object) Math.pow(x, y);
                }
            } catch (ArithmeticException overflow) {
                return arithmetic(operator, (double) x, (double) y);
            }
        }
        return arithmetic(operator, ((Number) a).doubleValue(), ((Number) b).doubleValue());
    }

    private static double arithmetic(BinaryOperator operator, double x, double y) {
        switch (operator) {
            case ADD: return x + y;
            case SUBTRACT: return x - y;
            case MULTIPLY: return x * y;
            default: return Math.pow(x, y);
        }
    }

    private static long power(long base, long exponent) {
        long result = 1;
        long factor = base;
        long remaining = exponent;
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                result = Math.multiplyExact(result, factor);
            }
            remaining >>= 1;
            if (remaining > 0) {
                factor = Math.multiplyExact(factor, factor);
            }
        }
        return result;
    }

    private Object divide(Object left, Object right, int line) {
        Object a = toNumber(left, "/", line);
        Object b = toNumber(right, "/", line);
        checkDivisor(b, line);
        if (a instanceof Long && b instanceof Long) {
            long x = (Long) a;
            long y = (Long) b;
            if (language == Language.JAVA_LIKE) {
                return x / y;
            }
            if (language == Language.JAVASCRIPT_LIKE && x % y == 0) {
                return x / y;
            }
        }
        return ((Number) a).doubleValue() / ((Number) b).doubleValue();
    }

    private Object floorDivide(Object left, Object right, int line) {
        Object a = toNumber(left, "//", line);
        Object b = toNumber(right, "//", line);
        checkDivisor(b, line);
        if (a instanceof Long && b instanceof Long) {
            return Math.floorDiv((Long) a, (Long) b);
        }
        return Math.floor(((Number) a).doubleValue() / ((Number) b).doubleValue());
    }

    private Object modulo(Object left, Object right, int line) {
        Object a = toNumber(left, "%", line);
        Object b = toNumber(right, "%", line);
        checkDivisor(b, line);
        if (a instanceof Long && b instanceof Long) {
            return language == Language.PYTHON_LIKE ? Math.floorMod((Long) a, (Long) b) : (Long) a % (Long) b;
        }
        double x = ((Number) a).doubleValue();
        double y = ((Number) b).doubleValue();
        return language == Language.PYTHON_LIKE ? x - y * Math.floor(x / y) : x % y;
    }

    private static void checkDivisor(Object divisor, int line) {
        if (((Number) divisor).doubleValue() == 0) {
            throw new SimulationFault(FaultKind.DIVISION_BY_ZERO, line, "Division by zero");
        }
    }

    /**
     * Numeric view of an operand. Python treats booleans as 0/1; JavaScript also converts
     * null and numeric strings.
     */
    Object toNumber(Object value, String operator, int line) {
        if (value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Boolean && language != Language.JAVA_LIKE) {
            return (Boolean) value ? 1L : 0L;
        }
        if (language == Language.JAVASCRIPT_LIKE) {
            if (value == NoneValue.NONE) return 0L;
            if (value instanceof String) return parseJsNumber((String) value);
        }
        throw mismatch(line, "Cannot use '" + operator + "' with " + describe(value));
    }

    private static Object parseJsNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return 0L;
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException notLong) {
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException notNumber) {
                return Double.NaN;
            }
        }
    }

    private int compare(Object left, Object right, BinaryOperator operator, int line) {
        if (left instanceof String && right instanceof String) {
            return Integer.signum(((String) left).compareTo((String) right));
        }
        if (isNumeric(left) && isNumeric(right) || language == Language.JAVASCRIPT_LIKE) {
            Object a = toNumber(left, operator.getSymbol(), line);
            Object b = toNumber(right, operator.getSymbol(), line);
            if (a instanceof Long && b instanceof Long) {
                return Long.compare((Long) a, (Long) b);
            }
            double x = ((Number) a).doubleValue();
            double y = ((Number) b).doubleValue();
            if (Double.isNaN(x) || Double.isNaN(y)) {
                // every comparison with NaN is false; callers only test the sign
                return operator == BinaryOperator.LESS || operator == BinaryOperator.LESS_EQUAL ? 1 : -1;
            }
            return Double.compare(x, y);
        }
        throw mismatch(line, "Cannot compare " + describe(left) + " with " + describe(right)
                + " using '" + operator.getSymbol() + "'");
    }

    private boolean isNumeric(Object value) {
        return value instanceof Long || value instanceof Double
                || value instanceof Boolean && language == Language.PYTHON_LIKE;
    }

    /** Structural equality: numbers by value, lists element by element. */
    boolean valueEquals(Object left, Object right) {
        if (left == right) return true;
        if (isNumeric(left) && isNumeric(right)) {
            Object a = left instanceof Boolean ? ((Boolean) left ? 1L : 0L) : left;
            Object b = right instanceof Boolean ? ((Boolean) right ? 1L : 0L) : right;
            if (a instanceof Long && b instanceof Long) return a.equals(b);
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        if (left instanceof List && right instanceof List) {
            List<?> a = (List<?>) left;
            List<?> b = (List<?>) right;
            if (language == Language.JAVASCRIPT_LIKE) return false;
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!valueEquals(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        return left != null && left.equals(right);
    }

    private boolean strictEquals(Object left, Object right) {
        boolean leftNumber = left instanceof Long || left instanceof Double;
        boolean rightNumber = right instanceof Long || right instanceof Double;
        if (leftNumber != rightNumber) return false;
        if (leftNumber) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        if (left instanceof List || right instanceof List) return left == right;
        return left != null && left.equals(right);
    }

    private boolean looseEquals(Object left, Object right) {
        if (left instanceof List || right instanceof List || left instanceof FunctionValue
                || right instanceof FunctionValue) {
            return left == right;
        }
        if (left instanceof String && (right instanceof Long || right instanceof Double || right instanceof Boolean)
                || right instanceof String && (left instanceof Long || left instanceof Double || left instanceof Boolean)
                || left instanceof Boolean || right instanceof Boolean) {
            if (left == NoneValue.NONE || right == NoneValue.NONE) return false;
            Object a = toNumber(left, "==", 0);
            Object b = toNumber(right, "==", 0);
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return strictEquals(left, right);
    }

    private boolean contains(Object container, Object element, int line) {
        if (container instanceof List) {
            for (Object item : (List<?>) container) {
                if (valueEquals(item, element)) return true;
            }
            return false;
        }
        if (container instanceof String) {
            if (!(element instanceof String)) {
                throw mismatch(line, "'in' on a string needs a string on the left, not " + describe(element));
            }
            return ((String) container).contains((String) element);
        }
        if (container instanceof RangeValue) {
            return element instanceof Long && ((RangeValue) container).contains((Long) element);
        }
        throw mismatch(line, "Cannot look inside " + describe(container));
    }

    /** Items a loop walks over: list elements, range values or the characters of a string. */
    List<Object> iterate(Object iterable, int line) {
        if (iterable instanceof List) {
            return new ArrayList<>((List<?>) iterable);
        }
        if (iterable instanceof RangeValue) {
            RangeValue range = (RangeValue) iterable;
            checkSize(range.size(), line);
            List<Object> out = new ArrayList<>((int) range.size());
            for (long i = 0; i < range.size(); i++) {
                out.add(range.get(i));
            }
            return out;
        }
        if (iterable instanceof String) {
            String text = (String) iterable;
            List<Object> out = new ArrayList<>(text.length());
            for (int i = 0; i < text.length(); i++) {
                out.add(String.valueOf(text.charAt(i)));
            }
            return out;
        }
        throw mismatch(line, "Cannot loop over " + describe(iterable));
    }

    /** Resolves an index against a length; Python counts negative indices from the end. */
    int index(Object index, int length, int line) {
        if (!(index instanceof Long)) {
            if (index instanceof Double && language == Language.JAVASCRIPT_LIKE && (Double) index == Math.rint((Double) index)) {
                return index(((Double) index).longValue(), length, line);
            }
            throw mismatch(line, "An index must be a whole number, not " + describe(index));
        }
        long i = (Long) index;
        if (i < 0 && language == Language.PYTHON_LIKE) {
            i += length;
        }
        if (i < 0 || i >= length) {
            throw new SimulationFault(FaultKind.INDEX_OUT_OF_RANGE, line,
                    "Index " + index + " is out of range for length " + length);
        }
        return (int) i;
    }

    static void checkSize(long size, int line) {
        if (size > MAX_COLLECTION_SIZE) {
            throw new SimulationFault(FaultKind.UNSUPPORTED_CONSTRUCT, line,
                    "This value grows too large to trace (over " + MAX_COLLECTION_SIZE + " items)");
        }
    }

    SimulationFault mismatch(int line, String message) {
        return new SimulationFault(FaultKind.TYPE_MISMATCH, line, message);
    }

    /** "the int 3", "the str 'a'", used in fault messages. */
    String describe(Object value) {
        return "the " + formatter.typeOf(value, null) + " " + formatter.inspect(value);
    }
}
