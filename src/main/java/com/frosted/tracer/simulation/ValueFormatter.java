package com.frosted.tracer.simulation;

import com.frosted.tracer.model.Language;

import java.util.List;

/**
 * How values read in one language: the printed form ({@code print}), the inspected form shown
 * in variable snapshots, and the type name.
 */
public final class ValueFormatter {
    /** Lists longer than this are cut short in snapshots. */
    static final int MAX_SHOWN_ITEMS = 100;
    static final int MAX_SHOWN_CHARS = 1000;
    // a list that contains itself prints as [...]
    private static final int MAX_DEPTH = 20;

    private final Language language;

    public ValueFormatter(Language language) {
        this.language = language;
    }

    /** Text the program would print for the value. */
    public String display(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        return inspect(value, false, false, 0);
    }

    /** The value as shown in the variables panel; strings are quoted. */
    public String inspect(Object value) {
        return inspect(value, true, true, 0);
    }

    private String inspect(Object value, boolean quoteStrings, boolean abbreviate, int depth) {
        if (value == null || value == NoneValue.NONE) {
            return language == Language.PYTHON_LIKE ? "None" : "null";
        }
        if (value instanceof Boolean) {
            boolean b = (Boolean) value;
            if (language == Language.PYTHON_LIKE) return b ? "True" : "False";
            return b ? "true" : "false";
        }
        if (value instanceof Long) {
            return value.toString();
        }
        if (value instanceof Double) {
            return formatDouble((Double) value);
        }
        if (value instanceof String) {
            String text = (String) value;
            if (abbreviate && text.length() > MAX_SHOWN_CHARS) {
                return quote(text.substring(0, MAX_SHOWN_CHARS)) + "...";
            }
            return quoteStrings ? quote(text) : text;
        }
        if (value instanceof List) {
            if (depth > MAX_DEPTH) {
                return "[...]";
            }
            StringBuilder sb = new StringBuilder("[");
            List<?> list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(", ");
                if (abbreviate && i == MAX_SHOWN_ITEMS) {
                    sb.append("... ").append(list.size() - i).append(" more");
                    break;
                }
                sb.append(inspect(list.get(i), true, abbreviate, depth + 1));
            }
            return sb.append(']').toString();
        }
        if (value instanceof RangeValue) {
            RangeValue range = (RangeValue) value;
            return "range(" + range.getStart() + ", " + range.getStop()
                    + (range.getStep() != 1 ? ", " + range.getStep() : "") + ")";
        }
        if (value instanceof FunctionValue) {
            String name = ((FunctionValue) value).getName();
            return language == Language.PYTHON_LIKE ? "<function " + name + ">" : "[Function: " + name + "]";
        }
        return String.valueOf(value);
    }

    /** Text a value contributes when concatenated to a string with {@code +}. */
    public String concatenated(Object value) {
        if (language == Language.JAVASCRIPT_LIKE && value instanceof List) {
            StringBuilder sb = new StringBuilder();
            List<?> list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(concatenated(list.get(i)));
            }
            return sb.toString();
        }
        return display(value);
    }

    private String formatDouble(double d) {
        if (Double.isNaN(d)) {
            return language == Language.PYTHON_LIKE ? "nan" : "NaN";
        }
        if (Double.isInfinite(d)) {
            if (language == Language.PYTHON_LIKE) return d > 0 ? "inf" : "-inf";
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (language == Language.JAVASCRIPT_LIKE && d == Math.rint(d) && Math.abs(d) < 1e21) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private String quote(String s) {
        if (language == Language.PYTHON_LIKE) {
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + "'";
        }
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }

    /**
     * Type name of the value in this language. A declared type, when the language has one,
     * takes precedence.
     */
    public String typeOf(Object value, String declaredType) {
        if (declaredType != null && !declaredType.equals("var") && language == Language.JAVA_LIKE) {
            return declaredType;
        }
        switch (language) {
            case PYTHON_LIKE:
                return pythonType(value);
            case JAVASCRIPT_LIKE:
                return javaScriptType(value);
            default:
                return javaType(value);
        }
    }

    private static String pythonType(Object value) {
        if (value == NoneValue.NONE || value == null) return "NoneType";
        if (value instanceof Boolean) return "bool";
        if (value instanceof Long) return "int";
        if (value instanceof Double) return "float";
        if (value instanceof String) return "str";
        if (value instanceof List) return "list";
        if (value instanceof RangeValue) return "range";
        return "function";
    }

    private static String javaScriptType(Object value) {
        if (value == NoneValue.NONE || value == null) return "null";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Long || value instanceof Double) return "number";
        if (value instanceof String) return "string";
        if (value instanceof List) return "array";
        return "function";
    }

    private static String javaType(Object value) {
        if (value == NoneValue.NONE || value == null) return "null";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Long) return "int";
        if (value instanceof Double) return "double";
        if (value instanceof String) return "String";
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            return (list.isEmpty() ? "int" : javaType(list.get(0))) + "[]";
        }
        return "method";
    }
}
