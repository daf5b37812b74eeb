package com.quire.parameterize.translate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders parameter values as source code of one kernel language. Subclasses override the per-type
 * hooks; {@link #translate(Object)} dispatches on the value's Java type.
 */
public abstract class ParameterTranslator {

    /** Language name as it appears in notebook metadata (lower case). */
    public abstract String getLanguage();

    /** One-line comment in this language. */
    public abstract String comment(String text);

    /** Assignment statement binding {@code name} to an already rendered value. */
    public String assign(String name, String renderedValue) {
        return name + " = " + renderedValue;
    }

    /**
     * Source for a parameters cell: a header comment then one assignment per entry, in map order.
     */
    public String codifyParameters(Map<String, Object> parameters) {
        Objects.requireNonNull(parameters, "parameters");
        StringBuilder sb = new StringBuilder(comment("Parameters")).append('\n');
        parameters.forEach((name, value) -> sb.append(assign(name, translate(value))).append('\n'));
        return sb.toString();
    }

    /**
     * Parameters declared in a parameters cell's source. Languages without inspection support
     * return an empty list.
     */
    public List<ParameterDeclaration> inspect(String source) {
        return List.of();
    }

    public String translate(Object value) {
        if (value == null) {
            return translateNull();
        }
        if (value instanceof Boolean b) {
            return translateBoolean(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return translateInteger((Number) value);
        }
        if (value instanceof Number n) {
            return translateFloat(n);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return translateString(value.toString());
        }
        if (value instanceof Map<?, ?> map) {
            return translateMap(map);
        }
        if (value instanceof Collection<?> c) {
            return translateList(new ArrayList<>(c));
        }
        if (value instanceof Object[] array) {
            return translateList(Arrays.asList(array));
        }
        return translateString(value.toString());
    }

    protected abstract String translateNull();

    protected abstract String translateBoolean(boolean value);

    protected String translateString(String value) {
        return translateEscapedString(value);
    }

    protected String translateInteger(Number value) {
        return value.toString();
    }

    protected String translateFloat(Number value) {
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        return value.toString();
    }

    protected abstract String translateMap(Map<?, ?> map);

    protected abstract String translateList(List<?> list);

    /** Double-quoted literal with backslash escapes, valid in Python, R and Scala. */
    protected String translateEscapedString(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(escapeControlCharacter(c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /** Escape for a control character with no short form; {@code \xNN} by default. */
    protected String escapeControlCharacter(char c) {
        return String.format("\\x%02x", (int) c);
    }

    /** Map key rendering: strings are escaped, other keys translated as values. */
    protected String translateKey(Object key) {
        return key instanceof String s ? translateEscapedString(s) : translate(key);
    }

    protected String joinValues(List<?> values, String separator) {
        return values.stream().map(this::translate).collect(Collectors.joining(separator));
    }
}
