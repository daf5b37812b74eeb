package com.quire.parameterize.translate;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Scala literals bound with {@code val}. Integers outside the {@code Int} range get an {@code L} suffix. */
public final class ScalaTranslator extends ParameterTranslator {

    @Override
    public String getLanguage() {
        return "scala";
    }

    @Override
    public String comment(String text) {
        return "// " + text;
    }

    @Override
    public String assign(String name, String renderedValue) {
        return "val " + name + " = " + renderedValue;
    }

    @Override
    protected String translateNull() {
        return "None";
    }

    @Override
    protected String translateBoolean(boolean value) {
        return value ? "true" : "false";
    }

    @Override
    protected String translateInteger(Number value) {
        String text = value.toString();
        boolean wide = value instanceof Long l && (l > Integer.MAX_VALUE || l < Integer.MIN_VALUE)
                || value instanceof BigInteger b && b.bitLength() > 31;
        return wide ? text + "L" : text;
    }

    @Override
    protected String translateFloat(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d)) return "Double.NaN";
            if (Double.isInfinite(d)) return d > 0 ? "Double.PositiveInfinity" : "Double.NegativeInfinity";
        }
        return super.translateFloat(value);
    }

    @Override
    protected String escapeControlCharacter(char c) {
        return String.format("\\u%04x", (int) c);
    }

    @Override
    protected String translateMap(Map<?, ?> map) {
        return map.entrySet().stream()
                .map(e -> translateKey(e.getKey()) + " -> " + translate(e.getValue()))
                .collect(Collectors.joining(", ", "Map(", ")"));
    }

    @Override
    protected String translateList(List<?> list) {
        return "Seq(" + joinValues(list, ", ") + ")";
    }
}
