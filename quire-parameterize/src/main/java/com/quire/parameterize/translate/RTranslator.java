package com.quire.parameterize.translate;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** R literals. Leading underscores are dropped from names since R identifiers cannot start with one. */
public final class RTranslator extends ParameterTranslator {

    @Override
    public String getLanguage() {
        return "r";
    }

    @Override
    public String comment(String text) {
        return "# " + text;
    }

    @Override
    public String assign(String name, String renderedValue) {
        String stripped = name;
        while (stripped.startsWith("_")) {
            stripped = stripped.substring(1);
        }
        return stripped + " = " + renderedValue;
    }

    @Override
    protected String translateNull() {
        return "NULL";
    }

    @Override
    protected String translateBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    protected String translateFloat(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d)) return "NaN";
            if (Double.isInfinite(d)) return d > 0 ? "Inf" : "-Inf";
        }
        return super.translateFloat(value);
    }

    @Override
    protected String translateMap(Map<?, ?> map) {
        return map.entrySet().stream()
                .map(e -> translateKey(e.getKey()) + " = " + translate(e.getValue()))
                .collect(Collectors.joining(", ", "list(", ")"));
    }

    @Override
    protected String translateList(List<?> list) {
        return "list(" + joinValues(list, ", ") + ")";
    }
}
