package com.quire.parameterize.translate;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Bash assignments. Strings are shell-quoted; lists become arrays; mappings are not supported. */
public final class BashTranslator extends ParameterTranslator {

    private static final Pattern SAFE = Pattern.compile("[\\w@%+=:,./-]+");

    @Override
    public String getLanguage() {
        return "bash";
    }

    @Override
    public String comment(String text) {
        return "# " + text;
    }

    @Override
    public String assign(String name, String renderedValue) {
        return name + "=" + renderedValue;
    }

    @Override
    protected String translateNull() {
        return "''";
    }

    @Override
    protected String translateBoolean(boolean value) {
        return value ? "true" : "false";
    }

    @Override
    protected String translateString(String value) {
        return quote(value);
    }

    @Override
    protected String translateMap(Map<?, ?> map) {
        throw new IllegalArgumentException("Bash parameters cannot hold mappings");
    }

    @Override
    protected String translateList(List<?> list) {
        return "(" + joinValues(list, " ") + ")";
    }

    static String quote(String value) {
        if (value.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
