package com.quire.parameterize;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {name}} tokens in a path with parameter values. Nested values are addressed as
 * {@code {pm.run_uuid}} or {@code {pm[run_uuid]}}. {@code {{} and {@code }}} stand for literal braces.
 */
public final class PathTemplates {

    private static final Pattern TOKEN = Pattern.compile("\\{\\{|}}|\\{([^{}]+)}");

    private PathTemplates() {
    }

    /**
     * Resolves every token in {@code path}.
     *
     * @param path       path template; null is returned as null
     * @param parameters values by name (may be null)
     * @throws IllegalArgumentException if a token names a missing parameter
     */
    public static String resolve(String path, Map<String, Object> parameters) {
        if (path == null || path.indexOf('{') < 0 && path.indexOf('}') < 0) {
            return path;
        }
        Matcher m = TOKEN.matcher(path);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement;
            if ("{{".equals(m.group())) {
                replacement = "{";
            } else if ("}}".equals(m.group())) {
                replacement = "}";
            } else {
                replacement = String.valueOf(lookup(m.group(1).trim(), parameters, path));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static Object lookup(String key, Map<String, Object> parameters, String path) {
        String[] segments = key.replace("[", ".").replace("]", "").split("\\.");
        Object current = parameters;
        for (String segment : segments) {
            if (!(current instanceof Map<?, ?>) || !((Map<?, ?>) current).containsKey(segment)) {
                throw new IllegalArgumentException("Missing parameter '" + key + "' for path template: " + path);
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }
}
