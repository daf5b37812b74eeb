package com.quire.parameterize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Redacts values of parameters whose names look sensitive. Name patterns are case-insensitive regular
 * expressions matched anywhere in the name. The built-in set covers {@code password}, {@code token} and
 * {@code key} as a whole word ({@code api_key} matches, {@code keyword} does not); a custom set replaces it.
 */
public final class SensitiveParameters {

    /** Replacement written in place of a sensitive value. */
    public static final String REDACTED = "********";

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "password",
            "token",
            "(?<![A-Za-z0-9])key(?![A-Za-z0-9])");

    private static final SensitiveParameters DEFAULTS = new SensitiveParameters(DEFAULT_PATTERNS);

    private final List<Pattern> patterns;

    private SensitiveParameters(List<String> patterns) {
        this.patterns = patterns.stream()
                .map(SensitiveParameters::compile)
                .toList();
    }

    /** Redactor with the built-in patterns. */
    public static SensitiveParameters defaults() {
        return DEFAULTS;
    }

    /**
     * Redactor with the given patterns; null = built-in patterns.
     *
     * @throws IllegalArgumentException if a pattern is not a valid regular expression
     */
    public static SensitiveParameters of(List<String> patterns) {
        return patterns == null ? DEFAULTS : new SensitiveParameters(patterns);
    }

    /** Redacts with the built-in patterns. */
    public static Object obfuscateParameter(String name, Object value) {
        return DEFAULTS.redact(name, value);
    }

    /** Redacts with the given patterns (null = built-in patterns). */
    public static Object obfuscateParameter(String name, Object value, List<String> patterns) {
        return of(patterns).redact(name, value);
    }

    public boolean isSensitive(String name) {
        if (name == null) return false;
        for (Pattern p : patterns) {
            if (p.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    /** {@link #REDACTED} when the name is sensitive (whatever the value, empty included), else the value unchanged. */
    public Object redact(String name, Object value) {
        return isSensitive(name) ? REDACTED : value;
    }

    /** Copy of the parameters with sensitive values redacted, in the same order. */
    public Map<String, Object> redactAll(Map<String, Object> parameters) {
        Objects.requireNonNull(parameters, "parameters");
        Map<String, Object> out = new LinkedHashMap<>();
        parameters.forEach((name, value) -> out.put(name, redact(name, value)));
        return out;
    }

    private static Pattern compile(String regex) {
        Objects.requireNonNull(regex, "pattern");
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid sensitive parameter pattern: " + regex, e);
        }
    }
}
