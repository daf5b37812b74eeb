package com.quire.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Run defaults loaded from environment variables. Values set on an individual execution request override these.
 * <p>
 * Engine: QUIRE_ENGINE. Timeouts: QUIRE_START_TIMEOUT_SECONDS, QUIRE_EXECUTION_TIMEOUT_SECONDS (unset = none).
 * Redaction: QUIRE_OBFUSCATE_PARAMETERS, QUIRE_SENSITIVE_PATTERNS (comma-separated regexes; unset = built-in patterns).
 * Output: QUIRE_REPORT_MODE, QUIRE_PROGRESS_BAR, QUIRE_LOG_OUTPUT, QUIRE_AUTOSAVE_SECONDS. IO: QUIRE_IO_RETRIES.
 * Unparseable values fall back to the defaults.
 */
public final class QuireConfig {

    private static final String ENV_ENGINE = "QUIRE_ENGINE";
    private static final String ENV_START_TIMEOUT_SECONDS = "QUIRE_START_TIMEOUT_SECONDS";
    private static final String ENV_EXECUTION_TIMEOUT_SECONDS = "QUIRE_EXECUTION_TIMEOUT_SECONDS";
    private static final String ENV_OBFUSCATE_PARAMETERS = "QUIRE_OBFUSCATE_PARAMETERS";
    private static final String ENV_SENSITIVE_PATTERNS = "QUIRE_SENSITIVE_PATTERNS";
    private static final String ENV_REPORT_MODE = "QUIRE_REPORT_MODE";
    private static final String ENV_PROGRESS_BAR = "QUIRE_PROGRESS_BAR";
    private static final String ENV_LOG_OUTPUT = "QUIRE_LOG_OUTPUT";
    private static final String ENV_AUTOSAVE_SECONDS = "QUIRE_AUTOSAVE_SECONDS";
    private static final String ENV_IO_RETRIES = "QUIRE_IO_RETRIES";

    public static final String DEFAULT_ENGINE = "default";
    private static final int DEFAULT_START_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_AUTOSAVE_SECONDS = 30;
    private static final int DEFAULT_IO_RETRIES = 3;

    private final String engineName;
    private final int startTimeoutSeconds;
    private final Integer executionTimeoutSeconds;
    private final boolean obfuscateSensitiveParameters;
    private final List<String> sensitiveParameterPatterns;
    private final boolean reportMode;
    private final boolean progressBar;
    private final boolean logOutput;
    private final int autosaveSeconds;
    private final int ioRetries;

    private QuireConfig(Builder b) {
        this.engineName = b.engineName;
        this.startTimeoutSeconds = b.startTimeoutSeconds;
        this.executionTimeoutSeconds = b.executionTimeoutSeconds;
        this.obfuscateSensitiveParameters = b.obfuscateSensitiveParameters;
        this.sensitiveParameterPatterns = b.sensitiveParameterPatterns != null
                ? Collections.unmodifiableList(new ArrayList<>(b.sensitiveParameterPatterns))
                : null;
        this.reportMode = b.reportMode;
        this.progressBar = b.progressBar;
        this.logOutput = b.logOutput;
        this.autosaveSeconds = b.autosaveSeconds;
        this.ioRetries = b.ioRetries;
    }

    /** Engine used when a request names none. Default {@value #DEFAULT_ENGINE}. */
    public String getEngineName() {
        return engineName;
    }

    /** Seconds to wait for the kernel to start. Default 60. */
    public int getStartTimeoutSeconds() {
        return startTimeoutSeconds;
    }

    /** Per-cell execution timeout in seconds; null = no timeout. */
    public Integer getExecutionTimeoutSeconds() {
        return executionTimeoutSeconds;
    }

    /** Whether sensitive parameter values are redacted. Default true. */
    public boolean isObfuscateSensitiveParameters() {
        return obfuscateSensitiveParameters;
    }

    /** Custom sensitive-name patterns, or null to use the built-in set. */
    public List<String> getSensitiveParameterPatterns() {
        return sensitiveParameterPatterns;
    }

    public boolean isReportMode() {
        return reportMode;
    }

    public boolean isProgressBar() {
        return progressBar;
    }

    public boolean isLogOutput() {
        return logOutput;
    }

    /** Minimum seconds between intermediate saves during a long cell. Default 30; 0 disables. */
    public int getAutosaveSeconds() {
        return autosaveSeconds;
    }

    /** Attempts when reading an input notebook. Default 3; at least 1. */
    public int getIoRetries() {
        return ioRetries;
    }

    public static QuireConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Builds the config from an environment-like map (keys as in {@link #fromEnvironment()}). */
    public static QuireConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Function<String, String> get = env::get;
        List<String> patterns = parseCommaSeparated(get.apply(ENV_SENSITIVE_PATTERNS));
        return builder()
                .engineName(getEnv(get, ENV_ENGINE, DEFAULT_ENGINE))
                .startTimeoutSeconds(parseInt(get.apply(ENV_START_TIMEOUT_SECONDS), DEFAULT_START_TIMEOUT_SECONDS))
                .executionTimeoutSeconds(parseOptionalInt(get.apply(ENV_EXECUTION_TIMEOUT_SECONDS)))
                .obfuscateSensitiveParameters(parseBoolean(get.apply(ENV_OBFUSCATE_PARAMETERS), true))
                .sensitiveParameterPatterns(patterns.isEmpty() ? null : patterns)
                .reportMode(parseBoolean(get.apply(ENV_REPORT_MODE), false))
                .progressBar(parseBoolean(get.apply(ENV_PROGRESS_BAR), true))
                .logOutput(parseBoolean(get.apply(ENV_LOG_OUTPUT), false))
                .autosaveSeconds(parseInt(get.apply(ENV_AUTOSAVE_SECONDS), DEFAULT_AUTOSAVE_SECONDS))
                .ioRetries(parseInt(get.apply(ENV_IO_RETRIES), DEFAULT_IO_RETRIES))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        return defaultValue;
    }

    private static int parseInt(String value, int defaultValue) {
        Integer parsed = parseOptionalInt(value);
        return parsed != null ? parsed : defaultValue;
    }

    private static Integer parseOptionalInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String engineName = DEFAULT_ENGINE;
        private int startTimeoutSeconds = DEFAULT_START_TIMEOUT_SECONDS;
        private Integer executionTimeoutSeconds;
        private boolean obfuscateSensitiveParameters = true;
        private List<String> sensitiveParameterPatterns;
        private boolean reportMode;
        private boolean progressBar = true;
        private boolean logOutput;
        private int autosaveSeconds = DEFAULT_AUTOSAVE_SECONDS;
        private int ioRetries = DEFAULT_IO_RETRIES;

        public Builder engineName(String engineName) {
            this.engineName = (engineName != null && !engineName.isBlank()) ? engineName.trim() : DEFAULT_ENGINE;
            return this;
        }

        public Builder startTimeoutSeconds(int startTimeoutSeconds) {
            this.startTimeoutSeconds = Math.max(0, startTimeoutSeconds);
            return this;
        }

        public Builder executionTimeoutSeconds(Integer executionTimeoutSeconds) {
            this.executionTimeoutSeconds = executionTimeoutSeconds;
            return this;
        }

        public Builder obfuscateSensitiveParameters(boolean obfuscateSensitiveParameters) {
            this.obfuscateSensitiveParameters = obfuscateSensitiveParameters;
            return this;
        }

        public Builder sensitiveParameterPatterns(List<String> sensitiveParameterPatterns) {
            this.sensitiveParameterPatterns = sensitiveParameterPatterns;
            return this;
        }

        public Builder reportMode(boolean reportMode) {
            this.reportMode = reportMode;
            return this;
        }

        public Builder progressBar(boolean progressBar) {
            this.progressBar = progressBar;
            return this;
        }

        public Builder logOutput(boolean logOutput) {
            this.logOutput = logOutput;
            return this;
        }

        public Builder autosaveSeconds(int autosaveSeconds) {
            this.autosaveSeconds = Math.max(0, autosaveSeconds);
            return this;
        }

        public Builder ioRetries(int ioRetries) {
            this.ioRetries = Math.max(1, ioRetries);
            return this;
        }

        public QuireConfig build() {
            return new QuireConfig(this);
        }
    }
}
