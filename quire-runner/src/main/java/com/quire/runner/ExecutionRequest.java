package com.quire.runner;

import com.quire.config.QuireConfig;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One notebook run: where to read and write, what to inject, and how the engine should run it.
 * Immutable; build with {@link #builder()} or {@link #builder(QuireConfig)}.
 */
public final class ExecutionRequest {

    private final String inputPath;
    private final String outputPath;
    private final Map<String, Object> parameters;
    private final String engineName;
    private final boolean requestSaveOnCellExecute;
    private final int autosaveCellEvery;
    private final boolean prepareOnly;
    private final String kernelName;
    private final String language;
    private final boolean progressBar;
    private final boolean logOutput;
    private final String stdoutFile;
    private final String stderrFile;
    private final int startTimeout;
    private final Integer executionTimeout;
    private final boolean reportMode;
    private final String cwd;
    private final boolean obfuscateSensitiveParameters;
    private final List<String> sensitiveParameterPatterns;
    private final Map<String, Object> extras;

    private ExecutionRequest(Builder b) {
        this.inputPath = Objects.requireNonNull(b.inputPath, "inputPath");
        this.outputPath = b.outputPath;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
        this.engineName = b.engineName;
        this.requestSaveOnCellExecute = b.requestSaveOnCellExecute;
        this.autosaveCellEvery = b.autosaveCellEvery;
        this.prepareOnly = b.prepareOnly;
        this.kernelName = b.kernelName;
        this.language = b.language;
        this.progressBar = b.progressBar;
        this.logOutput = b.logOutput;
        this.stdoutFile = b.stdoutFile;
        this.stderrFile = b.stderrFile;
        this.startTimeout = b.startTimeout;
        this.executionTimeout = b.executionTimeout;
        this.reportMode = b.reportMode;
        this.cwd = b.cwd;
        this.obfuscateSensitiveParameters = b.obfuscateSensitiveParameters;
        this.sensitiveParameterPatterns = b.sensitiveParameterPatterns != null
                ? List.copyOf(b.sensitiveParameterPatterns) : null;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder seeded with the configured defaults. */
    public static Builder builder(QuireConfig config) {
        Objects.requireNonNull(config, "config");
        return new Builder()
                .engineName(config.getEngineName())
                .startTimeout(config.getStartTimeoutSeconds())
                .executionTimeout(config.getExecutionTimeoutSeconds())
                .obfuscateSensitiveParameters(config.isObfuscateSensitiveParameters())
                .sensitiveParameterPatterns(config.getSensitiveParameterPatterns())
                .reportMode(config.isReportMode())
                .progressBar(config.isProgressBar())
                .logOutput(config.isLogOutput())
                .autosaveCellEvery(config.getAutosaveSeconds());
    }

    /** Input reference; may contain {@code {name}} templates. */
    public String getInputPath() {
        return inputPath;
    }

    /** Output reference; null = do not persist. May contain {@code {name}} templates. */
    public String getOutputPath() {
        return outputPath;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /** Engine name; null = registry default. */
    public String getEngineName() {
        return engineName;
    }

    public boolean isRequestSaveOnCellExecute() {
        return requestSaveOnCellExecute;
    }

    public int getAutosaveCellEvery() {
        return autosaveCellEvery;
    }

    public boolean isPrepareOnly() {
        return prepareOnly;
    }

    public String getKernelName() {
        return kernelName;
    }

    public String getLanguage() {
        return language;
    }

    public boolean isProgressBar() {
        return progressBar;
    }

    public boolean isLogOutput() {
        return logOutput;
    }

    public String getStdoutFile() {
        return stdoutFile;
    }

    public String getStderrFile() {
        return stderrFile;
    }

    /** Seconds to wait for the kernel to start. */
    public int getStartTimeout() {
        return startTimeout;
    }

    /** Per-cell timeout in seconds; null = none. */
    public Integer getExecutionTimeout() {
        return executionTimeout;
    }

    public boolean isReportMode() {
        return reportMode;
    }

    public String getCwd() {
        return cwd;
    }

    public boolean isObfuscateSensitiveParameters() {
        return obfuscateSensitiveParameters;
    }

    /** Name patterns for redaction; null = built-in set. */
    public List<String> getSensitiveParameterPatterns() {
        return sensitiveParameterPatterns;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    public static final class Builder {
        private String inputPath;
        private String outputPath;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private String engineName;
        private boolean requestSaveOnCellExecute = true;
        private int autosaveCellEvery = 30;
        private boolean prepareOnly;
        private String kernelName;
        private String language;
        private boolean progressBar = true;
        private boolean logOutput;
        private String stdoutFile;
        private String stderrFile;
        private int startTimeout = 60;
        private Integer executionTimeout;
        private boolean reportMode;
        private String cwd;
        private boolean obfuscateSensitiveParameters = true;
        private List<String> sensitiveParameterPatterns;
        private final Map<String, Object> extras = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder inputPath(String inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder inputPath(Path inputPath) {
            this.inputPath = inputPath != null ? inputPath.toString() : null;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath != null ? outputPath.toString() : null;
            return this;
        }

        /** Adds all entries, keeping their iteration order. */
        public Builder parameters(Map<String, ?> parameters) {
            if (parameters != null) {
                this.parameters.putAll(parameters);
            }
            return this;
        }

        public Builder parameter(String name, Object value) {
            this.parameters.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder engineName(String engineName) {
            this.engineName = engineName;
            return this;
        }

        public Builder requestSaveOnCellExecute(boolean requestSaveOnCellExecute) {
            this.requestSaveOnCellExecute = requestSaveOnCellExecute;
            return this;
        }

        public Builder autosaveCellEvery(int seconds) {
            this.autosaveCellEvery = Math.max(0, seconds);
            return this;
        }

        public Builder prepareOnly(boolean prepareOnly) {
            this.prepareOnly = prepareOnly;
            return this;
        }

        public Builder kernelName(String kernelName) {
            this.kernelName = kernelName;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
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

        public Builder stdoutFile(String stdoutFile) {
            this.stdoutFile = stdoutFile;
            return this;
        }

        public Builder stderrFile(String stderrFile) {
            this.stderrFile = stderrFile;
            return this;
        }

        public Builder startTimeout(int seconds) {
            this.startTimeout = seconds;
            return this;
        }

        public Builder executionTimeout(Integer seconds) {
            this.executionTimeout = seconds;
            return this;
        }

        public Builder reportMode(boolean reportMode) {
            this.reportMode = reportMode;
            return this;
        }

        public Builder cwd(String cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder cwd(Path cwd) {
            this.cwd = cwd != null ? cwd.toString() : null;
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

        /** Engine-specific options passed through untouched. */
        public Builder extra(String key, Object value) {
            this.extras.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public ExecutionRequest build() {
            return new ExecutionRequest(this);
        }
    }
}
