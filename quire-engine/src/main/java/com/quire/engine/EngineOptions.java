package com.quire.engine;

import com.quire.document.load.NotebookSink;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options passed through to an engine for one run. Immutable; build with {@link #builder()}.
 */
public final class EngineOptions {

    private final String inputPath;
    private final String outputPath;
    private final NotebookSink sink;
    private final String kernelName;
    private final boolean progressBar;
    private final boolean logOutput;
    private final Duration startTimeout;
    private final Duration executionTimeout;
    private final String stdoutFile;
    private final String stderrFile;
    private final String cwd;
    private final Duration autosaveInterval;
    private final Map<String, Object> extras;

    private EngineOptions(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.sink = b.sink;
        this.kernelName = b.kernelName;
        this.progressBar = b.progressBar;
        this.logOutput = b.logOutput;
        this.startTimeout = b.startTimeout;
        this.executionTimeout = b.executionTimeout;
        this.stdoutFile = b.stdoutFile;
        this.stderrFile = b.stderrFile;
        this.cwd = b.cwd;
        this.autosaveInterval = b.autosaveInterval;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getInputPath() {
        return inputPath;
    }

    /** Where to save after each cell; null = the engine must not save. */
    public String getOutputPath() {
        return outputPath;
    }

    /** Sink used for intermediate saves to {@link #getOutputPath()}; null = no intermediate saves. */
    public NotebookSink getSink() {
        return sink;
    }

    public String getKernelName() {
        return kernelName;
    }

    public boolean isProgressBar() {
        return progressBar;
    }

    public boolean isLogOutput() {
        return logOutput;
    }

    public Duration getStartTimeout() {
        return startTimeout;
    }

    /** Per-cell timeout; null = none. */
    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public String getStdoutFile() {
        return stdoutFile;
    }

    public String getStderrFile() {
        return stderrFile;
    }

    /** Working directory for the run (also installed process-wide by the runner); null = unchanged. */
    public String getCwd() {
        return cwd;
    }

    /** Minimum time between intermediate saves during a cell; {@link Duration#ZERO} disables. */
    public Duration getAutosaveInterval() {
        return autosaveInterval;
    }

    /** Engine-specific options not modelled above; immutable. */
    public Map<String, Object> getExtras() {
        return extras;
    }

    public static final class Builder {
        private String inputPath;
        private String outputPath;
        private NotebookSink sink;
        private String kernelName;
        private boolean progressBar = true;
        private boolean logOutput;
        private Duration startTimeout = Duration.ofSeconds(60);
        private Duration executionTimeout;
        private String stdoutFile;
        private String stderrFile;
        private String cwd;
        private Duration autosaveInterval = Duration.ofSeconds(30);
        private final Map<String, Object> extras = new LinkedHashMap<>();

        public Builder inputPath(String inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder sink(NotebookSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder kernelName(String kernelName) {
            this.kernelName = kernelName;
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

        public Builder startTimeout(Duration startTimeout) {
            this.startTimeout = startTimeout != null ? startTimeout : Duration.ofSeconds(60);
            return this;
        }

        public Builder executionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
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

        public Builder cwd(String cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder autosaveInterval(Duration autosaveInterval) {
            this.autosaveInterval = autosaveInterval != null ? autosaveInterval : Duration.ZERO;
            return this;
        }

        public Builder extras(Map<String, Object> extras) {
            if (extras != null) {
                this.extras.putAll(extras);
            }
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }
    }
}
