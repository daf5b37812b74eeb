package com.quire.runner;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A notebook cell failed during execution. Carries the failing cell's position and the error details
 * reported by the kernel; the message reproduces the traceback with terminal colors removed.
 */
public class NotebookExecutionException extends RuntimeException {

    private static final String RULE = "-".repeat(75);
    private static final Pattern ANSI = Pattern.compile("\u001B\\[[0-9;]*[A-Za-z]");

    private final int cellIndex;
    private final Integer execCount;
    private final String source;
    private final String ename;
    private final String evalue;
    private final List<String> traceback;

    public NotebookExecutionException(int cellIndex, Integer execCount, String source,
                                      String ename, String evalue, List<String> traceback) {
        super(formatMessage(execCount, traceback));
        this.cellIndex = cellIndex;
        this.execCount = execCount;
        this.source = source;
        this.ename = ename;
        this.evalue = evalue;
        this.traceback = traceback != null ? List.copyOf(traceback) : List.of();
    }

    /** Index of the failing cell in the executed notebook, before error markers were inserted. */
    public int getCellIndex() {
        return cellIndex;
    }

    /** Execution count of the failing cell; null when it never got one. */
    public Integer getExecCount() {
        return execCount;
    }

    public String getSource() {
        return source;
    }

    public String getEname() {
        return ename;
    }

    public String getEvalue() {
        return evalue;
    }

    public List<String> getTraceback() {
        return traceback;
    }

    private static String formatMessage(Integer execCount, List<String> traceback) {
        String tb = traceback != null ? String.join("\n", traceback) : "";
        return "\n" + RULE + "\n"
                + "Exception encountered at \"In [" + (execCount != null ? execCount : "None") + "]\":\n"
                + ANSI.matcher(tb).replaceAll("") + "\n";
    }
}
