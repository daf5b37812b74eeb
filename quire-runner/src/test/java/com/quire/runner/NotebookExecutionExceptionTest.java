package com.quire.runner;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NotebookExecutionExceptionTest {

    @Test
    void message_showsCountAndTraceback() {
        NotebookExecutionException e = new NotebookExecutionException(
                3, 5, "1/0", "ZeroDivisionError", "division by zero", List.of("line one", "line two"));

        String rule = "-".repeat(75);
        assertEquals("\n" + rule + "\nException encountered at \"In [5]\":\nline one\nline two\n", e.getMessage());
    }

    @Test
    void message_stripsTerminalColors() {
        NotebookExecutionException e = new NotebookExecutionException(
                0, null, "", "E", "", List.of("\u001B[0;31mError\u001B[0m"));

        assertEquals("\n" + "-".repeat(75) + "\nException encountered at \"In [None]\":\nError\n", e.getMessage());
        assertEquals(List.of("\u001B[0;31mError\u001B[0m"), e.getTraceback());
    }
}
