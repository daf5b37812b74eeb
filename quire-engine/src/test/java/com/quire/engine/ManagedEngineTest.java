package com.quire.engine;

import com.quire.document.Cell;
import com.quire.document.Notebook;
import com.quire.document.load.NotebookSink;
import com.quire.document.output.ErrorOutput;
import com.quire.document.output.StreamOutput;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManagedEngineTest {

    /** Clock that advances one second on every read. */
    private static final class SteppingClock extends Clock {
        private Instant current = Instant.parse("2024-01-01T00:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Instant now = current;
            current = current.plusSeconds(1);
            return now;
        }
    }

    /** Runs code cells in order; a cell whose source contains "raise" fails. */
    private static final class ScriptedEngine extends ManagedEngine {
        ScriptedEngine() {
            super(new SteppingClock());
        }

        @Override
        protected void executeManaged(ExecutionManager manager) {
            List<Cell> cells = manager.getNotebook().getCells();
            int count = 0;
            for (int i = 0; i < cells.size(); i++) {
                Cell cell = cells.get(i);
                if (!cell.isCode()) continue;
                manager.cellStart(cell, i);
                cell.setExecutionCount(++count);
                if (cell.getSource().contains("raise")) {
                    cell.setOutputs(List.of(new ErrorOutput("RuntimeError", "boom", List.of("Traceback"))));
                    manager.cellException(cell, i);
                    manager.cellComplete(cell, i);
                    return;
                }
                cell.setOutputs(List.of(new StreamOutput("stdout", "ok\n")));
                manager.cellComplete(cell, i);
            }
        }
    }

    private static Notebook notebook(String... sources) {
        List<Cell> cells = new ArrayList<>();
        cells.add(Cell.markdown("# Report"));
        for (String s : sources) {
            Cell c = Cell.code(s);
            c.setOutputs(List.of(new StreamOutput("stdout", "stale\n")));
            c.setExecutionCount(99);
            cells.add(c);
        }
        return Notebook.of(cells);
    }

    @Test
    void execute_recordsTimesStatusAndOutputs() throws Exception {
        Notebook nb = notebook("a = 1", "b = 2");

        Notebook result = new ScriptedEngine().execute(nb, EngineOptions.builder().build());

        Map<String, Object> ns = result.namespace();
        assertEquals("2024-01-01T00:00:00Z", ns.get("start_time"));
        assertEquals(false, ns.get(Notebook.EXCEPTION));
        assertTrue((Double) ns.get("duration") > 0);

        Map<String, Object> first = result.getCell(1).namespace();
        assertEquals("completed", first.get("status"));
        assertEquals(false, first.get(Notebook.EXCEPTION));
        assertEquals(1.0, first.get("duration"));
        assertEquals(1, result.getCell(1).getExecutionCount());
        assertEquals("ok\n", ((StreamOutput) result.getCell(1).getOutputs().get(0)).getText());

        assertEquals("completed", result.getCell(0).namespace().get("status"));
    }

    @Test
    void execute_flagsFailedCellAndLeavesLaterCellsPending() throws Exception {
        Notebook nb = notebook("a = 1", "raise ValueError()", "c = 3");

        Notebook result = new ScriptedEngine().execute(nb, EngineOptions.builder().build());

        assertEquals(true, result.namespace().get(Notebook.EXCEPTION));
        Map<String, Object> failed = result.getCell(2).namespace();
        assertEquals("failed", failed.get("status"));
        assertEquals(true, failed.get(Notebook.EXCEPTION));

        assertEquals("completed", result.getCell(0).namespace().get("status"));
        Cell notRun = result.getCell(3);
        assertEquals("pending", notRun.namespace().get("status"));
        assertNull(notRun.getExecutionCount());
        assertTrue(notRun.getOutputs().isEmpty());
    }

    @Test
    void execute_savesToOutputPathThroughSink() throws Exception {
        List<String> saves = new ArrayList<>();
        NotebookSink sink = (notebook, ref) -> saves.add(ref);
        EngineOptions options = EngineOptions.builder().outputPath("out.ipynb").sink(sink).build();

        new ScriptedEngine().execute(notebook("a = 1"), options);

        // start, cell start, cell complete, notebook complete
        assertEquals(4, saves.size());
        assertTrue(saves.stream().allMatch("out.ipynb"::equals));
    }

    @Test
    void execute_withoutOutputPathNeverSaves() throws Exception {
        List<String> saves = new ArrayList<>();
        EngineOptions options = EngineOptions.builder().sink((notebook, ref) -> saves.add(ref)).build();

        new ScriptedEngine().execute(notebook("a = 1"), options);

        assertTrue(saves.isEmpty());
    }

    @Test
    void execute_recordsCompletionEvenWhenEngineThrows() {
        Notebook nb = notebook("a = 1");
        ManagedEngine broken = new ManagedEngine(new SteppingClock()) {
            @Override
            protected void executeManaged(ExecutionManager manager) {
                throw new IllegalStateException("kernel lost");
            }
        };

        assertThrows(IllegalStateException.class, () -> broken.execute(nb, EngineOptions.builder().build()));
        assertEquals(false, nb.namespace().get(Notebook.EXCEPTION));
        assertTrue(nb.namespace().get("end_time") instanceof String);
    }

    @Test
    void autosave_respectsInterval() {
        List<String> saves = new ArrayList<>();
        EngineOptions options = EngineOptions.builder()
                .outputPath("out.ipynb")
                .sink((notebook, ref) -> saves.add(ref))
                .autosaveInterval(Duration.ofSeconds(10))
                .build();
        ExecutionManager manager = new ExecutionManager(notebook("a = 1"), options, new SteppingClock());

        assertTrue(manager.autosave());
        assertFalse(manager.autosave());
        assertEquals(1, saves.size());
    }

    @Test
    void autosave_disabledByZeroInterval() {
        EngineOptions options = EngineOptions.builder()
                .outputPath("out.ipynb")
                .sink((notebook, ref) -> { })
                .autosaveInterval(Duration.ZERO)
                .build();
        ExecutionManager manager = new ExecutionManager(notebook("a = 1"), options, new SteppingClock());

        assertFalse(manager.autosave());
    }
}
