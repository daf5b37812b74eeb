package com.quire.runner;

import com.quire.document.Cell;
import com.quire.document.Notebook;

/**
 * Markdown cells that point a reader at the cell where execution failed: a banner at the top linking
 * to an anchor placed just above the failing cell. Both carry {@value #MARKER_TAG} so a later run can
 * remove them.
 */
public final class ErrorMarkers {

    public static final String MARKER_TAG = "quire-error-cell-tag";
    public static final String ANCHOR_ID = "quire-error-cell";

    static final String STYLE =
            "style=\"color:red; font-family:Helvetica Neue, Helvetica, Arial, sans-serif; font-size:2em;\"";
    static final String BANNER_TEMPLATE =
            "<span " + STYLE + ">An Exception was encountered at '<a href=\"#" + ANCHOR_ID + "\">In [%s]</a>'.</span>";
    static final String ANCHOR =
            "<span id=\"" + ANCHOR_ID + "\" " + STYLE
                    + ">Execution using quire encountered an exception here and stopped:</span>";

    private ErrorMarkers() {
    }

    /** Removes every marker cell. Idempotent. */
    public static Notebook clear(Notebook notebook) {
        notebook.getCells().removeIf(cell -> cell.hasTag(MARKER_TAG));
        return notebook;
    }

    /**
     * Inserts the anchor before the failing cell, then the banner at the top.
     * The failing cell ends up at {@code error.getCellIndex() + 2}.
     */
    public static Notebook mark(Notebook notebook, NotebookExecutionException error) {
        Cell anchor = Cell.markdown(ANCHOR);
        anchor.addTag(MARKER_TAG);
        notebook.addCell(error.getCellIndex(), anchor);

        Object count = error.getExecCount() != null ? error.getExecCount() : "None";
        Cell banner = Cell.markdown(String.format(BANNER_TEMPLATE, count));
        banner.addTag(MARKER_TAG);
        notebook.addCell(0, banner);
        return notebook;
    }
}
