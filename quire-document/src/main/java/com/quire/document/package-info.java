/**
 * Notebook document model and JSON serialization.
 *
 * <ul>
 *   <li>{@link com.quire.document.Notebook} – ordered cells, document metadata, the {@code quire} metadata namespace</li>
 *   <li>{@link com.quire.document.Cell} – typed cell with metadata, tags, source; outputs and execution count for code cells</li>
 *   <li>{@link com.quire.document.output} – output variants decoded by {@code output_type}</li>
 *   <li>{@link com.quire.document.load} – {@link com.quire.document.load.NotebookSource} / {@link com.quire.document.load.NotebookSink}
 *       and the local file implementation</li>
 *   <li>{@link com.quire.document.NotebookJson} – {@code fromJson}/{@code toJson}, file read/write, deep copy</li>
 * </ul>
 */
package com.quire.document;
