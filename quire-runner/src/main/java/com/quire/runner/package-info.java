/**
 * Notebook runs: {@link com.quire.runner.NotebookRunner} drives a run described by an
 * {@link com.quire.runner.ExecutionRequest}; failures are located by
 * {@link com.quire.runner.ExecutionErrors} and flagged in the document by
 * {@link com.quire.runner.ErrorMarkers}.
 */
package com.quire.runner;
