package com.quire.document;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory notebook: ordered cells (order is execution order), document metadata and format version.
 * Mutable; loaded once per run and passed from stage to stage.
 * <p>
 * This tool owns the {@value #NAMESPACE} key of document and cell metadata (see {@link #namespace()}).
 */
@JsonPropertyOrder({"cells", "metadata", "nbformat", "nbformat_minor"})
public final class Notebook {

    /** Metadata key reserved for this tool, in document and cell metadata. */
    public static final String NAMESPACE = "quire";

    public static final String INPUT_PATH = "input_path";
    public static final String OUTPUT_PATH = "output_path";
    public static final String PARAMETERS = "parameters";
    public static final String EXCEPTION = "exception";

    /** First nbformat 4 minor version that requires cell ids. */
    private static final int CELL_ID_MINOR = 5;

    private final List<Cell> cells;
    private final Map<String, Object> metadata;
    private final int nbformat;
    private final int nbformatMinor;
    private final Map<String, Object> other = new LinkedHashMap<>();

    @JsonCreator
    public Notebook(
            @JsonProperty("cells") List<Cell> cells,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("nbformat") Integer nbformat,
            @JsonProperty("nbformat_minor") Integer nbformatMinor) {
        this.cells = cells != null ? new ArrayList<>(cells) : new ArrayList<>();
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.nbformat = nbformat != null ? nbformat : 4;
        this.nbformatMinor = nbformatMinor != null ? nbformatMinor : CELL_ID_MINOR;
    }

    /** Empty nbformat 4.5 notebook holding the given cells. */
    public static Notebook of(List<Cell> cells) {
        Notebook nb = new Notebook(null, null, 4, CELL_ID_MINOR);
        if (cells != null) {
            cells.forEach(nb::addCell);
        }
        return nb;
    }

    /** Mutable cell list; index order is execution order. */
    @JsonProperty("cells")
    public List<Cell> getCells() {
        return cells;
    }

    public Cell getCell(int index) {
        return cells.get(index);
    }

    public int size() {
        return cells.size();
    }

    /** Appends a cell, assigning a cell id when the notebook format requires one. */
    public void addCell(Cell cell) {
        addCell(cells.size(), cell);
    }

    /** Inserts a cell at {@code index}, assigning a cell id when the notebook format requires one. */
    public void addCell(int index, Cell cell) {
        if (cell.getId() == null && nbformat == 4 && nbformatMinor >= CELL_ID_MINOR) {
            cell.setId(newCellId());
        }
        cells.add(index, cell);
    }

    /** Mutable document metadata; never null. */
    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonProperty("nbformat")
    public int getNbformat() {
        return nbformat;
    }

    @JsonProperty("nbformat_minor")
    public int getNbformatMinor() {
        return nbformatMinor;
    }

    /**
     * Document-level namespace for this tool ({@code metadata.quire}); created if absent.
     *
     * @throws IllegalStateException if the key exists but does not hold an object
     */
    public Map<String, Object> namespace() {
        return namespaceOf(metadata, "notebook metadata");
    }

    /** True if any cell carries the given tag. */
    public boolean anyTaggedCell(String tag) {
        return indexOfTaggedCell(tag) >= 0;
    }

    /** Index of the first cell carrying the given tag, or -1. */
    public int indexOfTaggedCell(String tag) {
        for (int i = 0; i < cells.size(); i++) {
            if (cells.get(i).hasTag(tag)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns a string value at a dotted path in the metadata (e.g. {@code kernelspec.name}), or null
     * if any segment is missing or not an object.
     */
    public String metadataString(String dottedPath) {
        Object current = metadata;
        for (String segment : dottedPath.split("\\.")) {
            if (!(current instanceof Map<?, ?>)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current instanceof String ? (String) current : null;
    }

    @JsonAnySetter
    void putOther(String key, Object value) {
        other.put(key, value);
    }

    @JsonAnyGetter
    Map<String, Object> getOther() {
        return other;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> namespaceOf(Map<String, Object> metadata, String owner) {
        Object existing = metadata.get(NAMESPACE);
        if (existing == null) {
            Map<String, Object> created = new LinkedHashMap<>();
            metadata.put(NAMESPACE, created);
            return created;
        }
        if (!(existing instanceof Map<?, ?>)) {
            throw new IllegalStateException(owner + " key '" + NAMESPACE + "' is not an object");
        }
        return (Map<String, Object>) existing;
    }

    private static String newCellId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
