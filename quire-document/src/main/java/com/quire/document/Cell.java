package com.quire.document;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.quire.document.output.Output;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single notebook cell: type, mutable metadata (including the {@code tags} list), source text and,
 * for code cells only, outputs and an execution count.
 * <p>
 * Fields this model does not interpret (e.g. {@code attachments}) are kept in a side map and written back
 * unchanged, so a load/store round trip does not lose data.
 */
@JsonPropertyOrder({"id", "cell_type", "metadata", "source"})
public final class Cell {

    public static final String TAGS_KEY = "tags";

    private String id;
    private final String cellTypeName;
    private final Map<String, Object> metadata;
    private MultilineText source;
    private List<Output> outputs;
    private Integer executionCount;
    private final Map<String, Object> other = new LinkedHashMap<>();

    @JsonCreator
    public Cell(
            @JsonProperty("id") String id,
            @JsonProperty("cell_type") String cellTypeName,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("source") @JsonDeserialize(using = SourceTextDeserializer.class) MultilineText source,
            @JsonProperty("outputs") List<Output> outputs,
            @JsonProperty("execution_count") Integer executionCount) {
        this.id = id;
        this.cellTypeName = cellTypeName != null ? cellTypeName : CellType.CODE.getValue();
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.source = source != null ? source : MultilineText.of("");
        if (getCellType() == CellType.CODE) {
            this.outputs = outputs != null ? new ArrayList<>(outputs) : new ArrayList<>();
            this.executionCount = executionCount;
        }
    }

    /** New code cell with the given source, no outputs and no execution count. */
    public static Cell code(String source) {
        return new Cell(null, CellType.CODE.getValue(), null, MultilineText.of(source), null, null);
    }

    /** New markdown cell with the given source. */
    public static Cell markdown(String source) {
        return new Cell(null, CellType.MARKDOWN.getValue(), null, MultilineText.of(source), null, null);
    }

    @JsonProperty("id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @JsonProperty("cell_type")
    public String getCellTypeName() {
        return cellTypeName;
    }

    public CellType getCellType() {
        return CellType.fromValue(cellTypeName);
    }

    public boolean isCode() {
        return getCellType() == CellType.CODE;
    }

    /** Mutable metadata map; never null. */
    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getSource() {
        return source.getText();
    }

    /** Replaces the source; rewritten source is stored as a single string. */
    public void setSource(String source) {
        this.source = MultilineText.of(source);
    }

    @JsonProperty("source")
    MultilineText sourceText() {
        return source;
    }

    /** Mutable outputs list for code cells; empty list for every other cell type. */
    public List<Output> getOutputs() {
        return outputs != null ? outputs : List.of();
    }

    public void setOutputs(List<Output> outputs) {
        requireCode("outputs");
        this.outputs = outputs != null ? new ArrayList<>(outputs) : new ArrayList<>();
    }

    /** Execution count for code cells; null when the cell has not run or is not a code cell. */
    public Integer getExecutionCount() {
        return executionCount;
    }

    public void setExecutionCount(Integer executionCount) {
        requireCode("execution_count");
        this.executionCount = executionCount;
    }

    /**
     * Tags in their stored order. Returns a copy; use {@link #addTag(String)} / {@link #setTags(List)} to change.
     */
    public List<String> getTags() {
        Object raw = metadata.get(TAGS_KEY);
        List<String> tags = new ArrayList<>();
        if (raw instanceof List<?>) {
            for (Object t : (List<?>) raw) {
                if (t != null) tags.add(t.toString());
            }
        }
        return tags;
    }

    public boolean hasTag(String tag) {
        return tag != null && getTags().contains(tag);
    }

    /** Appends the tag unless already present; tags behave as an ordered set. */
    public void addTag(String tag) {
        Objects.requireNonNull(tag, "tag");
        List<String> tags = getTags();
        if (!tags.contains(tag)) {
            tags.add(tag);
            metadata.put(TAGS_KEY, tags);
        }
    }

    public void setTags(List<String> tags) {
        metadata.put(TAGS_KEY, tags != null ? new ArrayList<>(tags) : new ArrayList<>());
    }

    /**
     * Per-cell metadata namespace for this tool ({@code metadata.quire}); created if absent.
     *
     * @throws IllegalStateException if the key exists but does not hold an object
     */
    public Map<String, Object> namespace() {
        return Notebook.namespaceOf(metadata, "cell metadata");
    }

    @JsonAnySetter
    void putOther(String key, Object value) {
        other.put(key, value);
    }

    @JsonAnyGetter
    Map<String, Object> anyFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (isCode()) {
            fields.put("execution_count", executionCount);
            fields.put("outputs", outputs != null ? outputs : List.of());
        }
        fields.putAll(other);
        return fields;
    }

    private void requireCode(String field) {
        if (!isCode()) {
            throw new IllegalStateException("Only code cells carry " + field + "; cell type is " + cellTypeName);
        }
    }
}
