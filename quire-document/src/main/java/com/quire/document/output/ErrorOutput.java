package com.quire.document.output;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Error output produced by an engine: exception name, value and traceback lines. */
@JsonPropertyOrder({"output_type", "ename", "evalue", "traceback"})
public final class ErrorOutput extends Output {

    private final String ename;
    private final String evalue;
    private final List<String> traceback;

    @JsonCreator
    public ErrorOutput(
            @JsonProperty("output_type") String outputTypeName,
            @JsonProperty("ename") String ename,
            @JsonProperty("evalue") String evalue,
            @JsonProperty("traceback") List<String> traceback) {
        super(OutputType.ERROR.getValue());
        this.ename = ename;
        this.evalue = evalue;
        this.traceback = traceback != null ? List.copyOf(traceback) : List.of();
    }

    public ErrorOutput(String ename, String evalue, List<String> traceback) {
        this(OutputType.ERROR.getValue(), ename, evalue, traceback);
    }

    @JsonProperty("ename")
    public String getEname() {
        return ename;
    }

    @JsonProperty("evalue")
    public String getEvalue() {
        return evalue;
    }

    @JsonProperty("traceback")
    public List<String> getTraceback() {
        return traceback;
    }
}
