package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single ELAN annotation. Alignable annotations carry a time range; reference
 * annotations instead point at an annotation on the parent tier.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"id", "start_ms", "end_ms", "value", "ref_id"})
public class ElanAnnotationModel {
    private String id;
    private Long startMs;
    private Long endMs;
    private String value = "";
    /**
     * The ID of the parent-tier annotation; null for alignable annotations
     */
    private String refId;
    private String tierId;

    public ElanAnnotationModel() {}

    public ElanAnnotationModel(String id, Long startMs, Long endMs, String value, String refId, String tierId) {
        this.id = id;
        this.startMs = startMs;
        this.endMs = endMs;
        this.value = value;
        this.refId = refId;
        this.tierId = tierId;
    }

    @JsonIgnore
    public boolean isAlignable() {
        return refId == null;
    }

    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    @JsonProperty("start_ms")
    public Long getStartMs() {
        return startMs;
    }
    public void setStartMs(Long startMs) {
        this.startMs = startMs;
    }
    @JsonProperty("end_ms")
    public Long getEndMs() {
        return endMs;
    }
    public void setEndMs(Long endMs) {
        this.endMs = endMs;
    }
    public String getValue() {
        return value;
    }
    public void setValue(String value) {
        this.value = value;
    }
    @JsonProperty("ref_id")
    public String getRefId() {
        return refId;
    }
    public void setRefId(String refId) {
        this.refId = refId;
    }
    @JsonIgnore
    public String getTierId() {
        return tierId;
    }
    public void setTierId(String tierId) {
        this.tierId = tierId;
    }
}
