package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ELAN tier with its annotations, in file order.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"tier_id", "participant", "linguistic_type_ref", "parent_ref", "annotations"})
public class ElanTierModel {
    private String id;
    private String participant;
    private String linguisticTypeRef;
    /**
     * The TIER_ID of the parent tier, if this is a dependent tier
     */
    private String parentRef;
    private List<ElanAnnotationModel> annotations = new ArrayList<>();

    public ElanTierModel() {}

    public ElanTierModel(String id, String participant, String linguisticTypeRef, String parentRef) {
        this.id = id;
        this.participant = participant;
        this.linguisticTypeRef = linguisticTypeRef;
        this.parentRef = parentRef;
    }

    @JsonIgnore
    public List<ElanAnnotationModel> getAlignableAnnotations() {
        return annotations.stream().filter(ElanAnnotationModel::isAlignable).collect(Collectors.toList());
    }

    @JsonIgnore
    public boolean hasAlignableAnnotations() {
        return annotations.stream().anyMatch(ElanAnnotationModel::isAlignable);
    }

    @JsonProperty("tier_id")
    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    public String getParticipant() {
        return participant;
    }
    public void setParticipant(String participant) {
        this.participant = participant;
    }
    @JsonProperty("linguistic_type_ref")
    public String getLinguisticTypeRef() {
        return linguisticTypeRef;
    }
    public void setLinguisticTypeRef(String linguisticTypeRef) {
        this.linguisticTypeRef = linguisticTypeRef;
    }
    @JsonProperty("parent_ref")
    public String getParentRef() {
        return parentRef;
    }
    public void setParentRef(String parentRef) {
        this.parentRef = parentRef;
    }
    public List<ElanAnnotationModel> getAnnotations() {
        return annotations;
    }
    public void setAnnotations(List<ElanAnnotationModel> annotations) {
        this.annotations = annotations;
    }
}
