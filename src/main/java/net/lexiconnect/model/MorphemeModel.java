package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * This model holds a single morpheme of an analysed word.
 */
@JsonInclude(Include.NON_NULL)
public class MorphemeModel implements OrderedModel {
    /**
     * The ID of the morpheme
     */
    private String id;
    /**
     * The ID the morpheme carried in its source file, if it differs from ours
     */
    private String originalId;
    /**
     * The grammatical class of the morpheme; null when unknown
     */
    private MorphemeType type = MorphemeType.STEM;
    /**
     * The surface form as it appears in the word
     */
    private String surfaceForm = "";
    /**
     * The citation (dictionary) form
     */
    private String citationForm = "";
    private String gloss = "";
    /**
     * The morphosyntactic analysis, flattened to a display string
     */
    private String msa = "";
    private String language = "";
    /**
     * The position of the morpheme within its word
     */
    private int order;

    public MorphemeModel() {}

    public MorphemeModel(String id, MorphemeType type, String surfaceForm) {
        this.id = id;
        this.type = type;
        this.surfaceForm = surfaceForm;
    }

    @Override
    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    @JsonProperty("original_id")
    public String getOriginalId() {
        return originalId;
    }
    public void setOriginalId(String originalId) {
        this.originalId = originalId;
    }
    public MorphemeType getType() {
        return type;
    }
    public void setType(MorphemeType type) {
        this.type = type;
    }
    @JsonProperty("surface_form")
    public String getSurfaceForm() {
        return surfaceForm;
    }
    public void setSurfaceForm(String surfaceForm) {
        this.surfaceForm = surfaceForm;
    }
    @JsonProperty("citation_form")
    public String getCitationForm() {
        return citationForm;
    }
    public void setCitationForm(String citationForm) {
        this.citationForm = citationForm;
    }
    public String getGloss() {
        return gloss;
    }
    public void setGloss(String gloss) {
        this.gloss = gloss;
    }
    public String getMsa() {
        return msa;
    }
    public void setMsa(String msa) {
        this.msa = msa;
    }
    public String getLanguage() {
        return language;
    }
    public void setLanguage(String language) {
        this.language = language;
    }
    @Override
    public int getOrder() {
        return order;
    }
    public void setOrder(int order) {
        this.order = order;
    }
}
