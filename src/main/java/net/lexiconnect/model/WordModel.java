package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * This model holds a word of a phrase, together with its morpheme analysis.
 * A punctuation word never carries morphemes.
 */
@JsonInclude(Include.NON_NULL)
public class WordModel implements OrderedModel {
    /**
     * The ID of the word
     */
    private String id;
    /**
     * The word as written
     */
    private String surfaceForm = "";
    private String gloss = "";
    /**
     * The part(s) of speech assigned to the word
     */
    private List<String> pos = new ArrayList<>();
    private String language = "";
    /**
     * The position of the word within its phrase
     */
    private int order;
    /**
     * True if the word is a punctuation mark rather than a lexical word
     */
    private boolean punctuation;
    private List<MorphemeModel> morphemes = new ArrayList<>();

    public WordModel() {}

    public WordModel(String id, String surfaceForm) {
        this.id = id;
        this.surfaceForm = surfaceForm;
    }

    @Override
    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    @JsonProperty("surface_form")
    public String getSurfaceForm() {
        return surfaceForm;
    }
    public void setSurfaceForm(String surfaceForm) {
        this.surfaceForm = surfaceForm;
    }
    public String getGloss() {
        return gloss;
    }
    public void setGloss(String gloss) {
        this.gloss = gloss;
    }
    public List<String> getPos() {
        return pos;
    }
    public void setPos(List<String> pos) {
        this.pos = pos == null ? new ArrayList<>() : new ArrayList<>(pos);
    }
    // A single part of speech, as older data stores it
    @JsonIgnore
    public void setPosValue(String pos) {
        this.pos = new ArrayList<>();
        if (pos != null && !pos.isEmpty())
            this.pos.add(pos);
    }

    /**
     * @return the parts of speech joined for display, or null if there are none
     */
    @JsonIgnore
    public String getPosLabel() {
        if (pos == null || pos.isEmpty()) return null;
        return String.join(", ", pos);
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
    @JsonProperty("is_punctuation")
    public boolean isPunctuation() {
        return punctuation;
    }
    public void setPunctuation(boolean punctuation) {
        this.punctuation = punctuation;
        if (punctuation)
            morphemes = new ArrayList<>();
    }
    public List<MorphemeModel> getMorphemes() {
        return morphemes;
    }
    public void setMorphemes(List<MorphemeModel> morphemes) {
        if (punctuation) return;
        this.morphemes = morphemes == null ? new ArrayList<>() : morphemes;
    }
    public void addMorpheme(MorphemeModel morpheme) {
        if (punctuation) return;
        morphemes.add(morpheme);
    }
}
