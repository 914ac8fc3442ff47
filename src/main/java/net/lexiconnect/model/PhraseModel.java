package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * This model holds a phrase (FLEx: segment) and the words it is made of.
 */
@JsonInclude(Include.NON_NULL)
public class PhraseModel implements OrderedModel {
    /**
     * The ID of the phrase
     */
    private String id;
    /**
     * The segment number, used as a display label
     */
    private String segnum = "";
    /**
     * The full text of the phrase
     */
    private String surfaceText = "";
    private String language = "";
    /**
     * The position of the phrase within its section
     */
    private int order;
    private List<WordModel> words = new ArrayList<>();

    public PhraseModel() {}

    public PhraseModel(String id, String surfaceText) {
        this.id = id;
        this.surfaceText = surfaceText;
    }

    @Override
    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    public String getSegnum() {
        return segnum;
    }
    public void setSegnum(String segnum) {
        this.segnum = segnum;
    }
    @JsonProperty("surface_text")
    public String getSurfaceText() {
        return surfaceText;
    }
    public void setSurfaceText(String surfaceText) {
        this.surfaceText = surfaceText;
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
    public List<WordModel> getWords() {
        return words;
    }
    public void setWords(List<WordModel> words) {
        this.words = words == null ? new ArrayList<>() : words;
    }
    public void addWord(WordModel word) {
        words.add(word);
    }
}
