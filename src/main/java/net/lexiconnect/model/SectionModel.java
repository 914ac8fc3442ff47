package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

import java.util.ArrayList;
import java.util.List;

/**
 * This model holds a section of a text, the equivalent of a FLEx paragraph.
 */
@JsonInclude(Include.NON_NULL)
public class SectionModel implements OrderedModel {
    /**
     * The ID of the section
     */
    private String id;
    /**
     * The position of the section within its text
     */
    private int order;
    private List<PhraseModel> phrases = new ArrayList<>();
    /**
     * Words attached to the section without an intervening phrase. Only the
     * legacy storage schema produces these.
     */
    private List<WordModel> words = new ArrayList<>();

    public SectionModel() {}

    public SectionModel(String id, int order) {
        this.id = id;
        this.order = order;
    }

    @Override
    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    @Override
    public int getOrder() {
        return order;
    }
    public void setOrder(int order) {
        this.order = order;
    }
    public List<PhraseModel> getPhrases() {
        return phrases;
    }
    public void setPhrases(List<PhraseModel> phrases) {
        this.phrases = phrases == null ? new ArrayList<>() : phrases;
    }
    public void addPhrase(PhraseModel phrase) {
        phrases.add(phrase);
    }
    public List<WordModel> getWords() {
        return words;
    }
    public void setWords(List<WordModel> words) {
        this.words = words == null ? new ArrayList<>() : words;
    }
}
