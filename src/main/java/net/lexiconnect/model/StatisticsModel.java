package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregate counts over a set of parsed texts.
 */
@JsonPropertyOrder({"total_texts", "total_sections", "total_phrases", "total_words_tokenized",
        "total_words_stored", "total_morphemes", "words_with_morphemes", "gloss_only_words",
        "morpheme_types", "languages", "pos_tags"})
public class StatisticsModel {
    private int totalTexts;
    private int totalSections;
    private int totalPhrases;
    /**
     * Words counted by splitting the phrase text on whitespace
     */
    private int totalWordsTokenized;
    /**
     * Words counted as stored word entities
     */
    private int totalWordsStored;
    private int totalMorphemes;
    private int wordsWithMorphemes;
    /**
     * Words that carry a gloss but no morpheme analysis
     */
    private int glossOnlyWords;
    private TreeMap<String, Integer> morphemeTypes = new TreeMap<>();
    private TreeSet<String> languages = new TreeSet<>();
    private TreeSet<String> posTags = new TreeSet<>();

    @JsonProperty("total_texts")
    public int getTotalTexts() { return totalTexts; }
    public void setTotalTexts(int totalTexts) { this.totalTexts = totalTexts; }
    @JsonProperty("total_sections")
    public int getTotalSections() { return totalSections; }
    public void setTotalSections(int totalSections) { this.totalSections = totalSections; }
    @JsonProperty("total_phrases")
    public int getTotalPhrases() { return totalPhrases; }
    public void setTotalPhrases(int totalPhrases) { this.totalPhrases = totalPhrases; }
    @JsonProperty("total_words_tokenized")
    public int getTotalWordsTokenized() { return totalWordsTokenized; }
    public void setTotalWordsTokenized(int totalWordsTokenized) { this.totalWordsTokenized = totalWordsTokenized; }
    @JsonProperty("total_words_stored")
    public int getTotalWordsStored() { return totalWordsStored; }
    public void setTotalWordsStored(int totalWordsStored) { this.totalWordsStored = totalWordsStored; }
    @JsonProperty("total_morphemes")
    public int getTotalMorphemes() { return totalMorphemes; }
    public void setTotalMorphemes(int totalMorphemes) { this.totalMorphemes = totalMorphemes; }
    @JsonProperty("words_with_morphemes")
    public int getWordsWithMorphemes() { return wordsWithMorphemes; }
    public void setWordsWithMorphemes(int wordsWithMorphemes) { this.wordsWithMorphemes = wordsWithMorphemes; }
    @JsonProperty("gloss_only_words")
    public int getGlossOnlyWords() { return glossOnlyWords; }
    public void setGlossOnlyWords(int glossOnlyWords) { this.glossOnlyWords = glossOnlyWords; }
    @JsonProperty("morpheme_types")
    public TreeMap<String, Integer> getMorphemeTypes() { return morphemeTypes; }
    public void setMorphemeTypes(TreeMap<String, Integer> morphemeTypes) { this.morphemeTypes = morphemeTypes; }
    public TreeSet<String> getLanguages() { return languages; }
    public void setLanguages(TreeSet<String> languages) { this.languages = languages; }
    @JsonProperty("pos_tags")
    public TreeSet<String> getPosTags() { return posTags; }
    public void setPosTags(TreeSet<String> posTags) { this.posTags = posTags; }
}
