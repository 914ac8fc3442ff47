package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * This model holds an interlinear text, the root of one parsed or stored document.
 */
@JsonInclude(Include.NON_NULL)
public class TextModel {
    /**
     * ID of the text
     */
    private String id;
    private String title = "";
    /**
     * The bibliographic source of the text
     */
    private String source = "";
    private String comment = "";
    /**
     * The language of the text, used as the default for everything below it
     */
    private String languageCode = "unknown";
    /**
     * An explicit language for the title/source/comment items, if one was given
     */
    private String metadataLanguage;
    /**
     * An explicit language for glosses and other analyses, if one was given
     */
    private String analysisLanguage;
    private List<SectionModel> sections = new ArrayList<>();

    public TextModel() {}

    public TextModel(String id, String title) {
        this.id = id;
        this.title = title;
    }

    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    public String getTitle() {
        return title;
    }
    public void setTitle(String title) {
        this.title = title;
    }
    public String getSource() {
        return source;
    }
    public void setSource(String source) {
        this.source = source;
    }
    public String getComment() {
        return comment;
    }
    public void setComment(String comment) {
        this.comment = comment;
    }
    @JsonProperty("language_code")
    public String getLanguageCode() {
        return languageCode;
    }
    public void setLanguageCode(String languageCode) {
        this.languageCode = languageCode;
    }
    @JsonProperty("metadata_language")
    public String getMetadataLanguage() {
        return metadataLanguage;
    }
    public void setMetadataLanguage(String metadataLanguage) {
        this.metadataLanguage = metadataLanguage;
    }
    @JsonProperty("analysis_language")
    public String getAnalysisLanguage() {
        return analysisLanguage;
    }
    public void setAnalysisLanguage(String analysisLanguage) {
        this.analysisLanguage = analysisLanguage;
    }
    public List<SectionModel> getSections() {
        return sections;
    }
    public void setSections(List<SectionModel> sections) {
        this.sections = sections == null ? new ArrayList<>() : sections;
    }
    public void addSection(SectionModel section) {
        sections.add(section);
    }
}
