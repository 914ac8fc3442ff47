package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.lexiconnect.Util;
import net.lexiconnect.parser.StableIdGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * This model holds a gloss annotation as it is stored in the graph, pointing at the
 * word or morpheme it annotates. Glosses are not part of the document tree; they are
 * derived from the gloss fields of words and morphemes.
 */
@JsonInclude(Include.NON_NULL)
public class GlossModel {

    public enum Target {
        WORD, PHRASE, MORPHEME;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    private String id;
    /**
     * The gloss text
     */
    private String annotation;
    private Target target = Target.WORD;
    /**
     * The ID of the annotated word, phrase or morpheme
     */
    private String targetId;
    private String language = "en";

    public GlossModel() {}

    public GlossModel(String annotation, Target target, String targetId, String language) {
        this.id = StableIdGenerator.generate("gloss", target.toString(), targetId, annotation);
        this.annotation = annotation;
        this.target = target;
        this.targetId = targetId;
        this.language = language;
    }

    /**
     * Collects a gloss for every word and morpheme of the text that has a non-empty gloss.
     * Punctuation words are never glossed.
     *
     * @param text - the text to walk
     * @param analysisLanguage - the language to record for the glosses; "en" if not valid
     * @return the glosses in document order
     */
    public static List<GlossModel> deriveFrom(TextModel text, String analysisLanguage) {
        String language = Util.firstValidLanguage(analysisLanguage, text.getAnalysisLanguage(), "en");
        List<GlossModel> result = new ArrayList<>();
        for (SectionModel s : Util.sortedByOrder(text.getSections())) {
            List<WordModel> words = new ArrayList<>();
            for (PhraseModel p : Util.sortedByOrder(s.getPhrases()))
                words.addAll(Util.sortedByOrder(p.getWords()));
            words.addAll(Util.sortedByOrder(s.getWords()));
            for (WordModel w : words) {
                if (w.isPunctuation()) continue;
                if (!Util.isEmpty(w.getGloss()))
                    result.add(new GlossModel(w.getGloss(), Target.WORD, w.getId(), language));
                for (MorphemeModel m : Util.sortedByOrder(w.getMorphemes()))
                    if (!Util.isEmpty(m.getGloss()))
                        result.add(new GlossModel(m.getGloss(), Target.MORPHEME, m.getId(), language));
            }
        }
        return result;
    }

    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    public String getAnnotation() {
        return annotation;
    }
    public void setAnnotation(String annotation) {
        this.annotation = annotation;
    }
    @JsonProperty("gloss_type")
    public Target getTarget() {
        return target;
    }
    public void setTarget(Target target) {
        this.target = target;
    }
    @JsonProperty("target_id")
    public String getTargetId() {
        return targetId;
    }
    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }
    public String getLanguage() {
        return language;
    }
    public void setLanguage(String language) {
        this.language = language;
    }
}
