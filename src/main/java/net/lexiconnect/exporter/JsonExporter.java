package net.lexiconnect.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.lexiconnect.exceptions.ExportException;
import net.lexiconnect.model.*;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static net.lexiconnect.Util.sortedByOrder;

/**
 * This class dumps texts as JSON, inside an envelope that records the export time.
 * Values are written as stored, with no language inheritance; absent values appear
 * as explicit nulls so that every record has the same keys.
 */
public class JsonExporter implements Exporter {

    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public JsonExporter() {
        this(Clock.systemUTC());
    }

    public JsonExporter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getFileType() {
        return ExportFormat.JSON.getFileType();
    }

    @Override
    public String getMediaType() {
        return ExportFormat.JSON.getMediaType();
    }

    @Override
    public String getFileExtension() {
        return ExportFormat.JSON.getFileExtension();
    }

    @Override
    public byte[] export(List<TextModel> texts) throws ExportException {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("exported_at", DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
        List<Object> textList = new ArrayList<>();
        try {
            for (TextModel text : texts)
                textList.add(textMap(text));
            envelope.put("texts", textList);
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new ExportException(getFileType(), e);
        }
    }

    private static Map<String, Object> textMap(TextModel text) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", text.getId());
        m.put("title", text.getTitle());
        m.put("source", text.getSource());
        m.put("comment", text.getComment());
        m.put("language_code", text.getLanguageCode());
        List<Object> sections = new ArrayList<>();
        for (SectionModel s : sortedByOrder(text.getSections()))
            sections.add(sectionMap(s));
        m.put("sections", sections);
        return m;
    }

    private static Map<String, Object> sectionMap(SectionModel section) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", section.getId());
        m.put("order", section.getOrder());
        List<Object> phrases = new ArrayList<>();
        for (PhraseModel p : sortedByOrder(section.getPhrases()))
            phrases.add(phraseMap(p));
        m.put("phrases", phrases);
        m.put("words", wordList(section.getWords()));
        return m;
    }

    private static Map<String, Object> phraseMap(PhraseModel phrase) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", phrase.getId());
        m.put("order", phrase.getOrder());
        m.put("segnum", phrase.getSegnum());
        m.put("surface_text", phrase.getSurfaceText());
        m.put("language", phrase.getLanguage());
        m.put("words", wordList(phrase.getWords()));
        return m;
    }

    private static List<Object> wordList(List<WordModel> words) {
        List<Object> result = new ArrayList<>();
        for (WordModel w : sortedByOrder(words)) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", w.getId());
            m.put("order", w.getOrder());
            m.put("surface_form", w.getSurfaceForm());
            m.put("gloss", w.getGloss());
            m.put("pos", w.getPos() == null || w.getPos().isEmpty() ? null : w.getPos());
            m.put("language", w.getLanguage());
            m.put("is_punctuation", w.isPunctuation());
            List<Object> morphemes = new ArrayList<>();
            for (MorphemeModel morpheme : sortedByOrder(w.getMorphemes()))
                morphemes.add(morphemeMap(morpheme));
            m.put("morphemes", morphemes);
            result.add(m);
        }
        return result;
    }

    private static Map<String, Object> morphemeMap(MorphemeModel morpheme) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", morpheme.getId());
        m.put("original_guid", morpheme.getOriginalId());
        m.put("order", morpheme.getOrder());
        m.put("type", morpheme.getType() == null ? null : morpheme.getType().getValue());
        m.put("surface_form", morpheme.getSurfaceForm());
        m.put("citation_form", morpheme.getCitationForm());
        m.put("gloss", morpheme.getGloss());
        m.put("msa", morpheme.getMsa());
        m.put("language", morpheme.getLanguage());
        return m;
    }
}
