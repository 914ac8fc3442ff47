package net.lexiconnect.exporter;

import com.sun.xml.txw2.output.IndentingXMLStreamWriter;
import net.lexiconnect.exceptions.ExportException;
import net.lexiconnect.model.*;
import net.lexiconnect.parser.StableIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static net.lexiconnect.Util.firstValidLanguage;
import static net.lexiconnect.Util.isEmpty;
import static net.lexiconnect.Util.sortedByOrder;

/**
 * This class writes texts out as FLEx interlinear text XML. A single text is written as
 * a bare interlinear-text root; several texts are wrapped in one document element.
 *
 * Surface forms carry the language of their word (falling back through phrase and text),
 * while glosses, parts of speech and analyses carry the analysis language.
 */
public class FlextextExporter implements Exporter {
    private static final Logger logger = LoggerFactory.getLogger(FlextextExporter.class);

    private static final String FALLBACK_ANALYSIS_LANGUAGE = "en";
    private static final String DOCUMENT_VERSION = "2";

    private final String defaultLanguage;

    public FlextextExporter() {
        this(null);
    }

    /**
     * @param defaultLanguage - language used for metadata and analysis items when the text
     *                        itself names none
     */
    public FlextextExporter(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    @Override
    public String getFileType() {
        return ExportFormat.FLEXTEXT.getFileType();
    }

    @Override
    public String getMediaType() {
        return ExportFormat.FLEXTEXT.getMediaType();
    }

    @Override
    public String getFileExtension() {
        return ExportFormat.FLEXTEXT.getFileExtension();
    }

    @Override
    public byte[] export(List<TextModel> texts) throws ExportException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLOutputFactory output = XMLOutputFactory.newInstance();
            XMLStreamWriter writer = new IndentingXMLStreamWriter(
                    output.createXMLStreamWriter(out, StandardCharsets.UTF_8.name()));
            writer.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");

            if (texts.size() == 1) {
                writeText(writer, texts.get(0));
            } else {
                writer.writeStartElement("document");
                writer.writeAttribute("version", DOCUMENT_VERSION);
                for (TextModel text : texts)
                    writeText(writer, text);
                writer.writeEndElement(); // document
            }

            writer.writeEndDocument();
            writer.flush();
            writer.close();
        } catch (XMLStreamException | RuntimeException e) {
            logger.error("FLEXText export of {} text(s) failed", texts.size(), e);
            throw new ExportException(getFileType(), e);
        }
        return out.toByteArray();
    }

    private void writeText(XMLStreamWriter writer, TextModel text) throws XMLStreamException {
        String metadataLanguage = firstValidLanguage(
                text.getMetadataLanguage(), text.getLanguageCode(), defaultLanguage);
        String analysisLanguage = firstValidLanguage(
                text.getAnalysisLanguage(), defaultLanguage, FALLBACK_ANALYSIS_LANGUAGE);
        String textLanguage = firstValidLanguage(text.getLanguageCode());

        writer.writeStartElement("interlinear-text");
        writeGuid(writer, text.getId());
        writeItem(writer, ItemType.TITLE, metadataLanguage, text.getTitle());
        writeItem(writer, ItemType.SOURCE, metadataLanguage, text.getSource());
        writeItem(writer, ItemType.COMMENT, metadataLanguage, text.getComment());

        writer.writeStartElement("paragraphs");
        for (SectionModel section : sortedByOrder(text.getSections())) {
            writer.writeStartElement("paragraph");
            writeGuid(writer, section.getId());
            writer.writeStartElement("phrases");
            for (PhraseModel phrase : phrasesOf(section, textLanguage))
                writePhrase(writer, phrase, textLanguage, analysisLanguage);
            writer.writeEndElement(); // phrases
            writer.writeEndElement(); // paragraph
        }
        writer.writeEndElement(); // paragraphs

        writer.writeStartElement("languages");
        if (textLanguage != null) {
            writer.writeEmptyElement("language");
            writer.writeAttribute("lang", textLanguage);
            writer.writeAttribute("vernacular", "true");
        }
        if (!analysisLanguage.equals(textLanguage)) {
            writer.writeEmptyElement("language");
            writer.writeAttribute("lang", analysisLanguage);
        }
        writer.writeEndElement(); // languages
        writer.writeEndElement(); // interlinear-text
    }

    // The section's phrases in order; words stored directly on the section follow as one extra phrase
    private static List<PhraseModel> phrasesOf(SectionModel section, String textLanguage) {
        List<PhraseModel> phrases = new ArrayList<>(sortedByOrder(section.getPhrases()));
        if (section.getWords() != null && !section.getWords().isEmpty()) {
            PhraseModel direct = new PhraseModel(
                    StableIdGenerator.generate("phrase", section.getId(), "words"), "");
            direct.setLanguage(textLanguage);
            direct.setOrder(phrases.isEmpty() ? 0 : phrases.get(phrases.size() - 1).getOrder() + 1);
            direct.setWords(new ArrayList<>(section.getWords()));
            phrases.add(direct);
        }
        return phrases;
    }

    private void writePhrase(XMLStreamWriter writer, PhraseModel phrase, String textLanguage,
                             String analysisLanguage) throws XMLStreamException {
        String phraseLanguage = firstValidLanguage(phrase.getLanguage(), textLanguage);

        writer.writeStartElement("phrase");
        writeGuid(writer, phrase.getId());
        writeItem(writer, ItemType.SEGNUM, analysisLanguage, phrase.getSegnum());
        writeItem(writer, ItemType.TXT, phraseLanguage, phrase.getSurfaceText());

        writer.writeStartElement("words");
        for (WordModel word : sortedByOrder(phrase.getWords()))
            writeWord(writer, word, phraseLanguage, analysisLanguage);
        writer.writeEndElement(); // words
        writer.writeEndElement(); // phrase
    }

    private void writeWord(XMLStreamWriter writer, WordModel word, String phraseLanguage,
                           String analysisLanguage) throws XMLStreamException {
        String wordLanguage = firstValidLanguage(word.getLanguage(), phraseLanguage);

        writer.writeStartElement("word");
        writeGuid(writer, word.getId());
        if (word.isPunctuation()) {
            writeItem(writer, ItemType.PUNCT, wordLanguage, word.getSurfaceForm());
            writer.writeEndElement(); // word
            return;
        }
        writeItem(writer, ItemType.TXT, wordLanguage, word.getSurfaceForm());
        writeItem(writer, ItemType.GLS, analysisLanguage, word.getGloss());
        writeItem(writer, ItemType.POS, analysisLanguage, word.getPosLabel());

        List<MorphemeModel> morphemes = word.getMorphemes();
        if (morphemes != null && !morphemes.isEmpty()) {
            writer.writeStartElement("morphemes");
            for (MorphemeModel morpheme : sortedByOrder(morphemes)) {
                String morphLanguage = firstValidLanguage(morpheme.getLanguage(), wordLanguage);
                writer.writeStartElement("morph");
                writeGuid(writer, morpheme.getId());
                if (morpheme.getType() != null)
                    writer.writeAttribute("type", morpheme.getType().getValue());
                writeItem(writer, ItemType.TXT, morphLanguage, morpheme.getSurfaceForm());
                writeItem(writer, ItemType.CF, morphLanguage, morpheme.getCitationForm());
                writeItem(writer, ItemType.GLS, analysisLanguage, morpheme.getGloss());
                writeItem(writer, ItemType.MSA, analysisLanguage, morpheme.getMsa());
                writer.writeEndElement(); // morph
            }
            writer.writeEndElement(); // morphemes
        }
        writer.writeEndElement(); // word
    }

    private static void writeGuid(XMLStreamWriter writer, String id) throws XMLStreamException {
        if (!isEmpty(id))
            writer.writeAttribute("guid", id);
    }

    // Absent and empty values produce no item at all
    private static void writeItem(XMLStreamWriter writer, ItemType type, String lang, String value)
            throws XMLStreamException {
        if (isEmpty(value))
            return;
        writer.writeStartElement("item");
        writer.writeAttribute("type", type.getCode());
        if (lang != null)
            writer.writeAttribute("lang", lang);
        writer.writeCharacters(value);
        writer.writeEndElement();
    }
}
