package net.lexiconnect.parser;

import net.lexiconnect.exceptions.InvalidInputException;
import net.lexiconnect.model.*;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import static net.lexiconnect.Util.UNKNOWN_LANGUAGE;
import static net.lexiconnect.Util.firstValidLanguage;
import static net.lexiconnect.Util.normalizeLanguageCode;

/**
 * Parser for FLEx interlinear text exports (.flextext). Each interlinear-text element
 * in the file becomes one text.
 */
public class FlexTextParser {
    private static final Logger logger = LoggerFactory.getLogger(FlexTextParser.class);

    // How much of an element's content goes into a derived ID
    private static final int FRAGMENT_LENGTH = 32;

    /**
     * Parses a .flextext file from disk.
     *
     * @param file - the file to read
     * @return the texts in document order
     * @throws InvalidInputException if the file cannot be read or is not well-formed XML
     */
    public List<TextModel> parseFile(File file) throws InvalidInputException {
        try (InputStream in = FileUtils.openInputStream(file)) {
            return parse(in, file.getName());
        } catch (IOException e) {
            throw new InvalidInputException(file.getName(), e.getMessage(), e);
        }
    }

    /**
     * Parses the contents of a FLEXText stream.
     *
     * @param filestream - the XML data
     * @param sourceName - the name of the file, used to seed IDs for texts that have none
     * @return the texts in document order; empty if the file has no interlinear-text
     * @throws InvalidInputException if the stream is not well-formed XML
     */
    public List<TextModel> parse(InputStream filestream, String sourceName) throws InvalidInputException {
        Document doc = Util.openFileStream(filestream, sourceName);
        Element rootEl = doc.getDocumentElement();

        List<TextModel> texts = new ArrayList<>();
        List<Element> textElements = Util.elementsNamed(rootEl, "interlinear-text");
        for (int i = 0; i < textElements.size(); i++)
            texts.add(parseInterlinearText(textElements.get(i), sourceName, i));
        logger.debug("Parsed {} interlinear text(s) from {}", texts.size(), sourceName);
        return texts;
    }

    private TextModel parseInterlinearText(Element element, String sourceName, int index) {
        TextModel text = new TextModel();
        String metadataLanguage = null;

        for (Element item : Util.childElements(element, "item")) {
            ItemType type = ItemType.fromCode(Util.attribute(item, "type"));
            if (type == null) continue;
            String value = Util.textOf(item);
            switch (type) {
                case TITLE:
                    text.setTitle(value);
                    break;
                case SOURCE:
                    text.setSource(value);
                    break;
                case COMMENT:
                    text.setComment(value);
                    break;
                default:
                    continue;
            }
            if (metadataLanguage == null)
                metadataLanguage = normalizeLanguageCode(Util.attribute(item, "lang"));
        }

        String language = firstValidLanguage(metadataLanguage, vernacularLanguage(element));
        text.setLanguageCode(language == null ? UNKNOWN_LANGUAGE : language);

        String guid = Util.attribute(element, "guid");
        text.setId(isBlank(guid)
                ? StableIdGenerator.generate("interlinear-text", sourceName, String.valueOf(index),
                        StableIdGenerator.fragment(text.getTitle(), FRAGMENT_LENGTH))
                : guid);

        List<Element> paragraphs = Util.containedElements(element, "paragraphs", "paragraph");
        for (int i = 0; i < paragraphs.size(); i++)
            text.addSection(parseParagraph(paragraphs.get(i), text.getId(), i, text.getLanguageCode()));
        return text;
    }

    // The first vernacular language declared in the languages block, if any
    private static String vernacularLanguage(Element textElement) {
        for (Element lang : Util.containedElements(textElement, "languages", "language"))
            if ("true".equalsIgnoreCase(Util.attribute(lang, "vernacular")))
                return Util.attribute(lang, "lang");
        return null;
    }

    private SectionModel parseParagraph(Element element, String textId, int index, String textLanguage) {
        SectionModel section = new SectionModel();
        section.setId(elementId(element, "paragraph", textId, index));
        section.setOrder(Util.orderOf(element, index));

        List<Element> phrases = Util.containedElements(element, "phrases", "phrase");
        for (int i = 0; i < phrases.size(); i++)
            section.addPhrase(parsePhrase(phrases.get(i), section.getId(), i, textLanguage));
        return section;
    }

    private PhraseModel parsePhrase(Element element, String sectionId, int index, String textLanguage) {
        PhraseModel phrase = new PhraseModel();
        String itemLanguage = null;

        for (Element item : Util.childElements(element, "item")) {
            ItemType type = ItemType.fromCode(Util.attribute(item, "type"));
            if (type == ItemType.SEGNUM) {
                phrase.setSegnum(Util.textOf(item));
            } else if (type == ItemType.TXT) {
                phrase.setSurfaceText(Util.textOf(item));
                itemLanguage = Util.attribute(item, "lang");
            }
        }
        phrase.setLanguage(inherit(itemLanguage, textLanguage));
        phrase.setId(elementId(element, "phrase", sectionId, index));
        phrase.setOrder(Util.orderOf(element, index));

        List<Element> words = Util.containedElements(element, "words", "word");
        for (int i = 0; i < words.size(); i++)
            phrase.addWord(parseWord(words.get(i), phrase.getId(), i, phrase.getLanguage()));
        return phrase;
    }

    private WordModel parseWord(Element element, String phraseId, int index, String phraseLanguage) {
        WordModel word = new WordModel();
        word.setId(elementId(element, "word", phraseId, index));
        word.setOrder(Util.orderOf(element, index));
        String itemLanguage = null;
        boolean haveGloss = false;

        for (Element item : Util.childElements(element, "item")) {
            ItemType type = ItemType.fromCode(Util.attribute(item, "type"));
            if (type == null) continue;
            if (type == ItemType.PUNCT) {
                // Punctuation ends the analysis of this word
                word.setSurfaceForm(Util.textOf(item));
                word.setPunctuation(true);
                word.setGloss("");
                word.setPos(null);
                String punctLanguage = Util.attribute(item, "lang");
                word.setLanguage(inherit(punctLanguage == null ? itemLanguage : punctLanguage, phraseLanguage));
                return word;
            }
            switch (type) {
                case TXT:
                    word.setSurfaceForm(Util.textOf(item));
                    itemLanguage = Util.attribute(item, "lang");
                    break;
                case GLS:
                    if (!haveGloss) {
                        word.setGloss(Util.textOf(item));
                        haveGloss = true;
                    }
                    break;
                case POS:
                    word.setPosValue(Util.textOf(item));
                    break;
                default:
                    break;
            }
        }
        word.setLanguage(inherit(itemLanguage, phraseLanguage));

        List<Element> morphs = Util.containedElements(element, "morphemes", "morph");
        for (int i = 0; i < morphs.size(); i++)
            word.addMorpheme(parseMorpheme(morphs.get(i), word.getId(), i, word.getLanguage()));
        return word;
    }

    private MorphemeModel parseMorpheme(Element element, String wordId, int index, String wordLanguage) {
        MorphemeModel morpheme = new MorphemeModel();
        String guid = Util.attribute(element, "guid");
        morpheme.setId(elementId(element, "morph", wordId, index));
        if (!isBlank(guid))
            morpheme.setOriginalId(guid);
        morpheme.setOrder(Util.orderOf(element, index));
        morpheme.setType(MorphemeType.fromFlexType(Util.attribute(element, "type")));
        String itemLanguage = null;

        for (Element item : Util.childElements(element, "item")) {
            ItemType type = ItemType.fromCode(Util.attribute(item, "type"));
            if (type == null) continue;
            switch (type) {
                case TXT:
                    morpheme.setSurfaceForm(Util.textOf(item));
                    itemLanguage = Util.attribute(item, "lang");
                    break;
                case CF:
                    morpheme.setCitationForm(Util.textOf(item));
                    break;
                case GLS:
                    morpheme.setGloss(Util.textOf(item));
                    break;
                case MSA:
                    morpheme.setMsa(Util.textOf(item));
                    break;
                default:
                    break;
            }
        }
        morpheme.setLanguage(inherit(itemLanguage, wordLanguage));
        return morpheme;
    }

    // The element's own guid, or one derived from its position and content
    private static String elementId(Element element, String kind, String parentId, int index) {
        String guid = Util.attribute(element, "guid");
        if (!isBlank(guid))
            return guid;
        return StableIdGenerator.generate(kind, parentId, String.valueOf(index),
                StableIdGenerator.fragment(Util.textOf(element), FRAGMENT_LENGTH));
    }

    private static String inherit(String own, String parent) {
        String chosen = firstValidLanguage(own, parent);
        return chosen == null ? parent : chosen;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
