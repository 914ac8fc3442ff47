package net.lexiconnect.testing.integrationtests;

import junit.framework.TestCase;
import net.lexiconnect.exporter.FlextextExporter;
import net.lexiconnect.model.*;
import net.lexiconnect.parser.FlexTextParser;
import net.lexiconnect.parser.StableIdGenerator;
import net.lexiconnect.testing.Util;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class FlextextExporterTest extends TestCase {

    private FlextextExporter exporter;

    public void setUp() throws Exception {
        super.setUp();
        exporter = new FlextextExporter();
    }

    public void testSingleTextIsBareRoot() throws Exception {
        byte[] xml = exporter.export(Util.parseFlexText("hello.flextext"));
        String asString = new String(xml, StandardCharsets.UTF_8);
        assertTrue(asString.startsWith("<?xml"));
        assertTrue(asString.substring(0, asString.indexOf("?>")).contains("UTF-8"));
        Document doc = Util.parseXml(xml);
        Element root = doc.getDocumentElement();
        assertEquals("interlinear-text", root.getNodeName());
        assertEquals("b6e4c6a0-0001-4b8e-9d34-000000000001", root.getAttribute("guid"));
        assertEquals("Hello text", Util.item(root, "title"));
        assertEquals("en", Util.itemElement(root, "title").getAttribute("lang"));
        // indentation puts line breaks between elements
        assertTrue(asString.contains("\n"));
    }

    public void testSeveralTextsAreWrapped() throws Exception {
        byte[] xml = exporter.export(Util.parseFlexText("mixed.flextext"));
        Element root = Util.parseXml(xml).getDocumentElement();
        assertEquals("document", root.getNodeName());
        assertEquals("2", root.getAttribute("version"));
        assertEquals(2, Util.childElements(root, "interlinear-text").size());
    }

    public void testRoundTrip() throws Exception {
        TextModel original = Util.parseFlexText("hello.flextext").get(0);
        byte[] xml = exporter.export(Collections.singletonList(original));
        List<TextModel> reparsed = new FlexTextParser().parse(new ByteArrayInputStream(xml), "hello.flextext");
        assertEquals(1, reparsed.size());
        TextModel copy = reparsed.get(0);
        assertEquals(original.getId(), copy.getId());
        assertEquals(original.getTitle(), copy.getTitle());
        assertEquals(original.getSource(), copy.getSource());
        assertEquals(original.getComment(), copy.getComment());
        assertWordsMatch(Util.allWords(original), Util.allWords(copy));
        PhraseModel phrase = copy.getSections().get(0).getPhrases().get(0);
        assertEquals("Hello world", phrase.getSurfaceText());
        assertEquals("1", phrase.getSegnum());
    }

    public void testRoundTripWithPunctuationAndReordering() throws Exception {
        List<TextModel> original = Util.parseFlexText("mixed.flextext");
        byte[] xml = exporter.export(original);
        List<TextModel> copy = new FlexTextParser().parse(new ByteArrayInputStream(xml), "mixed.flextext");
        assertEquals(2, copy.size());
        assertWordsMatch(Util.allWords(original.get(0)), Util.allWords(copy.get(0)));
        // the paragraph with order 0 is written first
        assertEquals("meow.", copy.get(0).getSections().get(0).getPhrases().get(0).getSurfaceText());
        assertTrue(copy.get(1).getSections().isEmpty());
        assertEquals("fr", copy.get(1).getLanguageCode());
    }

    private static void assertWordsMatch(List<WordModel> expected, List<WordModel> actual) {
        assertEquals(expected.size(), actual.size());
        for (int i = 0; i < expected.size(); i++) {
            WordModel e = expected.get(i);
            WordModel a = actual.get(i);
            assertEquals(e.getId(), a.getId());
            assertEquals(e.getSurfaceForm(), a.getSurfaceForm());
            assertEquals(e.getGloss(), a.getGloss());
            assertEquals(e.getPos(), a.getPos());
            assertEquals(e.isPunctuation(), a.isPunctuation());
            assertEquals(e.getMorphemes().size(), a.getMorphemes().size());
            for (int j = 0; j < e.getMorphemes().size(); j++) {
                MorphemeModel em = e.getMorphemes().get(j);
                MorphemeModel am = a.getMorphemes().get(j);
                assertEquals(em.getType(), am.getType());
                assertEquals(em.getSurfaceForm(), am.getSurfaceForm());
                assertEquals(em.getCitationForm(), am.getCitationForm());
                assertEquals(em.getGloss(), am.getGloss());
                assertEquals(em.getMsa(), am.getMsa());
            }
        }
    }

    public void testPunctuationWordHasOnlyPunctItem() throws Exception {
        Element root = Util.parseXml(exporter.export(Collections.singletonList(Util.catText()))).getDocumentElement();
        List<Element> words = Util.elements(root, "word");
        assertEquals(2, words.size());

        Element cat = words.get(0);
        assertEquals("cat", Util.item(cat, "txt"));
        assertEquals(1, Util.elements(cat, "morph").size());
        assertEquals("stem", Util.elements(cat, "morph").get(0).getAttribute("type"));

        Element stop = words.get(1);
        List<Element> items = Util.childElements(stop, "item");
        assertEquals(1, items.size());
        assertEquals("punct", items.get(0).getAttribute("type"));
        assertEquals(".", items.get(0).getTextContent());
        assertTrue(Util.elements(stop, "morphemes").isEmpty());
        assertTrue(Util.elements(stop, "morph").isEmpty());
    }

    public void testPunctuationModelIgnoresLateMorphemes() throws Exception {
        TextModel text = Util.catText();
        WordModel stop = text.getSections().get(0).getPhrases().get(0).getWords().get(1);
        stop.setMorphemes(Collections.singletonList(new MorphemeModel("late", MorphemeType.STEM, ".")));
        stop.addMorpheme(new MorphemeModel("later", MorphemeType.STEM, "."));
        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        assertTrue(Util.elements(Util.elements(root, "word").get(1), "morph").isEmpty());
    }

    public void testSiblingsAreSortedByOrderThenId() throws Exception {
        TextModel text = new TextModel("t", "Sorting");
        SectionModel later = new SectionModel("s-b", 1);
        later.addPhrase(new PhraseModel("p-later", "later"));
        SectionModel earlier = new SectionModel("s-a", 0);
        PhraseModel phrase = new PhraseModel("p-earlier", "z y x");
        WordModel z = new WordModel("w-z", "z");
        z.setOrder(2);
        WordModel y = new WordModel("w-y", "y");
        y.setOrder(1);
        WordModel x = new WordModel("w-x", "x");
        x.setOrder(1);
        MorphemeModel m2 = new MorphemeModel("m-2", MorphemeType.SUFFIX, "-2");
        m2.setOrder(1);
        MorphemeModel m1 = new MorphemeModel("m-1", MorphemeType.STEM, "1");
        z.setMorphemes(Arrays.asList(m2, m1));
        phrase.setWords(Arrays.asList(z, y, x));
        earlier.addPhrase(phrase);
        text.setSections(Arrays.asList(later, earlier));

        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        List<Element> paragraphs = Util.elements(root, "paragraph");
        assertEquals("s-a", paragraphs.get(0).getAttribute("guid"));
        assertEquals("s-b", paragraphs.get(1).getAttribute("guid"));
        List<Element> words = Util.elements(paragraphs.get(0), "word");
        // equal order falls back to the ID
        assertEquals("w-x", words.get(0).getAttribute("guid"));
        assertEquals("w-y", words.get(1).getAttribute("guid"));
        assertEquals("w-z", words.get(2).getAttribute("guid"));
        List<Element> morphs = Util.elements(words.get(2), "morph");
        assertEquals("m-1", morphs.get(0).getAttribute("guid"));
        assertEquals("m-2", morphs.get(1).getAttribute("guid"));
    }

    public void testEmptyValuesProduceNoItem() throws Exception {
        TextModel text = Util.catText();
        text.setSource(null);
        text.setComment("");
        WordModel cat = text.getSections().get(0).getPhrases().get(0).getWords().get(0);
        cat.setGloss("");
        cat.setPos(null);
        cat.getMorphemes().get(0).setMsa(null);
        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        assertNull(Util.itemElement(root, "source"));
        assertNull(Util.itemElement(root, "comment"));
        Element word = Util.elements(root, "word").get(0);
        assertNull(Util.itemElement(word, "gls"));
        assertNull(Util.itemElement(word, "pos"));
        Element morph = Util.elements(word, "morph").get(0);
        assertNull(Util.itemElement(morph, "msa"));
        assertEquals("cat", Util.item(morph, "gls"));
    }

    public void testLanguageFallback() throws Exception {
        TextModel text = Util.catText();
        PhraseModel phrase = text.getSections().get(0).getPhrases().get(0);
        phrase.setLanguage("unknown");
        WordModel cat = phrase.getWords().get(0);
        cat.setLanguage(null);
        cat.getMorphemes().get(0).setLanguage("");

        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        Element word = Util.elements(root, "word").get(0);
        assertEquals("xyz", Util.itemElement(word, "txt").getAttribute("lang"));
        assertEquals("en", Util.itemElement(word, "gls").getAttribute("lang"));
        assertEquals("en", Util.itemElement(word, "pos").getAttribute("lang"));
        Element morph = Util.elements(word, "morph").get(0);
        assertEquals("xyz", Util.itemElement(morph, "txt").getAttribute("lang"));
        assertEquals("xyz", Util.itemElement(morph, "cf").getAttribute("lang"));
        assertEquals("en", Util.itemElement(morph, "gls").getAttribute("lang"));
        assertEquals("xyz", Util.itemElement(root, "title").getAttribute("lang"));
    }

    public void testExplicitLanguagesWin() throws Exception {
        TextModel text = Util.catText();
        text.setMetadataLanguage("de");
        text.setAnalysisLanguage("fr");
        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        assertEquals("de", Util.itemElement(root, "title").getAttribute("lang"));
        Element word = Util.elements(root, "word").get(0);
        assertEquals("fr", Util.itemElement(word, "gls").getAttribute("lang"));
        assertEquals("xyz", Util.itemElement(word, "txt").getAttribute("lang"));
    }

    public void testNoLanguageAvailable() throws Exception {
        TextModel text = Util.catText();
        text.setLanguageCode("unknown");
        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        assertFalse(Util.itemElement(root, "title").hasAttribute("lang"));
        Element word = Util.elements(root, "word").get(0);
        assertFalse(Util.itemElement(word, "txt").hasAttribute("lang"));
        assertEquals("en", Util.itemElement(word, "gls").getAttribute("lang"));

        root = Util.parseXml(new FlextextExporter("es").export(Collections.singletonList(text))).getDocumentElement();
        assertEquals("es", Util.itemElement(root, "title").getAttribute("lang"));
        assertEquals("es", Util.itemElement(Util.elements(root, "word").get(0), "gls").getAttribute("lang"));
    }

    public void testMorphTypeOmittedWhenAbsent() throws Exception {
        TextModel text = Util.catText();
        text.getSections().get(0).getPhrases().get(0).getWords().get(0).getMorphemes().get(0).setType(null);
        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        assertFalse(Util.elements(root, "morph").get(0).hasAttribute("type"));
    }

    public void testSectionWordsBecomeOnePhrase() throws Exception {
        TextModel text = new TextModel("t-legacy", "Legacy");
        SectionModel section = new SectionModel("s-legacy", 0);
        WordModel second = new WordModel("w-2", "two");
        second.setOrder(1);
        section.setWords(Arrays.asList(second, new WordModel("w-1", "one")));
        text.addSection(section);

        Element root = Util.parseXml(exporter.export(Collections.singletonList(text))).getDocumentElement();
        List<Element> phrases = Util.elements(root, "phrase");
        assertEquals(1, phrases.size());
        assertEquals(StableIdGenerator.generate("phrase", "s-legacy", "words"), phrases.get(0).getAttribute("guid"));
        List<Element> words = Util.elements(phrases.get(0), "word");
        assertEquals("one", Util.item(words.get(0), "txt"));
        assertEquals("two", Util.item(words.get(1), "txt"));
    }
}
