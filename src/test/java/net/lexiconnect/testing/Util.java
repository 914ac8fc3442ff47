package net.lexiconnect.testing;

import net.lexiconnect.exceptions.InvalidInputException;
import net.lexiconnect.model.*;
import net.lexiconnect.parser.FlexTextParser;
import net.lexiconnect.services.GraphDatabaseServiceProvider;
import org.apache.commons.io.FileUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the tests.
 */
public class Util {

    public static final String TEST_FILES = "src/TestFiles/";

    public static List<TextModel> parseFlexText(String fileName) throws InvalidInputException {
        return new FlexTextParser().parseFile(new File(TEST_FILES + fileName));
    }

    public static File testFile(String fileName) {
        return new File(TEST_FILES + fileName);
    }

    // A fresh database in a temporary directory; remove it with tearDownTestDB
    public static File createTestDBHome() throws IOException {
        return Files.createTempDirectory("lexiconnect-test").toFile();
    }

    public static void tearDownTestDB(GraphDatabaseServiceProvider provider, File home) throws IOException {
        if (provider != null)
            provider.close();
        if (home != null)
            FileUtils.deleteDirectory(home);
    }

    public static Document parseXml(byte[] xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml));
    }

    public static List<Element> elements(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        NodeList found = parent.getElementsByTagName(name);
        for (int i = 0; i < found.getLength(); i++)
            result.add((Element) found.item(i));
        return result;
    }

    public static List<Element> childElements(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (org.w3c.dom.Node n = parent.getFirstChild(); n != null; n = n.getNextSibling())
            if (n instanceof Element && n.getNodeName().equals(name))
                result.add((Element) n);
        return result;
    }

    // The text of the item of the given type directly under the element, or null
    public static String item(Element parent, String type) {
        for (Element i : childElements(parent, "item"))
            if (type.equals(i.getAttribute("type")))
                return i.getTextContent();
        return null;
    }

    public static Element itemElement(Element parent, String type) {
        for (Element i : childElements(parent, "item"))
            if (type.equals(i.getAttribute("type")))
                return i;
        return null;
    }

    public static List<WordModel> allWords(TextModel text) {
        List<WordModel> words = new ArrayList<>();
        for (SectionModel s : net.lexiconnect.Util.sortedByOrder(text.getSections())) {
            for (PhraseModel p : net.lexiconnect.Util.sortedByOrder(s.getPhrases()))
                words.addAll(net.lexiconnect.Util.sortedByOrder(p.getWords()));
            words.addAll(net.lexiconnect.Util.sortedByOrder(s.getWords()));
        }
        return words;
    }

    // A small text built in code: one section, one phrase "cat ." with a punctuation mark
    public static TextModel catText() {
        TextModel text = new TextModel("text-cat", "Cat");
        text.setLanguageCode("xyz");
        SectionModel section = new SectionModel("section-cat", 0);
        PhraseModel phrase = new PhraseModel("phrase-cat", "cat .");
        phrase.setSegnum("1");
        WordModel cat = new WordModel("word-cat", "cat");
        cat.setGloss("cat");
        cat.setPosValue("n");
        MorphemeModel stem = new MorphemeModel("morph-cat", MorphemeType.STEM, "cat");
        stem.setGloss("cat");
        stem.setCitationForm("cat");
        cat.addMorpheme(stem);
        WordModel stop = new WordModel("word-stop", ".");
        stop.setOrder(1);
        stop.addMorpheme(new MorphemeModel("morph-stop", MorphemeType.STEM, "."));
        stop.setPunctuation(true);
        phrase.addWord(cat);
        phrase.addWord(stop);
        section.addPhrase(phrase);
        text.addSection(section);
        return text;
    }
}
