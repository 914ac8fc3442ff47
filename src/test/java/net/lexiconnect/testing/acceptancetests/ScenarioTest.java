package net.lexiconnect.testing.acceptancetests;

import junit.framework.TestCase;
import net.lexiconnect.exporter.FlextextExporter;
import net.lexiconnect.exporter.JsonExporter;
import net.lexiconnect.model.TextModel;
import net.lexiconnect.parser.ElanParser;
import net.lexiconnect.testing.Util;
import org.json.JSONArray;
import org.json.JSONObject;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * End-to-end behaviour from input file (or hand-built model) to exported output,
 * without a database.
 */
public class ScenarioTest extends TestCase {

    public void testMinimalFlexTextRoundTrip() throws Exception {
        List<TextModel> texts = Util.parseFlexText("hello.flextext");
        Element root = Util.parseXml(new FlextextExporter().export(texts)).getDocumentElement();

        Element paragraphs = Util.childElements(root, "paragraphs").get(0);
        Element paragraph = Util.childElements(paragraphs, "paragraph").get(0);
        Element phrases = Util.childElements(paragraph, "phrases").get(0);
        Element phrase = Util.childElements(phrases, "phrase").get(0);
        assertEquals("Hello world", Util.item(phrase, "txt"));

        List<Element> words = Util.childElements(Util.childElements(phrase, "words").get(0), "word");
        assertEquals(2, words.size());
        assertEquals("Hello", Util.item(words.get(0), "txt"));
        assertEquals("world", Util.item(words.get(1), "txt"));
        for (Element word : words) {
            List<Element> morphs = Util.elements(word, "morph");
            assertEquals(1, morphs.size());
            assertEquals("stem", morphs.get(0).getAttribute("type"));
        }
        assertEquals("greeting", Util.item(words.get(0), "gls"));
        assertEquals("earth", Util.item(words.get(1), "gls"));
    }

    public void testElanWithoutUsableTier() throws Exception {
        TextModel text = new ElanParser().parseFile(Util.testFile("notier.eaf"));
        assertEquals("notier.eaf", text.getTitle());
        assertNotNull(text.getSections());
        assertTrue(text.getSections().isEmpty());

        Element root = Util.parseXml(new FlextextExporter().export(Collections.singletonList(text)))
                .getDocumentElement();
        assertTrue(Util.elements(root, "paragraph").isEmpty());
    }

    public void testPunctuationAfterWord() throws Exception {
        Element root = Util.parseXml(new FlextextExporter().export(Collections.singletonList(Util.catText())))
                .getDocumentElement();
        List<Element> words = Util.elements(Util.elements(root, "phrase").get(0), "word");
        assertEquals(2, words.size());
        assertEquals(1, Util.elements(words.get(0), "morphemes").size());

        Element stop = words.get(1);
        assertEquals(1, Util.childElements(stop, "item").size());
        assertEquals(".", Util.item(stop, "punct"));
        assertTrue(Util.elements(stop, "morphemes").isEmpty());
    }

    public void testJsonEnvelope() throws Exception {
        List<TextModel> texts = Arrays.asList(Util.parseFlexText("mixed.flextext").get(0),
                Util.parseFlexText("hello.flextext").get(0));
        JSONObject result = new JSONObject(new String(new JsonExporter().export(texts), StandardCharsets.UTF_8));
        Instant exportedAt = Instant.parse(result.getString("exported_at"));
        assertFalse(exportedAt.isAfter(Instant.now()));
        assertTrue(result.getString("exported_at").endsWith("Z"));

        JSONArray exported = result.getJSONArray("texts");
        assertEquals(2, exported.length());
        for (int i = 0; i < exported.length(); i++) {
            JSONArray sections = exported.getJSONObject(i).getJSONArray("sections");
            for (int j = 1; j < sections.length(); j++) {
                JSONObject prev = sections.getJSONObject(j - 1);
                JSONObject next = sections.getJSONObject(j);
                assertTrue(prev.getInt("order") < next.getInt("order")
                        || (prev.getInt("order") == next.getInt("order")
                            && prev.getString("id").compareTo(next.getString("id")) < 0));
            }
        }
    }

    public void testRepeatedRunsGiveIdenticalOutput() throws Exception {
        byte[] first = new FlextextExporter().export(Util.parseFlexText("mixed.flextext"));
        byte[] second = new FlextextExporter().export(Util.parseFlexText("mixed.flextext"));
        assertTrue(Arrays.equals(first, second));

        ElanParser parser = new ElanParser();
        byte[] elanFirst = new FlextextExporter().export(
                Collections.singletonList(parser.parseFile(Util.testFile("sample.eaf"))));
        byte[] elanSecond = new FlextextExporter().export(
                Collections.singletonList(parser.parseFile(Util.testFile("sample.eaf"))));
        assertTrue(Arrays.equals(elanFirst, elanSecond));
    }
}
