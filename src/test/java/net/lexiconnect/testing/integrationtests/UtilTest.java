package net.lexiconnect.testing.integrationtests;

import junit.framework.TestCase;
import net.lexiconnect.ApplicationConfig;
import net.lexiconnect.Util;
import net.lexiconnect.model.ItemType;
import net.lexiconnect.model.WordModel;
import net.lexiconnect.services.GraphSchema;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class UtilTest extends TestCase {

    public void testFirstValidLanguage() {
        assertEquals("xyz", Util.firstValidLanguage(null, " ", "unknown", " xyz ", "en"));
        assertEquals("en", Util.firstValidLanguage("UNKNOWN", "en"));
        assertNull(Util.firstValidLanguage(null, "", "unknown"));
        assertNull(Util.firstValidLanguage());
    }

    public void testFlattenMsa() {
        assertEquals("", Util.flattenMsa(null));
        assertEquals("n", Util.flattenMsa("n"));
        assertEquals("n, sg", Util.flattenMsa(new String[]{"n", "sg"}));
        assertEquals("v, 3", Util.flattenMsa(Arrays.asList("v", "", null, 3)));
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("num", "pl");
        features.put("cat", "n");
        assertEquals("cat=n; num=pl", Util.flattenMsa(features));
    }

    public void testSortedByOrder() {
        WordModel b = new WordModel("b", "b");
        WordModel a = new WordModel("a", "a");
        WordModel first = new WordModel("z", "z");
        first.setOrder(-1);
        List<WordModel> sorted = Util.sortedByOrder(Arrays.asList(b, a, first));
        assertEquals("z", sorted.get(0).getId());
        assertEquals("a", sorted.get(1).getId());
        assertEquals("b", sorted.get(2).getId());
        assertTrue(Util.sortedByOrder(null).isEmpty());
    }

    public void testTokenize() {
        assertEquals(Arrays.asList("the", "dog", "sleeps."), Util.tokenize("  the dog\tsleeps.\n"));
        assertTrue(Util.tokenize("   ").isEmpty());
        assertTrue(Util.tokenize(null).isEmpty());
    }

    public void testItemTypes() {
        assertEquals(ItemType.GLS, ItemType.fromCode(" gls "));
        assertEquals(ItemType.PUNCT, ItemType.fromCode("punct"));
        // homonym numbers and other item types are ignored
        assertNull(ItemType.fromCode("hn"));
        assertNull(ItemType.fromCode("variantTypes"));
        assertNull(ItemType.fromCode(null));
    }

    public void testConfiguration() {
        Map<String, String> env = new HashMap<>();
        ApplicationConfig defaults = new ApplicationConfig(env);
        assertEquals("/var/lib/lexiconnect", defaults.getDbPath());
        assertEquals(GraphSchema.TYPED, defaults.getSchema());

        env.put(ApplicationConfig.HOME_ENV, " /tmp/lexiconnect ");
        env.put(ApplicationConfig.SCHEMA_ENV, "contains");
        ApplicationConfig configured = new ApplicationConfig(env);
        assertEquals("/tmp/lexiconnect", configured.getDbPath());
        assertEquals(GraphSchema.CONTAINS, configured.getSchema());
    }

    public void testUnknownSchemaName() {
        try {
            GraphSchema.fromName("flat");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("FLAT"));
        }
    }
}
