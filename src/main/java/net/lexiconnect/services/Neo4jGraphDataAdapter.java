package net.lexiconnect.services;

import net.lexiconnect.Util;
import net.lexiconnect.exceptions.TextNotFoundException;
import net.lexiconnect.model.*;
import org.neo4j.graphdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static net.lexiconnect.Util.UNKNOWN_LANGUAGE;
import static net.lexiconnect.Util.firstValidLanguage;

/**
 * Keeps texts in an embedded Neo4j database, in either of the two graph layouts. Each
 * call runs in its own transaction.
 */
public class Neo4jGraphDataAdapter implements GraphDataAdapter {
    private static final Logger logger = LoggerFactory.getLogger(Neo4jGraphDataAdapter.class);

    // Part-of-speech values that older imports used to mark punctuation
    private static final Set<String> PUNCTUATION_TAGS = Set.of("PUNCT", "PUNCTUATION", "SYM");

    private final GraphDatabaseService db;
    private final GraphSchema schema;

    public Neo4jGraphDataAdapter(GraphDatabaseService db, GraphSchema schema) {
        this.db = db;
        this.schema = schema;
    }

    public GraphSchema getSchema() {
        return schema;
    }

    /*
     * Reading
     */

    @Override
    public TextModel fetch(String textId) throws TextNotFoundException {
        try (Transaction tx = db.beginTx()) {
            Node textNode = tx.findNode(Nodes.TEXT, "id", textId);
            if (textNode == null)
                throw new TextNotFoundException(textId);
            return readText(textNode);
        }
    }

    @Override
    public List<TextModel> fetchAll() {
        List<TextModel> result = new ArrayList<>();
        try (Transaction tx = db.beginTx()) {
            tx.findNodes(Nodes.TEXT).forEachRemaining(n -> result.add(readText(n)));
        }
        result.sort(Comparator.comparing(TextModel::getId));
        return result;
    }

    @Override
    public List<TextModel> fetchDataset(String datasetId) {
        List<TextModel> result = new ArrayList<>();
        if (datasetId == null)
            return result;
        try (Transaction tx = db.beginTx()) {
            tx.findNodes(Nodes.TEXT, "dataset", datasetId).forEachRemaining(n -> result.add(readText(n)));
        }
        result.sort(Comparator.comparing(TextModel::getId));
        return result;
    }

    private TextModel readText(Node node) {
        TextModel text = new TextModel();
        text.setId(stringProperty(node, "id"));
        text.setTitle(stringProperty(node, "title"));
        text.setSource(stringProperty(node, "source"));
        text.setComment(stringProperty(node, "comment"));
        String language = firstValidLanguage(stringProperty(node, "language_code"));
        text.setLanguageCode(language == null ? UNKNOWN_LANGUAGE : language);
        text.setMetadataLanguage(stringProperty(node, "metadata_language"));
        text.setAnalysisLanguage(stringProperty(node, "analysis_language"));

        int i = 0;
        List<SectionModel> sections = new ArrayList<>();
        for (Relationship r : node.getRelationships(Direction.OUTGOING, schema.textToSection())) {
            Node child = r.getEndNode();
            if (child.hasLabel(schema.sectionLabel()))
                sections.add(readSection(child, r, i++, text.getLanguageCode()));
        }
        text.setSections(Util.sortedByOrder(sections));
        return text;
    }

    private SectionModel readSection(Node node, Relationship link, int index, String textLanguage) {
        SectionModel section = new SectionModel();
        section.setId(stringProperty(node, "id"));
        section.setOrder(orderOf(node, link, index));

        List<PhraseModel> phrases = new ArrayList<>();
        List<WordModel> words = new ArrayList<>();
        int i = 0;
        for (Relationship r : node.getRelationships(Direction.OUTGOING, schema.sectionToPhrase())) {
            Node child = r.getEndNode();
            if (child.hasLabel(Nodes.PHRASE))
                phrases.add(readPhrase(child, r, i++, textLanguage));
        }
        i = 0;
        for (Relationship r : node.getRelationships(Direction.OUTGOING, schema.sectionToWord())) {
            Node child = r.getEndNode();
            if (child.hasLabel(Nodes.WORD))
                words.add(readWord(child, r, i++, textLanguage));
        }
        section.setPhrases(Util.sortedByOrder(phrases));
        section.setWords(Util.sortedByOrder(words));
        return section;
    }

    private PhraseModel readPhrase(Node node, Relationship link, int index, String textLanguage) {
        PhraseModel phrase = new PhraseModel();
        phrase.setId(stringProperty(node, "id"));
        phrase.setOrder(orderOf(node, link, index));
        phrase.setSegnum(stringProperty(node, "segnum"));
        phrase.setSurfaceText(stringProperty(node, "surface_text"));
        phrase.setLanguage(inherit(stringProperty(node, "language"), textLanguage));

        List<WordModel> words = new ArrayList<>();
        int i = 0;
        for (Relationship r : node.getRelationships(Direction.OUTGOING, schema.phraseToWord())) {
            Node child = r.getEndNode();
            if (child.hasLabel(Nodes.WORD))
                words.add(readWord(child, r, i++, phrase.getLanguage()));
        }
        phrase.setWords(Util.sortedByOrder(words));
        return phrase;
    }

    private WordModel readWord(Node node, Relationship link, int index, String phraseLanguage) {
        WordModel word = new WordModel();
        word.setId(stringProperty(node, "id"));
        word.setOrder(orderOf(node, link, index));
        word.setSurfaceForm(stringProperty(node, "surface_form"));
        word.setGloss(stringProperty(node, "gloss"));
        word.setLanguage(inherit(stringProperty(node, "language"), phraseLanguage));
        List<String> pos = listProperty(node, "pos");

        boolean punctuation = Boolean.TRUE.equals(node.getProperty("is_punctuation", false))
                || pos.stream().anyMatch(p -> PUNCTUATION_TAGS.contains(p.toUpperCase(Locale.ROOT)));
        if (punctuation) {
            word.setPunctuation(true);
            return word;
        }
        word.setPos(pos);

        List<MorphemeModel> morphemes = new ArrayList<>();
        int i = 0;
        for (Relationship r : node.getRelationships(Direction.OUTGOING, schema.wordToMorpheme())) {
            Node child = r.getEndNode();
            if (child.hasLabel(Nodes.MORPHEME))
                morphemes.add(readMorpheme(child, r, i++, word.getLanguage()));
        }
        word.setMorphemes(Util.sortedByOrder(morphemes));
        return word;
    }

    private MorphemeModel readMorpheme(Node node, Relationship link, int index, String wordLanguage) {
        MorphemeModel morpheme = new MorphemeModel();
        morpheme.setId(stringProperty(node, "id"));
        morpheme.setOriginalId(stringProperty(node, "original_guid"));
        morpheme.setOrder(orderOf(node, link, index));
        morpheme.setType(MorphemeType.fromStoredValue(stringProperty(node, "type")));
        morpheme.setSurfaceForm(stringProperty(node, "surface_form"));
        morpheme.setCitationForm(stringProperty(node, "citation_form"));
        morpheme.setGloss(stringProperty(node, "gloss"));
        Object msa = node.getProperty("msa", null);
        morpheme.setMsa(msa == null ? null : Util.flattenMsa(msa));
        morpheme.setLanguage(inherit(stringProperty(node, "language"), wordLanguage));
        return morpheme;
    }

    // Relationship Order (typed schema) wins over the node's own order; the read index is the last resort
    private int orderOf(Node node, Relationship link, int index) {
        if (schema.orderOnRelationship()) {
            Object relOrder = link.getProperty(GraphSchema.ORDER_PROPERTY, null);
            if (relOrder instanceof Number)
                return ((Number) relOrder).intValue();
        }
        Object order = node.getProperty("order", null);
        return order instanceof Number ? ((Number) order).intValue() : index;
    }

    private static String inherit(String own, String parent) {
        String chosen = firstValidLanguage(own, parent);
        return chosen == null ? parent : chosen;
    }

    private static String stringProperty(Entity e, String key) {
        Object value = e.getProperty(key, null);
        return value == null ? null : value.toString();
    }

    private static List<String> listProperty(Entity e, String key) {
        Object value = e.getProperty(key, null);
        List<String> result = new ArrayList<>();
        if (value instanceof String[]) {
            for (String s : (String[]) value)
                if (s != null && !s.isEmpty())
                    result.add(s);
        } else if (value != null && !value.toString().isEmpty()) {
            result.add(value.toString());
        }
        return result;
    }

    /*
     * Writing
     */

    @Override
    public String store(TextModel text, String datasetId) {
        try (Transaction tx = db.beginTx()) {
            storeText(tx, text, datasetId);
            tx.commit();
        }
        return text.getId();
    }

    @Override
    public List<String> replaceDataset(String datasetId, List<TextModel> texts) {
        List<String> stored = new ArrayList<>();
        try (Transaction tx = db.beginTx()) {
            List<Node> previous = new ArrayList<>();
            tx.findNodes(Nodes.TEXT, "dataset", datasetId).forEachRemaining(previous::add);
            for (Node n : previous)
                deleteTextTree(n);
            if (!previous.isEmpty())
                logger.info("Removed {} text(s) previously stored in dataset {}", previous.size(), datasetId);
            for (TextModel text : texts) {
                storeText(tx, text, datasetId);
                stored.add(text.getId());
            }
            tx.commit();
        }
        return stored;
    }

    private void storeText(Transaction tx, TextModel text, String datasetId) {
        Node existing = tx.findNode(Nodes.TEXT, "id", text.getId());
        if (existing != null) {
            logger.info("Replacing stored text {}", text.getId());
            deleteTextTree(existing);
        }

        Map<String, Node> annotatable = new HashMap<>();
        Node textNode = tx.createNode(Nodes.TEXT);
        setProperty(textNode, "id", text.getId());
        setProperty(textNode, "title", text.getTitle());
        setProperty(textNode, "source", text.getSource());
        setProperty(textNode, "comment", text.getComment());
        setProperty(textNode, "language_code", text.getLanguageCode());
        setProperty(textNode, "metadata_language", text.getMetadataLanguage());
        setProperty(textNode, "analysis_language", text.getAnalysisLanguage());
        setProperty(textNode, "dataset", datasetId);

        for (SectionModel section : Util.sortedByOrder(text.getSections())) {
            Node sectionNode = tx.createNode(schema.sectionLabel());
            setProperty(sectionNode, "id", section.getId());
            sectionNode.setProperty("order", section.getOrder());
            textNode.createRelationshipTo(sectionNode, schema.textToSection());

            for (PhraseModel phrase : Util.sortedByOrder(section.getPhrases())) {
                Node phraseNode = tx.createNode(Nodes.PHRASE);
                setProperty(phraseNode, "id", phrase.getId());
                phraseNode.setProperty("order", phrase.getOrder());
                setProperty(phraseNode, "segnum", phrase.getSegnum());
                setProperty(phraseNode, "surface_text", phrase.getSurfaceText());
                setProperty(phraseNode, "language", phrase.getLanguage());
                sectionNode.createRelationshipTo(phraseNode, schema.sectionToPhrase());
                annotatable.put(phrase.getId(), phraseNode);

                for (WordModel word : Util.sortedByOrder(phrase.getWords()))
                    storeWord(tx, phraseNode, schema.phraseToWord(), word, annotatable);
            }
            for (WordModel word : Util.sortedByOrder(section.getWords()))
                storeWord(tx, sectionNode, schema.sectionToWord(), word, annotatable);
        }

        int glosses = 0;
        for (GlossModel gloss : GlossModel.deriveFrom(text, text.getAnalysisLanguage())) {
            Node target = annotatable.get(gloss.getTargetId());
            if (target == null) continue;
            Node glossNode = tx.createNode(Nodes.GLOSS);
            setProperty(glossNode, "id", gloss.getId());
            setProperty(glossNode, "annotation", gloss.getAnnotation());
            setProperty(glossNode, "gloss_type", gloss.getTarget().toString());
            setProperty(glossNode, "language", gloss.getLanguage());
            glossNode.createRelationshipTo(target, ERelations.ANNOTATES);
            glosses++;
        }
        logger.debug("Stored text {} with {} gloss(es)", text.getId(), glosses);
    }

    private void storeWord(Transaction tx, Node parent, RelationshipType relType, WordModel word,
                           Map<String, Node> annotatable) {
        Node wordNode = tx.createNode(Nodes.WORD);
        setProperty(wordNode, "id", word.getId());
        wordNode.setProperty("order", word.getOrder());
        setProperty(wordNode, "surface_form", word.getSurfaceForm());
        setProperty(wordNode, "gloss", word.getGloss());
        if (word.getPos() != null && !word.getPos().isEmpty())
            wordNode.setProperty("pos", word.getPos().toArray(new String[0]));
        setProperty(wordNode, "language", word.getLanguage());
        wordNode.setProperty("is_punctuation", word.isPunctuation());
        Relationship link = parent.createRelationshipTo(wordNode, relType);
        if (schema.orderOnRelationship() && relType == schema.phraseToWord())
            link.setProperty(GraphSchema.ORDER_PROPERTY, word.getOrder());
        annotatable.put(word.getId(), wordNode);

        if (word.isPunctuation())
            return;
        for (MorphemeModel morpheme : Util.sortedByOrder(word.getMorphemes())) {
            Node morphNode = tx.createNode(Nodes.MORPHEME);
            setProperty(morphNode, "id", morpheme.getId());
            setProperty(morphNode, "original_guid", morpheme.getOriginalId());
            morphNode.setProperty("order", morpheme.getOrder());
            if (morpheme.getType() != null)
                morphNode.setProperty("type", morpheme.getType().getValue());
            setProperty(morphNode, "surface_form", morpheme.getSurfaceForm());
            setProperty(morphNode, "citation_form", morpheme.getCitationForm());
            setProperty(morphNode, "gloss", morpheme.getGloss());
            setProperty(morphNode, "msa", morpheme.getMsa());
            setProperty(morphNode, "language", morpheme.getLanguage());
            Relationship morphLink = wordNode.createRelationshipTo(morphNode, schema.wordToMorpheme());
            if (schema.orderOnRelationship())
                morphLink.setProperty(GraphSchema.ORDER_PROPERTY, morpheme.getOrder());
            annotatable.put(morpheme.getId(), morphNode);
        }
    }

    // Neo4j stores no nulls; an absent property reads back as null
    private static void setProperty(Node node, String key, String value) {
        if (value != null)
            node.setProperty(key, value);
    }

    /*
     * Deletion
     */

    @Override
    public boolean delete(String textId) {
        try (Transaction tx = db.beginTx()) {
            Node textNode = tx.findNode(Nodes.TEXT, "id", textId);
            if (textNode == null)
                return false;
            deleteTextTree(textNode);
            tx.commit();
        }
        logger.info("Deleted text {}", textId);
        return true;
    }

    // Removes the text node, everything it contains, and the glosses on its contents
    private void deleteTextTree(Node textNode) {
        Set<Node> doomed = new LinkedHashSet<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(textNode);
        RelationshipType[] containment = {schema.textToSection(), schema.sectionToPhrase(),
                schema.phraseToWord(), schema.wordToMorpheme(), schema.sectionToWord()};
        while (!pending.isEmpty()) {
            Node n = pending.pop();
            if (!doomed.add(n)) continue;
            for (Relationship r : n.getRelationships(Direction.OUTGOING, containment))
                pending.push(r.getEndNode());
            for (Relationship r : n.getRelationships(Direction.INCOMING, ERelations.ANNOTATES))
                pending.push(r.getStartNode());
        }

        Set<Relationship> links = new HashSet<>();
        for (Node n : doomed)
            n.getRelationships().forEach(links::add);
        links.forEach(Relationship::delete);
        doomed.forEach(Node::delete);
    }
}
