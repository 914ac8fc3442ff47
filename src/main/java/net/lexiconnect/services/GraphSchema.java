package net.lexiconnect.services;

import org.neo4j.graphdb.Label;
import org.neo4j.graphdb.RelationshipType;

import java.util.Locale;

/**
 * The two layouts in which texts are kept in the graph. TYPED names each level of the
 * hierarchy with its own relationship type and keeps word and morpheme order on the
 * relationship; CONTAINS uses one relationship type throughout and labels sections
 * as paragraphs.
 */
public enum GraphSchema {
    TYPED(Nodes.SECTION, ERelations.SECTION_PART_OF_TEXT, ERelations.PHRASE_IN_SECTION,
            ERelations.PHRASE_COMPOSED_OF, ERelations.WORD_MADE_OF, ERelations.SECTION_HAS_WORD, true),
    CONTAINS(Nodes.PARAGRAPH, ERelations.CONTAINS, ERelations.CONTAINS,
            ERelations.CONTAINS, ERelations.CONTAINS, ERelations.CONTAINS, false);

    public static final String ORDER_PROPERTY = "Order";

    private final Label sectionLabel;
    private final RelationshipType textToSection;
    private final RelationshipType sectionToPhrase;
    private final RelationshipType phraseToWord;
    private final RelationshipType wordToMorpheme;
    private final RelationshipType sectionToWord;
    private final boolean orderOnRelationship;

    GraphSchema(Label sectionLabel, RelationshipType textToSection, RelationshipType sectionToPhrase,
                RelationshipType phraseToWord, RelationshipType wordToMorpheme,
                RelationshipType sectionToWord, boolean orderOnRelationship) {
        this.sectionLabel = sectionLabel;
        this.textToSection = textToSection;
        this.sectionToPhrase = sectionToPhrase;
        this.phraseToWord = phraseToWord;
        this.wordToMorpheme = wordToMorpheme;
        this.sectionToWord = sectionToWord;
        this.orderOnRelationship = orderOnRelationship;
    }

    public Label sectionLabel() {
        return sectionLabel;
    }

    public RelationshipType textToSection() {
        return textToSection;
    }

    public RelationshipType sectionToPhrase() {
        return sectionToPhrase;
    }

    public RelationshipType phraseToWord() {
        return phraseToWord;
    }

    public RelationshipType wordToMorpheme() {
        return wordToMorpheme;
    }

    public RelationshipType sectionToWord() {
        return sectionToWord;
    }

    /**
     * @return true if word and morpheme order is also recorded on the linking relationship
     */
    public boolean orderOnRelationship() {
        return orderOnRelationship;
    }

    /**
     * @param name - "typed" or "contains", in any case; null or blank gives TYPED
     */
    public static GraphSchema fromName(String name) {
        if (name == null || name.trim().isEmpty())
            return TYPED;
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
