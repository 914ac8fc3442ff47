package net.lexiconnect.services;

import org.neo4j.graphdb.RelationshipType;

/**
 * Lists all possible relationship types we use in the Neo4j database.
 */
public enum ERelations implements RelationshipType {
    // Typed schema
    SECTION_PART_OF_TEXT,   // links a text to its sections
    PHRASE_IN_SECTION,      // links a section to its phrases
    PHRASE_COMPOSED_OF,     // links a phrase to its words, with an Order property
    WORD_MADE_OF,           // links a word to its morphemes, with an Order property
    SECTION_HAS_WORD,       // links a section to words that belong to no phrase

    // Legacy schema
    CONTAINS,               // every parent-child link

    // Both schemas
    ANNOTATES               // from a gloss to the word or morpheme it glosses
}
