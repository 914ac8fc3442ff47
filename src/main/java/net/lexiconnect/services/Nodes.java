package net.lexiconnect.services;

import org.neo4j.graphdb.Label;

/**
 * Lists all possible labels we use in the Neo4j database.
 */
public enum Nodes implements Label {
    TEXT,       // is an interlinear text
    SECTION,    // is a paragraph-level part of a text
    PARAGRAPH,  // is a section, in the CONTAINS schema
    PHRASE,     // is a phrase (segment) of a section
    WORD,       // is a word or punctuation mark of a phrase
    MORPHEME,   // is a morpheme of a word
    GLOSS       // is a gloss annotation on a word or morpheme
}
