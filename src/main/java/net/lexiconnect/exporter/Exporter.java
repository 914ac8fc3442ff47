package net.lexiconnect.exporter;

import net.lexiconnect.exceptions.ExportException;
import net.lexiconnect.model.TextModel;

import java.util.List;

/**
 * Turns a list of texts into the bytes of one output file.
 */
public interface Exporter {

    /**
     * @return the short format name, as callers request it
     */
    String getFileType();

    String getMediaType();

    String getFileExtension();

    /**
     * Serializes the given texts. Children are written in (order, id) sequence no matter
     * how they arrive.
     *
     * @param texts - the texts to write
     * @return the complete file contents
     * @throws ExportException if the output could not be produced; no partial output is returned
     */
    byte[] export(List<TextModel> texts) throws ExportException;
}
