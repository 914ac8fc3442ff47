package net.lexiconnect.services;

import net.lexiconnect.exceptions.TextNotFoundException;
import net.lexiconnect.model.TextModel;

import java.util.List;

/**
 * The boundary between the stored graph and the text model. Implementations assemble
 * complete, ordered text trees; callers never see how the store lays them out.
 */
public interface GraphDataAdapter {

    /**
     * Reads one text with everything below it. Children are sorted by (order, id) and
     * missing languages are filled in from the parent level.
     *
     * @param textId - the ID of the text
     * @return the text; a text with no sections comes back with an empty section list
     * @throws TextNotFoundException if no text has that ID
     */
    TextModel fetch(String textId) throws TextNotFoundException;

    List<TextModel> fetchAll();

    /**
     * @return the texts that were imported together under the given dataset ID, possibly none
     */
    List<TextModel> fetchDataset(String datasetId);

    /**
     * Stores a text, replacing any text already stored under the same ID.
     *
     * @return the ID of the stored text
     */
    default String store(TextModel text) {
        return store(text, null);
    }

    String store(TextModel text, String datasetId);

    /**
     * Removes every text stored under the dataset ID, then stores the given texts under it.
     * Both happen in one transaction, so a text that is no longer in the dataset does not
     * survive.
     *
     * @return the IDs of the stored texts, in input order
     */
    List<String> replaceDataset(String datasetId, List<TextModel> texts);

    /**
     * @return true if a text was found and removed
     */
    boolean delete(String textId);
}
