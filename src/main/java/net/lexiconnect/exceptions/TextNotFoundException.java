package net.lexiconnect.exceptions;

/**
 * Thrown when no stored text (or dataset) matches the requested ID.
 */
public class TextNotFoundException extends Exception {

    private static final long serialVersionUID = 3398020002854193125L;

    private final String textId;

    public TextNotFoundException(String textId) {
        super(String.format("No text found for id '%s'", textId));
        this.textId = textId;
    }

    public String getTextId() {
        return textId;
    }
}
