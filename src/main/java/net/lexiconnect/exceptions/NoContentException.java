package net.lexiconnect.exceptions;

/**
 * Thrown when an export request resolves, but there are no texts to export.
 */
public class NoContentException extends Exception {

    private static final long serialVersionUID = 1455382113427094511L;

    public NoContentException(String message) {
        super(message);
    }
}
