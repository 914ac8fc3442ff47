package net.lexiconnect.exceptions;

/**
 * Thrown when serialization fails for an unexpected reason. The message is meant for
 * end users; the cause carries the details.
 */
public class ExportException extends Exception {

    private static final long serialVersionUID = -7112838406417958291L;

    public ExportException(String format, Throwable cause) {
        super(String.format("Unable to generate %s export output", format), cause);
    }
}
