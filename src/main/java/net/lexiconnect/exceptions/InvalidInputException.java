package net.lexiconnect.exceptions;

/**
 * Thrown when an input file cannot be parsed at all, e.g. because it is not well-formed XML.
 * No partial result accompanies it.
 */
public class InvalidInputException extends Exception {

    private static final long serialVersionUID = 6201945870301327734L;

    private final String fileName;

    public InvalidInputException(String fileName, String message, Throwable cause) {
        super(String.format("Could not parse %s: %s", fileName, message), cause);
        this.fileName = fileName;
    }

    public InvalidInputException(String fileName, String message) {
        this(fileName, message, null);
    }

    public String getFileName() {
        return fileName;
    }
}
