package net.lexiconnect.exceptions;

/**
 * Thrown when an export is requested in a format that has no exporter.
 */
public class ExporterNotFoundException extends Exception {

    private static final long serialVersionUID = -2384010523186621509L;

    private final String format;

    public ExporterNotFoundException(String format) {
        super(format == null || format.trim().isEmpty()
                ? "An export format must be given"
                : String.format("Unsupported export format '%s'", format));
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
