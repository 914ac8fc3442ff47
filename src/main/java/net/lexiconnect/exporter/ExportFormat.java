package net.lexiconnect.exporter;

import net.lexiconnect.exceptions.ExporterNotFoundException;

import java.util.Locale;

/**
 * The registered export formats. Each format hands out a fresh exporter per use.
 */
public enum ExportFormat {
    FLEXTEXT("flextext", "application/xml", "flextext") {
        @Override
        public Exporter newExporter() {
            return new FlextextExporter();
        }
    },
    JSON("json", "application/json", "json") {
        @Override
        public Exporter newExporter() {
            return new JsonExporter();
        }
    };

    private final String fileType;
    private final String mediaType;
    private final String fileExtension;

    ExportFormat(String fileType, String mediaType, String fileExtension) {
        this.fileType = fileType;
        this.mediaType = mediaType;
        this.fileExtension = fileExtension;
    }

    public abstract Exporter newExporter();

    public String getFileType() {
        return fileType;
    }

    public String getMediaType() {
        return mediaType;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    /**
     * Looks up a format by its name, ignoring case and surrounding whitespace.
     *
     * @param name - the requested format, e.g. "flextext"
     * @return the matching format
     * @throws ExporterNotFoundException if no format has that name
     */
    public static ExportFormat forName(String name) throws ExporterNotFoundException {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (ExportFormat f : values())
                if (f.fileType.equals(wanted))
                    return f;
        }
        throw new ExporterNotFoundException(name);
    }
}
