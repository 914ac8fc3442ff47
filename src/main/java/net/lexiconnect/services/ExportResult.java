package net.lexiconnect.services;

/**
 * The output of an export, with what a caller needs to deliver it as a file.
 */
public class ExportResult {
    private final byte[] content;
    private final String mediaType;
    private final String fileName;

    public ExportResult(byte[] content, String mediaType, String fileName) {
        this.content = content;
        this.mediaType = mediaType;
        this.fileName = fileName;
    }

    public byte[] getContent() {
        return content;
    }

    public String getMediaType() {
        return mediaType;
    }

    public String getFileName() {
        return fileName;
    }
}
