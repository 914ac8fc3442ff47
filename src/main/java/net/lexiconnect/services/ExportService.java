package net.lexiconnect.services;

import net.lexiconnect.exceptions.ExportException;
import net.lexiconnect.exceptions.ExporterNotFoundException;
import net.lexiconnect.exceptions.NoContentException;
import net.lexiconnect.exceptions.TextNotFoundException;
import net.lexiconnect.exporter.ExportFormat;
import net.lexiconnect.model.TextModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Exports stored texts. The identifier may name a single text, a dataset (all texts
 * imported from one file), or everything ("all" or "*").
 */
public class ExportService {
    private static final Logger logger = LoggerFactory.getLogger(ExportService.class);

    private final GraphDataAdapter adapter;

    public ExportService(GraphDataAdapter adapter) {
        this.adapter = adapter;
    }

    /**
     * @param datasetId - a text ID, a dataset ID, or "all" / "*"
     * @param format - the name of the export format
     * @return the exported file
     * @throws ExporterNotFoundException if the format is not known
     * @throws TextNotFoundException if nothing is stored under the identifier
     * @throws NoContentException if everything was requested but nothing is stored
     * @throws ExportException if the output could not be produced
     */
    public ExportResult export(String datasetId, String format)
            throws ExporterNotFoundException, TextNotFoundException, NoContentException, ExportException {
        ExportFormat exportFormat = ExportFormat.forName(format);
        List<TextModel> texts = resolve(datasetId);
        if (texts.isEmpty())
            throw new NoContentException(String.format("No texts found for '%s'", datasetId));

        byte[] content = exportFormat.newExporter().export(texts);
        logger.info("Exported {} text(s) for {} as {}", texts.size(), datasetId, exportFormat.getFileType());
        return new ExportResult(content, exportFormat.getMediaType(),
                fileNameFor(datasetId, texts) + "." + exportFormat.getFileExtension());
    }

    private List<TextModel> resolve(String datasetId) throws TextNotFoundException {
        if (datasetId == null)
            throw new TextNotFoundException(null);
        if ("all".equalsIgnoreCase(datasetId) || "*".equals(datasetId))
            return adapter.fetchAll();
        try {
            return Collections.singletonList(adapter.fetch(datasetId));
        } catch (TextNotFoundException e) {
            List<TextModel> dataset = adapter.fetchDataset(datasetId);
            if (dataset.isEmpty())
                throw e;
            return dataset;
        }
    }

    private static String fileNameFor(String datasetId, List<TextModel> texts) {
        String base = datasetId;
        if (texts.size() == 1 && texts.get(0).getTitle() != null && !texts.get(0).getTitle().trim().isEmpty())
            base = texts.get(0).getTitle().trim();
        if ("*".equals(base) || "all".equalsIgnoreCase(base))
            base = "all";
        return base.replaceAll("[^\\p{L}\\p{N}._-]+", "_");
    }
}
