package net.lexiconnect.services;

import net.lexiconnect.exceptions.InvalidInputException;
import net.lexiconnect.model.TextModel;
import net.lexiconnect.parser.ElanParser;
import net.lexiconnect.parser.FlexTextParser;
import net.lexiconnect.parser.StableIdGenerator;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parses uploaded files and stores the resulting texts. The parser is chosen by file
 * extension. All texts of one file share a dataset ID derived from the file name.
 * Importing a file of the same name again removes every text that the earlier import
 * stored, including texts whose IDs have since changed, before the new texts are stored.
 */
public class IngestService {
    private static final Logger logger = LoggerFactory.getLogger(IngestService.class);

    private final GraphDataAdapter adapter;

    public IngestService(GraphDataAdapter adapter) {
        this.adapter = adapter;
    }

    public IngestResult ingest(File file) throws InvalidInputException {
        try (InputStream in = FileUtils.openInputStream(file)) {
            return ingest(in, file.getName());
        } catch (IOException e) {
            throw new InvalidInputException(file.getName(), e.getMessage(), e);
        }
    }

    public IngestResult ingest(InputStream in, String fileName) throws InvalidInputException {
        List<TextModel> texts = parse(in, fileName);
        String datasetId = datasetIdFor(fileName);
        List<String> stored = adapter.replaceDataset(datasetId, texts);
        logger.info("Imported {} text(s) from {} as dataset {}", stored.size(), fileName, datasetId);
        return new IngestResult(datasetId, fileName, stored, StatisticsService.compute(texts));
    }

    /**
     * Parses a file without storing it.
     *
     * @param in - the file contents
     * @param fileName - the file name; its extension selects the parser
     * @return the texts the file contains
     * @throws InvalidInputException if the file type is not supported or the file is malformed
     */
    public static List<TextModel> parse(InputStream in, String fileName) throws InvalidInputException {
        String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        switch (extension) {
            case "flextext":
                return new FlexTextParser().parse(in, fileName);
            case "eaf":
                return Collections.singletonList(new ElanParser().parse(in, fileName));
            default:
                throw new InvalidInputException(fileName,
                        String.format("unsupported file type '%s'; expected .flextext or .eaf", extension));
        }
    }

    public static String datasetIdFor(String fileName) {
        return StableIdGenerator.generate("dataset", FilenameUtils.getName(fileName));
    }
}
