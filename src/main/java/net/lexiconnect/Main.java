package net.lexiconnect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.lexiconnect.exceptions.*;
import net.lexiconnect.model.StatisticsModel;
import net.lexiconnect.model.TextModel;
import net.lexiconnect.parser.ElanParser;
import net.lexiconnect.services.*;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line front end: import files into the database, export stored texts, and
 * inspect files without storing them.
 */
@Command(name = "lexiconnect", mixinStandardHelpOptions = true, version = "lexiconnect 1.0",
        description = "Import, store and export interlinear texts",
        subcommands = {Main.ImportCommand.class, Main.ExportCommand.class, Main.DeleteCommand.class,
                Main.StatsCommand.class, Main.ElanDumpCommand.class})
public class Main implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_BAD_INPUT = 2;
    public static final int EXIT_NOT_FOUND = 3;
    public static final int EXIT_NO_CONTENT = 4;

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Option(names = {"--home"}, description = "Database home directory (default: $" + ApplicationConfig.HOME_ENV
            + " or " + ApplicationConfig.DEFAULT_HOME + ")", paramLabel = "<dir>")
    String home;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_BAD_INPUT;
    }

    GraphDatabaseServiceProvider openDatabase(ApplicationConfig config) {
        return new GraphDatabaseServiceProvider(home == null ? config.getDbPath() : home);
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    @Command(name = "import", mixinStandardHelpOptions = true,
            description = "Parse .flextext or .eaf files and store their texts")
    static class ImportCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        Main parent;

        @Parameters(paramLabel = "<file>", arity = "1..*", description = "Files to import")
        List<File> files;

        @Override
        public Integer call() throws IOException {
            ApplicationConfig config = ApplicationConfig.fromEnvironment();
            int result = 0;
            try (GraphDatabaseServiceProvider dbProvider = parent.openDatabase(config)) {
                IngestService ingest = new IngestService(
                        new Neo4jGraphDataAdapter(dbProvider.getDatabase(), config.getSchema()));
                for (File f : files) {
                    try {
                        System.out.println(mapper.writeValueAsString(ingest.ingest(f)));
                    } catch (InvalidInputException e) {
                        logger.error("Could not import {}: {}", e.getFileName(), e.getMessage());
                        result = EXIT_BAD_INPUT;
                    }
                }
            }
            return result;
        }
    }

    @Command(name = "export", mixinStandardHelpOptions = true,
            description = "Export a stored text, a dataset, or everything (\"all\")")
    static class ExportCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        Main parent;

        @Parameters(paramLabel = "<id>", description = "Text ID, dataset ID, or \"all\"")
        String id;

        @Option(names = {"--format", "-f"}, defaultValue = "flextext", paramLabel = "<fmt>",
                description = "Output format: flextext or json (default: flextext)")
        String format;

        @Option(names = {"--output", "-o"}, paramLabel = "<file>",
                description = "Output file, or - for standard output (default: a file named after the export)")
        String output;

        @Override
        public Integer call() throws IOException {
            ApplicationConfig config = ApplicationConfig.fromEnvironment();
            try (GraphDatabaseServiceProvider dbProvider = parent.openDatabase(config)) {
                ExportService exporter = new ExportService(
                        new Neo4jGraphDataAdapter(dbProvider.getDatabase(), config.getSchema()));
                ExportResult result = exporter.export(id, format);
                if ("-".equals(output)) {
                    System.out.write(result.getContent());
                    System.out.flush();
                } else {
                    File target = new File(output == null ? result.getFileName() : output);
                    FileUtils.writeByteArrayToFile(target, result.getContent());
                    logger.info("Wrote {} ({})", target, result.getMediaType());
                }
                return 0;
            } catch (ExporterNotFoundException e) {
                logger.error(e.getMessage());
                return EXIT_BAD_INPUT;
            } catch (TextNotFoundException e) {
                logger.error(e.getMessage());
                return EXIT_NOT_FOUND;
            } catch (NoContentException e) {
                logger.warn(e.getMessage());
                return EXIT_NO_CONTENT;
            } catch (ExportException e) {
                logger.error(e.getMessage(), e.getCause());
                return EXIT_FAILURE;
            }
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Remove a stored text")
    static class DeleteCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        Main parent;

        @Parameters(paramLabel = "<id>", description = "Text ID")
        String id;

        @Override
        public Integer call() {
            ApplicationConfig config = ApplicationConfig.fromEnvironment();
            try (GraphDatabaseServiceProvider dbProvider = parent.openDatabase(config)) {
                GraphDataAdapter adapter = new Neo4jGraphDataAdapter(dbProvider.getDatabase(), config.getSchema());
                if (adapter.delete(id))
                    return 0;
                logger.error("No text found for id '{}'", id);
                return EXIT_NOT_FOUND;
            }
        }
    }

    @Command(name = "stats", mixinStandardHelpOptions = true,
            description = "Print corpus statistics for files, without storing them")
    static class StatsCommand implements Callable<Integer> {
        @Parameters(paramLabel = "<file>", arity = "1..*", description = "Files to analyse")
        List<File> files;

        @Override
        public Integer call() throws IOException {
            List<TextModel> texts = new ArrayList<>();
            for (File f : files) {
                try (InputStream in = FileUtils.openInputStream(f)) {
                    texts.addAll(IngestService.parse(in, f.getName()));
                } catch (InvalidInputException e) {
                    logger.error("Could not read {}: {}", e.getFileName(), e.getMessage());
                    return EXIT_BAD_INPUT;
                }
            }
            StatisticsModel stats = StatisticsService.compute(texts);
            System.out.println(mapper.writeValueAsString(stats));
            return 0;
        }
    }

    @Command(name = "elan-dump", mixinStandardHelpOptions = true,
            description = "Print the tiers and annotations of an ELAN file as JSON")
    static class ElanDumpCommand implements Callable<Integer> {
        @Parameters(paramLabel = "<file>", description = "The .eaf file")
        File file;

        @Override
        public Integer call() throws IOException {
            ElanParser parser = new ElanParser();
            try {
                System.out.println(parser.toJson(parser.readFile(file)));
                return 0;
            } catch (InvalidInputException e) {
                logger.error("Could not read {}: {}", e.getFileName(), e.getMessage());
                return EXIT_BAD_INPUT;
            }
        }
    }
}
