package net.lexiconnect.services;

import java.nio.file.Files;
import java.nio.file.Path;

import org.neo4j.configuration.GraphDatabaseSettings;
import org.neo4j.dbms.api.DatabaseManagementService;
import org.neo4j.dbms.api.DatabaseManagementServiceBuilder;
import org.neo4j.graphdb.GraphDatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the embedded database under a home directory and holds the handle to it. One
 * provider is created at startup and passed to whatever needs the database; closing it
 * shuts the database down.
 */
public class GraphDatabaseServiceProvider implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(GraphDatabaseServiceProvider.class);

    private final DatabaseManagementService dbService;
    private final GraphDatabaseService db;
    private final Thread shutdownHook;

    /**
     * Connect to a DB under the given home directory. Settings in conf/neo4j.conf below
     * the home directory are applied if that file exists.
     *
     * @param dbLocation - the home directory
     */
    public GraphDatabaseServiceProvider(String dbLocation) {
        Path home = Path.of(dbLocation);
        DatabaseManagementServiceBuilder builder = new DatabaseManagementServiceBuilder(home.resolve("data"));
        Path config = home.resolve("conf").resolve("neo4j.conf");
        if (Files.exists(config)) {
            logger.info("Loading database settings from {}", config);
            builder.loadPropertiesFromFile(config);
        }
        dbService = builder.build();
        db = dbService.database(GraphDatabaseSettings.DEFAULT_DATABASE_NAME);
        shutdownHook = new Thread(dbService::shutdown);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        logger.info("Opened database at {}", home);
    }

    public GraphDatabaseService getDatabase() {
        return db;
    }

    @Override
    public void close() {
        dbService.shutdown();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // already shutting down; the hook will run anyway
            logger.debug("JVM shutdown in progress, leaving shutdown hook in place");
        }
    }
}
