package net.lexiconnect;

import net.lexiconnect.services.GraphSchema;

import java.util.Map;

/**
 * This is the main configuration class. It says where the database lives and which
 * graph layout texts are stored in, as set in the environment.
 */
public class ApplicationConfig {
    public static final String HOME_ENV = "LEXICONNECT_HOME";
    public static final String SCHEMA_ENV = "LEXICONNECT_SCHEMA";
    static final String DEFAULT_HOME = "/var/lib/lexiconnect";

    private final String dbPath;
    private final GraphSchema schema;

    public ApplicationConfig(Map<String, String> env) {
        String home = env.get(HOME_ENV);
        this.dbPath = home == null || home.trim().isEmpty() ? DEFAULT_HOME : home.trim();
        this.schema = GraphSchema.fromName(env.get(SCHEMA_ENV));
    }

    public static ApplicationConfig fromEnvironment() {
        return new ApplicationConfig(System.getenv());
    }

    public String getDbPath() {
        return dbPath;
    }

    public GraphSchema getSchema() {
        return schema;
    }
}
