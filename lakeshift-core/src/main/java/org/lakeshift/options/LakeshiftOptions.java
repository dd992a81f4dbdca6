package org.lakeshift.options;

/**
 * Defines configuration constants used throughout lakeshift.
 * Keeps the config file, the environment and the CLI on the same names.
 */
public final class LakeshiftOptions {

    private LakeshiftOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "LAKESHIFT_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "lakeshift.yaml";
    }

    /**
     * Environment variables that override values of the active profile.
     */
    public static final class Env {
        private Env() {}

        public static final String CATALOG = "LAKESHIFT_CATALOG";
        public static final String SCHEMA = "LAKESHIFT_SCHEMA";
        public static final String SCHEMA_DIR = "LAKESHIFT_SCHEMA_DIR";
        public static final String MIGRATIONS_DIR = "LAKESHIFT_MIGRATIONS_DIR";
        public static final String STATE_TABLE = "LAKESHIFT_STATE_TABLE";
        public static final String JDBC_URL = "LAKESHIFT_JDBC_URL";
        public static final String DATABRICKS_HOST = "DATABRICKS_HOST";
        public static final String DATABRICKS_TOKEN = "DATABRICKS_TOKEN";
        public static final String DATABRICKS_HTTP_PATH = "DATABRICKS_HTTP_PATH";
    }

    /**
     * Filesystem layout defaults, relative to the working directory.
     */
    public static final class Paths {
        private Paths() {}

        public static final String SCHEMA_DIR_DEFAULT = "schema";
        public static final String MIGRATIONS_DIR_DEFAULT = "sql/migrations";
    }

    /**
     * Migration history table.
     */
    public static final class State {
        private State() {}

        public static final String TABLE_DEFAULT = "_lakeshift_migrations";
    }
}
