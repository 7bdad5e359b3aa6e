package org.sqlquote.options;

/**
 * Defines configuration option constants used throughout sqlquote.
 */
public final class SqlQuoteOptions {

    private SqlQuoteOptions() {
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
        public static final String ENV_VAR = "SQLQUOTE_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "sqlquote.yaml";
    }

    /**
     * Identifier rendering settings.
     */
    public static final class Identifiers {
        private Identifiers() {}

        /**
         * Quoting policy for identifiers: ALWAYS or AS_NEEDED.
         * Default: AS_NEEDED
         */
        public static final String QUOTING_KEY = "sqlquote.identifiers.quoting";
        public static final String QUOTING_DEFAULT = "AS_NEEDED";
    }

    public static final class Dialect {
        private Dialect() {}

        /**
         * Dialect used to map Java types to column types. No default.
         */
        public static final String KEY = "sqlquote.dialect";
    }
}
