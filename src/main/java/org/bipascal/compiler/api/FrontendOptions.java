package org.bipascal.compiler.api;

import com.typesafe.config.Config;

import java.util.Locale;

/**
 * Tunables of the lexer and parser.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * bipascal.frontend {
 *   dialect = "BILINGUAL"            # BILINGUAL, ENGLISH or INDONESIAN
 *   case-sensitive-keywords = false
 *   max-errors = 100                 # syntax errors reported before the parser gives up
 * }
 * </pre>
 *
 * @param dialect The keyword spellings to recognize.
 * @param caseSensitiveKeywords Whether {@code BEGIN} differs from {@code begin}.
 * @param maxErrors The number of syntax errors after which parsing stops.
 */
public record FrontendOptions(KeywordDialect dialect, boolean caseSensitiveKeywords, int maxErrors) {

    /** The configuration path of the frontend block. */
    public static final String CONFIG_PATH = "bipascal.frontend";

    private static final FrontendOptions DEFAULTS = new FrontendOptions(KeywordDialect.BILINGUAL, false, 100);

    public FrontendOptions {
        if (dialect == null) {
            throw new IllegalArgumentException("dialect must not be null");
        }
        if (maxErrors < 1) {
            throw new IllegalArgumentException("max-errors must be at least 1, got " + maxErrors);
        }
    }

    /**
     * @return The built-in defaults, identical to the values in {@code reference.conf}.
     */
    public static FrontendOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the options from the {@value #CONFIG_PATH} block. Missing keys fall back to the defaults.
     * @param config The application configuration.
     * @return The options.
     * @throws IllegalArgumentException if the dialect name or error limit is invalid.
     */
    public static FrontendOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return DEFAULTS;
        }
        Config frontend = config.getConfig(CONFIG_PATH);
        KeywordDialect dialect = frontend.hasPath("dialect")
                ? KeywordDialect.valueOf(frontend.getString("dialect").trim().toUpperCase(Locale.ROOT))
                : DEFAULTS.dialect();
        boolean caseSensitive = frontend.hasPath("case-sensitive-keywords")
                ? frontend.getBoolean("case-sensitive-keywords")
                : DEFAULTS.caseSensitiveKeywords();
        int maxErrors = frontend.hasPath("max-errors")
                ? frontend.getInt("max-errors")
                : DEFAULTS.maxErrors();
        return new FrontendOptions(dialect, caseSensitive, maxErrors);
    }
}
