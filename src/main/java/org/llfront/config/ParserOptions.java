package org.llfront.config;

import com.typesafe.config.Config;

/**
 * Options for {@link org.llfront.IrParser}, read from the {@code llfront.parser} section.
 *
 * @param maxNestingDepth The deepest nesting of type and constant syntax that is accepted.
 * @param sourceName The file name reported in error positions.
 */
public record ParserOptions(int maxNestingDepth, String sourceName) {

    /** The configuration path of the parser section. */
    public static final String CONFIG_PATH = "llfront.parser";

    /** The values shipped in {@code reference.conf}. */
    public static final ParserOptions DEFAULT = new ParserOptions(256, "<memory>");

    public ParserOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("max-nesting-depth must be positive: " + maxNestingDepth);
        }
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("source-name must not be blank");
        }
    }

    /**
     * Reads the options from a resolved configuration.
     * @param config The configuration containing the {@code llfront.parser} section.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static ParserOptions fromConfig(Config config) {
        Config section = config.getConfig(CONFIG_PATH);
        return new ParserOptions(section.getInt("max-nesting-depth"), section.getString("source-name"));
    }

    /**
     * @param sourceName The file name to report.
     * @return A copy of these options with another source name.
     */
    public ParserOptions withSourceName(String sourceName) {
        return new ParserOptions(maxNestingDepth, sourceName);
    }
}
