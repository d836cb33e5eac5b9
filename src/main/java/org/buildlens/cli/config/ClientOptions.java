package org.buildlens.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Settings of the notification sink, read from the {@code buildlens.client} block.
 *
 * @param format      Where notifications go.
 * @param prettyPrint Whether JSON output is indented.
 * @param displayName Target display name used when a script has none, or {@code null}.
 */
public record ClientOptions(Format format, boolean prettyPrint, String displayName) {

    static final String CLIENT_PATH = "buildlens.client";
    static final String DISPLAY_NAME_PATH = "buildlens.target.display-name";

    /**
     * Notification sinks.
     */
    public enum Format {
        /** JSON-RPC notification lines. */
        JSON,
        /** Log lines through SLF4J. */
        LOG;

        public static Format parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown client format '" + value + "', expected JSON or LOG", e);
            }
        }
    }

    /**
     * Reads the options, applying defaults for missing keys.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static ClientOptions fromConfig(Config config) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "format", "JSON",
                "pretty-print", false));
        Config client = config.hasPath(CLIENT_PATH)
                ? config.getConfig(CLIENT_PATH).withFallback(defaults)
                : defaults;

        String displayName = config.hasPath(DISPLAY_NAME_PATH) ? config.getString(DISPLAY_NAME_PATH) : null;
        return new ClientOptions(
                Format.parse(client.getString("format")),
                client.getBoolean("pretty-print"),
                displayName);
    }

    public ClientOptions withFormat(Format format) {
        return new ClientOptions(format, prettyPrint, displayName);
    }

    public ClientOptions withPrettyPrint(boolean prettyPrint) {
        return new ClientOptions(format, prettyPrint, displayName);
    }
}
