package org.scadfront.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.scadfront.diagnostics.ErrorHandlerOptions;

/**
 * Builds the session configuration from HOCON layers. Reading files is left to the host; it passes
 * whatever it parsed as overrides.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dscadfront.error-handler.throw-errors=false})</li>
 *   <li>Host overrides</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    /** Path of the error-handler block. */
    public static final String ERROR_HANDLER_PATH = "scadfront.error-handler";

    private ConfigLoader() {
    }

    /**
     * @return The classpath defaults with system properties applied, resolved.
     */
    public static Config defaults() {
        return withOverrides(ConfigFactory.empty());
    }

    /**
     * Layers host settings between system properties and the classpath defaults.
     *
     * @param overrides Settings supplied by the host, for example parsed from its own settings file.
     * @return The resolved config.
     * @throws com.typesafe.config.ConfigException if a substitution cannot be resolved.
     */
    public static Config withOverrides(final Config overrides) {
        return ConfigFactory.systemProperties()
                .withFallback(overrides)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Reads the error-handler block.
     *
     * @param config A resolved config.
     * @return The options; programmatic defaults if the block is absent.
     * @throws IllegalArgumentException if a severity name is not recognized.
     */
    public static ErrorHandlerOptions errorHandlerOptions(final Config config) {
        if (!config.hasPath(ERROR_HANDLER_PATH)) {
            return ErrorHandlerOptions.defaults();
        }
        return ErrorHandlerOptions.fromConfig(config.getConfig(ERROR_HANDLER_PATH));
    }
}
