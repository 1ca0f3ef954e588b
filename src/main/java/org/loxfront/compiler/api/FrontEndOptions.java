package org.loxfront.compiler.api;

import com.typesafe.config.Config;
import org.loxfront.compiler.frontend.parser.Parser;

/**
 * Tunable limits of the front end.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * loxfront {
 *   parser {
 *     max-arguments = 255  # upper bound for call arguments and function parameters
 *   }
 * }
 * </pre>
 *
 * @param maxArguments The maximum number of arguments of a call and parameters of a function.
 */
public record FrontEndOptions(int maxArguments) {

    private static final String MAX_ARGUMENTS_PATH = "loxfront.parser.max-arguments";

    public FrontEndOptions {
        if (maxArguments < 1) {
            throw new IllegalArgumentException("maxArguments must be positive, got " + maxArguments);
        }
    }

    /**
     * @return The options with all defaults.
     */
    public static FrontEndOptions defaults() {
        return new FrontEndOptions(Parser.DEFAULT_MAX_ARGUMENTS);
    }

    /**
     * Reads the options from the application configuration, falling back to defaults for missing keys.
     * @param config The resolved configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a present value has the wrong type.
     */
    public static FrontEndOptions fromConfig(Config config) {
        int maxArguments = config.hasPath(MAX_ARGUMENTS_PATH)
                ? config.getInt(MAX_ARGUMENTS_PATH)
                : Parser.DEFAULT_MAX_ARGUMENTS;
        return new FrontEndOptions(maxArguments);
    }
}
