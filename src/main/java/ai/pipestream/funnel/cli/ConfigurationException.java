package ai.pipestream.funnel.cli;

/**
 * Thrown for invalid or incomplete invocation: the run stops before any job is created.
 */
public class ConfigurationException extends RuntimeException {

    private final boolean helpRequested;

    public ConfigurationException(String message) {
        this(message, false, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, false, cause);
    }

    private ConfigurationException(String message, boolean helpRequested, Throwable cause) {
        super(message, cause);
        this.helpRequested = helpRequested;
    }

    /**
     * Not an error: the user asked for usage.
     */
    public static ConfigurationException help() {
        return new ConfigurationException("help requested", true, null);
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }
}
