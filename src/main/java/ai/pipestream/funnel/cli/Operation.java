package ai.pipestream.funnel.cli;

import java.util.Locale;

/**
 * Operations accepted on the command line.
 */
public enum Operation {
    GET("get"),
    PUT("put"),
    LIST("list"),
    DELETE("delete");

    private final String label;

    Operation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Whether input items for this operation are local paths rather than keys.
     */
    public boolean readsLocalFiles() {
        return this == PUT;
    }

    public static Operation fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (Operation operation : values()) {
            if (operation.label.equals(normalized)) {
                return operation;
            }
        }
        throw new ConfigurationException("Unknown operation '" + name + "'; expected one of get, put, list, delete");
    }
}
