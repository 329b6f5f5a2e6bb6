package ai.pipestream.funnel.job;

import java.util.Locale;

/**
 * Canned ACL applied to uploaded objects.
 */
public enum AccessPolicy {
    PUBLIC_READ("public-read"),
    PRIVATE("private");

    private final String cannedAcl;

    AccessPolicy(String cannedAcl) {
        this.cannedAcl = cannedAcl;
    }

    public String cannedAcl() {
        return cannedAcl;
    }

    /**
     * Parses a command-line value. Anything other than {@code public-read} yields {@link #PRIVATE}.
     */
    public static AccessPolicy fromFlag(String value) {
        if (value != null && PUBLIC_READ.cannedAcl.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return PUBLIC_READ;
        }
        return PRIVATE;
    }
}
