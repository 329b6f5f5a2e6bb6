package ai.pipestream.funnel.job;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    @Test
    void parsesKnownFlags() {
        assertEquals(AccessPolicy.PUBLIC_READ, AccessPolicy.fromFlag("public-read"));
        assertEquals(AccessPolicy.PUBLIC_READ, AccessPolicy.fromFlag(" Public-Read "));
        assertEquals(AccessPolicy.PRIVATE, AccessPolicy.fromFlag("private"));
    }

    @Test
    void unknownOrMissingFlagFallsBackToPrivate() {
        assertEquals(AccessPolicy.PRIVATE, AccessPolicy.fromFlag("authenticated-read"));
        assertEquals(AccessPolicy.PRIVATE, AccessPolicy.fromFlag(null));
        assertEquals("private", AccessPolicy.PRIVATE.cannedAcl());
    }
}
