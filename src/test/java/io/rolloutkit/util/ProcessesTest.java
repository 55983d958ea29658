package io.rolloutkit.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessesTest {

    @Test
    void livenessShouldTreatMissingPidsAsDead() {
        assertTrue(Processes.isAlive(Processes.currentPid()));
        assertFalse(Processes.isAlive(2_000_000_000L));
        assertFalse(Processes.isAlive(0L));
        assertFalse(Processes.isAlive((Long) null));
    }

    @Test
    void idsShouldCarryTheirPrefix() {
        assertTrue(Ids.newInvocationId().startsWith("inv_"));
        assertTrue(Ids.newRolloutId().startsWith("rol_"));
        assertEquals(4 + 12, Ids.newRunId().length());
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", Hashing.sha256Hex("hello"));
    }
}
