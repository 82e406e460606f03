package engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CrashConfigTest {

    @Test
    void noneNeverCrashes() {
        assertFalse(CrashConfig.NONE.shouldCrash("stepA", CrashPhase.BEFORE_EXECUTE));
        assertFalse(CrashConfig.NONE.shouldCrash("stepA", CrashPhase.AFTER_EXECUTE_BEFORE_RECORD));
    }

    @Test
    void crashesOnlyAtConfiguredStepAndPhase() {
        CrashConfig config = new CrashConfig("stepB", CrashPhase.AFTER_EXECUTE_BEFORE_RECORD);

        assertTrue(config.shouldCrash("stepB", CrashPhase.AFTER_EXECUTE_BEFORE_RECORD));
        assertFalse(config.shouldCrash("stepB", CrashPhase.BEFORE_EXECUTE));
        assertFalse(config.shouldCrash("stepA", CrashPhase.AFTER_EXECUTE_BEFORE_RECORD));
    }

    @Test
    void blankStepNameMatchesEveryStep() {
        CrashConfig config = new CrashConfig(" ", CrashPhase.BEFORE_EXECUTE);

        assertTrue(config.shouldCrash("anything", CrashPhase.BEFORE_EXECUTE));
    }

    @Test
    void phaseParsing() {
        assertEquals(CrashPhase.BEFORE_EXECUTE, CrashPhase.fromValue("before-execute"));
        assertEquals(CrashPhase.AFTER_EXECUTE_BEFORE_RECORD, CrashPhase.fromValue(" After-Execute-Before-Record "));
        assertEquals(CrashPhase.NONE, CrashPhase.fromValue(null));
        assertEquals(CrashPhase.NONE, CrashPhase.fromValue("none"));
        assertThrows(IllegalArgumentException.class, () -> CrashPhase.fromValue("mid-flight"));
    }
}
