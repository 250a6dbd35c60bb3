package ph.extremelogic.common.tracer.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class LevelTest {

    @ParameterizedTest
    @EnumSource(Level.class)
    @DisplayName("Every level is at least as severe as itself and all lower levels")
    void testIsAtLeast(Level level) {
        for (Level other : Level.values()) {
            assertEquals(level.getImportance() >= other.getImportance(), level.isAtLeast(other),
                    level + " compared to " + other);
            assertEquals(!level.isAtLeast(other), level.isLessSevereThan(other));
        }
    }

    @Test
    @DisplayName("Importance ranks run from debug=0 to fatal=4")
    void testImportanceRanks() {
        assertEquals(0, Level.DEBUG.getImportance());
        assertEquals(1, Level.INFO.getImportance());
        assertEquals(2, Level.WARN.getImportance());
        assertEquals(3, Level.ERROR.getImportance());
        assertEquals(4, Level.FATAL.getImportance());
        assertTrue(Level.FATAL.isAtLeast(Level.DEBUG));
        assertFalse(Level.DEBUG.isAtLeast(Level.INFO));
    }

    @Test
    @DisplayName("Only error and fatal default to the error stream")
    void testUseStderr() {
        assertFalse(Level.DEBUG.isUseStderr());
        assertFalse(Level.INFO.isUseStderr());
        assertFalse(Level.WARN.isUseStderr());
        assertTrue(Level.ERROR.isUseStderr());
        assertTrue(Level.FATAL.isUseStderr());
    }

    @Test
    @DisplayName("Display names and colors")
    void testDisplayData() {
        assertEquals("Debug", Level.DEBUG.getName());
        assertEquals("Info", Level.INFO.getName());
        assertEquals(90, Level.DEBUG.getAnsiColor());
        assertEquals(94, Level.INFO.getAnsiColor());
        assertEquals(93, Level.WARN.getAnsiColor());
        assertEquals(91, Level.ERROR.getAnsiColor());
        assertEquals(91, Level.FATAL.getAnsiColor());
    }

    @ParameterizedTest
    @ValueSource(strings = {"warn", "WARN", " Warn "})
    void testGetLevelIgnoresCase(String name) {
        assertEquals(Level.WARN, Level.getLevel(name));
    }

    @Test
    void testGetLevelUnknown() {
        assertNull(Level.getLevel("verbose"));
        assertNull(Level.getLevel(null));
    }
}
