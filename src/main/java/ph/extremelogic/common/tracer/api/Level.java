package ph.extremelogic.common.tracer.api;

import java.util.Locale;

/**
 * Closed set of severity levels, ordered by importance.
 */
public enum Level {
    DEBUG("Debug", 90, 0, false),
    INFO("Info", 94, 1, false),
    WARN("Warn", 93, 2, false),
    ERROR("Error", 91, 3, true),
    FATAL("Fatal", 91, 4, true);

    private final String displayName;
    private final int ansiColor;
    public final int importance;
    private final boolean useStderr;

    Level(String displayName, int ansiColor, int importance, boolean useStderr) {
        this.displayName = displayName;
        this.ansiColor = ansiColor;
        this.importance = importance;
        this.useStderr = useStderr;
    }

    public String getName() {
        return displayName;
    }

    public int getAnsiColor() {
        return ansiColor;
    }

    public int getImportance() {
        return importance;
    }

    /**
     * Whether console output for this level defaults to the error stream.
     */
    public boolean isUseStderr() {
        return useStderr;
    }

    public boolean isAtLeast(Level other) {
        return this.importance >= other.importance;
    }

    public boolean isLessSevereThan(Level other) {
        return this.importance < other.importance;
    }

    public static Level getLevel(String name) {
        if (name == null) return null;
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Level level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return null;
    }
}
