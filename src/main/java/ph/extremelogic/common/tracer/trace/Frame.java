package ph.extremelogic.common.tracer.trace;

import java.util.Objects;

/**
 * One stack frame, reduced to what the rendered output needs.
 */
public final class Frame {
    private static final String[] CORE_PREFIXES = {
            "java.", "javax.", "jdk.", "sun.", "com.sun."
    };

    private final String library;
    private final int line;
    private final String member;
    private final boolean core;
    private final String terseLibrary;

    public Frame(String library, int line, String member, boolean core, String terseLibrary) {
        this.library = Objects.requireNonNull(library, "library");
        this.line = line;
        this.member = Objects.requireNonNull(member, "member");
        this.core = core;
        this.terseLibrary = terseLibrary != null ? terseLibrary : library;
    }

    public static Frame from(StackTraceElement element) {
        String className = element.getClassName();
        String library = element.getFileName() != null ? element.getFileName() : className;
        int dot = className.lastIndexOf('.');
        String simpleName = dot >= 0 ? className.substring(dot + 1) : className;
        String packageName = dot >= 0 ? className.substring(0, dot) : className;
        String terseLibrary = element.getModuleName() != null ? element.getModuleName() : packageName;
        return new Frame(library, element.getLineNumber(), simpleName + "." + element.getMethodName(),
                isCoreClass(className), terseLibrary);
    }

    static boolean isCoreClass(String className) {
        for (String prefix : CORE_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public String getLibrary() { return library; }
    public int getLine() { return line; }
    public String getMember() { return member; }

    /**
     * Whether the frame belongs to the JDK rather than application code.
     */
    public boolean isCore() { return core; }

    public String getLocation() {
        return line > 0 ? library + " " + line : library;
    }

    /**
     * The frame as it appears once folded in terse mode: no line, library shortened to its module.
     */
    Frame toTerse() {
        return new Frame(terseLibrary, -1, member, core, terseLibrary);
    }

    @Override
    public String toString() {
        return getLocation() + " in " + member;
    }
}
