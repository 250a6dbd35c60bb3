package ph.extremelogic.common.tracer.handler;

import ph.extremelogic.common.tracer.LogEvent;
import ph.extremelogic.common.tracer.layout.Layout;
import ph.extremelogic.common.tracer.layout.TracerLayout;

import java.io.PrintStream;

/**
 * Writes events to the console, colored by default.
 */
public final class ConsoleHandler implements Handler {
    private final Layout<String> layout;
    private final boolean useStderr;
    private final PrintStream out;
    private final PrintStream err;

    public ConsoleHandler() {
        this(true, false);
    }

    /**
     * @param useColors whether to write the ANSI colored message
     * @param useStderr whether levels flagged for the error stream go to {@code System.err};
     *                  otherwise everything is written to {@code System.out}
     */
    public ConsoleHandler(boolean useColors, boolean useStderr) {
        this(useColors, useStderr, System.out, System.err);
    }

    public ConsoleHandler(boolean useColors, boolean useStderr, PrintStream out, PrintStream err) {
        this.layout = new TracerLayout(useColors);
        this.useStderr = useStderr;
        this.out = out;
        this.err = err;
    }

    @Override
    public void handle(LogEvent event) {
        String message = layout.toSerializable(event);
        PrintStream target = useStderr && event.getLevel().isUseStderr() ? err : out;
        synchronized (target) {
            target.println(message);
        }
    }
}
