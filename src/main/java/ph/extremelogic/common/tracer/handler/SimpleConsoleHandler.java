package ph.extremelogic.common.tracer.handler;

import ph.extremelogic.common.tracer.LogEvent;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Bare console output of level and body only, e.g. {@code warn > disk almost full}. Meant for
 * demos and quick scripts; {@link ConsoleHandler} is the full output.
 */
public final class SimpleConsoleHandler implements Handler {
    private final PrintStream out;

    public SimpleConsoleHandler() {
        this(System.out);
    }

    public SimpleConsoleHandler(PrintStream out) {
        this.out = out;
    }

    @Override
    public void handle(LogEvent event) {
        out.println(String.format("%-5s> %s",
                event.getLevel().getName().toLowerCase(Locale.ROOT), event.getBody()));
    }
}
