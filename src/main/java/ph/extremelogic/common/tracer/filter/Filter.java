package ph.extremelogic.common.tracer.filter;

import ph.extremelogic.common.tracer.LogEvent;

/**
 * Decides, before anything is recorded or delivered, whether an event goes through.
 */
@FunctionalInterface
public interface Filter {
    boolean handle(LogEvent event);
}
