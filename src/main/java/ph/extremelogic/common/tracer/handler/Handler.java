package ph.extremelogic.common.tracer.handler;

import ph.extremelogic.common.tracer.LogEvent;

/**
 * Receives every event accepted by the logger it is attached to.
 *
 * <pre>{@code
 * Logger logger = new Logger("example");
 * logger.attach(event -> System.out.println(event.getBody()));
 * }</pre>
 *
 * A handler instance can only be attached to one logger at a time.
 */
@FunctionalInterface
public interface Handler {

    void handle(LogEvent event);

    /**
     * Releases whatever the handler holds. Called at most once by the registry, when the handler is
     * detached or its logger disposed; implementations should still tolerate repeated calls.
     */
    default void dispose() {
    }

    /**
     * Name used in diagnostics. Lambdas and anonymous classes have no simple name and fall back to
     * the binary class name.
     */
    default String getName() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
