package ph.extremelogic.common.tracer;

import ph.extremelogic.common.tracer.api.Level;
import ph.extremelogic.common.tracer.filter.Filter;
import ph.extremelogic.common.tracer.filter.FilterChain;
import ph.extremelogic.common.tracer.handler.Handler;
import ph.extremelogic.common.tracer.handler.HandlerRegistry;
import ph.extremelogic.common.tracer.trace.Trace;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Logging session for one named section.
 *
 * <p>Events below the configured level are dropped, the rest go through the filters in order. An
 * accepted event is appended to {@link #getLogs()}, its plain rendering to {@link #getLogsGenerated()},
 * and it is then delivered to every attached handler on the calling thread.</p>
 *
 * <pre>{@code
 * try (Logger logger = new Logger("billing", new Configuration.Builder()
 *         .handler(new ConsoleHandler())
 *         .build())) {
 *     logger.info("Invoice created", "id 4711");
 *     logger.error("Payment failed", e);
 * }
 * }</pre>
 */
public final class Logger implements AutoCloseable {
    private static final Pattern SECTION_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String section;
    private final boolean forceUtc;
    private final Clock clock;
    private final FilterChain filterChain;
    private final HandlerRegistry handlerRegistry = new HandlerRegistry();

    private volatile Level level;
    private volatile boolean indentation;
    private volatile boolean disposed = false;

    // One event is filtered, recorded and delivered completely before the next one starts
    private final ReentrantLock lock = new ReentrantLock();
    private final List<LogEvent> logs = new ArrayList<>();
    private final StringBuilder logsGenerated = new StringBuilder();

    public Logger(String section) {
        this(section, new Configuration());
    }

    public Logger(String section, Configuration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        this.section = validateSection(section);
        this.level = configuration.getLevel();
        this.indentation = configuration.isIndentation();
        this.forceUtc = configuration.isForceUtc();
        this.clock = configuration.getClock();
        this.filterChain = new FilterChain(configuration.getFilters());

        try {
            for (Handler handler : configuration.getHandlers()) {
                handlerRegistry.attach(handler);
            }
        } catch (RuntimeException e) {
            handlerRegistry.releaseAll();
            throw e;
        }
    }

    private static String validateSection(String section) {
        String trimmed = section == null ? "" : section.trim();
        if (trimmed.isEmpty()) {
            throw new ConfigurationException("Section must not be empty");
        }
        if (!SECTION_PATTERN.matcher(trimmed).matches()) {
            throw new ConfigurationException("Invalid section name: " + trimmed);
        }
        return trimmed;
    }

    public void debug(String body) {
        log(Level.DEBUG, body, null, null, null);
    }

    public void debug(String body, String description) {
        log(Level.DEBUG, body, description, null, null);
    }

    public void info(String body) {
        log(Level.INFO, body, null, null, null);
    }

    public void info(String body, String description) {
        log(Level.INFO, body, description, null, null);
    }

    public void warn(String body) {
        log(Level.WARN, body, null, null, null);
    }

    public void warn(String body, String description) {
        log(Level.WARN, body, description, null, null);
    }

    public void warn(String body, Throwable t) {
        log(Level.WARN, body, null, t, traceOf(t));
    }

    public void warn(String body, String description, Throwable t) {
        log(Level.WARN, body, description, t, traceOf(t));
    }

    public void warn(String body, String description, Object error, Trace stack) {
        log(Level.WARN, body, description, error, stack);
    }

    public void error(String body) {
        log(Level.ERROR, body, null, null, null);
    }

    public void error(String body, String description) {
        log(Level.ERROR, body, description, null, null);
    }

    public void error(String body, Throwable t) {
        log(Level.ERROR, body, null, t, traceOf(t));
    }

    public void error(String body, String description, Throwable t) {
        log(Level.ERROR, body, description, t, traceOf(t));
    }

    public void error(String body, String description, Object error, Trace stack) {
        log(Level.ERROR, body, description, error, stack);
    }

    public void fatal(String body) {
        log(Level.FATAL, body, null, null, null);
    }

    public void fatal(String body, String description) {
        log(Level.FATAL, body, description, null, null);
    }

    public void fatal(String body, Throwable t) {
        log(Level.FATAL, body, null, t, traceOf(t));
    }

    public void fatal(String body, String description, Throwable t) {
        log(Level.FATAL, body, description, t, traceOf(t));
    }

    public void fatal(String body, String description, Object error, Trace stack) {
        log(Level.FATAL, body, description, error, stack);
    }

    private static Trace traceOf(Throwable t) {
        return t == null ? null : Trace.from(t);
    }

    /**
     * Raw entry point behind the level methods. Unlike {@link #debug} and {@link #info} it accepts an
     * error and a stack for any level.
     */
    public void log(Level level, String body, String description, Object error, Trace stack) {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(body, "body");
        if (disposed) {
            return;
        }

        LogEvent event = new DefaultLogEvent(section, level, now(), body.trim(),
                description == null ? null : description.trim(), error, stack, indentation);
        if (event.getLevel().isLessSevereThan(this.level)) {
            return;
        }

        lock.lock();
        try {
            if (disposed || !filterChain.evaluate(event)) {
                return;
            }
            logs.add(event);
            logsGenerated.append(event.getGeneratedMessage()).append('\n');
            handlerRegistry.dispatch(event);
        } finally {
            lock.unlock();
        }
    }

    private OffsetDateTime now() {
        OffsetDateTime timestamp = OffsetDateTime.now(clock);
        return forceUtc ? timestamp.withOffsetSameInstant(ZoneOffset.UTC) : timestamp;
    }

    public void attach(Handler handler) {
        if (disposed) {
            throw new IllegalStateException("Logger " + section + " is disposed");
        }
        handlerRegistry.attach(handler);
    }

    public boolean detach(Handler handler) {
        return handlerRegistry.detach(handler);
    }

    public boolean detachAt(int index) {
        return handlerRegistry.detachAt(index);
    }

    public List<Handler> getHandlers() {
        return handlerRegistry.getHandlers();
    }

    public void addFilter(Filter filter) {
        filterChain.add(filter);
    }

    public boolean removeFilter(Filter filter) {
        return filterChain.remove(filter);
    }

    public List<Filter> getFilters() {
        return filterChain.getFilters();
    }

    /**
     * Every event accepted so far, in logging order.
     */
    public List<LogEvent> getLogs() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(logs));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Plain renderings of {@link #getLogs()}, one per event, each followed by a newline.
     */
    public String getLogsGenerated() {
        lock.lock();
        try {
            return logsGenerated.toString();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEnabled(Level level) {
        return !disposed && level.isAtLeast(this.level);
    }

    public boolean isDebugEnabled() { return isEnabled(Level.DEBUG); }
    public boolean isInfoEnabled() { return isEnabled(Level.INFO); }
    public boolean isWarnEnabled() { return isEnabled(Level.WARN); }
    public boolean isErrorEnabled() { return isEnabled(Level.ERROR); }
    public boolean isFatalEnabled() { return isEnabled(Level.FATAL); }

    public String getSection() { return section; }
    public Level getLevel() { return level; }
    public boolean isIndentation() { return indentation; }
    public boolean isForceUtc() { return forceUtc; }
    public boolean isDisposed() { return disposed; }

    public void setLevel(Level level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    /**
     * Affects events created from now on; recorded events keep their setting.
     */
    public void setIndentation(boolean indentation) {
        this.indentation = indentation;
    }

    /**
     * Disposes and detaches every handler. Later log calls are ignored.
     */
    public void dispose() {
        lock.lock();
        try {
            if (disposed) {
                return;
            }
            disposed = true;
            handlerRegistry.disposeAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        dispose();
    }
}
