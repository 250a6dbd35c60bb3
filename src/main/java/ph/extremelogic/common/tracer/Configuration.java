package ph.extremelogic.common.tracer;

import ph.extremelogic.common.tracer.api.Level;
import ph.extremelogic.common.tracer.filter.Filter;
import ph.extremelogic.common.tracer.handler.Handler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Settings a {@link Logger} is created with.
 *
 * <pre>{@code
 * Configuration configuration = new Configuration.Builder()
 *         .level(Level.DEBUG)
 *         .handler(new ConsoleHandler())
 *         .build();
 * Logger logger = new Logger("example", configuration);
 * }</pre>
 */
public final class Configuration {
    private final Level level;
    private final boolean indentation;
    private final boolean forceUtc;
    private final List<Handler> handlers;
    private final List<Filter> filters;
    private final Clock clock;

    public Configuration() {
        this(new Builder());
    }

    public Configuration(Level level) {
        this(new Builder().level(level));
    }

    private Configuration(Builder builder) {
        this.level = builder.level;
        this.indentation = builder.indentation;
        this.forceUtc = builder.forceUtc;
        this.handlers = Collections.unmodifiableList(new ArrayList<>(builder.handlers));
        this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
        this.clock = builder.clock;
    }

    public Level getLevel() { return level; }
    public boolean isIndentation() { return indentation; }
    public boolean isForceUtc() { return forceUtc; }
    public List<Handler> getHandlers() { return handlers; }
    public List<Filter> getFilters() { return filters; }
    public Clock getClock() { return clock; }

    public static class Builder {
        private Level level = Level.INFO;
        private boolean indentation = true;
        private boolean forceUtc = false;
        private final List<Handler> handlers = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();
        private Clock clock = Clock.systemDefaultZone();

        public Builder level(Level level) {
            this.level = Objects.requireNonNull(level, "level");
            return this;
        }

        public Builder level(String levelName) {
            Level parsed = Level.getLevel(levelName);
            if (parsed == null) {
                throw new ConfigurationException("Unknown level: " + levelName);
            }
            this.level = parsed;
            return this;
        }

        public Builder indentation(boolean indentation) {
            this.indentation = indentation;
            return this;
        }

        /**
         * Converts every timestamp to UTC before it is recorded.
         */
        public Builder forceUtc(boolean forceUtc) {
            this.forceUtc = forceUtc;
            return this;
        }

        public Builder handler(Handler handler) {
            handlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder filter(Filter filter) {
            filters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Configuration build() {
            return new Configuration(this);
        }
    }
}
