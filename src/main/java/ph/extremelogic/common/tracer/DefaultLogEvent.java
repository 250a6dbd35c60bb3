package ph.extremelogic.common.tracer;

import ph.extremelogic.common.tracer.api.Level;
import ph.extremelogic.common.tracer.trace.Trace;

import java.time.OffsetDateTime;
import java.util.Objects;

public final class DefaultLogEvent implements LogEvent {
    private final String section;
    private final Level level;
    private final OffsetDateTime timestamp;
    private final String body;
    private final String description;
    private final Object error;
    private final Trace stack;
    private final boolean indentation;

    // Rendering is deterministic for an immutable event, cache it lazily
    private volatile String generatedMessageColored;

    public DefaultLogEvent(String section, Level level, OffsetDateTime timestamp, String body,
                           String description, Object error, Trace stack, boolean indentation) {
        this.section = Objects.requireNonNull(section, "section");
        this.level = Objects.requireNonNull(level, "level");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.body = Objects.requireNonNull(body, "body");
        this.description = description;
        this.error = error;
        this.stack = stack;
        this.indentation = indentation;
    }

    @Override public String getSection() { return section; }
    @Override public Level getLevel() { return level; }
    @Override public OffsetDateTime getTimestamp() { return timestamp; }
    @Override public String getBody() { return body; }
    @Override public String getDescription() { return description; }
    @Override public Object getError() { return error; }
    @Override public Trace getStack() { return stack; }
    @Override public boolean isIndentation() { return indentation; }

    @Override
    public String getGeneratedMessageColored() {
        String text = generatedMessageColored;
        if (text == null) {
            text = LogEvent.super.getGeneratedMessageColored();
            generatedMessageColored = text;
        }
        return text;
    }

    @Override
    public String toString() {
        return String.format("DefaultLogEvent[section=%s, level=%s, timestamp=%s, body=%s]",
                section, level, timestamp, body);
    }
}
