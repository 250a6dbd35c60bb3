package ph.extremelogic.common.tracer;

import ph.extremelogic.common.tracer.api.Level;
import ph.extremelogic.common.tracer.layout.TracerLayout;
import ph.extremelogic.common.tracer.trace.Trace;

import java.time.OffsetDateTime;

public interface LogEvent {
    String getSection();
    Level getLevel();
    OffsetDateTime getTimestamp();
    String getBody();
    String getDescription();
    Object getError();
    Trace getStack();
    boolean isIndentation();

    /**
     * Full ANSI-colored rendering of this event. Handlers write it as is.
     */
    default String getGeneratedMessageColored() {
        return TracerLayout.renderColored(this);
    }

    /**
     * The colored rendering with every color code stripped.
     */
    default String getGeneratedMessage() {
        return TracerLayout.render(this);
    }
}
