package ph.extremelogic.common.tracer.layout;

import ph.extremelogic.common.tracer.LogEvent;

public interface Layout<T> {
    T toSerializable(LogEvent event);
    String getContentType();
}
