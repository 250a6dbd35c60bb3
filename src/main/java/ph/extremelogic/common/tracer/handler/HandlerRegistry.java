package ph.extremelogic.common.tracer.handler;

import ph.extremelogic.common.tracer.ConfigurationException;
import ph.extremelogic.common.tracer.DeliveryException;
import ph.extremelogic.common.tracer.LogEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered set of handlers owned by one logger, delivering each event to all of them in attachment
 * order on the calling thread.
 */
public final class HandlerRegistry {
    // Owner of every attached handler across all registries, held weakly
    static final HandlerOwnership OWNERSHIP = new HandlerOwnership();

    private final List<Handler> handlers = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    public synchronized void attach(Handler handler) {
        Objects.requireNonNull(handler, "handler");
        if (closed) {
            throw new IllegalStateException("Handler registry is closed");
        }
        if (!OWNERSHIP.claim(handler, this)) {
            throw new ConfigurationException("Handler " + handler.getName() + " is already attached"
                    + (isAttached(handler) ? " to this logger" : " to another logger"));
        }
        handlers.add(handler);
    }

    public synchronized boolean detach(Handler handler) {
        int index = indexOf(handler);
        return index >= 0 && detachAt(index);
    }

    /**
     * Detaches the handler at {@code index}. An index that is out of bounds is ignored.
     */
    public synchronized boolean detachAt(int index) {
        if (index < 0 || index >= handlers.size()) {
            return false;
        }
        Handler handler = handlers.get(index);
        disposeQuietly(handler);
        handlers.remove(index);
        OWNERSHIP.release(handler);
        return true;
    }

    /**
     * Delivers {@code event} to every handler. A failing handler does not stop delivery to the
     * following ones; the failures are rethrown together once all handlers ran.
     */
    public void dispatch(LogEvent event) {
        if (closed) {
            throw new IllegalStateException("Handler registry is closed");
        }
        DeliveryException failure = null;
        for (Handler handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = new DeliveryException("Handler " + handler.getName() + " failed to handle event", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public synchronized void disposeAll() {
        while (!handlers.isEmpty()) {
            detachAt(0);
        }
        closed = true;
    }

    /**
     * Drops every handler and gives up ownership of them without disposing them.
     */
    public synchronized void releaseAll() {
        for (Handler handler : handlers) {
            OWNERSHIP.release(handler);
        }
        handlers.clear();
    }

    public List<Handler> getHandlers() {
        return Collections.unmodifiableList(new ArrayList<>(handlers));
    }

    public boolean isAttached(Handler handler) {
        return indexOf(handler) >= 0;
    }

    public int size() {
        return handlers.size();
    }

    public boolean isClosed() {
        return closed;
    }

    private int indexOf(Handler handler) {
        for (int i = 0; i < handlers.size(); i++) {
            if (handlers.get(i) == handler) {
                return i;
            }
        }
        return -1;
    }

    private static void disposeQuietly(Handler handler) {
        try {
            handler.dispose();
        } catch (RuntimeException e) {
            System.err.printf("Error disposing handler %s: %s%n", handler.getName(), e.getMessage());
        }
    }
}
