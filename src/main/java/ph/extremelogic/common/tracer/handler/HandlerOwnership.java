package ph.extremelogic.common.tracer.handler;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;

/**
 * Tracks which registry owns each attached handler. Handlers are compared by identity and both the
 * handler and its owner are held weakly, so a logger that is collected without being disposed gives
 * its handlers up.
 */
final class HandlerOwnership {
    private final ReferenceQueue<Handler> queue = new ReferenceQueue<>();
    private final Map<HandlerKey, WeakReference<HandlerRegistry>> owners = new HashMap<>();

    /**
     * Records {@code registry} as owner of {@code handler}, unless a live registry already owns it.
     */
    synchronized boolean claim(Handler handler, HandlerRegistry registry) {
        expungeStale();
        WeakReference<HandlerRegistry> current = owners.get(new HandlerKey(handler, null));
        if (current != null && current.get() != null) {
            return false;
        }
        owners.put(new HandlerKey(handler, queue), new WeakReference<>(registry));
        return true;
    }

    synchronized void release(Handler handler) {
        owners.remove(new HandlerKey(handler, null));
        expungeStale();
    }

    private void expungeStale() {
        Reference<? extends Handler> stale;
        while ((stale = queue.poll()) != null) {
            owners.remove(stale);
        }
    }

    private static final class HandlerKey extends WeakReference<Handler> {
        private final int hash;

        HandlerKey(Handler handler, ReferenceQueue<Handler> queue) {
            super(handler, queue);
            this.hash = System.identityHashCode(handler);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof HandlerKey)) return false;
            Handler handler = get();
            return handler != null && handler == ((HandlerKey) other).get();
        }
    }
}
