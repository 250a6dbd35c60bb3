package ph.extremelogic.common.tracer.filter;

import ph.extremelogic.common.tracer.LogEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Filters in registration order. The first rejection ends evaluation; an empty chain accepts.
 */
public final class FilterChain {
    private final List<Filter> filters = new CopyOnWriteArrayList<>();

    public FilterChain() {
    }

    public FilterChain(List<Filter> filters) {
        for (Filter filter : filters) {
            add(filter);
        }
    }

    public void add(Filter filter) {
        filters.add(Objects.requireNonNull(filter, "filter"));
    }

    public synchronized boolean remove(Filter filter) {
        for (int i = 0; i < filters.size(); i++) {
            if (filters.get(i) == filter) {
                filters.remove(i);
                return true;
            }
        }
        return false;
    }

    public boolean evaluate(LogEvent event) {
        for (Filter filter : filters) {
            if (!filter.handle(event)) {
                return false;
            }
        }
        return true;
    }

    public List<Filter> getFilters() {
        return Collections.unmodifiableList(new ArrayList<>(filters));
    }

    public int size() {
        return filters.size();
    }
}
