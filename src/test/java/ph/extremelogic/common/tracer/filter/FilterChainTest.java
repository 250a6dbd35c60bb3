package ph.extremelogic.common.tracer.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import ph.extremelogic.common.tracer.DefaultLogEvent;
import ph.extremelogic.common.tracer.LogEvent;
import ph.extremelogic.common.tracer.api.Level;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FilterChainTest {

    private final LogEvent event = new DefaultLogEvent("svc", Level.INFO, OffsetDateTime.now(), "body",
            null, null, null, true);

    @Test
    @DisplayName("Empty chain accepts every event")
    void testEmptyChainAccepts() {
        assertTrue(new FilterChain().evaluate(event));
    }

    @Test
    @DisplayName("First rejection stops evaluation")
    void testShortCircuit() {
        Filter rejecting = mock(Filter.class);
        Filter accepting = mock(Filter.class);
        when(rejecting.handle(any())).thenReturn(false);
        when(accepting.handle(any())).thenReturn(true);
        FilterChain chain = new FilterChain(List.of(rejecting, accepting));

        assertFalse(chain.evaluate(event));

        verify(rejecting).handle(event);
        verify(accepting, never()).handle(any());
    }

    @Test
    @DisplayName("Filters run in registration order")
    void testOrder() {
        Filter first = mock(Filter.class);
        Filter second = mock(Filter.class);
        when(first.handle(any())).thenReturn(true);
        when(second.handle(any())).thenReturn(true);
        FilterChain chain = new FilterChain();
        chain.add(first);
        chain.add(second);

        assertTrue(chain.evaluate(event));

        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).handle(event);
        inOrder.verify(second).handle(event);
    }

    @Test
    @DisplayName("Removing a filter drops it from evaluation")
    void testRemove() {
        Filter rejecting = e -> false;
        FilterChain chain = new FilterChain();
        chain.add(rejecting);

        assertTrue(chain.remove(rejecting));
        assertFalse(chain.remove(rejecting));
        assertEquals(0, chain.size());
        assertTrue(chain.evaluate(event));
    }

    @Test
    @DisplayName("Filters can inspect the event")
    void testLambdaFilter() {
        FilterChain chain = new FilterChain();
        chain.add(e -> e.getBody().contains("happy"));

        assertFalse(chain.evaluate(event));
        assertEquals(1, chain.getFilters().size());
    }
}
