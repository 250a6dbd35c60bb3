package ph.extremelogic.common.tracer.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ph.extremelogic.common.tracer.DefaultLogEvent;
import ph.extremelogic.common.tracer.LogEvent;
import ph.extremelogic.common.tracer.api.Level;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleHandlerTest {
    private static final OffsetDateTime TIMESTAMP =
            OffsetDateTime.of(2024, 5, 1, 13, 37, 0, 0, ZoneOffset.UTC);

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    }

    private static LogEvent event(Level level, String body) {
        return new DefaultLogEvent("console_test", level, TIMESTAMP, body, null, null, null, true);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should write the plain message when colors are off")
    void testPlainOutput() {
        LogEvent event = event(Level.INFO, "hello");

        new ConsoleHandler(false, false, out, err).handle(event);

        assertEquals(event.getGeneratedMessage() + System.lineSeparator(), out());
        assertEquals("", err());
    }

    @Test
    @DisplayName("Should write the colored message by default")
    void testColoredOutput() {
        LogEvent event = event(Level.WARN, "careful");

        new ConsoleHandler(true, false, out, err).handle(event);

        assertTrue(out().startsWith(event.getGeneratedMessageColored()));
        assertTrue(out().contains("\u001B[93m"), "Output should contain the warn color");
    }

    @Test
    @DisplayName("Should route error levels to stderr when enabled")
    void testStderrRouting() {
        ConsoleHandler handler = new ConsoleHandler(false, true, out, err);

        handler.handle(event(Level.INFO, "routine"));
        handler.handle(event(Level.ERROR, "broken"));
        handler.handle(event(Level.FATAL, "dead"));

        assertTrue(out().contains("routine"));
        assertFalse(out().contains("broken"));
        assertTrue(err().contains("broken"));
        assertTrue(err().contains("dead"));
    }

    @Test
    @DisplayName("Should keep everything on stdout when stderr routing is off")
    void testNoStderrRouting() {
        new ConsoleHandler(false, false, out, err).handle(event(Level.ERROR, "broken"));

        assertTrue(out().contains("broken"));
        assertEquals("", err());
    }

    @Test
    @DisplayName("Simple console output shows level and body only")
    void testSimpleConsoleHandler() {
        SimpleConsoleHandler handler = new SimpleConsoleHandler(out);

        handler.handle(event(Level.INFO, "hello"));
        handler.handle(event(Level.ERROR, "bad"));

        String nl = System.lineSeparator();
        assertEquals("info > hello" + nl + "error> bad" + nl, out());
    }
}
