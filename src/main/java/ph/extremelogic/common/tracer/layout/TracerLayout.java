package ph.extremelogic.common.tracer.layout;

import ph.extremelogic.common.tracer.LogEvent;
import ph.extremelogic.common.tracer.api.Level;
import ph.extremelogic.common.tracer.trace.Frame;
import ph.extremelogic.common.tracer.trace.Trace;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Renders events into the tracer's line-oriented format.
 *
 * <pre>
 * [2024-05-01 13:37:00 +0200] Warn : section: body
 *                             |&gt; description line 1
 *                             |  description line 2
 *                             |- java.lang.IllegalStateException: broken
 * </pre>
 *
 * The plain form is always derived from the colored one by stripping the color codes, so both carry
 * exactly the same text.
 */
public final class TracerLayout implements Layout<String> {
    public static final String RESET = "\u001B[0m";

    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[0-9]+m");
    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int LEVEL_WIDTH = 5;

    // Fold hook for stack output; application frames are all kept, terse mode folds JDK internals
    private static final Predicate<Frame> KEEP_ALL_FRAMES = frame -> false;

    private final boolean colored;

    public TracerLayout() {
        this(false);
    }

    public TracerLayout(boolean colored) {
        this.colored = colored;
    }

    @Override
    public String toSerializable(LogEvent event) {
        return colored ? event.getGeneratedMessageColored() : event.getGeneratedMessage();
    }

    @Override
    public String getContentType() {
        return "text/plain";
    }

    public boolean isColored() {
        return colored;
    }

    public static String renderColored(LogEvent event) {
        Level level = event.getLevel();
        String color = color(level.getAnsiColor());
        String time = formatTimestamp(event.getTimestamp());

        StringBuilder sb = new StringBuilder(256);
        sb.append(RESET).append('[').append(time).append("] ")
                .append(color).append(center(level.getName(), LEVEL_WIDTH))
                .append(": ").append(event.getSection())
                .append(": ").append(event.getBody())
                .append(RESET);

        String separator = separator(time, event.isIndentation());

        String description = event.getDescription();
        if (description != null && !description.isEmpty()) {
            sb.append(separator).append("> ")
                    .append(description.replace("\n", separator + "  "));
        }

        Object error = event.getError();
        if (error != null) {
            // emptiness is judged before trimming, a blank error text still yields its marker
            String errorText = String.valueOf(error);
            if (!errorText.isEmpty()) {
                appendColoredBlock(sb, errorText.trim(), separator, color);
            }
        }

        Trace stack = event.getStack();
        if (stack != null) {
            String stackText = stack.foldFrames(KEEP_ALL_FRAMES, true).toString().trim();
            if (!stackText.isEmpty()) {
                appendColoredBlock(sb, stackText, separator, color);
            }
        }

        return sb.toString();
    }

    public static String render(LogEvent event) {
        return stripAnsi(event.getGeneratedMessageColored());
    }

    public static String stripAnsi(String text) {
        return ANSI_PATTERN.matcher(text).replaceAll("");
    }

    private static void appendColoredBlock(StringBuilder sb, String text, String separator, String color) {
        sb.append(separator).append("- ").append(color)
                .append(text.replace("\n", RESET + separator + "  " + color))
                .append(RESET);
    }

    static String separator(String time, boolean indentation) {
        if (!indentation) {
            return "\n|";
        }
        StringBuilder sb = new StringBuilder(time.length() + 5);
        sb.append('\n');
        for (int i = 0; i < time.length() + 3; i++) {
            sb.append(' ');
        }
        return sb.append('|').toString();
    }

    public static String formatTimestamp(OffsetDateTime timestamp) {
        return timestamp.format(TIMESTAMP_FORMATTER) + " " + formatOffset(timestamp.getOffset());
    }

    static String formatOffset(ZoneOffset offset) {
        int totalSeconds = offset.getTotalSeconds();
        int totalMinutes = Math.abs(totalSeconds) / 60;
        return String.format("%c%02d%02d", totalSeconds >= 0 ? '+' : '-', totalMinutes / 60, totalMinutes % 60);
    }

    /**
     * Centers {@code text} in {@code width} columns, odd padding going to the right.
     */
    public static String center(String text, int width) {
        if (text.length() >= width) return text;
        int totalPadding = width - text.length();
        int padLeft = totalPadding / 2;
        int padRight = totalPadding - padLeft;
        return " ".repeat(padLeft) + text + " ".repeat(padRight);
    }

    static String color(int ansiColor) {
        return "\u001B[" + ansiColor + "m";
    }
}
