package ph.extremelogic.common.tracer.trace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * An immutable, normalized stack trace. Frames are ordered innermost first, as the JVM reports them.
 */
public final class Trace {
    private final List<Frame> frames;

    public Trace(List<Frame> frames) {
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
    }

    public static Trace from(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable");
        return from(throwable.getStackTrace());
    }

    public static Trace from(StackTraceElement[] elements) {
        List<Frame> frames = new ArrayList<>(elements.length);
        for (StackTraceElement element : elements) {
            frames.add(Frame.from(element));
        }
        return new Trace(frames);
    }

    /**
     * Stack of the calling code, without the frame of this method.
     */
    public static Trace current() {
        StackTraceElement[] elements = new Throwable().getStackTrace();
        return from(Arrays.copyOfRange(elements, Math.min(1, elements.length), elements.length));
    }

    public List<Frame> getFrames() {
        return frames;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * Collapses each run of consecutive frames matching {@code predicate} into the outermost frame of
     * that run. In terse mode JDK frames are folded as well, folded frames lose their line number and
     * show only their module, and a folded outermost frame is dropped.
     */
    public Trace foldFrames(Predicate<Frame> predicate, boolean terse) {
        Predicate<Frame> folds = terse ? predicate.or(Frame::isCore) : predicate;

        // walk from the outermost frame inward, keeping the first frame of each folded run
        List<Frame> kept = new ArrayList<>();
        for (int i = frames.size() - 1; i >= 0; i--) {
            Frame frame = frames.get(i);
            if (!folds.test(frame)) {
                kept.add(frame);
            } else if (kept.isEmpty() || !folds.test(kept.get(kept.size() - 1))) {
                kept.add(frame);
            }
        }

        if (terse) {
            for (int i = 0; i < kept.size(); i++) {
                Frame frame = kept.get(i);
                if (folds.test(frame)) {
                    kept.set(i, frame.toTerse());
                }
            }
            if (kept.size() > 1 && folds.test(kept.get(0))) {
                kept.remove(0);
            }
        }

        Collections.reverse(kept);
        return new Trace(kept);
    }

    @Override
    public String toString() {
        int longest = 0;
        for (Frame frame : frames) {
            longest = Math.max(longest, frame.getLocation().length());
        }
        StringBuilder sb = new StringBuilder();
        for (Frame frame : frames) {
            String location = frame.getLocation();
            sb.append(location);
            for (int i = location.length(); i < longest; i++) {
                sb.append(' ');
            }
            sb.append("  ").append(frame.getMember()).append('\n');
        }
        return sb.toString();
    }
}
