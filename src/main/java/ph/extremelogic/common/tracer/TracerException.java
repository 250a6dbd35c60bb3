package ph.extremelogic.common.tracer;

/**
 * Base type for every failure the tracer surfaces to its callers.
 */
public class TracerException extends RuntimeException {

    public TracerException(String message) {
        super(message);
    }

    public TracerException(String message, Throwable cause) {
        super(message, cause);
    }
}
