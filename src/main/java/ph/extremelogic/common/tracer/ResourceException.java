package ph.extremelogic.common.tracer;

/**
 * A file-backed handler could not open, lock or write its file.
 */
public class ResourceException extends TracerException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
