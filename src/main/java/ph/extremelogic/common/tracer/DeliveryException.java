package ph.extremelogic.common.tracer;

/**
 * Raised after a dispatch in which at least one handler failed. The first failure is the cause,
 * later ones are attached as suppressed exceptions.
 */
public class DeliveryException extends TracerException {

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
