package ph.extremelogic.common.tracer;

/**
 * Invalid setup: a bad section name, a handler attached twice, contradicting handler options.
 */
public class ConfigurationException extends TracerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
