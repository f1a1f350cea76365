package orbit.error;

/**
 * Raised when a configuration artifact operation fails.
 */
public class ConfigurationException extends OrbitException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
