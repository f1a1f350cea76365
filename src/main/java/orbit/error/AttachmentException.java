package orbit.error;

/**
 * A structural attachment call returned non-2xx, or the attachment job failed or timed out.
 */
public class AttachmentException extends ConfigurationException {

    public AttachmentException(String message) {
        super(message);
    }

    public AttachmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
