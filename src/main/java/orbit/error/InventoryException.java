package orbit.error;

/**
 * Device inventory could not be read, parsed or validated.
 */
public class InventoryException extends OrbitException {

    public InventoryException(String message) {
        super(message);
    }

    public InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
