package orbit.error;

/**
 * A device named by serial or identifier is absent from the manager inventory.
 * Aborts the current edge batch.
 */
public class DeviceNotFoundException extends OnboardingException {

    private final String device;

    public DeviceNotFoundException(String device, String message) {
        super(message);
        this.device = device;
    }

    public String device() {
        return device;
    }
}
