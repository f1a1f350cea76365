package orbit.error;

/**
 * Registration was accepted by the manager but the new device's identifier could not
 * be looked up afterwards.
 */
public class UnresolvedDeviceException extends OnboardingException {

    private final String deviceIp;

    public UnresolvedDeviceException(String deviceIp) {
        super("Device " + deviceIp + " was registered but its identifier could not be resolved");
        this.deviceIp = deviceIp;
    }

    public String deviceIp() {
        return deviceIp;
    }
}
