package orbit.manager.model;

import java.util.Objects;

/**
 * Request to register a control component with the manager.
 *
 * @param personality "vsmart" for controllers, "vbond" for validators
 */
public record DeviceRegistration(String deviceIp, String username, String password, String personality) {

    public DeviceRegistration {
        Objects.requireNonNull(deviceIp, "deviceIp is required");
        Objects.requireNonNull(username, "username is required");
        Objects.requireNonNull(password, "password is required");
        Objects.requireNonNull(personality, "personality is required");
    }

    @Override
    public String toString() {
        // password omitted
        return "DeviceRegistration{deviceIp='" + deviceIp + "', username='" + username
                + "', personality='" + personality + "'}";
    }
}
