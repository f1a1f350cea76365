package orbit.onboarding.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Controller (vSmart) to register.
 */
public record ControllerSpec(
        @JsonProperty("ip") String ip,
        @JsonProperty("password") String password,
        @JsonProperty("site_id") Integer siteId,
        @JsonProperty("system_ip") String systemIp,
        @JsonProperty("hostname") String hostname) implements ControlComponentSpec {

    public ControllerSpec {
        Objects.requireNonNull(ip, "ip is required");
        password = password == null ? DEFAULT_PASSWORD : password;
    }

    public static ControllerSpec of(String ip, String password) {
        return new ControllerSpec(ip, password, null, null, null);
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.CONTROLLER;
    }
}
