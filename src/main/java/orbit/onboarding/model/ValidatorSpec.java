package orbit.onboarding.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Validator (vBond) to register.
 */
public record ValidatorSpec(
        @JsonProperty("ip") String ip,
        @JsonProperty("password") String password,
        @JsonProperty("site_id") Integer siteId,
        @JsonProperty("system_ip") String systemIp,
        @JsonProperty("hostname") String hostname) implements ControlComponentSpec {

    public ValidatorSpec {
        Objects.requireNonNull(ip, "ip is required");
        password = password == null ? DEFAULT_PASSWORD : password;
    }

    public static ValidatorSpec of(String ip, String password) {
        return new ValidatorSpec(ip, password, null, null, null);
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.VALIDATOR;
    }
}
