package orbit.onboarding.model;

/**
 * Common shape of controllers and validators: registered by management IP with a
 * device password.
 */
public interface ControlComponentSpec extends DeviceSpec {

    String DEFAULT_PASSWORD = "admin";

    String ip();

    /** Initial device password; never null */
    String password();

    String systemIp();

    String hostname();

    @Override
    default String identity() {
        return ip();
    }
}
