package orbit.onboarding.model;

/**
 * Desired state of one device in the inventory.
 * One implementation per device class.
 */
public interface DeviceSpec {

    DeviceKind kind();

    /** Management IP for control components, hardware serial for edges */
    String identity();

    Integer siteId();
}
