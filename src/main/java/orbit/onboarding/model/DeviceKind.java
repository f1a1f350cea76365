package orbit.onboarding.model;

/**
 * Device classes handled by the onboarder, in onboarding order.
 */
public enum DeviceKind {
    /** Controller (vSmart), registered by management IP */
    CONTROLLER("vsmart", "controller"),
    /** Validator (vBond), registered by management IP */
    VALIDATOR("vbond", "validator"),
    /** WAN edge, discovered by zero-touch bootstrap and matched by serial */
    EDGE(null, "edge");

    private final String personality;
    private final String label;

    DeviceKind(String personality, String label) {
        this.personality = personality;
        this.label = label;
    }

    /** Registration personality, null for edges */
    public String personality() {
        return personality;
    }

    public String label() {
        return label;
    }

    public boolean isControlPlane() {
        return this != EDGE;
    }
}
