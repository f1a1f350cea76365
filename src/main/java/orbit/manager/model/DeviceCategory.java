package orbit.manager.model;

/**
 * Inventory partitions exposed by the manager.
 */
public enum DeviceCategory {
    /** Controllers and validators (and the manager itself) */
    CONTROLLERS("controllers"),
    /** WAN edge devices */
    EDGES("vedges");

    private final String path;

    DeviceCategory(String path) {
        this.path = path;
    }

    /** Path segment used by the manager's device inventory endpoints */
    public String path() {
        return path;
    }
}
