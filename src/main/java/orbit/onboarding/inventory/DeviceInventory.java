package orbit.onboarding.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;
import orbit.manager.config.ManagerEndpoint;
import orbit.onboarding.model.ControllerSpec;
import orbit.onboarding.model.EdgeSpec;
import orbit.onboarding.model.ValidatorSpec;

import java.util.List;
import java.util.Objects;

/**
 * Complete device inventory for one onboarding run.
 */
public record DeviceInventory(
        @JsonProperty("manager") ManagerEndpoint manager,
        @JsonProperty("controllers") List<ControllerSpec> controllers,
        @JsonProperty("validators") List<ValidatorSpec> validators,
        @JsonProperty("edges") List<EdgeSpec> edges) {

    public DeviceInventory {
        Objects.requireNonNull(manager, "manager is required");
        controllers = controllers == null ? List.of() : List.copyOf(controllers);
        validators = validators == null ? List.of() : List.copyOf(validators);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /** Inventory with a manager only, as used by backup and restore */
    public static DeviceInventory managerOnly(ManagerEndpoint manager) {
        return new DeviceInventory(manager, List.of(), List.of(), List.of());
    }

    public int totalDevices() {
        return controllers.size() + validators.size() + edges.size();
    }

    /** Number of controllers and validators */
    public int controlComponents() {
        return controllers.size() + validators.size();
    }
}
