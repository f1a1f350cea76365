package orbit.onboarding.model;

import java.util.HashSet;
import java.util.List;

/**
 * Device identifiers produced by one orchestration run, per device class,
 * in inventory order.
 */
public record OnboardingResult(List<String> controllers, List<String> validators, List<String> edges) {

    public OnboardingResult {
        controllers = distinct("controllers", controllers);
        validators = distinct("validators", validators);
        edges = distinct("edges", edges);
    }

    public static OnboardingResult empty() {
        return new OnboardingResult(List.of(), List.of(), List.of());
    }

    public int total() {
        return controllers.size() + validators.size() + edges.size();
    }

    private static List<String> distinct(String name, List<String> ids) {
        List<String> copy = List.copyOf(ids);
        if (new HashSet<>(copy).size() != copy.size()) {
            throw new IllegalArgumentException(name + " contains duplicate identifiers: " + copy);
        }
        return copy;
    }
}
