package orbit.manager.model;

import java.util.Locale;
import java.util.Set;

/**
 * Snapshot of a device read on a single poll tick. Never cached across polls.
 */
public record DeviceRuntimeState(String deviceId, String reachability, String certificateStatus) {

    private static final Set<String> INSTALLED = Set.of("certinstalled", "installed");

    public boolean isReachable() {
        return "reachable".equalsIgnoreCase(reachability);
    }

    public boolean isCertificateInstalled() {
        return certificateStatus != null && INSTALLED.contains(certificateStatus.toLowerCase(Locale.ROOT));
    }

    /** Composite readiness: reachable AND certificate installed */
    public boolean isReady() {
        return isReachable() && isCertificateInstalled();
    }
}
