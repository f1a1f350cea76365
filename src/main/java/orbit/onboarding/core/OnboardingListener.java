package orbit.onboarding.core;

import orbit.onboarding.model.DeviceKind;

/**
 * Observer for onboarding milestones. Passed explicitly through constructors;
 * every callback has a no-op default so listeners override only what they need.
 *
 * Callbacks run on the onboarding thread and must not throw.
 */
public interface OnboardingListener {

    OnboardingListener NOOP = new OnboardingListener() {
    };

    /** A device was registered (control plane) or found in inventory (edge) */
    default void deviceOnboarded(DeviceKind kind, String identity, String deviceId) {
    }

    /** A device was already onboarded and reused */
    default void deviceSkipped(DeviceKind kind, String identity, String deviceId) {
    }

    /** A polled device satisfied its predicate */
    default void deviceReady(String deviceId, int readyCount, int total) {
    }

    /** Periodic progress of a poll, at coarse intervals */
    default void waiting(String what, int pendingCount, long elapsedSeconds) {
    }

    /** A configuration artifact was attached */
    default void attached(String deviceId, String artifactName) {
    }
}
