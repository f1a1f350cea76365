package orbit.onboarding.poll;

/**
 * Remote-observable predicate evaluated per device on each sweep.
 * Throwing means "not yet known" and is never fatal.
 */
@FunctionalInterface
public interface ReadinessCheck {

    boolean isReady(String deviceId) throws Exception;
}
