package orbit.cli;

import orbit.onboarding.core.OnboardingListener;
import orbit.onboarding.model.DeviceKind;

import java.io.PrintWriter;

/**
 * Prints onboarding milestones for the operator.
 */
class ConsoleListener implements OnboardingListener {

    private final PrintWriter out;

    ConsoleListener(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void deviceOnboarded(DeviceKind kind, String identity, String deviceId) {
        print("  + " + kind.label() + " " + identity + " onboarded (" + deviceId + ")");
    }

    @Override
    public void deviceSkipped(DeviceKind kind, String identity, String deviceId) {
        print("  = " + kind.label() + " " + identity + " already onboarded (" + deviceId + ")");
    }

    @Override
    public void deviceReady(String deviceId, int readyCount, int total) {
        print("  " + deviceId + " ready (" + readyCount + "/" + total + ")");
    }

    @Override
    public void waiting(String what, int pendingCount, long elapsedSeconds) {
        print("  waiting for " + pendingCount + " device(s) to " + what + " (" + elapsedSeconds + "s)");
    }

    @Override
    public void attached(String deviceId, String artifactName) {
        print("  " + artifactName + " attached to " + deviceId);
    }

    private void print(String line) {
        out.println(line);
        out.flush();
    }
}
