package orbit.onboarding.service;

import orbit.manager.client.FakeManagerClient;
import orbit.onboarding.config.OrbitConfig;
import orbit.onboarding.core.OnboardingListener;
import orbit.onboarding.poll.AbortSignal;
import orbit.onboarding.poll.FakePollClock;
import orbit.onboarding.poll.ReadinessPoller;

import java.time.Duration;

/**
 * Wires the onboarding services against a fake manager and a simulated clock.
 */
class OnboardingFixture {

    final FakeManagerClient client = new FakeManagerClient();
    final FakePollClock clock = new FakePollClock();
    final AbortSignal abortSignal = new AbortSignal();
    final OrbitConfig config = OrbitConfig.defaults();

    JobTracker jobTracker() {
        return new JobTracker(client, clock, abortSignal, config.pollInterval(), config.progressLogInterval());
    }

    AttachmentCoordinator attachments() {
        return new AttachmentCoordinator(client, jobTracker(), OnboardingListener.NOOP, config.taskTimeout());
    }

    DeviceOnboarder onboarder() {
        ReadinessPoller poller = new ReadinessPoller(clock, abortSignal, OnboardingListener.NOOP,
                Duration.ofSeconds(30));
        return new DeviceOnboarder(client, poller, attachments(), OnboardingListener.NOOP, config);
    }
}
