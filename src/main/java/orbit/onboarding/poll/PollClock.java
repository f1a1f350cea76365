package orbit.onboarding.poll;

import java.time.Duration;

/**
 * Time source and sleeper for retry and poll loops.
 * Tests substitute a simulated clock whose sleep advances time.
 */
public interface PollClock {

    PollClock SYSTEM = new PollClock() {
        @Override
        public long millis() {
            return System.nanoTime() / 1_000_000L;
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            Thread.sleep(duration.toMillis());
        }
    };

    /** Monotonic milliseconds, only meaningful as a difference */
    long millis();

    void sleep(Duration duration) throws InterruptedException;
}
