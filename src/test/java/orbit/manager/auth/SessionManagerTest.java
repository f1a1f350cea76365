package orbit.manager.auth;

import orbit.error.AuthenticationException;
import orbit.error.ConnectionFailedException;
import orbit.error.SessionException;
import orbit.manager.client.FakeManagerClient;
import orbit.manager.client.ManagerApiException;
import orbit.manager.client.ManagerConnector;
import orbit.manager.config.ManagerEndpoint;
import orbit.onboarding.poll.FakePollClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {

    private static final ManagerEndpoint ENDPOINT = ManagerEndpoint.of("vmanage.example.com", "admin", "secret", 443);
    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private FakePollClock clock;
    private AtomicInteger attempts;

    @BeforeEach
    void setUp() {
        clock = new FakePollClock();
        attempts = new AtomicInteger();
    }

    private SessionManager manager(ManagerConnector connector, int maxAttempts) {
        return new SessionManager(ENDPOINT, connector, clock, INTERVAL, maxAttempts);
    }

    @Test
    void connectsOnFirstAttempt() {
        FakeManagerClient client = new FakeManagerClient();
        SessionManager sessions = manager(endpoint -> {
            attempts.incrementAndGet();
            return client;
        }, 5);

        assertSame(client, sessions.connect());
        assertTrue(sessions.isConnected());
        assertEquals(1, attempts.get());
        assertEquals(0, clock.sleepCount());
    }

    @Test
    @DisplayName("Refused connections are retried at the fixed interval")
    void retriesTransientFailures() {
        FakeManagerClient client = new FakeManagerClient();
        SessionManager sessions = manager(endpoint -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ConnectException("Connection refused");
            }
            return client;
        }, 5);

        assertSame(client, sessions.connect());
        assertEquals(3, attempts.get());
        assertEquals(2, clock.sleepCount());
        assertEquals(INTERVAL, clock.sleeps.get(0));
    }

    @Test
    void genericRequestFailuresAreRetried() {
        FakeManagerClient client = new FakeManagerClient();
        SessionManager sessions = manager(endpoint -> {
            if (attempts.incrementAndGet() == 1) {
                throw new ManagerApiException(502, "bad gateway", "server starting");
            }
            return client;
        }, 5);

        assertSame(client, sessions.connect());
        assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Exhausted retries raise a connection failure with the last cause")
    void exhaustedRetries() {
        SessionManager sessions = manager(endpoint -> {
            attempts.incrementAndGet();
            throw new ConnectException("Connection refused");
        }, 4);

        ConnectionFailedException e = assertThrows(ConnectionFailedException.class, sessions::connect);

        assertEquals(4, attempts.get());
        assertEquals(4, e.attempts());
        assertEquals(3, clock.sleepCount());
        assertInstanceOf(ConnectException.class, e.getCause());
        assertTrue(e.getMessage().contains("after 4 attempts"));
        assertFalse(sessions.isConnected());
    }

    @Test
    void timeoutOverridesAttemptBudget() {
        SessionManager sessions = manager(endpoint -> {
            attempts.incrementAndGet();
            throw new IOException("timed out");
        }, 120);

        assertThrows(ConnectionFailedException.class, () -> sessions.connect(Duration.ofSeconds(90)));

        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("Rejected credentials fail at once without retrying")
    void authenticationFailureIsTerminal() {
        SessionManager sessions = manager(endpoint -> {
            attempts.incrementAndGet();
            throw new ManagerApiException(401, null, "Login rejected: unauthorized");
        }, 10);

        AuthenticationException e = assertThrows(AuthenticationException.class, sessions::connect);

        assertEquals(1, attempts.get());
        assertEquals(0, clock.sleepCount());
        assertTrue(e.getMessage().contains("'admin'"));
    }

    @Test
    void unexpectedFailureIsNotRetried() {
        SessionManager sessions = manager(endpoint -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bad state");
        }, 10);

        SessionException e = assertThrows(SessionException.class, sessions::connect);

        assertFalse(e instanceof ConnectionFailedException);
        assertFalse(e instanceof AuthenticationException);
        assertEquals(1, attempts.get());
    }

    @Test
    void reusesLiveSession() {
        SessionManager sessions = manager(endpoint -> {
            attempts.incrementAndGet();
            return new FakeManagerClient();
        }, 5);

        assertSame(sessions.connect(), sessions.connect());
        assertEquals(1, attempts.get());
    }

    @Test
    void closeIsIdempotent() {
        FakeManagerClient client = new FakeManagerClient();
        SessionManager sessions = manager(endpoint -> client, 5);

        sessions.close();
        sessions.connect();
        sessions.close();
        sessions.close();

        assertEquals(1, client.closeCount);
        assertFalse(sessions.isConnected());
        assertNull(sessions.session());
    }
}
