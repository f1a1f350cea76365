package orbit.manager.auth;

import orbit.error.AuthenticationException;
import orbit.error.ConnectionFailedException;
import orbit.error.SessionException;
import orbit.manager.client.ManagerApiException;
import orbit.manager.client.ManagerClient;
import orbit.manager.client.ManagerConnector;
import orbit.manager.config.ManagerEndpoint;
import orbit.onboarding.poll.PollClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;

/**
 * Holds the single authenticated session to the manager.
 *
 * Connecting retries transient failures (refused connection, failed request) at a fixed
 * interval up to a bounded number of attempts. Rejected credentials and unexpected errors
 * are raised at once without using the retry budget.
 */
public class SessionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final ManagerEndpoint endpoint;
    private final ManagerConnector connector;
    private final PollClock clock;
    private final Duration retryInterval;
    private final int maxAttempts;

    private ManagerClient session;

    public SessionManager(ManagerEndpoint endpoint, ManagerConnector connector, PollClock clock,
            Duration retryInterval, int maxAttempts) {
        this.endpoint = endpoint;
        this.connector = connector;
        this.clock = clock;
        this.retryInterval = retryInterval;
        this.maxAttempts = maxAttempts;
    }

    public ManagerEndpoint endpoint() {
        return endpoint;
    }

    /**
     * Connect with the configured attempt budget.
     */
    public ManagerClient connect() {
        return connect(null);
    }

    /**
     * Connect, retrying transient failures.
     *
     * @param timeout when set, overrides the attempt budget with {@code timeout / retryInterval}
     * @return the live session
     * @throws AuthenticationException   if the manager rejects the credentials
     * @throws ConnectionFailedException if every attempt failed transiently
     * @throws SessionException          on any other failure
     */
    public synchronized ManagerClient connect(Duration timeout) {
        if (session != null) {
            return session;
        }

        int attempts = attemptBudget(timeout);
        log.info("Connecting to manager at {}", endpoint.baseUrl());

        Exception lastFailure = null;
        int attempt = 0;
        while (attempt < attempts) {
            attempt++;
            try {
                session = connector.connect(endpoint);
                log.info("Successfully connected to manager");
                return session;
            } catch (ConnectException e) {
                lastFailure = e;
            } catch (IOException | ManagerApiException e) {
                if (isUnauthorized(e)) {
                    throw new AuthenticationException(
                            "Authentication failed for user '" + endpoint.username() + "'", e);
                }
                lastFailure = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SessionException("Interrupted while connecting to manager", e);
            } catch (RuntimeException e) {
                throw new SessionException("Unexpected error connecting to manager: " + e.getMessage(), e);
            }

            log.debug("Connection attempt {}/{} failed: {}", attempt, attempts, lastFailure.getMessage());
            if (attempt % 10 == 0) {
                log.info("Waiting for manager API (attempt {}/{})...", attempt, attempts);
            }
            if (attempt < attempts) {
                pause();
            }
        }

        throw new ConnectionFailedException("Failed to connect to manager after " + attempts + " attempts. "
                + "Last error: " + (lastFailure == null ? "none" : lastFailure.getMessage()), attempts, lastFailure);
    }

    private int attemptBudget(Duration timeout) {
        if (timeout == null) {
            return maxAttempts;
        }
        long intervalMs = Math.max(1, retryInterval.toMillis());
        return (int) Math.max(1, timeout.toMillis() / intervalMs);
    }

    private static boolean isUnauthorized(Exception e) {
        if (e instanceof ManagerApiException) {
            return ((ManagerApiException) e).isAuthenticationFailure();
        }
        String message = String.valueOf(e.getMessage());
        return message.contains("401") || message.contains("Unauthorized");
    }

    private void pause() {
        try {
            clock.sleep(retryInterval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException("Interrupted while waiting to reconnect", e);
        }
    }

    /**
     * Current session, or null when not connected.
     */
    public synchronized ManagerClient session() {
        return session;
    }

    public synchronized boolean isConnected() {
        return session != null;
    }

    /**
     * Close the session. Safe to call repeatedly or when never connected.
     */
    @Override
    public synchronized void close() {
        if (session == null) {
            log.debug("No active session to close");
            return;
        }
        try {
            log.debug("Closing manager session");
            session.close();
        } catch (RuntimeException e) {
            log.warn("Error closing manager session: {}", e.getMessage());
        } finally {
            session = null;
        }
    }
}
