package orbit.manager.client;

import orbit.manager.config.ManagerEndpoint;

import java.io.IOException;

/**
 * Opens authenticated sessions against a manager endpoint.
 */
@FunctionalInterface
public interface ManagerConnector {

    /**
     * Log in and return a live session.
     *
     * @throws java.net.ConnectException when the endpoint refuses the connection
     * @throws IOException               on other transport failures
     * @throws ManagerApiException       when the manager answers with an error, including
     *                                   credential rejection
     * @throws InterruptedException      when interrupted while waiting on the network
     */
    ManagerClient connect(ManagerEndpoint endpoint) throws IOException, InterruptedException;
}
