package orbit.onboarding;

import orbit.backup.ConfigurationManager;
import orbit.backup.ManagerCatalogArchive;
import orbit.backup.NetworkHierarchyArchiver;
import orbit.error.OrchestrationException;
import orbit.manager.auth.SessionManager;
import orbit.manager.client.ManagerClient;
import orbit.manager.client.ManagerConnector;
import orbit.manager.client.http.HttpManagerConnector;
import orbit.onboarding.config.OrbitConfig;
import orbit.onboarding.core.OnboardingListener;
import orbit.onboarding.inventory.DeviceInventory;
import orbit.onboarding.inventory.InventoryLoader;
import orbit.onboarding.model.OnboardingResult;
import orbit.onboarding.poll.AbortSignal;
import orbit.onboarding.poll.PollClock;
import orbit.onboarding.poll.ReadinessPoller;
import orbit.onboarding.service.AttachmentCoordinator;
import orbit.onboarding.service.DeviceOnboarder;
import orbit.onboarding.service.JobTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for onboarding a fleet described by a {@link DeviceInventory}.
 *
 * Usage:
 *
 * <pre>
 * try (Orbit orbit = Orbit.fromFile(Path.of("inventory.yaml"))) {
 *     OnboardingResult result = orbit.onboard(true, true, Duration.ofMinutes(10));
 * }
 * </pre>
 *
 * One instance holds one manager session; phases run sequentially against it.
 */
public final class Orbit implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orbit.class);

    private final DeviceInventory inventory;
    private final OrbitConfig config;
    private final SessionManager sessionManager;
    private final PollClock clock;
    private final OnboardingListener listener;
    private final AbortSignal abortSignal = new AbortSignal();

    public Orbit(DeviceInventory inventory, OrbitConfig config, ManagerConnector connector, PollClock clock,
            OnboardingListener listener) {
        this.inventory = inventory;
        this.config = config;
        this.clock = clock;
        this.listener = listener == null ? OnboardingListener.NOOP : listener;
        this.sessionManager = new SessionManager(inventory.manager(), connector, clock,
                config.connectRetryInterval(), config.connectMaxAttempts());
    }

    /**
     * Load the inventory file and use the HTTP client with environment-based settings.
     */
    public static Orbit fromFile(Path path) {
        return fromInventory(InventoryLoader.load(path));
    }

    public static Orbit fromInventory(DeviceInventory inventory) {
        return fromInventory(inventory, OrbitConfig.fromEnv(), OnboardingListener.NOOP);
    }

    public static Orbit fromInventory(DeviceInventory inventory, OrbitConfig config, OnboardingListener listener) {
        return new Orbit(inventory, config, new HttpManagerConnector(), PollClock.SYSTEM, listener);
    }

    public DeviceInventory inventory() {
        return inventory;
    }

    public AbortSignal abortSignal() {
        return abortSignal;
    }

    /**
     * Onboard every device, bounding each readiness wait by the configured readiness timeout.
     */
    public OnboardingResult onboard(boolean skipExisting, boolean waitForReady) {
        return onboard(skipExisting, waitForReady, config.readinessTimeout());
    }

    /**
     * Onboard every device in the inventory.
     *
     * Order: connect, controllers, validators, control-plane wait, edges, edge wait.
     * The control-plane wait completes before any edge is touched.
     *
     * @param skipExisting  reuse devices that are already onboarded
     * @param waitForReady  wait for reachability and certificates after each plane
     * @param timeout       bound for each readiness wait
     * @throws OrchestrationException wrapping the first failure of any phase
     */
    public OnboardingResult onboard(boolean skipExisting, boolean waitForReady, Duration timeout) {
        log.info("Starting onboarding of {} device(s)", inventory.totalDevices());

        try {
            ManagerClient client = sessionManager.connect();
            DeviceOnboarder onboarder = onboarder(client);

            List<String> controllers = List.of();
            if (!inventory.controllers().isEmpty()) {
                log.info("Phase 1: onboarding controllers");
                controllers = onboarder.onboardControllers(inventory.controllers(), skipExisting);
            }

            List<String> validators = List.of();
            if (!inventory.validators().isEmpty()) {
                log.info("Phase 2: onboarding validators");
                validators = onboarder.onboardValidators(inventory.validators(), skipExisting);
            }

            if (waitForReady) {
                List<String> controlPlane = new ArrayList<>(controllers);
                controlPlane.addAll(validators);
                if (!controlPlane.isEmpty()) {
                    log.info("Waiting for control plane to be ready...");
                    onboarder.waitForOnboarding(controlPlane, timeout);
                }
            }

            List<String> edges = List.of();
            if (!inventory.edges().isEmpty()) {
                log.info("Phase 3: onboarding edges");
                edges = onboarder.onboardEdges(inventory.edges(), skipExisting);

                if (waitForReady && !edges.isEmpty()) {
                    log.info("Waiting for edges to be ready...");
                    onboarder.waitForOnboarding(edges, timeout);
                }
            }

            OnboardingResult result = new OnboardingResult(controllers, validators, edges);
            log.info("Onboarding completed: {} controllers, {} validators, {} edges",
                    controllers.size(), validators.size(), edges.size());
            return result;

        } catch (RuntimeException e) {
            throw new OrchestrationException("Onboarding failed: " + e.getMessage(), e);
        }
    }

    /**
     * Back up manager configuration to {@code outputDir}.
     */
    public boolean backup(Path outputDir, boolean backupMrf) {
        log.info("Backing up configuration to {}", outputDir);
        return configurationManager().backup(outputDir, List.of(), false, backupMrf);
    }

    /**
     * Restore manager configuration from {@code backupDir}.
     */
    public boolean restore(Path backupDir, boolean attach, boolean restoreMrf) {
        log.info("Restoring configuration from {}", backupDir);
        return configurationManager().restore(backupDir, List.of(), attach, restoreMrf);
    }

    private DeviceOnboarder onboarder(ManagerClient client) {
        ReadinessPoller poller = new ReadinessPoller(clock, abortSignal, listener, config.progressLogInterval());
        JobTracker jobTracker = new JobTracker(client, clock, abortSignal, config.pollInterval(),
                config.progressLogInterval());
        AttachmentCoordinator attachments = new AttachmentCoordinator(client, jobTracker, listener,
                config.taskTimeout());
        return new DeviceOnboarder(client, poller, attachments, listener, config);
    }

    private ConfigurationManager configurationManager() {
        ManagerClient client = sessionManager.connect();
        return new ConfigurationManager(new ManagerCatalogArchive(client), new NetworkHierarchyArchiver(client));
    }

    @Override
    public void close() {
        sessionManager.close();
    }
}
