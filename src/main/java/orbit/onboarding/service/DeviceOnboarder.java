package orbit.onboarding.service;

import orbit.error.CredentialException;
import orbit.error.DeviceNotFoundException;
import orbit.error.OnboardingException;
import orbit.error.OperationCancelledException;
import orbit.error.UnresolvedDeviceException;
import orbit.manager.client.ManagerApiException;
import orbit.manager.client.ManagerClient;
import orbit.manager.model.DeviceCategory;
import orbit.manager.model.DeviceRecord;
import orbit.manager.model.DeviceRegistration;
import orbit.onboarding.config.OrbitConfig;
import orbit.onboarding.core.OnboardingListener;
import orbit.onboarding.model.ControlComponentSpec;
import orbit.onboarding.model.ControllerSpec;
import orbit.onboarding.model.DeviceKind;
import orbit.onboarding.model.EdgeSpec;
import orbit.onboarding.model.ValidatorSpec;
import orbit.onboarding.poll.ReadinessPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Onboards control-plane and edge devices.
 *
 * Control components (controllers, validators) are registered by management IP with an
 * ordered list of credential candidates. Edges are never registered here: they appear in
 * the inventory through zero-touch bootstrap, and this class confirms them by serial,
 * waits for their certificate and attaches their configuration profile.
 *
 * Devices are processed sequentially; returned ids keep inventory order.
 */
public class DeviceOnboarder {

    private static final Logger log = LoggerFactory.getLogger(DeviceOnboarder.class);

    private final ManagerClient client;
    private final ReadinessPoller poller;
    private final AttachmentCoordinator attachments;
    private final OnboardingListener listener;
    private final OrbitConfig config;

    public DeviceOnboarder(ManagerClient client, ReadinessPoller poller, AttachmentCoordinator attachments,
            OnboardingListener listener, OrbitConfig config) {
        this.client = client;
        this.poller = poller;
        this.attachments = attachments;
        this.listener = listener;
        this.config = config;
    }

    /**
     * Onboard controllers.
     *
     * @param skipExisting reuse controllers whose management IP is already onboarded
     * @return device ids in input order
     */
    public List<String> onboardControllers(List<ControllerSpec> controllers, boolean skipExisting) {
        return onboardControlComponents(DeviceKind.CONTROLLER, controllers, skipExisting);
    }

    /**
     * Onboard validators.
     *
     * @param skipExisting reuse validators whose management IP is already onboarded
     * @return device ids in input order
     */
    public List<String> onboardValidators(List<ValidatorSpec> validators, boolean skipExisting) {
        return onboardControlComponents(DeviceKind.VALIDATOR, validators, skipExisting);
    }

    private List<String> onboardControlComponents(DeviceKind kind, List<? extends ControlComponentSpec> specs,
            boolean skipExisting) {
        log.info("Onboarding {} {}(s)", specs.size(), kind.label());

        OnboardedDeviceIndex existing = skipExisting ? OnboardedDeviceIndex.scan(client) : OnboardedDeviceIndex.empty();

        List<String> deviceIds = new ArrayList<>();
        int i = 0;
        for (ControlComponentSpec spec : specs) {
            i++;
            log.info("Processing {} {}/{}: {}", kind.label(), i, specs.size(), spec.ip());

            if (existing.contains(spec.ip())) {
                Optional<String> existingId = existing.deviceIdFor(spec.ip());
                if (existingId.isPresent()) {
                    log.info("{} {} already onboarded, skipping", capitalize(kind.label()), spec.ip());
                    append(deviceIds, existingId.get());
                    listener.deviceSkipped(kind, spec.ip(), existingId.get());
                    continue;
                }
                log.warn("{} {} looks onboarded but has no known identifier, registering it",
                        capitalize(kind.label()), spec.ip());
            }

            try {
                String deviceId = registerControlComponent(kind, spec);
                append(deviceIds, deviceId);
                listener.deviceOnboarded(kind, spec.ip(), deviceId);
                log.info("Successfully onboarded {} {}", kind.label(), spec.ip());
            } catch (CredentialException | UnresolvedDeviceException | OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new OnboardingException(
                        "Failed to onboard " + kind.label() + " " + spec.ip() + ": " + e.getMessage(), e);
            }
        }

        return deviceIds;
    }

    /**
     * Register one control component, trying each credential candidate in order.
     * Only an authentication rejection moves on to the next candidate.
     *
     * @return the identifier the manager assigned
     * @throws CredentialException        if every candidate was rejected
     * @throws UnresolvedDeviceException  if registration succeeded but the id lookup did not
     * @throws ManagerApiException        on a non-credential rejection
     */
    public String registerControlComponent(DeviceKind kind, ControlComponentSpec spec) {
        List<ManagerApiException> rejected = new ArrayList<>();
        boolean registered = false;

        for (String password : credentialCandidates(spec)) {
            DeviceRegistration registration = new DeviceRegistration(
                    spec.ip(), config.deviceUsername(), password, kind.personality());
            try {
                log.debug("Trying credential candidate {} for {}", rejected.size() + 1, spec.ip());
                client.createDevice(registration);
                registered = true;
                break;
            } catch (ManagerApiException e) {
                if (!e.isAuthenticationFailure()) {
                    throw e;
                }
                log.debug("Credential candidate {} rejected by {}", rejected.size() + 1, spec.ip());
                rejected.add(e);
            }
        }

        if (!registered) {
            throw new CredentialException(spec.ip(), rejected);
        }

        return findControlComponentId(spec.ip())
                .orElseThrow(() -> new UnresolvedDeviceException(spec.ip()));
    }

    /** Default password first, then the device's own, without repeats */
    List<String> credentialCandidates(ControlComponentSpec spec) {
        LinkedHashSet<String> candidates = new LinkedHashSet<>();
        candidates.add(config.defaultDevicePassword());
        candidates.add(spec.password());
        return List.copyOf(candidates);
    }

    private Optional<String> findControlComponentId(String ip) {
        try {
            return client.listDevices(DeviceCategory.CONTROLLERS).stream()
                    .filter(d -> ip.equals(d.managementIp()))
                    .map(DeviceRecord::id)
                    .findFirst();
        } catch (RuntimeException e) {
            log.debug("Error finding device by IP {}: {}", ip, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Confirm edges that completed zero-touch discovery, wait for their certificate and
     * attach their template or config-group.
     *
     * A serial missing from the inventory aborts the whole batch.
     *
     * @return device ids in input order
     * @throws DeviceNotFoundException if an edge is not in the manager inventory
     * @throws OnboardingException     on any other per-device failure, naming the serial
     */
    public List<String> onboardEdges(List<EdgeSpec> edges, boolean skipExisting) {
        log.info("Onboarding {} edge device(s)", edges.size());

        List<String> deviceIds = new ArrayList<>();
        int i = 0;
        for (EdgeSpec edge : edges) {
            i++;
            log.info("Processing edge {}/{}: serial={}, system_ip={}, site_id={}",
                    i, edges.size(), edge.serial(), edge.systemIp(), edge.siteId());

            try {
                DeviceRecord device = findEdge(edge.serial()).orElseThrow(() -> new DeviceNotFoundException(
                        edge.serial(),
                        "Edge device with serial " + edge.serial() + " not found in manager inventory. "
                                + "Ensure the device has discovered the validator and appears in device inventory."));
                String deviceId = device.id();

                if (skipExisting && device.isCertificateInstalled()) {
                    log.info("Edge {} ({}) already has certificate installed, skipping", edge.serial(), deviceId);
                    append(deviceIds, deviceId);
                    listener.deviceSkipped(DeviceKind.EDGE, edge.serial(), deviceId);
                    continue;
                }

                waitForCertificate(deviceId);
                append(deviceIds, deviceId);
                listener.deviceOnboarded(DeviceKind.EDGE, edge.serial(), deviceId);
                log.info("Edge {} certificate installed successfully", edge.serial());

                attach(edge, deviceId);

            } catch (DeviceNotFoundException | OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new OnboardingException("Failed to onboard edge " + edge.serial() + ": " + e.getMessage(), e);
            }
        }

        log.info("Successfully onboarded {} edge device(s)", deviceIds.size());
        return deviceIds;
    }

    private void attach(EdgeSpec edge, String deviceId) {
        if (edge.templateName() != null) {
            log.info("Attaching template '{}' to edge {}", edge.templateName(), edge.serial());
            attachments.attachTemplate(deviceId, edge.templateName(), edge.attachmentVariables());
        } else if (edge.configGroup() != null) {
            log.info("Attaching config-group '{}' to edge {}", edge.configGroup(), edge.serial());
            attachments.attachConfigGroup(deviceId, edge.configGroup(), edge.attachmentVariables());
        } else {
            log.info("No template or config-group specified for edge {}, skipping attachment", edge.serial());
        }
    }

    private Optional<DeviceRecord> findEdge(String serialOrId) {
        for (DeviceRecord device : client.listDevices(DeviceCategory.EDGES)) {
            if (device.matches(serialOrId)) {
                log.debug("Found edge device: serial={}, id={}", serialOrId, device.id());
                return Optional.of(device);
            }
        }
        return Optional.empty();
    }

    /**
     * Block until the edge reports its certificate installed.
     */
    public void waitForCertificate(String deviceId) {
        poller.waitUntilReady(List.of(deviceId), this::isCertificateInstalled,
                config.certificateTimeout(), config.pollInterval(), "install certificates");
    }

    private boolean isCertificateInstalled(String deviceId) {
        return client.listDevices(DeviceCategory.EDGES).stream()
                .filter(d -> deviceId.equals(d.id()))
                .findFirst()
                .map(DeviceRecord::isCertificateInstalled)
                .orElse(false);
    }

    /**
     * Block until every device is reachable with its certificate installed.
     */
    public void waitForOnboarding(Collection<String> deviceIds, Duration timeout) {
        poller.waitUntilReady(deviceIds, id -> client.getDeviceState(id).isReady(),
                timeout, config.pollInterval(), "complete onboarding");
    }

    private static void append(List<String> deviceIds, String deviceId) {
        if (deviceIds.contains(deviceId)) {
            log.warn("Device {} listed more than once in this batch, keeping the first", deviceId);
            return;
        }
        deviceIds.add(deviceId);
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
