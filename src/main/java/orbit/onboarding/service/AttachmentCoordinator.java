package orbit.onboarding.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import orbit.error.AttachmentException;
import orbit.error.ConfigGroupNotFoundException;
import orbit.error.DeviceNotFoundException;
import orbit.error.OrbitException;
import orbit.error.TemplateNotFoundException;
import orbit.manager.client.ManagerClient;
import orbit.manager.model.ApiResponse;
import orbit.manager.model.DeviceCategory;
import orbit.manager.model.DeviceRecord;
import orbit.manager.model.NamedResource;
import orbit.manager.model.TemplateAttachment;
import orbit.onboarding.core.OnboardingListener;
import orbit.onboarding.model.AttachmentJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches configuration profiles to edge devices.
 *
 * Two generations are supported and are mutually exclusive per device:
 * <ul>
 * <li>legacy device templates: resolve by name, submit a flat variable record, track the
 * returned job to completion</li>
 * <li>config-groups: resolve by name, associate the device, then push variables
 * (best-effort)</li>
 * </ul>
 */
public class AttachmentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AttachmentCoordinator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Keys projected into the fixed template variables, never copied verbatim */
    static final Set<String> RESERVED_KEYS = Set.of("system_ip", "site_id");

    private final ManagerClient client;
    private final JobTracker jobTracker;
    private final OnboardingListener listener;
    private final Duration taskTimeout;

    public AttachmentCoordinator(ManagerClient client, JobTracker jobTracker, OnboardingListener listener,
            Duration taskTimeout) {
        this.client = client;
        this.jobTracker = jobTracker;
        this.listener = listener;
        this.taskTimeout = taskTimeout;
    }

    /**
     * Attach a legacy device template and wait for the attach job.
     *
     * @param variables must carry {@code system_ip} and {@code site_id}; other entries are
     *                  passed through as template variables
     * @return the finished job
     * @throws TemplateNotFoundException if no template has that name
     * @throws DeviceNotFoundException   if the device is not in the edge inventory
     * @throws AttachmentException       on a non-2xx submit, a failed job or a timeout
     */
    public AttachmentJob attachTemplate(String deviceId, String templateName, Map<String, Object> variables) {
        log.info("Attaching template '{}' to device {}", templateName, deviceId);

        try {
            String templateId = findByName(client.listTemplates(), templateName);
            if (templateId == null) {
                throw new TemplateNotFoundException(templateName);
            }
            log.debug("Found template '{}' with ID {}", templateName, templateId);

            DeviceRecord device = client.listDevices(DeviceCategory.EDGES).stream()
                    .filter(d -> deviceId.equals(d.id()))
                    .findFirst()
                    .orElseThrow(() -> new DeviceNotFoundException(deviceId, "Device " + deviceId + " not found"));

            TemplateAttachment attachment = new TemplateAttachment(templateId,
                    templateVariables(device, templateId, variables));

            ApiResponse response = client.submitTemplateAttach(attachment);
            if (!response.isSuccess()) {
                throw new AttachmentException("Failed to attach template: "
                        + response.statusCode() + " - " + response.body());
            }

            String jobId = extractJobId(response);
            log.info("Template attachment initiated, task ID: {}", jobId);

            AttachmentJob job = jobTracker.await(jobId, taskTimeout);

            log.info("Template '{}' attached successfully to {}", templateName, deviceId);
            listener.attached(deviceId, templateName);
            return job;

        } catch (OrbitException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AttachmentException("Failed to attach template '" + templateName + "': " + e.getMessage(), e);
        }
    }

    /**
     * Associate a device with a config-group and push its variables.
     *
     * A failed variable push is logged and ignored: association is the structural step.
     *
     * @throws ConfigGroupNotFoundException if no config-group has that name
     * @throws AttachmentException          if association is rejected
     */
    public void attachConfigGroup(String deviceId, String groupName, Map<String, Object> variables) {
        log.info("Attaching config-group '{}' to device {}", groupName, deviceId);

        try {
            String groupId = findByName(client.listConfigGroups(), groupName);
            if (groupId == null) {
                throw new ConfigGroupNotFoundException(groupName);
            }
            log.debug("Found config-group '{}' with ID {}", groupName, groupId);

            ApiResponse associated = client.associateDevice(groupId, deviceId);
            if (!associated.isSuccess()) {
                throw new AttachmentException("Failed to associate device with config-group: "
                        + associated.statusCode() + " - " + associated.body());
            }

            if (!variables.isEmpty()) {
                pushVariables(groupId, deviceId, variables);
            }

            log.info("Config-group '{}' attached successfully to {}", groupName, deviceId);
            listener.attached(deviceId, groupName);

        } catch (OrbitException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AttachmentException("Failed to attach config-group '" + groupName + "': " + e.getMessage(), e);
        }
    }

    private void pushVariables(String groupId, String deviceId, Map<String, Object> variables) {
        try {
            ApiResponse pushed = client.pushVariables(groupId, deviceId, variables);
            if (!pushed.isSuccess()) {
                log.warn("Failed to deploy variables for device {}: {} - {}",
                        deviceId, pushed.statusCode(), pushed.body());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to deploy variables for device {}: {}", deviceId, e.getMessage());
        }
    }

    /**
     * Flat variable record for a legacy template attach.
     * Fixed keys first, then the caller's extra variables minus the reserved ones.
     */
    static Map<String, Object> templateVariables(DeviceRecord device, String templateId,
            Map<String, Object> variables) {
        Object systemIp = variables.get("system_ip");
        Object siteId = variables.get("site_id");
        String hostName = device.hostName() != null && !device.hostName().isBlank()
                ? device.hostName()
                : "Edge" + siteId;
        String deviceIp = device.managementIp() != null && !device.managementIp().isBlank()
                ? device.managementIp()
                : systemIp == null ? null : String.valueOf(systemIp);

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("csv-status", "complete");
        record.put("csv-deviceId", device.id());
        record.put("csv-deviceIP", deviceIp);
        record.put("csv-host-name", hostName);
        record.put("//system/host-name", hostName);
        record.put("//system/system-ip", systemIp == null ? null : String.valueOf(systemIp));
        record.put("//system/site-id", String.valueOf(siteId));
        record.put("csv-templateId", templateId);

        variables.forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key)) {
                record.put(key, value);
            }
        });
        return record;
    }

    /** First exact name match wins */
    private static String findByName(List<NamedResource> catalog, String name) {
        for (NamedResource resource : catalog) {
            if (name.equals(resource.name())) {
                return resource.id();
            }
        }
        return null;
    }

    private static String extractJobId(ApiResponse response) {
        JsonNode body;
        try {
            body = MAPPER.readTree(response.body() == null ? "" : response.body());
        } catch (IOException e) {
            throw new AttachmentException("Unreadable template attach response: " + response.body(), e);
        }
        JsonNode id = body == null ? null : body.get("id");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            throw new AttachmentException("Template attach response carries no task id: " + response.body());
        }
        return id.asText();
    }
}
