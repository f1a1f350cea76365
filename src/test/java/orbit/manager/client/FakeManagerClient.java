package orbit.manager.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import orbit.manager.model.ApiResponse;
import orbit.manager.model.DeviceCategory;
import orbit.manager.model.DeviceRecord;
import orbit.manager.model.DeviceRegistration;
import orbit.manager.model.DeviceRuntimeState;
import orbit.manager.model.JobStatusReport;
import orbit.manager.model.NamedResource;
import orbit.manager.model.TemplateAttachment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * In-memory manager for tests. Every call is appended to {@link #calls} so tests can assert
 * on ordering.
 */
public class FakeManagerClient implements ManagerClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String JOB_READ_ERROR = "!error";

    public final List<String> calls = new ArrayList<>();

    private final Map<DeviceCategory, Map<String, DeviceRecord>> devices = new EnumMap<>(DeviceCategory.class);
    private final Map<String, String> attachedConfig = new HashMap<>();
    private final Set<String> unreadableConfig = new HashSet<>();
    private final Map<String, DeviceRuntimeState> states = new HashMap<>();
    private final Set<DeviceCategory> unreadableCategories = new HashSet<>();

    public final List<NamedResource> templates = new ArrayList<>();
    public final List<NamedResource> configGroups = new ArrayList<>();
    public final Map<String, JsonNode> templateDefinitions = new HashMap<>();

    // registration
    public final List<DeviceRegistration> registrations = new ArrayList<>();
    public Function<DeviceRegistration, RuntimeException> registrationOutcome = r -> null;
    public final Map<String, String> idOnRegistration = new HashMap<>();

    // attachment
    public final List<TemplateAttachment> templateAttachments = new ArrayList<>();
    public ApiResponse templateAttachResponse = new ApiResponse(200, "{\"id\":\"job-1\"}");
    public final List<String> associations = new ArrayList<>();
    public ApiResponse associateResponse = new ApiResponse(200, "{}");
    public final List<Map<String, Object>> pushedVariables = new ArrayList<>();
    public ApiResponse pushResponse = new ApiResponse(200, "{}");
    public RuntimeException pushFailure;

    // jobs
    public final Deque<String> jobStatuses = new ArrayDeque<>();
    public String defaultJobStatus = "Success";
    public int jobStatusReads;

    // server / hierarchy / catalog
    public String serverVersion = "20.12.1";
    public final List<JsonNode> hierarchy = new ArrayList<>();
    public final List<JsonNode> createdHierarchyNodes = new ArrayList<>();
    public final List<JsonNode> createdTemplates = new ArrayList<>();
    public final List<JsonNode> createdConfigGroups = new ArrayList<>();
    public RuntimeException hierarchyFailure;

    public int closeCount;

    public FakeManagerClient() {
        for (DeviceCategory category : DeviceCategory.values()) {
            devices.put(category, new LinkedHashMap<>());
        }
    }

    // ---- setup ----

    public FakeManagerClient withDevice(DeviceCategory category, DeviceRecord device) {
        devices.get(category).put(device.id(), device);
        return this;
    }

    public FakeManagerClient withController(String id, String managementIp) {
        return withDevice(DeviceCategory.CONTROLLERS, DeviceRecord.builder().id(id).managementIp(managementIp).build());
    }

    public FakeManagerClient withEdge(String id, String serial, String certificateStatus) {
        return withDevice(DeviceCategory.EDGES, DeviceRecord.builder()
                .id(id)
                .serialNumber(serial)
                .certificateStatus(certificateStatus)
                .build());
    }

    public FakeManagerClient withAttachedConfig(String deviceId, String config) {
        attachedConfig.put(deviceId, config);
        return this;
    }

    public FakeManagerClient withUnreadableConfig(String deviceId) {
        unreadableConfig.add(deviceId);
        return this;
    }

    public FakeManagerClient withUnreadableInventory(DeviceCategory category) {
        unreadableCategories.add(category);
        return this;
    }

    public FakeManagerClient withState(String deviceId, String reachability, String certificateStatus) {
        states.put(deviceId, new DeviceRuntimeState(deviceId, reachability, certificateStatus));
        return this;
    }

    public FakeManagerClient withTemplate(String name, String id) {
        templates.add(new NamedResource(name, id));
        return this;
    }

    public FakeManagerClient withConfigGroup(String name, String id) {
        configGroups.add(new NamedResource(name, id));
        return this;
    }

    public void updateCertificate(String edgeId, String certificateStatus) {
        DeviceRecord edge = devices.get(DeviceCategory.EDGES).get(edgeId);
        devices.get(DeviceCategory.EDGES).put(edgeId, edge.toBuilder().certificateStatus(certificateStatus).build());
    }

    public long count(String prefix) {
        return calls.stream().filter(c -> c.startsWith(prefix)).count();
    }

    // ---- ManagerClient ----

    @Override
    public void createDevice(DeviceRegistration registration) {
        calls.add("createDevice:" + registration.deviceIp());
        registrations.add(registration);
        RuntimeException failure = registrationOutcome.apply(registration);
        if (failure != null) {
            throw failure;
        }
        String id = idOnRegistration.get(registration.deviceIp());
        if (id != null) {
            withController(id, registration.deviceIp());
        }
    }

    @Override
    public List<DeviceRecord> listDevices(DeviceCategory category) {
        calls.add("listDevices:" + category.path());
        if (unreadableCategories.contains(category)) {
            throw new ManagerApiException(500, "boom", "inventory unavailable");
        }
        return List.copyOf(devices.get(category).values());
    }

    @Override
    public String getAttachedConfig(String deviceId) {
        calls.add("getAttachedConfig:" + deviceId);
        if (unreadableConfig.contains(deviceId)) {
            throw new ManagerApiException(404, "", "no config for " + deviceId);
        }
        return attachedConfig.getOrDefault(deviceId, "");
    }

    @Override
    public DeviceRuntimeState getDeviceState(String deviceId) {
        calls.add("getDeviceState:" + deviceId);
        DeviceRuntimeState state = states.get(deviceId);
        if (state == null) {
            throw new ManagerApiException(404, "", "unknown device " + deviceId);
        }
        return state;
    }

    @Override
    public List<NamedResource> listTemplates() {
        calls.add("listTemplates");
        return List.copyOf(templates);
    }

    /** Registered definition, else one synthesized from the catalog entry */
    @Override
    public JsonNode getTemplateDefinition(String templateId) {
        calls.add("getTemplateDefinition:" + templateId);
        JsonNode definition = templateDefinitions.get(templateId);
        if (definition != null) {
            return definition;
        }
        return templates.stream()
                .filter(t -> templateId.equals(t.id()))
                .findFirst()
                .map(t -> (JsonNode) MAPPER.createObjectNode()
                        .put("templateName", t.name())
                        .put("templateId", t.id())
                        .put("configType", "template"))
                .orElse(null);
    }

    @Override
    public ApiResponse submitTemplateAttach(TemplateAttachment attachment) {
        calls.add("submitTemplateAttach:" + attachment.templateId());
        templateAttachments.add(attachment);
        return templateAttachResponse;
    }

    @Override
    public List<NamedResource> listConfigGroups() {
        calls.add("listConfigGroups");
        return List.copyOf(configGroups);
    }

    @Override
    public ApiResponse associateDevice(String groupId, String deviceId) {
        calls.add("associateDevice:" + groupId + ":" + deviceId);
        associations.add(deviceId);
        return associateResponse;
    }

    @Override
    public ApiResponse pushVariables(String groupId, String deviceId, Map<String, Object> variables) {
        calls.add("pushVariables:" + groupId + ":" + deviceId);
        pushedVariables.add(variables);
        if (pushFailure != null) {
            throw pushFailure;
        }
        return pushResponse;
    }

    @Override
    public JobStatusReport getJobStatus(String jobId) {
        calls.add("getJobStatus:" + jobId);
        jobStatusReads++;
        String status = jobStatuses.isEmpty() ? defaultJobStatus : jobStatuses.poll();
        if (JOB_READ_ERROR.equals(status)) {
            throw new ManagerApiException(503, "", "status unavailable");
        }
        return new JobStatusReport(jobId, status, null);
    }

    @Override
    public String serverVersion() {
        calls.add("serverVersion");
        return serverVersion;
    }

    @Override
    public List<JsonNode> getNetworkHierarchy() {
        calls.add("getNetworkHierarchy");
        if (hierarchyFailure != null) {
            throw hierarchyFailure;
        }
        return List.copyOf(hierarchy);
    }

    @Override
    public void createNetworkHierarchyNode(JsonNode node) {
        calls.add("createNetworkHierarchyNode:" + node.path("name").asText());
        createdHierarchyNodes.add(node);
    }

    @Override
    public void createTemplate(JsonNode definition) {
        calls.add("createTemplate");
        createdTemplates.add(definition);
    }

    @Override
    public void createConfigGroup(JsonNode definition) {
        calls.add("createConfigGroup");
        createdConfigGroups.add(definition);
    }

    @Override
    public void close() {
        closeCount++;
    }
}
