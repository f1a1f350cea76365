package orbit.manager.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import orbit.error.OperationCancelledException;
import orbit.manager.client.ManagerApiException;
import orbit.manager.client.ManagerClient;
import orbit.manager.model.ApiResponse;
import orbit.manager.model.DeviceCategory;
import orbit.manager.model.DeviceRecord;
import orbit.manager.model.DeviceRegistration;
import orbit.manager.model.DeviceRuntimeState;
import orbit.manager.model.JobStatusReport;
import orbit.manager.model.NamedResource;
import orbit.manager.model.TemplateAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ManagerClient} over the manager REST API.
 */
public class HttpManagerClient implements ManagerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpManagerClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final String baseUrl;
    private final String xsrfToken;
    private boolean closed;

    HttpManagerClient(HttpClient http, String baseUrl, String xsrfToken) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.xsrfToken = xsrfToken;
    }

    // ---- device inventory ----

    @Override
    public void createDevice(DeviceRegistration registration) {
        ObjectNode body = MAPPER.createObjectNode()
                .put("deviceIP", registration.deviceIp())
                .put("username", registration.username())
                .put("password", registration.password())
                .put("personality", registration.personality())
                .put("generateCSR", false);
        HttpResponse<String> response = send("POST", "/dataservice/system/device", body);
        requireSuccess("POST", "/dataservice/system/device", response);
    }

    @Override
    public List<DeviceRecord> listDevices(DeviceCategory category) {
        JsonNode data = getJson("/dataservice/system/device/" + category.path()).path("data");
        List<DeviceRecord> devices = new ArrayList<>();
        for (JsonNode node : data) {
            String uuid = text(node, "uuid");
            if (uuid == null) {
                continue;
            }
            String serial = text(node, "chasisNumber");
            devices.add(DeviceRecord.builder()
                    .id(uuid)
                    .managementIp(text(node, "deviceIP"))
                    .serialNumber(serial != null ? serial : text(node, "serialNumber"))
                    .reachability(text(node, "reachability"))
                    .certificateStatus(text(node, "certInstallStatus"))
                    .hostName(text(node, "host-name"))
                    .build());
        }
        return devices;
    }

    @Override
    public String getAttachedConfig(String deviceId) {
        return getJson("/dataservice/template/config/attached/" + encode(deviceId)).path("config").asText("");
    }

    @Override
    public DeviceRuntimeState getDeviceState(String deviceId) {
        JsonNode data = getJson("/dataservice/device?uuid=" + encode(deviceId)).path("data");
        JsonNode device = data.isArray() && data.size() > 0 ? data.get(0) : MAPPER.createObjectNode();
        return new DeviceRuntimeState(deviceId, text(device, "reachability"), text(device, "certificate-status"));
    }

    // ---- legacy device templates ----

    @Override
    public List<NamedResource> listTemplates() {
        return resources(getJson("/dataservice/template/device").path("data"), "templateName", "templateId");
    }

    @Override
    public JsonNode getTemplateDefinition(String templateId) {
        return getJson("/dataservice/template/device/object/" + encode(templateId));
    }

    @Override
    public ApiResponse submitTemplateAttach(TemplateAttachment attachment) {
        ObjectNode template = MAPPER.createObjectNode()
                .put("templateId", attachment.templateId())
                .put("isEdited", false)
                .put("isMasterEdited", false);
        JsonNode device = MAPPER.valueToTree(attachment.variables());
        template.putArray("device").add(device);

        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("deviceTemplateList").add(template);

        return toResponse(send("POST", "/dataservice/template/device/config/attachfeature", body));
    }

    // ---- config-groups ----

    @Override
    public List<NamedResource> listConfigGroups() {
        JsonNode groups = getJson("/dataservice/v1/config-group");
        JsonNode list = groups.isArray() ? groups : groups.path("data");
        return resources(list, "name", "id");
    }

    @Override
    public ApiResponse associateDevice(String groupId, String deviceId) {
        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("devices").addObject().put("id", deviceId);
        return toResponse(send("POST", "/dataservice/v1/config-group/" + encode(groupId) + "/device/associate", body));
    }

    @Override
    public ApiResponse pushVariables(String groupId, String deviceId, Map<String, Object> variables) {
        ObjectNode body = MAPPER.createObjectNode();
        ObjectNode device = body.putArray("devices").addObject().put("id", deviceId);
        ArrayNode list = device.putArray("variables");
        variables.forEach((name, value) -> list.addObject()
                .put("name", name)
                .set("value", MAPPER.valueToTree(value)));
        return toResponse(send("POST", "/dataservice/v1/config-group/" + encode(groupId) + "/device/variables", body));
    }

    // ---- async jobs ----

    @Override
    public JobStatusReport getJobStatus(String jobId) {
        JsonNode raw = getJson("/dataservice/device/action/status/" + encode(jobId));
        return new JobStatusReport(jobId, text(raw.path("summary"), "status"), raw);
    }

    // ---- server / network hierarchy ----

    @Override
    public String serverVersion() {
        JsonNode about = getJson("/dataservice/client/server");
        JsonNode data = about.has("data") ? about.get("data") : about;
        return text(data, "platformVersion");
    }

    @Override
    public List<JsonNode> getNetworkHierarchy() {
        JsonNode hierarchy = getJson("/dataservice/v1/network-hierarchy");
        List<JsonNode> nodes = new ArrayList<>();
        (hierarchy.isArray() ? hierarchy : hierarchy.path("data")).forEach(nodes::add);
        return nodes;
    }

    @Override
    public void createNetworkHierarchyNode(JsonNode node) {
        requireSuccess("POST", "/dataservice/v1/network-hierarchy",
                send("POST", "/dataservice/v1/network-hierarchy", node));
    }

    // ---- catalog writes ----

    @Override
    public void createTemplate(JsonNode definition) {
        String path = definition.path("configType").asText("").equals("file")
                ? "/dataservice/template/device/cli"
                : "/dataservice/template/device/feature";
        requireSuccess("POST", path, send("POST", path, definition));
    }

    @Override
    public void createConfigGroup(JsonNode definition) {
        requireSuccess("POST", "/dataservice/v1/config-group", send("POST", "/dataservice/v1/config-group", definition));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            HttpRequest logout = HttpRequest.newBuilder(URI.create(baseUrl + "/logout"))
                    .timeout(HttpManagerConnector.REQUEST_TIMEOUT)
                    .GET()
                    .build();
            http.send(logout, HttpResponse.BodyHandlers.discarding());
            log.debug("Logged out of {}", baseUrl);
        } catch (IOException e) {
            log.debug("Logout failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Logout interrupted");
        }
    }

    // ---- transport ----

    private JsonNode getJson(String path) {
        HttpResponse<String> response = send("GET", path, null);
        requireSuccess("GET", path, response);
        try {
            String body = response.body();
            return body == null || body.isBlank() ? MAPPER.createObjectNode() : MAPPER.readTree(body);
        } catch (IOException e) {
            throw new ManagerApiException("Unreadable reply from GET " + path, e);
        }
    }

    private HttpResponse<String> send(String method, String path, JsonNode body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(HttpManagerConnector.REQUEST_TIMEOUT)
                .header("Accept", "application/json");
        if (xsrfToken != null) {
            builder.header("X-XSRF-TOKEN", xsrfToken);
        }
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body.toString()));
        }

        log.debug("{} {}", method, path);
        try {
            return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ManagerApiException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during " + method + " " + path);
        }
    }

    private static void requireSuccess(String method, String path, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw ManagerApiException.ofStatus(method, path, status, response.body());
        }
    }

    private static ApiResponse toResponse(HttpResponse<String> response) {
        return new ApiResponse(response.statusCode(), response.body());
    }

    private static List<NamedResource> resources(JsonNode list, String nameField, String idField) {
        List<NamedResource> resources = new ArrayList<>();
        for (JsonNode node : list) {
            String name = text(node, nameField);
            if (name != null) {
                resources.add(new NamedResource(name, text(node, idField), node));
            }
        }
        return resources;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
