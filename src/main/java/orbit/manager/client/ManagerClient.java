package orbit.manager.client;

import com.fasterxml.jackson.databind.JsonNode;
import orbit.manager.model.ApiResponse;
import orbit.manager.model.DeviceCategory;
import orbit.manager.model.DeviceRecord;
import orbit.manager.model.DeviceRegistration;
import orbit.manager.model.DeviceRuntimeState;
import orbit.manager.model.JobStatusReport;
import orbit.manager.model.NamedResource;
import orbit.manager.model.TemplateAttachment;

import java.util.List;
import java.util.Map;

/**
 * Authenticated session against the manager's device-management API.
 * Not safe for concurrent mutation: one orchestration run uses it sequentially.
 *
 * Read operations throw {@link ManagerApiException} on failure. Structural writes whose
 * outcome callers inspect return an {@link ApiResponse} instead.
 */
public interface ManagerClient extends AutoCloseable {

    // ---- device inventory ----

    /**
     * Register a control component.
     *
     * @throws ManagerApiException on rejection, authentication-class when the device
     *                             refused the credentials
     */
    void createDevice(DeviceRegistration registration);

    /**
     * List devices of a category in inventory order.
     */
    List<DeviceRecord> listDevices(DeviceCategory category);

    /**
     * Rendered configuration currently attached to a device.
     */
    String getAttachedConfig(String deviceId);

    /**
     * Fresh reachability/certificate snapshot of one device.
     */
    DeviceRuntimeState getDeviceState(String deviceId);

    // ---- legacy device templates ----

    List<NamedResource> listTemplates();

    /**
     * Full definition of one device template, in the form the template create endpoints accept.
     */
    JsonNode getTemplateDefinition(String templateId);

    /**
     * Submit a template attachment.
     * The body of a successful response carries the asynchronous job id.
     */
    ApiResponse submitTemplateAttach(TemplateAttachment attachment);

    // ---- config-groups ----

    List<NamedResource> listConfigGroups();

    ApiResponse associateDevice(String groupId, String deviceId);

    ApiResponse pushVariables(String groupId, String deviceId, Map<String, Object> variables);

    // ---- async jobs ----

    JobStatusReport getJobStatus(String jobId);

    // ---- server / network hierarchy ----

    /**
     * Reported server version, for example "20.12.3".
     */
    String serverVersion();

    List<JsonNode> getNetworkHierarchy();

    void createNetworkHierarchyNode(JsonNode node);

    // ---- catalog writes used by restore ----

    void createTemplate(JsonNode definition);

    void createConfigGroup(JsonNode definition);

    /**
     * End the session. Must be safe to call more than once.
     */
    @Override
    void close();
}
