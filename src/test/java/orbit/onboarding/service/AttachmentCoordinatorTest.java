package orbit.onboarding.service;

import orbit.error.AttachmentException;
import orbit.error.ConfigGroupNotFoundException;
import orbit.error.DeviceNotFoundException;
import orbit.error.TemplateNotFoundException;
import orbit.manager.client.FakeManagerClient;
import orbit.manager.client.ManagerApiException;
import orbit.manager.model.ApiResponse;
import orbit.manager.model.DeviceCategory;
import orbit.manager.model.DeviceRecord;
import orbit.onboarding.model.AttachmentJob;
import orbit.onboarding.model.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttachmentCoordinatorTest {

    private OnboardingFixture fixture;
    private FakeManagerClient client;
    private AttachmentCoordinator coordinator;

    @BeforeEach
    void setUp() {
        fixture = new OnboardingFixture();
        client = fixture.client;
        coordinator = fixture.attachments();
    }

    private static Map<String, Object> variables(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    // ---- config-groups ----

    @Test
    @DisplayName("Config-group with empty variables: association only")
    void configGroupWithoutVariables() {
        client.withConfigGroup("branch", "cg-1");

        coordinator.attachConfigGroup("edge-1", "branch", Map.of());

        assertEquals(1, client.count("associateDevice"));
        assertEquals(0, client.count("pushVariables"));
    }

    @Test
    @DisplayName("Config-group with variables: association then variable push")
    void configGroupWithVariables() {
        client.withConfigGroup("branch", "cg-1");

        coordinator.attachConfigGroup("edge-1", "branch", variables("system_ip", "10.1.0.1", "site_id", 100));

        assertEquals(List.of("listConfigGroups", "associateDevice:cg-1:edge-1", "pushVariables:cg-1:edge-1"),
                client.calls);
    }

    @Test
    @DisplayName("Rejected variable push still counts as attached")
    void variablePushFailureIsBestEffort() {
        client.withConfigGroup("branch", "cg-1");
        client.pushResponse = new ApiResponse(400, "bad variables");

        assertDoesNotThrow(() -> coordinator.attachConfigGroup("edge-1", "branch", variables("hostname", "e1")));

        client.pushFailure = new ManagerApiException("connection reset", null);
        assertDoesNotThrow(() -> coordinator.attachConfigGroup("edge-1", "branch", variables("hostname", "e1")));
    }

    @Test
    void rejectedAssociationFails() {
        client.withConfigGroup("branch", "cg-1");
        client.associateResponse = new ApiResponse(404, "device not found");

        AttachmentException e = assertThrows(AttachmentException.class,
                () -> coordinator.attachConfigGroup("edge-1", "branch", variables("hostname", "e1")));

        assertTrue(e.getMessage().contains("Failed to associate device with config-group: 404"));
        assertEquals(0, client.count("pushVariables"));
    }

    @Test
    void unknownConfigGroup() {
        client.withConfigGroup("other", "cg-2");

        ConfigGroupNotFoundException e = assertThrows(ConfigGroupNotFoundException.class,
                () -> coordinator.attachConfigGroup("edge-1", "branch", Map.of()));

        assertTrue(e.getMessage().contains("branch"));
        assertTrue(e.getMessage().contains("20.12"));
    }

    // ---- templates ----

    @Test
    void attachesTemplateAndWaitsForJob() {
        client.withTemplate("branch", "tpl-1").withEdge("edge-1", "SN-1", "Installed");
        client.jobStatuses.addAll(List.of("In progress", "In progress", "Success"));

        AttachmentJob job = coordinator.attachTemplate("edge-1", "branch", variables("system_ip", "10.1.0.1", "site_id", 7));

        assertEquals("job-1", job.id());
        assertEquals(JobState.SUCCEEDED, job.state());
        assertEquals(3, client.jobStatusReads);
        assertEquals(2, fixture.clock.sleepCount());
    }

    @Test
    void firstTemplateWithExactNameWins() {
        client.withTemplate("branch-v2", "tpl-0")
                .withTemplate("branch", "tpl-1")
                .withTemplate("branch", "tpl-2")
                .withEdge("edge-1", "SN-1", "Installed");

        coordinator.attachTemplate("edge-1", "branch", variables("system_ip", "10.1.0.1", "site_id", 7));

        assertEquals("tpl-1", client.templateAttachments.get(0).templateId());
    }

    @Test
    void unknownTemplate() {
        assertThrows(TemplateNotFoundException.class,
                () -> coordinator.attachTemplate("edge-1", "branch", Map.of()));
        assertEquals(0, client.count("submitTemplateAttach"));
    }

    @Test
    void deviceMissingFromEdgeInventory() {
        client.withTemplate("branch", "tpl-1");

        assertThrows(DeviceNotFoundException.class,
                () -> coordinator.attachTemplate("edge-9", "branch", variables("system_ip", "10.1.0.1", "site_id", 7)));
    }

    @Test
    void rejectedSubmission() {
        client.withTemplate("branch", "tpl-1").withEdge("edge-1", "SN-1", "Installed");
        client.templateAttachResponse = new ApiResponse(500, "server error");

        AttachmentException e = assertThrows(AttachmentException.class, () -> coordinator.attachTemplate(
                "edge-1", "branch", variables("system_ip", "10.1.0.1", "site_id", 7)));

        assertEquals("Failed to attach template: 500 - server error", e.getMessage());
    }

    @Test
    void submissionWithoutJobId() {
        client.withTemplate("branch", "tpl-1").withEdge("edge-1", "SN-1", "Installed");
        client.templateAttachResponse = new ApiResponse(200, "{}");

        assertThrows(AttachmentException.class, () -> coordinator.attachTemplate(
                "edge-1", "branch", variables("system_ip", "10.1.0.1", "site_id", 7)));
    }

    @Test
    void failedJob() {
        client.withTemplate("branch", "tpl-1").withEdge("edge-1", "SN-1", "Installed");
        client.jobStatuses.addAll(List.of("In progress", "Failure"));

        AttachmentException e = assertThrows(AttachmentException.class, () -> coordinator.attachTemplate(
                "edge-1", "branch", variables("system_ip", "10.1.0.1", "site_id", 7)));

        assertTrue(e.getMessage().startsWith("Task job-1 failed"));
    }

    // ---- template variables ----

    @Test
    @DisplayName("Fixed template keys come from the device record and the merged variables")
    void templateVariablesFromDevice() {
        DeviceRecord device = DeviceRecord.builder()
                .id("edge-1")
                .managementIp("192.0.2.10")
                .hostName("branch-7")
                .build();

        Map<String, Object> record = AttachmentCoordinator.templateVariables(device, "tpl-1",
                variables("system_ip", "10.1.0.1", "site_id", 7, "hostname", "edge1"));

        assertEquals("complete", record.get("csv-status"));
        assertEquals("edge-1", record.get("csv-deviceId"));
        assertEquals("192.0.2.10", record.get("csv-deviceIP"));
        assertEquals("branch-7", record.get("csv-host-name"));
        assertEquals("branch-7", record.get("//system/host-name"));
        assertEquals("10.1.0.1", record.get("//system/system-ip"));
        assertEquals("7", record.get("//system/site-id"));
        assertEquals("tpl-1", record.get("csv-templateId"));
        assertEquals("edge1", record.get("hostname"));
        assertEquals(9, record.size());
    }

    @Test
    void templateVariablesFallbacks() {
        DeviceRecord device = DeviceRecord.builder().id("edge-1").build();

        Map<String, Object> record = AttachmentCoordinator.templateVariables(device, "tpl-1",
                variables("system_ip", "10.1.0.1", "site_id", 7));

        assertEquals("10.1.0.1", record.get("csv-deviceIP"));
        assertEquals("Edge7", record.get("csv-host-name"));
    }

    @Test
    void templateAttachUsesEdgeInventoryRecord() {
        client.withTemplate("branch", "tpl-1")
                .withDevice(DeviceCategory.EDGES, DeviceRecord.builder().id("edge-1").hostName("br-1").build());

        coordinator.attachTemplate("edge-1", "branch", variables("system_ip", "10.1.0.1", "site_id", 7));

        assertEquals("br-1", client.templateAttachments.get(0).variables().get("csv-host-name"));
    }
}
