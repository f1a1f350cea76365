package orbit.onboarding.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EdgeSpecTest {

    @Test
    void templateAndConfigGroupAreMutuallyExclusive() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new EdgeSpec("SN-1", "10.1.0.1", 100, "branch", "branch-cg", null));

        assertTrue(e.getMessage().contains("SN-1"));
    }

    @Test
    void switchingProfileClearsTheOther() {
        EdgeSpec edge = EdgeSpec.of("SN-1", "10.1.0.1", 100).withTemplate("branch", Map.of());

        EdgeSpec regrouped = edge.withConfigGroup("branch-cg", Map.of());

        assertNull(regrouped.templateName());
        assertEquals("branch-cg", regrouped.configGroup());
    }

    @Test
    void attachmentVariablesMergeExtraValues() {
        EdgeSpec edge = EdgeSpec.of("SN-1", "10.1.0.1", 100).withTemplate("branch", Map.of("hostname", "edge1"));

        Map<String, Object> variables = edge.attachmentVariables();

        assertEquals(Map.of("system_ip", "10.1.0.1", "site_id", 100, "hostname", "edge1"), variables);
        assertEquals(List.of("system_ip", "site_id", "hostname"), List.copyOf(variables.keySet()));
    }

    @Test
    void resultRejectsDuplicateIds() {
        assertThrows(IllegalArgumentException.class,
                () -> new OnboardingResult(List.of("a", "a"), List.of(), List.of()));
        assertEquals(3, new OnboardingResult(List.of("a"), List.of("b"), List.of("c")).total());
    }
}
