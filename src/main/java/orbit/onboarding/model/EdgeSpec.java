package orbit.onboarding.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * WAN edge to confirm and configure.
 *
 * At most one of {@code templateName} and {@code configGroup} may be set. With neither,
 * the edge is left registered but unconfigured.
 *
 * @param values extra attachment variables, keys unique
 */
public record EdgeSpec(
        @JsonProperty("serial") String serial,
        @JsonProperty("system_ip") String systemIp,
        @JsonProperty("site_id") Integer siteId,
        @JsonProperty("template_name") String templateName,
        @JsonProperty("config_group") String configGroup,
        @JsonProperty("values") Map<String, Object> values) implements DeviceSpec {

    public EdgeSpec {
        Objects.requireNonNull(serial, "serial is required");
        Objects.requireNonNull(systemIp, "system_ip is required");
        Objects.requireNonNull(siteId, "site_id is required");
        if (templateName != null && configGroup != null) {
            throw new IllegalArgumentException(
                    "Edge " + serial + ": template_name and config_group are mutually exclusive");
        }
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static EdgeSpec of(String serial, String systemIp, int siteId) {
        return new EdgeSpec(serial, systemIp, siteId, null, null, null);
    }

    public EdgeSpec withTemplate(String templateName, Map<String, Object> values) {
        return new EdgeSpec(serial, systemIp, siteId, templateName, null, values);
    }

    public EdgeSpec withConfigGroup(String configGroup, Map<String, Object> values) {
        return new EdgeSpec(serial, systemIp, siteId, null, configGroup, values);
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.EDGE;
    }

    @Override
    public String identity() {
        return serial;
    }

    /**
     * Attachment variables: {@code system_ip} and {@code site_id} merged with the extra values.
     * Extra values win on key collision.
     */
    public Map<String, Object> attachmentVariables() {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("system_ip", systemIp);
        merged.put("site_id", siteId);
        merged.putAll(values);
        return merged;
    }
}
