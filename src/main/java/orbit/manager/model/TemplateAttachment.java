package orbit.manager.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One device's entry in a legacy template attach request: the template id plus the
 * flat variable record the manager expects for that device.
 */
public record TemplateAttachment(String templateId, Map<String, Object> variables) {

    public TemplateAttachment {
        Objects.requireNonNull(templateId, "templateId is required");
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
