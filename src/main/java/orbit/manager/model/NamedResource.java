package orbit.manager.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A named configuration artifact (device template or config-group) in the manager catalog.
 *
 * @param definition full definition as returned by the manager, may be null
 */
public record NamedResource(String name, String id, JsonNode definition) {

    public NamedResource(String name, String id) {
        this(name, id, null);
    }
}
