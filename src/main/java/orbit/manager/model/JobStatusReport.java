package orbit.manager.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Status of an asynchronous manager job as read on one poll.
 *
 * @param status summary status text, null when the manager has not reported one yet
 * @param raw    full payload, kept for failure messages
 */
public record JobStatusReport(String jobId, String status, JsonNode raw) {
}
