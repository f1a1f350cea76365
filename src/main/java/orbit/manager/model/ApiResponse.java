package orbit.manager.model;

/**
 * Raw outcome of a structural write against the manager.
 */
public record ApiResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode == 200 || statusCode == 201;
    }
}
