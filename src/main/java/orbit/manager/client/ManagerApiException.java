package orbit.manager.client;

import java.util.Locale;

/**
 * A request to the manager failed: non-2xx status or an unreadable reply.
 * Status 0 means no HTTP status was available.
 */
public class ManagerApiException extends RuntimeException {

    private final int statusCode;
    private final String body;

    public ManagerApiException(int statusCode, String body, String message) {
        super(message);
        this.statusCode = statusCode;
        this.body = body;
    }

    public ManagerApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.body = null;
    }

    public static ManagerApiException ofStatus(String method, String path, int statusCode, String body) {
        return new ManagerApiException(statusCode, body,
                method + " " + path + " failed: " + statusCode + " - " + body);
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }

    /**
     * Credential rejection: 401/403, or an unauthorized/authentication marker in the message.
     */
    public boolean isAuthenticationFailure() {
        if (statusCode == 401 || statusCode == 403) {
            return true;
        }
        String text = String.valueOf(getMessage()).toLowerCase(Locale.ROOT);
        return text.contains("401") || text.contains("unauthorized") || text.contains("authenticat");
    }
}
