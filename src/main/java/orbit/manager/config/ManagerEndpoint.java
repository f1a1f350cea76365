package orbit.manager.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Connection parameters of the manager. Immutable.
 * A URL given without a scheme is taken as https.
 */
public record ManagerEndpoint(
        @JsonProperty("url") String url,
        @JsonProperty("username") String username,
        @JsonProperty("password") String password,
        @JsonProperty("port") Integer port,
        @JsonProperty("verify") Boolean verify) {

    public static final int DEFAULT_PORT = 443;

    public ManagerEndpoint {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(username, "username is required");
        Objects.requireNonNull(password, "password is required");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        url = url.startsWith("http://") || url.startsWith("https://") ? url : "https://" + url;
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        port = port == null ? DEFAULT_PORT : port;
        verify = verify != null && verify;
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
    }

    public static ManagerEndpoint of(String url, String username, String password, int port) {
        return new ManagerEndpoint(url, username, password, port, false);
    }

    /** Scheme, host and port, without a trailing slash */
    public String baseUrl() {
        String withoutScheme = url.substring(url.indexOf("://") + 3);
        boolean hasPort = withoutScheme.contains(":") && !withoutScheme.startsWith("[");
        return hasPort ? url : url + ":" + port;
    }

    @Override
    public String toString() {
        return "ManagerEndpoint{url='" + url + "', username='" + username + "', port=" + port
                + ", verify=" + verify + '}';
    }
}
