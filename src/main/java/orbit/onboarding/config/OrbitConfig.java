package orbit.onboarding.config;

import java.time.Duration;

/**
 * Configuration holder for onboarding settings.
 * All settings have sensible defaults.
 */
public final class OrbitConfig {

    // Connection settings
    private Duration connectRetryInterval = Duration.ofSeconds(30);
    private int connectMaxAttempts = 120; // ~1 hour at 30s

    // Device registration
    private String deviceUsername = "admin";
    private String defaultDevicePassword = "admin";

    // Polling settings
    private Duration pollInterval = Duration.ofSeconds(10);
    private Duration readinessTimeout = Duration.ofSeconds(600);
    private Duration certificateTimeout = Duration.ofSeconds(300);
    private Duration taskTimeout = Duration.ofSeconds(600);
    private Duration progressLogInterval = Duration.ofSeconds(30);

    private OrbitConfig() {
    }

    public static OrbitConfig defaults() {
        return new OrbitConfig();
    }

    public static OrbitConfig fromEnv() {
        OrbitConfig config = new OrbitConfig();

        Duration retryInterval = seconds("ORBIT_CONNECT_RETRY_INTERVAL");
        if (retryInterval != null) {
            config.connectRetryInterval = retryInterval;
        }

        String maxAttempts = System.getenv("ORBIT_CONNECT_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.connectMaxAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String devicePassword = System.getenv("ORBIT_DEFAULT_DEVICE_PASSWORD");
        if (devicePassword != null && !devicePassword.isBlank()) {
            config.defaultDevicePassword = devicePassword;
        }

        Duration pollInterval = seconds("ORBIT_POLL_INTERVAL");
        if (pollInterval != null) {
            config.pollInterval = pollInterval;
        }

        Duration readyTimeout = seconds("ORBIT_READY_TIMEOUT");
        if (readyTimeout != null) {
            config.readinessTimeout = readyTimeout;
        }

        Duration certTimeout = seconds("ORBIT_CERT_TIMEOUT");
        if (certTimeout != null) {
            config.certificateTimeout = certTimeout;
        }

        Duration taskTimeout = seconds("ORBIT_TASK_TIMEOUT");
        if (taskTimeout != null) {
            config.taskTimeout = taskTimeout;
        }

        return config;
    }

    private static Duration seconds(String env) {
        String value = System.getenv(env);
        if (value == null || value.isBlank()) {
            return null;
        }
        return Duration.ofSeconds(Long.parseLong(value.trim()));
    }

    // Getters
    public Duration connectRetryInterval() {
        return connectRetryInterval;
    }

    public int connectMaxAttempts() {
        return connectMaxAttempts;
    }

    public String deviceUsername() {
        return deviceUsername;
    }

    public String defaultDevicePassword() {
        return defaultDevicePassword;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration readinessTimeout() {
        return readinessTimeout;
    }

    public Duration certificateTimeout() {
        return certificateTimeout;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration progressLogInterval() {
        return progressLogInterval;
    }

    // Fluent setters for testing/customization
    public OrbitConfig withConnectRetryInterval(Duration interval) {
        this.connectRetryInterval = interval;
        return this;
    }

    public OrbitConfig withConnectMaxAttempts(int attempts) {
        this.connectMaxAttempts = attempts;
        return this;
    }

    public OrbitConfig withDefaultDevicePassword(String password) {
        this.defaultDevicePassword = password;
        return this;
    }

    public OrbitConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public OrbitConfig withReadinessTimeout(Duration timeout) {
        this.readinessTimeout = timeout;
        return this;
    }

    public OrbitConfig withCertificateTimeout(Duration timeout) {
        this.certificateTimeout = timeout;
        return this;
    }

    public OrbitConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "OrbitConfig{" +
                "connectRetryInterval=" + connectRetryInterval +
                ", connectMaxAttempts=" + connectMaxAttempts +
                ", pollInterval=" + pollInterval +
                ", readinessTimeout=" + readinessTimeout +
                ", certificateTimeout=" + certificateTimeout +
                ", taskTimeout=" + taskTimeout +
                '}';
    }
}
