package orbit.manager.model;

import java.util.Objects;

/**
 * Immutable view of a device as listed in the manager inventory.
 */
public final class DeviceRecord {
    private final String id;
    private final String managementIp;
    private final String serialNumber;
    private final String reachability;
    private final String certificateStatus;
    private final String hostName;

    private DeviceRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.managementIp = builder.managementIp;
        this.serialNumber = builder.serialNumber;
        this.reachability = builder.reachability;
        this.certificateStatus = builder.certificateStatus;
        this.hostName = builder.hostName;
    }

    // Getters
    public String id() {
        return id;
    }

    public String managementIp() {
        return managementIp;
    }

    public String serialNumber() {
        return serialNumber;
    }

    public String reachability() {
        return reachability;
    }

    public String certificateStatus() {
        return certificateStatus;
    }

    public String hostName() {
        return hostName;
    }

    /** Certificate install status as reported in the edge inventory ("Installed") */
    public boolean isCertificateInstalled() {
        return "Installed".equalsIgnoreCase(certificateStatus);
    }

    /** Match by hardware serial, or by identifier when the caller already has one */
    public boolean matches(String serialOrId) {
        return serialOrId != null && (serialOrId.equals(serialNumber) || serialOrId.equals(id));
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .managementIp(managementIp)
                .serialNumber(serialNumber)
                .reachability(reachability)
                .certificateStatus(certificateStatus)
                .hostName(hostName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String managementIp;
        private String serialNumber;
        private String reachability;
        private String certificateStatus;
        private String hostName;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder managementIp(String managementIp) {
            this.managementIp = managementIp;
            return this;
        }

        public Builder serialNumber(String serialNumber) {
            this.serialNumber = serialNumber;
            return this;
        }

        public Builder reachability(String reachability) {
            this.reachability = reachability;
            return this;
        }

        public Builder certificateStatus(String certificateStatus) {
            this.certificateStatus = certificateStatus;
            return this;
        }

        public Builder hostName(String hostName) {
            this.hostName = hostName;
            return this;
        }

        public DeviceRecord build() {
            return new DeviceRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        DeviceRecord that = (DeviceRecord) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "DeviceRecord{" +
                "id='" + id + '\'' +
                ", managementIp='" + managementIp + '\'' +
                ", serialNumber='" + serialNumber + '\'' +
                ", certificateStatus='" + certificateStatus + '\'' +
                '}';
    }
}
