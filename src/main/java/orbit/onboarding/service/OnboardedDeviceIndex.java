package orbit.onboarding.service;

import orbit.manager.client.ManagerClient;
import orbit.manager.model.DeviceCategory;
import orbit.manager.model.DeviceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Management addresses of control components already known to the manager.
 *
 * The address a device was onboarded with is read from its attached configuration
 * (the VPN 0 interface address). When no address can be extracted the reported
 * management IP is used instead. This is a heuristic over rendered configuration text.
 */
public final class OnboardedDeviceIndex {

    private static final Logger log = LoggerFactory.getLogger(OnboardedDeviceIndex.class);

    static final Pattern VPN0_IPV4 = Pattern.compile(
            "vpn 0[\\s\\S]+?ip\\saddress\\s(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})");
    static final Pattern VPN0_IPV6 = Pattern.compile(
            "vpn 0[\\s\\S]+?ipv6\\saddress\\s([0-9a-fA-F:]+)");

    private final Set<String> onboardedIps;
    private final Map<String, String> deviceIdByAddress;

    private OnboardedDeviceIndex(Set<String> onboardedIps, Map<String, String> deviceIdByAddress) {
        this.onboardedIps = onboardedIps;
        this.deviceIdByAddress = deviceIdByAddress;
    }

    public static OnboardedDeviceIndex empty() {
        return new OnboardedDeviceIndex(Set.of(), Map.of());
    }

    /**
     * Read the controller inventory and every device's attached configuration.
     * An unreadable inventory yields an empty index.
     */
    public static OnboardedDeviceIndex scan(ManagerClient client) {
        Set<String> ips = new LinkedHashSet<>();
        Map<String, String> ids = new HashMap<>();

        try {
            for (DeviceRecord device : client.listDevices(DeviceCategory.CONTROLLERS)) {
                for (String ip : addressesOf(client, device)) {
                    ips.add(ip);
                    ids.putIfAbsent(ip, device.id());
                }
                if (device.managementIp() != null) {
                    ids.putIfAbsent(device.managementIp(), device.id());
                }
            }
        } catch (RuntimeException e) {
            log.warn("Error getting onboarded devices: {}", e.getMessage());
        }

        log.debug("Already onboarded control components: {}", ips);
        return new OnboardedDeviceIndex(ips, ids);
    }

    private static Set<String> addressesOf(ManagerClient client, DeviceRecord device) {
        Set<String> addresses = new LinkedHashSet<>();
        try {
            String config = client.getAttachedConfig(device.id());
            String config0 = config == null ? "" : config;

            Matcher v4 = VPN0_IPV4.matcher(config0);
            if (v4.find()) {
                addresses.add(v4.group(1));
            } else if (device.managementIp() != null) {
                addresses.add(device.managementIp());
            }

            Matcher v6 = VPN0_IPV6.matcher(config0);
            if (v6.find()) {
                addresses.add(v6.group(1));
            }
        } catch (RuntimeException e) {
            log.debug("Error getting config for device {}: {}", device.id(), e.getMessage());
            if (device.managementIp() != null) {
                addresses.add(device.managementIp());
            }
        }
        return addresses;
    }

    public boolean contains(String ip) {
        return onboardedIps.contains(ip);
    }

    /** Device owning an address, by configured or reported IP */
    public Optional<String> deviceIdFor(String ip) {
        return Optional.ofNullable(deviceIdByAddress.get(ip));
    }

    public Set<String> onboardedIps() {
        return Set.copyOf(onboardedIps);
    }
}
