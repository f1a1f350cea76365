package orbit.onboarding.service;

import orbit.manager.client.FakeManagerClient;
import orbit.manager.model.DeviceCategory;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OnboardedDeviceIndexTest {

    private static final String VSMART_CONFIG = String.join("\n",
            "system",
            " host-name vsmart-1",
            " system-ip 1.1.1.3",
            "!",
            "vpn 0",
            " interface eth0",
            "  ip address 10.0.0.11/24",
            "  ipv6 address 2001:db8::11/64",
            "  no shutdown",
            "!",
            "vpn 512",
            " interface eth1",
            "  ip address 192.168.1.11/24");

    @Test
    void readsVpn0AddressesFromAttachedConfig() {
        FakeManagerClient client = new FakeManagerClient()
                .withController("ctrl-1", "1.1.1.3")
                .withAttachedConfig("ctrl-1", VSMART_CONFIG);

        OnboardedDeviceIndex index = OnboardedDeviceIndex.scan(client);

        assertEquals(Set.of("10.0.0.11", "2001:db8::11"), index.onboardedIps());
        assertTrue(index.contains("10.0.0.11"));
        assertFalse(index.contains("192.168.1.11"));
        assertEquals(Optional.of("ctrl-1"), index.deviceIdFor("10.0.0.11"));
        assertEquals(Optional.of("ctrl-1"), index.deviceIdFor("2001:db8::11"));
        // reported address still resolves to the device
        assertEquals(Optional.of("ctrl-1"), index.deviceIdFor("1.1.1.3"));
    }

    @Test
    void fallsBackToReportedAddress() {
        FakeManagerClient client = new FakeManagerClient()
                .withController("ctrl-1", "10.0.0.11")
                .withAttachedConfig("ctrl-1", "system\n host-name vsmart-1\n!")
                .withController("ctrl-2", "10.0.0.12")
                .withUnreadableConfig("ctrl-2");

        OnboardedDeviceIndex index = OnboardedDeviceIndex.scan(client);

        assertEquals(Set.of("10.0.0.11", "10.0.0.12"), index.onboardedIps());
        assertEquals(Optional.of("ctrl-2"), index.deviceIdFor("10.0.0.12"));
    }

    @Test
    void unreadableInventoryGivesEmptyIndex() {
        FakeManagerClient client = new FakeManagerClient().withUnreadableInventory(DeviceCategory.CONTROLLERS);

        OnboardedDeviceIndex index = OnboardedDeviceIndex.scan(client);

        assertTrue(index.onboardedIps().isEmpty());
        assertEquals(Optional.empty(), index.deviceIdFor("10.0.0.11"));
    }
}
