package orbit.manager.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DeviceRuntimeStateTest {

    @Test
    void readyNeedsReachabilityAndCertificate() {
        assertTrue(new DeviceRuntimeState("d1", "reachable", "certinstalled").isReady());
        assertFalse(new DeviceRuntimeState("d1", "unreachable", "certinstalled").isReady());
        assertFalse(new DeviceRuntimeState("d1", "reachable", "pending").isReady());
        assertFalse(new DeviceRuntimeState("d1", "reachable", null).isReady());
    }

    @Test
    @DisplayName("Certificate status matches regardless of the default locale")
    void certificateStatusIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertTrue(new DeviceRuntimeState("d1", "Reachable", "CertInstalled").isCertificateInstalled());
            assertTrue(new DeviceRuntimeState("d1", "Reachable", "INSTALLED").isReady());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
