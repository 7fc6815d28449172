package org.transitdisplay.client;

import org.junit.jupiter.api.Test;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.interfaces.CommandRunner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NmcliNetworkLinkTest {

    private static final String ACTIVE = "Wired connection 1:eth0:802-3-ethernet\nHomeWifi:wlan0:802-11-wireless\n";

    @Test
    void parsesWifiConnectionName() {
        assertEquals("HomeWifi", NmcliNetworkLink.wifiConnectionName(ACTIVE));
        assertNull(NmcliNetworkLink.wifiConnectionName("lo:lo:loopback\n"));
    }

    @Test
    void parsesDeviceState() {
        assertTrue(NmcliNetworkLink.deviceConnected("HomeWifi:connected\n:disconnected\n", "HomeWifi"));
        assertFalse(NmcliNetworkLink.deviceConnected("HomeWifi:connecting\n", "HomeWifi"));
        assertFalse(NmcliNetworkLink.deviceConnected("Other:connected\n", "HomeWifi"));
    }

    @Test
    void probeDiscoversNameThenChecksState() {
        List<List<String>> seen = new ArrayList<>();
        CommandRunner runner = cmd -> {
            seen.add(cmd);
            return cmd.contains("con") ? ACTIVE : "HomeWifi:connected\n";
        };
        NmcliNetworkLink link = new NmcliNetworkLink(runner, null);

        assertTrue(link.isConnected());
        assertTrue(link.isConnected());
        // name discovered once and remembered
        assertEquals(3, seen.size());
    }

    @Test
    void commandFailureCountsAsDisconnected() {
        NmcliNetworkLink link = new NmcliNetworkLink(cmd -> { throw new IOException("nmcli not found"); }, "HomeWifi");
        assertFalse(link.isConnected());
    }

    @Test
    void reconnectRunsConnectionUp() throws Exception {
        List<List<String>> seen = new ArrayList<>();
        NmcliNetworkLink link = new NmcliNetworkLink(cmd -> { seen.add(cmd); return ""; }, "HomeWifi");

        link.reconnect();

        assertEquals(List.of(List.of("sudo", "nmcli", "connection", "up", "HomeWifi")), seen);
    }

    @Test
    void reconnectFailureIsAFetchException() {
        NmcliNetworkLink failing = new NmcliNetworkLink(cmd -> { throw new IOException("exit 4"); }, "HomeWifi");
        assertThrows(FetchException.class, failing::reconnect);
        assertThrows(FetchException.class, new NmcliNetworkLink(cmd -> "", null)::reconnect);
    }

    @Test
    void reconnectFindsSavedProfileWhenNothingIsActive() throws Exception {
        List<List<String>> seen = new ArrayList<>();
        CommandRunner runner = cmd -> {
            seen.add(cmd);
            if (cmd.contains("--active")) {
                return "Wired connection 1:eth0:802-3-ethernet\n";
            }
            if (cmd.contains("name,type")) {
                return "Wired connection 1:802-3-ethernet\nHomeWifi:802-11-wireless\n";
            }
            return "";
        };
        NmcliNetworkLink link = new NmcliNetworkLink(runner, null);

        link.reconnect();

        assertEquals(List.of("sudo", "nmcli", "connection", "up", "HomeWifi"), seen.get(seen.size() - 1));
    }

    @Test
    void parsesSavedWifiProfile() {
        assertEquals("Cafe: Guest", NmcliNetworkLink.savedWifiConnectionName("Cafe: Guest:802-11-wireless\n"));
        assertNull(NmcliNetworkLink.savedWifiConnectionName("Wired connection 1:802-3-ethernet\n"));
    }
}
