package org.transitdisplay.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.interfaces.CommandRunner;
import org.transitdisplay.interfaces.NetworkLink;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Wifi link managed through NetworkManager's {@code nmcli}.
 * <p>
 * The connection name is discovered lazily from the active wireless
 * connection, or from the saved wireless profiles when none is active, and
 * remembered, so a later reconnect still knows what to bring up.
 * Probe failures count as disconnected.
 */
public final class NmcliNetworkLink implements NetworkLink {

    private static final Logger log = LoggerFactory.getLogger(NmcliNetworkLink.class);

    private final CommandRunner runner;
    private volatile String connectionName;

    /**
     * @param runner         command runner
     * @param connectionName known connection name, or null to discover it
     */
    public NmcliNetworkLink(CommandRunner runner, String connectionName) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.connectionName = connectionName;
    }

    @Override
    public boolean isConnected() {
        try {
            String name = connectionName();
            String out = runner.run(List.of("nmcli", "--get-values", "connection,state", "device"));
            boolean up = deviceConnected(out, name);
            if (!up) {
                log.warn("[Nmcli] no wifi: connection {} not connected", name);
            }
            return up;
        } catch (IOException e) {
            log.error("[Nmcli] wifi check using nmcli failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void reconnect() throws FetchException {
        try {
            String name = connectionName();
            runner.run(List.of("sudo", "nmcli", "connection", "up", name));
            log.info("[Nmcli] restarted wifi connection \"{}\"", name);
        } catch (IOException e) {
            throw new FetchException("failed to restart wifi using nmcli: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("wifi reconnect interrupted", e);
        }
    }

    private String connectionName() throws IOException, InterruptedException {
        String name = connectionName;
        if (name != null) return name;
        String out = runner.run(List.of("nmcli", "--get-values", "name,device,type", "con", "show", "--active"));
        name = wifiConnectionName(out);
        if (name == null) {
            // link already down: fall back to the saved profiles
            String saved = runner.run(List.of("nmcli", "--get-values", "name,type", "con", "show"));
            name = savedWifiConnectionName(saved);
        }
        if (name == null) {
            throw new IOException("no wifi connection found using nmcli");
        }
        log.info("[Nmcli] using wifi connection \"{}\"", name);
        connectionName = name;
        return name;
    }

    /** Parses {@code name:device:type} lines; returns the first wlan wireless connection. */
    static String wifiConnectionName(String nmcliOutput) {
        for (String line : nmcliOutput.split("\\R")) {
            String[] parts = line.split(":", 3);
            if (parts.length == 3 && parts[1].startsWith("wlan") && parts[2].contains("wireless")) {
                return parts[0];
            }
        }
        return null;
    }

    /** Parses {@code name:type} lines of saved connections; returns the first wireless one. */
    static String savedWifiConnectionName(String nmcliOutput) {
        for (String line : nmcliOutput.split("\\R")) {
            int sep = line.lastIndexOf(':');
            if (sep > 0 && line.substring(sep + 1).contains("wireless")) {
                return line.substring(0, sep);
            }
        }
        return null;
    }

    /** Parses {@code connection:state} lines. */
    static boolean deviceConnected(String nmcliOutput, String connectionName) {
        for (String line : nmcliOutput.split("\\R")) {
            String[] parts = line.split(":", 2);
            if (parts.length == 2 && parts[0].equals(connectionName) && parts[1].trim().equals("connected")) {
                return true;
            }
        }
        return false;
    }
}
