package org.transitdisplay.runtime;

import org.junit.jupiter.api.Test;
import org.transitdisplay.TestFakes.RecordingSleeper;
import org.transitdisplay.errors.FetchException;
import org.transitdisplay.errors.ReconnectExhaustedException;
import org.transitdisplay.interfaces.NetworkLink;
import org.transitdisplay.runtime.ConnectivityWatchdog.ReconnectPolicy;
import org.transitdisplay.runtime.ConnectivityWatchdog.State;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectivityWatchdogTest {

    /** Link that is down until the n-th reconnect attempt succeeds. */
    private static final class FlakyLink implements NetworkLink {
        private final int succeedOnAttempt;
        private final boolean reconnectThrows;
        private boolean connected;
        int attempts;

        FlakyLink(boolean initiallyConnected, int succeedOnAttempt, boolean reconnectThrows) {
            this.connected = initiallyConnected;
            this.succeedOnAttempt = succeedOnAttempt;
            this.reconnectThrows = reconnectThrows;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public void reconnect() throws FetchException {
            attempts++;
            if (attempts >= succeedOnAttempt) {
                connected = true;
                return;
            }
            if (reconnectThrows) throw new FetchException("nmcli exited with 10");
        }
    }

    private static ConnectivityWatchdog watchdog(NetworkLink link, RecordingSleeper sleeper) {
        return new ConnectivityWatchdog(link, Duration.ofSeconds(30), Duration.ofSeconds(60),
                ReconnectPolicy.defaults(), sleeper);
    }

    @Test
    void connectedProbeDoesNothing() throws Exception {
        FlakyLink link = new FlakyLink(true, 1, false);
        RecordingSleeper sleeper = new RecordingSleeper();

        assertEquals(State.CONNECTED, watchdog(link, sleeper).checkOnce());
        assertEquals(0, link.attempts);
        assertTrue(sleeper.sleeps().isEmpty());
    }

    @Test
    void twentyOneFailedAttemptsAreFatal() {
        FlakyLink link = new FlakyLink(false, Integer.MAX_VALUE, true);
        RecordingSleeper sleeper = new RecordingSleeper();
        ConnectivityWatchdog w = watchdog(link, sleeper);

        ReconnectExhaustedException e = assertThrows(ReconnectExhaustedException.class, w::checkOnce);

        assertEquals(21, link.attempts);
        assertEquals(21, e.attempts());
        assertEquals(State.DISCONNECTED, w.state());
    }

    @Test
    void nineteenFailuresThenSuccessReturnsToConnected() throws Exception {
        FlakyLink link = new FlakyLink(false, 20, true);
        RecordingSleeper sleeper = new RecordingSleeper();
        ConnectivityWatchdog w = watchdog(link, sleeper);

        assertEquals(State.CONNECTED, w.checkOnce());
        assertEquals(20, link.attempts);
        assertEquals(State.CONNECTED, w.state());
    }

    @Test
    void retryDelayEscalatesAfterTenAttempts() throws Exception {
        FlakyLink link = new FlakyLink(false, 13, false);
        RecordingSleeper sleeper = new RecordingSleeper();

        watchdog(link, sleeper).checkOnce();

        List<Duration> sleeps = sleeper.sleeps();
        assertEquals(12, sleeps.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(Duration.ofSeconds(10), sleeps.get(i), "attempt " + (i + 1));
        }
        assertEquals(Duration.ofSeconds(60), sleeps.get(10));
        assertEquals(Duration.ofSeconds(60), sleeps.get(11));
    }

    @Test
    void runWaitsInitialDelayThenProbesAtInterval() {
        FlakyLink link = new FlakyLink(true, 1, false);
        RecordingSleeper sleeper = new RecordingSleeper(3);

        assertThrows(InterruptedException.class, () -> watchdog(link, sleeper).run());
        assertEquals(List.of(Duration.ofSeconds(60), Duration.ofSeconds(30), Duration.ofSeconds(30)), sleeper.sleeps());
    }

    @Test
    void policyRejectsNonPositiveMax() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), 1, Duration.ofSeconds(1), 0));
    }
}
