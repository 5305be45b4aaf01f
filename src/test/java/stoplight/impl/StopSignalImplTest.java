package stoplight.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class StopSignalImplTest {

    @Test
    void startsUnset() {
        assertFalse(new StopSignalImpl().isStopRequested());
    }

    @Test
    void staysSetOnceRequested() {
        StopSignalImpl signal = new StopSignalImpl();
        signal.requestStop();
        for (int i = 0; i < 1_000; i++) {
            assertTrue(signal.isStopRequested(), "latch went back to false at read " + i);
        }
    }

    @Test
    void repeatedRequestsAreHarmless() {
        StopSignalImpl signal = new StopSignalImpl();
        signal.requestStop();
        signal.requestStop();
        signal.requestStop();
        assertTrue(signal.isStopRequested());
    }

    /** A plain thread spinning on the flag must see a write made by another thread. */
    @Test
    void writeIsVisibleToPollingThread() throws Exception {
        StopSignalImpl signal = new StopSignalImpl();
        CountDownLatch polling = new CountDownLatch(1);
        Thread spinner = new Thread(() -> {
            polling.countDown();
            while (!signal.isStopRequested()) {
                Thread.onSpinWait();
            }
        }, "spinner");
        spinner.setDaemon(true);
        spinner.start();

        assertTrue(polling.await(5, TimeUnit.SECONDS));
        signal.requestStop();
        spinner.join(Duration.ofSeconds(10).toMillis());
        assertFalse(spinner.isAlive(), "spinner never observed the stop request");
    }
}
