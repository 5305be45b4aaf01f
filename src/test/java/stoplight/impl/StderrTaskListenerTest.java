package stoplight.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import stoplight.records.SpawnOptions;

class StderrTaskListenerTest {

    @Test
    void reportsEachLifecycleEvent() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
        SpawnOptions opts = SpawnOptions.builder().name("reporter").listener(new StderrTaskListener(out)).build();

        new TaskSpawnerImpl().spawn(stop -> 1, opts).join();
        new TaskSpawnerImpl().<Integer>spawn(stop -> { throw new IllegalStateException("bad state"); }, opts).join();

        String log = buf.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("[reporter] started"), log);
        assertTrue(log.contains("[reporter] finished in "), log);
        assertTrue(log.contains("[reporter] terminated abnormally: java.lang.IllegalStateException: bad state"), log);
    }
}
