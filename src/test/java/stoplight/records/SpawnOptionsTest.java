package stoplight.records;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import stoplight.constants.CoreConstants;
import stoplight.contracts.TaskListener;

class SpawnOptionsTest {

    @Test
    void defaultsFollowCoreConstants() {
        SpawnOptions o = SpawnOptions.defaults();
        assertNull(o.name());
        assertEquals(CoreConstants.DEFAULT_DAEMON, o.daemon());
        assertSame(TaskListener.NONE, o.listener());
    }

    @Test
    void builderSetsEveryField() {
        TaskListener l = new TaskListener() {};
        SpawnOptions o = SpawnOptions.builder().name("poller").daemon(false).listener(l).build();
        assertEquals("poller", o.name());
        assertFalse(o.daemon());
        assertSame(l, o.listener());
    }

    @Test
    void listenerIsMandatory() {
        assertThrows(NullPointerException.class,
                () -> SpawnOptions.builder().listener(null).build());
    }
}
