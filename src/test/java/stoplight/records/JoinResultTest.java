package stoplight.records;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import stoplight.errors.WorkerFaultException;

class JoinResultTest {

    @Test
    void okCarriesValue() {
        JoinResult<String> r = JoinResult.ok("done");
        assertTrue(r.isOk());
        assertFalse(r.isFault());
        assertEquals("done", r.unwrap());
        assertEquals("done", r.orElse("other"));
        assertNull(r.fault());
    }

    @Test
    void okMayCarryNull() {
        JoinResult<Void> r = JoinResult.ok(null);
        assertTrue(r.isOk());
        assertNull(r.unwrap());
    }

    @Test
    void faultIsDistinguishableAndUnwrapThrows() {
        IllegalArgumentException boom = new IllegalArgumentException("boom");
        JoinResult<Integer> r = JoinResult.fault(boom);

        assertTrue(r.isFault());
        assertFalse(r.isOk());
        assertSame(boom, r.fault());
        assertEquals(7, r.orElse(7));

        WorkerFaultException e = assertThrows(WorkerFaultException.class, r::unwrap);
        assertSame(boom, e.getCause());
    }

    @Test
    void faultRequiresThrowable() {
        assertThrows(NullPointerException.class, () -> JoinResult.fault(null));
    }
}
