package stoplight.contracts;

/**
 * Shared one-way latch that carries a stop request from the owner of a
 * {@link StoppableTask} to the code running inside its worker.
 *
 * <p>The latch starts {@code false} and, once set, never reads {@code false}
 * again. Both operations are non-blocking and safe to call from any thread,
 * including from a tight polling loop.</p>
 */
public interface StopSignal {

    /** Ask the worker to stop. Idempotent; never blocks. */
    void requestStop();

    /** @return {@code true} once any {@link #requestStop()} has completed */
    boolean isStopRequested();
}
