package stoplight.contracts;

import stoplight.records.JoinResult;

/**
 * Handle to a running worker and the stop signal it shares with its body.
 *
 * <p>Cancellation is cooperative only. {@link #join()} raises the stop signal
 * and then waits for the worker to exit, <strong>however long that takes</strong>:
 * a body that never polls the signal makes {@code join()} block forever.
 * There is no forced termination and no timeout.</p>
 *
 * @param <T> the body's result type
 */
public interface StoppableTask<T> {

    /**
     * Request stop, then block until the worker has exited.
     *
     * <p>May be called once. The worker's outcome is returned as a value;
     * a fault inside the body is never rethrown here.</p>
     *
     * @return {@link JoinResult#isOk() ok} with the body's value, or a fault
     *         carrying whatever the body threw
     * @throws stoplight.errors.DoubleJoinException if this task was already joined
     * @throws IllegalStateException if called from the task's own worker thread
     */
    JoinResult<T> join();

    /** The signal shared with the body. */
    StopSignal stopSignal();

    /** Raise the stop signal without waiting. Same as {@code stopSignal().requestStop()}. */
    default void requestStop() { stopSignal().requestStop(); }

    /** @return {@code true} once the worker thread has exited; never blocks */
    boolean isFinished();

    /** @return {@code true} once {@link #join()} has been called */
    boolean isJoined();

    /** Name of the worker thread. */
    String name();
}
