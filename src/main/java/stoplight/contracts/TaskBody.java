package stoplight.contracts;

/**
 * Unit of work executed on a dedicated worker thread.
 *
 * <p>The body is expected to poll {@link StopSignal#isStopRequested()} and
 * return once it reads {@code true}. Nothing forces it to: a body that never
 * polls simply runs to its own completion.</p>
 *
 * @param <T> type of the value handed back through {@link StoppableTask#join()}
 */
@FunctionalInterface
public interface TaskBody<T> {

    /**
     * @param stop the signal shared with the task's owner
     * @return the task's result, may be {@code null}
     * @throws Exception any failure; it is reported as a fault by {@code join()}
     */
    T run(StopSignal stop) throws Exception;
}
