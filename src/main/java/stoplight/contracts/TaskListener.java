package stoplight.contracts;

/**
 * Lifecycle callbacks for a spawned task.
 *
 * <p>All methods are invoked on the worker thread and should return quickly.
 * A listener that throws does not change the task's result.</p>
 */
public interface TaskListener {

    /** Listener that ignores every event. */
    TaskListener NONE = new TaskListener() {};

    /** The worker has started and is about to run the body. */
    default void onStart(String taskName) {}

    /** The body returned normally after {@code elapsedNanos}. */
    default void onFinish(String taskName, long elapsedNanos) {}

    /** The body terminated by throwing {@code fault}. */
    default void onFault(String taskName, Throwable fault) {}
}
