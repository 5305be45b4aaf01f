package stoplight.contracts;

import stoplight.records.SpawnOptions;

/**
 * Starts task bodies on their own worker threads.
 *
 * <p>Every call creates exactly one new thread. There is no pooling and no
 * back-pressure; callers bound how many tasks they keep alive.</p>
 */
public interface TaskSpawner {

    /**
     * Allocate a fresh stop signal, start a worker running {@code body} with it,
     * and return without waiting for the body.
     *
     * @throws stoplight.errors.SpawnFailureException if no worker could be started
     */
    <T> StoppableTask<T> spawn(TaskBody<T> body, SpawnOptions options);

    /** {@link #spawn(TaskBody, SpawnOptions)} with {@link SpawnOptions#defaults()}. */
    default <T> StoppableTask<T> spawn(TaskBody<T> body) {
        return spawn(body, SpawnOptions.defaults());
    }
}
