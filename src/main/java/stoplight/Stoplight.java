package stoplight;

import stoplight.contracts.StoppableTask;
import stoplight.contracts.TaskBody;
import stoplight.contracts.TaskSpawner;
import stoplight.impl.TaskSpawnerImpl;
import stoplight.records.SpawnOptions;

/**
 * Entry point for stoppable tasks.
 *
 * <pre>
 * StoppableTask&lt;Integer&gt; task = Stoplight.spawn(stop -&gt; {
 *     while (!stop.isStopRequested()) { }
 *     return 42;
 * });
 * // join() signals the task to stop, then returns its value.
 * assert task.join().unwrap() == 42;
 * </pre>
 */
public final class Stoplight {

    private static final TaskSpawner SPAWNER = new TaskSpawnerImpl();

    private Stoplight() {}

    /** Start {@code body} on a new worker thread with default options. */
    public static <T> StoppableTask<T> spawn(TaskBody<T> body) {
        return SPAWNER.spawn(body);
    }

    /** Start {@code body} on a new worker thread configured by {@code options}. */
    public static <T> StoppableTask<T> spawn(TaskBody<T> body, SpawnOptions options) {
        return SPAWNER.spawn(body, options);
    }
}
