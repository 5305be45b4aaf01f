package stoplight.impl;

import stoplight.constants.CoreConstants;
import stoplight.contracts.StopSignal;
import stoplight.contracts.StoppableTask;
import stoplight.contracts.TaskBody;
import stoplight.contracts.TaskSpawner;
import stoplight.errors.SpawnFailureException;
import stoplight.records.SpawnOptions;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Default {@link TaskSpawner}: one new platform thread per task.
 * <p>
 * Order of a spawn: signal allocated, thread created by the {@link ThreadFactory},
 * options applied, thread started, handle returned. Any failure on the way
 * surfaces as a {@link SpawnFailureException}; nothing is retried.
 * </p>
 * <p>
 * <strong>Usage:</strong>
 * <pre>
 * TaskSpawner spawner = new TaskSpawnerImpl();
 * StoppableTask&lt;Integer&gt; task = spawner.spawn(stop -&gt; {
 *     while (!stop.isStopRequested()) { }
 *     return 42;
 * });
 * int answer = task.join().unwrap();
 * </pre>
 */
public final class TaskSpawnerImpl implements TaskSpawner {

    private final ThreadFactory threadFactory;

    public TaskSpawnerImpl() {
        this(new NamedThreadFactory(CoreConstants.DEFAULT_NAME_PREFIX, CoreConstants.DEFAULT_DAEMON));
    }

    /**
     * @param threadFactory source of worker threads; the daemon flag and, when given,
     *                      the name from {@link SpawnOptions} override what it sets
     */
    public TaskSpawnerImpl(ThreadFactory threadFactory) {
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
    }

    @Override
    public <T> StoppableTask<T> spawn(TaskBody<T> body, SpawnOptions options) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(options, "options");

        StopSignal signal = new StopSignalImpl();
        TaskWorker<T> worker = new TaskWorker<>(body, signal, options.listener());

        Thread thread;
        try {
            thread = threadFactory.newThread(worker);
        } catch (RuntimeException | OutOfMemoryError e) {
            throw new SpawnFailureException("Thread factory failed to create a worker", e);
        }
        if (thread == null) {
            throw new SpawnFailureException("Thread factory returned no worker thread");
        }

        try {
            if (options.name() != null) {
                thread.setName(options.name());
            }
            thread.setDaemon(options.daemon());
            thread.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            // OutOfMemoryError here means "unable to create native thread".
            // A factory may already have started the thread; tell that body to stop.
            signal.requestStop();
            throw new SpawnFailureException("Could not start worker " + thread.getName(), e);
        }
        return new StoppableTaskImpl<>(thread, signal, worker);
    }
}
