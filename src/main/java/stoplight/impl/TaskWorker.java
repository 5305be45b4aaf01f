package stoplight.impl;

import stoplight.contracts.StopSignal;
import stoplight.contracts.TaskBody;
import stoplight.contracts.TaskListener;
import stoplight.records.JoinResult;

/**
 * The {@link Runnable} a worker thread executes: runs the body once and
 * captures its outcome so nothing escapes the thread uncaught.
 */
final class TaskWorker<T> implements Runnable {

    private final TaskBody<T> body;
    private final StopSignal signal;
    private final TaskListener listener;

    // Written by the worker thread before it exits; Thread.join() publishes it to the joiner.
    private JoinResult<T> outcome;

    TaskWorker(TaskBody<T> body, StopSignal signal, TaskListener listener) {
        this.body = body;
        this.signal = signal;
        this.listener = listener;
    }

    @Override
    public void run() {
        String name = Thread.currentThread().getName();
        long startNs = System.nanoTime();
        notifyListener(name, () -> listener.onStart(name));

        JoinResult<T> result = execute();
        outcome = result;

        if (result.isOk()) {
            long elapsed = System.nanoTime() - startNs;
            notifyListener(name, () -> listener.onFinish(name, elapsed));
        } else {
            notifyListener(name, () -> listener.onFault(name, result.fault()));
        }
    }

    private JoinResult<T> execute() {
        try {
            return JoinResult.ok(body.run(signal));
        } catch (Throwable t) {
            return JoinResult.fault(t);
        }
    }

    /**
     * Only valid after the worker thread has terminated. {@code null} if the
     * thread never ran this worker.
     */
    JoinResult<T> outcome() {
        return outcome;
    }

    private static void notifyListener(String name, Runnable event) {
        try {
            event.run();
        } catch (Throwable t) {
            // A broken listener must not turn into a task fault or lose the outcome; report and carry on.
            System.err.println("Task listener failed in worker thread: " + name);
            t.printStackTrace();
        }
    }
}
