package stoplight.impl;

import stoplight.contracts.StopSignal;
import stoplight.contracts.StoppableTask;
import stoplight.errors.DoubleJoinException;
import stoplight.records.JoinResult;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A started worker thread bundled with its stop signal.
 *
 * <p>{@link #join()} waits with {@link Thread#join()} and nothing else; if the
 * body never polls the signal the caller waits forever. Interrupting the
 * joining thread does not cut the wait short: the interrupt is remembered and
 * re-asserted once the worker has exited.</p>
 */
public final class StoppableTaskImpl<T> implements StoppableTask<T> {

    private final Thread thread;
    private final StopSignal signal;
    private final TaskWorker<T> worker;
    private final AtomicBoolean joined = new AtomicBoolean(false);

    StoppableTaskImpl(Thread thread, StopSignal signal, TaskWorker<T> worker) {
        this.thread = thread;
        this.signal = signal;
        this.worker = worker;
    }

    @Override
    public JoinResult<T> join() {
        if (Thread.currentThread() == thread) {
            throw new IllegalStateException("Task " + thread.getName() + " cannot join itself");
        }
        signal.requestStop();
        if (!joined.compareAndSet(false, true)) {
            throw new DoubleJoinException(thread.getName());
        }

        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        JoinResult<T> outcome = worker.outcome();
        if (outcome == null) {
            // The thread factory handed back a thread that never ran the worker.
            return JoinResult.fault(new IllegalStateException(
                    "Worker " + thread.getName() + " produced no outcome"));
        }
        return outcome;
    }

    @Override public StopSignal stopSignal() { return signal; }

    @Override public boolean isFinished() { return !thread.isAlive(); }

    @Override public boolean isJoined() { return joined.get(); }

    @Override public String name() { return thread.getName(); }

    @Override
    public String toString() {
        return "StoppableTask[" + thread.getName()
                + (isFinished() ? ", finished" : ", running")
                + (signal.isStopRequested() ? ", stop requested]" : "]");
    }
}
