package stoplight.records;

import stoplight.errors.WorkerFaultException;

import java.util.Objects;

/**
 * Outcome of joining a task: either the value the body returned, or the
 * {@link Throwable} that ended it.
 *
 * @param value the body's return value; {@code null} for a fault (or a body that returned null)
 * @param fault what the body threw; {@code null} when the body returned normally
 * @param <T>   the body's result type
 */
public record JoinResult<T>(T value, Throwable fault) {

    /** Normal completion carrying {@code value}, which may be {@code null}. */
    public static <T> JoinResult<T> ok(T value) {
        return new JoinResult<>(value, null);
    }

    /** Abnormal termination caused by {@code fault}. */
    public static <T> JoinResult<T> fault(Throwable fault) {
        return new JoinResult<>(null, Objects.requireNonNull(fault, "fault"));
    }

    /** @return {@code true} if the body returned normally */
    public boolean isOk() { return fault == null; }

    /** @return {@code true} if the body threw */
    public boolean isFault() { return fault != null; }

    /**
     * @return the body's value
     * @throws WorkerFaultException if the body faulted; the fault is its cause
     */
    public T unwrap() {
        if (fault != null) {
            throw new WorkerFaultException(fault);
        }
        return value;
    }

    /** The body's value, or {@code other} if it faulted. */
    public T orElse(T other) {
        return fault == null ? value : other;
    }
}
