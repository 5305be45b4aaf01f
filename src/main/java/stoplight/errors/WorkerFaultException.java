package stoplight.errors;

/**
 * Raised by {@link stoplight.records.JoinResult#unwrap()} when the task body
 * terminated abnormally. The body's throwable is the cause.
 */
public class WorkerFaultException extends RuntimeException {

    public WorkerFaultException(Throwable fault) {
        super("Task body terminated abnormally: " + fault, fault);
    }
}
