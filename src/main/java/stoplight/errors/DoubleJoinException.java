package stoplight.errors;

/** A task handle was joined more than once. This is a programming error. */
public class DoubleJoinException extends IllegalStateException {

    public DoubleJoinException(String taskName) {
        super("Task " + taskName + " has already been joined");
    }
}
