package stoplight.errors;

/** No worker thread could be created or started. Never retried internally. */
public class SpawnFailureException extends RuntimeException {

    public SpawnFailureException(String message) {
        super(message);
    }

    public SpawnFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
