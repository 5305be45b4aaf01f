package stoplight.records;

import stoplight.constants.CoreConstants;
import stoplight.contracts.TaskListener;

import java.util.Objects;

/**
 * Per-spawn settings for the worker thread.
 *
 * <p>Use the nested {@link Builder} to construct an instance of this record.</p>
 *
 * @param name     explicit worker thread name; {@code null} lets the thread factory pick one
 * @param daemon   whether the worker is a daemon thread
 * @param listener lifecycle callbacks, {@link TaskListener#NONE} for none
 */
public record SpawnOptions(String name, boolean daemon, TaskListener listener) {

    public SpawnOptions {
        Objects.requireNonNull(listener, "listener");
    }

    private static final SpawnOptions DEFAULTS = new Builder().build();

    /** Factory naming, {@link CoreConstants#DEFAULT_DAEMON}, no listener. */
    public static SpawnOptions defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String name = null;
        private boolean daemon = CoreConstants.DEFAULT_DAEMON;
        private TaskListener listener = TaskListener.NONE;

        public Builder name(String name) { this.name = name; return this; }
        public Builder daemon(boolean daemon) { this.daemon = daemon; return this; }
        public Builder listener(TaskListener listener) { this.listener = listener; return this; }

        public SpawnOptions build() {
            return new SpawnOptions(name, daemon, listener);
        }
    }
}
