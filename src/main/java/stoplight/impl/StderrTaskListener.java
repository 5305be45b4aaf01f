package stoplight.impl;

import stoplight.contracts.TaskListener;

import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

/** Writes one line per lifecycle event, to {@code System.err} unless told otherwise. */
public final class StderrTaskListener implements TaskListener {

    private final PrintStream out;

    public StderrTaskListener() {
        this(System.err);
    }

    public StderrTaskListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onStart(String taskName) {
        out.println("[" + taskName + "] started");
    }

    @Override
    public void onFinish(String taskName, long elapsedNanos) {
        out.printf("[%s] finished in %d ms%n", taskName, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
    }

    @Override
    public void onFault(String taskName, Throwable fault) {
        out.println("[" + taskName + "] terminated abnormally: " + fault);
    }
}
