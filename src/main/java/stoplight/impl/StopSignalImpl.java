package stoplight.impl;

import stoplight.contracts.StopSignal;

import java.util.concurrent.atomic.AtomicBoolean;

/** {@link StopSignal} backed by an {@link AtomicBoolean}. Only ever moves false → true. */
public final class StopSignalImpl implements StopSignal {

    private final AtomicBoolean stopFlag = new AtomicBoolean(false);

    @Override public void requestStop() { stopFlag.set(true); }

    @Override public boolean isStopRequested() { return stopFlag.get(); }

    @Override
    public String toString() {
        return "StopSignal[" + (stopFlag.get() ? "stop requested" : "running") + "]";
    }
}
