package bench;

import org.openjdk.jmh.annotations.*;
import stoplight.contracts.StopSignal;
import stoplight.contracts.TaskSpawner;
import stoplight.impl.StopSignalImpl;
import stoplight.impl.TaskSpawnerImpl;

import java.util.concurrent.TimeUnit;

/** Micro-benchmark: full spawn → join round trip vs. the cost of one signal poll. */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(2)
public class SpawnJoinBench {

    @State(Scope.Thread)
    public static class Spawner {
        TaskSpawner spawner;
        StopSignal signal;

        @Setup(Level.Trial)
        public void init() {
            spawner = new TaskSpawnerImpl();
            signal = new StopSignalImpl();
        }
    }

    /** Body returns at once; measures thread creation, start and join. */
    @Benchmark
    public int spawnAndJoinImmediate(Spawner s) {
        return s.spawner.spawn(stop -> 1).join().unwrap();
    }

    /** Body spins until the stop request arrives. */
    @Benchmark
    public int spawnAndJoinPolling(Spawner s) {
        return s.spawner.spawn(stop -> {
            int spins = 0;
            while (!stop.isStopRequested()) { spins++; }
            return spins;
        }).join().unwrap();
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public boolean pollSignal(Spawner s) {
        return s.signal.isStopRequested();
    }
}
