package au.org.ala.renditions.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Periodic housekeeping, driven externally: whoever owns the process calls {@link #run(boolean)} from time to
 * time (on each request, or from a timer) and only the tasks whose interval has elapsed are run.
 */
public class MaintenanceTasks {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceTasks.class);

    private final Clock clock;
    private final List<Task> tasks = new CopyOnWriteArrayList<>();

    public MaintenanceTasks() {
        this(Clock.systemUTC());
    }

    public MaintenanceTasks(Clock clock) {
        this.clock = clock;
    }

    public void register(String name, Runnable task, Duration interval) {
        tasks.add(new Task(name, task, interval));
    }

    /**
     * Run the tasks that are due, or all of them if {@code force} is set.
     *
     * @return the number of tasks run
     */
    public int run(boolean force) {
        Instant now = clock.instant();
        int ran = 0;
        for (Task task : tasks) {
            if (task.claim(now, force)) {
                ran++;
                try {
                    task.runnable.run();
                } catch (RuntimeException e) {
                    log.error("Maintenance task {} failed", task.name, e);
                }
            }
        }
        return ran;
    }

    private static final class Task {
        final String name;
        final Runnable runnable;
        final Duration interval;
        private Instant lastRun;

        Task(String name, Runnable runnable, Duration interval) {
            this.name = name;
            this.runnable = runnable;
            this.interval = interval;
        }

        synchronized boolean claim(Instant now, boolean force) {
            if (force || lastRun == null || !now.isBefore(lastRun.plus(interval))) {
                lastRun = now;
                return true;
            }
            return false;
        }
    }
}
