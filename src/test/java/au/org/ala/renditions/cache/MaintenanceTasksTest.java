package au.org.ala.renditions.cache;

import au.org.ala.renditions.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;

@RunWith(JUnit4.class)
public class MaintenanceTasksTest extends TestBase {

    private static class MutableClock extends Clock {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    public void testRunsWhenDue() {
        MutableClock clock = new MutableClock();
        MaintenanceTasks tasks = new MaintenanceTasks(clock);
        AtomicInteger sweeps = new AtomicInteger();
        tasks.register("sweep", sweeps::incrementAndGet, Duration.ofHours(1));

        assertEquals(1, tasks.run(false));
        assertEquals(0, tasks.run(false));

        clock.now = clock.now.plus(Duration.ofMinutes(59));
        assertEquals(0, tasks.run(false));
        assertEquals(1, tasks.run(true));

        clock.now = clock.now.plus(Duration.ofHours(1));
        assertEquals(1, tasks.run(false));
        assertEquals(3, sweeps.get());
    }

    @Test
    public void testFailingTaskDoesNotStopOthers() {
        MaintenanceTasks tasks = new MaintenanceTasks(new MutableClock());
        AtomicInteger ran = new AtomicInteger();
        tasks.register("broken", () -> {
            throw new IllegalStateException("boom");
        }, Duration.ofMinutes(1));
        tasks.register("working", ran::incrementAndGet, Duration.ofMinutes(1));

        assertEquals(2, tasks.run(false));
        assertEquals(1, ran.get());
    }
}
