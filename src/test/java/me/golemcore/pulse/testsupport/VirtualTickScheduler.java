package me.golemcore.pulse.testsupport;

import me.golemcore.pulse.port.outbound.TickScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Single-threaded scheduler driven by a {@link MutableClock}. Nothing runs
 * until {@link #advance(Duration)} moves virtual time past a task's next run.
 */
public class VirtualTickScheduler implements TickScheduler {

    private final MutableClock clock;
    private final List<Task> tasks = new ArrayList<>();

    public VirtualTickScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Handle schedule(String name, Runnable runnable, Duration initialDelay, Duration interval) {
        Task task = new Task(name, runnable, clock.instant().plus(initialDelay), interval);
        tasks.add(task);
        return () -> task.cancelled = true;
    }

    @Override
    public void shutdown() {
        tasks.forEach(task -> task.cancelled = true);
    }

    /**
     * Runs tasks in time order until virtual time reaches {@code now + duration}.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<Task> next = tasks.stream()
                    .filter(task -> !task.cancelled)
                    .filter(task -> !task.nextRunAt.isAfter(target))
                    .min(Comparator.comparing((Task task) -> task.nextRunAt));
            if (next.isEmpty()) {
                break;
            }
            Task task = next.get();
            clock.set(task.nextRunAt);
            task.runnable.run();
            task.nextRunAt = clock.instant().plus(task.interval);
        }
        clock.set(target);
    }

    /**
     * Runs the named task now, outside its schedule.
     */
    public void fire(String name) {
        tasks.stream()
                .filter(task -> task.name.equals(name) && !task.cancelled)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No armed task: " + name))
                .runnable.run();
    }

    public long activeTasks() {
        return tasks.stream().filter(task -> !task.cancelled).count();
    }

    private static final class Task {
        private final String name;
        private final Runnable runnable;
        private final Duration interval;
        private Instant nextRunAt;
        private volatile boolean cancelled;

        private Task(String name, Runnable runnable, Instant nextRunAt, Duration interval) {
            this.name = name;
            this.runnable = runnable;
            this.nextRunAt = nextRunAt;
            this.interval = interval;
        }
    }
}
