package com.example.notificationscheduler.service.registry;

import com.example.notificationscheduler.exception.DuplicateJobException;
import com.example.notificationscheduler.exception.JobNotFoundException;
import com.example.notificationscheduler.service.clock.CronSchedule;
import com.example.notificationscheduler.service.clock.SchedulerClock;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Name-keyed store of {@link ScheduledJob} records.
 * <p>
 * Names are unique for the lifetime of the registry; there is no unregister.
 */
@Slf4j
public class JobRegistry {

    private final ConcurrentHashMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final SchedulerClock clock;

    public JobRegistry(SchedulerClock clock) {
        this.clock = clock;
    }

    /**
     * Register a new job with status IDLE
     *
     * @throws DuplicateJobException          if the name is taken
     * @throws IllegalArgumentException       if the name is blank
     * @throws com.example.notificationscheduler.exception.InvalidCronExpressionException
     *                                        if the schedule does not parse
     */
    public ScheduledJob register(String name, String schedule, JobTask task) {
        return register(name, schedule, task, null);
    }

    public ScheduledJob register(String name, String schedule, JobTask task, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name is required");
        }
        if (task == null) {
            throw new IllegalArgumentException("Job task is required for " + name);
        }
        if (contains(name)) {
            throw rejectDuplicate(name);
        }
        var cronSchedule = CronSchedule.parse(schedule);
        var job = new ScheduledJob(name, description, cronSchedule, task, clock.now(), sequence.incrementAndGet());

        // a concurrent registration can still win between the check and here
        if (jobs.putIfAbsent(name, job) != null) {
            throw rejectDuplicate(name);
        }

        log.info("Registered job: {} ({})", name, cronSchedule);
        return job;
    }

    /**
     * @throws JobNotFoundException if no job has this name
     */
    public ScheduledJob get(String name) {
        return find(name).orElseThrow(() -> new JobNotFoundException(name));
    }

    public Optional<ScheduledJob> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(jobs.get(name));
    }

    /**
     * All jobs, in registration order
     */
    public List<ScheduledJob> list() {
        return jobs.values().stream()
                .sorted(Comparator.comparingLong(ScheduledJob::getSequence))
                .toList();
    }

    /**
     * Replace a job's schedule, keeping its run history.
     * Rebinding to the clock is the scheduler's responsibility.
     */
    public ScheduledJob updateSchedule(String name, String newSchedule) {
        var job = get(name);
        var cronSchedule = CronSchedule.parse(newSchedule);
        job.updateSchedule(cronSchedule);
        log.info("Updated schedule of job {} to {}", name, cronSchedule);
        return job;
    }

    public boolean contains(String name) {
        return name != null && jobs.containsKey(name);
    }

    public int size() {
        return jobs.size();
    }

    private DuplicateJobException rejectDuplicate(String name) {
        log.warn("Rejected duplicate registration of job {}", name);
        return new DuplicateJobException(name);
    }
}
