package io.invoiceops.internal;

import io.invoiceops.CronScheduler;
import io.invoiceops.JobCallback;
import io.invoiceops.core.ScheduleEntry;
import io.invoiceops.core.SchedulerSettings;
import io.invoiceops.exception.JobAlreadyRunningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cron scheduler with an in-memory registry.
 *
 * <p>One dispatcher thread takes due firings from a {@link DelayQueue} and hands job bodies to a
 * fixed worker pool, so a slow job never blocks the timer loop.
 *
 * <p>Firing policy:
 * <ul>
 *   <li>At most one execution per job id. A firing due while the job runs is skipped, not queued.</li>
 *   <li>Missed firings are coalesced: after a firing the next one is computed from the current time.</li>
 *   <li>A firing found later than the misfire grace time is dropped and the next one armed.</li>
 * </ul>
 */
public class InMemoryCronScheduler implements CronScheduler {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCronScheduler.class);

    // upper bound on how long the dispatcher sleeps before re-reading the clock
    private static final long DISPATCH_TICK_MILLIS = 250;

    private final SchedulerSettings settings;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentHashMap<String, Registration> registrations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicBoolean> executing = new ConcurrentHashMap<>();
    private final DelayQueue<Firing> queue = new DelayQueue<>();

    private ExecutorService workerPool;
    private Thread dispatcherThread;

    private static final class Registration {
        private final String jobId;
        private final CronTrigger trigger;
        private final JobCallback callback;

        private volatile boolean paused;
        private volatile Instant nextFireTime;

        private Registration(String jobId, CronTrigger trigger, JobCallback callback) {
            this.jobId = jobId;
            this.trigger = trigger;
            this.callback = callback;
        }
    }

    private final class Firing implements Delayed {
        private final Registration registration;
        private final Instant fireAt;

        private Firing(Registration registration, Instant fireAt) {
            this.registration = registration;
            this.fireAt = fireAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), fireAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof Firing o) {
                return this.fireAt.compareTo(o.fireAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public InMemoryCronScheduler(SchedulerSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public InMemoryCronScheduler(SchedulerSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Scheduler starting with workerThreads={}, misfireGraceTime={}, coalesce={}, registrations={}",
                settings.workerThreads(),
                settings.misfireGraceTime(),
                settings.coalesce(),
                registrations.size());

        AtomicInteger threadIndex = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r);
            t.setName("invoiceops.scheduler.worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("invoiceops.scheduler.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        Instant now = clock.instant();
        for (Registration reg : registrations.values()) {
            if (!reg.paused) {
                arm(reg, reg.trigger.nextAfter(now));
            }
        }
        log.info("Scheduler started successfully.");
    }

    @Override
    public void shutdown(boolean waitForRunning) {
        ExecutorService pool;
        synchronized (this) {
            if (!started.compareAndSet(true, false)) {
                return;
            }
            log.info("Scheduler stopping waitForRunning={}", waitForRunning);

            if (dispatcherThread != null) {
                dispatcherThread.interrupt();
                dispatcherThread = null;
            }
            queue.clear();
            pool = workerPool;
            workerPool = null;
        }

        if (pool != null) {
            pool.shutdown();
            if (waitForRunning) {
                try {
                    if (!pool.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("Scheduler shutdown timed out with jobs still running timeout={}",
                                settings.shutdownTimeout());
                        pool.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    pool.shutdownNow();
                }
            }
        }
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public synchronized void addJob(String jobId, String cronExpression, String timezone, JobCallback callback) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(callback, "callback must not be null");

        // parse before touching the registry so a bad schedule leaves the old registration intact
        CronTrigger trigger = CronTrigger.parse(cronExpression, timezone);
        Registration reg = new Registration(jobId, trigger, callback);
        Registration previous = registrations.put(jobId, reg);
        arm(reg, trigger.nextAfter(clock.instant()));

        if (previous != null) {
            log.info("Scheduler replaced job id={} cron='{}' timezone={} nextFireTime={}",
                    jobId, cronExpression, timezone, reg.nextFireTime);
        } else {
            log.info("Scheduler added job id={} cron='{}' timezone={} nextFireTime={}",
                    jobId, cronExpression, timezone, reg.nextFireTime);
        }
    }

    @Override
    public synchronized boolean removeJob(String jobId) {
        Registration removed = registrations.remove(jobId);
        if (removed == null) {
            return false;
        }
        executing.computeIfPresent(jobId, (k, flag) -> flag.get() ? flag : null);
        log.info("Scheduler removed job id={}", jobId);
        return true;
    }

    @Override
    public synchronized void pauseJob(String jobId) {
        Registration reg = requireRegistration(jobId);
        reg.paused = true;
        reg.nextFireTime = null;
        log.info("Scheduler paused job id={}", jobId);
    }

    @Override
    public synchronized void resumeJob(String jobId) {
        Registration reg = requireRegistration(jobId);
        if (!reg.paused) {
            return;
        }
        reg.paused = false;
        arm(reg, reg.trigger.nextAfter(clock.instant()));
        log.info("Scheduler resumed job id={} nextFireTime={}", jobId, reg.nextFireTime);
    }

    @Override
    public Instant nextFireTime(String jobId) {
        Registration reg = registrations.get(jobId);
        return reg == null ? null : reg.nextFireTime;
    }

    @Override
    public List<ScheduleEntry> getAllJobs() {
        List<ScheduleEntry> entries = new ArrayList<>(registrations.size());
        for (Registration reg : registrations.values()) {
            entries.add(new ScheduleEntry(
                    reg.jobId,
                    reg.trigger.expression(),
                    reg.trigger.timezone(),
                    reg.nextFireTime,
                    reg.paused,
                    isExecuting(reg.jobId)
            ));
        }
        entries.sort(Comparator.comparing(ScheduleEntry::jobId));
        return entries;
    }

    @Override
    public <T> CompletableFuture<T> submitExclusive(String jobId, Callable<T> task) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(task, "task must not be null");

        ExecutorService pool = workerPool;
        if (!started.get() || pool == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Scheduler is not running"));
        }
        if (!tryAcquire(jobId)) {
            return CompletableFuture.failedFuture(new JobAlreadyRunningException(jobId));
        }

        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            pool.execute(() -> {
                try {
                    future.complete(task.call());
                } catch (Throwable e) {
                    future.completeExceptionally(e);
                } finally {
                    release(jobId);
                }
            });
        } catch (RejectedExecutionException e) {
            release(jobId);
            future.completeExceptionally(new IllegalStateException("Scheduler is shutting down", e));
        }
        return future;
    }

    private Registration requireRegistration(String jobId) {
        Registration reg = registrations.get(jobId);
        if (reg == null) {
            throw new IllegalArgumentException("No scheduled job with id: " + jobId);
        }
        return reg;
    }

    // Caller holds the monitor.
    private void arm(Registration reg, Instant next) {
        reg.nextFireTime = next;
        if (next == null) {
            log.warn("Scheduler job has no further firings id={}", reg.jobId);
            return;
        }
        if (started.get()) {
            queue.offer(new Firing(reg, next));
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                Firing firing = queue.poll(DISPATCH_TICK_MILLIS, TimeUnit.MILLISECONDS);
                if (firing != null) {
                    dispatch(firing);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Scheduler dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void dispatch(Firing firing) {
        Registration reg = firing.registration;
        Instant now;
        ExecutorService pool;
        synchronized (this) {
            if (!started.get()
                    || registrations.get(reg.jobId) != reg
                    || reg.paused
                    || !firing.fireAt.equals(reg.nextFireTime)) {
                // replaced, removed, paused or re-armed since this firing was queued
                return;
            }
            now = clock.instant();
            Instant base = settings.coalesce() && now.isAfter(firing.fireAt) ? now : firing.fireAt;
            arm(reg, reg.trigger.nextAfter(base));
            pool = workerPool;
        }

        Duration lateness = Duration.between(firing.fireAt, now);
        if (lateness.compareTo(settings.misfireGraceTime()) > 0) {
            log.warn("Scheduler dropped misfired job id={} scheduledFor={} lateBy={} nextFireTime={}",
                    reg.jobId, firing.fireAt, lateness, reg.nextFireTime);
            return;
        }

        if (!tryAcquire(reg.jobId)) {
            log.warn("Scheduler skipped firing; previous run still in progress id={} scheduledFor={}",
                    reg.jobId, firing.fireAt);
            return;
        }

        try {
            pool.execute(() -> execute(reg));
        } catch (RejectedExecutionException e) {
            release(reg.jobId);
            log.warn("Scheduler could not submit job id={}; worker pool is shut down", reg.jobId);
        }
    }

    private void execute(Registration reg) {
        Instant startedAt = clock.instant();
        log.debug("Scheduler job started id={} at={}", reg.jobId, startedAt);
        try {
            reg.callback.run();
            log.debug("Scheduler job finished id={} at={}", reg.jobId, clock.instant());
        } catch (Exception e) {
            log.error("Scheduler job failed id={} msg={}", reg.jobId, e.getMessage(), e);
        } finally {
            release(reg.jobId);
        }
    }

    private boolean tryAcquire(String jobId) {
        return executing.computeIfAbsent(jobId, k -> new AtomicBoolean(false)).compareAndSet(false, true);
    }

    private void release(String jobId) {
        AtomicBoolean flag = executing.get(jobId);
        if (flag != null) {
            flag.set(false);
        }
    }

    private boolean isExecuting(String jobId) {
        AtomicBoolean flag = executing.get(jobId);
        return flag != null && flag.get();
    }
}
