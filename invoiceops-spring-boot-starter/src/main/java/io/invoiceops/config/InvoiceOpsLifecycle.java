package io.invoiceops.config;

import io.invoiceops.CronScheduler;
import io.invoiceops.runner.ScheduledValidationService;
import io.invoiceops.webhook.RetrySweeper;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the cron scheduler, replays enabled jobs and starts the webhook retry sweep with the container.
 */
public class InvoiceOpsLifecycle implements SmartLifecycle {
    private final CronScheduler scheduler;
    private final ScheduledValidationService validationService;
    private final RetrySweeper retrySweeper;
    private volatile boolean running = false;

    public InvoiceOpsLifecycle(CronScheduler scheduler,
                               ScheduledValidationService validationService,
                               RetrySweeper retrySweeper) {
        this.scheduler = scheduler;
        this.validationService = validationService;
        this.retrySweeper = retrySweeper;
    }

    @Override
    public void start() {
        scheduler.start();
        validationService.registerEnabledJobs();
        retrySweeper.start();
        running = true;
    }

    @Override
    public void stop() {
        retrySweeper.stop();
        scheduler.shutdown(true);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
