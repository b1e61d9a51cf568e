package com.flagship.event_ledger.reconciliation;

import com.flagship.event_ledger.config.ReconciliationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Triggers full and quick reconciliation on their cron cadences.
 *
 * State per check kind: IDLE -> RUNNING -> IDLE. A trigger that finds its check
 * already running is skipped. The enable toggle only affects scheduled triggers;
 * {@link #runFullCheck()}, {@link #runQuickCheck()} and {@link #runManual()} called
 * directly still honour the running flags. Manual and scheduled full runs share one flag.
 */
@Component
@Slf4j
public class ReconciliationScheduler implements SmartLifecycle {

    private final ReconciliationService reconciliationService;
    private final TaskScheduler taskScheduler;
    private final ReconciliationProperties properties;

    private final AtomicBoolean enabled;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean quickCheckRunning = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> triggers = new ArrayList<>();

    public ReconciliationScheduler(ReconciliationService reconciliationService,
                                   TaskScheduler taskScheduler,
                                   ReconciliationProperties properties) {
        this.reconciliationService = reconciliationService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.enabled = new AtomicBoolean(properties.getScheduler().isEnabled());
    }

    /**
     * Runs a full SCHEDULED reconciliation unless one is already running.
     *
     * @return false if skipped
     */
    public boolean runFullCheck() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Full reconciliation already running, skipping");
            return false;
        }
        try {
            reconciliationService.runReconciliation(ReportType.SCHEDULED);
        } catch (RuntimeException e) {
            log.error("Scheduled reconciliation failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
        return true;
    }

    /**
     * Runs a MANUAL reconciliation, ignoring the enable toggle.
     *
     * @throws ReconciliationInProgressException if a full run is already in flight
     */
    public ReconciliationReport runManual() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Manual reconciliation rejected, a run is already in progress");
            throw new ReconciliationInProgressException();
        }
        try {
            return reconciliationService.runReconciliation(ReportType.MANUAL);
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs the quick check unless one is already running.
     *
     * @return false if skipped
     */
    public boolean runQuickCheck() {
        if (!quickCheckRunning.compareAndSet(false, true)) {
            log.warn("Quick reconciliation check already running, skipping");
            return false;
        }
        try {
            reconciliationService.runQuickCheck();
        } catch (RuntimeException e) {
            log.error("Quick reconciliation check failed: {}", e.getMessage(), e);
        } finally {
            quickCheckRunning.set(false);
        }
        return true;
    }

    public SchedulerStatus getStatus() {
        return new SchedulerStatus(enabled.get(), running.get(), quickCheckRunning.get());
    }

    public void setEnabled(boolean value) {
        enabled.set(value);
        log.info("Reconciliation scheduler {}", value ? "enabled" : "disabled");
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    @Override
    public synchronized void start() {
        if (!triggers.isEmpty()) {
            return;
        }
        triggers.add(taskScheduler.schedule(this::onFullTrigger, new CronTrigger(properties.getFullCron())));
        triggers.add(taskScheduler.schedule(this::onQuickTrigger, new CronTrigger(properties.getQuickCron())));
        log.info("Reconciliation scheduled: full='{}', quick='{}'", properties.getFullCron(), properties.getQuickCron());
    }

    @Override
    public synchronized void stop() {
        triggers.forEach(trigger -> trigger.cancel(false));
        triggers.clear();
    }

    @Override
    public boolean isRunning() {
        return !triggers.isEmpty();
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getScheduler().isAutoStartup();
    }

    private void onFullTrigger() {
        if (enabled.get()) {
            runFullCheck();
        }
    }

    private void onQuickTrigger() {
        if (enabled.get()) {
            runQuickCheck();
        }
    }
}
