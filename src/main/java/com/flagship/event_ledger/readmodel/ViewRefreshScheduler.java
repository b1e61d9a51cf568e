package com.flagship.event_ledger.readmodel;

import com.flagship.event_ledger.config.MaterializedViewProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the full read-model refresh on a fixed interval. A tick arriving while
 * the previous refresh is still running is skipped.
 */
@Component
@Slf4j
public class ViewRefreshScheduler implements SmartLifecycle {

    private final MaterializedViewService materializedViewService;
    private final TaskScheduler taskScheduler;
    private final MaterializedViewProperties properties;

    private final AtomicBoolean refreshing = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduled;

    public ViewRefreshScheduler(MaterializedViewService materializedViewService,
                                TaskScheduler taskScheduler,
                                MaterializedViewProperties properties) {
        this.materializedViewService = materializedViewService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    /**
     * @return false if a refresh was already running
     */
    public boolean runRefresh() {
        if (!refreshing.compareAndSet(false, true)) {
            log.info("Full refresh already running, skipping this tick");
            return false;
        }
        try {
            materializedViewService.refreshAll();
        } catch (RuntimeException e) {
            log.error("Scheduled full refresh failed: {}", e.getMessage(), e);
        } finally {
            refreshing.set(false);
        }
        return true;
    }

    public boolean isRefreshing() {
        return refreshing.get();
    }

    @Override
    public synchronized void start() {
        if (scheduled == null) {
            scheduled = taskScheduler.scheduleWithFixedDelay(this::runRefresh,
                    Instant.now().plus(properties.getRefreshInterval()), properties.getRefreshInterval());
            log.info("Full read-model refresh scheduled every {}", properties.getRefreshInterval());
        }
    }

    @Override
    public synchronized void stop() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
    }

    @Override
    public boolean isRunning() {
        return scheduled != null;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getScheduler().isAutoStartup();
    }
}
