package com.ai.dialer.component;

import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.service.CallerIdLockService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Optional background purge of expired caller ID locks. Stores already ignore expired locks,
 * so this only keeps the table small.
 */
@Component
public class CallerIdLockSweeper {

    private static final Logger log = LoggerFactory.getLogger(CallerIdLockSweeper.class);

    private final CallerIdLockService lockService;
    private final TaskScheduler taskScheduler;
    private final Duration interval;

    public CallerIdLockSweeper(CallerIdLockService lockService, TaskScheduler taskScheduler, DialerProperties properties) {
        this.lockService = lockService;
        this.taskScheduler = taskScheduler;
        this.interval = properties.getLock().getSweepInterval();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        taskScheduler.scheduleWithFixedDelay(this::sweep, interval);
        log.info("Caller ID lock sweep every {}", interval);
    }

    void sweep() {
        try {
            int purged = lockService.purgeExpired();
            if (purged > 0) {
                log.info("Purged {} expired caller ID locks", purged);
            }
        } catch (RuntimeException e) {
            log.warn("Caller ID lock sweep failed", e);
        }
    }
}
