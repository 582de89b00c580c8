package com.pharmanio.duty.scheduler;

import com.pharmanio.duty.config.DutyRosterProperties;
import com.pharmanio.duty.service.DutyRosterRefreshService;
import com.pharmanio.duty.service.RefreshResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the roster expiry check once at startup and then daily.
 */
@Slf4j
@Component
public class DutyRosterRefreshScheduler {

    private final DutyRosterRefreshService refreshService;
    private final DutyRosterProperties properties;

    public DutyRosterRefreshScheduler(DutyRosterRefreshService refreshService, DutyRosterProperties properties) {
        this.refreshService = refreshService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkOnStartup() {
        if (!properties.isCheckOnStartup()) {
            log.info("Startup on-duty check disabled via configuration.");
            return;
        }
        RefreshResult result = refreshService.ensureRosterFresh();
        log.info("Startup on-duty check finished: {}", result.outcome());
    }

    @Scheduled(cron = "${pharmanio.duty.scheduler-cron:0 0 6 * * *}", zone = "${pharmanio.duty.time-zone:Indian/Antananarivo}")
    public void checkOnSchedule() {
        if (!properties.isSchedulerEnabled()) {
            log.debug("On-duty expiry check skipped, disabled via configuration.");
            return;
        }
        RefreshResult result = refreshService.ensureRosterFresh();
        log.info("Scheduled on-duty check finished: {}", result.outcome());
    }
}
