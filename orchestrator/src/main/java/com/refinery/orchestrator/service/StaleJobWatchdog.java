package com.refinery.orchestrator.service;

import com.refinery.orchestrator.config.RefineryProperties;
import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobStatus;
import com.refinery.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Puts unfinished jobs back on the worker pool.
 *
 * At startup every PENDING or PROCESSING job is dispatched, since no worker
 * survived the restart. Afterwards, every tick re-dispatches jobs in those
 * states that have not been touched for stale-after and have no worker on
 * this node. The orchestrator resumes them from their last completed pass.
 */
@Component
@EnableScheduling
public class StaleJobWatchdog {

    private static final Logger log = LoggerFactory.getLogger(StaleJobWatchdog.class);

    private static final Set<JobStatus> UNFINISHED = EnumSet.of(JobStatus.PENDING, JobStatus.PROCESSING);

    private final JobStore        jobStore;
    private final JobOrchestrator orchestrator;
    private final Clock           clock;
    private final Duration        staleAfter;

    public StaleJobWatchdog(JobStore jobStore, JobOrchestrator orchestrator,
                            Clock clock, RefineryProperties properties) {
        this.jobStore     = jobStore;
        this.orchestrator = orchestrator;
        this.clock        = clock;
        this.staleAfter   = properties.orchestrator().staleAfter();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeOnStartup() {
        int dispatched = redispatch(jobStore.findStale(UNFINISHED, clock.instant()));
        if (dispatched > 0) {
            log.info("Resumed {} unfinished job(s) after startup", dispatched);
        }
    }

    /**
     * fixedDelay: the next sweep starts a full interval after this one ends.
     */
    @Scheduled(fixedDelayString = "${refinery.orchestrator.watchdog-interval-ms:60000}",
               initialDelayString = "${refinery.orchestrator.watchdog-interval-ms:60000}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(staleAfter);
        int dispatched = redispatch(jobStore.findStale(UNFINISHED, cutoff));
        if (dispatched > 0) {
            log.warn("Re-dispatched {} stale job(s) not updated since {}", dispatched, cutoff);
        }
    }

    private int redispatch(List<Job> jobs) {
        int dispatched = 0;
        for (Job job : jobs) {
            if (orchestrator.isActive(job.getId())) continue;
            log.info("Dispatching unfinished job {} ({}, pass {}/{}, last update {})",
                    job.getId(), job.getStatus(), job.getCurrentPass(), job.getTotalPasses(), job.getUpdatedAt());
            if (orchestrator.dispatch(job.getId())) dispatched++;
        }
        return dispatched;
    }
}
