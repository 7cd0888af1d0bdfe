package com.refinery.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tuning knobs bound from the "refinery.*" keys in application.yml.
 *
 * Passed explicitly into the orchestrator, broadcaster and stream relay
 * constructors; nothing reads configuration from static state.
 */
@ConfigurationProperties(prefix = "refinery")
public record RefineryProperties(@DefaultValue Orchestrator orchestrator,
                                 @DefaultValue Broadcast broadcast,
                                 @DefaultValue Stream stream) {

    /**
     * @param maxConcurrentJobs  worker threads; further jobs wait in PENDING
     * @param maxAttemptsPerPass attempts per pass before the job fails
     * @param passTimeout        deadline for one refinement call
     * @param staleAfter         idle time after which the watchdog re-claims a job
     */
    public record Orchestrator(@DefaultValue("4") int maxConcurrentJobs,
                               @DefaultValue("3") int maxAttemptsPerPass,
                               @DefaultValue("5m") Duration passTimeout,
                               @DefaultValue("10m") Duration staleAfter) {
    }

    /**
     * @param subscriberBuffer live events buffered per subscriber before it is dropped
     */
    public record Broadcast(@DefaultValue("256") int subscriberBuffer) {
    }

    /**
     * @param heartbeatInterval idle time between heartbeat frames on SSE/WebSocket
     * @param sseTimeout        hard limit on one SSE connection
     * @param allowedOrigins    origins accepted for WebSocket upgrades
     */
    public record Stream(@DefaultValue("5s") Duration heartbeatInterval,
                         @DefaultValue("30m") Duration sseTimeout,
                         @DefaultValue("*") String[] allowedOrigins) {
    }
}
