package com.refinery.orchestrator.broadcast;

import com.refinery.orchestrator.config.RefineryProperties;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process fan-out of job events to live subscribers.
 *
 * publish() must only be called once the event is durable in the Job Store.
 * It never blocks: every subscriber has its own bounded buffer and a full
 * buffer detaches that subscriber instead of slowing the orchestrator.
 */
@Component
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final JobStore jobStore;
    private final Clock    clock;
    private final int      bufferSize;

    private final ConcurrentHashMap<UUID, Set<EventSubscription>> subscribers = new ConcurrentHashMap<>();

    public EventBroadcaster(JobStore jobStore, Clock clock, RefineryProperties properties) {
        this.jobStore   = jobStore;
        this.clock      = clock;
        this.bufferSize = properties.broadcast().subscriberBuffer();
    }

    /**
     * Attach to a job's events after 'sinceSequence' (0 = from the beginning).
     *
     * @throws com.refinery.orchestrator.error.NotFoundException if the job does not exist
     */
    public EventSubscription subscribe(UUID jobId, long sinceSequence) {
        jobStore.getJob(jobId);
        EventSubscription subscription =
                new EventSubscription(this, jobStore, clock, jobId, sinceSequence, bufferSize);
        subscribers.compute(jobId, (id, set) -> {
            Set<EventSubscription> target = set != null ? set : ConcurrentHashMap.newKeySet();
            target.add(subscription);
            return target;
        });
        log.debug("Subscriber attached to job {} from sequence {} ({} live)",
                jobId, sinceSequence, subscriberCount(jobId));
        return subscription;
    }

    public void publish(JobEvent event) {
        Set<EventSubscription> targets = subscribers.get(event.getJobId());
        if (targets == null) return;
        for (EventSubscription subscription : targets) {
            if (!subscription.offer(event)) {
                log.warn("Dropping live feed of a slow subscriber on job {} at sequence {}",
                        event.getJobId(), event.getSequence());
                detach(subscription);
            }
        }
    }

    public void publishAll(List<JobEvent> events) {
        events.forEach(this::publish);
    }

    public int subscriberCount(UUID jobId) {
        Set<EventSubscription> set = subscribers.get(jobId);
        return set == null ? 0 : set.size();
    }

    void detach(EventSubscription subscription) {
        subscribers.computeIfPresent(subscription.getJobId(), (id, set) -> {
            set.remove(subscription);
            return set.isEmpty() ? null : set;
        });
    }
}
