package com.refinery.orchestrator.stream;

import com.refinery.orchestrator.api.dto.JobEventResponse;
import com.refinery.orchestrator.broadcast.EventBroadcaster;
import com.refinery.orchestrator.broadcast.EventSubscription;
import com.refinery.orchestrator.config.RefineryProperties;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.model.JobEventType;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns a pull-based EventSubscription into pushed frames.
 *
 * Each relay owns one pump thread that polls the subscription with the
 * heartbeat interval as timeout: an event becomes an event frame, a timeout
 * a heartbeat, and a finished subscription an end frame. Any send failure
 * ends the relay and closes the subscription; it never reaches other
 * observers or the job.
 */
@Component
public class ProgressRelay {

    private static final Logger log = LoggerFactory.getLogger(ProgressRelay.class);

    /** Push side of one observer connection. */
    public interface FrameSink {
        void event(JobEvent event) throws IOException;
        void heartbeat() throws IOException;
        /** Last call on a sink; not made when the relay was stopped from outside. */
        void end() throws IOException;
    }

    /** Running relay; stop() is idempotent. */
    public static final class Handle implements AutoCloseable {
        private final EventSubscription subscription;
        private final AtomicBoolean     stopped = new AtomicBoolean();

        private Handle(EventSubscription subscription) {
            this.subscription = subscription;
        }

        public void stop() {
            if (stopped.compareAndSet(false, true)) {
                subscription.close();
            }
        }

        public boolean isStopped() { return stopped.get(); }

        @Override
        public void close() { stop(); }
    }

    private final EventBroadcaster broadcaster;
    private final Duration         heartbeatInterval;
    private final Duration         sseTimeout;
    private final ExecutorService  pumps = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "refinery-relay");
        thread.setDaemon(true);
        return thread;
    });

    public ProgressRelay(EventBroadcaster broadcaster, RefineryProperties properties) {
        this.broadcaster       = broadcaster;
        this.heartbeatInterval = properties.stream().heartbeatInterval();
        this.sseTimeout        = properties.stream().sseTimeout();
    }

    @PreDestroy
    public void shutdown() {
        pumps.shutdownNow();
    }

    /**
     * Subscribe and start pumping frames into the sink.
     *
     * @throws com.refinery.orchestrator.error.NotFoundException if the job does not exist
     */
    public Handle start(UUID jobId, long sinceSequence, FrameSink sink) {
        EventSubscription subscription = broadcaster.subscribe(jobId, sinceSequence);
        Handle handle = new Handle(subscription);
        pumps.submit(() -> pump(subscription, sink, handle));
        return handle;
    }

    /**
     * Server-Sent Events view of a job: id = sequence, event = event type,
     * comment lines as heartbeats. The emitter completes after the last frame.
     *
     * @throws com.refinery.orchestrator.error.NotFoundException if the job does not exist
     */
    public SseEmitter openSse(UUID jobId, long sinceSequence) {
        SseEmitter emitter = new SseEmitter(sseTimeout.toMillis());
        Handle handle = start(jobId, sinceSequence, new FrameSink() {
            @Override
            public void event(JobEvent event) throws IOException {
                SseEmitter.SseEventBuilder frame = SseEmitter.event()
                        .name(event.getEventType().wireName())
                        .data(JobEventResponse.from(event), MediaType.APPLICATION_JSON);
                // The sentinel reuses the last delivered sequence; keep Last-Event-ID on real events.
                if (event.getEventType() != JobEventType.RESYNC_REQUIRED) {
                    frame.id(String.valueOf(event.getSequence()));
                }
                emitter.send(frame);
            }

            @Override
            public void heartbeat() throws IOException {
                emitter.send(SseEmitter.event().comment("heartbeat"));
            }

            @Override
            public void end() {
                emitter.complete();
            }
        });
        emitter.onCompletion(handle::stop);
        emitter.onTimeout(handle::stop);
        emitter.onError(e -> handle.stop());
        return emitter;
    }

    private void pump(EventSubscription subscription, FrameSink sink, Handle handle) {
        UUID jobId = subscription.getJobId();
        try {
            while (!handle.isStopped()) {
                Optional<JobEvent> next = subscription.poll(heartbeatInterval);
                if (handle.isStopped()) {
                    return;
                }
                if (next.isPresent()) {
                    sink.event(next.get());
                } else if (subscription.isFinished()) {
                    sink.end();
                    log.debug("Relay for job {} ended after sequence {}", jobId, subscription.lastDelivered());
                    return;
                } else {
                    sink.heartbeat();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | IllegalStateException e) {
            log.debug("Observer of job {} went away: {}", jobId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Relay for job {} failed", jobId, e);
        } finally {
            handle.stop();
        }
    }
}
