package com.refinery.orchestrator.broadcast;

import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One observer's view of one job's event stream.
 *
 * The first pull replays durable events after 'sinceSequence' from the Job
 * Store, then switches to the live buffer filled by EventBroadcaster.publish.
 * The subscription is registered for live events before the replay is read,
 * so the two overlap rather than leave a hole; anything at or below the last
 * delivered sequence is skipped, and a jump ahead re-reads the store to fill
 * the gap.
 *
 * The stream ends after a terminal job event, after the RESYNC_REQUIRED
 * sentinel (live buffer overflowed), or when close() is called. It cannot be
 * restarted; subscribe again with the last sequence seen.
 *
 * Pulling (poll/hasNext/next) is meant for a single consumer thread.
 * offer() and close() may be called from any thread.
 */
public class EventSubscription implements Iterator<JobEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventSubscription.class);

    // Pushed by close() to wake a consumer blocked on the live buffer.
    private static final JobEvent WAKE_UP = new JobEvent(null, -1, null, null, null, null, null);

    // How long hasNext() waits per round before re-checking for close().
    private static final Duration ITERATOR_WAIT = Duration.ofSeconds(1);

    private final EventBroadcaster        broadcaster;
    private final JobStore                jobStore;
    private final Clock                   clock;
    private final UUID                    jobId;
    private final BlockingQueue<JobEvent> live;
    private final Deque<JobEvent>         replay = new ArrayDeque<>();

    private volatile boolean overflowed;
    private volatile boolean closed;

    // Consumer-thread state.
    private long     lastDelivered;
    private boolean  caughtUp;
    private boolean  finished;
    private JobEvent lookahead;

    EventSubscription(EventBroadcaster broadcaster, JobStore jobStore, Clock clock,
                      UUID jobId, long sinceSequence, int bufferSize) {
        this.broadcaster   = broadcaster;
        this.jobStore      = jobStore;
        this.clock         = clock;
        this.jobId         = jobId;
        this.lastDelivered = Math.max(0, sinceSequence);
        this.live          = new ArrayBlockingQueue<>(bufferSize);
    }

    // ------------------------------------------------------------------
    // Publisher side
    // ------------------------------------------------------------------

    /**
     * Hand a live event to this subscriber without blocking.
     *
     * @return false if the buffer is full; the subscription is then marked
     *         overflowed and must be detached by the caller
     */
    boolean offer(JobEvent event) {
        if (closed || overflowed) return true;
        if (live.offer(event)) return true;
        overflowed = true;
        return false;
    }

    // ------------------------------------------------------------------
    // Consumer side
    // ------------------------------------------------------------------

    /**
     * Next event in sequence order, waiting at most 'timeout' for a live one.
     *
     * @return empty on timeout or once the stream has ended (see {@link #isFinished()})
     */
    public Optional<JobEvent> poll(Duration timeout) throws InterruptedException {
        if (lookahead != null) {
            JobEvent e = lookahead;
            lookahead = null;
            return Optional.of(e);
        }
        if (finished) return Optional.empty();

        if (!caughtUp) {
            catchUp();
            if (finished) return Optional.empty();
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            JobEvent next = replay.pollFirst();
            if (next != null) {
                if (next.getSequence() <= lastDelivered) {
                    if (endsStream(next)) return Optional.empty();
                    continue;
                }
                return Optional.of(deliver(next));
            }

            if (closed) {
                finish();
                return Optional.empty();
            }

            if (overflowed && live.isEmpty()) {
                log.warn("Subscriber on job {} overflowed its live buffer after sequence {}; asking it to resync",
                        jobId, lastDelivered);
                finish();
                return Optional.of(JobEvent.resyncRequired(jobId, lastDelivered, clock.instant()));
            }

            long remaining = deadline - System.nanoTime();
            JobEvent event = remaining > 0 ? live.poll(remaining, TimeUnit.NANOSECONDS) : live.poll();
            if (event == null) {
                if (overflowed || closed) continue;
                return Optional.empty();
            }
            if (event == WAKE_UP) continue;
            if (event.getSequence() <= lastDelivered) {
                if (endsStream(event)) return Optional.empty();
                continue;
            }
            if (event.getSequence() > lastDelivered + 1) {
                log.debug("Gap on job {}: have {}, got {}; re-reading store", jobId, lastDelivered, event.getSequence());
                replay.addAll(jobStore.listEvents(jobId, lastDelivered));
                replay.addLast(event);
                continue;
            }
            return Optional.of(deliver(event));
        }
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) return true;
        try {
            while (!finished) {
                Optional<JobEvent> e = poll(ITERATOR_WAIT);
                if (e.isPresent()) {
                    lookahead = e.get();
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        }
        return false;
    }

    @Override
    public JobEvent next() {
        if (!hasNext()) throw new NoSuchElementException("Event stream for job " + jobId + " has ended");
        JobEvent e = lookahead;
        lookahead = null;
        return e;
    }

    /** Stop receiving events. Safe to call more than once and from any thread. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        broadcaster.detach(this);
        live.offer(WAKE_UP);
    }

    public boolean isFinished()     { return finished && lookahead == null; }
    public UUID    getJobId()       { return jobId; }
    public long    lastDelivered()  { return lastDelivered; }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void catchUp() {
        caughtUp = true;
        // Read the job before its events: a terminal status means the terminal
        // event is already committed and will show up in the read below.
        Job job = jobStore.getJob(jobId);
        if (lastDelivered > job.getLastSequence()) {
            log.debug("Subscriber on job {} asked for events after {} but the log ends at {}; resuming from there",
                    jobId, lastDelivered, job.getLastSequence());
            lastDelivered = job.getLastSequence();
        }
        replay.addAll(jobStore.listEvents(jobId, lastDelivered));
        if (job.getStatus().isTerminal() && replay.isEmpty()) {
            finish();
        }
    }

    private JobEvent deliver(JobEvent event) {
        lastDelivered = event.getSequence();
        if (event.getEventType().isTerminal()) {
            finish();
        }
        return event;
    }

    /** A terminal event the subscriber already has still ends the stream. */
    private boolean endsStream(JobEvent skipped) {
        if (!skipped.getEventType().isTerminal()) return false;
        finish();
        return true;
    }

    private void finish() {
        finished = true;
        replay.clear();
        close();
    }
}
