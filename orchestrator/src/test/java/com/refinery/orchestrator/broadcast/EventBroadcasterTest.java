package com.refinery.orchestrator.broadcast;

import com.refinery.orchestrator.config.RefineryProperties;
import com.refinery.orchestrator.error.NotFoundException;
import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.model.JobEventType;
import com.refinery.orchestrator.model.JobTransition;
import com.refinery.orchestrator.store.InMemoryJobStore;
import com.refinery.orchestrator.store.NewEvent;
import com.refinery.orchestrator.store.NewJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class EventBroadcasterTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    Clock            clock = Clock.systemUTC();
    InMemoryJobStore store;
    EventBroadcaster broadcaster;
    UUID             jobId;

    @BeforeEach
    void setUp() {
        store       = new InMemoryJobStore(clock);
        broadcaster = newBroadcaster(256);
        jobId       = store.createJob(new NewJob("doc", "doc.md", null, 3, "gpt-4", null)).getId();
    }

    private EventBroadcaster newBroadcaster(int buffer) {
        return new EventBroadcaster(store, clock, new RefineryProperties(
                new RefineryProperties.Orchestrator(1, 3, Duration.ofMinutes(1), Duration.ofMinutes(10)),
                new RefineryProperties.Broadcast(buffer),
                new RefineryProperties.Stream(Duration.ofSeconds(1), Duration.ofMinutes(1), new String[]{"*"})));
    }

    /** Persist then publish, in that order, like the orchestrator does. */
    private JobEvent append(JobEventType type, Integer pass) {
        JobEvent event = store.appendEvent(jobId, NewEvent.of(type, pass, type.wireName()));
        broadcaster.publish(event);
        return event;
    }

    private void cancelJob() {
        broadcaster.publishAll(store.record(jobId, JobTransition.cancel(),
                List.of(NewEvent.of(JobEventType.JOB_CANCELLED, null, "cancelled"))).events());
    }

    private static List<Long> drain(EventSubscription subscription) {
        List<Long> sequences = new ArrayList<>();
        subscription.forEachRemaining(e -> sequences.add(e.getSequence()));
        return sequences;
    }

    // ------------------------------------------------------------------
    // Catch-up then live
    // ------------------------------------------------------------------

    @Test
    void lateSubscriber_getsMissedEventsThenLiveOnes() throws Exception {
        append(JobEventType.JOB_STARTED, null);
        append(JobEventType.PASS_STARTED, 1);
        append(JobEventType.PASS_COMPLETED, 1);
        append(JobEventType.PASS_STARTED, 2);
        append(JobEventType.PASS_COMPLETED, 2);

        EventSubscription subscription = broadcaster.subscribe(jobId, 2);
        List<Long> seen = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            seen.add(subscription.poll(WAIT).orElseThrow().getSequence());
        }
        append(JobEventType.PASS_STARTED, 3);
        cancelJob();
        seen.addAll(drain(subscription));

        assertThat(seen).containsExactly(3L, 4L, 5L, 6L, 7L);
        assertThat(subscription.isFinished()).isTrue();
        assertThat(broadcaster.subscriberCount(jobId)).isZero();
    }

    @Test
    void eventsPublishedBeforeFirstPoll_areNotDuplicated() {
        append(JobEventType.JOB_STARTED, null);
        EventSubscription subscription = broadcaster.subscribe(jobId, 0);
        append(JobEventType.PASS_STARTED, 1);
        append(JobEventType.PASS_COMPLETED, 1);
        cancelJob();

        assertThat(drain(subscription)).containsExactly(1L, 2L, 3L, 4L);
    }

    @Test
    void unpublishedEvent_isRecoveredFromStore() throws Exception {
        append(JobEventType.JOB_STARTED, null);
        EventSubscription subscription = broadcaster.subscribe(jobId, 0);
        assertThat(subscription.poll(WAIT)).map(JobEvent::getSequence).contains(1L);

        // Written but never published: the next live event exposes the gap.
        store.appendEvent(jobId, NewEvent.of(JobEventType.PASS_STARTED, 1, "silent"));
        append(JobEventType.PASS_COMPLETED, 1);

        assertThat(subscription.poll(WAIT)).map(JobEvent::getSequence).contains(2L);
        assertThat(subscription.poll(WAIT)).map(JobEvent::getSequence).contains(3L);
        subscription.close();
    }

    // ------------------------------------------------------------------
    // Finished jobs
    // ------------------------------------------------------------------

    @Test
    void replayOfFinishedJob_isDeterministicAndEnds() {
        append(JobEventType.JOB_STARTED, null);
        append(JobEventType.PASS_STARTED, 1);
        cancelJob();

        List<Long> first  = drain(broadcaster.subscribe(jobId, 0));
        List<Long> second = drain(broadcaster.subscribe(jobId, 0));

        assertThat(first).containsExactly(1L, 2L, 3L).isEqualTo(second);
    }

    @Test
    void subscribingPastTheEndOfFinishedJob_endsImmediately() throws Exception {
        append(JobEventType.JOB_STARTED, null);
        cancelJob();

        EventSubscription subscription = broadcaster.subscribe(jobId, 2);

        assertThat(subscription.poll(WAIT)).isEmpty();
        assertThat(subscription.isFinished()).isTrue();
    }

    @Test
    void subscribingPastTheEndOfLiveJob_resumesFromLastEventAndEndsOnTerminal() throws Exception {
        append(JobEventType.JOB_STARTED, null);
        EventSubscription subscription = broadcaster.subscribe(jobId, 100);

        assertThat(subscription.poll(Duration.ofMillis(50))).isEmpty();
        assertThat(subscription.lastDelivered()).isEqualTo(1L);

        append(JobEventType.PASS_STARTED, 1);
        cancelJob();

        assertThat(drain(subscription)).containsExactly(2L, 3L);
        assertThat(subscription.isFinished()).isTrue();
    }

    @Test
    void unknownJob_throwsNotFound() {
        assertThatThrownBy(() -> broadcaster.subscribe(UUID.randomUUID(), 0))
                .isInstanceOf(NotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Slow subscribers
    // ------------------------------------------------------------------

    @Test
    void overflowingSubscriber_drainsBufferThenGetsResyncSentinel() throws Exception {
        broadcaster = newBroadcaster(4);
        append(JobEventType.JOB_STARTED, null);
        EventSubscription slow = broadcaster.subscribe(jobId, 0);
        assertThat(slow.poll(WAIT)).isPresent();

        for (int i = 0; i < 10; i++) {
            append(JobEventType.PASS_STARTED, 1);
        }
        assertThat(broadcaster.subscriberCount(jobId)).isZero();

        List<JobEvent> received = new ArrayList<>();
        Optional<JobEvent> next;
        while ((next = slow.poll(WAIT)).isPresent()) {
            received.add(next.get());
        }

        assertThat(received).extracting(JobEvent::getSequence).containsExactly(2L, 3L, 4L, 5L, 5L);
        JobEvent sentinel = received.get(received.size() - 1);
        assertThat(sentinel.getEventType()).isEqualTo(JobEventType.RESYNC_REQUIRED);
        assertThat(sentinel.getDetails().get("resumeFrom").asLong()).isEqualTo(5L);
        assertThat(slow.isFinished()).isTrue();
    }

    @Test
    void slowSubscriber_doesNotAffectOthers() {
        broadcaster = newBroadcaster(2);
        EventSubscription slow = broadcaster.subscribe(jobId, 0);
        EventSubscription fast = broadcaster.subscribe(jobId, 0);
        List<Long> fastSeen = new ArrayList<>();

        for (int i = 0; i < 6; i++) {
            append(JobEventType.PASS_STARTED, 1);
            fastSeen.add(fast.next().getSequence());
        }
        cancelJob();
        fastSeen.addAll(drain(fast));

        assertThat(fastSeen).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
        slow.close();
    }

    @Test
    void close_wakesBlockedConsumer() throws Exception {
        EventSubscription subscription = broadcaster.subscribe(jobId, 0);
        CountDownLatch polling = new CountDownLatch(1);
        ExecutorService consumer = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<JobEvent>> result = consumer.submit(() -> {
                polling.countDown();
                return subscription.poll(Duration.ofSeconds(30));
            });
            polling.await();
            Thread.sleep(100);
            subscription.close();

            assertThat(result.get(2, TimeUnit.SECONDS)).isEmpty();
            assertThat(broadcaster.subscriberCount(jobId)).isZero();
        } finally {
            consumer.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentSubscribers_allSeeTheSameCompleteSequence() throws Exception {
        int subscribers = 8;
        int events = 50;
        ExecutorService pool = Executors.newFixedThreadPool(subscribers + 1);
        try {
            CountDownLatch attached = new CountDownLatch(subscribers);
            List<Future<List<Long>>> results = new ArrayList<>();
            for (int i = 0; i < subscribers; i++) {
                results.add(pool.submit(() -> {
                    EventSubscription subscription = broadcaster.subscribe(jobId, 0);
                    attached.countDown();
                    return drain(subscription);
                }));
            }
            attached.await();
            pool.submit(() -> {
                for (int i = 0; i < events; i++) append(JobEventType.PASS_STARTED, 1);
                cancelJob();
            }).get(5, TimeUnit.SECONDS);

            List<Long> expected = LongStream.rangeClosed(1, events + 1).boxed().toList();
            for (Future<List<Long>> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void subscribeMidStream_fromAnyPoint_seesGaplessTail() throws Exception {
        Job job = store.getJob(jobId);
        for (int i = 0; i < 5; i++) append(JobEventType.PASS_STARTED, 1);

        EventSubscription subscription = broadcaster.subscribe(job.getId(), 3);
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            producer.submit(() -> {
                for (int i = 0; i < 5; i++) append(JobEventType.PASS_STARTED, 1);
                cancelJob();
            });
            assertThat(drain(subscription)).containsExactly(4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L);
        } finally {
            producer.shutdownNow();
        }
    }
}
