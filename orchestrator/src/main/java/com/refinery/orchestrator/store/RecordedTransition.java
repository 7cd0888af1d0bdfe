package com.refinery.orchestrator.store;

import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobEvent;

import java.util.List;

/**
 * Result of JobStore.record: the job after the transition and the events that
 * were appended with it, in sequence order. Both are durable once returned.
 */
public record RecordedTransition(Job job, List<JobEvent> events) {
}
