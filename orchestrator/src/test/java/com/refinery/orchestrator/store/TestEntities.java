package com.refinery.orchestrator.store;

import com.refinery.orchestrator.model.Job;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity helpers for tests that never touch JPA.
 */
public final class TestEntities {

    private TestEntities() {}

    /** Reflectively set the id, which JPA normally assigns on persist. */
    public static void setId(Object entity, UUID id) {
        setField(entity, "id", id);
    }

    public static void setField(Object entity, String name, Object value) {
        try {
            var f = entity.getClass().getDeclaredField(name);
            f.setAccessible(true);
            f.set(entity, value);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static Job job(String fileId, int totalPasses, Instant now) {
        Job job = new Job(fileId, fileId + ".md", "user-1", totalPasses, "gpt-4", null, now);
        setId(job, UUID.randomUUID());
        return job;
    }
}
