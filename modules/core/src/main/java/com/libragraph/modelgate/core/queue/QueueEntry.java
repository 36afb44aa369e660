package com.libragraph.modelgate.core.queue;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * Delivery of one task id. {@code claimedBy} is null until a worker wins it.
 */
public record QueueEntry(
        @ColumnName("id") long id,
        @ColumnName("task_id") String taskId,
        @ColumnName("enqueued_at") Instant enqueuedAt,
        @ColumnName("claimed_by") String claimedBy,
        @ColumnName("claimed_at") Instant claimedAt,
        @ColumnName("deliveries") int deliveries
) {
    public boolean isClaimed() {
        return claimedBy != null;
    }
}
