package com.libragraph.modelgate.core.task;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * Row of the {@code task} table. JSON columns stay serialized here;
 * {@link TaskStore} decodes them into views.
 */
public record TaskRecord(
        @ColumnName("id") String id,
        @ColumnName("model") String model,
        @ColumnName("provider") String provider,
        @ColumnName("parameters") String parameters,
        @ColumnName("is_async") boolean async,
        @ColumnName("status") TaskStatus status,
        @ColumnName("principal") String principal,
        @ColumnName("result") String result,
        @ColumnName("error") String error,
        @ColumnName("attempts") int attempts,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("started_at") Instant startedAt,
        @ColumnName("completed_at") Instant completedAt
) {}
