package dev.schedin.job;

import java.time.Instant;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * A persisted job, as read from the {@code jobs} table together with its payload row.
 *
 * @param interval normalized interval in seconds for recurring schedules, null for one-shot jobs
 * @param nextRunAt null only for jobs stored without a schedule
 */
public record Job(
    UUID userId,
    UUID jobId,
    String name,
    @Nullable String description,
    JobType type,
    @Nullable String schedule,
    @Nullable Long interval,
    @Nullable Instant nextRunAt,
    Instant createdAt,
    int runs,
    int errorCount,
    JobStatus status,
    Payload payload) {}
