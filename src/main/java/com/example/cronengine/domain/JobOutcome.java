package com.example.cronengine.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 作业一次触发的结果。
 * <p>
 * 实际执行过的带 {@link ExecutionStatus}；被拒绝的（作业不存在、未激活、正在运行）没有 status，
 * 只有 error，既没调用 handler 也没写库。
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class JobOutcome {
    private final Long jobId;
    private final RunTrigger trigger;
    private final ExecutionStatus status;
    private final Instant startedAt;
    private final long durationMs;
    private final JsonNode result;
    private final Throwable error;

    public static JobOutcome success(Long jobId, RunTrigger trigger, Instant startedAt, long durationMs, JsonNode result) {
        return new JobOutcome(jobId, trigger, ExecutionStatus.SUCCESS, startedAt, durationMs, result, null);
    }

    public static JobOutcome failed(Long jobId, RunTrigger trigger, ExecutionStatus status,
                                    Instant startedAt, long durationMs, Throwable error) {
        if (status == ExecutionStatus.SUCCESS) {
            throw new IllegalArgumentException("failed outcome cannot have status SUCCESS");
        }
        return new JobOutcome(jobId, trigger, status, startedAt, durationMs, null, error);
    }

    public static JobOutcome rejected(Long jobId, RunTrigger trigger, Throwable reason) {
        return new JobOutcome(jobId, trigger, null, Instant.now(), 0L, null, reason);
    }

    public boolean isExecuted() {
        return status != null;
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public String errorMessage() {
        if (error == null) return null;
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
