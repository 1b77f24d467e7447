package com.example.cronengine.domain;

import lombok.*;

import javax.persistence.*;
import javax.validation.constraints.*;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter @Setter @ToString
@Table(name = "cron_job",
        uniqueConstraints = {@UniqueConstraint(name = "uk_job_name", columnNames = "name")},
        indexes = {@Index(name = "idx_job_active_next", columnList = "active, next_execution_at"),
                @Index(name = "idx_job_type_active", columnList = "type, active")})
public class CronJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(min = 3, max = 100)
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Size(max = 500)
    @Column(length = 500)
    private String description;

    @NotBlank
    @Column(name = "schedule", nullable = false, length = 64)
    private String schedule;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private JobType type = JobType.OTHER;

    @NotBlank
    @Column(name = "task_identifier", nullable = false, length = 64)
    private String taskIdentifier;

    // JSON 对象，原样交给 handler
    @Lob
    @Column(name = "config")
    private String config;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "running", nullable = false)
    private boolean running = false;

    @Min(1)
    @Column(name = "timeout_ms", nullable = false)
    private long timeoutMs = 300_000L;

    // 只保存，引擎不做自动重试
    @Min(0)
    @Column(name = "max_retries", nullable = false)
    private int maxRetries = 3;

    @Min(0)
    @Column(name = "retry_delay_ms", nullable = false)
    private long retryDelayMs = 5_000L;

    @Min(1) @Max(10)
    @Column(name = "priority", nullable = false)
    private int priority = 5;

    private long executionCount;
    private long successCount;
    private long failureCount;

    @Column(name = "last_executed_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp lastExecutedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ExecutionStatus lastExecutionStatus;

    private Long lastExecutionDurationMs;

    @Lob
    private String lastExecutionResult;

    @Embedded
    private LastError lastError;

    @Column(name = "next_execution_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp nextExecutionAt;

    private boolean notifyOnSuccess = false;
    private boolean notifyOnFailure = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cron_job_recipient", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "email", length = 254)
    private List<@Email @NotBlank String> notificationRecipients = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cron_job_tag", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "sort_order")
    @Column(name = "tag", length = 30)
    private List<@Size(max = 30) String> tags = new ArrayList<>();

    @Column(name = "created_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp updatedAt;

    @PrePersist
    public void prePersist() {
        Timestamp now = new Timestamp(System.currentTimeMillis());
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = new Timestamp(System.currentTimeMillis());
    }

    /**
     * 从 {@code source} 复制可编辑的定义字段；id、running 标记和统计保持不变。
     */
    public void applyDefinition(CronJob source) {
        name = source.name;
        description = source.description;
        schedule = source.schedule;
        type = source.type;
        taskIdentifier = source.taskIdentifier;
        config = source.config;
        active = source.active;
        timeoutMs = source.timeoutMs;
        maxRetries = source.maxRetries;
        retryDelayMs = source.retryDelayMs;
        priority = source.priority;
        nextExecutionAt = source.nextExecutionAt;
        notifyOnSuccess = source.notifyOnSuccess;
        notifyOnFailure = source.notifyOnFailure;
        notificationRecipients = source.notificationRecipients == null
                ? new ArrayList<>() : new ArrayList<>(source.notificationRecipients);
        tags = source.tags == null ? new ArrayList<>() : new ArrayList<>(source.tags);
    }

    /** 成功率百分比，保留两位小数；从未执行为 0 */
    public BigDecimal getSuccessRate() {
        return rate(successCount);
    }

    public BigDecimal getFailureRate() {
        return rate(failureCount);
    }

    private BigDecimal rate(long count) {
        if (executionCount == 0) return BigDecimal.ZERO;
        return BigDecimal.valueOf(count * 100L)
                .divide(BigDecimal.valueOf(executionCount), 2, RoundingMode.HALF_UP);
    }
}
