package com.example.cronengine.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

/**
 * {@link CronJob} 的一次执行记录，与作业统计一起写入。
 */
@Entity
@Table(name = "cron_job_run", indexes = { @Index(name = "idx_run_job", columnList = "job_id, started_at") })
@Getter @Setter @ToString
public class JobRun {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_trigger", nullable = false, length = 16)
    private RunTrigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionStatus status;

    @Column(name = "started_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp startedAt;

    @Column(name = "ended_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp endedAt;

    private Long durationMs;

    @Column(length = 2000)
    private String message;
}
