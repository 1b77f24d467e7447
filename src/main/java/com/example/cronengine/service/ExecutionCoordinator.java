package com.example.cronengine.service;

import com.example.cronengine.domain.*;
import com.example.cronengine.exception.*;
import com.example.cronengine.notify.Notifier;
import com.example.cronengine.repo.JobStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * 单次触发的执行协调：单飞守卫、handler 在 taskExec 上按超时执行、经 {@link JobStore} 写统计、完成后通知。
 * <p>
 * 内存中的 {@code runningJobs} 是唯一的互斥手段，持久化的 {@code running} 字段仅供展示。
 * 超时不会中断 handler（除非 {@code cronengine.execution.interrupt-on-timeout=true}），只是不再等待，
 * 因此结果记录后它可能仍占着一个线程。不做自动重试。
 * <p>
 * 定时器线程只负责把触发交给 jobDispatch，等待和记录都在 dispatch 线程上完成。
 */
@Slf4j
@Service
public class ExecutionCoordinator {

    private final JobStore store;
    private final TaskRegistry registry;
    private final Notifier notifier;
    private final ObjectMapper mapper;
    private final AsyncTaskExecutor taskExec;
    private final TaskExecutor dispatchExec;
    private final ZoneId zone;
    private final boolean interruptOnTimeout;

    // jobId -> 本次执行开始时间
    private final Map<Long, Instant> runningJobs = new ConcurrentHashMap<>();

    public ExecutionCoordinator(JobStore store,
                                TaskRegistry registry,
                                Notifier notifier,
                                ObjectMapper mapper,
                                @Qualifier("taskExec") AsyncTaskExecutor taskExec,
                                @Qualifier("jobDispatch") TaskExecutor dispatchExec,
                                @Value("${cronengine.scheduler.zone:UTC}") ZoneId zone,
                                @Value("${cronengine.execution.interrupt-on-timeout:false}") boolean interruptOnTimeout) {
        this.store = store;
        this.registry = registry;
        this.notifier = notifier;
        this.mapper = mapper;
        this.taskExec = taskExec;
        this.dispatchExec = dispatchExec;
        this.zone = zone;
        this.interruptOnTimeout = interruptOnTimeout;
    }

    /**
     * 定时器入口：交给 jobDispatch 后立即返回，不阻塞定时器线程。
     * 上一次执行未结束时的触发会被丢弃。不抛异常。
     */
    public void execute(Long jobId) {
        try {
            dispatchExec.execute(() -> runScheduled(jobId));
        } catch (TaskRejectedException ex) {
            log.error("Dispatch pool rejected scheduled fire of job id={}", jobId, ex);
            alert("Job Dispatch Rejected", "Scheduled fire of job " + jobId + " was dropped", details(jobId, ex));
        }
    }

    private void runScheduled(Long jobId) {
        try {
            JobOutcome outcome = run(jobId, RunTrigger.SCHEDULED);
            if (!outcome.isExecuted()) {
                if (outcome.getError() instanceof AlreadyRunningException) {
                    log.debug("Job id={} is already running, skipping execution", jobId);
                } else {
                    log.warn("Scheduled fire of job id={} skipped: {}", jobId, outcome.errorMessage());
                }
            }
        } catch (RuntimeException ex) {
            log.error("Unexpected error in scheduled execution of job id={}", jobId, ex);
        }
    }

    /**
     * 手动执行，在调用线程上同步完成。被拒绝的情况（不存在、未激活、正在运行）
     * 以无 status 的 outcome 返回，不抛异常。
     */
    public JobOutcome executeManual(Long jobId) {
        return run(jobId, RunTrigger.MANUAL);
    }

    public boolean isRunning(Long jobId) {
        return runningJobs.containsKey(jobId);
    }

    public Set<Long> running() {
        return Collections.unmodifiableSet(new TreeSet<>(runningJobs.keySet()));
    }

    /**
     * 占住作业的单飞守卫后执行 {@code action}，期间该作业的触发都会被当作"正在运行"拒绝。
     * 用于修改/删除定义，避免检查与写入之间插进一次执行。
     *
     * @throws AlreadyRunningException 守卫已被占用
     */
    public <T> T callWhileIdle(Long jobId, Supplier<T> action) {
        Instant claimedAt = Instant.now();
        if (runningJobs.putIfAbsent(jobId, claimedAt) != null) {
            throw new AlreadyRunningException(jobId);
        }
        try {
            return action.get();
        } finally {
            runningJobs.remove(jobId, claimedAt);
        }
    }

    private JobOutcome run(Long jobId, RunTrigger trigger) {
        Optional<CronJob> loaded;
        try {
            loaded = store.get(jobId);
        } catch (RuntimeException ex) {
            log.error("Failed to load job id={}", jobId, ex);
            alert("Job Store Failure", "Failed to load job " + jobId, details(jobId, ex));
            return JobOutcome.rejected(jobId, trigger, ex);
        }
        if (!loaded.isPresent()) {
            log.warn("Job not found: id={}", jobId);
            return JobOutcome.rejected(jobId, trigger, new JobNotFoundException(jobId));
        }
        CronJob job = loaded.get();

        if (runningJobs.containsKey(jobId)) {
            return JobOutcome.rejected(jobId, trigger, new AlreadyRunningException(jobId));
        }
        if (!job.isActive()) {
            return JobOutcome.rejected(jobId, trigger, new JobInactiveException(jobId));
        }

        Instant startedAt = Instant.now();
        if (runningJobs.putIfAbsent(jobId, startedAt) != null) {
            return JobOutcome.rejected(jobId, trigger, new AlreadyRunningException(jobId));
        }
        try {
            markRunning(jobId);
            log.info("Executing job: id={}, name={}, task={}, trigger={}",
                    jobId, job.getName(), job.getTaskIdentifier(), trigger);

            JobOutcome outcome = invoke(job, trigger, startedAt, System.nanoTime());
            CronJob recorded = record(job, outcome);
            notifyOutcome(recorded, outcome);

            if (outcome.isSuccess()) {
                log.info("Job completed: id={}, name={} ({}ms)", jobId, job.getName(), outcome.getDurationMs());
            } else {
                log.warn("Job {}: id={}, name={} ({}ms): {}", outcome.getStatus(), jobId, job.getName(),
                        outcome.getDurationMs(), outcome.errorMessage());
            }
            return outcome;
        } finally {
            runningJobs.remove(jobId, startedAt);
        }
    }

    private JobOutcome invoke(CronJob job, RunTrigger trigger, Instant startedAt, long t0) {
        Long jobId = job.getId();
        Optional<TaskRunner> runner = registry.resolve(job.getTaskIdentifier());
        if (!runner.isPresent()) {
            return JobOutcome.failed(jobId, trigger, ExecutionStatus.FAILURE, startedAt, elapsed(t0),
                    new UnknownTaskException(job.getTaskIdentifier()));
        }

        JsonNode config;
        try {
            config = parseConfig(job.getConfig());
        } catch (Exception ex) {
            return JobOutcome.failed(jobId, trigger, ExecutionStatus.FAILURE, startedAt, elapsed(t0),
                    new CronEngineException("Invalid job config: " + ex.getMessage(), ex));
        }

        TaskRunner r = runner.get();
        Future<JsonNode> future;
        try {
            future = taskExec.submit(() -> r.run(config));
        } catch (TaskRejectedException ex) {
            log.error("Worker pool rejected job id={}", jobId, ex);
            return JobOutcome.failed(jobId, trigger, ExecutionStatus.FAILURE, startedAt, elapsed(t0),
                    new CronEngineException("Worker pool saturated, job not started", ex));
        }

        try {
            JsonNode result = future.get(job.getTimeoutMs(), TimeUnit.MILLISECONDS);
            return JobOutcome.success(jobId, trigger, startedAt, elapsed(t0), result);
        } catch (TimeoutException te) {
            if (interruptOnTimeout) {
                future.cancel(true);
            }
            log.warn("Job id={} timed out after {}ms, handler {}", jobId, job.getTimeoutMs(),
                    interruptOnTimeout ? "interrupted" : "left running");
            return JobOutcome.failed(jobId, trigger, ExecutionStatus.TIMEOUT, startedAt, elapsed(t0),
                    new ExecutionTimeoutException(job.getTimeoutMs()));
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() == null ? ee : ee.getCause();
            log.error("Job failed id={}", jobId, cause);
            return JobOutcome.failed(jobId, trigger, ExecutionStatus.FAILURE, startedAt, elapsed(t0),
                    new TaskHandlerException(cause));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for job id={}", jobId);
            return JobOutcome.failed(jobId, trigger, ExecutionStatus.CANCELLED, startedAt, elapsed(t0),
                    new CronEngineException("Interrupted during execution", ie));
        }
    }

    private void markRunning(Long jobId) {
        try {
            store.markRunning(jobId, true);
        } catch (RuntimeException ex) {
            log.error("Failed to persist running flag for job id={}", jobId, ex);
            alert("Job Store Failure", "Failed to mark job " + jobId + " as running", details(jobId, ex));
        }
    }

    private CronJob record(CronJob job, JobOutcome outcome) {
        Instant next = nextFire(job.getSchedule());
        try {
            return store.recordExecution(job.getId(), outcome, next).orElse(job);
        } catch (RuntimeException ex) {
            log.error("Failed to record execution of job id={}", job.getId(), ex);
            alert("Job Store Failure", "Failed to record execution of job: " + job.getName(), details(job.getId(), ex));
            try {
                store.markRunning(job.getId(), false);
            } catch (RuntimeException again) {
                log.error("Failed to clear running flag for job id={}", job.getId(), again);
            }
            return job;
        }
    }

    private void notifyOutcome(CronJob job, JobOutcome outcome) {
        boolean wanted = outcome.isSuccess() ? job.isNotifyOnSuccess() : job.isNotifyOnFailure();
        List<String> to = job.getNotificationRecipients();
        if (!wanted || to == null || to.isEmpty()) {
            return;
        }
        try {
            notifier.notifyJobOutcome(job, outcome);
        } catch (RuntimeException ex) {
            log.error("Notifier failed for job id={}", job.getId(), ex);
        }
    }

    private void alert(String kind, String message, Map<String, ?> details) {
        try {
            notifier.notifySystemAlert(kind, message, details);
        } catch (RuntimeException ex) {
            log.error("Failed to send system alert '{}'", kind, ex);
        }
    }

    private JsonNode parseConfig(String config) throws Exception {
        if (config == null || config.trim().isEmpty()) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(config);
    }

    private Instant nextFire(String schedule) {
        try {
            return CronSchedule.parse(schedule).next(Instant.now(), zone).orElse(null);
        } catch (InvalidScheduleException ex) {
            return null;
        }
    }

    private static Map<String, Object> details(Long jobId, Throwable ex) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("jobId", jobId);
        d.put("error", String.valueOf(ex.getMessage()));
        return d;
    }

    private static long elapsed(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }
}
