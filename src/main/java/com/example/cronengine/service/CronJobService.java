package com.example.cronengine.service;

import com.example.cronengine.domain.*;
import com.example.cronengine.exception.*;
import com.example.cronengine.notify.Notifier;
import com.example.cronengine.repo.JobStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import javax.validation.ConstraintViolation;
import javax.validation.ConstraintViolationException;
import javax.validation.Validator;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 引擎对外入口：启动、作业定义的增删改、手动执行、状态查询。
 */
@Slf4j
@Service
public class CronJobService {

    private final JobStore store;
    private final JobScheduler scheduler;
    private final ExecutionCoordinator coordinator;
    private final TaskRegistry registry;
    private final Notifier notifier;
    private final Validator validator;
    private final ObjectMapper mapper;
    private final ZoneId zone;
    private final boolean autoStart;

    public CronJobService(JobStore store,
                          JobScheduler scheduler,
                          ExecutionCoordinator coordinator,
                          TaskRegistry registry,
                          Notifier notifier,
                          Validator validator,
                          ObjectMapper mapper,
                          @Value("${cronengine.scheduler.zone:UTC}") ZoneId zone,
                          @Value("${cronengine.scheduler.auto-start:true}") boolean autoStart) {
        this.store = store;
        this.scheduler = scheduler;
        this.coordinator = coordinator;
        this.registry = registry;
        this.notifier = notifier;
        this.validator = validator;
        this.mapper = mapper;
        this.zone = zone;
        this.autoStart = autoStart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) {
            initialize();
        } else {
            log.info("Cron engine auto-start disabled, call initialize() to schedule jobs");
        }
    }

    /**
     * 清掉上个进程遗留的 running 标记，上报找不到 task 的作业，然后调度所有激活作业。
     * 返回已调度的作业数。
     */
    public int initialize() {
        log.info("Initializing cron job engine...");
        try {
            resetStaleRunningFlags();
            List<CronJob> active = store.listActive();
            for (CronJob job : active) {
                if (!registry.contains(job.getTaskIdentifier())) {
                    log.warn("Job {} ({}) refers to unknown task '{}'", job.getName(), job.getId(), job.getTaskIdentifier());
                    alert("Unknown Task", "Job " + job.getName() + " refers to unknown task " + job.getTaskIdentifier(),
                            Collections.singletonMap("jobId", job.getId()));
                }
            }
            int scheduled = scheduler.refreshAll(active);
            log.info("Cron job engine initialized with {} of {} active jobs", scheduled, active.size());
            return scheduled;
        } catch (RuntimeException ex) {
            log.error("Failed to initialize cron job engine", ex);
            alert("Cron Service Initialization Failed", String.valueOf(ex.getMessage()),
                    Collections.singletonMap("error", ex.toString()));
            return 0;
        }
    }

    private void resetStaleRunningFlags() {
        for (CronJob job : store.listAll()) {
            if (job.isRunning() && !coordinator.isRunning(job.getId())) {
                log.warn("Clearing stale running flag of job {} ({})", job.getName(), job.getId());
                store.markRunning(job.getId(), false);
            }
        }
    }

    // ---- 引擎操作

    /** 为已有作业安装或替换定时器，表达式非法抛 {@link InvalidScheduleException} */
    public void scheduleJob(CronJob job) {
        scheduler.schedule(job);
    }

    public void unscheduleJob(Long jobId) {
        scheduler.unschedule(jobId);
    }

    /** 重新读取激活作业并重建全部定时器 */
    public int refreshAll() {
        log.info("Refreshing cron jobs from store...");
        return scheduler.refreshAll(store.listActive());
    }

    public JobOutcome executeManual(Long jobId) {
        return coordinator.executeManual(jobId);
    }

    public EngineStatus status() {
        return new EngineStatus(scheduler.status(), coordinator.running());
    }

    // ---- 定义生命周期

    public CronJob create(CronJob definition) {
        normalize(definition);
        validateDefinition(definition, null);

        CronJob job = new CronJob();
        job.applyDefinition(definition);
        job.setNextExecutionAt(nextExecution(job.getSchedule()));
        CronJob saved = store.create(job);
        log.info("Created cron job {} ({}) task={} schedule={}", saved.getName(), saved.getId(),
                saved.getTaskIdentifier(), saved.getSchedule());

        if (saved.isActive()) {
            scheduler.scheduleOrReport(saved);
        }
        return saved;
    }

    /**
     * 在定义副本上应用 {@code patch}，校验后保存。作业运行中拒绝修改。
     * 保存后重新注册定时器（变为未激活时移除）。
     */
    public CronJob update(Long jobId, Consumer<CronJob> patch) {
        CronJob draft = get(jobId);
        ensureNotRunning(draft, "update");

        patch.accept(draft);
        normalize(draft);
        validateDefinition(draft, jobId);
        draft.setNextExecutionAt(nextExecution(draft.getSchedule()));

        CronJob saved = whileIdle(draft, "update", () -> store.update(jobId, job -> {
            // 守卫已由本线程持有，这里只看持久化标记
            if (job.isRunning()) {
                throw new JobConflictException("Cannot update a running cron job: " + job.getName());
            }
            job.applyDefinition(draft);
        }));
        log.info("Updated cron job {} ({}) active={} schedule={}", saved.getName(), jobId, saved.isActive(), saved.getSchedule());

        if (saved.isActive()) {
            scheduler.scheduleOrReport(saved);
        } else {
            scheduler.unschedule(jobId);
        }
        return saved;
    }

    /** 移除定时器，保留定义 */
    public CronJob deactivate(Long jobId) {
        return update(jobId, job -> job.setActive(false));
    }

    public CronJob activate(Long jobId) {
        return update(jobId, job -> job.setActive(true));
    }

    public void delete(Long jobId) {
        CronJob job = get(jobId);
        ensureNotRunning(job, "delete");
        boolean deleted = whileIdle(job, "delete", () -> {
            scheduler.unschedule(jobId);
            return store.delete(jobId);
        });
        if (!deleted) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Deleted cron job {} ({})", job.getName(), jobId);
    }

    public CronJob get(Long jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<CronJob> list() {
        return store.listAll();
    }

    public List<JobRun> history(Long jobId, int limit) {
        get(jobId);
        return store.history(jobId, limit);
    }

    public JobStats stats() {
        return store.stats();
    }

    public Set<String> availableTasks() {
        return registry.availableTasks();
    }

    // ---- 内部

    private void ensureNotRunning(CronJob job, String action) {
        if (job.isRunning() || coordinator.isRunning(job.getId())) {
            throw new JobConflictException("Cannot " + action + " a running cron job: " + job.getName());
        }
    }

    // 写入期间占住单飞守卫，检查与写入之间不会插进一次执行
    private <T> T whileIdle(CronJob job, String action, Supplier<T> write) {
        try {
            return coordinator.callWhileIdle(job.getId(), write);
        } catch (AlreadyRunningException ex) {
            throw new JobConflictException("Cannot " + action + " a running cron job: " + job.getName());
        }
    }

    private void normalize(CronJob job) {
        if (job.getName() != null) job.setName(job.getName().trim());
        if (job.getSchedule() != null) job.setSchedule(job.getSchedule().trim());
        if (job.getTaskIdentifier() != null) job.setTaskIdentifier(job.getTaskIdentifier().trim());
        if (job.getType() == null) job.setType(JobType.OTHER);
        if (job.getNotificationRecipients() == null) job.setNotificationRecipients(new ArrayList<>());
        if (job.getTags() == null) job.setTags(new ArrayList<>());
    }

    private void validateDefinition(CronJob job, Long excludingId) {
        Set<ConstraintViolation<CronJob>> violations = validator.validate(job);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        CronSchedule.parse(job.getSchedule());
        if (!registry.contains(job.getTaskIdentifier())) {
            throw new UnknownTaskException(job.getTaskIdentifier());
        }
        validateConfig(job.getConfig());
        if (store.existsByName(job.getName(), excludingId)) {
            throw new JobConflictException("Cron job with this name already exists: " + job.getName());
        }
    }

    private void validateConfig(String config) {
        if (config == null || config.trim().isEmpty()) return;
        JsonNode node;
        try {
            node = mapper.readTree(config);
        } catch (Exception e) {
            throw new IllegalArgumentException("Job config is not valid JSON: " + e.getMessage(), e);
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Job config must be a JSON object");
        }
    }

    private Timestamp nextExecution(String schedule) {
        return CronSchedule.parse(schedule).next(Instant.now(), zone).map(Timestamp::from).orElse(null);
    }

    private void alert(String kind, String message, Map<String, ?> details) {
        try {
            notifier.notifySystemAlert(kind, message, details);
        } catch (RuntimeException ex) {
            log.error("Failed to send system alert '{}'", kind, ex);
        }
    }
}
