package com.example.cronengine.service;

import com.example.cronengine.domain.CronJob;
import com.example.cronengine.domain.CronSchedule;
import com.example.cronengine.exception.InvalidScheduleException;
import com.example.cronengine.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.ScheduledFuture;

/**
 * 每个激活作业一个 cron 定时器，按固定时区计算（默认 UTC）。
 * 触发时把作业 id 交给 {@link ExecutionCoordinator#execute(Long)}。
 */
@Slf4j
@Service
public class JobScheduler {

    private final TaskScheduler taskScheduler;
    private final ExecutionCoordinator coordinator;
    private final Notifier notifier;
    private final ZoneId zone;

    // 由 this 加锁保护
    private final Map<Long, ScheduledFuture<?>> timers = new LinkedHashMap<>();

    public JobScheduler(@Qualifier("jobTaskScheduler") TaskScheduler taskScheduler,
                        ExecutionCoordinator coordinator,
                        Notifier notifier,
                        @Value("${cronengine.scheduler.zone:UTC}") ZoneId zone) {
        this.taskScheduler = taskScheduler;
        this.coordinator = coordinator;
        this.notifier = notifier;
        this.zone = zone;
    }

    /**
     * 校验表达式，替换作业原有的定时器；作业激活时装上新的，未激活则不留定时器。
     *
     * @throws InvalidScheduleException 表达式非法；原有定时器保持不变
     */
    public synchronized void schedule(CronJob job) {
        CronSchedule cron = CronSchedule.parse(job.getSchedule());
        Long jobId = job.getId();
        cancel(jobId);

        if (!job.isActive()) {
            log.debug("Job {} is inactive, no timer installed", jobId);
            return;
        }

        ScheduledFuture<?> future = taskScheduler.schedule(
                () -> coordinator.execute(jobId),
                new CronTrigger(cron.toSpringExpression(), zone));
        if (future == null) {
            log.warn("Schedule '{}' of job {} never fires, no timer installed", cron, jobId);
            return;
        }
        timers.put(jobId, future);
        log.info("Scheduled job: {} ({}) zone={}", job.getName(), cron, zone);
    }

    public synchronized void unschedule(Long jobId) {
        if (cancel(jobId)) {
            log.info("Unscheduled job: {}", jobId);
        }
    }

    /**
     * 清空所有定时器后逐个调度激活作业。调度失败的作业发系统告警并跳过。
     * 返回当前已调度数。
     */
    public int refreshAll(Collection<CronJob> jobs) {
        List<Map<String, Object>> failures = new ArrayList<>();
        int scheduled;
        synchronized (this) {
            for (ScheduledFuture<?> f : timers.values()) {
                f.cancel(false);
            }
            timers.clear();

            for (CronJob job : jobs) {
                if (!job.isActive()) continue;
                try {
                    schedule(job);
                } catch (RuntimeException ex) {
                    log.error("Failed to schedule job {} ({}): {}", job.getName(), job.getId(), ex.getMessage());
                    failures.add(failureDetails(job, ex));
                }
            }
            scheduled = timers.size();
        }

        for (Map<String, Object> d : failures) {
            reportFailure(d);
        }
        log.info("Refreshed cron jobs: {} scheduled, {} failed", scheduled, failures.size());
        return scheduled;
    }

    /** 调度作业；失败时上报而不抛异常 */
    public boolean scheduleOrReport(CronJob job) {
        try {
            schedule(job);
            return true;
        } catch (RuntimeException ex) {
            log.error("Failed to schedule job {} ({}): {}", job.getName(), job.getId(), ex.getMessage());
            reportFailure(failureDetails(job, ex));
            return false;
        }
    }

    public synchronized Set<Long> status() {
        return Collections.unmodifiableSet(new TreeSet<>(timers.keySet()));
    }

    public synchronized boolean isScheduled(Long jobId) {
        return timers.containsKey(jobId);
    }

    @PreDestroy
    public synchronized void shutdown() {
        for (ScheduledFuture<?> f : timers.values()) {
            f.cancel(false);
        }
        log.info("Job scheduler stopped, {} timers cancelled", timers.size());
        timers.clear();
    }

    private boolean cancel(Long jobId) {
        ScheduledFuture<?> prev = timers.remove(jobId);
        if (prev == null) return false;
        prev.cancel(false);
        return true;
    }

    private static Map<String, Object> failureDetails(CronJob job, RuntimeException ex) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("jobId", job.getId());
        d.put("name", job.getName());
        d.put("schedule", job.getSchedule());
        d.put("error", ex.getMessage());
        return d;
    }

    private void reportFailure(Map<String, Object> details) {
        try {
            notifier.notifySystemAlert("Job Scheduling Failed",
                    "Failed to schedule job: " + details.get("name"), details);
        } catch (RuntimeException ex) {
            log.error("Failed to send scheduling alert for job {}", details.get("jobId"), ex);
        }
    }
}
