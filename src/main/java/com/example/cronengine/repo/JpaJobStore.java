package com.example.cronengine.repo;

import com.example.cronengine.domain.*;
import com.example.cronengine.exception.JobNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private static final int MAX_MESSAGE = 1900;
    private static final int MAX_STACK = 16_000;
    // TIMEOUT / CANCELLED 与 FAILURE 一样计入失败
    private static final Set<ExecutionStatus> FAILED_STATUSES =
            EnumSet.of(ExecutionStatus.FAILURE, ExecutionStatus.TIMEOUT, ExecutionStatus.CANCELLED);

    private final CronJobRepo jobRepo;
    private final JobRunRepo runRepo;
    private final ObjectMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<CronJob> get(Long id) {
        return id == null ? Optional.empty() : jobRepo.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CronJob> listActive() {
        return jobRepo.findByActiveTrue();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CronJob> listAll() {
        return jobRepo.findAll();
    }

    @Override
    @Transactional
    public CronJob create(CronJob job) {
        return jobRepo.save(job);
    }

    @Override
    @Transactional
    public CronJob update(Long id, Consumer<CronJob> patch) {
        CronJob job = jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
        patch.accept(job);
        return jobRepo.save(job);
    }

    @Override
    @Transactional
    public boolean delete(Long id) {
        if (!jobRepo.existsById(id)) return false;
        long runs = runRepo.deleteByJobId(id);
        jobRepo.deleteById(id);
        log.debug("Deleted job id={} with {} history rows", id, runs);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByName(String name, Long excludingId) {
        return excludingId == null
                ? jobRepo.existsByName(name)
                : jobRepo.existsByNameAndIdNot(name, excludingId);
    }

    @Override
    @Transactional
    public int markRunning(Long id, boolean running) {
        return jobRepo.updateRunning(id, running);
    }

    @Override
    @Transactional
    public Optional<CronJob> recordExecution(Long id, JobOutcome outcome, Instant nextExecutionAt) {
        Optional<CronJob> opt = jobRepo.findById(id);
        if (!opt.isPresent()) {
            log.warn("Job not found when recording execution, id={}", id);
            return Optional.empty();
        }
        CronJob job = opt.get();
        Timestamp finishedAt = new Timestamp(System.currentTimeMillis());

        job.setExecutionCount(job.getExecutionCount() + 1);
        if (outcome.isSuccess()) {
            job.setSuccessCount(job.getSuccessCount() + 1);
            job.setLastError(null);
            job.setLastExecutionResult(toJson(outcome));
        } else {
            job.setFailureCount(job.getFailureCount() + 1);
            job.setLastExecutionResult(null);
            Throwable err = outcome.getError();
            job.setLastError(new LastError(trim(outcome.errorMessage(), MAX_MESSAGE), stackTrace(err), finishedAt));
        }
        job.setLastExecutedAt(finishedAt);
        job.setLastExecutionStatus(outcome.getStatus());
        job.setLastExecutionDurationMs(outcome.getDurationMs());
        job.setNextExecutionAt(nextExecutionAt == null ? null : Timestamp.from(nextExecutionAt));
        job.setRunning(false);

        JobRun run = new JobRun();
        run.setJobId(id);
        run.setTrigger(outcome.getTrigger());
        run.setStatus(outcome.getStatus());
        run.setStartedAt(Timestamp.from(outcome.getStartedAt()));
        run.setEndedAt(finishedAt);
        run.setDurationMs(outcome.getDurationMs());
        run.setMessage(trim(outcome.errorMessage(), MAX_MESSAGE));
        runRepo.save(run);

        return Optional.of(jobRepo.save(job));
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobRun> history(Long id, int limit) {
        return runRepo.findByJobIdOrderByStartedAtDescIdDesc(id, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public JobStats stats() {
        Map<JobType, Long> byType = new EnumMap<>(JobType.class);
        for (JobType t : JobType.values()) {
            long n = jobRepo.countByType(t);
            if (n > 0) byType.put(t, n);
        }
        return new JobStats(
                jobRepo.count(),
                jobRepo.countByActiveTrue(),
                jobRepo.countByRunningTrue(),
                jobRepo.countByLastExecutionStatus(ExecutionStatus.SUCCESS),
                jobRepo.countByLastExecutionStatusIn(FAILED_STATUSES),
                Collections.unmodifiableMap(byType));
    }

    private String toJson(JobOutcome outcome) {
        if (outcome.getResult() == null || outcome.getResult().isNull()) return null;
        try {
            return mapper.writeValueAsString(outcome.getResult());
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize result of job id={} : {}", outcome.getJobId(), e.getMessage());
            return null;
        }
    }

    private static String stackTrace(Throwable t) {
        if (t == null) return null;
        Throwable root = t.getCause() != null ? t.getCause() : t;
        StringWriter sw = new StringWriter();
        root.printStackTrace(new PrintWriter(sw));
        return trim(sw.toString(), MAX_STACK);
    }

    private static String trim(String m, int max) {
        if (m == null) return null;
        return m.length() > max ? m.substring(0, max) : m;
    }
}
