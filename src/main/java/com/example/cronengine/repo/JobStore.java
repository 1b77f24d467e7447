package com.example.cronengine.repo;

import com.example.cronengine.domain.CronJob;
import com.example.cronengine.domain.JobOutcome;
import com.example.cronengine.domain.JobRun;
import com.example.cronengine.domain.JobStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 作业定义与统计的持久化。每个调用各自原子。
 */
public interface JobStore {
    Optional<CronJob> get(Long id);

    List<CronJob> listActive();

    List<CronJob> listAll();

    CronJob create(CronJob job);

    /** 读出作业、应用 {@code patch} 后保存；不存在时抛 {@code JobNotFoundException} */
    CronJob update(Long id, Consumer<CronJob> patch);

    boolean delete(Long id);

    boolean existsByName(String name, Long excludingId);

    int markRunning(Long id, boolean running);

    /**
     * 累计本次结果、写最近一次执行字段、清 {@code running}、存下次触发时间，并追加一条执行历史。
     * 返回更新后的作业；期间作业被删则返回 empty。
     */
    Optional<CronJob> recordExecution(Long id, JobOutcome outcome, Instant nextExecutionAt);

    List<JobRun> history(Long id, int limit);

    JobStats stats();
}
