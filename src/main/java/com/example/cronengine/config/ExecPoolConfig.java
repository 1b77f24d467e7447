package com.example.cronengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 三个线程池：
 * - jobTaskScheduler：cron 定时器，触发时只把作业交给 jobDispatch，立即返回
 * - jobDispatch：每次触发占一个线程，负责守卫、等待超时、记录结果
 * - taskExec：真正执行 handler；有限队列，满了直接拒绝
 */
@Slf4j
@Configuration
public class ExecPoolConfig {

    @Bean(name = "taskExec", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor taskExec(
            @Value("${cronengine.execution.core-pool-size:8}") int corePoolSize,
            @Value("${cronengine.execution.max-pool-size:32}") int maxPoolSize,
            @Value("${cronengine.execution.queue-capacity:64}") int queueCapacity) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(corePoolSize);
        e.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        e.setQueueCapacity(queueCapacity);
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("job-runner-");
        // 不能用 CallerRuns：否则 handler 跑在等待线程上，超时失效
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // 超时的 handler 可能还在跑，关闭时不等它们
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        log.info("Job runner pool initialized core={} max={} queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return e;
    }

    @Bean(name = "jobDispatch", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor jobDispatch(
            @Value("${cronengine.dispatch.core-pool-size:4}") int corePoolSize,
            @Value("${cronengine.dispatch.max-pool-size:256}") int maxPoolSize) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(corePoolSize);
        e.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        // 容量 0 = SynchronousQueue，按需扩线程，触发不排队
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(60);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("job-dispatch-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        log.info("Job dispatch pool initialized core={} max={}", corePoolSize, maxPoolSize);
        return e;
    }

    @Bean(name = "jobTaskScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler jobTaskScheduler(
            @Value("${cronengine.scheduler.pool-size:10}") int poolSize) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(poolSize);
        s.setThreadNamePrefix("job-timer-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.setAwaitTerminationSeconds(5);
        s.initialize();
        log.info("Job timer scheduler initialized with pool size {}", poolSize);
        return s;
    }
}
