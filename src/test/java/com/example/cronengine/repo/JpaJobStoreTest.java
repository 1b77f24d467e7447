package com.example.cronengine.repo;

import com.example.cronengine.domain.*;
import com.example.cronengine.exception.ExecutionTimeoutException;
import com.example.cronengine.exception.JobNotFoundException;
import com.example.cronengine.exception.TaskHandlerException;
import com.example.cronengine.support.Jobs;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({JpaJobStore.class, JpaJobStoreTest.MapperConfig.class})
class JpaJobStoreTest {

    @TestConfiguration
    static class MapperConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    private JpaJobStore store;

    @Autowired
    private TestEntityManager em;

    @Autowired
    private ObjectMapper mapper;

    private CronJob create(String name) {
        CronJob job = Jobs.job(name, "noop");
        job.setTags(Arrays.asList("nightly", "fs"));
        job.setNotificationRecipients(Arrays.asList("ops@example.com"));
        return store.create(job);
    }

    private void reload() {
        em.flush();
        em.clear();
    }

    @Test
    void createAndReadBack() {
        CronJob created = create("stored-job");
        reload();

        CronJob loaded = store.get(created.getId()).get();
        assertThat(loaded.getName()).isEqualTo("stored-job");
        assertThat(loaded.getTags()).containsExactly("nightly", "fs");
        assertThat(loaded.getNotificationRecipients()).containsExactly("ops@example.com");
        assertThat(loaded.getCreatedAt()).isNotNull();
        assertThat(loaded.getPriority()).isEqualTo(5);
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    void recordSuccess() {
        CronJob job = create("success-job");
        store.markRunning(job.getId(), true);
        reload();
        Instant next = Instant.parse("2030-01-01T00:00:00Z");

        JobOutcome outcome = JobOutcome.success(job.getId(), RunTrigger.SCHEDULED, Instant.now(), 42L,
                mapper.createObjectNode().put("ok", true));
        store.recordExecution(job.getId(), outcome, next);
        reload();

        CronJob loaded = store.get(job.getId()).get();
        assertThat(loaded.getExecutionCount()).isEqualTo(1);
        assertThat(loaded.getSuccessCount()).isEqualTo(1);
        assertThat(loaded.getFailureCount()).isZero();
        assertThat(loaded.isRunning()).isFalse();
        assertThat(loaded.getLastExecutionStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(loaded.getLastExecutionDurationMs()).isEqualTo(42L);
        assertThat(loaded.getLastExecutionResult()).isEqualTo("{\"ok\":true}");
        assertThat(loaded.getLastError()).isNull();
        assertThat(loaded.getNextExecutionAt().toInstant()).isEqualTo(next);
        assertThat(loaded.getSuccessRate()).isEqualByComparingTo("100.00");

        List<JobRun> runs = store.history(job.getId(), 10);
        assertThat(runs).hasSize(1);
        assertThat(runs.get(0).getTrigger()).isEqualTo(RunTrigger.SCHEDULED);
        assertThat(runs.get(0).getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    void recordFailureKeepsErrorDetails() {
        CronJob job = create("failure-job");

        store.recordExecution(job.getId(), JobOutcome.failed(job.getId(), RunTrigger.MANUAL, ExecutionStatus.FAILURE,
                Instant.now(), 5L, new TaskHandlerException(new IllegalStateException("disk full"))), null);
        reload();

        CronJob loaded = store.get(job.getId()).get();
        assertThat(loaded.getFailureCount()).isEqualTo(1);
        assertThat(loaded.getLastExecutionResult()).isNull();
        assertThat(loaded.getLastError().getMessage()).isEqualTo("disk full");
        assertThat(loaded.getLastError().getStack()).contains("IllegalStateException");
        assertThat(loaded.getLastError().getTimestamp()).isNotNull();
        assertThat(loaded.getNextExecutionAt()).isNull();
        assertThat(store.history(job.getId(), 10).get(0).getMessage()).isEqualTo("disk full");
    }

    @Test
    void recordForMissingJobIsEmpty() {
        JobOutcome outcome = JobOutcome.success(999L, RunTrigger.MANUAL, Instant.now(), 1L, null);

        assertThat(store.recordExecution(999L, outcome, null)).isEmpty();
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        CronJob job = create("history-job");
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 3; i++) {
            store.recordExecution(job.getId(), JobOutcome.success(job.getId(), RunTrigger.SCHEDULED,
                    t0.plusSeconds(60L * i), i, null), null);
        }
        reload();

        List<JobRun> runs = store.history(job.getId(), 2);
        assertThat(runs).extracting(JobRun::getDurationMs).containsExactly(2L, 1L);
    }

    @Test
    void nameLookupCanExcludeJob() {
        CronJob job = create("named-job");

        assertThat(store.existsByName("named-job", null)).isTrue();
        assertThat(store.existsByName("named-job", job.getId())).isFalse();
        assertThat(store.existsByName("other-job", null)).isFalse();
    }

    @Test
    void statsAggregateOverAllJobs() {
        CronJob a = create("stats-a");
        CronJob b = create("stats-b");
        CronJob c = Jobs.job("stats-c", "noop");
        c.setType(JobType.BACKUP);
        c.setActive(false);
        store.create(c);
        CronJob d = create("stats-d");

        store.recordExecution(a.getId(), JobOutcome.success(a.getId(), RunTrigger.MANUAL, Instant.now(), 1L, null), null);
        store.recordExecution(b.getId(), JobOutcome.failed(b.getId(), RunTrigger.MANUAL, ExecutionStatus.FAILURE,
                Instant.now(), 1L, new IllegalStateException("x")), null);
        store.recordExecution(d.getId(), JobOutcome.failed(d.getId(), RunTrigger.SCHEDULED, ExecutionStatus.TIMEOUT,
                Instant.now(), 100L, new ExecutionTimeoutException(100L)), null);
        store.markRunning(b.getId(), true);
        reload();

        JobStats stats = store.stats();
        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getActive()).isEqualTo(3);
        assertThat(stats.getRunning()).isEqualTo(1);
        assertThat(stats.getLastSucceeded()).isEqualTo(1);
        // the timed-out job counts as failed
        assertThat(stats.getLastFailed()).isEqualTo(2);
        assertThat(stats.getByType()).containsEntry(JobType.MAINTENANCE, 3L).containsEntry(JobType.BACKUP, 1L);
    }

    @Test
    void timeoutCountsAsFailure() {
        CronJob job = create("timeout-job");

        store.recordExecution(job.getId(), JobOutcome.failed(job.getId(), RunTrigger.SCHEDULED, ExecutionStatus.TIMEOUT,
                Instant.now(), 100L, new ExecutionTimeoutException(100L)), null);
        reload();

        CronJob loaded = store.get(job.getId()).get();
        assertThat(loaded.getFailureCount()).isEqualTo(1);
        assertThat(loaded.getLastError().getMessage()).isEqualTo("Job execution timed out after 100ms");
        assertThat(loaded.getFailureRate()).isEqualByComparingTo("100.00");
    }

    @Test
    void deleteRemovesHistory() {
        CronJob job = create("deleted-job");
        store.recordExecution(job.getId(), JobOutcome.success(job.getId(), RunTrigger.MANUAL, Instant.now(), 1L, null), null);
        reload();

        assertThat(store.delete(job.getId())).isTrue();
        reload();

        assertThat(store.get(job.getId())).isEmpty();
        assertThat(store.history(job.getId(), 10)).isEmpty();
        assertThat(store.delete(job.getId())).isFalse();
    }

    @Test
    void updateOfMissingJobFails() {
        assertThatThrownBy(() -> store.update(12345L, j -> j.setPriority(1)))
                .isInstanceOf(JobNotFoundException.class);
    }
}
