package com.example.cronengine.repo;

import com.example.cronengine.domain.CronJob;
import com.example.cronengine.domain.ExecutionStatus;
import com.example.cronengine.domain.JobType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface CronJobRepo extends JpaRepository<CronJob, Long> {
    List<CronJob> findByActiveTrue();

    List<CronJob> findByRunningTrue();

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);

    long countByActiveTrue();

    long countByRunningTrue();

    long countByLastExecutionStatus(ExecutionStatus status);

    long countByLastExecutionStatusIn(Collection<ExecutionStatus> statuses);

    long countByType(JobType type);

    @Modifying
    @Query("update CronJob j set j.running = ?2 where j.id = ?1")
    int updateRunning(Long id, boolean running);
}
