package com.example.cronengine.repo;

import com.example.cronengine.domain.JobRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobRunRepo extends JpaRepository<JobRun, Long> {

    List<JobRun> findByJobIdOrderByStartedAtDescIdDesc(Long jobId, Pageable page);

    long deleteByJobId(Long jobId);
}
