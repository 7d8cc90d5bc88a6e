package com.example.batch.repo;

import com.example.batch.domain.JobHistory;
import com.example.batch.domain.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobHistoryRepo extends JpaRepository<JobHistory, Long> {
    List<JobHistory> findByJobIdOrderByCreatedAtAscIdAsc(Long jobId);

    Page<JobHistory> findByJobIdOrderByCreatedAtAscIdAsc(Long jobId, Pageable pageable);

    long countByJobIdAndNewStatus(Long jobId, JobStatus newStatus);
}
