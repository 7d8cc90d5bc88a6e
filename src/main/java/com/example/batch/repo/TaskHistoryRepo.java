package com.example.batch.repo;

import com.example.batch.domain.TaskHistory;
import com.example.batch.domain.TaskStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TaskHistoryRepo extends JpaRepository<TaskHistory, Long> {
    List<TaskHistory> findByTaskIdOrderByCreatedAtAscIdAsc(Long taskId);

    Page<TaskHistory> findByTaskIdOrderByCreatedAtAscIdAsc(Long taskId, Pageable pageable);

    long countByJobIdAndNewStatus(Long jobId, TaskStatus newStatus);

    long countByTaskIdAndNewStatus(Long taskId, TaskStatus newStatus);
}
