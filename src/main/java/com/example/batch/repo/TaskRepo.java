package com.example.batch.repo;

import com.example.batch.domain.BatchTask;
import com.example.batch.domain.JobType;
import com.example.batch.domain.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import javax.persistence.LockModeType;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TaskRepo extends JpaRepository<BatchTask, Long>, JpaSpecificationExecutor<BatchTask> {
    Optional<BatchTask> findByIdAndTenantId(Long id, Long tenantId);

    List<BatchTask> findByJobIdOrderBySequenceNumberAsc(Long jobId);

    @Query("select t.jobId from BatchTask t where t.id = :id")
    Optional<Long> findJobIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from BatchTask t where t.id = :id")
    Optional<BatchTask> lockById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from BatchTask t where t.jobId = :jobId order by t.id asc")
    List<BatchTask> lockByJobId(@Param("jobId") Long jobId);

    /**
     * 领取候选：按 sequence_number 最小的 PENDING
     */
    @Query("select t.id from BatchTask t where t.jobId = :jobId and t.status = :status order by t.sequenceNumber asc, t.id asc")
    List<Long> findIdsByJobIdAndStatus(@Param("jobId") Long jobId, @Param("status") TaskStatus status, Pageable page);

    /**
     * 原子地将任务从 from 转为 to 并写入 worker。
     * 只有当前仍为 from 时更新成功（返回 1），返回 0 表示被其它调用方抢走。
     */
    @Modifying(flushAutomatically = true)
    @Query("update BatchTask t set t.status = :to, t.workerId = :workerId, t.updatedAt = :now " +
            "where t.id = :id and t.status = :from")
    int compareAndSetWorker(@Param("id") Long id,
                            @Param("workerId") Long workerId,
                            @Param("from") TaskStatus from,
                            @Param("to") TaskStatus to,
                            @Param("now") Timestamp now);

    long countByJobId(Long jobId);

    long countByJobIdAndStatus(Long jobId, TaskStatus status);

    List<BatchTask> findByWorkerIdAndStatusOrderByIdAsc(Long workerId, TaskStatus status);

    long countByWorkerIdAndStatusIn(Long workerId, Collection<TaskStatus> statuses);

    @Query("select t from BatchTask t where t.status = :status and t.timeoutMinutes is not null and t.startedAt is not null")
    List<BatchTask> findTimed(@Param("status") TaskStatus status);

    @Query("select j.type from BatchJob j, BatchTask t where t.id = :taskId and j.id = t.jobId")
    Optional<JobType> findJobTypeByTaskId(@Param("taskId") Long taskId);
}
