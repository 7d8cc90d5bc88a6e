package com.example.batch.repo;

import com.example.batch.domain.BatchJob;
import com.example.batch.domain.JobStatus;
import com.example.batch.domain.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import javax.persistence.LockModeType;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface JobRepo extends JpaRepository<BatchJob, Long>, JpaSpecificationExecutor<BatchJob> {
    Optional<BatchJob> findByIdAndTenantId(Long id, Long tenantId);

    boolean existsByIdAndTenantId(Long id, Long tenantId);

    /**
     * 行锁（SELECT ... FOR UPDATE），按 job 串行化进度重算、取消、重试与分配。
     * 加锁顺序固定为 job -> task -> worker。
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from BatchJob j where j.id = :id")
    Optional<BatchJob> lockById(@Param("id") Long id);

    @Query("select j.id from BatchJob j where j.status = :status " +
            "and (j.scheduledStart is null or j.scheduledStart <= :now) order by j.id asc")
    List<Long> findDueIds(@Param("status") JobStatus status, @Param("now") Timestamp now);

    @Query("select j from BatchJob j where j.status in :statuses " +
            "and exists (select t.id from BatchTask t where t.jobId = j.id and t.status = :taskStatus) " +
            "order by j.createdAt asc, j.id asc")
    List<BatchJob> findWithTaskInStatus(@Param("statuses") Collection<JobStatus> statuses,
                                        @Param("taskStatus") TaskStatus taskStatus);

    @Query("select j from BatchJob j where j.status in :statuses and j.timeoutMinutes is not null " +
            "and j.actualStart is not null and j.actualStart < :startedBefore")
    List<BatchJob> findTimeoutCandidates(@Param("statuses") Collection<JobStatus> statuses,
                                     @Param("startedBefore") Timestamp startedBefore);
}
