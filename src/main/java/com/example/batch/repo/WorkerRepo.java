package com.example.batch.repo;

import com.example.batch.domain.Worker;
import com.example.batch.domain.WorkerStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 计数与状态只通过单条条件 UPDATE 修改，check-and-increment 在数据库内原子完成。
 */
@Repository
public interface WorkerRepo extends JpaRepository<Worker, Long>, JpaSpecificationExecutor<Worker> {

    String CANDIDATE_SELECT = "select new com.example.batch.repo.WorkerCandidate(w.id, w.currentTaskCount, w.lastHeartbeat) " +
            "from Worker w where w.active = true and w.status in :statuses and w.currentTaskCount < w.maxConcurrentTasks ";

    String CANDIDATE_ORDER = "order by w.currentTaskCount asc, w.lastHeartbeat asc, w.id asc";

    @Query(CANDIDATE_SELECT + CANDIDATE_ORDER)
    List<WorkerCandidate> findCandidates(@Param("statuses") Collection<WorkerStatus> statuses, Pageable page);

    @Query(CANDIDATE_SELECT + "and w.id in :pool " + CANDIDATE_ORDER)
    List<WorkerCandidate> findCandidatesIn(@Param("statuses") Collection<WorkerStatus> statuses,
                                           @Param("pool") Collection<Long> pool,
                                           Pageable page);

    @Query("select w.currentTaskCount from Worker w where w.id = :id")
    Optional<Integer> findCurrentTaskCount(@Param("id") Long id);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.currentTaskCount = w.currentTaskCount + 1, w.status = :busy, w.updatedAt = :now " +
            "where w.id = :id and w.active = true and w.status in :statuses and w.currentTaskCount < w.maxConcurrentTasks")
    int tryReserve(@Param("id") Long id,
                   @Param("busy") WorkerStatus busy,
                   @Param("statuses") Collection<WorkerStatus> statuses,
                   @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.currentTaskCount = w.currentTaskCount - 1, " +
            "w.totalTasksProcessed = w.totalTasksProcessed + :processed, " +
            "w.failedTaskCount = w.failedTaskCount + :failed, w.updatedAt = :now " +
            "where w.id = :id and w.currentTaskCount > 0")
    int release(@Param("id") Long id,
                @Param("processed") int processed,
                @Param("failed") int failed,
                @Param("now") Timestamp now);

    /**
     * 在 release 之后调用：totalTasksProcessed 已包含本次
     */
    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.averageTaskDuration = " +
            "(coalesce(w.averageTaskDuration, 0.0) * (w.totalTasksProcessed - 1) + :seconds) / w.totalTasksProcessed " +
            "where w.id = :id and w.totalTasksProcessed > 0")
    int foldDuration(@Param("id") Long id, @Param("seconds") double seconds);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.status = :to, w.updatedAt = :now " +
            "where w.id = :id and w.status in :from and w.active = true and w.currentTaskCount = 0")
    int moveIfDrained(@Param("id") Long id,
                      @Param("from") Collection<WorkerStatus> from,
                      @Param("to") WorkerStatus to,
                      @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.status = :to, w.updatedAt = :now " +
            "where w.id = :id and w.status in :from and w.active = true and w.currentTaskCount > 0")
    int moveIfLoaded(@Param("id") Long id,
                     @Param("from") Collection<WorkerStatus> from,
                     @Param("to") WorkerStatus to,
                     @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.status = :to, w.updatedAt = :now where w.id = :id")
    int updateStatus(@Param("id") Long id, @Param("to") WorkerStatus to, @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.active = :active, w.updatedAt = :now where w.id = :id")
    int updateActive(@Param("id") Long id, @Param("active") Boolean active, @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.lastHeartbeat = :ts, w.updatedAt = :now where w.id = :id")
    int touchHeartbeat(@Param("id") Long id, @Param("ts") Timestamp ts, @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true)
    @Query("update Worker w set w.status = :offline, w.updatedAt = :now " +
            "where w.active = true and w.status in :statuses and w.lastHeartbeat < :cutoff")
    int markStale(@Param("offline") WorkerStatus offline,
                  @Param("statuses") Collection<WorkerStatus> statuses,
                  @Param("cutoff") Timestamp cutoff,
                  @Param("now") Timestamp now);
}
