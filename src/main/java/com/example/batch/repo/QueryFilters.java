package com.example.batch.repo;

import com.example.batch.domain.*;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import javax.persistence.criteria.Predicate;
import java.util.ArrayList;
import java.util.List;

/**
 * 列表查询的可选过滤条件，null 表示不过滤
 */
public final class QueryFilters {

    private QueryFilters() {
    }

    public static Specification<BatchJob> jobs(Long tenantId, JobStatus status, JobType type, JobPriority priority) {
        return (root, query, cb) -> {
            List<Predicate> ps = new ArrayList<>();
            ps.add(cb.equal(root.get("tenantId"), tenantId));
            if (status != null) ps.add(cb.equal(root.get("status"), status));
            if (type != null) ps.add(cb.equal(root.get("type"), type));
            if (priority != null) ps.add(cb.equal(root.get("priority"), priority));
            return cb.and(ps.toArray(new Predicate[0]));
        };
    }

    public static Specification<BatchTask> tasks(Long tenantId, Long jobId, Long workerId, TaskStatus status) {
        return (root, query, cb) -> {
            List<Predicate> ps = new ArrayList<>();
            ps.add(cb.equal(root.get("tenantId"), tenantId));
            if (jobId != null) ps.add(cb.equal(root.get("jobId"), jobId));
            if (workerId != null) ps.add(cb.equal(root.get("workerId"), workerId));
            if (status != null) ps.add(cb.equal(root.get("status"), status));
            return cb.and(ps.toArray(new Predicate[0]));
        };
    }

    public static Specification<Worker> workers(WorkerStatus status, Boolean active) {
        return (root, query, cb) -> {
            List<Predicate> ps = new ArrayList<>();
            if (status != null) ps.add(cb.equal(root.get("status"), status));
            if (active != null) ps.add(cb.equal(root.get("active"), active));
            return cb.and(ps.toArray(new Predicate[0]));
        };
    }

    /**
     * 调用方未指定排序时补上默认排序
     */
    public static Pageable sorted(Pageable pageable, Sort fallback) {
        if (pageable.isUnpaged() || pageable.getSort().isSorted()) return pageable;
        return PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), fallback);
    }
}
