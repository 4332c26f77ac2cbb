package com.tasksync.projection.repository;

import com.tasksync.projection.domain.TaskProjection;
import com.tasksync.projection.domain.TaskProjectionKey;
import com.tasksync.shared.domain.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskProjectionRepository extends JpaRepository<TaskProjection, TaskProjectionKey> {

    Optional<TaskProjection> findByTenantIdAndTaskId(String tenantId, String taskId);

    List<TaskProjection> findByTenantIdAndActiveTrueAndTaskIdGreaterThanOrderByTaskIdAsc(
            String tenantId, String afterTaskId, Pageable page);

    List<TaskProjection> findByTenantIdAndStatusAndTaskIdGreaterThanOrderByTaskIdAsc(
            String tenantId, TaskStatus status, String afterTaskId, Pageable page);
}
