package com.tasksync.command.eventstore;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskEventRecordRepository extends JpaRepository<TaskEventRecord, String> {

    List<TaskEventRecord> findByTenantIdAndTaskIdOrderByStreamVersionAsc(String tenantId, String taskId);

    List<TaskEventRecord> findByTenantIdAndTaskIdAndStreamVersionGreaterThanOrderByStreamVersionAsc(
            String tenantId, String taskId, long streamVersion);

    Optional<TaskEventRecord> findByIdAndTenantIdAndTaskId(String id, String tenantId, String taskId);

    List<TaskEventRecord> findByTenantIdOrderByIdAsc(String tenantId);

    Optional<TaskEventRecord> findFirstByTenantIdAndTaskIdOrderByStreamVersionDesc(String tenantId, String taskId);

    @Query("SELECT COALESCE(MAX(e.streamVersion), 0) FROM TaskEventRecord e " +
           "WHERE e.tenantId = :tenantId AND e.taskId = :taskId")
    long findMaxStreamVersion(@Param("tenantId") String tenantId, @Param("taskId") String taskId);
}
