package com.appforge.orchestrator.repository;

import com.appforge.orchestrator.model.TaskRecord;
import com.appforge.orchestrator.model.TaskState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + recovery queries for the tasks table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface TaskRecordRepository extends JpaRepository<TaskRecord, UUID> {

    /**
     * Non-terminal tasks whose heartbeat is older than cutoff.
     * The recovery sweep re-dispatches these when no local worker owns them.
     */
    List<TaskRecord> findByStateInAndHeartbeatAtBefore(Collection<TaskState> states, Instant cutoff);
}
