package com.conveyor.engine.repository;

import com.conveyor.engine.model.RunRecord;
import com.conveyor.engine.model.RunState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the pipeline_runs table.
 */
public interface RunRecordRepository extends JpaRepository<RunRecord, UUID> {

    /**
     * Claim the oldest QUEUED run. Row-locked so two engine instances sharing
     * the database never start the same run; must be called inside a
     * transaction that marks the run RUNNING before it commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT r FROM RunRecord r
            WHERE r.state = 'QUEUED'
            ORDER BY r.createdAt ASC
            LIMIT 1
            """)
    Optional<RunRecord> claimNextQueuedRun();

    List<RunRecord> findByState(RunState state);
}
