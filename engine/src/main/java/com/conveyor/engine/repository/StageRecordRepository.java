package com.conveyor.engine.repository;

import com.conveyor.engine.model.StageRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StageRecordRepository extends JpaRepository<StageRecord, UUID> {

    /** Stage results of one run, in execution order. */
    List<StageRecord> findByRunIdOrderByPositionAsc(UUID runId);
}
