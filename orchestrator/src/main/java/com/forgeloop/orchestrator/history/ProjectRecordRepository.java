package com.forgeloop.orchestrator.history;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store of completed projects.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface ProjectRecordRepository extends JpaRepository<ProjectRecord, UUID> {

    boolean existsByProjectNameAndStartedAt(String projectName, Instant startedAt);

    List<ProjectRecord> findAllByOrderByCompletedAtAsc();
}
