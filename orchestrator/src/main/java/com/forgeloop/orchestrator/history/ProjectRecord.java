package com.forgeloop.orchestrator.history;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One completed project, appended by the learning phase.
 *
 * Rows are never updated; the ThresholdOptimizer reads them in batch.
 *
 * DB table: project_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "project_records",
       uniqueConstraints = @UniqueConstraint(columnNames = {"project_name", "started_at"}))
public class ProjectRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_name", nullable = false)
    private String projectName;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at", nullable = false, updatable = false)
    private Instant completedAt;

    // Implemented (leaf) items per category at the thresholds in force.
    @Column(name = "simple_items", nullable = false)
    private int simpleItems;

    @Column(name = "medium_items", nullable = false)
    private int mediumItems;

    // Items that had to be decomposed before implementation.
    @Column(name = "complex_items", nullable = false)
    private int complexItems;

    // Simple items whose remainder had to be split off mid-item.
    @Column(name = "simple_splits", nullable = false)
    private int simpleSplits;

    // Medium items that needed three or more sub-units (commits).
    @Column(name = "medium_three_commits", nullable = false)
    private int mediumThreeCommits;

    // Items whose actual resource went above the ceiling.
    @Column(name = "overflow_items", nullable = false)
    private int overflowItems;

    @Column(name = "total_items", nullable = false)
    private int totalItems;

    @Column(name = "verification_attempts", nullable = false)
    private int verificationAttempts;

    @Column(name = "estimated_resource", nullable = false)
    private long estimatedResource;

    @Column(name = "actual_resource", nullable = false)
    private long actualResource;

    protected ProjectRecord() {}   // JPA

    public ProjectRecord(String projectName, Instant startedAt, Instant completedAt) {
        this.projectName = projectName;
        this.startedAt   = startedAt;
        this.completedAt = completedAt;
    }

    /** Estimated over actual resource; 1.0 is a perfect estimate. Null when nothing was spent. */
    public Double estimateAccuracy() {
        return actualResource == 0 ? null : (double) estimatedResource / actualResource;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID    getId()                   { return id; }
    public String  getProjectName()          { return projectName; }
    public Instant getStartedAt()            { return startedAt; }
    public Instant getCompletedAt()          { return completedAt; }
    public int     getSimpleItems()          { return simpleItems; }
    public int     getMediumItems()          { return mediumItems; }
    public int     getComplexItems()         { return complexItems; }
    public int     getSimpleSplits()         { return simpleSplits; }
    public int     getMediumThreeCommits()   { return mediumThreeCommits; }
    public int     getOverflowItems()        { return overflowItems; }
    public int     getTotalItems()           { return totalItems; }
    public int     getVerificationAttempts() { return verificationAttempts; }
    public long    getEstimatedResource()    { return estimatedResource; }
    public long    getActualResource()       { return actualResource; }

    public void setSimpleItems(int v)          { this.simpleItems = v; }
    public void setMediumItems(int v)          { this.mediumItems = v; }
    public void setComplexItems(int v)         { this.complexItems = v; }
    public void setSimpleSplits(int v)         { this.simpleSplits = v; }
    public void setMediumThreeCommits(int v)   { this.mediumThreeCommits = v; }
    public void setOverflowItems(int v)        { this.overflowItems = v; }
    public void setTotalItems(int v)           { this.totalItems = v; }
    public void setVerificationAttempts(int v) { this.verificationAttempts = v; }
    public void setEstimatedResource(long v)   { this.estimatedResource = v; }
    public void setActualResource(long v)      { this.actualResource = v; }
}
