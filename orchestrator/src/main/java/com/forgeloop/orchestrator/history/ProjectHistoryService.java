package com.forgeloop.orchestrator.history;

import com.forgeloop.orchestrator.config.TunableThresholds;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.ComplexityCategory;
import com.forgeloop.orchestrator.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * "Record completed project": the only write path into the history store.
 */
@Service
public class ProjectHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ProjectHistoryService.class);

    private final ProjectRecordRepository repository;
    private final TunableThresholds       thresholds;
    private final Clock                   clock;

    public ProjectHistoryService(ProjectRecordRepository repository, TunableThresholds thresholds, Clock clock) {
        this.repository = repository;
        this.thresholds = thresholds;
        this.clock      = clock;
    }

    /**
     * Summarise a finished checkpoint into a ProjectRecord and append it.
     *
     * Replaying the learning phase after a crash does not append twice: a
     * project is identified by its name and start time.
     */
    @Transactional
    public ProjectRecord recordCompletedProject(Checkpoint cp) {
        String name = cp.getProject().getName();
        if (repository.existsByProjectNameAndStartedAt(name, cp.getProject().getStartedAt())) {
            log.info("Project '{}' already recorded, skipping", name);
            return null;
        }
        ProjectRecord record = summarise(cp);
        ProjectRecord saved = repository.save(record);
        log.info("Recorded project '{}': {} items, {} simple splits, {} overflows, estimate accuracy {}",
                name, saved.getTotalItems(), saved.getSimpleSplits(), saved.getOverflowItems(),
                saved.estimateAccuracy());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ProjectRecord> history() {
        return repository.findAllByOrderByCompletedAtAsc();
    }

    ProjectRecord summarise(Checkpoint cp) {
        ProjectRecord record = new ProjectRecord(cp.getProject().getName(),
                cp.getProject().getStartedAt(), clock.instant());
        long ceiling = thresholds.ceiling();
        int simple = 0, medium = 0, complex = 0, simpleSplits = 0, mediumThree = 0, overflow = 0, total = 0;
        long estimated = 0;
        long actual = 0;

        for (WorkItem item : cp.getWorkItems().values()) {
            if (item.getComplexityCategory() == ComplexityCategory.COMPLEX) {
                complex++;
            }
            if (item.isUmbrella() || !item.isScored()) {
                continue;
            }
            total++;
            estimated += item.getEstimatedResource();
            actual    += item.getActualResource();
            if (item.getActualResource() > ceiling) {
                overflow++;
            }
            switch (item.getComplexityCategory()) {
                case SIMPLE -> {
                    simple++;
                    if (item.isSplitMidItem()) simpleSplits++;
                }
                case MEDIUM -> {
                    medium++;
                    if (item.getSubUnitsUsed() >= 3) mediumThree++;
                }
                case COMPLEX -> { }
            }
        }
        record.setSimpleItems(simple);
        record.setMediumItems(medium);
        record.setComplexItems(complex);
        record.setSimpleSplits(simpleSplits);
        record.setMediumThreeCommits(mediumThree);
        record.setOverflowItems(overflow);
        record.setTotalItems(total);
        record.setVerificationAttempts(cp.getVerification().getFailureHistory().size() + 1);
        record.setEstimatedResource(estimated);
        record.setActualResource(actual);
        return record;
    }
}
