package com.forgeloop.orchestrator.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.PhaseId;
import com.forgeloop.orchestrator.model.PhaseStatus;
import com.forgeloop.orchestrator.model.ProjectIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * File-backed checkpoint store against a temp directory.
 */
class FileCheckpointStoreTest {

    @TempDir Path dir;

    Path file;
    FileCheckpointStore store;

    @BeforeEach
    void setUp() {
        file  = dir.resolve("state/checkpoint.json");
        store = new FileCheckpointStore(file, new ObjectMapper(),
                Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // load / initialize
    // ------------------------------------------------------------------

    @Test
    void load_noDocument_returnsEmpty() {
        assertThat(store.load()).isEmpty();
        assertThat(store.exists()).isFalse();
    }

    @Test
    void initialize_writesNotStartedDocument() {
        store.initialize(new ProjectIdentity("X", "build X"));

        Checkpoint cp = store.load().orElseThrow();
        assertThat(cp.getVersion()).isEqualTo(Checkpoint.CURRENT_VERSION);
        assertThat(cp.getProject().getName()).isEqualTo("X");
        assertThat(cp.getProject().getStartedAt()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
        assertThat(cp.getPhase().getStatus()).isEqualTo(PhaseStatus.NOT_STARTED);
    }

    @Test
    void initialize_existingDocument_refused() {
        store.initialize(new ProjectIdentity("X", "build X"));

        assertThatThrownBy(() -> store.initialize(new ProjectIdentity("Y", "build Y")))
                .isInstanceOf(CheckpointException.class)
                .extracting(e -> ((CheckpointException) e).getKind())
                .isEqualTo(CheckpointException.Kind.ALREADY_EXISTS);
    }

    // ------------------------------------------------------------------
    // mutate
    // ------------------------------------------------------------------

    @Test
    void mutate_persistsChangesAndLeavesNoTempFiles() throws Exception {
        store.initialize(new ProjectIdentity("X", "build X"));

        store.mutate(c -> {
            c.getWorkProgress().markOpen("1");
            c.getWorkProgress().markOpen("2");
            c.getWorkProgress().markCompleted("1");
            return c;
        });

        Checkpoint cp = store.load().orElseThrow();
        assertThat(cp.getWorkProgress().getCompletedItems()).containsExactly("1");
        assertThat(cp.getWorkProgress().getOpenItems()).containsExactly("2");
        assertThat(cp.getWorkProgress().getTotalItems()).isEqualTo(2);
        try (var files = Files.list(file.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void mutate_replayedMutation_isIdempotent() {
        store.initialize(new ProjectIdentity("X", "build X"));

        for (int i = 0; i < 2; i++) {
            store.mutate(c -> {
                c.getWorkProgress().markOpen("7");
                c.getWorkProgress().markCompleted("7");
                c.recordArtifacts(PhaseId.PHASE_0_INFRA, List.of("pom.xml"));
                c.completePhase(PhaseId.PHASE_0_INFRA);
                return c;
            });
        }

        Checkpoint cp = store.load().orElseThrow();
        assertThat(cp.getWorkProgress().getCompletedItems()).containsExactly("7");
        assertThat(cp.getArtifacts()).containsExactly("pom.xml");
        assertThat(cp.getPhaseArtifacts().get(PhaseId.PHASE_0_INFRA)).containsExactly("pom.xml");
        assertThat(cp.getPhasesCompleted()).containsExactly(PhaseId.PHASE_0_INFRA);
    }

    @Test
    void mutate_throwingMutation_leavesDocumentUnchanged() throws Exception {
        store.initialize(new ProjectIdentity("X", "build X"));
        String before = Files.readString(file);

        assertThatThrownBy(() -> store.mutate(c -> {
            c.getWorkProgress().markOpen("1");
            throw new IllegalStateException("crash");
        })).hasMessage("crash");

        assertThat(Files.readString(file)).isEqualTo(before);
    }

    @Test
    void mutate_breakingInvariants_isRejected() {
        store.initialize(new ProjectIdentity("X", "build X"));

        assertThatThrownBy(() -> store.mutate(c -> {
            c.getWorkProgress().setInProgressItem("9");   // not open
            return c;
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.load().orElseThrow().getWorkProgress().getInProgressItem()).isNull();
    }

    @Test
    void mutate_noDocument_notFound() {
        assertThatThrownBy(() -> store.mutate(c -> c))
                .isInstanceOf(CheckpointException.class)
                .extracting(e -> ((CheckpointException) e).getKind())
                .isEqualTo(CheckpointException.Kind.NOT_FOUND);
    }

    // ------------------------------------------------------------------
    // Corrupt and old documents
    // ------------------------------------------------------------------

    @Test
    void load_unparsableDocument_corruptStateAndFileKept() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ \"version\": 2, \"phase\": ");

        assertThatThrownBy(() -> store.load())
                .isInstanceOf(CheckpointException.class)
                .extracting(e -> ((CheckpointException) e).getKind())
                .isEqualTo(CheckpointException.Kind.CORRUPT_STATE);
        assertThat(Files.exists(file)).isTrue();
    }

    @Test
    void load_overlappingItemSets_corruptState() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, """
                {"version":2,"project":{"name":"X"},
                 "workProgress":{"openItems":["1"],"completedItems":["1"]}}
                """);

        assertThatThrownBy(() -> store.load())
                .isInstanceOf(CheckpointException.class)
                .hasMessageContaining("both completed and open");
    }

    @Test
    void load_newerVersion_unsupported() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"version\": 99, \"project\": {\"name\": \"X\"}}");

        assertThatThrownBy(() -> store.load())
                .isInstanceOf(CheckpointException.class)
                .extracting(e -> ((CheckpointException) e).getKind())
                .isEqualTo(CheckpointException.Kind.UNSUPPORTED_VERSION);
    }

    @Test
    void load_versionOneDocument_migrated() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, """
                {
                  "project": {"name": "X", "request": "build X"},
                  "phase": {"current": "PHASE_3_IMPLEMENTATION", "status": "IN_PROGRESS"},
                  "phasesCompleted": ["PHASE_0_INFRA", "PHASE_1_DEFINITION", "PHASE_1_5_DECOMPOSITION", "PHASE_2_ARCHITECTURE"],
                  "workProgress": {"totalItems": 2, "completedItems": ["1"], "openItems": ["2"]},
                  "resourceTracking": {"budget": 200000, "used": 42000},
                  "artifacts": ["docs/prd.md"]
                }
                """);

        Optional<Checkpoint> loaded = store.load();

        Checkpoint cp = loaded.orElseThrow();
        assertThat(cp.getVersion()).isEqualTo(2);
        assertThat(cp.getWorkItems()).isEmpty();
        assertThat(cp.getDisclosures()).isEmpty();
        assertThat(cp.getResourceTracking().getCumulativeUsed()).isEqualTo(42000);
        assertThat(cp.getPhaseArtifacts().get(PhaseId.PHASE_1_DEFINITION)).containsExactly("docs/prd.md");
        assertThat(cp.getPhaseArtifacts()).doesNotContainKey(PhaseId.PHASE_3_IMPLEMENTATION);
    }

    @Test
    void delete_removesDocument() {
        store.initialize(new ProjectIdentity("X", "build X"));

        store.delete();

        assertThat(store.exists()).isFalse();
        assertThat(store.load()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Run lease
    // ------------------------------------------------------------------

    @Test
    void runLease_secondAcquireInSameProcess_refused() {
        try (RunLease lease = RunLease.acquire(file)) {
            assertThatThrownBy(() -> RunLease.acquire(file)).isInstanceOf(RunAlreadyActiveException.class);
        }
        try (RunLease again = RunLease.acquire(file)) {
            assertThat(again).isNotNull();
        }
    }
}
