package com.forgeloop.orchestrator.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.PhaseId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Upgrades older checkpoint documents to {@link Checkpoint#CURRENT_VERSION}.
 *
 * Version 1 documents (no version field) predate the item registry, the
 * disclosure list, the cumulative resource counter and per-phase artifacts.
 */
class CheckpointMigrator {

    private static final Logger log = LoggerFactory.getLogger(CheckpointMigrator.class);

    private static final Set<String> ARTIFACT_PHASES = Set.of(
            PhaseId.PHASE_0_INFRA.name(), PhaseId.PHASE_1_DEFINITION.name(), PhaseId.PHASE_2_ARCHITECTURE.name());

    private CheckpointMigrator() {}

    static ObjectNode migrate(ObjectNode doc) {
        int version = doc.path("version").asInt(1);
        if (version > Checkpoint.CURRENT_VERSION) {
            throw new CheckpointException(CheckpointException.Kind.UNSUPPORTED_VERSION,
                    "Checkpoint version %d is newer than supported version %d"
                            .formatted(version, Checkpoint.CURRENT_VERSION));
        }
        if (version < 2) {
            migrateV1toV2(doc);
            log.info("Migrated checkpoint document from version 1 to 2");
        }
        return doc;
    }

    private static void migrateV1toV2(ObjectNode doc) {
        if (!doc.has("workItems")) {
            doc.putObject("workItems");
        }
        if (!doc.has("disclosures")) {
            doc.putArray("disclosures");
        }
        if (!doc.has("phaseArtifacts")) {
            // Version 1 kept one flat artifact set: credit it to every artifact-producing phase already done.
            ObjectNode perPhase = doc.putObject("phaseArtifacts");
            JsonNode artifacts = doc.path("artifacts");
            for (JsonNode phase : doc.path("phasesCompleted")) {
                String id = phase.asText();
                if (ARTIFACT_PHASES.contains(id) && artifacts.isArray()) {
                    perPhase.set(id, artifacts.deepCopy());
                }
            }
        }
        JsonNode tracking = doc.get("resourceTracking");
        if (tracking != null && tracking.isObject() && !tracking.has("cumulativeUsed")) {
            ((ObjectNode) tracking).put("cumulativeUsed", tracking.path("used").asLong(0));
        }
        doc.put("version", 2);
    }
}
