package com.forgeloop.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The durable snapshot of an in-progress build run.
 *
 * This is the only persisted orchestration state. It is serialised as a
 * single JSON document by the CheckpointStore and is changed exclusively
 * through CheckpointStore.mutate(), one logical transaction per phase
 * completion, item completion, verification attempt or approval.
 *
 * {@code resumeHint} is derived text for humans; resumption decisions always
 * use the structured fields.
 */
public class Checkpoint {

    public static final int CURRENT_VERSION = 2;

    private int version = CURRENT_VERSION;
    private ProjectIdentity project = new ProjectIdentity();
    private PhaseState phase = new PhaseState();
    private Set<PhaseId> phasesCompleted = new LinkedHashSet<>();
    private WorkProgress workProgress = new WorkProgress();
    private Map<String, WorkItem> workItems = new LinkedHashMap<>();
    private ResourceTracking resourceTracking = new ResourceTracking();
    private VerificationState verification = new VerificationState();
    private List<AgentInvocation> agentInvocations = new ArrayList<>();
    private Set<String> artifacts = new LinkedHashSet<>();
    // Key artifacts each phase produced, checked by the phase completion predicates.
    private Map<PhaseId, List<String>> phaseArtifacts = new EnumMap<>(PhaseId.class);
    private PendingApproval pendingApproval;
    private List<Disclosure> disclosures = new ArrayList<>();
    private String resumeHint;

    public int                   getVersion()          { return version; }
    public ProjectIdentity       getProject()          { return project; }
    public PhaseState            getPhase()            { return phase; }
    public Set<PhaseId>          getPhasesCompleted()  { return phasesCompleted; }
    public WorkProgress          getWorkProgress()     { return workProgress; }
    public Map<String, WorkItem> getWorkItems()        { return workItems; }
    public ResourceTracking      getResourceTracking() { return resourceTracking; }
    public VerificationState     getVerification()     { return verification; }
    public List<AgentInvocation> getAgentInvocations() { return agentInvocations; }
    public Set<String>           getArtifacts()        { return artifacts; }
    public Map<PhaseId, List<String>> getPhaseArtifacts() { return phaseArtifacts; }
    public PendingApproval       getPendingApproval()  { return pendingApproval; }
    public List<Disclosure>      getDisclosures()      { return disclosures; }
    public String                getResumeHint()       { return resumeHint; }

    public void setVersion(int version)                          { this.version = version; }
    public void setProject(ProjectIdentity project)              { this.project = project; }
    public void setPhase(PhaseState phase)                       { this.phase = phase; }
    public void setPhasesCompleted(Set<PhaseId> v)               { this.phasesCompleted = v; }
    public void setWorkProgress(WorkProgress workProgress)       { this.workProgress = workProgress; }
    public void setWorkItems(Map<String, WorkItem> workItems)    { this.workItems = workItems; }
    public void setResourceTracking(ResourceTracking v)          { this.resourceTracking = v; }
    public void setVerification(VerificationState verification)  { this.verification = verification; }
    public void setAgentInvocations(List<AgentInvocation> v)     { this.agentInvocations = v; }
    public void setArtifacts(Set<String> artifacts)              { this.artifacts = artifacts; }
    public void setPhaseArtifacts(Map<PhaseId, List<String>> v)  { this.phaseArtifacts = v; }
    public void setPendingApproval(PendingApproval v)            { this.pendingApproval = v; }
    public void setDisclosures(List<Disclosure> disclosures)     { this.disclosures = disclosures; }
    public void setResumeHint(String resumeHint)                 { this.resumeHint = resumeHint; }

    @JsonIgnore
    public WorkItem item(String itemId) {
        WorkItem item = workItems.get(itemId);
        if (item == null) {
            throw new IllegalArgumentException("Unknown work item: " + itemId);
        }
        return item;
    }

    /** Record the artifacts a phase produced, both in the global set and per phase. */
    public void recordArtifacts(PhaseId phaseId, List<String> produced) {
        artifacts.addAll(produced);
        List<String> forPhase = phaseArtifacts.computeIfAbsent(phaseId, p -> new ArrayList<>());
        for (String artifact : produced) {
            if (!forPhase.contains(artifact)) {
                forPhase.add(artifact);
            }
        }
    }

    /** Record that a phase is done. phasesCompleted only ever grows. */
    public void completePhase(PhaseId phaseId) {
        phasesCompleted.add(phaseId);
    }
}
