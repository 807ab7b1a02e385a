package com.forgeloop.orchestrator.model;

/**
 * Resource (context) accounting.
 *
 * {@code used} gates the session: it only grows within a session and is reset
 * when a new session starts. {@code cumulativeUsed} is a metric across all
 * sessions and never gates anything.
 */
public class ResourceTracking {

    private long budget;
    private long used;
    private long lastUnitCost;
    private boolean thresholdExceeded;
    private String sessionId;
    private long cumulativeUsed;

    public long    getBudget()            { return budget; }
    public long    getUsed()              { return used; }
    public long    getLastUnitCost()      { return lastUnitCost; }
    public boolean isThresholdExceeded()  { return thresholdExceeded; }
    public String  getSessionId()         { return sessionId; }
    public long    getCumulativeUsed()    { return cumulativeUsed; }

    public void setBudget(long budget)                    { this.budget = budget; }
    public void setUsed(long used)                        { this.used = used; }
    public void setLastUnitCost(long lastUnitCost)        { this.lastUnitCost = lastUnitCost; }
    public void setThresholdExceeded(boolean v)           { this.thresholdExceeded = v; }
    public void setSessionId(String sessionId)            { this.sessionId = sessionId; }
    public void setCumulativeUsed(long cumulativeUsed)    { this.cumulativeUsed = cumulativeUsed; }
}
