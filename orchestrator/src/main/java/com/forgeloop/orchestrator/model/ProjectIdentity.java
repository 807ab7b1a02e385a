package com.forgeloop.orchestrator.model;

import java.time.Instant;

/**
 * Who the checkpoint belongs to and when it was last written.
 */
public class ProjectIdentity {

    private String name;
    private String request;
    private Instant startedAt;
    private Instant lastUpdated;

    public ProjectIdentity() {}   // Jackson

    public ProjectIdentity(String name, String request) {
        this.name    = name;
        this.request = request;
    }

    public String  getName()        { return name; }
    public String  getRequest()     { return request; }
    public Instant getStartedAt()   { return startedAt; }
    public Instant getLastUpdated() { return lastUpdated; }

    public void setName(String name)               { this.name = name; }
    public void setRequest(String request)         { this.request = request; }
    public void setStartedAt(Instant startedAt)    { this.startedAt = startedAt; }
    public void setLastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; }
}
