package com.forgeloop.orchestrator.config;

import com.forgeloop.orchestrator.model.PhaseId;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * All tunables of the orchestrator, bound from {@code forgeloop.*}.
 *
 * Every numeric policy (score weights, category boundaries, budget ladder,
 * verification cap) is configuration; the values below are the defaults.
 */
@ConfigurationProperties(prefix = "forgeloop")
public class ForgeloopProperties {

    private final Checkpoint   checkpoint   = new Checkpoint();
    private final Complexity   complexity   = new Complexity();
    private final Cost         cost         = new Cost();
    private final Budget       budget       = new Budget();
    private final Verification verification = new Verification();
    private final Optimizer    optimizer    = new Optimizer();
    private final Claude       claude       = new Claude();
    private final Github       github       = new Github();

    // Wall-clock budget per phase; phases not listed use defaultPhaseBudget.
    private Map<PhaseId, Duration> phaseBudgets = new EnumMap<>(PhaseId.class);
    private Duration defaultPhaseBudget = Duration.ofHours(2);

    public Checkpoint   getCheckpoint()   { return checkpoint; }
    public Complexity   getComplexity()   { return complexity; }
    public Cost         getCost()         { return cost; }
    public Budget       getBudget()       { return budget; }
    public Verification getVerification() { return verification; }
    public Optimizer    getOptimizer()    { return optimizer; }
    public Claude       getClaude()       { return claude; }
    public Github       getGithub()       { return github; }

    public Map<PhaseId, Duration> getPhaseBudgets()       { return phaseBudgets; }
    public void setPhaseBudgets(Map<PhaseId, Duration> v) { this.phaseBudgets = v; }
    public Duration getDefaultPhaseBudget()               { return defaultPhaseBudget; }
    public void setDefaultPhaseBudget(Duration v)         { this.defaultPhaseBudget = v; }

    public Duration phaseBudget(PhaseId phase) {
        return phaseBudgets.getOrDefault(phase, defaultPhaseBudget);
    }

    // ------------------------------------------------------------------

    public static class Checkpoint {
        private String path = ".forgeloop/checkpoint.json";

        public String getPath()            { return path; }
        public void setPath(String path)   { this.path = path; }
    }

    public static class Complexity {
        private int fileWeight = 100;
        private int dependencyWeight = 50;
        private int simpleMax = 500;
        private int mediumMax = 1500;

        public int getFileWeight()                { return fileWeight; }
        public int getDependencyWeight()          { return dependencyWeight; }
        public int getSimpleMax()                 { return simpleMax; }
        public int getMediumMax()                 { return mediumMax; }
        public void setFileWeight(int v)          { this.fileWeight = v; }
        public void setDependencyWeight(int v)    { this.dependencyWeight = v; }
        public void setSimpleMax(int v)           { this.simpleMax = v; }
        public void setMediumMax(int v)           { this.mediumMax = v; }
    }

    /** Per-unit cost model used for resource estimates (tokens). */
    public static class Cost {
        private long baseContext = 10_000;
        private long perFile = 3_000;
        private long perLine = 40;
        private long perTestLine = 20;
        private long review = 5_000;
        // Test LOC written per implementation LOC (TDD assumption).
        private double testRatio = 1.5;

        public long   getBaseContext()            { return baseContext; }
        public long   getPerFile()                { return perFile; }
        public long   getPerLine()                { return perLine; }
        public long   getPerTestLine()            { return perTestLine; }
        public long   getReview()                 { return review; }
        public double getTestRatio()              { return testRatio; }
        public void setBaseContext(long v)        { this.baseContext = v; }
        public void setPerFile(long v)            { this.perFile = v; }
        public void setPerLine(long v)            { this.perLine = v; }
        public void setPerTestLine(long v)        { this.perTestLine = v; }
        public void setReview(long v)             { this.review = v; }
        public void setTestRatio(double v)        { this.testRatio = v; }
    }

    public static class Budget {
        private long proceedBelow = 100_000;
        private long ceiling = 150_000;
        private long perAgentCeiling = 200_000;
        private double itemCeilingRatio = 0.75;
        private long sessionBudget = 200_000;
        private double sessionWarnRatio = 0.75;
        // Sub-units an item may use beyond its plan before it is flagged.
        private int maxExtraSubUnits = 2;

        public long   getProceedBelow()           { return proceedBelow; }
        public long   getCeiling()                { return ceiling; }
        public long   getPerAgentCeiling()        { return perAgentCeiling; }
        public double getItemCeilingRatio()       { return itemCeilingRatio; }
        public long   getSessionBudget()          { return sessionBudget; }
        public double getSessionWarnRatio()       { return sessionWarnRatio; }
        public int    getMaxExtraSubUnits()       { return maxExtraSubUnits; }
        public void setProceedBelow(long v)       { this.proceedBelow = v; }
        public void setCeiling(long v)            { this.ceiling = v; }
        public void setPerAgentCeiling(long v)    { this.perAgentCeiling = v; }
        public void setItemCeilingRatio(double v) { this.itemCeilingRatio = v; }
        public void setSessionBudget(long v)      { this.sessionBudget = v; }
        public void setSessionWarnRatio(double v) { this.sessionWarnRatio = v; }
        public void setMaxExtraSubUnits(int v)    { this.maxExtraSubUnits = v; }
    }

    public static class Verification {
        private int maxAttempts = 3;
        private double coverageTarget = 80.0;
        private double coverageTolerance = 5.0;
        private int flakyWindow = 3;
        // Estimated lines of code per failing test in a fix item.
        private int fixLocPerTest = 50;

        public int    getMaxAttempts()             { return maxAttempts; }
        public double getCoverageTarget()          { return coverageTarget; }
        public double getCoverageTolerance()       { return coverageTolerance; }
        public int    getFlakyWindow()             { return flakyWindow; }
        public int    getFixLocPerTest()           { return fixLocPerTest; }
        public void setMaxAttempts(int v)          { this.maxAttempts = v; }
        public void setCoverageTarget(double v)    { this.coverageTarget = v; }
        public void setCoverageTolerance(double v) { this.coverageTolerance = v; }
        public void setFlakyWindow(int v)          { this.flakyWindow = v; }
        public void setFixLocPerTest(int v)        { this.fixLocPerTest = v; }
    }

    public static class Optimizer {
        private int minSample = 5;
        private double simpleSplitRateTarget = 0.05;
        private double mediumThreeCommitRateTarget = 0.40;

        public int    getMinSample()                         { return minSample; }
        public double getSimpleSplitRateTarget()             { return simpleSplitRateTarget; }
        public double getMediumThreeCommitRateTarget()       { return mediumThreeCommitRateTarget; }
        public void setMinSample(int v)                      { this.minSample = v; }
        public void setSimpleSplitRateTarget(double v)       { this.simpleSplitRateTarget = v; }
        public void setMediumThreeCommitRateTarget(double v) { this.mediumThreeCommitRateTarget = v; }
    }

    public static class Claude {
        private String apiKey;
        private String apiUrl = "https://api.anthropic.com/v1/messages";
        private String model = "claude-sonnet-4-6";
        private int maxTokens = 4096;
        private int maxTurns = 4;

        public String getApiKey()          { return apiKey; }
        public String getApiUrl()          { return apiUrl; }
        public String getModel()           { return model; }
        public int    getMaxTokens()       { return maxTokens; }
        public int    getMaxTurns()        { return maxTurns; }
        public void setApiKey(String v)    { this.apiKey = v; }
        public void setApiUrl(String v)    { this.apiUrl = v; }
        public void setModel(String v)     { this.model = v; }
        public void setMaxTokens(int v)    { this.maxTokens = v; }
        public void setMaxTurns(int v)     { this.maxTurns = v; }
    }

    public static class Github {
        private String baseUrl = "https://api.github.com";
        private String owner;
        private String repo;
        private String token;

        public String getBaseUrl()         { return baseUrl; }
        public String getOwner()           { return owner; }
        public String getRepo()            { return repo; }
        public String getToken()           { return token; }
        public void setBaseUrl(String v)   { this.baseUrl = v; }
        public void setOwner(String v)     { this.owner = v; }
        public void setRepo(String v)      { this.repo = v; }
        public void setToken(String v)     { this.token = v; }
    }
}
