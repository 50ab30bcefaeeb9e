package com.eligibility.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Spring Boot configuration properties for the eligibility engine.
 */
@ConfigurationProperties(prefix = "eligibility")
public class EligibilityProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the rule catalogue.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesPath = "classpath:eligibility-rules.yaml";

    /**
     * Aggregate confidence at or above which the rule verdict is eligible.
     */
    private double eligibleThreshold = 0.8;

    /**
     * Aggregate confidence at or below which the rule verdict is not eligible.
     */
    private double notEligibleThreshold = 0.4;

    /**
     * Combined confidence below which a case is escalated to review.
     */
    private double confidenceFloor = 0.6;

    /**
     * Weight of the rule confidence when rule and AI agree.
     */
    private double ruleWeight = 0.6;

    /**
     * Weight of the AI confidence when rule and AI agree.
     */
    private double aiWeight = 0.4;

    private int maxDepth = 20;

    private int maxNodes = 1000;

    /**
     * Upper bound on the AI reasoning call.
     */
    private Duration aiTimeout = Duration.ofSeconds(30);

    /**
     * Threads for AI reasoning calls.
     */
    private int aiThreads = 4;

    /**
     * Cached version resolutions before the cache is cleared.
     */
    private int cacheMaxEntries = 1024;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }

    public double getEligibleThreshold() {
        return eligibleThreshold;
    }

    public void setEligibleThreshold(double eligibleThreshold) {
        this.eligibleThreshold = eligibleThreshold;
    }

    public double getNotEligibleThreshold() {
        return notEligibleThreshold;
    }

    public void setNotEligibleThreshold(double notEligibleThreshold) {
        this.notEligibleThreshold = notEligibleThreshold;
    }

    public double getConfidenceFloor() {
        return confidenceFloor;
    }

    public void setConfidenceFloor(double confidenceFloor) {
        this.confidenceFloor = confidenceFloor;
    }

    public double getRuleWeight() {
        return ruleWeight;
    }

    public void setRuleWeight(double ruleWeight) {
        this.ruleWeight = ruleWeight;
    }

    public double getAiWeight() {
        return aiWeight;
    }

    public void setAiWeight(double aiWeight) {
        this.aiWeight = aiWeight;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public void setMaxNodes(int maxNodes) {
        this.maxNodes = maxNodes;
    }

    public Duration getAiTimeout() {
        return aiTimeout;
    }

    public void setAiTimeout(Duration aiTimeout) {
        this.aiTimeout = aiTimeout;
    }

    public int getAiThreads() {
        return aiThreads;
    }

    public void setAiThreads(int aiThreads) {
        this.aiThreads = aiThreads;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }
}
