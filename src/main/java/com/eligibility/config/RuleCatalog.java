package com.eligibility.config;

import com.eligibility.rule.RuleVersion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule sets loaded from configuration.
 *
 * @param name     Catalogue name
 * @param version  Catalogue version
 * @param ruleSets Versions per rule set id, in declaration order
 */
public record RuleCatalog(String name, String version, Map<String, List<RuleVersion>> ruleSets) {

    public RuleCatalog {
        Map<String, List<RuleVersion>> copy = new LinkedHashMap<>();
        ruleSets.forEach((id, versions) -> copy.put(id, List.copyOf(versions)));
        ruleSets = Collections.unmodifiableMap(copy);
    }

    public Set<String> ruleSetIds() {
        return ruleSets.keySet();
    }

    /**
     * Versions of one rule set; empty when unknown.
     */
    public List<RuleVersion> versions(String ruleSetId) {
        return ruleSets.getOrDefault(ruleSetId, List.of());
    }

    public List<RuleVersion> allVersions() {
        return ruleSets.values().stream().flatMap(List::stream).toList();
    }
}
