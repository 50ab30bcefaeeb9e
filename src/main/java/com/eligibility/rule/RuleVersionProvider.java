package com.eligibility.rule;

import java.util.List;

/**
 * Read-only source of the published versions of a rule set.
 */
@FunctionalInterface
public interface RuleVersionProvider {

    /**
     * @param ruleSetId Rule set identifier
     * @return Published versions; empty when the rule set is unknown
     */
    List<RuleVersion> publishedVersions(String ruleSetId);
}
