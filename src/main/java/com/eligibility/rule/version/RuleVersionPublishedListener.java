package com.eligibility.rule.version;

/**
 * Callback for committed publishes, e.g. to invalidate cached resolutions.
 */
@FunctionalInterface
public interface RuleVersionPublishedListener {

    void onPublished(RuleVersionPublishedEvent event);
}
