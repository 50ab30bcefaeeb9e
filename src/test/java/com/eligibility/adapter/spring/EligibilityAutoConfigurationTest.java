package com.eligibility.adapter.spring;

import com.eligibility.config.RuleCatalog;
import com.eligibility.core.AiReasoningProvider;
import com.eligibility.core.EligibilityEngine;
import com.eligibility.core.RuleVersionCache;
import com.eligibility.fact.Fact;
import com.eligibility.fact.FactProvider;
import com.eligibility.policy.AiVerdict;
import com.eligibility.policy.CombinedResult;
import com.eligibility.policy.DecisionThresholds;
import com.eligibility.policy.Outcome;
import com.eligibility.rule.version.ConflictDetector;
import com.eligibility.rule.version.InMemoryRuleVersionStore;
import com.eligibility.rule.version.RuleVersionPublisher;
import com.eligibility.rule.version.RuleVersionResolver;
import com.eligibility.spring.EnableEligibilityEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EligibilityAutoConfiguration.
 */
class EligibilityAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EligibilityAutoConfiguration.class))
            .withPropertyValues("eligibility.rules-path=classpath:rules/test-rules.yaml");

    @Configuration
    static class FactsConfiguration {

        @Bean
        FactProvider factProvider() {
            Instant at = Instant.parse("2024-02-01T10:00:00Z");
            return caseId -> List.of(
                    Fact.of("min_salary", "30000", at),
                    Fact.of("has_valid_passport", "true", at));
        }
    }

    @Configuration
    static class AiConfiguration {

        @Bean
        AiReasoningProvider aiReasoningProvider() {
            return (caseId, ruleSetId) -> AiVerdict.fromLabel("likely", 0.9, "Meets sponsorship criteria", List.of());
        }
    }

    @Configuration
    @EnableEligibilityEngine
    static class AnnotatedApplication {
    }

    @Test
    @DisplayName("Should create the rule infrastructure without a fact provider")
    void shouldCreateRuleBeans() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals("test-rules", context.getBean(RuleCatalog.class).name());
            assertEquals(3, context.getBean(InMemoryRuleVersionStore.class).findByRuleSet("skilled-worker").size());
            assertNotNull(context.getBean(RuleVersionResolver.class));
            assertNotNull(context.getBean(RuleVersionPublisher.class));
            assertNotNull(context.getBean(ConflictDetector.class));
            assertNotNull(context.getBean(RuleVersionCache.class));
            assertEquals(0, context.getBeanNamesForType(EligibilityEngine.class).length);
        });
    }

    @Test
    @DisplayName("Should create an engine that evaluates against the catalogue")
    void shouldEvaluateEndToEnd() {
        contextRunner.withUserConfiguration(FactsConfiguration.class, AiConfiguration.class).run(context -> {
            EligibilityEngine engine = context.getBean(EligibilityEngine.class);

            CombinedResult result = engine.evaluate("case-1", "skilled-worker", LocalDate.of(2024, 3, 1));

            assertEquals(Outcome.ELIGIBLE, result.aggregate().outcome());
            assertEquals(Outcome.ELIGIBLE, result.outcome());
            assertTrue(result.aiVerdict().available());
        });
    }

    @Test
    @DisplayName("An engine without an AI provider should escalate on rules alone")
    void shouldRunWithoutAiProvider() {
        contextRunner.withUserConfiguration(FactsConfiguration.class).run(context -> {
            CombinedResult result = context.getBean(EligibilityEngine.class)
                    .evaluate("case-1", "skilled-worker", LocalDate.of(2024, 8, 1));

            assertEquals(Outcome.NOT_ELIGIBLE, result.aggregate().outcome());
            assertFalse(result.aiVerdict().available());
        });
    }

    @Test
    @DisplayName("Should bind decision thresholds from properties")
    void shouldBindThresholds() {
        contextRunner.withPropertyValues(
                "eligibility.confidence-floor=0.7",
                "eligibility.rule-weight=0.5",
                "eligibility.ai-weight=0.5").run(context -> {
            DecisionThresholds thresholds = context.getBean(DecisionThresholds.class);
            assertEquals(0.7, thresholds.confidenceFloor());
            assertEquals(0.5, thresholds.ruleWeight());
            assertEquals(0.8, thresholds.eligibleThreshold());
        });
    }

    @Test
    @DisplayName("Should fail fast on inconsistent weights")
    void shouldFailOnInvalidWeights() {
        contextRunner.withPropertyValues("eligibility.rule-weight=0.9").run(context ->
                assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should fail fast on a missing catalogue")
    void shouldFailOnMissingCatalogue() {
        contextRunner.withPropertyValues("eligibility.rules-path=classpath:rules/absent.yaml").run(context ->
                assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("eligibility.enabled=false").run(context ->
                assertEquals(0, context.getBeanNamesForType(RuleCatalog.class).length));
    }

    @Test
    @DisplayName("The enable annotation should import the configuration")
    void shouldImportThroughAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(AnnotatedApplication.class)
                .withPropertyValues("eligibility.rules-path=classpath:rules/test-rules.yaml")
                .run(context -> assertEquals("test-rules", context.getBean(RuleCatalog.class).name()));
    }

    @Test
    @DisplayName("Should load the bundled catalogue by default")
    void shouldLoadBundledCatalogue() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(EligibilityAutoConfiguration.class))
                .run(context -> {
                    RuleCatalog catalog = context.getBean(RuleCatalog.class);
                    assertEquals("uk-visa-rules", catalog.name());
                    assertEquals(List.of("skilled-worker", "student"), List.copyOf(catalog.ruleSetIds()));
                });
    }
}
