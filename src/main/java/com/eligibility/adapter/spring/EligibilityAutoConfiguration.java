package com.eligibility.adapter.spring;

import com.eligibility.config.ConfigLoader;
import com.eligibility.config.RuleCatalog;
import com.eligibility.core.AiReasoningProvider;
import com.eligibility.core.EligibilityEngine;
import com.eligibility.core.RuleVersionCache;
import com.eligibility.expression.ExpressionEvaluator;
import com.eligibility.expression.ExpressionValidator;
import com.eligibility.fact.FactNormalizer;
import com.eligibility.fact.FactProvider;
import com.eligibility.policy.DecisionThresholds;
import com.eligibility.policy.EligibilityCombiner;
import com.eligibility.policy.ResultAggregator;
import com.eligibility.rule.RuleVersionProvider;
import com.eligibility.rule.version.ConflictDetector;
import com.eligibility.rule.version.InMemoryRuleVersionStore;
import com.eligibility.rule.version.RuleVersionPublisher;
import com.eligibility.rule.version.RuleVersionResolver;
import com.eligibility.rule.version.RuleVersionStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration for the eligibility engine.
 * <p>
 * The engine bean needs a {@link FactProvider} from the application; an
 * {@link AiReasoningProvider} is optional.
 */
@Configuration
@ConditionalOnProperty(prefix = "eligibility", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EligibilityProperties.class)
public class EligibilityAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EligibilityAutoConfiguration.class);

    private ExecutorService aiExecutor;

    @Bean
    @ConditionalOnMissingBean
    public ExpressionValidator expressionValidator(EligibilityProperties properties) {
        return new ExpressionValidator(properties.getMaxDepth(), properties.getMaxNodes());
    }

    @Bean
    @ConditionalOnMissingBean
    public FactNormalizer factNormalizer() {
        return new FactNormalizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionEvaluator expressionEvaluator(ExpressionValidator validator, FactNormalizer normalizer) {
        return new ExpressionEvaluator(validator, normalizer);
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionThresholds decisionThresholds(EligibilityProperties properties) {
        return new DecisionThresholds(
                properties.getEligibleThreshold(),
                properties.getNotEligibleThreshold(),
                properties.getConfidenceFloor(),
                properties.getRuleWeight(),
                properties.getAiWeight());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultAggregator resultAggregator(DecisionThresholds thresholds) {
        return new ResultAggregator(thresholds);
    }

    @Bean
    @ConditionalOnMissingBean
    public EligibilityCombiner eligibilityCombiner(DecisionThresholds thresholds) {
        return new EligibilityCombiner(thresholds);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleCatalog ruleCatalog(EligibilityProperties properties, ExpressionValidator validator) {
        return ConfigLoader.load(properties.getRulesPath(), validator);
    }

    @Bean
    @ConditionalOnMissingBean(RuleVersionStore.class)
    public InMemoryRuleVersionStore ruleVersionStore(RuleCatalog catalog) {
        InMemoryRuleVersionStore store = new InMemoryRuleVersionStore();
        catalog.allVersions().forEach(store::insert);
        log.info("Seeded rule version store with {} versions from catalogue {}",
                catalog.allVersions().size(), catalog.name());
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleVersionResolver ruleVersionResolver(RuleVersionProvider provider) {
        return new RuleVersionResolver(provider);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConflictDetector conflictDetector(RuleVersionStore store) {
        return new ConflictDetector(store);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleVersionCache ruleVersionCache(EligibilityProperties properties) {
        return new RuleVersionCache(properties.getCacheMaxEntries());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleVersionPublisher ruleVersionPublisher(RuleVersionStore store, ExpressionValidator validator,
                                                     RuleVersionCache cache) {
        RuleVersionPublisher publisher = new RuleVersionPublisher(store, validator);
        publisher.addListener(cache);
        return publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(FactProvider.class)
    public EligibilityEngine eligibilityEngine(FactProvider factProvider,
                                               ObjectProvider<AiReasoningProvider> aiProvider,
                                               RuleVersionResolver resolver,
                                               ExpressionEvaluator evaluator,
                                               ResultAggregator aggregator,
                                               EligibilityCombiner combiner,
                                               RuleVersionCache cache,
                                               EligibilityProperties properties) {
        AiReasoningProvider ai = aiProvider.getIfAvailable();
        if (ai == null) {
            log.warn("No AiReasoningProvider bean; cases will be decided on rules alone and escalated");
        }
        this.aiExecutor = Executors.newFixedThreadPool(properties.getAiThreads(), aiThreadFactory());
        log.info("Creating EligibilityEngine (AI timeout {}, {} AI threads)",
                properties.getAiTimeout(), properties.getAiThreads());
        return new EligibilityEngine(factProvider, resolver, ai, evaluator, aggregator, combiner, cache,
                aiExecutor, properties.getAiTimeout(), Clock.systemDefaultZone());
    }

    private static ThreadFactory aiThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "eligibility-ai-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PreDestroy
    public void shutdown() {
        if (aiExecutor != null && !aiExecutor.isShutdown()) {
            log.info("Shutting down AI reasoning executor");
            aiExecutor.shutdown();
            try {
                if (!aiExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    aiExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                aiExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
