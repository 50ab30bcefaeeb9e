package com.eligibility.core;

import com.eligibility.expression.ExpressionEvaluator;
import com.eligibility.expression.RequirementOutcome;
import com.eligibility.expression.ValidationResult;
import com.eligibility.fact.Fact;
import com.eligibility.fact.FactProvider;
import com.eligibility.fact.NormalizedFacts;
import com.eligibility.policy.AggregateResult;
import com.eligibility.policy.AiVerdict;
import com.eligibility.policy.CombinedResult;
import com.eligibility.policy.EligibilityCombiner;
import com.eligibility.policy.EscalationReason;
import com.eligibility.policy.RequirementResult;
import com.eligibility.policy.ResultAggregator;
import com.eligibility.rule.Requirement;
import com.eligibility.rule.RuleVersion;
import com.eligibility.rule.version.ResolutionResult;
import com.eligibility.rule.version.RuleVersionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Evaluates a case against the rule set version in force and fuses the
 * result with the AI verdict.
 * <p>
 * Flow: resolve version, load and normalize facts, evaluate each requirement
 * in order, aggregate, combine. The AI call starts right after resolution and
 * runs on the supplied executor while requirements are evaluated; it is
 * bounded by a timeout. Compiled requirements are kept per resolved version,
 * up to a fixed number of versions. Resolution and provider failures never escape:
 * they produce a {@code requires_review} result with the reason attached.
 */
public class EligibilityEngine {

    private static final Logger log = LoggerFactory.getLogger(EligibilityEngine.class);

    private final FactProvider factProvider;
    private final RuleVersionResolver resolver;
    private final AiReasoningProvider aiProvider;
    private final ExpressionEvaluator evaluator;
    private final ResultAggregator aggregator;
    private final EligibilityCombiner combiner;
    private final RuleVersionCache cache;
    private final Executor aiExecutor;
    private final Duration aiTimeout;
    private final Clock clock;

    static final int MAX_COMPILED_VERSIONS = 256;

    // published versions are immutable, so their compiled requirements can be shared
    private final Map<RuleVersion, List<ValidationResult>> compiled = new ConcurrentHashMap<>();

    /**
     * @param factProvider Source of case facts
     * @param resolver     Version resolver
     * @param aiProvider   AI reasoning call, or null to run on rules alone
     * @param evaluator    Requirement evaluator
     * @param aggregator   Rule verdict aggregation
     * @param combiner     Rule and AI fusion
     * @param cache        Resolution cache, or null
     * @param aiExecutor   Executor for the AI call
     * @param aiTimeout    Upper bound on the AI call
     * @param clock        Clock supplying the default as-of date
     */
    public EligibilityEngine(FactProvider factProvider,
                             RuleVersionResolver resolver,
                             AiReasoningProvider aiProvider,
                             ExpressionEvaluator evaluator,
                             ResultAggregator aggregator,
                             EligibilityCombiner combiner,
                             RuleVersionCache cache,
                             Executor aiExecutor,
                             Duration aiTimeout,
                             Clock clock) {
        this.factProvider = Objects.requireNonNull(factProvider, "factProvider");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.aiProvider = aiProvider;
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.combiner = Objects.requireNonNull(combiner, "combiner");
        this.cache = cache;
        this.aiExecutor = Objects.requireNonNull(aiExecutor, "aiExecutor");
        this.aiTimeout = Objects.requireNonNull(aiTimeout, "aiTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Evaluate as of today.
     */
    public CombinedResult evaluate(String caseId, String ruleSetId) {
        return evaluate(caseId, ruleSetId, LocalDate.now(clock));
    }

    /**
     * Evaluate a case.
     *
     * @param caseId    Case whose facts are evaluated
     * @param ruleSetId Rule set to apply
     * @param asOf      Date selecting the rule version
     * @return Combined result; never null
     */
    public CombinedResult evaluate(String caseId, String ruleSetId, LocalDate asOf) {
        ResolutionResult resolution;
        try {
            resolution = resolve(ruleSetId, asOf);
        } catch (RuntimeException e) {
            log.warn("Case {}: rule versions of {} could not be loaded: {}", caseId, ruleSetId, e.getMessage(), e);
            return CombinedResult.fatal(EscalationReason.RULES_UNAVAILABLE,
                    "Rule versions of " + ruleSetId + " could not be loaded: " + e.getMessage());
        }
        if (!resolution.isResolved()) {
            log.warn("Case {}: {}", caseId, resolution.getError());
            return CombinedResult.fatal(EscalationReason.NO_ACTIVE_RULE_VERSION, resolution.getError());
        }
        RuleVersion version = resolution.getVersion().orElseThrow();

        Collection<Fact> facts;
        try {
            facts = factProvider.currentFacts(caseId);
        } catch (RuntimeException e) {
            log.warn("Case {}: fact provider failed: {}", caseId, e.getMessage(), e);
            return CombinedResult.fatal(EscalationReason.FACTS_UNAVAILABLE,
                    "Facts for case " + caseId + " could not be loaded: " + e.getMessage());
        }

        CompletableFuture<AiVerdict> aiCall = requestAiVerdict(caseId, ruleSetId);

        NormalizedFacts normalized = evaluator.getNormalizer().normalize(facts);
        List<ValidationResult> validations = compile(version);
        List<RequirementResult> results = new ArrayList<>(validations.size());
        for (int i = 0; i < validations.size(); i++) {
            Requirement requirement = version.requirements().get(i);
            RequirementOutcome outcome = evaluator.evaluate(validations.get(i), normalized);
            log.debug("Case {}: requirement {} -> {}", caseId, requirement.code(), outcome.status());
            results.add(new RequirementResult(requirement, outcome));
        }

        AggregateResult aggregate = aggregator.aggregate(results, resolution.getWarnings());
        AiVerdict ai = awaitAiVerdict(caseId, aiCall);
        CombinedResult combined = combiner.combine(aggregate, ai);

        log.info("Case {} evaluated against {} version {}: outcome={}, confidence={}, requiresReview={}",
                caseId, ruleSetId, version.id(), combined.outcome().label(),
                String.format(Locale.ROOT, "%.2f", combined.confidence()), combined.requiresReview());
        return combined;
    }

    private ResolutionResult resolve(String ruleSetId, LocalDate asOf) {
        if (cache == null) {
            return resolver.resolve(ruleSetId, asOf);
        }
        return cache.get(ruleSetId, asOf, () -> resolver.resolve(ruleSetId, asOf));
    }

    private List<ValidationResult> compile(RuleVersion version) {
        List<ValidationResult> cached = compiled.get(version);
        if (cached != null) {
            return cached;
        }
        List<ValidationResult> validations = version.requirements().stream()
                .map(requirement -> evaluator.getValidator().validate(requirement.expression()))
                .toList();
        if (compiled.size() >= MAX_COMPILED_VERSIONS) {
            log.debug("Compiled version cache full ({} entries), clearing", compiled.size());
            compiled.clear();
        }
        compiled.put(version, validations);
        return validations;
    }

    int compiledVersionCount() {
        return compiled.size();
    }

    private CompletableFuture<AiVerdict> requestAiVerdict(String caseId, String ruleSetId) {
        if (aiProvider == null) {
            return CompletableFuture.completedFuture(AiVerdict.unavailable("no AI reasoning provider configured"));
        }
        return CompletableFuture.supplyAsync(() -> aiProvider.evaluate(caseId, ruleSetId), aiExecutor);
    }

    private AiVerdict awaitAiVerdict(String caseId, CompletableFuture<AiVerdict> aiCall) {
        try {
            AiVerdict verdict = aiCall.get(aiTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (verdict == null) {
                log.warn("Case {}: AI reasoning provider returned no verdict", caseId);
                return AiVerdict.unavailable("provider returned no verdict");
            }
            return verdict;
        } catch (TimeoutException e) {
            aiCall.cancel(true);
            log.warn("Case {}: AI reasoning timed out after {} ms", caseId, aiTimeout.toMillis());
            return AiVerdict.unavailable("timed out after " + aiTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Case {}: AI reasoning failed: {}", caseId, cause.getMessage(), cause);
            return AiVerdict.unavailable(String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aiCall.cancel(true);
            log.warn("Case {}: interrupted while waiting for AI reasoning", caseId);
            return AiVerdict.unavailable("interrupted");
        }
    }
}
