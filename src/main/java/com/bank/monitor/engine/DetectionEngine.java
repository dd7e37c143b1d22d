package com.bank.monitor.engine;

import com.bank.monitor.engine.evaluators.AdaptiveZScoreEvaluator;
import com.bank.monitor.engine.evaluators.StaticCeilingEvaluator;
import com.bank.monitor.model.DetectionPolicy;
import com.bank.monitor.model.MetricStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a metric evaluation to the evaluator registered for its policy.
 * Uses the Strategy pattern: each DetectionPolicy is handled by one PolicyEvaluator.
 */
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<DetectionPolicy, PolicyEvaluator> evaluatorMap;

    public DetectionEngine(List<PolicyEvaluator> evaluators) {
        this.evaluatorMap = new EnumMap<>(DetectionPolicy.class);

        for (PolicyEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedPolicy(), evaluator);
            log.debug("Registered policy evaluator: {} -> {}",
                    evaluator.getSupportedPolicy(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * Engine with the static-ceiling and adaptive Z-score evaluators wired to the given settings.
     */
    public static DetectionEngine withDefaultEvaluators(MonitorConfig config) {
        return new DetectionEngine(List.of(
                new StaticCeilingEvaluator(config.getStaticFailureCeiling()),
                new AdaptiveZScoreEvaluator(config.getMinHistory(),
                        config.getSigmaThreshold(), config.getZeroVarianceMargin())));
    }

    public boolean supports(DetectionPolicy policy) {
        return evaluatorMap.containsKey(policy);
    }

    public MetricStatus evaluate(DetectionPolicy policy, String metric, long value, MetricSeries history) {
        PolicyEvaluator evaluator = evaluatorMap.get(policy);
        if (evaluator == null) {
            throw new IllegalStateException("No evaluator registered for policy: " + policy);
        }
        return evaluator.evaluate(metric, value, history);
    }
}
