package com.poweragent.common.decision;

import com.poweragent.common.classifier.SeverityModel;
import com.poweragent.common.context.ContextAnalyzer;
import com.poweragent.common.model.ActionType;
import com.poweragent.common.model.Calibration;
import com.poweragent.common.model.ContextState;
import com.poweragent.common.model.OptimizationAction;
import com.poweragent.common.model.PowerSource;
import com.poweragent.common.model.SeverityClass;
import com.poweragent.common.model.SystemSnapshot;
import com.poweragent.common.model.UserActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Produces candidate {@link OptimizationAction}s for one tick.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Extract the 11-value {@link FeatureVector} from the snapshot and context.</li>
 *   <li>Ask the learned source; if it declines, ask the rule source.</li>
 *   <li>Expand the chosen class into one action per template of that class, leaving out
 *       app throttling while the target application is above the priority threshold.</li>
 *   <li>On battery with the user away, add the away rules at their fixed intensity.</li>
 * </ol>
 *
 * <h3>Intensity and confidence</h3>
 * <pre>
 *   intensity  = base × lerp(low, high, t) × (1 − w + w × score / 3)     clamped to [0, 1]
 *   confidence = classConfidence × historicalAccuracy (× emergencyBoost)  capped at 1.0
 * </pre>
 * where {@code t} is the position of the class's dominant metric inside its
 * {@link SeverityBand} and {@code w} is the context weight (0.15 by default).
 *
 * <p>Thread-safe: the only mutable field is the model-absence latch used to log
 * ModelUnavailable once per episode.
 */
public final class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final DecisionSource   learned;
    private final DecisionSource   rules;
    private final ModelProvider    models;
    private final DecisionSettings settings;
    private final Clock            clock;

    private final AtomicBoolean modelMissingReported = new AtomicBoolean(false);

    public DecisionEngine(ModelProvider models, DecisionSettings settings, Clock clock) {
        this(new LearnedDecisionSource(models, settings.minTrainingSamples(), settings.probabilityFloor()),
             new RuleDecisionSource(settings.rules(), settings.ruleConfidence()),
             models, settings, clock);
    }

    DecisionEngine(DecisionSource learned, DecisionSource rules, ModelProvider models,
                   DecisionSettings settings, Clock clock) {
        this.learned  = learned;
        this.rules    = rules;
        this.models   = models;
        this.settings = settings;
        this.clock    = clock;
    }

    public DecisionResult decide(SystemSnapshot snapshot, ContextState context) {
        int hour = snapshot.timestamp().atZone(settings.zone()).getHour();
        FeatureVector features = FeatureVector.extract(snapshot, context, hour);

        boolean modelUnavailable = models.currentModel().isEmpty();
        if (modelUnavailable) {
            if (modelMissingReported.compareAndSet(false, true)) {
                log.warn("[DecisionEngine] No severity model loaded, using rule table until one is available");
            }
        } else if (modelMissingReported.compareAndSet(true, false)) {
            log.info("[DecisionEngine] Severity model available again version={}",
                models.currentModel().map(SeverityModel::version).orElse(-1L));
        }

        Optional<SeverityDecision> fromModel = learned.evaluate(features);
        SeverityDecision decision = fromModel.isPresent()
            ? fromModel.get()
            : rules.evaluate(features).orElseThrow();

        Calibration calibration = models.calibration();
        List<OptimizationAction> candidates = expand(decision, features, context, calibration);

        log.debug("[DecisionEngine] severity={} path={} classConfidence={} accuracy={} candidates={}",
            decision.severity(), decision.path(), String.format("%.3f", decision.classConfidence()),
            String.format("%.3f", calibration.historicalAccuracy()), candidates.size());

        return new DecisionResult(candidates, decision.probabilities(), decision.path(),
            decision.severity(), features, modelUnavailable);
    }

    // ── expansion ──────────────────────────────────────────────────────────

    List<OptimizationAction> expand(SeverityDecision decision, FeatureVector features,
                                    ContextState context, Calibration calibration) {
        List<OptimizationAction> out = new ArrayList<>();
        if (decision.severity() != SeverityClass.NONE) {
            out.addAll(scaled(decision, features, context, calibration));
        }
        if (isAway(context)) {
            mergeAway(out, features, calibration);
        }
        out.sort(Comparator.comparingDouble(OptimizationAction::estimatedSavings).reversed());
        return out;
    }

    private List<OptimizationAction> scaled(SeverityDecision decision, FeatureVector features,
                                            ContextState context, Calibration calibration) {
        double t = bandPosition(decision.severity(), features);
        double bandFactor    = settings.intensityLow() + (settings.intensityHigh() - settings.intensityLow()) * t;
        double w             = settings.contextWeight();
        double contextFactor = (1.0 - w) + w * context.contextScore() / ContextAnalyzer.MAX_SCORE;

        double confidence = decision.classConfidence() * calibration.historicalAccuracy();
        if (context.isCritical()) {
            confidence *= settings.emergencyBoost();
        }
        confidence = Math.min(1.0, confidence);

        boolean appCritical = features.get(FeatureMetric.TARGET_APP_CPU) > settings.appPriorityCpu();

        List<OptimizationAction> out = new ArrayList<>();
        for (ActionTemplate template : settings.templatesFor(decision.severity())) {
            if (appCritical && template.actionType() == ActionType.APP_THROTTLE) {
                continue;
            }
            double intensity = clampUnit(template.baseIntensity() * bandFactor * contextFactor);
            double savings   = template.baseIntensity() > 0.0
                ? template.baseSavings() * intensity / template.baseIntensity()
                : template.baseSavings();
            out.add(OptimizationAction.create(template.actionType(), intensity, template.targetComponent(),
                savings, template.performanceImpact(), confidence, clock.instant()));
        }
        return out;
    }

    private static boolean isAway(ContextState context) {
        return context.userActivity() == UserActivity.AWAY && context.powerSource() == PowerSource.BATTERY;
    }

    /** Adds away actions; on a shared target the larger estimated saving wins. */
    private void mergeAway(List<OptimizationAction> out, FeatureVector features, Calibration calibration) {
        for (AwayRule rule : settings.awayRules()) {
            if (!rule.appliesTo(features)) {
                continue;
            }
            ActionTemplate template = rule.template();
            OptimizationAction away = OptimizationAction.create(template.actionType(), template.baseIntensity(),
                template.targetComponent(), template.baseSavings(), template.performanceImpact(),
                Math.min(1.0, rule.confidence() * calibration.historicalAccuracy()), clock.instant());

            int existing = indexOfTarget(out, template.targetComponent());
            if (existing < 0) {
                out.add(away);
            } else if (away.estimatedSavings() > out.get(existing).estimatedSavings()) {
                out.set(existing, away);
            }
        }
    }

    private static int indexOfTarget(List<OptimizationAction> actions, String target) {
        for (int i = 0; i < actions.size(); i++) {
            if (actions.get(i).targetComponent().equals(target)) {
                return i;
            }
        }
        return -1;
    }

    private double bandPosition(SeverityClass severity, FeatureVector features) {
        SeverityBand band = settings.bands().get(severity);
        if (band == null) {
            return 0.5;
        }
        return band.position(features.get(band.metric()));
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
