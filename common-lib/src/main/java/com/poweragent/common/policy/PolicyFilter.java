package com.poweragent.common.policy;

import com.poweragent.common.decision.ActionTemplate;
import com.poweragent.common.model.OptimizationAction;
import com.poweragent.common.model.OptimizationMode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gates decision candidates by the active {@link OptimizationMode}.
 *
 * <h3>Normal</h3>
 * <ol>
 *   <li>Drop candidates with {@code confidence < mode.minConfidence}.</li>
 *   <li>Drop candidates with {@code performanceImpact > maxPerformanceImpact}.</li>
 *   <li>Clamp intensity to {@code mode.maxIntensity}; savings scale with it.</li>
 *   <li>Keep the highest-savings candidate per target component.</li>
 *   <li>Keep at most {@code maxActionsPerCycle}, highest savings first.</li>
 * </ol>
 *
 * <h3>Emergency</h3>
 * Mode limits are ignored. Every known target gets exactly one action at intensity 1.0
 * and confidence 1.0. A candidate for the target whose confidence reaches the emergency
 * floor lends its action type and savings; otherwise the target's emergency template is
 * used, then any candidate for the target. A target with neither is left alone.
 *
 * <p>Stateless apart from the clock used to stamp synthesised actions.
 */
public final class PolicyFilter {

    private static final Comparator<OptimizationAction> BY_SAVINGS_DESC =
        Comparator.comparingDouble(OptimizationAction::estimatedSavings).reversed();

    private final PolicySettings settings;
    private final Clock          clock;

    public PolicyFilter(PolicySettings settings, Clock clock) {
        this.settings = settings;
        this.clock    = clock;
    }

    public List<OptimizationAction> filter(List<OptimizationAction> candidates, OptimizationMode mode,
                                           boolean emergency) {
        return filter(candidates, mode, emergency, settings.emergencyTemplates().keySet());
    }

    public List<OptimizationAction> filter(List<OptimizationAction> candidates, OptimizationMode mode,
                                           boolean emergency, Collection<String> knownTargets) {
        List<OptimizationAction> input = candidates == null ? List.of() : candidates;
        return emergency ? emergencySet(input, knownTargets) : normalSet(input, mode);
    }

    // ── normal ─────────────────────────────────────────────────────────────

    private List<OptimizationAction> normalSet(List<OptimizationAction> candidates, OptimizationMode mode) {
        Map<String, OptimizationAction> bestPerTarget = new LinkedHashMap<>();
        for (OptimizationAction candidate : candidates) {
            if (candidate.confidence() < mode.minConfidence()) continue;
            if (candidate.performanceImpact() > settings.maxPerformanceImpact()) continue;

            OptimizationAction clamped = candidate.intensity() > mode.maxIntensity()
                ? candidate.withIntensity(mode.maxIntensity())
                : candidate;

            bestPerTarget.merge(clamped.targetComponent(), clamped,
                (kept, next) -> next.estimatedSavings() > kept.estimatedSavings() ? next : kept);
        }

        List<OptimizationAction> approved = new ArrayList<>(bestPerTarget.values());
        approved.sort(BY_SAVINGS_DESC);
        if (approved.size() > settings.maxActionsPerCycle()) {
            return List.copyOf(approved.subList(0, settings.maxActionsPerCycle()));
        }
        return List.copyOf(approved);
    }

    // ── emergency ──────────────────────────────────────────────────────────

    private List<OptimizationAction> emergencySet(List<OptimizationAction> candidates,
                                                  Collection<String> knownTargets) {
        Set<String> targets = new LinkedHashSet<>(knownTargets);
        if (targets.isEmpty()) {
            targets.addAll(settings.emergencyTemplates().keySet());
        }

        List<OptimizationAction> out = new ArrayList<>();
        for (String target : targets) {
            OptimizationAction confident = null;
            OptimizationAction any       = null;
            for (OptimizationAction c : candidates) {
                if (!target.equals(c.targetComponent())) continue;
                if (any == null || c.estimatedSavings() > any.estimatedSavings()) any = c;
                if (c.confidence() >= settings.emergencyConfidenceFloor()
                        && (confident == null || c.estimatedSavings() > confident.estimatedSavings())) {
                    confident = c;
                }
            }

            ActionTemplate template = settings.emergencyTemplates().get(target);
            if (confident != null) {
                out.add(confident.withIntensity(1.0).withConfidence(1.0));
            } else if (template != null) {
                out.add(fromTemplate(template));
            } else if (any != null) {
                out.add(any.withIntensity(1.0).withConfidence(1.0));
            }
        }
        out.sort(BY_SAVINGS_DESC);
        return List.copyOf(out);
    }

    private OptimizationAction fromTemplate(ActionTemplate template) {
        double savings = template.baseIntensity() > 0.0
            ? template.baseSavings() / template.baseIntensity()
            : template.baseSavings();
        return OptimizationAction.create(template.actionType(), 1.0, template.targetComponent(),
            savings, template.performanceImpact(), 1.0, clock.instant());
    }
}
