package com.poweragent.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.poweragent.agent.actuator.ActionDispatcher;
import com.poweragent.agent.actuator.ComponentOptimizer;
import com.poweragent.agent.actuator.ComponentOptimizerRegistry;
import com.poweragent.agent.actuator.SimulatedComponentOptimizer;
import com.poweragent.agent.learning.FeedbackLearner;
import com.poweragent.agent.loop.AgentController;
import com.poweragent.agent.loop.ControllerSettings;
import com.poweragent.agent.metrics.AgentMetrics;
import com.poweragent.agent.monitor.JvmMetricSource;
import com.poweragent.agent.monitor.MetricSource;
import com.poweragent.agent.monitor.MonitorSampler;
import com.poweragent.agent.monitor.SnapshotCell;
import com.poweragent.agent.persistence.AgentStateStore;
import com.poweragent.agent.persistence.WriteBehindQueue;
import com.poweragent.common.classifier.BootstrapDataGenerator;
import com.poweragent.common.classifier.SeverityModelTrainer;
import com.poweragent.common.context.ContextAnalyzer;
import com.poweragent.common.context.ContextThresholds;
import com.poweragent.common.decision.AwayRule;
import com.poweragent.common.decision.DecisionEngine;
import com.poweragent.common.decision.DecisionSettings;
import com.poweragent.common.decision.FeatureMetric;
import com.poweragent.common.decision.RuleCondition;
import com.poweragent.common.decision.ThresholdRule;
import com.poweragent.common.model.ModeName;
import com.poweragent.common.model.OptimizationMode;
import com.poweragent.common.model.SeverityClass;
import com.poweragent.common.policy.PolicyFilter;
import com.poweragent.common.policy.PolicySettings;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;

/**
 * Wires the control loop from {@link AgentProperties}.
 *
 * <p>Thread layout: one dedicated thread for controller ticks, one for monitor sampling,
 * the bounded-elastic pool for actuator calls and a single thread for retraining.
 */
@Configuration
public class AgentConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── schedulers ─────────────────────────────────────────────────────────

    @Bean(destroyMethod = "dispose")
    public Scheduler loopScheduler() {
        return Schedulers.fromExecutorService(
            Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "power-agent-loop")), "power-agent-loop");
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler samplerScheduler() {
        return Schedulers.newSingle("power-agent-monitor", true);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler retrainScheduler() {
        return Schedulers.newSingle("power-agent-retrain", true);
    }

    @Bean(destroyMethod = "")
    public Scheduler dispatchScheduler() {
        return Schedulers.boundedElastic();
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    // ── reasoning ──────────────────────────────────────────────────────────

    @Bean
    public ContextThresholds contextThresholds(AgentProperties properties) {
        AgentProperties.Thresholds t = properties.getThresholds();
        return new ContextThresholds(t.getEmergencyBattery(), t.getLowBattery(), t.getMediumBattery(),
            t.getFullBattery(), t.getHeavyDemand(), t.getModerateDemand(), t.getLightDemand(),
            t.getQuietCpu(), t.getQuietTargetCpu(), t.getAwayAfter(),
            t.getNightStartHour(), t.getNightEndHour(), zoneOf(properties));
    }

    @Bean
    public ContextAnalyzer contextAnalyzer(ContextThresholds thresholds) {
        return new ContextAnalyzer(thresholds);
    }

    @Bean
    public DecisionSettings decisionSettings(AgentProperties properties) {
        AgentProperties.Decision d = properties.getDecision();
        DecisionSettings defaults = DecisionSettings.defaults();
        List<ThresholdRule> rules = d.getRules().isEmpty() ? defaults.rules() : toRules(d.getRules());
        return new DecisionSettings(rules, defaults.templates(), defaults.bands(),
            d.getRuleConfidence(), d.getEmergencyBoost(), d.getMinTrainingSamples(), d.getProbabilityFloor(),
            defaults.intensityLow(), defaults.intensityHigh(), defaults.contextWeight(),
            d.getAppPriorityCpu(), awayRules(d, defaults), zoneOf(properties));
    }

    static List<AwayRule> awayRules(AgentProperties.Decision d, DecisionSettings defaults) {
        if (!d.isAwayMode()) {
            return List.of();
        }
        return defaults.awayRules().stream()
            .map(r -> r.minNetworkMb() > 0.0 ? new AwayRule(r.template(), r.confidence(), d.getAwayNetworkMb()) : r)
            .toList();
    }

    @Bean
    public DecisionEngine decisionEngine(FeedbackLearner learner, DecisionSettings settings, Clock clock) {
        return new DecisionEngine(learner, settings, clock);
    }

    @Bean
    public PolicyFilter policyFilter(AgentProperties properties, Clock clock) {
        AgentProperties.Policy p = properties.getPolicy();
        PolicySettings settings = new PolicySettings(p.getMaxActionsPerCycle(), p.getMaxPerformanceImpact(),
            p.getEmergencyConfidenceFloor(), PolicySettings.defaultEmergencyTemplates());
        return new PolicyFilter(settings, clock);
    }

    // ── learning ───────────────────────────────────────────────────────────

    @Bean
    public SeverityModelTrainer severityModelTrainer(AgentProperties properties, Clock clock) {
        AgentProperties.Learning l = properties.getLearning();
        return new SeverityModelTrainer(l.getEpochs(), l.getLearningRate(), l.getL2(), clock);
    }

    @Bean
    public BootstrapDataGenerator bootstrapDataGenerator(ContextAnalyzer contextAnalyzer) {
        return new BootstrapDataGenerator(contextAnalyzer);
    }

    @Bean
    public WriteBehindQueue writeBehindQueue() {
        return new WriteBehindQueue();
    }

    @Bean
    public FeedbackLearner feedbackLearner(AgentStateStore store, WriteBehindQueue writes,
                                           SeverityModelTrainer trainer, BootstrapDataGenerator bootstrap,
                                           AgentMetrics metrics, Clock clock,
                                           @Qualifier("retrainScheduler") Scheduler retrainScheduler,
                                           AgentProperties properties) {
        return new FeedbackLearner(store, writes, trainer, bootstrap, metrics, clock, retrainScheduler,
            properties.getLearning());
    }

    // ── monitoring and actuation ───────────────────────────────────────────

    @Bean
    public AgentMetrics agentMetrics(MeterRegistry registry) {
        return new AgentMetrics(registry);
    }

    @Bean
    public SnapshotCell snapshotCell() {
        return new SnapshotCell();
    }

    @Bean
    public MetricSource metricSource() {
        return new JvmMetricSource();
    }

    @Bean
    public MonitorSampler monitorSampler(MetricSource source, SnapshotCell cell, AgentMetrics metrics, Clock clock,
                                         @Qualifier("samplerScheduler") Scheduler scheduler,
                                         AgentProperties properties) {
        return new MonitorSampler(source, cell, metrics, clock, properties.getMonitoringInterval(), scheduler);
    }

    @Bean
    public ComponentOptimizerRegistry componentOptimizerRegistry(AgentProperties properties) {
        List<ComponentOptimizer> optimizers = new ArrayList<>();
        for (String target : properties.getActuation().getTargets()) {
            optimizers.add(new SimulatedComponentOptimizer(target));
        }
        return new ComponentOptimizerRegistry(optimizers);
    }

    @Bean
    public ActionDispatcher actionDispatcher(ComponentOptimizerRegistry actuator,
                                             @Qualifier("dispatchScheduler") Scheduler scheduler,
                                             AgentProperties properties) {
        AgentProperties.Actuation a = properties.getActuation();
        return new ActionDispatcher(actuator, scheduler, a.getMaxRetries(), a.getRetryBackoff(),
            a.getDispatchTimeout());
    }

    // ── controller ─────────────────────────────────────────────────────────

    @Bean
    public ControllerSettings controllerSettings(AgentProperties properties) {
        Map<ModeName, OptimizationMode> modes = new EnumMap<>(ModeName.class);
        properties.getModes().forEach((name, mode) -> {
            ModeName key = ModeName.parse(name);
            modes.put(key, new OptimizationMode(key, mode.getMaxIntensity(), mode.getMinConfidence()));
        });
        return new ControllerSettings(properties.getMonitoringInterval(), properties.getTrailingWindow(),
            properties.getUnchangedTolerance(), modes, ModeName.parse(properties.getMode()),
            properties.getStoreTimeout());
    }

    @Bean
    public AgentController agentController(SnapshotCell monitor, ContextAnalyzer contextAnalyzer,
                                           DecisionEngine decisionEngine, PolicyFilter policyFilter,
                                           ActionDispatcher dispatcher, ComponentOptimizerRegistry actuator,
                                           FeedbackLearner learner, AgentStateStore store, WriteBehindQueue writes,
                                           AgentMetrics metrics, Clock clock, ControllerSettings settings) {
        return new AgentController(monitor, contextAnalyzer, decisionEngine, policyFilter, dispatcher, actuator,
            learner, store, writes, metrics, clock, settings);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static ZoneId zoneOf(AgentProperties properties) {
        String zone = properties.getZone();
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    static List<ThresholdRule> toRules(List<AgentProperties.Rule> configured) {
        List<ThresholdRule> rules = new ArrayList<>();
        for (AgentProperties.Rule rule : configured) {
            List<RuleCondition> conditions = new ArrayList<>();
            for (AgentProperties.Condition c : rule.getConditions()) {
                conditions.add(new RuleCondition(
                    FeatureMetric.valueOf(c.getMetric().trim().toUpperCase(Locale.ROOT)),
                    RuleCondition.Comparison.valueOf(c.getComparison().trim().toUpperCase(Locale.ROOT)),
                    c.getThreshold()));
            }
            rules.add(new ThresholdRule(rule.getName(), conditions,
                SeverityClass.valueOf(rule.getSeverity().trim().toUpperCase(Locale.ROOT))));
        }
        return rules;
    }
}
