package com.poweragent.agent.loop;

import com.poweragent.agent.config.AgentProperties;
import com.poweragent.agent.learning.FeedbackLearner;
import com.poweragent.agent.monitor.MonitorSampler;
import com.poweragent.agent.persistence.WriteBehindQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Drives the controller at the decision cadence.
 *
 * <p>Startup order: learning state restored (bootstrap model trained if none was stored),
 * monitor sampling started, active actions reloaded, first tick scheduled. Each cycle is a
 * fresh {@code Mono.delay} pipeline whose terminal callback schedules the next one, so a
 * failing tick never ends the loop.
 *
 * <p>Shutdown reverts every active action, stops sampling and drains pending store writes.
 */
@Component
public class ControlLoopRunner {

    private static final Logger log = LoggerFactory.getLogger(ControlLoopRunner.class);

    private final AgentController  controller;
    private final FeedbackLearner  learner;
    private final MonitorSampler   sampler;
    private final WriteBehindQueue writes;
    private final Scheduler        loopScheduler;
    private final Duration         decisionInterval;
    private final Duration         storeTimeout;

    private volatile boolean    running;
    private volatile Disposable nextCycle;

    public ControlLoopRunner(AgentController controller, FeedbackLearner learner, MonitorSampler sampler,
                             WriteBehindQueue writes, @Qualifier("loopScheduler") Scheduler loopScheduler,
                             AgentProperties properties, ControllerSettings settings) {
        this.controller       = controller;
        this.learner          = learner;
        this.sampler          = sampler;
        this.writes           = writes;
        this.loopScheduler    = loopScheduler;
        this.decisionInterval = properties.getDecisionInterval();
        this.storeTimeout     = settings.storeTimeout();
    }

    @PostConstruct
    public void start() {
        learner.initialize(storeTimeout);
        sampler.start();
        controller.start();
        running = true;
        log.info("[ControlLoop] Started decisionIntervalMs={}", decisionInterval.toMillis());
        scheduleNextCycle(decisionInterval);
    }

    @PreDestroy
    public void stop() {
        running = false;
        Disposable cycle = nextCycle;
        if (cycle != null) {
            cycle.dispose();
        }
        controller.shutdown();
        sampler.stop();
        writes.flush(storeTimeout);
        writes.close();
        log.info("[ControlLoop] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ── loop ───────────────────────────────────────────────────────────────

    private void scheduleNextCycle(Duration delay) {
        if (!running) {
            return;
        }
        nextCycle = Mono.delay(delay, loopScheduler)
            .doOnNext(i -> controller.tick())
            .subscribe(
                i -> scheduleNextCycle(decisionInterval),
                err -> {
                    log.error("[ControlLoop] Cycle failed, rescheduling", err);
                    scheduleNextCycle(decisionInterval);
                });
    }
}
