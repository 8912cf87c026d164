package com.poweragent.agent.api;

import com.poweragent.agent.loop.ActiveAction;
import com.poweragent.agent.loop.AgentController;
import com.poweragent.agent.loop.AgentStatus;
import com.poweragent.agent.loop.RevertReport;
import com.poweragent.common.model.FeedbackRecord;
import com.poweragent.common.model.ModeName;
import com.poweragent.common.model.OptimizationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Control surface of the agent. Commands take the controller lock and may wait on the
 * actuator, so they run on the bounded-elastic pool.
 */
@RestController
@RequestMapping("/api/v1/agent")
public class AgentApiController {

    private static final Logger log = LoggerFactory.getLogger(AgentApiController.class);

    private final AgentController controller;

    public AgentApiController(AgentController controller) {
        this.controller = controller;
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<AgentStatus>> status() {
        log.debug("[Api] Status query received");
        return call(controller::status)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Status endpoint error", e));
    }

    @GetMapping("/actions")
    public Mono<ResponseEntity<List<OptimizationAction>>> actions() {
        log.debug("[Api] Active actions query received");
        return call(() -> controller.activeActions().stream().map(ActiveAction::action).toList())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Actions endpoint error", e));
    }

    @PostMapping("/pause")
    public Mono<ResponseEntity<AgentStatus>> pause() {
        log.info("[Api] Pause requested");
        return call(() -> {
            controller.pause();
            return controller.status();
        })
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Pause endpoint error", e));
    }

    @PostMapping("/resume")
    public Mono<ResponseEntity<AgentStatus>> resume() {
        log.info("[Api] Resume requested");
        return call(() -> {
            controller.resume();
            return controller.status();
        })
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Resume endpoint error", e));
    }

    @PostMapping("/revert-all")
    public Mono<ResponseEntity<List<RevertReport>>> revertAll() {
        log.info("[Api] Revert-all requested");
        return call(controller::revertAll)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Revert-all endpoint error", e));
    }

    @PostMapping("/emergency-revert")
    public Mono<ResponseEntity<List<RevertReport>>> emergencyRevert() {
        log.warn("[Api] Emergency revert requested");
        return call(controller::emergencyRevert)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Emergency-revert endpoint error", e));
    }

    @PutMapping("/mode/{mode}")
    public Mono<ResponseEntity<AgentStatus>> setMode(@PathVariable String mode) {
        log.info("[Api] Mode change requested mode={}", mode);
        ModeName name;
        try {
            name = ModeName.parse(mode);
        } catch (IllegalArgumentException e) {
            log.warn("[Api] Rejected unknown mode={}", mode);
            return Mono.just(ResponseEntity.badRequest().<AgentStatus>build());
        }
        return call(() -> {
            controller.setMode(name);
            return controller.status();
        })
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Mode endpoint error mode={}", mode, e));
    }

    @PostMapping("/feedback")
    public Mono<ResponseEntity<FeedbackRecord>> feedback(@RequestBody FeedbackRequest request) {
        log.info("[Api] Feedback received satisfaction={} performanceAcceptable={} batteryImprovement={}",
            request.satisfaction(), request.performanceAcceptable(), request.batteryImprovement());
        return call(() -> controller.submitFeedback(request.satisfaction(), request.performanceAcceptable(),
                request.batteryImprovement(), request.comments()))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("[Api] Feedback endpoint error", e));
    }

    private static <T> Mono<T> call(Callable<T> command) {
        return Mono.fromCallable(command).subscribeOn(Schedulers.boundedElastic());
    }
}
