package com.poweragent.agent.actuator;

import com.poweragent.common.exception.ActuationException;
import com.poweragent.common.model.ActionResult;
import com.poweragent.common.model.OptimizationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs actuator calls off the tick thread with bounded exponential-backoff retry and a
 * soft timeout.
 *
 * <pre>
 *   call → success?  ── yes → SUCCEEDED
 *            │ no / throws
 *            └→ retry up to maxRetries (backoff, 2×, jitter) → FAILED
 *   not finished within dispatchTimeout → PENDING (keeps running, poll later)
 * </pre>
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final Actuator  actuator;
    private final Scheduler scheduler;
    private final int       maxRetries;
    private final Duration  backoff;
    private final Duration  timeout;

    public ActionDispatcher(Actuator actuator, Scheduler scheduler, int maxRetries,
                            Duration backoff, Duration timeout) {
        this.actuator   = actuator;
        this.scheduler  = scheduler;
        this.maxRetries = maxRetries;
        this.backoff    = backoff;
        this.timeout    = timeout;
    }

    public DispatchResult apply(OptimizationAction action) {
        return dispatch(action.id(), "apply", () -> actuator.apply(action));
    }

    public DispatchResult revert(String actionId) {
        return dispatch(actionId, "revert", () -> actuator.revert(actionId));
    }

    /**
     * Result of a previously pending call, or empty while it is still running.
     */
    public Optional<DispatchResult> poll(CompletableFuture<ActionResult> pending) {
        if (!pending.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await(pending, "poll", null));
    }

    /**
     * Waits up to the soft timeout for a pending call; PENDING again when it is still running.
     */
    public DispatchResult settle(CompletableFuture<ActionResult> pending) {
        return await(pending, "settle", null);
    }

    private DispatchResult dispatch(String actionId, String verb, Callable<ActionResult> call) {
        CompletableFuture<ActionResult> future = Mono.fromCallable(call)
            .flatMap(result -> result.success()
                ? Mono.just(result)
                : Mono.<ActionResult>error(new ActuationException(actionId, verb + " rejected: " + result.message())))
            .retryWhen(Retry.backoff(maxRetries, backoff)
                .doBeforeRetry(signal -> log.warn("[Dispatcher] Retrying {} action={} attempt={} reason={}",
                    verb, actionId, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .subscribeOn(scheduler)
            .toFuture();

        return await(future, verb, actionId);
    }

    private DispatchResult await(CompletableFuture<ActionResult> future, String verb, String actionId) {
        try {
            return DispatchResult.succeeded(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.warn("[Dispatcher] {} still running after {}ms, leaving pending action={}",
                verb, timeout.toMillis(), actionId);
            return DispatchResult.pending(future);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Dispatcher] {} failed after retries action={} reason={}", verb, actionId, cause.getMessage());
            return DispatchResult.failed(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Dispatcher] Interrupted waiting for {} action={}", verb, actionId);
            return DispatchResult.pending(future);
        }
    }
}
