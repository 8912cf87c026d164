package com.poweragent.agent.actuator;

import com.poweragent.common.model.ActionResult;

import java.util.concurrent.CompletableFuture;

/**
 * What became of one apply or revert within the soft timeout.
 *
 * <ul>
 *   <li>{@code SUCCEEDED}: the actuator confirmed the call.</li>
 *   <li>{@code FAILED}: every retry failed; {@code result} carries the last message.</li>
 *   <li>{@code PENDING}: still running; {@code pending} completes when it finishes.</li>
 * </ul>
 */
public record DispatchResult(Status status, ActionResult result, CompletableFuture<ActionResult> pending) {

    public enum Status { SUCCEEDED, FAILED, PENDING }

    public static DispatchResult succeeded(ActionResult result) {
        return new DispatchResult(Status.SUCCEEDED, result, null);
    }

    public static DispatchResult failed(String message) {
        return new DispatchResult(Status.FAILED, ActionResult.failed(message), null);
    }

    public static DispatchResult pending(CompletableFuture<ActionResult> future) {
        return new DispatchResult(Status.PENDING, null, future);
    }

    public boolean isSucceeded() { return status == Status.SUCCEEDED; }
    public boolean isFailed()    { return status == Status.FAILED; }
    public boolean isPending()   { return status == Status.PENDING; }
}
