package com.poweragent.agent.loop;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.poweragent.common.exception.FailureKind;
import com.poweragent.common.model.Calibration;
import com.poweragent.common.model.ModeName;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read model of the controller, copied out under the controller lock.
 */
public record AgentStatus(
    @JsonProperty("mode")                 ModeName                 mode,
    @JsonProperty("state")                ControllerState          state,
    @JsonProperty("activeActionCount")    int                      activeActionCount,
    @JsonProperty("aggregateSavings")     double                   aggregateSavings,
    @JsonProperty("satisfactionAverage")  double                   satisfactionAverage,
    @JsonProperty("failureCounts")        Map<FailureKind, Long>   failureCounts,
    @JsonProperty("stuckActions")         List<StuckAction>        stuckActions,
    @JsonProperty("calibration")          Calibration              calibration,
    @JsonProperty("modelVersion")         long                     modelVersion,
    @JsonProperty("lastDecisionId")       String                   lastDecisionId,
    @JsonProperty("lastDecisionAt")       Instant                  lastDecisionAt,
    @JsonProperty("totalTicks")           long                     totalTicks,
    @JsonProperty("totalDecisions")       long                     totalDecisions,
    @JsonProperty("emergencyActivations") long                     emergencyActivations
) {

    public AgentStatus {
        failureCounts = Map.copyOf(failureCounts);
        stuckActions  = List.copyOf(stuckActions);
    }
}
