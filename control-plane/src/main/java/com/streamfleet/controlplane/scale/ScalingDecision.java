package com.streamfleet.controlplane.scale;

import lombok.Value;

/**
 * Result of one rule evaluation: the action, how many instances it moves and why.
 */
@Value
class ScalingDecision {
    ScalingAction action;
    int adjustment;
    String reason;

    static ScalingDecision noAction(String reason) {
        return new ScalingDecision(ScalingAction.NO_ACTION, 0, reason);
    }
}
