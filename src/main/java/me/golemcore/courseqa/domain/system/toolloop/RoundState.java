package me.golemcore.courseqa.domain.system.toolloop;

/** States of the round controller. */
public enum RoundState {
    AWAITING_MODEL, DISPATCHING_TOOLS, TERMINATED
}
