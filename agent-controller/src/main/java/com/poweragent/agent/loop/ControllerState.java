package com.poweragent.agent.loop;

public enum ControllerState {
    STOPPED,
    RUNNING,
    PAUSED,
    EMERGENCY
}
