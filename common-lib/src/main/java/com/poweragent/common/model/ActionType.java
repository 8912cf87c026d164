package com.poweragent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of optimization an actuator knows how to apply.
 */
public enum ActionType {
    CPU_THROTTLE("cpu_throttle"),
    BRIGHTNESS_ADJUST("brightness_adjust"),
    NETWORK_LIMIT("network_limit"),
    APP_THROTTLE("app_throttle"),
    PROCESS_PRIORITY("process_priority");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ActionType fromWireName(String name) {
        for (ActionType type : values()) {
            if (type.wireName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + name);
    }
}
