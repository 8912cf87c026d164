package com.poweragent.common.model;

public enum ModeName {
    CONSERVATIVE,
    BALANCED,
    AGGRESSIVE;

    public static ModeName parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Mode name must not be blank");
        }
        return ModeName.valueOf(raw.trim().toUpperCase());
    }
}
