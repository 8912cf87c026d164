package com.poweragent.common.model;

public enum TimeOfDay {
    MORNING,
    AFTERNOON,
    EVENING,
    NIGHT;

    public static TimeOfDay fromHour(int hour) {
        if (hour >= 6 && hour < 12)  return MORNING;
        if (hour >= 12 && hour < 18) return AFTERNOON;
        if (hour >= 18 && hour < 22) return EVENING;
        return NIGHT;
    }
}
