package com.sandy.aiot.pump.incidents.entity;

import java.util.Optional;

/**
 * Condition classifier of an incident. Wire codes are the ones sent by the pump monitor firmware;
 * {@link #MISSING_DATA} has no code because only the server side staleness check produces it.
 */
public enum ConditionType {
    HIGH_CURRENT(1),
    LOW_PRESSURE(2),
    LOW_TEMPERATURE(3),
    SENSOR_ERROR(4),
    SYSTEM_ERROR(5),
    MISSING_DATA(0);

    private final int code;

    ConditionType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /** Maps a device wire code (1..5). Unknown codes and the code-less MISSING_DATA yield empty. */
    public static Optional<ConditionType> fromCode(int code) {
        for (ConditionType t : values()) {
            if (t.code == code && t.code != 0) return Optional.of(t);
        }
        return Optional.empty();
    }
}
