package com.sandy.aiot.pump.incidents.service;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One validated observation from a device: is the condition currently active, plus supporting telemetry.
 * Built by the REST layer or the missing-data monitor, never straight from raw JSON.
 */
@Value
@Builder
public class ConditionReport {
    String device;
    ConditionType conditionType;
    Instant timestamp;
    Instant startTime;
    double value;
    double threshold;
    long duration;
    boolean active;
    String description;
    String location;

    public IncidentKey key() {
        return new IncidentKey(device, conditionType);
    }
}
