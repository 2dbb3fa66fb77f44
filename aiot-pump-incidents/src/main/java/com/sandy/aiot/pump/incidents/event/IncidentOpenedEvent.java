package com.sandy.aiot.pump.incidents.event;

import com.sandy.aiot.pump.incidents.entity.ConditionType;

import java.time.Instant;

/** Published after a report opened a new incident. */
public record IncidentOpenedEvent(Long incidentId, String device, ConditionType conditionType,
                                  String location, double value, double threshold,
                                  String description, Instant startTime) {
}
