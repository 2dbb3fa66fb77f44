package com.sandy.aiot.pump.incidents.event;

import com.sandy.aiot.pump.incidents.entity.ConditionType;

import java.time.Instant;

/** Published after an open incident was closed, by a device clear or by an operator. */
public record IncidentResolvedEvent(Long incidentId, String device, ConditionType conditionType,
                                    Instant resolvedAt, long duration, boolean manual) {
}
