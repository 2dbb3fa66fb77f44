package com.sandy.aiot.pump.incidents.service;

import com.sandy.aiot.pump.incidents.entity.ConditionType;

/** Classification key; the open-incident invariant and the tracker's locking are scoped to it. */
public record IncidentKey(String device, ConditionType conditionType) {
    @Override
    public String toString() {
        return device + ":" + conditionType;
    }
}
