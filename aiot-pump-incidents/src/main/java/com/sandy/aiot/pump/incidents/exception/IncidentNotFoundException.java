package com.sandy.aiot.pump.incidents.exception;

import lombok.Getter;

@Getter
public class IncidentNotFoundException extends RuntimeException {
    private final Long incidentId;

    public IncidentNotFoundException(Long incidentId) {
        super("Incident not found: " + incidentId);
        this.incidentId = incidentId;
    }
}
