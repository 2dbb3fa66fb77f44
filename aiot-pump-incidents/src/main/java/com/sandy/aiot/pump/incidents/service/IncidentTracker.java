package com.sandy.aiot.pump.incidents.service;

/**
 * Turns condition reports into incident rows, keeping at most one open incident per
 * (device, conditionType).
 */
public interface IncidentTracker {

    /**
     * Creates, refreshes or resolves the open incident for the report's key, or does nothing for a clear
     * with no open incident. Same-key calls are serialised.
     */
    Outcome submit(ConditionReport report);

    /** Marks the incident acknowledged regardless of its active state. Repeat calls keep the first ack. */
    Outcome acknowledge(Long incidentId, String actor);

    /** Operator override: closes the incident without a device report. */
    Outcome resolveManually(Long incidentId);
}
