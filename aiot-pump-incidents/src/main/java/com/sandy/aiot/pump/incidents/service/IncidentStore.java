package com.sandy.aiot.pump.incidents.service;

import com.sandy.aiot.pump.incidents.entity.Incident;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage capability used by the tracker. Every lookup and mutation of one decision runs inside a
 * single {@link #inTransaction} call; lookups lock the rows they return until it completes.
 */
public interface IncidentStore {

    /**
     * Runs the work in one transaction. Storage failures surface as {@code StorageException}.
     */
    <T> T inTransaction(Supplier<T> work);

    /** Open incidents for the key, newest {@code timestamp} first. Normally zero or one. */
    List<Incident> findOpenIncidents(IncidentKey key);

    Optional<Incident> findById(Long incidentId);

    Incident createIncident(ConditionReport report);

    /** Refreshes timestamp, value, duration and description; identity and startTime stay. */
    Incident updateIncident(Incident open, ConditionReport report);

    Incident resolveIncident(Incident open, Instant resolvedAt, long duration);

    Incident acknowledgeIncident(Incident incident, String actor, Instant acknowledgedAt);
}
