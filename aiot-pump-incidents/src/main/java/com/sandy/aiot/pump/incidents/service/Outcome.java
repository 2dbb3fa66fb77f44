package com.sandy.aiot.pump.incidents.service;

/**
 * Result of a tracker operation. Failures are not variants here; they are thrown as
 * {@code IncidentNotFoundException} or {@code StorageException}.
 */
public sealed interface Outcome
        permits Outcome.Created, Outcome.Updated, Outcome.Resolved, Outcome.NoOpClear, Outcome.Acknowledged {

    record Created(Long incidentId) implements Outcome { }

    record Updated(Long incidentId) implements Outcome { }

    record Resolved(Long incidentId) implements Outcome { }

    /** Clear arrived with nothing open; nothing was persisted. */
    record NoOpClear() implements Outcome { }

    record Acknowledged(Long incidentId) implements Outcome { }
}
