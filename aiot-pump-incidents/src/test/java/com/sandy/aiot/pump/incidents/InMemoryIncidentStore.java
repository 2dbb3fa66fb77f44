package com.sandy.aiot.pump.incidents;

import com.sandy.aiot.pump.incidents.entity.Incident;
import com.sandy.aiot.pump.incidents.service.ConditionReport;
import com.sandy.aiot.pump.incidents.service.IncidentKey;
import com.sandy.aiot.pump.incidents.service.IncidentStore;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Map-backed store for tracker unit tests. It does no locking of its own, so any serialisation seen in
 * tests comes from the tracker.
 */
public class InMemoryIncidentStore implements IncidentStore {
    private final Map<Long, Incident> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    final AtomicInteger transactions = new AtomicInteger();
    /** Runs at the start of every transaction; lets a test park a caller while it holds its key lock. */
    volatile Runnable onTransactionStart;

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        transactions.incrementAndGet();
        Runnable hook = onTransactionStart;
        if (hook != null) {
            hook.run();
        }
        return work.get();
    }

    @Override
    public List<Incident> findOpenIncidents(IncidentKey key) {
        return rows.values().stream()
                .filter(i -> i.isActive() && i.getDevice().equals(key.device()) && i.getConditionType() == key.conditionType())
                .sorted(Comparator.comparing(Incident::getTimestamp).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Incident> findById(Long incidentId) {
        return Optional.ofNullable(rows.get(incidentId));
    }

    @Override
    public Incident createIncident(ConditionReport r) {
        // widen the read-then-insert window so missing serialisation shows up as duplicates
        Thread.yield();
        Incident i = Incident.builder()
                .id(ids.incrementAndGet())
                .device(r.getDevice())
                .conditionType(r.getConditionType())
                .location(r.getLocation())
                .value(r.getValue())
                .threshold(r.getThreshold())
                .description(r.getDescription())
                .startTime(r.getStartTime())
                .timestamp(r.getTimestamp())
                .duration(r.getDuration())
                .active(true)
                .createdAt(Instant.now())
                .build();
        rows.put(i.getId(), i);
        return i;
    }

    @Override
    public Incident updateIncident(Incident open, ConditionReport r) {
        open.setTimestamp(r.getTimestamp());
        open.setValue(r.getValue());
        open.setDuration(r.getDuration());
        open.setDescription(r.getDescription());
        return open;
    }

    @Override
    public Incident resolveIncident(Incident open, Instant resolvedAt, long duration) {
        open.setActive(false);
        open.setTimestamp(resolvedAt);
        open.setDuration(duration);
        return open;
    }

    @Override
    public Incident acknowledgeIncident(Incident incident, String actor, Instant acknowledgedAt) {
        incident.setAcknowledged(true);
        incident.setAcknowledgedAt(acknowledgedAt);
        incident.setAcknowledgedBy(actor);
        return incident;
    }

    /** Inserts a row as-is, bypassing the tracker. */
    public Incident seed(Incident incident) {
        incident.setId(ids.incrementAndGet());
        rows.put(incident.getId(), incident);
        return incident;
    }

    public void delete(Long id) {
        rows.remove(id);
    }

    public List<Incident> all() {
        return new ArrayList<>(rows.values());
    }
}
