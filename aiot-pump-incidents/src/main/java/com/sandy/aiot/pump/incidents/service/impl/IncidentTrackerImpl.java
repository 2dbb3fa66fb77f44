package com.sandy.aiot.pump.incidents.service.impl;

import com.sandy.aiot.pump.incidents.entity.Incident;
import com.sandy.aiot.pump.incidents.event.IncidentOpenedEvent;
import com.sandy.aiot.pump.incidents.event.IncidentResolvedEvent;
import com.sandy.aiot.pump.incidents.exception.IncidentNotFoundException;
import com.sandy.aiot.pump.incidents.exception.StorageException;
import com.sandy.aiot.pump.incidents.service.ConditionReport;
import com.sandy.aiot.pump.incidents.service.IncidentKey;
import com.sandy.aiot.pump.incidents.service.IncidentStore;
import com.sandy.aiot.pump.incidents.service.IncidentTracker;
import com.sandy.aiot.pump.incidents.service.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Default tracker. Same-key submissions are serialised by an in-process lock per key; inside it the
 * decision runs in one store transaction that row-locks the open incident.
 * Application events are published only after the transaction has committed.
 */
@Service
@Slf4j
public class IncidentTrackerImpl implements IncidentTracker {

    private final IncidentStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final long lockTimeoutMs;

    // one lock per key ever seen, never evicted: at most devices x condition types entries
    private final Map<IncidentKey, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    public IncidentTrackerImpl(IncidentStore store,
                               ApplicationEventPublisher eventPublisher,
                               @Value("${incident.tracker.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public Outcome submit(ConditionReport report) {
        IncidentKey key = report.key();
        Decision decision = withKeyLock(key, () -> store.inTransaction(() -> decide(key, report)));
        log.debug("Report applied key={} active={} outcome={}", key, report.isActive(), decision.outcome());
        publish(decision.event());
        return decision.outcome();
    }

    @Override
    public Outcome acknowledge(Long incidentId, String actor) {
        String ackBy = actor == null || actor.isBlank() ? null : actor.trim();
        return store.inTransaction(() -> {
            Incident incident = store.findById(incidentId).orElseThrow(() -> new IncidentNotFoundException(incidentId));
            if (incident.isAcknowledged()) {
                log.debug("Incident id={} already acknowledged by={} at={}", incidentId, incident.getAcknowledgedBy(), incident.getAcknowledgedAt());
            } else {
                store.acknowledgeIncident(incident, ackBy, Instant.now());
                log.info("Incident acknowledged id={} key={}:{} by={}", incidentId, incident.getDevice(), incident.getConditionType(), ackBy);
            }
            return new Outcome.Acknowledged(incidentId);
        });
    }

    @Override
    public Outcome resolveManually(Long incidentId) {
        Decision decision = store.inTransaction(() -> {
            Incident incident = store.findById(incidentId).orElseThrow(() -> new IncidentNotFoundException(incidentId));
            if (!incident.isActive()) {
                return new Decision(new Outcome.Resolved(incidentId), null);
            }
            Incident resolved = store.resolveIncident(incident, Instant.now(), incident.getDuration());
            log.info("Incident resolved manually id={} key={}:{}", incidentId, resolved.getDevice(), resolved.getConditionType());
            return new Decision(new Outcome.Resolved(incidentId), resolvedEvent(resolved, true));
        });
        publish(decision.event());
        return decision.outcome();
    }

    private Decision decide(IncidentKey key, ConditionReport report) {
        Optional<Incident> open = authoritativeOpenIncident(key);
        if (report.isActive()) {
            if (open.isPresent()) {
                Incident updated = store.updateIncident(open.get(), report);
                return new Decision(new Outcome.Updated(updated.getId()), null);
            }
            Incident created = store.createIncident(report);
            log.info("Incident opened id={} key={} value={} threshold={}", created.getId(), key, report.getValue(), report.getThreshold());
            return new Decision(new Outcome.Created(created.getId()), openedEvent(created));
        }
        if (open.isPresent()) {
            Incident resolved = store.resolveIncident(open.get(), report.getTimestamp(), report.getDuration());
            log.info("Incident resolved id={} key={} durationMs={}", resolved.getId(), key, resolved.getDuration());
            return new Decision(new Outcome.Resolved(resolved.getId()), resolvedEvent(resolved, false));
        }
        return new Decision(new Outcome.NoOpClear(), null);
    }

    /**
     * Picks the open incident with the latest timestamp. Extra open rows are reported and left as they are.
     */
    private Optional<Incident> authoritativeOpenIncident(IncidentKey key) {
        List<Incident> open = store.findOpenIncidents(key);
        if (open.size() <= 1) {
            return open.stream().findFirst();
        }
        Incident latest = open.stream()
                .max(Comparator.comparing(Incident::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseThrow();
        String others = open.stream()
                .filter(i -> i != latest)
                .map(i -> String.valueOf(i.getId()))
                .collect(Collectors.joining(","));
        log.error("INVARIANT VIOLATION: {} open incidents for key={} authoritativeId={} otherIds=[{}]; operator action required",
                open.size(), key, latest.getId(), others);
        return Optional.of(latest);
    }

    private <T> T withKeyLock(IncidentKey key, Supplier<T> work) {
        ReentrantLock lock = keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted waiting for incident lock key=" + key, e, true);
        }
        if (!acquired) {
            throw new StorageException("Timed out after " + lockTimeoutMs + "ms waiting for incident lock key=" + key, true);
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private void publish(Object event) {
        if (event == null) return;
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            // the incident is already committed; a failing listener must not turn that into an error
            log.error("Incident event listener failed event={}", event, e);
        }
    }

    private IncidentOpenedEvent openedEvent(Incident i) {
        return new IncidentOpenedEvent(i.getId(), i.getDevice(), i.getConditionType(), i.getLocation(),
                i.getValue(), i.getThreshold(), i.getDescription(), i.getStartTime());
    }

    private IncidentResolvedEvent resolvedEvent(Incident i, boolean manual) {
        return new IncidentResolvedEvent(i.getId(), i.getDevice(), i.getConditionType(), i.getTimestamp(), i.getDuration(), manual);
    }

    private record Decision(Outcome outcome, Object event) { }
}
