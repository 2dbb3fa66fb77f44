package com.sandy.aiot.pump.incidents.service.impl;

import com.sandy.aiot.pump.incidents.entity.Incident;
import com.sandy.aiot.pump.incidents.exception.StorageException;
import com.sandy.aiot.pump.incidents.repository.IncidentRepository;
import com.sandy.aiot.pump.incidents.service.ConditionReport;
import com.sandy.aiot.pump.incidents.service.IncidentKey;
import com.sandy.aiot.pump.incidents.service.IncidentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link IncidentStore} on Spring Data JPA. Open-incident and by-id lookups take a pessimistic write lock,
 * so a decision made inside {@link #inTransaction} cannot be invalidated by another writer before commit.
 */
@Service
@Slf4j
public class JpaIncidentStore implements IncidentStore {

    private final IncidentRepository incidentRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaIncidentStore(IncidentRepository incidentRepository,
                            PlatformTransactionManager transactionManager,
                            @Value("${incident.tracker.transaction-timeout-seconds:10}") int transactionTimeoutSeconds) {
        this.incidentRepository = incidentRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(transactionTimeoutSeconds);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (TransientDataAccessException | RecoverableDataAccessException | TransactionException e) {
            throw new StorageException("Incident transaction failed: " + e.getMessage(), e, true);
        } catch (DataAccessException e) {
            throw new StorageException("Incident storage error: " + e.getMessage(), e, false);
        }
    }

    @Override
    public List<Incident> findOpenIncidents(IncidentKey key) {
        return incidentRepository.findOpenForUpdate(key.device(), key.conditionType());
    }

    @Override
    public Optional<Incident> findById(Long incidentId) {
        return incidentRepository.findByIdForUpdate(incidentId);
    }

    @Override
    public Incident createIncident(ConditionReport report) {
        Incident incident = Incident.builder()
                .device(report.getDevice())
                .conditionType(report.getConditionType())
                .location(report.getLocation())
                .value(report.getValue())
                .threshold(report.getThreshold())
                .description(report.getDescription())
                .startTime(report.getStartTime())
                .timestamp(report.getTimestamp())
                .duration(report.getDuration())
                .active(true)
                .acknowledged(false)
                .build();
        return incidentRepository.save(incident);
    }

    @Override
    public Incident updateIncident(Incident open, ConditionReport report) {
        open.setTimestamp(report.getTimestamp());
        open.setValue(report.getValue());
        open.setDuration(report.getDuration());
        open.setDescription(report.getDescription());
        return incidentRepository.save(open);
    }

    @Override
    public Incident resolveIncident(Incident open, Instant resolvedAt, long duration) {
        open.setActive(false);
        open.setTimestamp(resolvedAt);
        open.setDuration(duration);
        return incidentRepository.save(open);
    }

    @Override
    public Incident acknowledgeIncident(Incident incident, String actor, Instant acknowledgedAt) {
        incident.setAcknowledged(true);
        incident.setAcknowledgedAt(acknowledgedAt);
        incident.setAcknowledgedBy(actor);
        return incidentRepository.save(incident);
    }
}
