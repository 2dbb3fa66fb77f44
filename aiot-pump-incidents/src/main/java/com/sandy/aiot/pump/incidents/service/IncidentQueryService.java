package com.sandy.aiot.pump.incidents.service;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import com.sandy.aiot.pump.incidents.entity.Incident;
import com.sandy.aiot.pump.incidents.repository.IncidentRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side for incident history: filtered, newest first, offset/limit paging.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IncidentQueryService {

    private final EntityManager entityManager;
    private final IncidentRepository incidentRepository;

    public Page search(Filter filter, int limit, int offset) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();

        CriteriaQuery<Incident> query = cb.createQuery(Incident.class);
        Root<Incident> root = query.from(Incident.class);
        query.select(root).where(predicates(cb, root, filter)).orderBy(cb.desc(root.get("timestamp")), cb.desc(root.get("id")));
        List<Incident> data = entityManager.createQuery(query)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();

        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<Incident> countRoot = countQuery.from(Incident.class);
        countQuery.select(cb.count(countRoot)).where(predicates(cb, countRoot, filter));
        long total = entityManager.createQuery(countQuery).getSingleResult();
        return new Page(data, total);
    }

    public List<Incident> findOpen(String device, ConditionType type) {
        return incidentRepository.findByDeviceAndConditionTypeAndActiveTrue(device, type);
    }

    public long countOpen() {
        return incidentRepository.countByActiveTrue();
    }

    public long countAll() {
        return incidentRepository.count();
    }

    private Predicate[] predicates(CriteriaBuilder cb, Root<Incident> root, Filter f) {
        List<Predicate> list = new ArrayList<>();
        if (f.getDevice() != null) list.add(cb.equal(root.get("device"), f.getDevice()));
        if (f.getActive() != null) list.add(cb.equal(root.get("active"), f.getActive()));
        if (f.getConditionType() != null) list.add(cb.equal(root.get("conditionType"), f.getConditionType()));
        if (f.getFrom() != null) list.add(cb.greaterThanOrEqualTo(root.<Instant>get("timestamp"), f.getFrom()));
        if (f.getTo() != null) list.add(cb.lessThanOrEqualTo(root.<Instant>get("timestamp"), f.getTo()));
        return list.toArray(new Predicate[0]);
    }

    @Value
    @Builder
    public static class Filter {
        String device;
        Boolean active;
        ConditionType conditionType;
        Instant from;
        Instant to;
    }

    public record Page(List<Incident> data, long total) { }
}
