package com.sandy.aiot.pump.incidents.service;

import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.repository.SensorReadingRepository;
import com.sandy.aiot.pump.incidents.repository.SensorReadingRepository.HourlyAverage;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side for telemetry history: filtered offset paging and bucketed averages for chart ranges.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SensorQueryService {

    public enum Interval { HOUR, SIX_HOURS }

    private final EntityManager entityManager;
    private final SensorReadingRepository sensorReadingRepository;

    public Page search(Filter filter, int limit, int offset) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();

        CriteriaQuery<SensorReading> query = cb.createQuery(SensorReading.class);
        Root<SensorReading> root = query.from(SensorReading.class);
        query.select(root).where(predicates(cb, root, filter)).orderBy(cb.desc(root.get("timestamp")), cb.desc(root.get("id")));
        List<SensorReading> data = entityManager.createQuery(query)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();

        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<SensorReading> countRoot = countQuery.from(SensorReading.class);
        countQuery.select(cb.count(countRoot)).where(predicates(cb, countRoot, filter));
        long total = entityManager.createQuery(countQuery).getSingleResult();
        return new Page(data, total);
    }

    /**
     * Averages per bucket, newest first. Six-hour buckets start at 00, 06, 12 and 18 UTC and are
     * folded from the hourly rows weighted by sample count, so they equal an average over the raw rows.
     */
    public List<Bucket> aggregate(Interval interval, Instant from, Instant to, String device) {
        List<HourlyAverage> hourly = sensorReadingRepository.averageByHour(from, to, device);
        Map<Instant, Bucket> buckets = new LinkedHashMap<>();
        for (HourlyAverage h : hourly) {
            LocalDateTime hourStart = LocalDateTime.of(h.getBucketYear(), h.getBucketMonth(), h.getBucketDay(), h.getBucketHour(), 0);
            if (interval == Interval.SIX_HOURS) {
                hourStart = hourStart.withHour(hourStart.getHour() - hourStart.getHour() % 6);
            }
            Instant start = hourStart.toInstant(ZoneOffset.UTC);
            buckets.computeIfAbsent(start, Bucket::new).add(h);
        }
        return new ArrayList<>(buckets.values());
    }

    private Predicate[] predicates(CriteriaBuilder cb, Root<SensorReading> root, Filter f) {
        List<Predicate> list = new ArrayList<>();
        if (f.getDevice() != null) list.add(cb.equal(root.get("device"), f.getDevice()));
        if (f.getFrom() != null) list.add(cb.greaterThanOrEqualTo(root.<Instant>get("timestamp"), f.getFrom()));
        if (f.getTo() != null) list.add(cb.lessThanOrEqualTo(root.<Instant>get("timestamp"), f.getTo()));
        return list.toArray(new Predicate[0]);
    }

    @Value
    @Builder
    public static class Filter {
        String device;
        Instant from;
        Instant to;
    }

    public record Page(List<SensorReading> data, long total) { }

    @Data
    public static class Bucket {
        private final Instant timestamp;
        private double tempAvg;
        private double humAvg;
        private double pressAvg;
        private double current1Avg;
        private double current2Avg;
        private double current1Rms;
        private double current2Rms;
        private double dutyCycle1;
        private double dutyCycle2;
        private long sampleCount;

        void add(HourlyAverage h) {
            long n = h.getSampleCount();
            long total = sampleCount + n;
            tempAvg = merge(tempAvg, h.getTempAvg(), n, total);
            humAvg = merge(humAvg, h.getHumAvg(), n, total);
            pressAvg = merge(pressAvg, h.getPressAvg(), n, total);
            current1Avg = merge(current1Avg, h.getCurrent1Avg(), n, total);
            current2Avg = merge(current2Avg, h.getCurrent2Avg(), n, total);
            current1Rms = merge(current1Rms, h.getCurrent1Rms(), n, total);
            current2Rms = merge(current2Rms, h.getCurrent2Rms(), n, total);
            dutyCycle1 = merge(dutyCycle1, h.getDutyCycle1(), n, total);
            dutyCycle2 = merge(dutyCycle2, h.getDutyCycle2(), n, total);
            sampleCount = total;
        }

        private double merge(double current, Double incoming, long n, long total) {
            double v = incoming == null ? 0.0 : incoming;
            return (current * sampleCount + v * n) / total;
        }
    }
}
