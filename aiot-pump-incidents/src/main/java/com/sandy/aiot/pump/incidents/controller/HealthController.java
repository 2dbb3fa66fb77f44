package com.sandy.aiot.pump.incidents.controller;

import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.service.IncidentQueryService;
import com.sandy.aiot.pump.incidents.service.SensorReadingService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;

/**
 * Liveness summary: database reachability, telemetry freshness and open incident count.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final SensorReadingService sensorReadingService;
    private final IncidentQueryService incidentQueryService;

    @Value("${incident.health.stale-minutes:5}")
    private int staleMinutes;
    @Value("${incident.health.unhealthy-active-count:5}")
    private int unhealthyActiveCount;

    @GetMapping
    public ResponseEntity<Health> health() {
        Instant now = Instant.now();
        Health h = new Health();
        h.setTimestamp(now);
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            Instant lastData = sensorReadingService.findLatest().map(SensorReading::getTimestamp).orElse(null);
            boolean receiving = lastData != null && lastData.isAfter(now.minus(Duration.ofMinutes(staleMinutes)));
            long open = incidentQueryService.countOpen();

            h.setDatabase("connected");
            h.setDataIngestion(receiving ? "active" : "stale");
            h.setLastDataReceived(lastData);
            h.setActiveAlerts(open);
            Stats stats = new Stats();
            stats.setSensorRecords(sensorReadingService.count());
            stats.setEvents(incidentQueryService.countAll());
            h.setStats(stats);

            String status = receiving ? "healthy" : "degraded";
            if (open > 0) {
                status = open > unhealthyActiveCount ? "unhealthy" : "warning";
            }
            h.setStatus(status);
            return ResponseEntity.ok(h);
        } catch (DataAccessException e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            h.setStatus("unhealthy");
            h.setDatabase("disconnected");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(h);
        }
    }

    @Data
    public static class Health {
        private String status;
        private Instant timestamp;
        private String database;
        private String dataIngestion;
        private Instant lastDataReceived;
        private long activeAlerts;
        private Stats stats;
    }

    @Data
    public static class Stats {
        private long sensorRecords;
        private long events;
    }
}
