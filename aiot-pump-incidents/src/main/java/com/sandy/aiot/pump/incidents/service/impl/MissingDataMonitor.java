package com.sandy.aiot.pump.incidents.service.impl;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import com.sandy.aiot.pump.incidents.entity.Incident;
import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.repository.SensorReadingRepository.DeviceLastSeen;
import com.sandy.aiot.pump.incidents.service.ConditionReport;
import com.sandy.aiot.pump.incidents.service.IncidentQueryService;
import com.sandy.aiot.pump.incidents.service.IncidentTracker;
import com.sandy.aiot.pump.incidents.service.Outcome;
import com.sandy.aiot.pump.incidents.service.SensorReadingService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Raises MISSING_DATA incidents for devices whose telemetry has gone quiet and clears them once readings
 * resume. Reports go through {@link IncidentTracker#submit} like any device report.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MissingDataMonitor {

    private final SensorReadingService sensorReadingService;
    private final IncidentQueryService incidentQueryService;
    private final IncidentTracker incidentTracker;

    @Value("${incident.missing-data.enabled:true}")
    private boolean enabled;
    @Value("${incident.missing-data.threshold-minutes:5}")
    private int thresholdMinutes;

    @PostConstruct
    public void init() {
        log.info("Missing-data monitor initialized: enabled={} thresholdMinutes={}", enabled, thresholdMinutes);
    }

    @Scheduled(fixedDelayString = "${incident.missing-data.scan-interval-ms:60000}")
    public void scheduledScan() {
        if (!enabled) return;
        try {
            scanOnce(Instant.now());
        } catch (Exception e) {
            log.error("Scheduled missing-data scan failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One pass over every device that has ever posted a reading.
     *
     * @param now evaluation time; exposed for tests and manual triggers
     * @return number of reports submitted
     */
    public int scanOnce(Instant now) {
        List<DeviceLastSeen> devices = sensorReadingService.findLastSeenPerDevice();
        Duration threshold = Duration.ofMinutes(thresholdMinutes);
        int submitted = 0;
        for (DeviceLastSeen d : devices) {
            if (d.getLastSeen() == null) continue;
            Duration silence = Duration.between(d.getLastSeen(), now);
            try {
                if (silence.compareTo(threshold) > 0) {
                    reportStale(d, silence, now);
                    submitted++;
                } else if (clearIfOpen(d, now)) {
                    submitted++;
                }
            } catch (RuntimeException e) {
                // one device failing must not stop the scan for the others
                log.error("Missing-data evaluation failed device={}: {}", d.getDevice(), e.getMessage(), e);
            }
        }
        if (!devices.isEmpty()) {
            log.debug("Missing-data scan completed. devices={} reportsSubmitted={}", devices.size(), submitted);
        }
        return submitted;
    }

    private void reportStale(DeviceLastSeen d, Duration silence, Instant now) {
        ConditionReport report = ConditionReport.builder()
                .device(d.getDevice())
                .conditionType(ConditionType.MISSING_DATA)
                .location(lastKnownLocation(d.getDevice()))
                .timestamp(now)
                .startTime(d.getLastSeen())
                .value(silence.toMillis() / 60000.0)
                .threshold(thresholdMinutes)
                .duration(silence.toMillis())
                .active(true)
                .description(String.format("No sensor data for %d minutes", silence.toMinutes()))
                .build();
        Outcome outcome = incidentTracker.submit(report);
        if (outcome instanceof Outcome.Created c) {
            log.warn("Device {} silent since {}; missing-data incident id={}", d.getDevice(), d.getLastSeen(), c.incidentId());
        }
    }

    private boolean clearIfOpen(DeviceLastSeen d, Instant now) {
        List<Incident> open = incidentQueryService.findOpen(d.getDevice(), ConditionType.MISSING_DATA);
        if (open.isEmpty()) return false;
        Instant outageStart = open.get(0).getStartTime();
        long outageMs = 0;
        if (outageStart != null) {
            // several readings may have arrived since the last scan; the outage ended at the first of them
            Instant resumedAt = sensorReadingService.findFirstAfter(d.getDevice(), outageStart)
                    .map(SensorReading::getTimestamp)
                    .orElse(d.getLastSeen());
            outageMs = Math.max(0, Duration.between(outageStart, resumedAt).toMillis());
        }
        ConditionReport clear = ConditionReport.builder()
                .device(d.getDevice())
                .conditionType(ConditionType.MISSING_DATA)
                .location(open.get(0).getLocation())
                .timestamp(now)
                .startTime(outageStart)
                .value(0)
                .threshold(thresholdMinutes)
                .duration(outageMs)
                .active(false)
                .description("Sensor data resumed")
                .build();
        incidentTracker.submit(clear);
        log.info("Device {} reporting again; missing-data cleared after {}ms", d.getDevice(), outageMs);
        return true;
    }

    private String lastKnownLocation(String device) {
        return sensorReadingService.findRecent(device, 1).stream()
                .findFirst()
                .map(SensorReading::getLocation)
                .orElse("unknown");
    }
}
