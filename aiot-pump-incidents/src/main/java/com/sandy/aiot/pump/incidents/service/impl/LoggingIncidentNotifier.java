package com.sandy.aiot.pump.incidents.service.impl;

import com.sandy.aiot.pump.incidents.event.IncidentOpenedEvent;
import com.sandy.aiot.pump.incidents.event.IncidentResolvedEvent;
import com.sandy.aiot.pump.incidents.service.IncidentNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.time.ZoneOffset;

/**
 * Writes alert lines to the application log. Push delivery plugs in as another {@link IncidentNotifier}.
 */
@Service
@Slf4j
public class LoggingIncidentNotifier implements IncidentNotifier {

    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    @Override
    public void incidentOpened(IncidentOpenedEvent e) {
        log.warn("ALERT {} on {} ({}) value={} threshold={} since {}: {}",
                e.conditionType(), e.device(), e.location(), String.format("%.2f", e.value()),
                String.format("%.2f", e.threshold()), e.startTime() == null ? "-" : TS_FMT.format(e.startTime()), e.description());
    }

    @Override
    public void incidentResolved(IncidentResolvedEvent e) {
        log.info("CLEARED {} on {} after {}s{}", e.conditionType(), e.device(), e.duration() / 1000,
                e.manual() ? " (operator)" : "");
    }
}
