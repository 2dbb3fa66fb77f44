package com.sandy.aiot.pump.incidents.service.impl;

import com.sandy.aiot.pump.incidents.event.IncidentOpenedEvent;
import com.sandy.aiot.pump.incidents.event.IncidentResolvedEvent;
import com.sandy.aiot.pump.incidents.service.IncidentNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans tracker events out to every registered notifier; one failing channel does not block the rest.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IncidentNotificationListener {

    private final List<IncidentNotifier> notifiers;

    @EventListener
    public void onOpened(IncidentOpenedEvent event) {
        for (IncidentNotifier n : notifiers) {
            try {
                n.incidentOpened(event);
            } catch (Exception e) {
                log.error("Notifier {} failed for opened incident id={}: {}", n.getClass().getSimpleName(), event.incidentId(), e.getMessage(), e);
            }
        }
    }

    @EventListener
    public void onResolved(IncidentResolvedEvent event) {
        for (IncidentNotifier n : notifiers) {
            try {
                n.incidentResolved(event);
            } catch (Exception e) {
                log.error("Notifier {} failed for resolved incident id={}: {}", n.getClass().getSimpleName(), event.incidentId(), e.getMessage(), e);
            }
        }
    }
}
