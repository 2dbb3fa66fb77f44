package com.sandy.aiot.pump.incidents.service;

import com.sandy.aiot.pump.incidents.event.IncidentOpenedEvent;
import com.sandy.aiot.pump.incidents.event.IncidentResolvedEvent;

/**
 * Outbound alert channel. Implementations must not throw back into the caller.
 */
public interface IncidentNotifier {
    void incidentOpened(IncidentOpenedEvent event);
    void incidentResolved(IncidentResolvedEvent event);
}
