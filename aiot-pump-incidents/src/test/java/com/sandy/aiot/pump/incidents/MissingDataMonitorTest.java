package com.sandy.aiot.pump.incidents;

import com.sandy.aiot.pump.incidents.entity.ConditionType;
import com.sandy.aiot.pump.incidents.entity.Incident;
import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.repository.IncidentRepository;
import com.sandy.aiot.pump.incidents.repository.SensorReadingRepository;
import com.sandy.aiot.pump.incidents.service.impl.MissingDataMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class MissingDataMonitorTest {

    // threshold-minutes keeps its default of 5
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired MissingDataMonitor missingDataMonitor;
    @Autowired SensorReadingRepository sensorReadingRepository;
    @Autowired IncidentRepository incidentRepository;

    @BeforeEach
    void setup() {
        incidentRepository.deleteAll();
        sensorReadingRepository.deleteAll();
    }

    private void storeReading(String device, Instant ts) {
        sensorReadingRepository.save(SensorReading.builder()
                .device(device)
                .location("Pump House")
                .timestamp(ts)
                .startTime(ts.minusSeconds(60))
                .endTime(ts)
                .sampleCount(60)
                .build());
    }

    @Test
    void silentDeviceGetsOneMissingDataIncidentUntilDataResumes() {
        storeReading("pump-quiet", NOW.minusSeconds(10 * 60));
        storeReading("pump-live", NOW.minusSeconds(30));

        assertEquals(1, missingDataMonitor.scanOnce(NOW));
        assertEquals(1, missingDataMonitor.scanOnce(NOW.plusSeconds(60)));

        List<Incident> all = incidentRepository.findAll();
        assertEquals(1, all.size(), "repeat scans refresh the same incident");
        Incident i = all.get(0);
        assertEquals("pump-quiet", i.getDevice());
        assertEquals(ConditionType.MISSING_DATA, i.getConditionType());
        assertTrue(i.isActive());
        assertEquals(NOW.minusSeconds(10 * 60), i.getStartTime());
        assertEquals(11 * 60 * 1000L, i.getDuration());
        assertEquals("Pump House", i.getLocation());

        Instant resumed = NOW.plusSeconds(120);
        storeReading("pump-quiet", resumed);
        assertEquals(1, missingDataMonitor.scanOnce(resumed.plusSeconds(5)));

        Incident cleared = incidentRepository.findById(i.getId()).orElseThrow();
        assertFalse(cleared.isActive());
        assertEquals(12 * 60 * 1000L, cleared.getDuration());

        // nothing left to clear or raise
        assertEquals(0, missingDataMonitor.scanOnce(resumed.plusSeconds(10)));
    }

    @Test
    void outageEndsAtFirstReadingAfterSilence() {
        storeReading("pump-flaky", NOW.minusSeconds(10 * 60));
        assertEquals(1, missingDataMonitor.scanOnce(NOW));

        // three readings land before the next scan
        storeReading("pump-flaky", NOW.plusSeconds(60));
        storeReading("pump-flaky", NOW.plusSeconds(120));
        storeReading("pump-flaky", NOW.plusSeconds(180));
        assertEquals(1, missingDataMonitor.scanOnce(NOW.plusSeconds(200)));

        Incident cleared = incidentRepository.findAll().get(0);
        assertFalse(cleared.isActive());
        assertEquals(11 * 60 * 1000L, cleared.getDuration());
    }
}
