package com.sandy.aiot.pump.incidents.service;

import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.repository.SensorReadingRepository.DeviceLastSeen;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SensorReadingService {
    SensorReading save(SensorReading reading);
    List<SensorReading> findRecent(String device, int limit);
    Optional<SensorReading> findLatest();
    /** Earliest reading from the device strictly after the given instant. */
    Optional<SensorReading> findFirstAfter(String device, Instant after);
    List<DeviceLastSeen> findLastSeenPerDevice();
    long count();
}
