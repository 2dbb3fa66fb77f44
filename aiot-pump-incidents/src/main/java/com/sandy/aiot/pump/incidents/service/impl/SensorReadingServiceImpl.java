package com.sandy.aiot.pump.incidents.service.impl;

import com.sandy.aiot.pump.incidents.entity.SensorReading;
import com.sandy.aiot.pump.incidents.repository.SensorReadingRepository;
import com.sandy.aiot.pump.incidents.repository.SensorReadingRepository.DeviceLastSeen;
import com.sandy.aiot.pump.incidents.service.SensorReadingService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class SensorReadingServiceImpl implements SensorReadingService {

    private final SensorReadingRepository sensorReadingRepository;

    @Override
    public SensorReading save(SensorReading reading) { return sensorReadingRepository.save(reading); }

    @Override
    public List<SensorReading> findRecent(String device, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        if (device == null || device.isBlank()) {
            return sensorReadingRepository.findAllByOrderByTimestampDesc(page);
        }
        return sensorReadingRepository.findByDeviceOrderByTimestampDesc(device, page);
    }

    @Override
    public Optional<SensorReading> findLatest() { return sensorReadingRepository.findTopByOrderByTimestampDesc(); }

    @Override
    public Optional<SensorReading> findFirstAfter(String device, Instant after) {
        return sensorReadingRepository.findFirstByDeviceAndTimestampAfterOrderByTimestampAsc(device, after);
    }

    @Override
    public List<DeviceLastSeen> findLastSeenPerDevice() { return sensorReadingRepository.findLastSeenPerDevice(); }

    @Override
    public long count() { return sensorReadingRepository.count(); }
}
