package com.sandy.aiot.pump.incidents.repository;

import com.sandy.aiot.pump.incidents.entity.SensorReading;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SensorReadingRepository extends JpaRepository<SensorReading, Long> {
    Optional<SensorReading> findTopByOrderByTimestampDesc();
    List<SensorReading> findAllByOrderByTimestampDesc(Pageable pageable);
    List<SensorReading> findByDeviceOrderByTimestampDesc(String device, Pageable pageable);
    Optional<SensorReading> findFirstByDeviceAndTimestampAfterOrderByTimestampAsc(String device, Instant after);

    @Query("select r.device as device, max(r.timestamp) as lastSeen from SensorReading r group by r.device")
    List<DeviceLastSeen> findLastSeenPerDevice();

    /**
     * Hourly averages inside [from, to], newest bucket first. The bucket is returned as its
     * calendar fields so the grouping stays portable across databases.
     */
    @Query("select year(r.timestamp) as bucketYear, month(r.timestamp) as bucketMonth, "
            + "day(r.timestamp) as bucketDay, hour(r.timestamp) as bucketHour, "
            + "avg(r.tempAvg) as tempAvg, avg(r.humAvg) as humAvg, avg(r.pressAvg) as pressAvg, "
            + "avg(r.current1Avg) as current1Avg, avg(r.current2Avg) as current2Avg, "
            + "avg(r.current1Rms) as current1Rms, avg(r.current2Rms) as current2Rms, "
            + "avg(r.dutyCycle1) as dutyCycle1, avg(r.dutyCycle2) as dutyCycle2, "
            + "count(r) as sampleCount "
            + "from SensorReading r "
            + "where r.timestamp >= :from and r.timestamp <= :to "
            + "and (:device is null or r.device = :device) "
            + "group by year(r.timestamp), month(r.timestamp), day(r.timestamp), hour(r.timestamp) "
            + "order by year(r.timestamp) desc, month(r.timestamp) desc, day(r.timestamp) desc, hour(r.timestamp) desc")
    List<HourlyAverage> averageByHour(@Param("from") Instant from,
                                      @Param("to") Instant to,
                                      @Param("device") String device);

    interface HourlyAverage {
        Integer getBucketYear();
        Integer getBucketMonth();
        Integer getBucketDay();
        Integer getBucketHour();
        Double getTempAvg();
        Double getHumAvg();
        Double getPressAvg();
        Double getCurrent1Avg();
        Double getCurrent2Avg();
        Double getCurrent1Rms();
        Double getCurrent2Rms();
        Double getDutyCycle1();
        Double getDutyCycle2();
        Long getSampleCount();
    }

    interface DeviceLastSeen {
        String getDevice();
        Instant getLastSeen();
    }
}
