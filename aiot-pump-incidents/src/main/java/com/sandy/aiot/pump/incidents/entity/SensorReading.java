package com.sandy.aiot.pump.incidents.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Aggregated telemetry window posted periodically by the pump monitor.
 * The latest row per device doubles as its heartbeat.
 */
@Entity
@Table(name = "sensor_readings", indexes = {
        @Index(name = "idx_reading_device_time", columnList = "device, reported_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorReading {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String device;
    @Column(length = 200)
    private String location;

    @Column(name = "reported_at")
    private Instant timestamp;
    @Column(name = "window_start")
    private Instant startTime;
    @Column(name = "window_end")
    private Instant endTime;
    private int sampleCount;

    private double tempMin;
    private double tempMax;
    private double tempAvg;

    private double humMin;
    private double humMax;
    private double humAvg;

    private double pressMin;
    private double pressMax;
    private double pressAvg;

    private double current1Min;
    private double current1Max;
    private double current1Avg;
    private double current1Rms;
    private double dutyCycle1;

    private double current2Min;
    private double current2Max;
    private double current2Avg;
    private double current2Rms;
    private double dutyCycle2;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
