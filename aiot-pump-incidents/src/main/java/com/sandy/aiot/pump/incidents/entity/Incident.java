package com.sandy.aiot.pump.incidents.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One occurrence of a condition on a device, from first active report until it is cleared.
 * At most one row per (device, conditionType) may be active; resolved rows are kept as history.
 */
@Entity
@Table(name = "incidents", indexes = {
        @Index(name = "idx_incident_open_key", columnList = "device, condition_type, active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String device;

    @Enumerated(EnumType.STRING)
    @Column(name = "condition_type", nullable = false, length = 32)
    private ConditionType conditionType;

    @Column(length = 200)
    private String location;

    @Column(name = "observed_value")
    private double value;
    private double threshold;

    @Column(length = 500)
    private String description;

    /** When the condition first became true, as reported by the device. */
    @Column(name = "start_time")
    private Instant startTime;

    /** Latest report that touched this row; resolution time once inactive. */
    @Column(name = "reported_at")
    private Instant timestamp;

    /** Device-reported elapsed milliseconds, never recomputed here. */
    private long duration;

    private boolean active;

    private boolean acknowledged;
    private Instant acknowledgedAt;
    @Column(length = 100)
    private String acknowledgedBy;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
