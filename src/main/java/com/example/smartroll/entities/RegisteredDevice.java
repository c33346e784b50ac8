package com.example.smartroll.entities;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A device bound to the student who owns it. A hardware address belongs to at most one student.
 */
@Entity
@Table(name = "registered_device", indexes = @Index(name = "idx_registered_device_student", columnList = "student_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegisteredDevice {

    @Id
    @Column(name = "device_id", length = 17)
    private String deviceId;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;
}
