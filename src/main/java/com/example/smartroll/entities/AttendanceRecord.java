package com.example.smartroll.entities;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "attendance_record", uniqueConstraints = {
        @UniqueConstraint(name = "uk_record_student_session", columnNames = {"student_id", "session_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    // device the check-in came from, normalized form
    @Column(name = "device_id", nullable = false, length = 17)
    private String deviceId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
