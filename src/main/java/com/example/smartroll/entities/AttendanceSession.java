package com.example.smartroll.entities;

import com.example.smartroll.enums.SessionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "attendance_session")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 200)
    private String title;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "classroom_id", nullable = false)
    private Classroom classroom;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SessionStatus status;

    // optional validity window; null bounds are open
    private Instant startsAt;
    private Instant endsAt;

    /**
     * A session accepts check-ins only while OPEN and, when a window is set,
     * for {@code startsAt <= now < endsAt}.
     */
    public boolean isOpenAt(Instant now) {
        if (status != SessionStatus.OPEN) return false;
        if (startsAt != null && now.isBefore(startsAt)) return false;
        return endsAt == null || now.isBefore(endsAt);
    }
}
