package com.example.smartroll.repository;

import com.example.smartroll.entities.AttendanceRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {
    Optional<AttendanceRecord> findByStudentIdAndSessionId(Long studentId, Long sessionId);

    List<AttendanceRecord> findBySessionIdOrderByRecordedAtAsc(Long sessionId);

    long countByStudentIdAndSessionId(Long studentId, Long sessionId);
}
