package com.example.smartroll.service;

import com.example.smartroll.entities.AppUser;
import com.example.smartroll.entities.AttendanceRecord;
import com.example.smartroll.exception.InvalidRequestException;
import com.example.smartroll.repository.AppUserRepository;
import com.example.smartroll.repository.AttendanceRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Read access to recorded check-ins for instructors.
 */
@Service
@RequiredArgsConstructor
public class AttendanceService {

    private final AttendanceRecordRepository recordRepository;
    private final AppUserRepository userRepository;

    @Transactional(readOnly = true)
    public List<AttendanceRecord> findRecordsForSession(Long sessionId) {
        if (sessionId == null || sessionId <= 0) {
            throw new InvalidRequestException("session_id must be a positive integer, got " + sessionId);
        }
        return recordRepository.findBySessionIdOrderByRecordedAtAsc(sessionId);
    }

    /**
     * Display names of the given students, keyed by user id. Unknown ids are left out.
     */
    @Transactional(readOnly = true)
    public Map<Long, String> studentNames(Collection<Long> studentIds) {
        if (studentIds == null || studentIds.isEmpty()) return Collections.emptyMap();
        return userRepository.findAllById(new HashSet<>(studentIds)).stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getDisplayName, (a, b) -> a));
    }
}
