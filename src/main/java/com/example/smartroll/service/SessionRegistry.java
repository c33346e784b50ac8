package com.example.smartroll.service;

import com.example.smartroll.entities.AttendanceSession;
import com.example.smartroll.exception.CheckInUnavailableException;
import com.example.smartroll.exception.InvalidRequestException;
import com.example.smartroll.repository.AttendanceSessionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Read-only view of scheduled sessions. Creating and closing sessions belongs to the
 * scheduling side; nothing here mutates them.
 */
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    private final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final AttendanceSessionRepository sessionRepository;

    public Optional<AttendanceSession> find(long sessionId) {
        if (sessionId <= 0) {
            throw new InvalidRequestException("session_id must be a positive integer, got " + sessionId);
        }
        try {
            return sessionRepository.findById(sessionId);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Session lookup failed for sessionId={}: {}", sessionId, ex.getMessage());
            throw new CheckInUnavailableException(CheckInUnavailableException.SESSION_REGISTRY,
                    "session registry unavailable", ex);
        }
    }
}
