package com.example.smartroll.service;

import com.example.smartroll.entities.AppUser;
import com.example.smartroll.entities.AttendanceSession;
import com.example.smartroll.exception.CheckInUnavailableException;
import com.example.smartroll.exception.InvalidRequestException;
import com.example.smartroll.model.CheckInOutcome;
import com.example.smartroll.model.ClassroomSegment;
import com.example.smartroll.model.DeviceIdentifier;
import com.example.smartroll.presence.NetworkPresenceResolver;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether a check-in is credited.
 *
 * Rules, first match wins:
 * 1. unknown session -> SESSION_NOT_FOUND
 * 2. closed or expired session -> SESSION_NOT_FOUND (callers cannot tell it from an absent one)
 * 3. device not registered to the student, not attached, or attached outside the session's
 *    classroom segment -> OFF_NETWORK
 * 4. record already present for (student, session) -> ALREADY_RECORDED with the original timestamp
 * 5. otherwise a new record -> ACCEPTED
 *
 * Rules 4 and 5 are a single insert-if-absent against the record store. Malformed input is
 * rejected with {@link InvalidRequestException} before rule 1; faults from the registries,
 * resolver and store propagate unchanged. A classroom stored without a usable network prefix
 * is a registry fault, not a caller error.
 */
@Service
@RequiredArgsConstructor
public class CheckInValidator {

    private final Logger log = LoggerFactory.getLogger(CheckInValidator.class);

    private final SessionRegistry sessionRegistry;
    private final DeviceRegistry deviceRegistry;
    private final NetworkPresenceResolver presenceResolver;
    private final AttendanceRecordStore recordStore;
    private final Clock clock;

    public CheckInOutcome validate(String rawDeviceId, long sessionId, AppUser student) {
        DeviceIdentifier device = DeviceIdentifier.parse(rawDeviceId);
        if (sessionId <= 0) {
            throw new InvalidRequestException("session_id must be a positive integer, got " + sessionId);
        }
        if (student == null || student.getId() == null) {
            throw new InvalidRequestException("student identity is required");
        }

        Optional<AttendanceSession> found = sessionRegistry.find(sessionId);
        if (found.isEmpty()) {
            log.debug("Check-in rejected: session {} not found (student={})", sessionId, student.getUsername());
            return CheckInOutcome.sessionNotFound(sessionId);
        }
        AttendanceSession session = found.get();
        Instant now = clock.instant();
        if (!session.isOpenAt(now)) {
            log.debug("Check-in rejected: session {} is not open (status={}, student={})",
                    sessionId, session.getStatus(), student.getUsername());
            return CheckInOutcome.sessionNotFound(sessionId);
        }

        ClassroomSegment segment = segmentOf(session);
        if (!deviceRegistry.isRegisteredTo(device, student.getId())) {
            log.debug("Check-in rejected: device {} is not registered to student={} (session {})",
                    device, student.getUsername(), sessionId);
            return CheckInOutcome.offNetwork(sessionId);
        }
        Optional<String> address = presenceResolver.resolve(device);
        if (address.isEmpty() || !segment.matches(address.get())) {
            log.debug("Check-in rejected: device {} at {} is off segment {} for session {}",
                    device, address.orElse("<unknown>"), segment, sessionId);
            return CheckInOutcome.offNetwork(sessionId);
        }

        RecordInsertion insertion = recordStore.insertIfAbsent(student.getId(), sessionId, device, now);
        if (!insertion.isCreated()) {
            log.debug("Repeat check-in for student={} session={}, original at {}",
                    student.getUsername(), sessionId, insertion.getRecord().getRecordedAt());
            return CheckInOutcome.alreadyRecorded(student.getDisplayName(), segment, insertion.getRecord());
        }
        log.info("Check-in recorded: student={} session={} device={} address={}",
                student.getUsername(), sessionId, device, address.get());
        return CheckInOutcome.accepted(student.getDisplayName(), segment, insertion.getRecord());
    }

    private ClassroomSegment segmentOf(AttendanceSession session) {
        String prefix = session.getClassroom() == null ? null : session.getClassroom().getWifiNetworkPrefix();
        try {
            return ClassroomSegment.of(prefix);
        } catch (IllegalArgumentException ex) {
            log.error("Session {} has no usable classroom network prefix", session.getId());
            throw new CheckInUnavailableException(CheckInUnavailableException.SESSION_REGISTRY,
                    "classroom network prefix missing for session " + session.getId(), ex);
        }
    }
}
