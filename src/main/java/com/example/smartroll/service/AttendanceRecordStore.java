package com.example.smartroll.service;

import com.example.smartroll.entities.AttendanceRecord;
import com.example.smartroll.exception.CheckInUnavailableException;
import com.example.smartroll.model.DeviceIdentifier;
import com.example.smartroll.repository.AttendanceRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Insert-if-absent over attendance records.
 *
 * The unique key on (student_id, session_id) is what guarantees a single record per pair:
 * every insert runs in its own short transaction via {@code saveAndFlush}, and a caller
 * that loses the race gets a constraint violation and reads back the winner's record.
 * Within one instance, requests for the same pair are additionally serialized on a lock
 * owned by that pair alone, so the loser normally finds the committed record on its first
 * lookup. Different pairs never share a lock. A pair's lock is dropped once no request holds it.
 */
@Service
public class AttendanceRecordStore {

    private final Logger log = LoggerFactory.getLogger(AttendanceRecordStore.class);

    private final AttendanceRecordRepository recordRepository;
    private final int maxAttempts;
    private final ConcurrentMap<String, PairLock> pairLocks = new ConcurrentHashMap<>();

    public AttendanceRecordStore(AttendanceRecordRepository recordRepository,
                                 @Value("${smartroll.store.max-insert-attempts:3}") int maxAttempts) {
        this.recordRepository = recordRepository;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public RecordInsertion insertIfAbsent(Long studentId, Long sessionId, DeviceIdentifier device, Instant recordedAt) {
        String key = studentId + ":" + sessionId;
        PairLock lock = pairLocks.compute(key, (k, held) -> held == null ? new PairLock() : held.retain());
        lock.lock();
        try {
            return insertWithRetry(studentId, sessionId, device, recordedAt);
        } finally {
            lock.unlock();
            pairLocks.computeIfPresent(key, (k, held) -> held.release() == 0 ? null : held);
        }
    }

    /** Number of pairs with a request in flight. */
    int pairsInFlight() {
        return pairLocks.size();
    }

    private RecordInsertion insertWithRetry(Long studentId, Long sessionId, DeviceIdentifier device, Instant recordedAt) {
        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<AttendanceRecord> existing = lookup(studentId, sessionId);
            if (existing.isPresent()) {
                return RecordInsertion.existing(existing.get());
            }
            AttendanceRecord candidate = AttendanceRecord.builder()
                    .studentId(studentId)
                    .sessionId(sessionId)
                    .deviceId(device.value())
                    .recordedAt(recordedAt)
                    .build();
            try {
                return RecordInsertion.created(recordRepository.saveAndFlush(candidate));
            } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
                // another request holds or just committed the same pair
                log.debug("Insert conflict for student={} session={} on attempt {}: {}",
                        studentId, sessionId, attempt, ex.getMessage());
                lastConflict = ex;
            } catch (DataAccessException | TransactionException ex) {
                log.warn("Attendance store write failed for student={} session={}: {}", studentId, sessionId, ex.getMessage());
                throw new CheckInUnavailableException(CheckInUnavailableException.ATTENDANCE_STORE,
                        "attendance store unavailable", ex);
            }
        }
        log.warn("Write conflict unresolved for student={} session={} after {} attempts", studentId, sessionId, maxAttempts);
        throw new CheckInUnavailableException(CheckInUnavailableException.ATTENDANCE_STORE,
                "write conflict unresolved for student " + studentId + " in session " + sessionId, lastConflict);
    }

    private Optional<AttendanceRecord> lookup(Long studentId, Long sessionId) {
        try {
            return recordRepository.findByStudentIdAndSessionId(studentId, sessionId);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Attendance store read failed for student={} session={}: {}", studentId, sessionId, ex.getMessage());
            throw new CheckInUnavailableException(CheckInUnavailableException.ATTENDANCE_STORE,
                    "attendance store unavailable", ex);
        }
    }

    // users is only touched inside ConcurrentMap.compute for this pair's key
    private static final class PairLock extends ReentrantLock {
        private int users = 1;

        PairLock retain() {
            users++;
            return this;
        }

        int release() {
            return --users;
        }
    }
}
