package com.example.smartroll.model;

import com.example.smartroll.entities.AttendanceRecord;
import com.example.smartroll.enums.CheckInResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of validating one check-in request. Built per request and handed
 * straight to the encoder; never persisted.
 *
 * studentName, segment and record are set only for ACCEPTED and ALREADY_RECORDED.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CheckInOutcome {

    private final CheckInResult result;
    private final long sessionId;
    private final String studentName;
    private final ClassroomSegment segment;
    private final AttendanceRecord record;

    public static CheckInOutcome accepted(String studentName, ClassroomSegment segment, AttendanceRecord record) {
        return new CheckInOutcome(CheckInResult.ACCEPTED, record.getSessionId(), studentName, segment, record);
    }

    public static CheckInOutcome alreadyRecorded(String studentName, ClassroomSegment segment, AttendanceRecord original) {
        return new CheckInOutcome(CheckInResult.ALREADY_RECORDED, original.getSessionId(), studentName, segment, original);
    }

    public static CheckInOutcome offNetwork(long sessionId) {
        return new CheckInOutcome(CheckInResult.OFF_NETWORK, sessionId, null, null, null);
    }

    public static CheckInOutcome sessionNotFound(long sessionId) {
        return new CheckInOutcome(CheckInResult.SESSION_NOT_FOUND, sessionId, null, null, null);
    }

    public boolean isSuccess() {
        return result == CheckInResult.ACCEPTED || result == CheckInResult.ALREADY_RECORDED;
    }
}
