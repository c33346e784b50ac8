package com.example.smartroll.service;

import com.example.smartroll.dto.CheckInResponse;
import com.example.smartroll.model.CheckInOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Fixed mapping from check-in outcomes to HTTP status and payload.
 *
 * <pre>
 * ACCEPTED          200  student, classroom_prefix
 * ALREADY_RECORDED  200  student, classroom_prefix, recorded_at (original)
 * OFF_NETWORK       403  fixed reason
 * SESSION_NOT_FOUND 404  message naming the session
 * invalid argument  400  message naming the violated constraint
 * </pre>
 *
 * Changing any row is a protocol change. Nothing here produces a 5xx.
 */
@Component
public class OutcomeEncoder {

    public static final String OFF_NETWORK_REASON = "You must be on classroom Wi-Fi";

    public ResponseEntity<CheckInResponse> encode(CheckInOutcome outcome) {
        String name = outcome.getResult().name().toLowerCase(Locale.ROOT);
        return switch (outcome.getResult()) {
            case ACCEPTED -> ResponseEntity.ok(CheckInResponse.builder()
                    .status(CheckInResponse.STATUS_SUCCESS)
                    .outcome(name)
                    .message("check_in_recorded")
                    .student(outcome.getStudentName())
                    .classroomPrefix(outcome.getSegment().prefix())
                    .build());
            case ALREADY_RECORDED -> ResponseEntity.ok(CheckInResponse.builder()
                    .status(CheckInResponse.STATUS_SUCCESS)
                    .outcome(name)
                    .message("check_in_already_recorded")
                    .student(outcome.getStudentName())
                    .classroomPrefix(outcome.getSegment().prefix())
                    .recordedAt(outcome.getRecord().getRecordedAt())
                    .build());
            case OFF_NETWORK -> ResponseEntity.status(HttpStatus.FORBIDDEN).body(CheckInResponse.builder()
                    .status(CheckInResponse.STATUS_ERROR)
                    .outcome(name)
                    .error("off_network")
                    .message(OFF_NETWORK_REASON)
                    .build());
            case SESSION_NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(CheckInResponse.builder()
                    .status(CheckInResponse.STATUS_ERROR)
                    .outcome(name)
                    .error("session_not_found")
                    .message("Session " + outcome.getSessionId() + " not found")
                    .build());
        };
    }

    public ResponseEntity<CheckInResponse> encodeInvalidArgument(String constraint) {
        return ResponseEntity.badRequest().body(CheckInResponse.builder()
                .status(CheckInResponse.STATUS_ERROR)
                .error("invalid_argument")
                .message(constraint)
                .build());
    }
}
