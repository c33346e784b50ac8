package com.example.smartroll.controller;

import com.example.smartroll.dto.CheckInRequest;
import com.example.smartroll.dto.CheckInResponse;
import com.example.smartroll.dto.RouterPushRequest;
import com.example.smartroll.entities.AppUser;
import com.example.smartroll.entities.AttendanceRecord;
import com.example.smartroll.exception.InvalidRequestException;
import com.example.smartroll.model.CheckInOutcome;
import com.example.smartroll.service.AppUserService;
import com.example.smartroll.service.AttendanceService;
import com.example.smartroll.service.CheckInValidator;
import com.example.smartroll.service.NetworkAttachmentService;
import com.example.smartroll.service.OutcomeEncoder;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
@RequestMapping("/attendance")
public class CheckInController {

    private final CheckInValidator checkInValidator;
    private final OutcomeEncoder outcomeEncoder;
    private final AppUserService appUserService;
    private final NetworkAttachmentService networkAttachmentService;
    private final AttendanceService attendanceService;

    /**
     * Student self check-in. The student is the authenticated user, never a field of the body.
     * Accepts JSON: {"mac": "AA:BB:CC:DD:EE:FF", "session_id": 1}
     */
    @PostMapping("/check_in")
    public ResponseEntity<CheckInResponse> checkIn(@RequestBody CheckInRequest request, Principal principal) {
        if (request.getSessionId() == null) {
            throw new InvalidRequestException("session_id is required");
        }
        AppUser student = appUserService.findByUsernameSafe(principal.getName());
        CheckInOutcome outcome = checkInValidator.validate(request.getMac(), request.getSessionId(), student);
        return outcomeEncoder.encode(outcome);
    }

    /**
     * Router push of currently associated devices.
     * Accepts JSON: {"connected_devices": [{"mac": "...", "ip": "10.0.5.23"}, ...]}
     */
    @PostMapping("/router_push")
    public ResponseEntity<Map<String, Object>> routerPush(@RequestBody RouterPushRequest request) {
        int saved = networkAttachmentService.recordAttachments(request.getConnectedDevices());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "router_data_ingested");
        result.put("count", saved);
        return ResponseEntity.ok(result);
    }

    /**
     * All check-ins of one session, oldest first.
     */
    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<Map<String, Object>>> sessionLogs(@PathVariable Long sessionId) {
        List<AttendanceRecord> records = attendanceService.findRecordsForSession(sessionId);
        Map<Long, String> names = attendanceService.studentNames(
                records.stream().map(AttendanceRecord::getStudentId).collect(Collectors.toSet()));

        List<Map<String, Object>> out = new ArrayList<>();
        for (AttendanceRecord r : records) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("student_id", r.getStudentId());
            m.put("student", names.get(r.getStudentId()));
            m.put("mac", r.getDeviceId());
            m.put("timestamp", r.getRecordedAt().toString());
            out.add(m);
        }
        return ResponseEntity.ok(out);
    }
}
