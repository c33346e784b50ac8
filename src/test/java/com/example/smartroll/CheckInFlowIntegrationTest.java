package com.example.smartroll;

import com.example.smartroll.dto.RouterPushRequest;
import com.example.smartroll.entities.AppUser;
import com.example.smartroll.entities.AttendanceSession;
import com.example.smartroll.entities.Classroom;
import com.example.smartroll.enums.CheckInResult;
import com.example.smartroll.enums.SessionStatus;
import com.example.smartroll.enums.UserRole;
import com.example.smartroll.model.CheckInOutcome;
import com.example.smartroll.repository.AttendanceRecordRepository;
import com.example.smartroll.repository.AttendanceSessionRepository;
import com.example.smartroll.repository.ClassroomRepository;
import com.example.smartroll.service.AppUserService;
import com.example.smartroll.service.CheckInValidator;
import com.example.smartroll.service.DeviceRegistry;
import com.example.smartroll.service.NetworkAttachmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end check-in flow over the embedded database: router push, check-in over HTTP,
 * repeat check-ins and concurrent check-ins for the same student and session.
 */
@SpringBootTest
@AutoConfigureMockMvc
class CheckInFlowIntegrationTest {

    private static final String PASSWORD = "secret";

    @Autowired MockMvc mvc;
    @Autowired AppUserService appUserService;
    @Autowired ClassroomRepository classroomRepository;
    @Autowired AttendanceSessionRepository sessionRepository;
    @Autowired AttendanceRecordRepository recordRepository;
    @Autowired NetworkAttachmentService networkAttachmentService;
    @Autowired CheckInValidator checkInValidator;
    @Autowired DeviceRegistry deviceRegistry;

    private AppUser student;
    private AttendanceSession session;
    private String mac;

    @BeforeEach
    void setup() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        student = appUserService.createUser("alice-" + suffix, PASSWORD, UserRole.STUDENT,
                "Alice", "Liddell", "alice-" + suffix + "@example.com");
        Classroom room = classroomRepository.save(Classroom.builder()
                .name("Room " + suffix).wifiNetworkPrefix("10.0.5.").build());
        session = sessionRepository.save(AttendanceSession.builder()
                .title("Lecture " + suffix).classroom(room).status(SessionStatus.OPEN).build());
        mac = randomMac();
        deviceRegistry.register(student.getId(), mac);
    }

    @Test
    void studentOnClassroomWifi_isAcceptedThenAlreadyRecorded() throws Exception {
        attach(mac, "10.0.5.23");

        mvc.perform(checkIn(mac, session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("accepted"))
                .andExpect(jsonPath("$.student").value("Alice Liddell"))
                .andExpect(jsonPath("$.classroom_prefix").value("10.0.5."));

        Long recordId = recordRepository.findByStudentIdAndSessionId(student.getId(), session.getId())
                .orElseThrow().getId();

        mvc.perform(checkIn(mac.toLowerCase(), session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("already_recorded"))
                .andExpect(jsonPath("$.recorded_at").exists());

        assertEquals(1, recordRepository.countByStudentIdAndSessionId(student.getId(), session.getId()));
        assertEquals(recordId, recordRepository.findByStudentIdAndSessionId(student.getId(), session.getId())
                .orElseThrow().getId());
    }

    @Test
    void studentOnAnotherNetwork_isOffNetwork() throws Exception {
        attach(mac, "10.0.9.4");

        mvc.perform(checkIn(mac, session.getId()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("off_network"));

        assertEquals(0, recordRepository.countByStudentIdAndSessionId(student.getId(), session.getId()));
    }

    @Test
    void unknownDevice_isOffNetwork() throws Exception {
        mvc.perform(checkIn(mac, session.getId()))
                .andExpect(status().isForbidden());
    }

    @Test
    void classmatesDeviceInTheRoom_doesNotCreditAbsentStudent() throws Exception {
        attach(mac, "10.0.5.23");
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        AppUser absent = appUserService.createUser("bob-" + suffix, PASSWORD, UserRole.STUDENT,
                "Bob", "Absent", "bob-" + suffix + "@example.com");

        mvc.perform(post("/attendance/check_in").with(httpBasic(absent.getUsername(), PASSWORD))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mac\":\"" + mac + "\",\"session_id\":" + session.getId() + "}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("off_network"));

        assertEquals(0, recordRepository.countByStudentIdAndSessionId(absent.getId(), session.getId()));
    }

    @Test
    void deviceRegistration_overHttpEnablesCheckIn() throws Exception {
        String second = randomMac();
        attach(second, "10.0.5.24");
        mvc.perform(checkIn(second, session.getId())).andExpect(status().isForbidden());

        mvc.perform(post("/api/devices").with(httpBasic(student.getUsername(), PASSWORD))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"" + student.getUsername() + "\",\"mac\":\"" + second + "\"}"))
                .andExpect(status().isForbidden());

        mvc.perform(post("/api/devices").with(httpBasic("admin", "admin"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"" + student.getUsername() + "\",\"mac\":\"" + second.toLowerCase() + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mac").value(second));

        mvc.perform(checkIn(second, session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("accepted"));

        mvc.perform(get("/api/devices").param("username", student.getUsername()).with(httpBasic("admin", "admin")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.devices.length()").value(2));
    }

    @Test
    void registeringAClassmatesDevice_isBadRequest() throws Exception {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        AppUser other = appUserService.createUser("carol-" + suffix, PASSWORD, UserRole.STUDENT,
                "Carol", "Other", "carol-" + suffix + "@example.com");

        mvc.perform(post("/api/devices").with(httpBasic("admin", "admin"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"" + other.getUsername() + "\",\"mac\":\"" + mac + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_argument"));
    }

    @Test
    void missingSession_isNotFoundNamingIt() throws Exception {
        attach(mac, "10.0.5.23");

        mvc.perform(checkIn(mac, 999L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Session 999 not found"));
    }

    @Test
    void closedSession_isNotFound() throws Exception {
        attach(mac, "10.0.5.23");
        session.setStatus(SessionStatus.CLOSED);
        sessionRepository.save(session);

        mvc.perform(checkIn(mac, session.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("session_not_found"));
    }

    @Test
    void emptyMac_isBadRequest() throws Exception {
        mvc.perform(post("/attendance/check_in").with(httpBasic(student.getUsername(), PASSWORD))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mac\":\"\",\"session_id\":999}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_argument"));
    }

    @Test
    void concurrentCheckIns_createExactlyOneRecord() throws Exception {
        attach(mac, "10.0.5.23");
        int n = 8;
        ExecutorService pool = Executors.newFixedThreadPool(n);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CheckInOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return checkInValidator.validate(mac, session.getId(), student);
                }));
            }
            start.countDown();

            int accepted = 0;
            int already = 0;
            for (Future<CheckInOutcome> f : futures) {
                CheckInResult result = f.get(30, TimeUnit.SECONDS).getResult();
                if (result == CheckInResult.ACCEPTED) accepted++;
                if (result == CheckInResult.ALREADY_RECORDED) already++;
            }
            assertEquals(1, accepted);
            assertEquals(n - 1, already);
            assertEquals(1, recordRepository.countByStudentIdAndSessionId(student.getId(), session.getId()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void routerPushAndSessionLog_overHttp() throws Exception {
        String push = "{\"connected_devices\":[{\"mac\":\"" + mac.replace(':', '-') + "\",\"ip\":\"10.0.5.50\"},"
                + "{\"mac\":\"not-a-mac\",\"ip\":\"10.0.5.51\"}]}";
        mvc.perform(post("/attendance/router_push").with(httpBasic("admin", "admin"))
                        .contentType(MediaType.APPLICATION_JSON).content(push))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));

        mvc.perform(checkIn(mac, session.getId())).andExpect(status().isOk());

        mvc.perform(get("/attendance/session/" + session.getId()).with(httpBasic("admin", "admin")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].student").value("Alice Liddell"))
                .andExpect(jsonPath("$[0].mac").value(mac));
    }

    @Test
    void userLookupByEmail() throws Exception {
        mvc.perform(get("/api/user").param("email", student.getEmail().toUpperCase())
                        .with(httpBasic(student.getUsername(), PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Alice Liddell"));

        mvc.perform(get("/api/user").param("email", "nobody@example.com")
                        .with(httpBasic(student.getUsername(), PASSWORD)))
                .andExpect(status().isNotFound());
    }

    private org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder checkIn(String deviceMac, Long sessionId) {
        return post("/attendance/check_in")
                .with(httpBasic(student.getUsername(), PASSWORD))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"mac\":\"" + deviceMac + "\",\"session_id\":" + sessionId + "}");
    }

    private void attach(String deviceMac, String ip) {
        networkAttachmentService.recordAttachments(List.of(new RouterPushRequest.ConnectedDevice(deviceMac, ip)));
    }

    private static String randomMac() {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            if (i > 0) sb.append(':');
            sb.append(String.format("%02X", r.nextInt(256)));
        }
        return sb.toString();
    }
}
