package com.example.smartroll.config;

import com.example.smartroll.entities.AttendanceSession;
import com.example.smartroll.entities.Classroom;
import com.example.smartroll.enums.SessionStatus;
import com.example.smartroll.enums.UserRole;
import com.example.smartroll.repository.AttendanceSessionRepository;
import com.example.smartroll.repository.ClassroomRepository;
import com.example.smartroll.service.AppUserService;
import com.example.smartroll.service.DeviceRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Seeds a demo classroom with one open session plus an instructor and a student
 * who owns one registered device.
 * Only active with smartroll.demo-data.enabled=true; real sessions come from the scheduler.
 */
@Component
@ConditionalOnProperty(name = "smartroll.demo-data.enabled", havingValue = "true")
public class DataInitializer {

    private final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    static final String DEMO_DEVICE = "02:00:00:00:01:01";

    private final ClassroomRepository classroomRepo;
    private final AttendanceSessionRepository sessionRepo;
    private final AppUserService appUserService;
    private final DeviceRegistry deviceRegistry;

    public DataInitializer(ClassroomRepository classroomRepo,
                           AttendanceSessionRepository sessionRepo,
                           AppUserService appUserService,
                           DeviceRegistry deviceRegistry) {
        this.classroomRepo = classroomRepo;
        this.sessionRepo = sessionRepo;
        this.appUserService = appUserService;
        this.deviceRegistry = deviceRegistry;
    }

    @PostConstruct
    public void init() {
        if (classroomRepo.findByName("Room 101").isEmpty()) {
            Classroom room = classroomRepo.save(Classroom.builder()
                    .name("Room 101")
                    .wifiNetworkPrefix("192.168.0.")
                    .build());
            AttendanceSession session = sessionRepo.save(AttendanceSession.builder()
                    .title("Demo lecture")
                    .classroom(room)
                    .status(SessionStatus.OPEN)
                    .build());
            log.info("Seeded classroom id={} with open session id={}", room.getId(), session.getId());
        }
        createIfMissing("instructor", UserRole.INSTRUCTOR, "Demo", "Instructor", "instructor@example.com");
        createIfMissing("student", UserRole.STUDENT, "Demo", "Student", "student@example.com");
        deviceRegistry.register(appUserService.findByUsernameSafe("student").getId(), DEMO_DEVICE);
    }

    private void createIfMissing(String username, UserRole role, String first, String last, String email) {
        if (appUserService.findByUsernameSafe(username) == null) {
            appUserService.createUser(username, username, role, first, last, email);
            log.info("Seeded {} user '{}'", role, username);
        }
    }
}
