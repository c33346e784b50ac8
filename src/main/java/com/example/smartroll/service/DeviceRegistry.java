package com.example.smartroll.service;

import com.example.smartroll.entities.RegisteredDevice;
import com.example.smartroll.exception.CheckInUnavailableException;
import com.example.smartroll.exception.InvalidRequestException;
import com.example.smartroll.model.DeviceIdentifier;
import com.example.smartroll.repository.RegisteredDeviceRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Which student owns which device. A check-in only counts for the device's owner.
 */
@Service
@RequiredArgsConstructor
public class DeviceRegistry {

    private final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    private final RegisteredDeviceRepository deviceRepository;
    private final Clock clock;

    public boolean isRegisteredTo(DeviceIdentifier device, Long studentId) {
        try {
            return deviceRepository.existsByDeviceIdAndStudentId(device.value(), studentId);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Device ownership lookup failed for device={} student={}: {}", device, studentId, ex.getMessage());
            throw new CheckInUnavailableException(CheckInUnavailableException.DEVICE_REGISTRY,
                    "device registry unavailable", ex);
        }
    }

    /**
     * Bind a device to a student. Registering the same device to the same student again is a no-op;
     * a device already bound to someone else is rejected.
     */
    @Transactional
    public RegisteredDevice register(Long studentId, String rawDeviceId) {
        if (studentId == null) {
            throw new InvalidRequestException("student identity is required");
        }
        DeviceIdentifier device = DeviceIdentifier.parse(rawDeviceId);
        Optional<RegisteredDevice> existing = deviceRepository.findById(device.value());
        if (existing.isPresent()) {
            if (!existing.get().getStudentId().equals(studentId)) {
                throw new InvalidRequestException("device " + device + " is registered to another student");
            }
            return existing.get();
        }
        RegisteredDevice saved = deviceRepository.save(RegisteredDevice.builder()
                .deviceId(device.value())
                .studentId(studentId)
                .registeredAt(clock.instant())
                .build());
        log.info("Registered device {} to student id={}", device, studentId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<RegisteredDevice> devicesOf(Long studentId) {
        return deviceRepository.findByStudentIdOrderByRegisteredAtAsc(studentId);
    }
}
