package com.example.smartroll.repository;

import com.example.smartroll.entities.RegisteredDevice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RegisteredDeviceRepository extends JpaRepository<RegisteredDevice, String> {

    List<RegisteredDevice> findByStudentIdOrderByRegisteredAtAsc(Long studentId);

    boolean existsByDeviceIdAndStudentId(String deviceId, Long studentId);
}
