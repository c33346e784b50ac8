package com.example.smartroll.repository;

import com.example.smartroll.entities.DeviceAttachment;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeviceAttachmentRepository extends JpaRepository<DeviceAttachment, String> {
}
