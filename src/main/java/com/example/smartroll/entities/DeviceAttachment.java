package com.example.smartroll.entities;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Last known network attachment of a device, as reported by the classroom routers.
 */
@Entity
@Table(name = "device_attachment")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceAttachment {

    @Id
    @Column(name = "device_id", length = 17)
    private String deviceId;

    @Column(name = "network_address", nullable = false, length = 64)
    private String networkAddress;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;
}
