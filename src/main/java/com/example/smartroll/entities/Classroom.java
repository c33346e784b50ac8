package com.example.smartroll.entities;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "classroom")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Classroom {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 120)
    private String name;

    // address prefix of the classroom Wi-Fi, e.g. "192.168.0."
    @Column(name = "wifi_network_prefix", nullable = false, length = 64)
    private String wifiNetworkPrefix;

    @PrePersist
    @PreUpdate
    void requireNetworkPrefix() {
        if (wifiNetworkPrefix == null || wifiNetworkPrefix.isBlank()) {
            throw new IllegalStateException("classroom '" + name + "' needs a Wi-Fi network prefix");
        }
        wifiNetworkPrefix = wifiNetworkPrefix.trim();
    }
}
