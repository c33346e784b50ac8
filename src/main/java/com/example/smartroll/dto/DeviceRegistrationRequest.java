package com.example.smartroll.dto;

import lombok.Data;

/**
 * Admin request binding a device to a student account.
 * JSON: {"username": "alice", "mac": "AA:BB:CC:DD:EE:FF"}
 */
@Data
public class DeviceRegistrationRequest {
    private String username;
    private String mac;
}
