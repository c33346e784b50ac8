package com.example.smartroll.controller;

import com.example.smartroll.dto.DeviceRegistrationRequest;
import com.example.smartroll.entities.AppUser;
import com.example.smartroll.entities.RegisteredDevice;
import com.example.smartroll.enums.UserRole;
import com.example.smartroll.exception.InvalidRequestException;
import com.example.smartroll.service.AppUserService;
import com.example.smartroll.service.DeviceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class UserController {

    private final AppUserService appUserService;
    private final DeviceRegistry deviceRegistry;

    @GetMapping("/user")
    public ResponseEntity<Map<String, Object>> getUser(@RequestParam(required = false) String email) {
        if (email == null || email.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("status", "error", "message", "Email required"));
        }
        Optional<AppUser> user = appUserService.findByEmail(email);
        if (user.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("status", "error", "message", "User not found"));
        }
        return ResponseEntity.ok(Map.of("status", "success", "name", user.get().getDisplayName()));
    }

    /**
     * Bind a device to a student. Only devices registered this way can be used to check in.
     */
    @PostMapping("/devices")
    public ResponseEntity<Map<String, Object>> registerDevice(@RequestBody DeviceRegistrationRequest request) {
        AppUser student = appUserService.findByUsernameSafe(request.getUsername());
        if (student == null || student.getRole() != UserRole.STUDENT) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("status", "error", "message", "Student not found"));
        }
        RegisteredDevice device = deviceRegistry.register(student.getId(), request.getMac());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("student", student.getUsername());
        result.put("mac", device.getDeviceId());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/devices")
    public ResponseEntity<Map<String, Object>> listDevices(@RequestParam String username) {
        AppUser student = appUserService.findByUsernameSafe(username);
        if (student == null) {
            throw new InvalidRequestException("unknown user " + username);
        }
        List<String> macs = deviceRegistry.devicesOf(student.getId()).stream()
                .map(RegisteredDevice::getDeviceId)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("student", student.getUsername(), "devices", macs));
    }
}
