package com.example.smartroll.service;

import com.example.smartroll.entities.AppUser;
import com.example.smartroll.enums.UserRole;
import com.example.smartroll.repository.AppUserRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AppUserService implements UserDetailsService {

    private final Logger log = LoggerFactory.getLogger(AppUserService.class);

    private final AppUserRepository userRepo;
    private final BCryptPasswordEncoder passwordEncoder;

    @Value("${smartroll.admin.username:admin}")
    private String adminUsername;

    @Value("${smartroll.admin.password:admin}")
    private String adminPassword;

    @PostConstruct
    public void initDefaultUsers() {
        if (userRepo.findByUsername(adminUsername).isEmpty()) {
            createUser(adminUsername, adminPassword, UserRole.ADMIN, null, null, null);
            log.info("Created bootstrap admin user '{}'", adminUsername);
        }
    }

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        return userRepo.findByUsername(username).orElseThrow(() -> new UsernameNotFoundException("Not found"));
    }

    @Transactional(readOnly = true)
    public AppUser findByUsernameSafe(String username) {
        if (username == null) return null;
        return userRepo.findByUsername(username).orElse(null);
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findByEmail(String email) {
        if (email == null || email.isBlank()) return Optional.empty();
        return userRepo.findByEmailIgnoreCase(email.trim());
    }

    /**
     * Create a user. Throws IllegalArgumentException if the username is already taken.
     */
    @Transactional
    public AppUser createUser(String username, String rawPassword, UserRole role,
                              String firstName, String lastName, String email) {
        if (username == null || username.isBlank() || rawPassword == null || role == null) {
            throw new IllegalArgumentException("username, password and role are required");
        }
        if (userRepo.findByUsername(username).isPresent()) {
            throw new IllegalArgumentException("Username already exists: " + username);
        }
        AppUser u = AppUser.builder()
                .username(username.trim())
                .password(passwordEncoder.encode(rawPassword))
                .role(role)
                .firstName(firstName)
                .lastName(lastName)
                .email(email)
                .build();
        try {
            return userRepo.saveAndFlush(u);
        } catch (DataIntegrityViolationException ex) {
            throw new IllegalArgumentException("Username or email already exists: " + username, ex);
        }
    }
}
