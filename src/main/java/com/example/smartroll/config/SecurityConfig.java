package com.example.smartroll.config;

import com.example.smartroll.service.AppUserService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

import static org.springframework.security.web.util.matcher.AntPathRequestMatcher.antMatcher;

@Configuration
public class SecurityConfig {

    @Bean
    public BCryptPasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * Create DaoAuthenticationProvider and let Spring inject AppUserService and passwordEncoder as method parameters.
     * Using method parameters avoids constructor-level circular dependency between SecurityConfig and AppUserService.
     */
    @Bean
    public DaoAuthenticationProvider authProvider(AppUserService appUserService, BCryptPasswordEncoder passwordEncoder) {
        DaoAuthenticationProvider provider = new DaoAuthenticationProvider(appUserService);
        provider.setPasswordEncoder(passwordEncoder);
        return provider;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, DaoAuthenticationProvider authProvider) throws Exception {
        http
                .csrf(csrf -> csrf.ignoringRequestMatchers(
                        antMatcher("/h2-console/**"), antMatcher("/attendance/**"), antMatcher("/api/**")))
                .headers(headers -> headers.frameOptions(frame -> frame.sameOrigin()))
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(antMatcher("/h2-console/**")).permitAll()
                        .requestMatchers(antMatcher("/attendance/check_in")).hasRole("STUDENT")
                        .requestMatchers(antMatcher("/attendance/router_push")).hasRole("ADMIN")
                        .requestMatchers(antMatcher("/attendance/session/**")).hasAnyRole("INSTRUCTOR", "ADMIN")
                        .requestMatchers(antMatcher("/api/devices/**")).hasRole("ADMIN")
                        .anyRequest().authenticated()
                )
                .httpBasic(Customizer.withDefaults())
                .authenticationProvider(authProvider);

        return http.build();
    }
}
