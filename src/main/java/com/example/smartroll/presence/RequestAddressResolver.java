package com.example.smartroll.presence;

import com.example.smartroll.model.DeviceIdentifier;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Uses the source address of the current HTTP request as the device's address.
 *
 * X-Forwarded-For is client-controlled, so its first hop is only used when the request
 * arrives from one of the configured {@code smartroll.presence.trusted-proxies}. Otherwise
 * the header is ignored and the remote address is used.
 */
@Component
@ConditionalOnProperty(name = "smartroll.presence.source", havingValue = "request")
public class RequestAddressResolver implements NetworkPresenceResolver {

    private final Logger log = LoggerFactory.getLogger(RequestAddressResolver.class);

    static final String FORWARDED_FOR = "X-Forwarded-For";

    private final Set<String> trustedProxies;

    public RequestAddressResolver(@Value("${smartroll.presence.trusted-proxies:}") String trustedProxies) {
        this.trustedProxies = trustedProxies == null ? Set.of() : Arrays.stream(trustedProxies.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Optional<String> resolve(DeviceIdentifier device) {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes)) {
            return Optional.empty();
        }
        return sourceAddress(((ServletRequestAttributes) attributes).getRequest());
    }

    Optional<String> sourceAddress(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            if (remote != null && trustedProxies.contains(remote)) {
                String first = forwarded.split(",")[0].trim();
                if (!first.isEmpty()) return Optional.of(first);
            } else {
                log.debug("Ignoring {} from untrusted peer {}", FORWARDED_FOR, remote);
            }
        }
        return (remote == null || remote.isBlank()) ? Optional.empty() : Optional.of(remote);
    }
}
