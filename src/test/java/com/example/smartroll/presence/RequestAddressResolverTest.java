package com.example.smartroll.presence;

import com.example.smartroll.model.DeviceIdentifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RequestAddressResolverTest {

    private static final DeviceIdentifier DEVICE = DeviceIdentifier.parse("AA:BB:CC:DD:EE:FF");

    private final RequestAddressResolver resolver = new RequestAddressResolver("172.16.0.1, 172.16.0.2");

    @AfterEach
    void cleanup() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void forwardedForFromTrustedProxy_firstHopWins() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("172.16.0.1");
        request.addHeader("X-Forwarded-For", "192.168.0.42, 172.16.0.1");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        assertEquals(Optional.of("192.168.0.42"), resolver.resolve(DEVICE));
    }

    @Test
    void forwardedForFromUntrustedPeer_isIgnored() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.9.4");
        request.addHeader("X-Forwarded-For", "192.168.0.42");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        assertEquals(Optional.of("10.0.9.4"), resolver.resolve(DEVICE));
    }

    @Test
    void withoutTrustedProxies_forwardedForIsNeverUsed() {
        RequestAddressResolver direct = new RequestAddressResolver("");
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("172.16.0.1");
        request.addHeader("X-Forwarded-For", "192.168.0.42");

        assertEquals(Optional.of("172.16.0.1"), direct.sourceAddress(request));
    }

    @Test
    void withoutForwardedFor_usesRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("192.168.0.7");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        assertEquals(Optional.of("192.168.0.7"), resolver.resolve(DEVICE));
    }

    @Test
    void outsideARequest_hasNoAttachment() {
        assertTrue(resolver.resolve(DEVICE).isEmpty());
    }
}
