package com.example.smartroll.model;

import lombok.EqualsAndHashCode;

/**
 * Address prefix of a classroom network. A device is on the segment when its
 * current address starts with the prefix; this is not a CIDR match.
 */
@EqualsAndHashCode
public final class ClassroomSegment {

    private final String prefix;

    private ClassroomSegment(String prefix) {
        this.prefix = prefix;
    }

    public static ClassroomSegment of(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("classroom segment prefix must not be empty");
        }
        return new ClassroomSegment(prefix.trim());
    }

    public boolean matches(String networkAddress) {
        return networkAddress != null && networkAddress.trim().startsWith(prefix);
    }

    public String prefix() {
        return prefix;
    }

    @Override
    public String toString() {
        return prefix;
    }
}
