package com.example.smartroll.enums;

/**
 * Closed set of business results a check-in attempt can produce.
 * Precondition and infrastructure faults are exceptions, not members of this set.
 */
public enum CheckInResult {
    ACCEPTED,
    ALREADY_RECORDED,
    OFF_NETWORK,
    SESSION_NOT_FOUND
}
