package com.example.smartroll.enums;

/**
 * Session lifecycle as set by the scheduling side.
 *
 * CLOSED sessions never accept check-ins, whatever their time window says.
 */
public enum SessionStatus {
    OPEN,
    CLOSED
}
