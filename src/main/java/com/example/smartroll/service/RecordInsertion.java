package com.example.smartroll.service;

import com.example.smartroll.entities.AttendanceRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of {@link AttendanceRecordStore#insertIfAbsent}: the record for the pair and
 * whether this call created it.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RecordInsertion {

    private final AttendanceRecord record;
    private final boolean created;

    static RecordInsertion created(AttendanceRecord record) {
        return new RecordInsertion(record, true);
    }

    static RecordInsertion existing(AttendanceRecord record) {
        return new RecordInsertion(record, false);
    }
}
