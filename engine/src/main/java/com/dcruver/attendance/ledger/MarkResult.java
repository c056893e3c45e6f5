package com.dcruver.attendance.ledger;

import lombok.Value;

import java.time.LocalTime;

/**
 * Outcome of an automatic mark. A duplicate mark is an ordinary outcome, not an error.
 */
@Value
public class MarkResult {
    Outcome outcome;
    AttendanceRecord record;  // the new record, or the day's first record when already marked
    int totalMarkedToday;

    public static MarkResult success(AttendanceRecord record, int totalMarkedToday) {
        return new MarkResult(Outcome.SUCCESS, record, totalMarkedToday);
    }

    public static MarkResult alreadyMarked(AttendanceRecord firstRecord, int totalMarkedToday) {
        return new MarkResult(Outcome.ALREADY_MARKED, firstRecord, totalMarkedToday);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    /**
     * Time of the day's first automatic record for this identity
     */
    public LocalTime getFirstCheckInTime() {
        return record.getTime();
    }

    public enum Outcome {
        SUCCESS,
        ALREADY_MARKED
    }
}
