package com.dcruver.attendance.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * One immutable attendance entry, belonging to the partition of its calendar date.
 */
@Value
@Builder
public class AttendanceRecord {
    public static final String PRESENT = "Present";
    public static final String LATE = "Late";
    public static final String ABSENT = "Absent";

    String label;
    LocalDate date;
    LocalTime time;
    LocalDateTime timestamp;
    String weekday;
    String status;
    EntryKind entryKind;

    @JsonCreator
    public AttendanceRecord(
            @JsonProperty("label") String label,
            @JsonProperty("date") LocalDate date,
            @JsonProperty("time") LocalTime time,
            @JsonProperty("timestamp") LocalDateTime timestamp,
            @JsonProperty("weekday") String weekday,
            @JsonProperty("status") String status,
            @JsonProperty("entryKind") EntryKind entryKind) {
        this.label = label;
        this.date = date;
        this.time = time;
        this.timestamp = timestamp;
        this.weekday = weekday;
        this.status = status;
        this.entryKind = entryKind;
    }

    /**
     * Record produced by a recognition event, always "Present"
     */
    public static AttendanceRecord automatic(String label, LocalDateTime timestamp) {
        LocalDateTime seconds = timestamp.truncatedTo(ChronoUnit.SECONDS);
        return AttendanceRecord.builder()
            .label(label)
            .date(seconds.toLocalDate())
            .time(seconds.toLocalTime())
            .timestamp(seconds)
            .weekday(weekdayName(seconds.toLocalDate()))
            .status(PRESENT)
            .entryKind(EntryKind.AUTOMATIC)
            .build();
    }

    /**
     * Operator correction; never counted for dedup
     */
    public static AttendanceRecord manual(String label, LocalDate date, LocalTime time, String status) {
        LocalTime seconds = time.truncatedTo(ChronoUnit.SECONDS);
        return AttendanceRecord.builder()
            .label(label)
            .date(date)
            .time(seconds)
            .timestamp(LocalDateTime.of(date, seconds))
            .weekday(weekdayName(date))
            .status(status == null || status.isBlank() ? PRESENT : status)
            .entryKind(EntryKind.MANUAL)
            .build();
    }

    public boolean isAutomatic() {
        return entryKind == EntryKind.AUTOMATIC;
    }

    public static String weekdayName(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
