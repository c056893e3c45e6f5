package com.dcruver.attendance.ledger;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only attendance records partitioned by calendar date.
 *
 * At most one automatic record exists per identity per day. Each loaded day keeps the
 * first automatic record of every identity it has seen; the mark check and the append
 * run while holding that day's partition, so two marks for the same identity and day
 * cannot both succeed. Manual entries bypass the check entirely.
 *
 * Partitions are read from the {@link LedgerStore} on first use and cached. Today's
 * partition is loaded eagerly so a restart still refuses a second automatic mark.
 * Reads of an empty day other than today are not cached.
 */
@Slf4j
public class AttendanceLedger {

    private final LedgerStore store;
    private final Clock clock;
    private final LocalDateTime sessionStart;
    private final ConcurrentMap<LocalDate, DayPartition> partitions = new ConcurrentHashMap<>();

    private final AtomicInteger sessionCheckIns = new AtomicInteger();
    private final AtomicInteger duplicateAttempts = new AtomicInteger();

    public AttendanceLedger(LedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.sessionStart = LocalDateTime.now(clock);

        DayPartition today = partition(today());
        synchronized (today) {
            log.info("Loaded {} attendance records for {}, {} identities already marked",
                today.records.size(), today.date, today.firstAutomatic.size());
        }
    }

    /**
     * Mark an identity present at the current time
     */
    public MarkResult mark(String identity) {
        return mark(identity, LocalDateTime.now(clock));
    }

    /**
     * Mark an identity present at {@code timestamp}, once per calendar day.
     * The store append happens before the in-memory update; a failed append changes nothing.
     */
    public MarkResult mark(String identity, LocalDateTime timestamp) {
        requireIdentity(identity);
        LocalDate date = timestamp.toLocalDate();
        DayPartition partition = partition(date);

        synchronized (partition) {
            AttendanceRecord first = partition.firstAutomatic.get(identity);
            if (first != null) {
                duplicateAttempts.incrementAndGet();
                log.info("{} already marked on {} at {}", identity, date, first.getTime());
                return MarkResult.alreadyMarked(first, partition.firstAutomatic.size());
            }

            AttendanceRecord record = AttendanceRecord.automatic(identity, timestamp);
            store.appendRecord(date, record);
            partition.append(record);
            sessionCheckIns.incrementAndGet();

            log.info("Attendance marked for {} at {}", identity, record.getTimestamp());
            return MarkResult.success(record, partition.firstAutomatic.size());
        }
    }

    /**
     * Append an operator entry. Always written, never consults or changes daily marks.
     */
    public AttendanceRecord manualEntry(String identity, LocalDate date, LocalTime time, String status) {
        requireIdentity(identity);
        AttendanceRecord record = AttendanceRecord.manual(identity, date, time, status);
        DayPartition partition = partition(date);

        synchronized (partition) {
            store.appendRecord(date, record);
            partition.records.add(record);
        }

        log.info("Manual attendance entry for {} on {} ({})", identity, date, record.getStatus());
        return record;
    }

    public List<AttendanceRecord> todayRecords() {
        return recordsOn(today());
    }

    /**
     * All records of one date in insertion order, empty when the date has none
     */
    public List<AttendanceRecord> recordsOn(LocalDate date) {
        DayPartition partition = readPartition(date);
        if (partition == null) {
            return List.of();
        }
        synchronized (partition) {
            return List.copyOf(partition.records);
        }
    }

    /**
     * Dates within {@code [start, end]} that have stored records, ascending
     */
    public List<LocalDate> datesWithRecords(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            return List.of();
        }
        return store.listPartitionDates().stream()
            .filter(date -> !date.isBefore(start) && !date.isAfter(end))
            .sorted()
            .toList();
    }

    /**
     * Records of an identity over {@code [today - daysBack, today]}, oldest first.
     * Labels are compared case-insensitively.
     */
    public List<AttendanceRecord> history(String identity, int daysBack) {
        if (daysBack < 0) {
            throw new IllegalArgumentException("daysBack must be >= 0, got " + daysBack);
        }

        LocalDate end = today();
        List<AttendanceRecord> result = new ArrayList<>();
        for (LocalDate date : datesWithRecords(end.minusDays(daysBack), end)) {
            for (AttendanceRecord record : recordsOn(date)) {
                if (record.getLabel().equalsIgnoreCase(identity)) {
                    result.add(record);
                }
            }
        }
        return result;
    }

    /**
     * Time of the identity's automatic check-in on {@code date}, if any
     */
    public Optional<LocalTime> firstCheckIn(String identity, LocalDate date) {
        DayPartition partition = readPartition(date);
        if (partition == null) {
            return Optional.empty();
        }
        synchronized (partition) {
            return Optional.ofNullable(partition.firstAutomatic.get(identity))
                .map(AttendanceRecord::getTime);
        }
    }

    public boolean isMarked(String identity, LocalDate date) {
        return firstCheckIn(identity, date).isPresent();
    }

    public SessionStats sessionStats() {
        LocalDateTime now = LocalDateTime.now(clock);
        DayPartition today = partition(now.toLocalDate());
        int marked;
        synchronized (today) {
            marked = today.firstAutomatic.size();
        }

        return SessionStats.builder()
            .sessionStart(sessionStart)
            .sessionDurationMinutes(Duration.between(sessionStart, now).toSeconds() / 60.0)
            .totalCheckIns(sessionCheckIns.get())
            .duplicateAttempts(duplicateAttempts.get())
            .todayMarkedIdentities(marked)
            .build();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LedgerStore getStore() {
        return store;
    }

    int cachedPartitionCount() {
        return partitions.size();
    }

    // Write path: always cached, the partition carries the day's marks
    private DayPartition partition(LocalDate date) {
        DayPartition existing = partitions.get(date);
        if (existing != null) {
            return existing;
        }
        return cache(date, store.readPartition(date));
    }

    // Read path: null for an empty day other than today, which stays uncached
    private DayPartition readPartition(LocalDate date) {
        DayPartition existing = partitions.get(date);
        if (existing != null) {
            return existing;
        }
        List<AttendanceRecord> stored = store.readPartition(date);
        if (stored.isEmpty() && !date.equals(today())) {
            return null;
        }
        return cache(date, stored);
    }

    private DayPartition cache(LocalDate date, List<AttendanceRecord> stored) {
        // Read outside the map so a slow store does not block other days
        DayPartition loaded = DayPartition.of(date, stored);
        DayPartition raced = partitions.putIfAbsent(date, loaded);
        if (raced != null) {
            return raced;
        }
        log.debug("Loaded partition {} with {} records", date, loaded.records.size());
        return loaded;
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity label must not be blank");
        }
    }

    /**
     * One calendar day: its records and the first automatic record per identity.
     * Guarded by its own monitor.
     */
    private static final class DayPartition {
        private final LocalDate date;
        private final List<AttendanceRecord> records = new ArrayList<>();
        private final Map<String, AttendanceRecord> firstAutomatic = new LinkedHashMap<>();

        private DayPartition(LocalDate date) {
            this.date = date;
        }

        static DayPartition of(LocalDate date, List<AttendanceRecord> stored) {
            DayPartition partition = new DayPartition(date);
            for (AttendanceRecord record : stored) {
                partition.append(record);
            }
            return partition;
        }

        void append(AttendanceRecord record) {
            records.add(record);
            if (record.isAutomatic()) {
                firstAutomatic.putIfAbsent(record.getLabel(), record);
            }
        }
    }
}
