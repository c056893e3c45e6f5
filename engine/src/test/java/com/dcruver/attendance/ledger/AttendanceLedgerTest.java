package com.dcruver.attendance.ledger;

import com.dcruver.attendance.domain.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AttendanceLedgerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryLedgerStore store;
    private AttendanceLedger ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        ledger = new AttendanceLedger(store, CLOCK);
    }

    @Test
    void testSecondMarkSameDayIsAlreadyMarked() {
        MarkResult first = ledger.mark("Alice", DAY.atTime(9, 0));
        MarkResult second = ledger.mark("Alice", DAY.atTime(9, 30));

        assertTrue(first.isSuccess());
        assertEquals(1, first.getTotalMarkedToday());
        assertEquals(MarkResult.Outcome.ALREADY_MARKED, second.getOutcome());
        assertEquals(LocalTime.of(9, 0), second.getFirstCheckInTime());
        assertEquals(1, ledger.recordsOn(DAY).size());
    }

    @Test
    void testMarkOnNextDaySucceedsAgain() {
        ledger.mark("Alice", DAY.atTime(9, 0));

        MarkResult nextDay = ledger.mark("Alice", DAY.plusDays(1).atTime(9, 0));

        assertTrue(nextDay.isSuccess());
    }

    @Test
    void testAutomaticRecordShape() {
        MarkResult result = ledger.mark("Alice", LocalDateTime.of(2024, 1, 1, 9, 0, 5, 123_000_000));

        AttendanceRecord record = result.getRecord();
        assertEquals("Alice", record.getLabel());
        assertEquals(DAY, record.getDate());
        assertEquals(LocalTime.of(9, 0, 5), record.getTime());
        assertEquals("Monday", record.getWeekday());
        assertEquals(AttendanceRecord.PRESENT, record.getStatus());
        assertEquals(EntryKind.AUTOMATIC, record.getEntryKind());
    }

    @Test
    void testManualEntryDoesNotBlockAutomaticMark() {
        AttendanceRecord manual = ledger.manualEntry("Bob", DAY, LocalTime.of(10, 0), AttendanceRecord.LATE);
        MarkResult mark = ledger.mark("Bob", DAY.atTime(11, 0));

        assertEquals(EntryKind.MANUAL, manual.getEntryKind());
        assertEquals(AttendanceRecord.LATE, manual.getStatus());
        assertTrue(mark.isSuccess());
        assertEquals(2, ledger.recordsOn(DAY).size());
    }

    @Test
    void testManualEntryAfterMarkIsStillWritten() {
        ledger.mark("Bob", DAY.atTime(9, 0));

        ledger.manualEntry("Bob", DAY, LocalTime.of(17, 0), null);

        List<AttendanceRecord> records = ledger.recordsOn(DAY);
        assertEquals(2, records.size());
        assertEquals(AttendanceRecord.PRESENT, records.get(1).getStatus());
        assertEquals(LocalTime.of(9, 0), ledger.firstCheckIn("Bob", DAY).orElseThrow());
    }

    @Test
    void testReloadFromStoreKeepsDailyMark() {
        ledger.mark("Alice", DAY.atTime(9, 0));

        AttendanceLedger restarted = new AttendanceLedger(store, CLOCK);
        MarkResult again = restarted.mark("Alice", DAY.atTime(10, 0));

        assertFalse(again.isSuccess());
        assertEquals(LocalTime.of(9, 0), again.getFirstCheckInTime());
        assertTrue(restarted.isMarked("Alice", DAY));
    }

    @Test
    void testFailedAppendChangesNothing() {
        store.setFailAppends(true);

        assertThrows(PersistenceException.class, () -> ledger.mark("Alice", DAY.atTime(9, 0)));
        assertFalse(ledger.isMarked("Alice", DAY));
        assertTrue(ledger.recordsOn(DAY).isEmpty());

        store.setFailAppends(false);
        assertTrue(ledger.mark("Alice", DAY.atTime(9, 5)).isSuccess());
    }

    @Test
    void testConcurrentMarksProduceOneRecord() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MarkResult>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                int minute = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledger.mark("Alice", DAY.atTime(9, minute));
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<MarkResult> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isSuccess()) {
                    successes++;
                }
            }

            assertEquals(1, successes);
            assertEquals(1, store.readPartition(DAY).size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testBlankIdentityRejected() {
        assertThrows(IllegalArgumentException.class, () -> ledger.mark(" ", DAY.atTime(9, 0)));
        assertThrows(IllegalArgumentException.class,
            () -> ledger.manualEntry("", DAY, LocalTime.NOON, null));
    }

    @Test
    void testTodayRecordsUsesClock() {
        ledger.mark("Alice");
        ledger.mark("Bob", DAY.minusDays(1).atTime(9, 0));

        List<AttendanceRecord> today = ledger.todayRecords();

        assertEquals(1, today.size());
        assertEquals(LocalTime.NOON, today.get(0).getTime());
    }

    @Test
    void testHistoryWindowIsInclusiveAndCaseInsensitive() {
        ledger.mark("Alice", DAY.minusDays(3).atTime(9, 0));
        ledger.mark("Alice", DAY.minusDays(2).atTime(9, 0));
        ledger.mark("Bob", DAY.minusDays(1).atTime(9, 0));
        ledger.mark("Alice", DAY.atTime(9, 0));

        List<AttendanceRecord> history = ledger.history("alice", 2);

        assertEquals(2, history.size());
        assertEquals(DAY.minusDays(2), history.get(0).getDate());
        assertEquals(DAY, history.get(1).getDate());
    }

    @Test
    void testHistoryRejectsNegativeWindow() {
        assertThrows(IllegalArgumentException.class, () -> ledger.history("Alice", -1));
    }

    @Test
    void testSessionStatsCountsCheckInsAndDuplicates() {
        ledger.mark("Alice");
        ledger.mark("Alice");
        ledger.mark("Bob");

        SessionStats stats = ledger.sessionStats();

        assertEquals(2, stats.getTotalCheckIns());
        assertEquals(1, stats.getDuplicateAttempts());
        assertEquals(2, stats.getTodayMarkedIdentities());
        assertEquals(0.0, stats.getSessionDurationMinutes());
    }

    @Test
    void testReadingEmptyPastDaysDoesNotCache() {
        int cachedBefore = ledger.cachedPartitionCount();

        for (int i = 1; i <= 100; i++) {
            assertTrue(ledger.recordsOn(DAY.minusDays(i)).isEmpty());
            assertTrue(ledger.firstCheckIn("Alice", DAY.minusDays(i)).isEmpty());
        }

        assertEquals(cachedBefore, ledger.cachedPartitionCount());
    }

    @Test
    void testMarkOnUncachedPastDayStillDeduplicates() {
        assertTrue(ledger.recordsOn(DAY.minusDays(3)).isEmpty());

        assertTrue(ledger.mark("Alice", DAY.minusDays(3).atTime(9, 0)).isSuccess());
        assertFalse(ledger.mark("Alice", DAY.minusDays(3).atTime(10, 0)).isSuccess());
        assertEquals(1, ledger.recordsOn(DAY.minusDays(3)).size());
    }

    @Test
    void testDatesWithRecordsWithinRange() {
        ledger.mark("Alice", DAY.minusDays(10).atTime(9, 0));
        ledger.manualEntry("Bob", DAY.minusDays(2), LocalTime.NOON, null);
        ledger.mark("Alice", DAY.atTime(9, 0));

        assertEquals(List.of(DAY.minusDays(2), DAY), ledger.datesWithRecords(DAY.minusDays(5), DAY));
        assertTrue(ledger.datesWithRecords(DAY, DAY.minusDays(5)).isEmpty());
    }
}
