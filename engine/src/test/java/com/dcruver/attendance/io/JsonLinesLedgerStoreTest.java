package com.dcruver.attendance.io;

import com.dcruver.attendance.ledger.AttendanceLedger;
import com.dcruver.attendance.ledger.AttendanceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesLedgerStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 1);

    @TempDir
    Path tempDir;

    private JsonLinesLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new JsonLinesLedgerStore(tempDir, JsonMapping.newObjectMapper());
    }

    @Test
    void testAppendsOneLinePerRecord() throws Exception {
        store.appendRecord(DAY, AttendanceRecord.automatic("Alice", DAY.atTime(9, 0)));
        store.appendRecord(DAY, AttendanceRecord.manual("Bob", DAY, LocalTime.of(10, 0), "Late"));

        List<String> lines = Files.readAllLines(store.partitionFile(DAY));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"date\":\"2024-01-01\""));

        List<AttendanceRecord> records = store.readPartition(DAY);
        assertEquals("Alice", records.get(0).getLabel());
        assertEquals(AttendanceRecord.manual("Bob", DAY, LocalTime.of(10, 0), "Late"), records.get(1));
    }

    @Test
    void testMissingPartitionIsEmpty() {
        assertTrue(store.readPartition(DAY).isEmpty());
        assertTrue(store.listPartitionDates().isEmpty());
    }

    @Test
    void testBlankLinesAreSkipped() throws Exception {
        store.appendRecord(DAY, AttendanceRecord.automatic("Alice", DAY.atTime(9, 0)));
        Files.writeString(store.partitionFile(DAY), Files.readString(store.partitionFile(DAY)) + "\n\n");

        assertEquals(1, store.readPartition(DAY).size());
    }

    @Test
    void testPartialLineIsSkipped() throws Exception {
        store.appendRecord(DAY, AttendanceRecord.automatic("Alice", DAY.atTime(9, 0)));
        Files.writeString(store.partitionFile(DAY), "{\"label\":\"Bob\",\"da", StandardOpenOption.APPEND);

        assertEquals(1, store.readPartition(DAY).size());

        store.appendRecord(DAY, AttendanceRecord.automatic("Carol", DAY.atTime(10, 0)));
        List<AttendanceRecord> records = store.readPartition(DAY);

        assertEquals(2, records.size());
        assertEquals("Alice", records.get(0).getLabel());
        assertEquals("Carol", records.get(1).getLabel());
    }

    @Test
    void testLedgerStartsOverDamagedTodayFile() throws Exception {
        store.appendRecord(DAY, AttendanceRecord.automatic("Alice", DAY.atTime(9, 0)));
        Files.writeString(store.partitionFile(DAY), "not json at all\n", StandardOpenOption.APPEND);
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);

        AttendanceLedger ledger = new AttendanceLedger(store, clock);

        assertTrue(ledger.isMarked("Alice", DAY));
        assertTrue(ledger.mark("Bob", DAY.atTime(12, 0)).isSuccess());
    }

    @Test
    void testListsPartitionDatesSortedAndIgnoresOtherFiles() throws Exception {
        store.appendRecord(DAY.plusDays(2), AttendanceRecord.automatic("Alice", DAY.plusDays(2).atTime(9, 0)));
        store.appendRecord(DAY, AttendanceRecord.automatic("Alice", DAY.atTime(9, 0)));
        Files.writeString(tempDir.resolve("attendance").resolve("notes.txt"), "ignore me");

        assertEquals(List.of(DAY, DAY.plusDays(2)), store.listPartitionDates());
    }

    @Test
    void testLedgerDedupSurvivesRestart() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);
        new AttendanceLedger(store, clock).mark("Alice", DAY.atTime(9, 0));

        AttendanceLedger restarted = new AttendanceLedger(
            new JsonLinesLedgerStore(tempDir, JsonMapping.newObjectMapper()), clock);

        assertFalse(restarted.mark("Alice", DAY.atTime(11, 0)).isSuccess());
        assertEquals(1, restarted.todayRecords().size());
    }
}
