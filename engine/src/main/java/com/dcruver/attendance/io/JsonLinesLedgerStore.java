package com.dcruver.attendance.io;

import com.dcruver.attendance.domain.PersistenceException;
import com.dcruver.attendance.ledger.AttendanceRecord;
import com.dcruver.attendance.ledger.LedgerStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One append-only file per calendar date, one JSON record per line:
 * {@code attendance/attendance_2024-01-01.jsonl}.
 * Lines that do not parse are skipped with a warning.
 */
@Slf4j
public class JsonLinesLedgerStore implements LedgerStore {

    private static final Pattern PARTITION_FILE = Pattern.compile("attendance_(\\d{4}-\\d{2}-\\d{2})\\.jsonl");

    private final ObjectMapper objectMapper;
    private final Path attendanceDir;

    public JsonLinesLedgerStore(Path dataDir, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.attendanceDir = dataDir.resolve("attendance");
    }

    @Override
    public void appendRecord(LocalDate date, AttendanceRecord record) {
        Path file = partitionFile(date);
        try {
            Files.createDirectories(attendanceDir);
            String line = objectMapper.writeValueAsString(record) + "\n";
            if (endsMidLine(file)) {
                line = "\n" + line;
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new PersistenceException("Failed to append attendance record to " + file, e);
        }
    }

    @Override
    public List<AttendanceRecord> readPartition(LocalDate date) {
        Path file = partitionFile(date);
        if (!Files.exists(file)) {
            return List.of();
        }

        try {
            List<AttendanceRecord> records = new ArrayList<>();
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(objectMapper.readValue(line, AttendanceRecord.class));
                } catch (JsonProcessingException e) {
                    // Typically a partial line left by an interrupted append
                    log.warn("Skipping unreadable line {} in {}: {}", i + 1, file, e.getOriginalMessage());
                }
            }
            return records;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read attendance partition " + file, e);
        }
    }

    @Override
    public List<LocalDate> listPartitionDates() {
        if (!Files.exists(attendanceDir)) {
            return List.of();
        }

        try (Stream<Path> files = Files.list(attendanceDir)) {
            List<LocalDate> dates = new ArrayList<>();
            files.forEach(p -> {
                Matcher m = PARTITION_FILE.matcher(p.getFileName().toString());
                if (m.matches()) {
                    try {
                        dates.add(LocalDate.parse(m.group(1)));
                    } catch (DateTimeParseException e) {
                        log.warn("Ignoring attendance file with invalid date: {}", p);
                    }
                }
            });
            dates.sort(null);
            return dates;
        } catch (IOException e) {
            throw new PersistenceException("Failed to list attendance partitions in " + attendanceDir, e);
        }
    }

    // True when the last append was cut short and left no trailing newline
    private static boolean endsMidLine(Path file) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return false;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(channel.size() - 1);
            channel.read(last);
            return last.get(0) != '\n';
        }
    }

    Path partitionFile(LocalDate date) {
        return attendanceDir.resolve("attendance_" + date + ".jsonl");
    }
}
