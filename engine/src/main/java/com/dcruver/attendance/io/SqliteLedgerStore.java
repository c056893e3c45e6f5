package com.dcruver.attendance.io;

import com.dcruver.attendance.domain.PersistenceException;
import com.dcruver.attendance.ledger.AttendanceRecord;
import com.dcruver.attendance.ledger.EntryKind;
import com.dcruver.attendance.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Stores attendance records in SQLite. A partition is every row with the same
 * {@code record_date}; row id order is append order.
 */
@Slf4j
public class SqliteLedgerStore implements LedgerStore {

    private final JdbcTemplate jdbcTemplate;

    public SqliteLedgerStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public void init() {
        try {
            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS attendance_records (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    label TEXT NOT NULL,
                    record_date TEXT NOT NULL,
                    record_time TEXT NOT NULL,
                    timestamp TEXT NOT NULL,
                    weekday TEXT NOT NULL,
                    status TEXT NOT NULL,
                    entry_kind TEXT NOT NULL
                )
                """);

            jdbcTemplate.execute("""
                CREATE INDEX IF NOT EXISTS idx_attendance_date
                ON attendance_records(record_date)
                """);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to initialize attendance tables", e);
        }

        log.info("Initialized attendance store");
    }

    @Override
    public void appendRecord(LocalDate date, AttendanceRecord record) {
        try {
            jdbcTemplate.update(
                "INSERT INTO attendance_records (label, record_date, record_time, timestamp, weekday, status, entry_kind) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                record.getLabel(),
                date.toString(),
                record.getTime().toString(),
                record.getTimestamp().toString(),
                record.getWeekday(),
                record.getStatus(),
                record.getEntryKind().name()
            );
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to append attendance record for " + record.getLabel(), e);
        }
    }

    @Override
    public List<AttendanceRecord> readPartition(LocalDate date) {
        try {
            return jdbcTemplate.query(
                "SELECT * FROM attendance_records WHERE record_date = ? ORDER BY id",
                new RecordRowMapper(),
                date.toString()
            );
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read attendance partition " + date, e);
        }
    }

    @Override
    public List<LocalDate> listPartitionDates() {
        try {
            return jdbcTemplate.queryForList(
                    "SELECT DISTINCT record_date FROM attendance_records ORDER BY record_date",
                    String.class)
                .stream()
                .map(LocalDate::parse)
                .toList();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to list attendance partitions", e);
        }
    }

    private static class RecordRowMapper implements RowMapper<AttendanceRecord> {
        @Override
        public AttendanceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AttendanceRecord.builder()
                .label(rs.getString("label"))
                .date(LocalDate.parse(rs.getString("record_date")))
                .time(LocalTime.parse(rs.getString("record_time")))
                .timestamp(LocalDateTime.parse(rs.getString("timestamp")))
                .weekday(rs.getString("weekday"))
                .status(rs.getString("status"))
                .entryKind(EntryKind.valueOf(rs.getString("entry_kind")))
                .build();
        }
    }
}
