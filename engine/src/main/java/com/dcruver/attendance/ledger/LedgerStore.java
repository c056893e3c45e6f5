package com.dcruver.attendance.ledger;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistence contract for date-partitioned attendance records.
 * Implementations throw {@link com.dcruver.attendance.domain.PersistenceException} on failure.
 */
public interface LedgerStore {

    /**
     * Durably append a record to the partition of {@code date}
     */
    void appendRecord(LocalDate date, AttendanceRecord record);

    /**
     * Records of one date in append order; empty when the date has no partition
     */
    List<AttendanceRecord> readPartition(LocalDate date);

    /**
     * Dates that have a stored partition, ascending
     */
    List<LocalDate> listPartitionDates();
}
