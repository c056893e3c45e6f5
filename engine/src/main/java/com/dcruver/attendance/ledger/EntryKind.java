package com.dcruver.attendance.ledger;

/**
 * How a record entered the ledger. Only automatic records take part in daily dedup.
 */
public enum EntryKind {
    AUTOMATIC,
    MANUAL
}
