package com.dcruver.attendance.ledger;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class SessionStats {
    private final LocalDateTime sessionStart;
    private final double sessionDurationMinutes;
    private final int totalCheckIns;
    private final int duplicateAttempts;
    private final int todayMarkedIdentities;
}
