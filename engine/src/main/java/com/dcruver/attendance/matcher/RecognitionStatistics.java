package com.dcruver.attendance.matcher;

import lombok.Builder;
import lombok.Data;
import org.springframework.stereotype.Component;

/**
 * Running recognition counters for the lifetime of the application.
 */
@Component
public class RecognitionStatistics {

    private long total;
    private long successful;
    private long unknown;
    private double confidenceSum;

    public synchronized void record(MatchResult result) {
        total++;
        if (result.isKnown()) {
            successful++;
            confidenceSum += result.getConfidence();
        } else {
            unknown++;
        }
    }

    public synchronized Snapshot snapshot() {
        if (total == 0) {
            return Snapshot.builder().build();
        }
        return Snapshot.builder()
            .totalRecognitions(total)
            .successfulRecognitions(successful)
            .unknownFaces(unknown)
            .successRate(successful * 100.0 / total)
            .unknownRate(unknown * 100.0 / total)
            .averageConfidence(successful > 0 ? confidenceSum / successful : 0.0)
            .build();
    }

    @Data
    @Builder
    public static class Snapshot {
        private final long totalRecognitions;
        private final long successfulRecognitions;
        private final long unknownFaces;
        private final double successRate;
        private final double unknownRate;
        private final double averageConfidence;
    }
}
