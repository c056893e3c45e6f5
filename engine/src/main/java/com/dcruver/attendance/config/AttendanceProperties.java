package com.dcruver.attendance.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Typed configuration for the gallery, matcher, ledger and reports.
 * Bound from the {@code attendance.*} namespace and validated once at startup.
 */
@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    /** Embedding dimension every gallery vector and query must have */
    private int dimension = 128;

    /** Maximum accepted distance when the caller does not pass one */
    private double defaultTolerance = 0.4;

    private int maxEmbeddingsPerIdentity = 15;

    private int historyDaysBack = 30;

    /** How many identities the statistics top list carries */
    private int topN = 10;

    /** Zone used to derive calendar days; blank means system default */
    private String zone = "";

    private String reportsDir = "${user.home}/.face-attendance/reports";

    private String backupDir = "${user.home}/.face-attendance/backups";

    private Storage storage = new Storage();

    @PostConstruct
    public void validate() {
        if (dimension <= 0) {
            throw new IllegalArgumentException("attendance.dimension must be positive, got " + dimension);
        }
        if (Double.isNaN(defaultTolerance) || defaultTolerance < 0) {
            throw new IllegalArgumentException("attendance.default-tolerance must be >= 0, got " + defaultTolerance);
        }
        if (maxEmbeddingsPerIdentity < 1) {
            throw new IllegalArgumentException(
                "attendance.max-embeddings-per-identity must be >= 1, got " + maxEmbeddingsPerIdentity);
        }
        if (historyDaysBack < 0) {
            throw new IllegalArgumentException("attendance.history-days-back must be >= 0, got " + historyDaysBack);
        }
        if (topN < 1) {
            throw new IllegalArgumentException("attendance.top-n must be >= 1, got " + topN);
        }
        if (storage == null || storage.getType() == null) {
            throw new IllegalArgumentException("attendance.storage.type is required");
        }
        zoneId();
    }

    public ZoneId zoneId() {
        if (zone == null || zone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("attendance.zone is not a valid zone id: " + zone, e);
        }
    }

    /**
     * Expand a leading ${user.home} left unresolved in a default and make the path absolute
     */
    public static Path resolvePath(String path) {
        return Paths.get(path.replace("${user.home}", System.getProperty("user.home"))).toAbsolutePath();
    }

    @Data
    public static class Storage {
        private StorageType type = StorageType.FILE;

        /** Root for the JSON gallery file and the daily attendance files */
        private String dataDir = "${user.home}/.face-attendance/data";

        private String databaseFile = "${user.home}/.face-attendance/attendance.db";
    }

    public enum StorageType {
        FILE,
        SQLITE
    }
}
