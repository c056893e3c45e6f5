package com.dcruver.attendance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the face attendance engine.
 *
 * Matches face embeddings supplied by an external extractor against a gallery of
 * known identities and keeps a duplicate-free, date-partitioned attendance ledger.
 * Operations are exposed as shell commands.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class FaceAttendanceApplication {

    public static void main(String[] args) {
        log.info("Starting Face Attendance...");
        SpringApplication.run(FaceAttendanceApplication.class, args);
    }
}
