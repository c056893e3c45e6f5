package com.dcruver.attendance.app;

import com.dcruver.attendance.config.AttendanceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for SQLite data source.
 * Connections are opened lazily, so nothing touches the file unless SQLite storage is selected.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(AttendanceProperties properties) throws Exception {
        // Ensure parent directory exists
        Path dbPath = AttendanceProperties.resolvePath(properties.getStorage().getDatabaseFile());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("busy_timeout", "5000");

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        dataSource.setConnectionProperties(connectionProperties);

        return dataSource;
    }
}
