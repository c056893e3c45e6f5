package com.dcruver.attendance.io;

import com.dcruver.attendance.domain.Embedding;
import com.dcruver.attendance.domain.PersistenceException;
import com.dcruver.attendance.gallery.GalleryEntry;
import com.dcruver.attendance.gallery.GallerySnapshot;
import com.dcruver.attendance.gallery.GalleryStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores gallery embeddings in SQLite, one row per embedding, ordered by position.
 * A save replaces every row inside a single transaction.
 */
@Slf4j
public class SqliteGalleryStore implements GalleryStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public SqliteGalleryStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = objectMapper;
    }

    public void init() {
        try {
            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS gallery_embeddings (
                    position INTEGER PRIMARY KEY,
                    label TEXT NOT NULL,
                    embedding_json TEXT NOT NULL
                )
                """);

            jdbcTemplate.execute("""
                CREATE INDEX IF NOT EXISTS idx_gallery_label
                ON gallery_embeddings(label)
                """);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to initialize gallery tables", e);
        }

        log.info("Initialized gallery store");
    }

    @Override
    public Optional<GallerySnapshot> load() {
        try {
            List<GalleryEntry> entries = jdbcTemplate.query(
                "SELECT label, embedding_json FROM gallery_embeddings ORDER BY position",
                (rs, rowNum) -> {
                    try {
                        double[] values = objectMapper.readValue(rs.getString("embedding_json"), double[].class);
                        return new GalleryEntry(rs.getString("label"), Embedding.of(values));
                    } catch (JsonProcessingException e) {
                        throw new SQLException("Failed to deserialize embedding", e);
                    }
                }
            );

            if (entries.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new GallerySnapshot(entries.get(0).getEmbedding().dimension(), entries));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load gallery", e);
        }
    }

    @Override
    public void save(GallerySnapshot snapshot) {
        List<Object[]> rows = new ArrayList<>(snapshot.size());
        try {
            List<GalleryEntry> entries = snapshot.getEntries();
            for (int i = 0; i < entries.size(); i++) {
                GalleryEntry entry = entries.get(i);
                rows.add(new Object[]{i, entry.getLabel(), objectMapper.writeValueAsString(entry.getEmbedding())});
            }
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize gallery", e);
        }

        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM gallery_embeddings");
                jdbcTemplate.batchUpdate(
                    "INSERT INTO gallery_embeddings (position, label, embedding_json) VALUES (?, ?, ?)",
                    rows
                );
            });
            log.debug("Saved {} gallery entries", rows.size());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save gallery", e);
        }
    }
}
