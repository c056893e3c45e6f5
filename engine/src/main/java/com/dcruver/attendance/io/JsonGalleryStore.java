package com.dcruver.attendance.io;

import com.dcruver.attendance.domain.PersistenceException;
import com.dcruver.attendance.gallery.GallerySnapshot;
import com.dcruver.attendance.gallery.GalleryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the gallery snapshot in a single JSON file.
 * Saves go to a temporary sibling first and are moved over the old file.
 */
@Slf4j
public class JsonGalleryStore implements GalleryStore {

    private final ObjectMapper objectMapper;
    private final Path galleryFile;

    public JsonGalleryStore(Path dataDir, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.galleryFile = dataDir.resolve("gallery").resolve("gallery.json");
    }

    @Override
    public Optional<GallerySnapshot> load() {
        if (!Files.exists(galleryFile)) {
            return Optional.empty();
        }
        try {
            GallerySnapshot snapshot = objectMapper.readValue(galleryFile.toFile(), GallerySnapshot.class);
            log.debug("Read {} gallery entries from {}", snapshot.size(), galleryFile);
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read gallery from " + galleryFile, e);
        }
    }

    @Override
    public void save(GallerySnapshot snapshot) {
        Path tempFile = galleryFile.resolveSibling(galleryFile.getFileName() + ".tmp");
        try {
            Files.createDirectories(galleryFile.getParent());
            objectMapper.writeValue(tempFile.toFile(), snapshot);
            Files.move(tempFile, galleryFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved {} gallery entries to {}", snapshot.size(), galleryFile);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save gallery to " + galleryFile, e);
        }
    }

    public Path getGalleryFile() {
        return galleryFile;
    }
}
