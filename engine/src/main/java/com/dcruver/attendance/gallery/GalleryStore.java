package com.dcruver.attendance.gallery;

import java.util.Optional;

/**
 * Persistence contract for the gallery.
 * Implementations throw {@link com.dcruver.attendance.domain.PersistenceException} on failure.
 */
public interface GalleryStore {

    /**
     * Load the last saved snapshot, or empty when nothing has been saved yet
     */
    Optional<GallerySnapshot> load();

    /**
     * Replace the stored gallery with the snapshot
     */
    void save(GallerySnapshot snapshot);
}
