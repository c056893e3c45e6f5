package com.dcruver.attendance.gallery;

import com.dcruver.attendance.domain.PersistenceException;

import java.util.Optional;

/**
 * Gallery store for tests. Can be told to fail the next saves.
 */
public class InMemoryGalleryStore implements GalleryStore {

    private GallerySnapshot saved;
    private int saveCount;
    private boolean failSaves;

    @Override
    public Optional<GallerySnapshot> load() {
        return Optional.ofNullable(saved);
    }

    @Override
    public void save(GallerySnapshot snapshot) {
        if (failSaves) {
            throw new PersistenceException("simulated save failure");
        }
        saved = snapshot;
        saveCount++;
    }

    public void setFailSaves(boolean failSaves) {
        this.failSaves = failSaves;
    }

    public int getSaveCount() {
        return saveCount;
    }

    public GallerySnapshot getSaved() {
        return saved;
    }
}
