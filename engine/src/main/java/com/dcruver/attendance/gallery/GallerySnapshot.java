package com.dcruver.attendance.gallery;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Storage-independent copy of the full gallery.
 * Stored as JSON by the file store and row by row by the SQLite store.
 */
@Data
public class GallerySnapshot {
    private final int dimension;
    private final List<GalleryEntry> entries;

    @JsonCreator
    public GallerySnapshot(
            @JsonProperty("dimension") int dimension,
            @JsonProperty("entries") List<GalleryEntry> entries) {
        this.dimension = dimension;
        this.entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static GallerySnapshot empty(int dimension) {
        return new GallerySnapshot(dimension, List.of());
    }

    public int size() {
        return entries.size();
    }
}
