package com.dcruver.attendance.gallery;

import com.dcruver.attendance.domain.Embedding;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One labeled embedding, in gallery insertion order.
 */
@Value
public class GalleryEntry {
    String label;
    Embedding embedding;

    @JsonCreator
    public GalleryEntry(@JsonProperty("label") String label,
                        @JsonProperty("embedding") Embedding embedding) {
        this.label = label;
        this.embedding = embedding;
    }
}
