package com.dcruver.attendance.gallery;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of an integrity check over the gallery.
 * Errors make the gallery invalid, warnings do not.
 */
@Data
@Builder
public class GalleryValidationReport {
    private final boolean valid;
    private final List<String> errors;
    private final List<String> warnings;
    private final int totalEmbeddings;
    private final int uniqueIdentities;
}
