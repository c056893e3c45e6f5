package com.dcruver.attendance.gallery;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Registered identities and their embedding counts.
 */
@Data
@Builder
public class GalleryStats {
    private final int totalEmbeddings;
    private final int identityCount;
    private final Map<String, Integer> embeddingsPerIdentity;  // first-seen order
}
