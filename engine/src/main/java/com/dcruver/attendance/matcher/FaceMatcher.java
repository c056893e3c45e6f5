package com.dcruver.attendance.matcher;

import com.dcruver.attendance.domain.Embedding;
import com.dcruver.attendance.gallery.EmbeddingGallery;
import com.dcruver.attendance.gallery.GalleryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Nearest-neighbor classification of a face embedding against the gallery.
 *
 * Linear Euclidean scan over every stored embedding. The first entry in insertion
 * order wins a tie, and a distance equal to the tolerance is still a match.
 * An empty gallery always yields Unknown with confidence 0, whatever the tolerance.
 * Stored entries of the wrong dimension are skipped; {@link EmbeddingGallery#validate()}
 * reports them.
 */
@Component
@Slf4j
public class FaceMatcher {

    private final AtomicBoolean skipWarned = new AtomicBoolean();

    /**
     * Match one query against the current gallery contents
     */
    public MatchResult recognize(EmbeddingGallery gallery, Embedding query, double tolerance) {
        return gallery.withEntries(entries -> {
            if (entries.isEmpty()) {
                return MatchResult.emptyGallery();
            }
            gallery.requireDimension(query);
            return match(entries, query, tolerance, gallery.getDimension());
        });
    }

    /**
     * Match queries one by one, in input order, against a single view of the gallery
     */
    public List<MatchResult> recognizeBatch(EmbeddingGallery gallery, List<Embedding> queries, double tolerance) {
        return gallery.withEntries(entries -> {
            List<MatchResult> results = new ArrayList<>(queries.size());
            for (Embedding query : queries) {
                if (entries.isEmpty()) {
                    results.add(MatchResult.emptyGallery());
                    continue;
                }
                gallery.requireDimension(query);
                results.add(match(entries, query, tolerance, gallery.getDimension()));
            }
            return results;
        });
    }

    // A negative or NaN tolerance never satisfies distance <= tolerance, so it is not checked
    private MatchResult match(List<GalleryEntry> entries, Embedding query, double tolerance, int dimension) {
        int bestIndex = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        int skipped = 0;

        for (int i = 0; i < entries.size(); i++) {
            Embedding stored = entries.get(i).getEmbedding();
            if (stored.dimension() != dimension) {
                skipped++;
                continue;
            }
            double distance = stored.distanceTo(query);
            // Strict comparison keeps the earliest entry on ties
            if (distance < bestDistance) {
                bestDistance = distance;
                bestIndex = i;
            }
        }

        if (skipped > 0) {
            if (skipWarned.compareAndSet(false, true)) {
                log.warn("Skipping {} stored embeddings with dimension other than {}; run gallery validate",
                    skipped, dimension);
            } else {
                log.debug("Skipped {} stored embeddings with wrong dimension", skipped);
            }
        }

        if (bestIndex < 0) {
            log.warn("No comparable embedding found among {} entries", entries.size());
            return MatchResult.emptyGallery();
        }

        if (bestDistance <= tolerance) {
            String label = entries.get(bestIndex).getLabel();
            log.debug("Matched {} at distance {}", label, bestDistance);
            return MatchResult.known(label, bestDistance);
        }

        log.debug("No match within tolerance {} (closest distance {})", tolerance, bestDistance);
        return MatchResult.unknown(bestDistance);
    }
}
