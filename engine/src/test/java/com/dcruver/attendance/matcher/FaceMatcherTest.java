package com.dcruver.attendance.matcher;

import com.dcruver.attendance.domain.DimensionMismatchException;
import com.dcruver.attendance.domain.Embedding;
import com.dcruver.attendance.gallery.EmbeddingGallery;
import com.dcruver.attendance.gallery.GalleryEntry;
import com.dcruver.attendance.gallery.GallerySnapshot;
import com.dcruver.attendance.gallery.InMemoryGalleryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dcruver.attendance.domain.TestEmbeddings.*;
import static org.junit.jupiter.api.Assertions.*;

class FaceMatcherTest {

    private static final double EPS = 1e-9;

    private EmbeddingGallery gallery;
    private FaceMatcher matcher;

    @BeforeEach
    void setUp() {
        gallery = new EmbeddingGallery(DIM, new InMemoryGalleryStore());
        matcher = new FaceMatcher();
    }

    @Test
    void testEmptyGalleryIsUnknownWithZeroConfidence() {
        MatchResult result = matcher.recognize(gallery, zeros(), 0.6);

        assertEquals(MatchResult.UNKNOWN, result.getLabel());
        assertEquals(0.0, result.getConfidence());
        assertFalse(result.isKnown());
    }

    @Test
    void testEmptyGalleryDoesNotCheckDimension() {
        MatchResult result = matcher.recognize(gallery, ofDimension(3), 0.6);
        assertFalse(result.isKnown());
    }

    @Test
    void testExactMatchHasFullConfidence() {
        gallery.add("Alice", List.of(zeros()));

        MatchResult result = matcher.recognize(gallery, zeros(), 0.6);

        assertEquals("Alice", result.getLabel());
        assertEquals(1.0, result.getConfidence(), EPS);
        assertEquals(0.0, result.getDistance(), EPS);
    }

    @Test
    void testPicksNearestIdentity() {
        gallery.add("Alice", List.of(spike(0, 1.0)));
        gallery.add("Bob", List.of(spike(1, 1.0)));

        MatchResult result = matcher.recognize(gallery, spike(1, 0.9), 0.6);

        assertEquals("Bob", result.getLabel());
        assertEquals(0.9, result.getConfidence(), EPS);
    }

    @Test
    void testTieGoesToEarliestEntry() {
        gallery.add("Alice", List.of(spike(0, 0.2)));
        gallery.add("Bob", List.of(spike(0, -0.2)));

        MatchResult result = matcher.recognize(gallery, zeros(), 0.6);

        assertEquals("Alice", result.getLabel());
    }

    @Test
    void testDistanceEqualToToleranceStillMatches() {
        gallery.add("Alice", List.of(spike(0, 0.5)));

        MatchResult atBoundary = matcher.recognize(gallery, zeros(), 0.5);
        MatchResult below = matcher.recognize(gallery, zeros(), 0.49);

        assertEquals("Alice", atBoundary.getLabel());
        assertFalse(below.isKnown());
    }

    @Test
    void testUnknownConfidenceIsNotClamped() {
        gallery.add("Alice", List.of(spike(0, 3.0)));

        MatchResult result = matcher.recognize(gallery, zeros(), 0.6);

        assertFalse(result.isKnown());
        assertEquals(3.0, result.getDistance(), EPS);
        assertEquals(-2.0, result.getConfidence(), EPS);
    }

    @Test
    void testToleranceIsMonotonic() {
        gallery.add("Alice", List.of(spike(0, 0.3)));
        gallery.add("Bob", List.of(spike(1, 0.7)));

        double[] tolerances = {0.0, 0.2, 0.3, 0.5, 0.8, 2.0};
        boolean seenKnown = false;
        for (double tolerance : tolerances) {
            boolean known = matcher.recognize(gallery, zeros(), tolerance).isKnown();
            if (seenKnown) {
                assertTrue(known, "Match lost when tolerance grew to " + tolerance);
            }
            seenKnown |= known;
        }
        assertTrue(seenKnown);
    }

    @Test
    void testZeroToleranceOnlyMatchesExactVectors() {
        gallery.add("Alice", List.of(spike(0, 0.01)));

        assertFalse(matcher.recognize(gallery, zeros(), 0.0).isKnown());
        assertTrue(matcher.recognize(gallery, spike(0, 0.01), 0.0).isKnown());
    }

    @Test
    void testRejectsWrongDimensionQuery() {
        gallery.add("Alice", List.of(zeros()));

        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
            () -> matcher.recognize(gallery, ofDimension(64), 0.6));
        assertEquals(DIM, e.getExpected());
        assertEquals(64, e.getActual());
    }

    @Test
    void testEmptyGalleryIgnoresTolerance() {
        for (double tolerance : new double[]{-0.1, Double.NaN, 0.0, 10.0}) {
            MatchResult result = matcher.recognize(gallery, zeros(), tolerance);
            assertEquals(MatchResult.UNKNOWN, result.getLabel());
            assertEquals(0.0, result.getConfidence());
        }
        assertEquals(0.0, matcher.recognizeBatch(gallery, List.of(zeros()), -1.0).get(0).getConfidence());
    }

    @Test
    void testNegativeOrNaNToleranceNeverMatches() {
        gallery.add("Alice", List.of(zeros()));

        MatchResult negative = matcher.recognize(gallery, zeros(), -0.1);
        MatchResult nan = matcher.recognize(gallery, zeros(), Double.NaN);

        assertFalse(negative.isKnown());
        assertFalse(nan.isKnown());
        assertEquals(1.0, negative.getConfidence(), EPS);
    }

    @Test
    void testStoredEntryOfWrongDimensionIsSkipped() {
        gallery.restore(new GallerySnapshot(DIM, List.of(
            new GalleryEntry("Alice", spike(0, 0.1)),
            new GalleryEntry("Broken", Embedding.of(1.0, 2.0)))));

        MatchResult result = matcher.recognize(gallery, spike(0, 0.1), 0.4);

        assertEquals("Alice", result.getLabel());
        assertEquals(1.0, result.getConfidence(), EPS);
        assertFalse(gallery.validate().isValid());
    }

    @Test
    void testOnlyWrongDimensionEntriesGiveUnknown() {
        gallery.restore(new GallerySnapshot(DIM, List.of(new GalleryEntry("Broken", Embedding.of(1.0, 2.0)))));

        MatchResult result = matcher.recognize(gallery, zeros(), 0.4);

        assertEquals(MatchResult.UNKNOWN, result.getLabel());
        assertEquals(0.0, result.getConfidence());
    }

    @Test
    void testRemovedIdentityIsNeverReturned() {
        gallery.add("Alice", List.of(zeros()));
        gallery.add("Bob", List.of(spike(0, 0.3)));
        gallery.remove("Alice");

        MatchResult result = matcher.recognize(gallery, zeros(), 0.6);

        assertEquals("Bob", result.getLabel());
    }

    @Test
    void testBatchPreservesInputOrder() {
        gallery.add("Alice", List.of(spike(0, 1.0)));
        gallery.add("Bob", List.of(spike(1, 1.0)));

        List<MatchResult> results = matcher.recognizeBatch(gallery,
            List.of(spike(1, 1.0), spike(5, 1.0), spike(0, 1.0)), 0.6);

        assertEquals(3, results.size());
        assertEquals("Bob", results.get(0).getLabel());
        assertFalse(results.get(1).isKnown());
        assertEquals("Alice", results.get(2).getLabel());
    }

    @Test
    void testBatchOnEmptyGallery() {
        List<MatchResult> results = matcher.recognizeBatch(gallery, List.of(zeros(), zeros()), 0.6);

        assertEquals(2, results.size());
        results.forEach(r -> assertEquals(0.0, r.getConfidence()));
    }
}
