package com.dcruver.attendance.gallery;

import com.dcruver.attendance.domain.DimensionMismatchException;
import com.dcruver.attendance.domain.Embedding;
import com.dcruver.attendance.matcher.MatchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Owns every (identity, embedding) pair used for matching.
 *
 * Readers share a read lock; add, remove, optimize and restore take the write lock.
 * Every write builds the new entry list, persists it through the {@link GalleryStore}
 * and only then swaps it in, so a failed save leaves the gallery as it was.
 */
@Slf4j
public class EmbeddingGallery {

    private final int dimension;
    private final GalleryStore store;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock
    private List<GalleryEntry> entries = List.of();
    private Map<String, Integer> countsByIdentity = Map.of();

    public EmbeddingGallery(int dimension, GalleryStore store) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
        this.store = store;
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Replace the in-memory gallery with whatever the store holds
     */
    public void load() {
        Optional<GallerySnapshot> loaded = store.load();
        if (loaded.isEmpty()) {
            log.info("No existing gallery found, starting fresh");
            return;
        }
        restore(loaded.get());
        log.info("Loaded {} embeddings for {} identities", size(), identityCount());
    }

    /**
     * Append embeddings under an identity. All vectors are checked before any is added.
     * The label {@value MatchResult#UNKNOWN} is reserved and rejected.
     */
    public void add(String identity, List<Embedding> embeddings) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity label must not be blank");
        }
        if (MatchResult.UNKNOWN.equals(identity)) {
            throw new IllegalArgumentException("'" + MatchResult.UNKNOWN + "' is reserved for unmatched faces");
        }
        for (Embedding embedding : embeddings) {
            requireDimension(embedding);
        }
        if (embeddings.isEmpty()) {
            log.debug("No embeddings supplied for {}, nothing to add", identity);
            return;
        }

        lock.writeLock().lock();
        try {
            List<GalleryEntry> updated = new ArrayList<>(entries.size() + embeddings.size());
            updated.addAll(entries);
            for (Embedding embedding : embeddings) {
                updated.add(new GalleryEntry(identity, embedding));
            }
            commit(updated);
            log.info("Added {} embeddings for {}", embeddings.size(), identity);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Delete every embedding owned by the identity.
     *
     * @return number of embeddings removed, 0 when the identity is unknown
     */
    public int remove(String identity) {
        lock.writeLock().lock();
        try {
            if (!countsByIdentity.containsKey(identity)) {
                log.debug("Identity {} not in gallery, nothing to remove", identity);
                return 0;
            }

            List<GalleryEntry> updated = new ArrayList<>(entries.size());
            for (GalleryEntry entry : entries) {
                if (!entry.getLabel().equals(identity)) {
                    updated.add(entry);
                }
            }
            int removed = entries.size() - updated.size();
            commit(updated);
            log.info("Removed {} embeddings for {}", removed, identity);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Keep only the first {@code maxPerIdentity} embeddings of each identity, in insertion order
     */
    public OptimizationResult optimize(int maxPerIdentity) {
        if (maxPerIdentity < 1) {
            throw new IllegalArgumentException("maxPerIdentity must be >= 1, got " + maxPerIdentity);
        }

        lock.writeLock().lock();
        try {
            int before = entries.size();
            Map<String, Integer> kept = new LinkedHashMap<>();
            List<GalleryEntry> updated = new ArrayList<>(before);

            for (GalleryEntry entry : entries) {
                int seen = kept.getOrDefault(entry.getLabel(), 0);
                if (seen < maxPerIdentity) {
                    updated.add(entry);
                    kept.put(entry.getLabel(), seen + 1);
                }
            }

            OptimizationResult result = new OptimizationResult(before, updated.size());
            if (result.isChanged()) {
                commit(updated);
            }
            log.info("Optimized gallery: {} -> {} embeddings", before, updated.size());
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Check stored dimensions, count bookkeeping and exact duplicates. Never mutates.
     */
    public GalleryValidationReport validate() {
        lock.readLock().lock();
        try {
            List<String> errors = new ArrayList<>();
            List<String> warnings = new ArrayList<>();

            for (int i = 0; i < entries.size(); i++) {
                int actual = entries.get(i).getEmbedding().dimension();
                if (actual != dimension) {
                    errors.add(String.format("Invalid embedding dimension at index %d: %d", i, actual));
                }
            }

            Map<String, Integer> actualCounts = countByIdentity(entries);
            if (!actualCounts.equals(countsByIdentity)) {
                errors.add("Mismatch between identity counts and stored embeddings");
            }
            int indexedTotal = countsByIdentity.values().stream().mapToInt(Integer::intValue).sum();
            if (indexedTotal != entries.size()) {
                errors.add(String.format("Indexed embedding total %d does not match stored total %d",
                    indexedTotal, entries.size()));
            }

            Set<Embedding> unique = new HashSet<>();
            for (GalleryEntry entry : entries) {
                unique.add(entry.getEmbedding());
            }
            if (unique.size() < entries.size()) {
                warnings.add(String.format("Duplicate embeddings detected (%d)", entries.size() - unique.size()));
            }

            return GalleryValidationReport.builder()
                .valid(errors.isEmpty())
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .totalEmbeddings(entries.size())
                .uniqueIdentities(actualCounts.size())
                .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public GallerySnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new GallerySnapshot(dimension, entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the whole gallery with a snapshot. Vectors are taken as they are;
     * wrong-dimension entries show up in {@link #validate()}.
     */
    public void restore(GallerySnapshot snapshot) {
        if (snapshot.getDimension() != dimension) {
            log.warn("Restoring snapshot of dimension {} into gallery of dimension {}",
                snapshot.getDimension(), dimension);
        }

        lock.writeLock().lock();
        try {
            entries = List.copyOf(snapshot.getEntries());
            countsByIdentity = Collections.unmodifiableMap(countByIdentity(entries));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Run a read-only computation against a consistent view of the entries
     */
    public <T> T withEntries(Function<List<GalleryEntry>, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public GalleryStats stats() {
        lock.readLock().lock();
        try {
            return GalleryStats.builder()
                .totalEmbeddings(entries.size())
                .identityCount(countsByIdentity.size())
                .embeddingsPerIdentity(countsByIdentity)
                .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String identity) {
        lock.readLock().lock();
        try {
            return countsByIdentity.containsKey(identity);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int identityCount() {
        lock.readLock().lock();
        try {
            return countsByIdentity.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void requireDimension(Embedding embedding) {
        if (embedding.dimension() != dimension) {
            throw new DimensionMismatchException(dimension, embedding.dimension());
        }
    }

    // Caller holds the write lock
    private void commit(List<GalleryEntry> updated) {
        List<GalleryEntry> frozen = List.copyOf(updated);
        store.save(new GallerySnapshot(dimension, frozen));
        entries = frozen;
        countsByIdentity = Collections.unmodifiableMap(countByIdentity(frozen));
    }

    private static Map<String, Integer> countByIdentity(List<GalleryEntry> source) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GalleryEntry entry : source) {
            counts.merge(entry.getLabel(), 1, Integer::sum);
        }
        return counts;
    }
}
