package com.dcruver.attendance.io;

import com.dcruver.attendance.domain.Embedding;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads embeddings produced by an external extractor from a JSON file.
 * Accepts a single array of numbers or an array of such arrays.
 */
public class EmbeddingFileReader {

    private final ObjectMapper objectMapper;

    public EmbeddingFileReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Embedding> read(Path file) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of numbers or of arrays in " + file);
        }

        List<Embedding> embeddings = new ArrayList<>();
        if (root.size() > 0 && root.get(0).isArray()) {
            for (JsonNode vector : root) {
                embeddings.add(toEmbedding(vector, file));
            }
        } else {
            embeddings.add(toEmbedding(root, file));
        }
        return embeddings;
    }

    private Embedding toEmbedding(JsonNode vector, Path file) throws IOException {
        if (!vector.isArray()) {
            throw new IOException("Mixed vector and scalar entries in " + file);
        }
        double[] values = new double[vector.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = vector.get(i);
            if (!value.isNumber()) {
                throw new IOException(String.format("Non-numeric value at position %d in %s", i, file));
            }
            values[i] = value.asDouble();
        }
        return Embedding.of(values);
    }
}
