package com.dcruver.attendance.gallery;

import lombok.Value;

@Value
public class OptimizationResult {
    int embeddingsBefore;
    int embeddingsAfter;

    public int getRemoved() {
        return embeddingsBefore - embeddingsAfter;
    }

    public boolean isChanged() {
        return embeddingsBefore != embeddingsAfter;
    }
}
