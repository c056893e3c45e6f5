package com.dcruver.attendance.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable fixed-length face embedding.
 * Values are copied on the way in and on the way out.
 */
public final class Embedding {

    private final double[] values;

    private Embedding(double[] values) {
        this.values = values;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Embedding of(double... values) {
        if (values == null) {
            throw new IllegalArgumentException("Embedding values must not be null");
        }
        return new Embedding(values.clone());
    }

    public static Embedding of(List<? extends Number> values) {
        double[] copy = new double[values.size()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = values.get(i).doubleValue();
        }
        return new Embedding(copy);
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    @JsonValue
    public double[] toArray() {
        return values.clone();
    }

    /**
     * Euclidean distance to another embedding of the same dimension
     */
    public double distanceTo(Embedding other) {
        if (other.values.length != values.length) {
            throw new DimensionMismatchException(values.length, other.values.length);
        }

        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            double diff = values[i] - other.values[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Embedding)) {
            return false;
        }
        return Arrays.equals(values, ((Embedding) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Embedding[dim=" + values.length + "]";
    }
}
