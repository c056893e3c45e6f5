package com.dcruver.attendance.domain;

import lombok.Getter;

/**
 * Thrown when a vector does not have the gallery's configured dimension.
 * Vectors are never truncated or padded.
 */
@Getter
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("Expected embedding of dimension %d but got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }
}
