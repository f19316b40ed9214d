package com.underscoreresearch.keystore.store;

import lombok.EqualsAndHashCode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.underscoreresearch.keystore.errors.GenerationExhaustedException;

/**
 * Unsigned 16 bit password epoch. Used as a fencing token, a mask is only accepted by a store sitting at the
 * generation right before the one the mask targets.
 */
@EqualsAndHashCode
public final class GenerationCounter implements Comparable<GenerationCounter> {
    public static final int MAX_VALUE = 0xFFFF;
    public static final GenerationCounter ZERO = new GenerationCounter(0);

    private final int value;

    private GenerationCounter(int value) {
        this.value = value;
    }

    @JsonCreator
    public static GenerationCounter of(int value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Generation must be between 0 and " + MAX_VALUE);
        }
        return value == 0 ? ZERO : new GenerationCounter(value);
    }

    public static GenerationCounter parse(String value) {
        try {
            return of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid generation \"" + value + "\"", exc);
        }
    }

    @JsonValue
    public int getValue() {
        return value;
    }

    public GenerationCounter next() throws GenerationExhaustedException {
        if (value == MAX_VALUE) {
            throw new GenerationExhaustedException(value);
        }
        return new GenerationCounter(value + 1);
    }

    public boolean isSuccessorOf(GenerationCounter previous) {
        return value == previous.value + 1;
    }

    @Override
    public int compareTo(GenerationCounter other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
