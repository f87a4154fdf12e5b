package com.tracegroup.core.model;

import java.util.Objects;

/**
 * Typed value of a stat.
 *
 * Invariants:
 * - stringValue is non-null iff kind == STRING
 * - UINT values are stored in longValue with unsigned interpretation
 */
public record StatValue(
    Kind kind,
    long longValue,
    double doubleValue,
    String stringValue
) {
    public enum Kind {
        INT,
        UINT,
        DOUBLE,
        STRING
    }

    public StatValue {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.STRING) != (stringValue != null)) {
            throw new IllegalArgumentException("stringValue must be set only for STRING stats");
        }
    }

    public static StatValue ofInt(long value) {
        return new StatValue(Kind.INT, value, 0.0, null);
    }

    public static StatValue ofUint(long value) {
        return new StatValue(Kind.UINT, value, 0.0, null);
    }

    public static StatValue ofDouble(double value) {
        return new StatValue(Kind.DOUBLE, 0L, value, null);
    }

    public static StatValue ofString(String value) {
        return new StatValue(Kind.STRING, 0L, 0.0, Objects.requireNonNull(value, "value"));
    }

    public static StatValue ofBoolean(boolean value) {
        return ofInt(value ? 1 : 0);
    }

    public boolean isIntegral() {
        return kind == Kind.INT || kind == Kind.UINT;
    }

    /**
     * Integer view of the value, regardless of signedness.
     *
     * @throws IllegalStateException for string stats
     */
    public long intOrUintValue() {
        return switch (kind) {
            case INT, UINT -> longValue;
            case DOUBLE -> (long) doubleValue;
            case STRING -> throw new IllegalStateException("String stat has no integer value: " + stringValue);
        };
    }

    /**
     * Whether a flag stat is set (non-zero number).
     */
    public boolean isTrue() {
        return switch (kind) {
            case INT, UINT -> longValue != 0;
            case DOUBLE -> doubleValue != 0.0;
            case STRING -> false;
        };
    }

    /**
     * Key used when two stats must compare equal across events.
     * Integers compare numerically whatever their signedness tag.
     */
    public Object matchKey() {
        return switch (kind) {
            case INT, UINT -> longValue;
            case DOUBLE -> doubleValue;
            case STRING -> stringValue;
        };
    }

    public String asString() {
        return switch (kind) {
            case INT -> Long.toString(longValue);
            case UINT -> Long.toUnsignedString(longValue);
            case DOUBLE -> Double.toString(doubleValue);
            case STRING -> stringValue;
        };
    }
}
