package com.terminaldesigner.pool;

/**
 * Numeric id of an object in a pool. Valid range is 0..65534; 65535 is the wire value for "no object".
 */
public record ObjectId(int value) implements Comparable<ObjectId> {

    public static final int MAX_VALUE = 0xFFFE;
    public static final int NULL_VALUE = 0xFFFF;

    public ObjectId {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Object id out of range (0.." + MAX_VALUE + "): " + value);
        }
    }

    public static ObjectId of(int value) {
        return new ObjectId(value);
    }

    @Override
    public int compareTo(ObjectId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
