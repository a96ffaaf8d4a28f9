package com.terminaldesigner.pool;

/**
 * Virtual Terminal version a pool is designed for.
 * Version 3 is the oldest version the designer supports; each later version only adds features.
 */
public enum VtVersion {
    VERSION_3(3),
    VERSION_4(4),
    VERSION_5(5),
    VERSION_6(6);

    private final int number;

    VtVersion(int number) {
        this.number = number;
    }

    public int number() { return number; }

    public boolean atLeast(VtVersion other) {
        return compareTo(other) >= 0;
    }

    public static VtVersion fromNumber(int number) {
        for (VtVersion v : values()) {
            if (v.number == number) return v;
        }
        throw new IllegalArgumentException("Unsupported VT version: " + number);
    }
}
