package com.terminaldesigner.pool;

/** Pixel offset of a child relative to its parent. */
public record Point(int x, int y) {

    public static final Point ORIGIN = new Point(0, 0);
}
