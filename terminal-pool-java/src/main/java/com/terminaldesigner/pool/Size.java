package com.terminaldesigner.pool;

/** Pixel extent of an object's content. */
public record Size(int width, int height) {

    public static final Size EMPTY = new Size(0, 0);

    public Size union(int x, int y, Size child) {
        return new Size(Math.max(width, x + child.width), Math.max(height, y + child.height));
    }
}
