package com.terminaldesigner.pool;

/**
 * Smallest mask and soft key designator geometry that fits every mask and key of a pool.
 */
public record MaskSizes(int maskSize, int softKeyWidth, int softKeyHeight) {}
