package com.terminaldesigner.pool;

/** Object with a declared pixel extent. */
public interface SizedObject {

    int width();

    int height();
}
