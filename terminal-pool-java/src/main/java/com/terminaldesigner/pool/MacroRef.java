package com.terminaldesigner.pool;

import java.util.Objects;

/**
 * Binds an object event to a Macro object. Macro ids are 8-bit on the wire.
 */
public record MacroRef(Event event, int macroId) {

    public MacroRef {
        Objects.requireNonNull(event, "macro binding has no event");
        if (macroId < 0 || macroId > 255) {
            throw new IllegalArgumentException("Macro id out of range (0..255): " + macroId);
        }
    }
}
