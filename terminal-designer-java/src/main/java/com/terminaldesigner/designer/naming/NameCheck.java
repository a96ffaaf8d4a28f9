package com.terminaldesigner.designer.naming;

import java.util.Optional;

/**
 * Outcome of validating a proposed object name. A rejected name carries a message and,
 * when the name is only taken, a free alternative.
 */
public record NameCheck(boolean valid, String message, String suggestion) {

    private static final NameCheck OK = new NameCheck(true, null, null);

    public static NameCheck ok() {
        return OK;
    }

    public static NameCheck rejected(String message) {
        return new NameCheck(false, message, null);
    }

    public static NameCheck taken(String message, String suggestion) {
        return new NameCheck(false, message, suggestion);
    }

    public Optional<String> suggestedName() {
        return Optional.ofNullable(suggestion);
    }
}
