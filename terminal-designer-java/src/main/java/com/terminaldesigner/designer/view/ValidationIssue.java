package com.terminaldesigner.designer.view;

import com.terminaldesigner.pool.NullableObjectId;

/**
 * One problem found in a pool. {@code objectId} is none for pool-wide issues.
 */
public record ValidationIssue(Kind kind, NullableObjectId objectId, String message) {

    public enum Kind {
        MISSING_REFERENCE,
        CHILD_NOT_ALLOWED,
        MISSING_MACRO,
        EVENT_NOT_POSSIBLE,
        NO_WORKING_SET,
        NO_DATA_MASK
    }

    @Override
    public String toString() {
        return kind + (objectId.isNone() ? "" : " [" + objectId + "]") + ": " + message;
    }
}
