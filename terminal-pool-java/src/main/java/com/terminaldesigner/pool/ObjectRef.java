package com.terminaldesigner.pool;

import java.util.Objects;

/**
 * Positioned reference from a parent to a child object.
 */
public record ObjectRef(ObjectId id, Point offset) {

    public ObjectRef {
        Objects.requireNonNull(id, "object reference has no id");
        if (offset == null) offset = Point.ORIGIN;
    }

    public static ObjectRef at(int id, int x, int y) {
        return new ObjectRef(ObjectId.of(id), new Point(x, y));
    }

    public ObjectRef withId(ObjectId newId) {
        return new ObjectRef(newId, offset);
    }
}
