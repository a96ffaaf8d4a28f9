package com.terminaldesigner.pool;

import java.util.Optional;

/**
 * Reference to an object that may be absent. {@code id} is null for {@link #NONE}.
 */
public record NullableObjectId(ObjectId id) {

    public static final NullableObjectId NONE = new NullableObjectId(null);

    public static NullableObjectId of(int value) {
        return value == ObjectId.NULL_VALUE ? NONE : new NullableObjectId(ObjectId.of(value));
    }

    public static NullableObjectId of(ObjectId id) {
        return id == null ? NONE : new NullableObjectId(id);
    }

    public boolean isNone() { return id == null; }

    public Optional<ObjectId> asOptional() { return Optional.ofNullable(id); }

    /** Value as written on the wire: the id, or 65535 for none. */
    public int wireValue() {
        return id == null ? ObjectId.NULL_VALUE : id.value();
    }

    @Override
    public String toString() {
        return id == null ? "None" : id.toString();
    }
}
