package com.terminaldesigner.designer.info;

import com.terminaldesigner.pool.VtObject;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Editor-side metadata for one object.
 *
 * The object id can be changed by the user, so the editor identifies an object by
 * {@link #uniqueId()} instead, which is assigned once and never changes.
 */
public class ObjectInfo {

    private final UUID uniqueId;
    private String name;

    public ObjectInfo() {
        this(UUID.randomUUID(), null);
    }

    ObjectInfo(UUID uniqueId, String name) {
        this.uniqueId = uniqueId;
        this.name = name;
    }

    public static ObjectInfo forObject(VtObject object) {
        return new ObjectInfo();
    }

    public UUID uniqueId() {
        return uniqueId;
    }

    /** The assigned name, or {@code "{id}: {Type}"} when none is set. */
    public String getName(VtObject object) {
        return name != null ? name : defaultName(object);
    }

    /** Empty names are ignored. */
    public void setName(String newName) {
        if (newName != null && !newName.isEmpty()) {
            this.name = newName;
        }
    }

    public Optional<String> customName() {
        return Optional.ofNullable(name);
    }

    public boolean hasCustomName() {
        return name != null;
    }

    public static String defaultName(VtObject object) {
        return object.id().value() + ": " + object.type().label();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectInfo other)) return false;
        return uniqueId.equals(other.uniqueId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uniqueId);
    }

    @Override
    public String toString() {
        return "ObjectInfo[" + uniqueId + (name != null ? ", " + name : "") + "]";
    }
}
