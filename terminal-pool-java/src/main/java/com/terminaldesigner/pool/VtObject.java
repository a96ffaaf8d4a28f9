package com.terminaldesigner.pool;

import java.util.List;

/**
 * One object of a pool. Implementations are immutable records from {@link VtObjects};
 * editing an object means replacing it in the pool with an edited copy.
 */
public interface VtObject {

    ObjectId id();

    ObjectType type();

    /** Copy of this object carrying {@code newId}. References held by other objects are not touched. */
    VtObject withId(ObjectId newId);

    /**
     * Every object id this object points at, in field order: positioned children, plain id lists,
     * attribute references and non-null nullable references. Macro bindings are not included.
     */
    default List<ObjectId> referencedObjects() {
        return List.of();
    }

    /**
     * The subset of {@link #referencedObjects()} that the object nests as children
     * and that the relationship rules apply to.
     */
    default List<ObjectId> childObjects() {
        return List.of();
    }

    /** Positioned children, empty for kinds that do not lay out children. */
    default List<ObjectRef> objectRefs() {
        return List.of();
    }

    default List<MacroRef> macroRefs() {
        return List.of();
    }
}
