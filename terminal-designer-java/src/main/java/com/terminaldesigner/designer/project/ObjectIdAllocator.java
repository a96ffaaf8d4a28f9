package com.terminaldesigner.designer.project;

import com.terminaldesigner.pool.ObjectId;
import com.terminaldesigner.pool.ObjectPool;

/**
 * Hands out object ids for new objects.
 *
 * A cursor moves upwards through the id space so consecutive allocations do not rescan the pool.
 * Once the cursor runs past the highest valid id, allocation falls back to the first gap from 1.
 * Id 0 is never allocated; it is conventionally the working set.
 */
public class ObjectIdAllocator {

    public static class IdSpaceExhaustedException extends RuntimeException {
        public IdSpaceExhaustedException(String msg) { super(msg); }
    }

    private int cursor = 1;

    public ObjectId allocate(ObjectPool pool) {
        while (cursor <= ObjectId.MAX_VALUE) {
            ObjectId candidate = ObjectId.of(cursor++);
            if (!pool.contains(candidate)) return candidate;
        }
        for (int value = 1; value <= ObjectId.MAX_VALUE; value++) {
            ObjectId candidate = ObjectId.of(value);
            if (!pool.contains(candidate)) {
                cursor = value + 1;
                return candidate;
            }
        }
        throw new IdSpaceExhaustedException("No free object id left in a pool of " + pool.size() + " objects");
    }

    /** Moves the cursor just past the highest id in use. */
    public void resync(ObjectPool pool) {
        cursor = pool.maxObjectId().map(id -> id.value() + 1).orElse(1);
    }

    int cursor() {
        return cursor;
    }
}
