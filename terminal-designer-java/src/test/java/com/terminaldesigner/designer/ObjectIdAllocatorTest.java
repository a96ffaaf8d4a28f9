package com.terminaldesigner.designer;

import com.terminaldesigner.designer.project.ObjectIdAllocator;
import com.terminaldesigner.pool.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObjectIdAllocatorTest {

    private static VtObjects.NumberVariable variable(int id) {
        return new VtObjects.NumberVariable(ObjectId.of(id), 0);
    }

    @Test
    void allocatesFromOneInEmptyPool() {
        assertEquals(ObjectId.of(1), new ObjectIdAllocator().allocate(new ObjectPool()));
    }

    @Test
    void skipsIdsInUse() {
        ObjectPool pool = new ObjectPool(List.of(variable(1), variable(2), variable(4)));
        ObjectIdAllocator allocator = new ObjectIdAllocator();

        assertEquals(ObjectId.of(3), allocator.allocate(pool));
        pool.add(variable(3));
        assertEquals(ObjectId.of(5), allocator.allocate(pool));
    }

    @Test
    void resyncMovesPastHighestId() {
        ObjectPool pool = new ObjectPool(List.of(variable(1), variable(500)));
        ObjectIdAllocator allocator = new ObjectIdAllocator();
        allocator.resync(pool);

        assertEquals(ObjectId.of(501), allocator.allocate(pool));
    }

    @Test
    void wrapsAroundToFirstGap() {
        ObjectPool pool = new ObjectPool(List.of(variable(1), variable(ObjectId.MAX_VALUE)));
        ObjectIdAllocator allocator = new ObjectIdAllocator();
        allocator.resync(pool);

        assertEquals(ObjectId.of(2), allocator.allocate(pool));
    }

    @Test
    void fullPoolThrows() {
        List<VtObject> all = new ArrayList<>();
        for (int id = 0; id <= ObjectId.MAX_VALUE; id++) {
            all.add(variable(id));
        }
        ObjectPool pool = new ObjectPool(all);

        assertThrows(ObjectIdAllocator.IdSpaceExhaustedException.class, () -> new ObjectIdAllocator().allocate(pool));
    }
}
