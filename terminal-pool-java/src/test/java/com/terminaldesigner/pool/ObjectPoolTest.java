package com.terminaldesigner.pool;

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObjectPoolTest {

    private static VtObjects.DataMask dataMask(int id, ObjectRef... refs) {
        return new VtObjects.DataMask(ObjectId.of(id), 0, NullableObjectId.NONE, List.of(refs), List.of());
    }

    private static VtObjects.Container container(int id, int w, int h, ObjectRef... refs) {
        return new VtObjects.Container(ObjectId.of(id), w, h, false, List.of(refs), List.of());
    }

    private static VtObjects.OutputString label(int id, int w, int h) {
        return new VtObjects.OutputString(ObjectId.of(id), w, h, 0, ObjectId.of(900), 0,
                NullableObjectId.NONE, 0, "label", List.of());
    }

    private static VtObjects.Key key(int id, ObjectRef... refs) {
        return new VtObjects.Key(ObjectId.of(id), 0, 0, List.of(refs), List.of());
    }

    @Test
    void objectByIdFindsAddedObject() {
        ObjectPool pool = new ObjectPool();
        pool.add(dataMask(5));

        assertTrue(pool.contains(ObjectId.of(5)));
        assertEquals(ObjectType.DATA_MASK, pool.objectById(ObjectId.of(5)).orElseThrow().type());
        assertTrue(pool.objectById(ObjectId.of(6)).isEmpty());
        assertTrue(pool.objectById(NullableObjectId.NONE).isEmpty());
    }

    @Test
    void addWithExistingIdReplacesInPlace() {
        ObjectPool pool = new ObjectPool(List.of(label(1, 10, 10), label(2, 10, 10)));
        pool.add(label(1, 50, 50));

        assertEquals(2, pool.size());
        assertEquals(ObjectId.of(1), pool.objects().get(0).id());
        assertEquals(50, ((VtObjects.OutputString) pool.objects().get(0)).width());
    }

    @Test
    void duplicateIdsInInitialCollectionKeepFirst() {
        ObjectPool pool = new ObjectPool(List.of(label(1, 10, 10), label(1, 99, 99)));
        assertEquals(1, pool.size());
        assertEquals(10, ((VtObjects.OutputString) pool.objects().get(0)).width());
    }

    @Test
    void removeLeavesReferencesDangling() {
        ObjectPool pool = new ObjectPool(List.of(dataMask(1, ObjectRef.at(2, 0, 0)), label(2, 10, 10)));
        pool.remove(ObjectId.of(2));

        assertFalse(pool.contains(ObjectId.of(2)));
        assertEquals(List.of(ObjectId.of(2)), pool.objectById(ObjectId.of(1)).orElseThrow().referencedObjects());
    }

    @Test
    void replaceUnknownIdLeavesPoolUnchanged() {
        ObjectPool pool = new ObjectPool(List.of(label(1, 10, 10)));
        assertFalse(pool.replace(label(7, 10, 10)));
        assertEquals(1, pool.size());
    }

    @Test
    void replaceWithNewIdKeepsPosition() {
        ObjectPool pool = new ObjectPool(List.of(label(1, 10, 10), label(2, 10, 10), label(3, 10, 10)));
        VtObject renumbered = pool.objectById(ObjectId.of(2)).orElseThrow().withId(ObjectId.of(20));

        assertTrue(pool.replace(ObjectId.of(2), renumbered));
        assertEquals(List.of(ObjectId.of(1), ObjectId.of(20), ObjectId.of(3)),
                pool.objects().stream().map(VtObject::id).toList());
    }

    @Test
    void replaceRefusesToOverwriteAnotherObject() {
        ObjectPool pool = new ObjectPool(List.of(label(1, 10, 10), label(2, 10, 10)));
        assertFalse(pool.replace(ObjectId.of(1), label(2, 99, 99)));
        assertEquals(10, ((VtObjects.OutputString) pool.objectById(ObjectId.of(2)).orElseThrow()).width());
    }

    @Test
    void parentObjectsListsEveryReferrer() {
        ObjectPool pool = new ObjectPool(List.of(
                dataMask(1, ObjectRef.at(3, 0, 0)),
                container(2, 50, 50, ObjectRef.at(3, 5, 5)),
                label(3, 10, 10)));

        List<ObjectId> parents = pool.parentObjects(ObjectId.of(3)).stream().map(VtObject::id).toList();
        assertEquals(List.of(ObjectId.of(1), ObjectId.of(2)), parents);
    }

    @Test
    void equalityIsOrderSensitive() {
        ObjectPool a = new ObjectPool(List.of(label(1, 10, 10), label(2, 10, 10)));
        ObjectPool b = new ObjectPool(List.of(label(2, 10, 10), label(1, 10, 10)));
        ObjectPool c = new ObjectPool(List.of(label(1, 10, 10), label(2, 10, 10)));

        assertNotEquals(a, b);
        assertEquals(a, c);
        assertEquals(a.hashCode(), c.hashCode());
    }

    @Test
    void copyIsIndependent() {
        ObjectPool original = new ObjectPool(List.of(label(1, 10, 10)));
        ObjectPool copy = original.copy();
        copy.add(label(2, 10, 10));

        assertEquals(1, original.size());
        assertNotEquals(original, copy);
    }

    @Test
    void sortObjectsByReordersPool() {
        ObjectPool pool = new ObjectPool(List.of(label(3, 1, 1), dataMask(1), label(2, 1, 1)));
        pool.sortObjectsBy(Comparator.comparing(VtObject::id));
        assertEquals(List.of(ObjectId.of(1), ObjectId.of(2), ObjectId.of(3)),
                pool.objects().stream().map(VtObject::id).toList());
        assertEquals(ObjectId.of(3), pool.maxObjectId().orElseThrow());
    }

    @Test
    void workingSetObjectIsEmptyWithoutWorkingSet() {
        ObjectPool pool = new ObjectPool(List.of(dataMask(5)));
        assertTrue(pool.workingSetObject().isEmpty());
    }

    @Test
    void contentSizeOfParentIsChildExtent() {
        ObjectPool pool = new ObjectPool(List.of(
                dataMask(1, ObjectRef.at(2, 10, 20), ObjectRef.at(3, 100, 0)),
                label(2, 50, 30),
                label(3, 40, 10)));

        assertEquals(new Size(140, 50), pool.contentSize(pool.objectById(ObjectId.of(1)).orElseThrow()));
    }

    @Test
    void contentSizeIgnoresMissingChildren() {
        ObjectPool pool = new ObjectPool(List.of(dataMask(1, ObjectRef.at(99, 10, 10))));
        assertEquals(Size.EMPTY, pool.contentSize(pool.objectById(ObjectId.of(1)).orElseThrow()));
    }

    @Test
    void contentSizeOfPointerFollowsTarget() {
        ObjectPool pool = new ObjectPool(List.of(
                new VtObjects.ObjectPointer(ObjectId.of(1), NullableObjectId.of(2)),
                label(2, 64, 16)));
        assertEquals(new Size(64, 16), pool.contentSize(pool.objectById(ObjectId.of(1)).orElseThrow()));
    }

    @Test
    void contentSizeTerminatesOnPointerCycle() {
        ObjectPool pool = new ObjectPool(List.of(
                new VtObjects.ObjectPointer(ObjectId.of(1), NullableObjectId.of(2)),
                new VtObjects.ObjectPointer(ObjectId.of(2), NullableObjectId.of(1))));
        assertEquals(Size.EMPTY, pool.contentSize(pool.objectById(ObjectId.of(1)).orElseThrow()));
    }

    @Test
    void minimumMaskSizesHonourFloors() {
        MaskSizes sizes = new ObjectPool().minimumMaskSizes();
        assertEquals(new MaskSizes(200, 60, 32), sizes);
    }

    @Test
    void minimumMaskSizesGrowToFitChildren() {
        ObjectPool pool = new ObjectPool(List.of(
                dataMask(1, ObjectRef.at(2, 300, 10)),
                label(2, 180, 20),
                key(3, ObjectRef.at(4, 0, 0)),
                container(4, 80, 40)));

        MaskSizes sizes = pool.minimumMaskSizes();
        assertEquals(480, sizes.maskSize());
        assertEquals(80, sizes.softKeyWidth());
        assertEquals(40, sizes.softKeyHeight());
    }
}
