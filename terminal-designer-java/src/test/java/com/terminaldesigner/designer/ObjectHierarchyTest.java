package com.terminaldesigner.designer;

import com.terminaldesigner.designer.info.ObjectInfoTable;
import com.terminaldesigner.designer.view.ObjectHierarchy;
import com.terminaldesigner.pool.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObjectHierarchyTest {

    private static VtObjects.WorkingSet workingSet(int id, int activeMask) {
        return new VtObjects.WorkingSet(ObjectId.of(id), 0, true, ObjectId.of(activeMask), List.of(), List.of(), List.of());
    }

    private static VtObjects.DataMask dataMask(int id, ObjectRef... refs) {
        return new VtObjects.DataMask(ObjectId.of(id), 0, NullableObjectId.NONE, List.of(refs), List.of());
    }

    private static VtObjects.Container container(int id, ObjectRef... refs) {
        return new VtObjects.Container(ObjectId.of(id), 100, 100, false, List.of(refs), List.of());
    }

    @Test
    void poolWithoutWorkingSetHasNoTree() {
        ObjectPool pool = new ObjectPool(List.of(dataMask(5)));
        ObjectHierarchy hierarchy = ObjectHierarchy.build(pool, new ObjectInfoTable());

        assertTrue(hierarchy.missingWorkingSet());
        assertTrue(hierarchy.root().isEmpty());
        assertTrue(hierarchy.render().startsWith(ObjectHierarchy.NO_WORKING_SET_MESSAGE));
        assertEquals(List.of(), hierarchy.expandPathTo(ObjectId.of(5)));
    }

    @Test
    void treeFollowsReferences() {
        ObjectPool pool = new ObjectPool(List.of(
                workingSet(0, 1), dataMask(1, ObjectRef.at(2, 0, 0)), container(2)));
        ObjectInfoTable names = new ObjectInfoTable();
        names.rename(ObjectId.of(1), "Main Screen");

        ObjectHierarchy.Node root = ObjectHierarchy.build(pool, names).root().orElseThrow();

        assertEquals(ObjectType.WORKING_SET, root.type());
        ObjectHierarchy.Node mask = root.children().get(0);
        assertEquals("Main Screen", mask.name());
        assertEquals(ObjectId.of(2), mask.children().get(0).id());
    }

    @Test
    void unresolvedReferenceBecomesMissingNode() {
        ObjectPool pool = new ObjectPool(List.of(workingSet(0, 1), dataMask(1, ObjectRef.at(99, 0, 0))));

        ObjectHierarchy.Node missing = ObjectHierarchy.build(pool, new ObjectInfoTable())
                .root().orElseThrow().children().get(0).children().get(0);

        assertTrue(missing.missing());
        assertEquals("Missing object: 99", missing.name());
    }

    @Test
    void cyclesAreNotExpandedTwice() {
        ObjectPool pool = new ObjectPool(List.of(
                workingSet(0, 1),
                dataMask(1, ObjectRef.at(2, 0, 0)),
                container(2, ObjectRef.at(3, 0, 0)),
                container(3, ObjectRef.at(2, 0, 0))));

        ObjectHierarchy.Node inner = ObjectHierarchy.build(pool, new ObjectInfoTable())
                .root().orElseThrow().children().get(0).children().get(0).children().get(0);

        assertEquals(ObjectId.of(3), inner.id());
        ObjectHierarchy.Node repeated = inner.children().get(0);
        assertEquals(ObjectId.of(2), repeated.id());
        assertTrue(repeated.children().isEmpty());
    }

    @Test
    void expandPathListsAncestorsRootFirst() {
        ObjectPool pool = new ObjectPool(List.of(
                workingSet(0, 1), dataMask(1, ObjectRef.at(2, 0, 0)), container(2, ObjectRef.at(3, 0, 0)),
                container(3)));
        ObjectHierarchy hierarchy = ObjectHierarchy.build(pool, new ObjectInfoTable());

        assertEquals(List.of(ObjectId.of(0), ObjectId.of(1), ObjectId.of(2)), hierarchy.expandPathTo(ObjectId.of(3)));
        assertEquals(List.of(), hierarchy.expandPathTo(ObjectId.of(0)));
        assertEquals(List.of(), hierarchy.expandPathTo(ObjectId.of(42)));
    }

    @Test
    void filterMatchesDisplayedNamesIgnoringCase() {
        ObjectPool pool = new ObjectPool(List.of(workingSet(0, 1), dataMask(1), dataMask(2)));
        ObjectInfoTable names = new ObjectInfoTable();
        names.rename(ObjectId.of(1), "Main Screen");
        ObjectHierarchy hierarchy = ObjectHierarchy.build(pool, names);

        assertEquals(List.of(ObjectId.of(1)), hierarchy.filterByName("main").stream().map(VtObject::id).toList());
        assertEquals(3, hierarchy.filterByName("").size());
    }

    @Test
    void auxiliaryObjectsAreListedSeparately() {
        ObjectPool pool = new ObjectPool(List.of(
                workingSet(0, 1), dataMask(1),
                new VtObjects.AuxiliaryFunctionType1(ObjectId.of(50), 0, 0, List.of())));
        ObjectHierarchy hierarchy = ObjectHierarchy.build(pool, new ObjectInfoTable());

        assertEquals(1, hierarchy.auxiliaryObjects().size());
        assertTrue(hierarchy.render().contains("--- auxiliary ---\n50: AuxiliaryFunctionType1"));
    }

    @Test
    void sharedSubtreesAreExpandedOnce() {
        List<VtObject> objects = new ArrayList<>();
        objects.add(workingSet(0, 1));
        objects.add(dataMask(1, ObjectRef.at(2, 0, 0)));
        for (int id = 2; id < 26; id++) {
            objects.add(container(id, ObjectRef.at(id + 1, 0, 0), ObjectRef.at(id + 1, 0, 50)));
        }
        objects.add(container(26));
        ObjectHierarchy hierarchy = ObjectHierarchy.build(new ObjectPool(objects), new ObjectInfoTable());

        ObjectHierarchy.Node first = hierarchy.root().orElseThrow().children().get(0).children().get(0);
        assertEquals(ObjectId.of(2), first.id());
        assertEquals(2, first.children().size());
        assertFalse(first.children().get(0).children().isEmpty());
        assertTrue(first.children().get(1).children().isEmpty());
        // working set, mask, container 2, then every later container twice
        assertEquals(2 * 24 + 3, hierarchy.render().split("\n").length);
    }
}
