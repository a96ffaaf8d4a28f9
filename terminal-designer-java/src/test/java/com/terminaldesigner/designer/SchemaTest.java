package com.terminaldesigner.designer;

import com.terminaldesigner.designer.schema.AllowedObjectRelationships;
import com.terminaldesigner.designer.schema.PossibleEvents;
import com.terminaldesigner.pool.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaTest {

    @Test
    void newerVersionsOnlyAddChildren() {
        VtVersion[] versions = VtVersion.values();
        for (ObjectType parent : ObjectType.values()) {
            for (int i = 1; i < versions.length; i++) {
                List<ObjectType> older = AllowedObjectRelationships.allowedChildren(parent, versions[i - 1]);
                List<ObjectType> newer = AllowedObjectRelationships.allowedChildren(parent, versions[i]);
                assertTrue(newer.containsAll(older), parent + " loses children in " + versions[i]);
            }
        }
    }

    @Test
    void dataMaskGainsKindsByVersion() {
        assertTrue(AllowedObjectRelationships.isAllowedChild(ObjectType.DATA_MASK, ObjectType.CONTAINER, VtVersion.VERSION_3));
        assertFalse(AllowedObjectRelationships.isAllowedChild(ObjectType.DATA_MASK, ObjectType.OUTPUT_LIST, VtVersion.VERSION_3));
        assertTrue(AllowedObjectRelationships.isAllowedChild(ObjectType.DATA_MASK, ObjectType.OUTPUT_LIST, VtVersion.VERSION_4));
        assertFalse(AllowedObjectRelationships.isAllowedChild(ObjectType.DATA_MASK, ObjectType.ANIMATION, VtVersion.VERSION_4));
        assertTrue(AllowedObjectRelationships.isAllowedChild(ObjectType.DATA_MASK, ObjectType.ANIMATION, VtVersion.VERSION_5));
        assertTrue(AllowedObjectRelationships.isAllowedChild(ObjectType.DATA_MASK, ObjectType.SCALED_GRAPHIC, VtVersion.VERSION_6));
    }

    @Test
    void containerButtonAndOutputListShareTables() {
        for (VtVersion v : VtVersion.values()) {
            assertEquals(AllowedObjectRelationships.allowedChildren(ObjectType.DATA_MASK, v),
                    AllowedObjectRelationships.allowedChildren(ObjectType.CONTAINER, v));
            assertEquals(AllowedObjectRelationships.allowedChildren(ObjectType.KEY, v),
                    AllowedObjectRelationships.allowedChildren(ObjectType.BUTTON, v));
            assertEquals(AllowedObjectRelationships.allowedChildren(ObjectType.WINDOW_MASK, v),
                    AllowedObjectRelationships.allowedChildren(ObjectType.OUTPUT_LIST, v));
        }
    }

    @Test
    void leafKindsHaveNoChildren() {
        assertEquals(List.of(), AllowedObjectRelationships.allowedChildren(ObjectType.NUMBER_VARIABLE, VtVersion.VERSION_6));
        assertEquals(List.of(), AllowedObjectRelationships.allowedChildren(ObjectType.WINDOW_MASK, VtVersion.VERSION_3));
        assertEquals(List.of(ObjectType.KEY), AllowedObjectRelationships.allowedChildren(ObjectType.KEY_GROUP, VtVersion.VERSION_4));
    }

    @Test
    void candidateChildrenFiltersPoolInOrder() {
        ObjectPool pool = new ObjectPool(List.of(
                new VtObjects.NumberVariable(ObjectId.of(1), 0),
                new VtObjects.Key(ObjectId.of(2), 0, 2, List.of(), List.of()),
                new VtObjects.Key(ObjectId.of(3), 0, 3, List.of(), List.of())));

        List<VtObject> candidates = AllowedObjectRelationships.candidateChildren(pool, ObjectType.SOFT_KEY_MASK,
                VtVersion.VERSION_3);

        assertEquals(List.of(ObjectId.of(2), ObjectId.of(3)), candidates.stream().map(VtObject::id).toList());
    }

    @Test
    void inputFieldsShareEvents() {
        assertEquals(PossibleEvents.forType(ObjectType.INPUT_BOOLEAN), PossibleEvents.forType(ObjectType.INPUT_NUMBER));
        assertEquals(PossibleEvents.forType(ObjectType.OUTPUT_STRING), PossibleEvents.forType(ObjectType.OUTPUT_NUMBER));
    }

    @Test
    void eventPossibilityFollowsKind() {
        assertTrue(PossibleEvents.isPossible(ObjectType.KEY, Event.ON_KEY_PRESS));
        assertFalse(PossibleEvents.isPossible(ObjectType.DATA_MASK, Event.ON_KEY_PRESS));
        assertTrue(PossibleEvents.isPossible(ObjectType.WORKING_SET, Event.ON_ACTIVATE));
        assertEquals(List.of(), PossibleEvents.forType(ObjectType.MACRO));
    }
}
