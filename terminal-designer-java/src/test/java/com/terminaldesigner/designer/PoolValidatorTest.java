package com.terminaldesigner.designer;

import com.terminaldesigner.designer.project.DefaultObjects;
import com.terminaldesigner.designer.view.PoolValidator;
import com.terminaldesigner.designer.view.ValidationIssue;
import com.terminaldesigner.pool.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoolValidatorTest {

    private final PoolValidator validator = new PoolValidator();

    private static VtObjects.WorkingSet workingSet(ObjectRef... refs) {
        return new VtObjects.WorkingSet(ObjectId.of(0), 0, true, ObjectId.of(1), List.of(refs), List.of(), List.of());
    }

    private static VtObjects.DataMask dataMask(int id, List<MacroRef> macros, ObjectRef... refs) {
        return new VtObjects.DataMask(ObjectId.of(id), 0, NullableObjectId.NONE, List.of(refs), macros);
    }

    private static List<ValidationIssue.Kind> kinds(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::kind).toList();
    }

    @Test
    void minimalPoolIsClean() {
        ObjectPool pool = new ObjectPool(List.of(workingSet(), dataMask(1, List.of())));
        assertEquals(List.of(), validator.validate(pool, VtVersion.VERSION_3));
    }

    @Test
    void emptyPoolLacksWorkingSetAndMask() {
        List<ValidationIssue> issues = validator.validate(new ObjectPool(), VtVersion.VERSION_3);
        assertEquals(List.of(ValidationIssue.Kind.NO_WORKING_SET, ValidationIssue.Kind.NO_DATA_MASK), kinds(issues));
        assertTrue(issues.get(0).objectId().isNone());
    }

    @Test
    void danglingReferenceIsReported() {
        ObjectPool pool = new ObjectPool(List.of(workingSet(), dataMask(1, List.of(), ObjectRef.at(77, 0, 0))));

        List<ValidationIssue> issues = validator.validate(pool, VtVersion.VERSION_3);
        assertEquals(List.of(ValidationIssue.Kind.MISSING_REFERENCE), kinds(issues));
        assertEquals(NullableObjectId.of(1), issues.get(0).objectId());
        assertTrue(issues.get(0).toString().contains("77"));
    }

    @Test
    void childAllowanceDependsOnVersion() {
        VtObjects.OutputList list = (VtObjects.OutputList) DefaultObjects.create(ObjectType.OUTPUT_LIST, ObjectId.of(2));
        ObjectPool pool = new ObjectPool(List.of(workingSet(), dataMask(1, List.of(), ObjectRef.at(2, 0, 0)), list));

        assertEquals(List.of(ValidationIssue.Kind.CHILD_NOT_ALLOWED), kinds(validator.validate(pool, VtVersion.VERSION_3)));
        assertEquals(List.of(), validator.validate(pool, VtVersion.VERSION_4));
    }

    @Test
    void macroBindingsAreChecked() {
        ObjectPool pool = new ObjectPool(List.of(
                workingSet(),
                dataMask(1, List.of(new MacroRef(Event.ON_SHOW, 9), new MacroRef(Event.ON_KEY_PRESS, 5))),
                new VtObjects.Macro(ObjectId.of(5), new byte[]{1})));

        assertEquals(List.of(ValidationIssue.Kind.MISSING_MACRO, ValidationIssue.Kind.EVENT_NOT_POSSIBLE),
                kinds(validator.validate(pool, VtVersion.VERSION_3)));
    }
}
