package com.terminaldesigner.designer.view;

import com.terminaldesigner.designer.schema.AllowedObjectRelationships;
import com.terminaldesigner.designer.schema.PossibleEvents;
import com.terminaldesigner.pool.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.terminaldesigner.designer.view.ValidationIssue.Kind.*;

/**
 * Checks a pool against the object relationship rules of a VT version.
 * Problems are reported as {@link ValidationIssue}s; nothing here throws for a broken pool.
 */
public class PoolValidator {

    public List<ValidationIssue> validate(ObjectPool pool, VtVersion version) {
        List<ValidationIssue> issues = new ArrayList<>();

        if (pool.workingSetObject().isEmpty()) {
            issues.add(new ValidationIssue(NO_WORKING_SET, NullableObjectId.NONE, "Pool has no working set"));
        }
        if (pool.objectsByType(ObjectType.DATA_MASK).isEmpty()) {
            issues.add(new ValidationIssue(NO_DATA_MASK, NullableObjectId.NONE, "Pool has no data mask"));
        }

        for (VtObject object : pool.objects()) {
            NullableObjectId at = NullableObjectId.of(object.id());
            checkReferences(pool, object, at, issues);
            checkChildren(pool, object, version, at, issues);
            checkMacros(pool, object, at, issues);
        }
        return issues;
    }

    private void checkReferences(ObjectPool pool, VtObject object, NullableObjectId at, List<ValidationIssue> issues) {
        for (ObjectId ref : object.referencedObjects()) {
            if (!pool.contains(ref)) {
                issues.add(new ValidationIssue(MISSING_REFERENCE, at, "References missing object " + ref));
            }
        }
    }

    private void checkChildren(ObjectPool pool, VtObject object, VtVersion version, NullableObjectId at,
                               List<ValidationIssue> issues) {
        List<ObjectType> allowed = AllowedObjectRelationships.allowedChildren(object.type(), version);
        for (ObjectId childId : object.childObjects()) {
            Optional<VtObject> child = pool.objectById(childId);
            if (child.isEmpty()) continue;
            if (!allowed.contains(child.get().type())) {
                issues.add(new ValidationIssue(CHILD_NOT_ALLOWED, at,
                        child.get().type().label() + " " + childId + " is not allowed in a "
                                + object.type().label() + " (VT version " + version.number() + ")"));
            }
        }
    }

    private void checkMacros(ObjectPool pool, VtObject object, NullableObjectId at, List<ValidationIssue> issues) {
        List<Event> possible = PossibleEvents.forType(object.type());
        for (MacroRef macro : object.macroRefs()) {
            Optional<VtObject> target = pool.objectById(ObjectId.of(macro.macroId()));
            if (target.isEmpty() || target.get().type() != ObjectType.MACRO) {
                issues.add(new ValidationIssue(MISSING_MACRO, at,
                        "Event " + macro.event() + " is bound to missing macro " + macro.macroId()));
            }
            if (!possible.contains(macro.event())) {
                issues.add(new ValidationIssue(EVENT_NOT_POSSIBLE, at,
                        object.type().label() + " never raises " + macro.event()));
            }
        }
    }
}
