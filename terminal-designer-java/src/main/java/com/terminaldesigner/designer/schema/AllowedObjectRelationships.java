package com.terminaldesigner.designer.schema;

import com.terminaldesigner.pool.ObjectPool;
import com.terminaldesigner.pool.ObjectType;
import com.terminaldesigner.pool.VtObject;
import com.terminaldesigner.pool.VtVersion;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.terminaldesigner.pool.ObjectType.*;
import static com.terminaldesigner.pool.VtVersion.*;

/**
 * Which object kinds a parent kind may reference as children, per VT version (ISO 11783-6 Annex B).
 *
 * Each table starts from the version 3 baseline and later versions only append, so the allowed
 * set for a newer version always contains the set of an older one. Kinds without children return
 * an empty list.
 */
public final class AllowedObjectRelationships {

    private AllowedObjectRelationships() {}

    public static List<ObjectType> allowedChildren(ObjectType parent, VtVersion version) {
        return switch (parent) {
            case WORKING_SET -> workingSet(version);
            case DATA_MASK -> dataMask(version);
            case ALARM_MASK -> alarmMask(version);
            // version 6 allows the same objects in a container as in a data mask
            case CONTAINER -> dataMask(version);
            case SOFT_KEY_MASK -> softKeyMask(version);
            case KEY -> key(version);
            // version 6 allows the same objects in a button as in a key
            case BUTTON -> key(version);
            case INPUT_LIST -> inputList(version);
            // version 6 allows the same objects in an output list as in a window mask
            case OUTPUT_LIST -> windowMask(version);
            case AUXILIARY_FUNCTION_TYPE_1, AUXILIARY_INPUT_TYPE_1 -> auxiliaryType1();
            case AUXILIARY_FUNCTION_TYPE_2, AUXILIARY_INPUT_TYPE_2 -> auxiliaryType2(version);
            case WINDOW_MASK -> windowMask(version);
            case KEY_GROUP -> keyGroup(version);
            case ANIMATION -> animation(version);
            default -> List.of();
        };
    }

    public static boolean isAllowedChild(ObjectType parent, ObjectType child, VtVersion version) {
        return allowedChildren(parent, version).contains(child);
    }

    /** Objects of {@code pool} that may be added as children of a {@code parent} kind, in pool order. */
    public static List<VtObject> candidateChildren(ObjectPool pool, ObjectType parent, VtVersion version) {
        List<ObjectType> allowed = allowedChildren(parent, version);
        return pool.objects().stream()
                .filter(o -> allowed.contains(o.type()))
                .collect(Collectors.toList());
    }

    // --- tables ---

    private static List<ObjectType> workingSet(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>(List.of(
                OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LINE, OUTPUT_RECTANGLE, OUTPUT_ELLIPSE, OUTPUT_POLYGON,
                PICTURE_GRAPHIC));
        if (version.atLeast(VERSION_4)) {
            allowed.addAll(List.of(OUTPUT_LIST, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH, OUTPUT_ARCHED_BAR_GRAPH,
                    GRAPHICS_CONTEXT, OBJECT_POINTER));
        }
        if (version.atLeast(VERSION_6)) {
            allowed.add(SCALED_GRAPHIC);
        }
        return List.copyOf(allowed);
    }

    private static List<ObjectType> dataMask(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>(List.of(
                CONTAINER, BUTTON, INPUT_BOOLEAN, INPUT_STRING, INPUT_NUMBER, INPUT_LIST,
                OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LINE, OUTPUT_RECTANGLE, OUTPUT_ELLIPSE, OUTPUT_POLYGON,
                OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH, OUTPUT_ARCHED_BAR_GRAPH, PICTURE_GRAPHIC, OBJECT_POINTER,
                WORKING_SET));
        appendMaskAdditions(allowed, version);
        return List.copyOf(allowed);
    }

    private static List<ObjectType> alarmMask(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>(List.of(
                CONTAINER, OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LINE, OUTPUT_RECTANGLE, OUTPUT_ELLIPSE,
                OUTPUT_POLYGON, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH, OUTPUT_ARCHED_BAR_GRAPH, PICTURE_GRAPHIC,
                OBJECT_POINTER, WORKING_SET));
        appendMaskAdditions(allowed, version);
        return List.copyOf(allowed);
    }

    private static void appendMaskAdditions(List<ObjectType> allowed, VtVersion version) {
        if (version.atLeast(VERSION_4)) {
            allowed.addAll(List.of(OUTPUT_LIST, GRAPHICS_CONTEXT));
        }
        if (version.atLeast(VERSION_5)) {
            allowed.addAll(List.of(ANIMATION, EXTERNAL_OBJECT_POINTER));
        }
        if (version.atLeast(VERSION_6)) {
            allowed.add(SCALED_GRAPHIC);
        }
    }

    private static List<ObjectType> softKeyMask(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>(List.of(KEY, OBJECT_POINTER));
        if (version.atLeast(VERSION_5)) {
            allowed.add(EXTERNAL_OBJECT_POINTER);
        }
        return List.copyOf(allowed);
    }

    private static List<ObjectType> key(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>(List.of(
                CONTAINER, OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LINE, OUTPUT_RECTANGLE, OUTPUT_ELLIPSE,
                OUTPUT_POLYGON, PICTURE_GRAPHIC, OBJECT_POINTER));
        if (version.atLeast(VERSION_4)) {
            allowed.addAll(List.of(WORKING_SET, OUTPUT_LIST, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH,
                    OUTPUT_ARCHED_BAR_GRAPH, GRAPHICS_CONTEXT));
        }
        if (version.atLeast(VERSION_5)) {
            allowed.addAll(List.of(ANIMATION, EXTERNAL_OBJECT_POINTER));
        }
        if (version.atLeast(VERSION_6)) {
            allowed.add(SCALED_GRAPHIC);
        }
        return List.copyOf(allowed);
    }

    private static List<ObjectType> inputList(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>(List.of(OUTPUT_STRING, OUTPUT_NUMBER, PICTURE_GRAPHIC));
        if (version.atLeast(VERSION_4)) {
            allowed.addAll(List.of(WORKING_SET, CONTAINER, OUTPUT_LIST, OUTPUT_LINE, OUTPUT_RECTANGLE,
                    OUTPUT_ELLIPSE, OUTPUT_POLYGON, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH, OUTPUT_ARCHED_BAR_GRAPH,
                    GRAPHICS_CONTEXT, OBJECT_POINTER));
        }
        if (version.atLeast(VERSION_5)) {
            allowed.add(EXTERNAL_OBJECT_POINTER);
        }
        if (version.atLeast(VERSION_6)) {
            allowed.add(SCALED_GRAPHIC);
        }
        return List.copyOf(allowed);
    }

    private static List<ObjectType> auxiliaryType1() {
        return List.of(OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LINE, OUTPUT_RECTANGLE, OUTPUT_ELLIPSE, OUTPUT_POLYGON,
                PICTURE_GRAPHIC);
    }

    private static List<ObjectType> auxiliaryType2(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>(List.of(
                CONTAINER, OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LINE, OUTPUT_RECTANGLE, OUTPUT_ELLIPSE,
                OUTPUT_POLYGON, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH, OUTPUT_ARCHED_BAR_GRAPH, PICTURE_GRAPHIC,
                OBJECT_POINTER));
        if (version.atLeast(VERSION_4)) {
            allowed.addAll(List.of(OUTPUT_LIST, GRAPHICS_CONTEXT));
        }
        if (version.atLeast(VERSION_6)) {
            allowed.add(SCALED_GRAPHIC);
        }
        return List.copyOf(allowed);
    }

    private static List<ObjectType> windowMask(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>();
        if (version.atLeast(VERSION_4)) {
            allowed.addAll(List.of(WORKING_SET, CONTAINER, BUTTON, INPUT_BOOLEAN, INPUT_STRING, INPUT_NUMBER,
                    INPUT_LIST, OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LIST, OUTPUT_LINE, OUTPUT_RECTANGLE,
                    OUTPUT_ELLIPSE, OUTPUT_POLYGON, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH, OUTPUT_ARCHED_BAR_GRAPH,
                    GRAPHICS_CONTEXT, PICTURE_GRAPHIC, OBJECT_POINTER));
        }
        if (version.atLeast(VERSION_5)) {
            allowed.addAll(List.of(ANIMATION, EXTERNAL_OBJECT_POINTER));
        }
        if (version.atLeast(VERSION_6)) {
            allowed.add(SCALED_GRAPHIC);
        }
        return List.copyOf(allowed);
    }

    private static List<ObjectType> keyGroup(VtVersion version) {
        return version.atLeast(VERSION_4) ? List.of(KEY) : List.of();
    }

    private static List<ObjectType> animation(VtVersion version) {
        List<ObjectType> allowed = new ArrayList<>();
        if (version.atLeast(VERSION_5)) {
            allowed.addAll(List.of(CONTAINER, OUTPUT_STRING, OUTPUT_NUMBER, OUTPUT_LIST, OUTPUT_LINE,
                    OUTPUT_RECTANGLE, OUTPUT_ELLIPSE, OUTPUT_POLYGON, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH,
                    OUTPUT_ARCHED_BAR_GRAPH, GRAPHICS_CONTEXT, PICTURE_GRAPHIC, OBJECT_POINTER));
        }
        if (version.atLeast(VERSION_6)) {
            allowed.add(SCALED_GRAPHIC);
        }
        return List.copyOf(allowed);
    }
}
