package com.terminaldesigner.designer.schema;

import com.terminaldesigner.pool.Event;
import com.terminaldesigner.pool.ObjectType;

import java.util.List;

import static com.terminaldesigner.pool.Event.*;

/**
 * Events each object kind raises, and so the events its macro bindings may use.
 */
public final class PossibleEvents {

    private PossibleEvents() {}

    private static final List<Event> INPUT_FIELD = List.of(
            ON_ENABLE, ON_DISABLE, ON_INPUT_FIELD_SELECTION, ON_INPUT_FIELD_DESELECTION, ON_ESC,
            ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_VALUE, ON_ENTRY_OF_VALUE, ON_ENTRY_OF_NEW_VALUE,
            ON_CHANGE_ATTRIBUTE, ON_CHANGE_SIZE);

    private static final List<Event> OUTPUT_FIELD = List.of(
            ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_VALUE, ON_CHANGE_ATTRIBUTE, ON_CHANGE_SIZE);

    private static final List<Event> VALUE_DISPLAY = List.of(ON_CHANGE_VALUE, ON_CHANGE_ATTRIBUTE, ON_CHANGE_SIZE);

    public static List<Event> forType(ObjectType type) {
        return switch (type) {
            case WORKING_SET -> List.of(ON_ACTIVATE, ON_DEACTIVATE, ON_CHANGE_ACTIVE_MASK,
                    ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_CHILD_LOCATION, ON_CHANGE_CHILD_POSITION);
            case DATA_MASK -> List.of(ON_SHOW, ON_HIDE, ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_CHILD_LOCATION,
                    ON_CHANGE_CHILD_POSITION, ON_CHANGE_SOFT_KEY_MASK, ON_CHANGE_ATTRIBUTE,
                    ON_POINTING_EVENT_PRESS, ON_POINTING_EVENT_RELEASE);
            case ALARM_MASK -> List.of(ON_SHOW, ON_HIDE, ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_CHILD_LOCATION,
                    ON_CHANGE_CHILD_POSITION, ON_CHANGE_PRIORITY, ON_CHANGE_SOFT_KEY_MASK, ON_CHANGE_ATTRIBUTE);
            case CONTAINER -> List.of(ON_SHOW, ON_HIDE, ON_CHANGE_CHILD_LOCATION, ON_CHANGE_CHILD_POSITION,
                    ON_CHANGE_SIZE);
            case SOFT_KEY_MASK -> List.of(ON_SHOW, ON_HIDE, ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_ATTRIBUTE);
            case KEY -> List.of(ON_KEY_PRESS, ON_KEY_RELEASE, ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_CHILD_LOCATION,
                    ON_CHANGE_CHILD_POSITION, ON_CHANGE_ATTRIBUTE, ON_INPUT_FIELD_SELECTION,
                    ON_INPUT_FIELD_DESELECTION);
            case BUTTON -> List.of(ON_ENABLE, ON_DISABLE, ON_INPUT_FIELD_SELECTION, ON_INPUT_FIELD_DESELECTION,
                    ON_KEY_PRESS, ON_KEY_RELEASE, ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_SIZE,
                    ON_CHANGE_CHILD_LOCATION, ON_CHANGE_CHILD_POSITION, ON_CHANGE_ATTRIBUTE);
            case INPUT_BOOLEAN, INPUT_STRING, INPUT_NUMBER -> INPUT_FIELD;
            case INPUT_LIST -> List.of(ON_ENABLE, ON_DISABLE, ON_INPUT_FIELD_SELECTION, ON_INPUT_FIELD_DESELECTION,
                    ON_ESC, ON_CHANGE_VALUE, ON_ENTRY_OF_VALUE, ON_ENTRY_OF_NEW_VALUE, ON_CHANGE_ATTRIBUTE,
                    ON_CHANGE_SIZE);
            case OUTPUT_STRING, OUTPUT_NUMBER -> OUTPUT_FIELD;
            case OUTPUT_LIST, OUTPUT_METER, OUTPUT_LINEAR_BAR_GRAPH, OUTPUT_ARCHED_BAR_GRAPH -> VALUE_DISPLAY;
            case OUTPUT_LINE -> List.of(ON_CHANGE_END_POINT, ON_CHANGE_ATTRIBUTE, ON_CHANGE_SIZE);
            case OUTPUT_RECTANGLE, OUTPUT_ELLIPSE -> List.of(ON_CHANGE_SIZE, ON_CHANGE_ATTRIBUTE);
            case OUTPUT_POLYGON -> List.of(ON_CHANGE_ATTRIBUTE, ON_CHANGE_SIZE);
            case PICTURE_GRAPHIC, KEY_GROUP, EXTERNAL_OBJECT_DEFINITION, EXTERNAL_REFERENCE_NAME ->
                    List.of(ON_CHANGE_ATTRIBUTE);
            case NUMBER_VARIABLE, STRING_VARIABLE, INPUT_ATTRIBUTES, OBJECT_POINTER, EXTERNAL_OBJECT_POINTER ->
                    List.of(ON_CHANGE_VALUE);
            case FONT_ATTRIBUTES -> List.of(ON_CHANGE_FONT_ATTRIBUTES, ON_CHANGE_ATTRIBUTE);
            case LINE_ATTRIBUTES -> List.of(ON_CHANGE_LINE_ATTRIBUTES, ON_CHANGE_ATTRIBUTE);
            case FILL_ATTRIBUTES -> List.of(ON_CHANGE_FILL_ATTRIBUTES, ON_CHANGE_ATTRIBUTE);
            case GRAPHICS_CONTEXT -> List.of(ON_CHANGE_ATTRIBUTE, ON_CHANGE_BACKGROUND_COLOUR);
            case WINDOW_MASK -> List.of(ON_SHOW, ON_HIDE, ON_CHANGE_BACKGROUND_COLOUR, ON_CHANGE_CHILD_LOCATION,
                    ON_CHANGE_CHILD_POSITION, ON_CHANGE_ATTRIBUTE, ON_POINTING_EVENT_PRESS,
                    ON_POINTING_EVENT_RELEASE);
            case ANIMATION -> List.of(ON_ENABLE, ON_DISABLE, ON_CHANGE_VALUE, ON_CHANGE_ATTRIBUTE, ON_CHANGE_SIZE);
            case SCALED_GRAPHIC -> List.of(ON_CHANGE_ATTRIBUTE, ON_CHANGE_VALUE);
            default -> List.of();
        };
    }

    public static boolean isPossible(ObjectType type, Event event) {
        return forType(type).contains(event);
    }
}
