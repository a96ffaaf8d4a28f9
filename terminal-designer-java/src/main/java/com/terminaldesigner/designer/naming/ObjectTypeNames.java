package com.terminaldesigner.designer.naming;

import com.terminaldesigner.pool.ObjectType;

/** Names for object kinds as operators read them. */
public final class ObjectTypeNames {

    private ObjectTypeNames() {}

    public static String friendlyName(ObjectType type) {
        return switch (type) {
            case WORKING_SET -> "Working Set";
            case DATA_MASK -> "Data Mask";
            case ALARM_MASK -> "Alarm Screen";
            case CONTAINER -> "Container";
            case SOFT_KEY_MASK -> "Soft Key Mask";
            case KEY -> "Key";
            case BUTTON -> "Button";
            case INPUT_BOOLEAN -> "Checkbox";
            case INPUT_STRING -> "Text Input";
            case INPUT_NUMBER -> "Number Input";
            case INPUT_LIST -> "List Input";
            case OUTPUT_STRING -> "Text Display";
            case OUTPUT_NUMBER -> "Number Display";
            case OUTPUT_LIST -> "List Display";
            case OUTPUT_LINE -> "Line";
            case OUTPUT_RECTANGLE -> "Rectangle";
            case OUTPUT_ELLIPSE -> "Ellipse";
            case OUTPUT_POLYGON -> "Polygon";
            case OUTPUT_METER -> "Meter";
            case OUTPUT_LINEAR_BAR_GRAPH -> "Linear Bar";
            case OUTPUT_ARCHED_BAR_GRAPH -> "Arched Bar";
            case PICTURE_GRAPHIC -> "Picture";
            case NUMBER_VARIABLE -> "Number Variable";
            case STRING_VARIABLE -> "String Variable";
            case FONT_ATTRIBUTES -> "Font Style";
            case LINE_ATTRIBUTES -> "Line Style";
            case FILL_ATTRIBUTES -> "Fill Style";
            case INPUT_ATTRIBUTES -> "Input Style";
            case OBJECT_POINTER -> "Object Reference";
            case MACRO -> "Macro";
            case AUXILIARY_FUNCTION_TYPE_1 -> "Aux Function v1";
            case AUXILIARY_INPUT_TYPE_1 -> "Aux Input v1";
            case AUXILIARY_FUNCTION_TYPE_2 -> "Aux Function v2";
            case AUXILIARY_INPUT_TYPE_2 -> "Aux Input v2";
            case AUXILIARY_CONTROL_DESIGNATOR_TYPE_2 -> "Aux Control v2";
            case COLOUR_MAP -> "Colour Map";
            case GRAPHICS_CONTEXT -> "Graphics Context";
            case COLOUR_PALETTE -> "Colour Palette";
            case GRAPHIC_DATA -> "Graphic Data";
            case WORKING_SET_SPECIAL_CONTROLS -> "Special Controls";
            case SCALED_GRAPHIC -> "Scaled Graphic";
            case WINDOW_MASK -> "Window Mask";
            case KEY_GROUP -> "Key Group";
            case EXTENDED_INPUT_ATTRIBUTES -> "Extended Input Style";
            case OBJECT_LABEL_REFERENCE_LIST -> "Label Reference List";
            case EXTERNAL_OBJECT_DEFINITION -> "External Object Definition";
            case EXTERNAL_REFERENCE_NAME -> "External Reference Name";
            case EXTERNAL_OBJECT_POINTER -> "External Object Pointer";
            case ANIMATION -> "Animation";
        };
    }
}
