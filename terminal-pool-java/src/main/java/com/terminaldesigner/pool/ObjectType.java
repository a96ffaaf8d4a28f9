package com.terminaldesigner.pool;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Object kinds of the ISO 11783-6 object model, keyed by their wire type id.
 * The label is the CamelCase name used in default object names ("5: DataMask") and in JSON.
 */
public enum ObjectType {
    WORKING_SET(0, "WorkingSet", VtObjects.WorkingSet.class),
    DATA_MASK(1, "DataMask", VtObjects.DataMask.class),
    ALARM_MASK(2, "AlarmMask", VtObjects.AlarmMask.class),
    CONTAINER(3, "Container", VtObjects.Container.class),
    SOFT_KEY_MASK(4, "SoftKeyMask", VtObjects.SoftKeyMask.class),
    KEY(5, "Key", VtObjects.Key.class),
    BUTTON(6, "Button", VtObjects.Button.class),
    INPUT_BOOLEAN(7, "InputBoolean", VtObjects.InputBoolean.class),
    INPUT_STRING(8, "InputString", VtObjects.InputString.class),
    INPUT_NUMBER(9, "InputNumber", VtObjects.InputNumber.class),
    INPUT_LIST(10, "InputList", VtObjects.InputList.class),
    OUTPUT_STRING(11, "OutputString", VtObjects.OutputString.class),
    OUTPUT_NUMBER(12, "OutputNumber", VtObjects.OutputNumber.class),
    OUTPUT_LINE(13, "OutputLine", VtObjects.OutputLine.class),
    OUTPUT_RECTANGLE(14, "OutputRectangle", VtObjects.OutputRectangle.class),
    OUTPUT_ELLIPSE(15, "OutputEllipse", VtObjects.OutputEllipse.class),
    OUTPUT_POLYGON(16, "OutputPolygon", VtObjects.OutputPolygon.class),
    OUTPUT_METER(17, "OutputMeter", VtObjects.OutputMeter.class),
    OUTPUT_LINEAR_BAR_GRAPH(18, "OutputLinearBarGraph", VtObjects.OutputLinearBarGraph.class),
    OUTPUT_ARCHED_BAR_GRAPH(19, "OutputArchedBarGraph", VtObjects.OutputArchedBarGraph.class),
    PICTURE_GRAPHIC(20, "PictureGraphic", VtObjects.PictureGraphic.class),
    NUMBER_VARIABLE(21, "NumberVariable", VtObjects.NumberVariable.class),
    STRING_VARIABLE(22, "StringVariable", VtObjects.StringVariable.class),
    FONT_ATTRIBUTES(23, "FontAttributes", VtObjects.FontAttributes.class),
    LINE_ATTRIBUTES(24, "LineAttributes", VtObjects.LineAttributes.class),
    FILL_ATTRIBUTES(25, "FillAttributes", VtObjects.FillAttributes.class),
    INPUT_ATTRIBUTES(26, "InputAttributes", VtObjects.InputAttributes.class),
    OBJECT_POINTER(27, "ObjectPointer", VtObjects.ObjectPointer.class),
    MACRO(28, "Macro", VtObjects.Macro.class),
    AUXILIARY_FUNCTION_TYPE_1(29, "AuxiliaryFunctionType1", VtObjects.AuxiliaryFunctionType1.class),
    AUXILIARY_INPUT_TYPE_1(30, "AuxiliaryInputType1", VtObjects.AuxiliaryInputType1.class),
    AUXILIARY_FUNCTION_TYPE_2(31, "AuxiliaryFunctionType2", VtObjects.AuxiliaryFunctionType2.class),
    AUXILIARY_INPUT_TYPE_2(32, "AuxiliaryInputType2", VtObjects.AuxiliaryInputType2.class),
    AUXILIARY_CONTROL_DESIGNATOR_TYPE_2(33, "AuxiliaryControlDesignatorType2",
            VtObjects.AuxiliaryControlDesignatorType2.class),
    WINDOW_MASK(34, "WindowMask", VtObjects.WindowMask.class),
    KEY_GROUP(35, "KeyGroup", VtObjects.KeyGroup.class),
    GRAPHICS_CONTEXT(36, "GraphicsContext", VtObjects.GraphicsContext.class),
    OUTPUT_LIST(37, "OutputList", VtObjects.OutputList.class),
    EXTENDED_INPUT_ATTRIBUTES(38, "ExtendedInputAttributes", VtObjects.ExtendedInputAttributes.class),
    COLOUR_MAP(39, "ColourMap", VtObjects.ColourMap.class),
    OBJECT_LABEL_REFERENCE_LIST(40, "ObjectLabelReferenceList", VtObjects.ObjectLabelReferenceList.class),
    EXTERNAL_OBJECT_DEFINITION(41, "ExternalObjectDefinition", VtObjects.ExternalObjectDefinition.class),
    EXTERNAL_REFERENCE_NAME(42, "ExternalReferenceName", VtObjects.ExternalReferenceName.class),
    EXTERNAL_OBJECT_POINTER(43, "ExternalObjectPointer", VtObjects.ExternalObjectPointer.class),
    ANIMATION(44, "Animation", VtObjects.Animation.class),
    COLOUR_PALETTE(45, "ColourPalette", VtObjects.ColourPalette.class),
    GRAPHIC_DATA(46, "GraphicData", VtObjects.GraphicData.class),
    WORKING_SET_SPECIAL_CONTROLS(47, "WorkingSetSpecialControls", VtObjects.WorkingSetSpecialControls.class),
    SCALED_GRAPHIC(48, "ScaledGraphic", VtObjects.ScaledGraphic.class);

    private static final Map<String, ObjectType> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(ObjectType::label, Function.identity()));

    private final int id;
    private final String label;
    private final Class<? extends VtObject> objectClass;

    ObjectType(int id, String label, Class<? extends VtObject> objectClass) {
        this.id = id;
        this.label = label;
        this.objectClass = objectClass;
    }

    public int id() { return id; }
    public String label() { return label; }
    public Class<? extends VtObject> objectClass() { return objectClass; }

    public static ObjectType fromId(int id) {
        for (ObjectType t : values()) {
            if (t.id == id) return t;
        }
        throw new IllegalArgumentException("Unknown object type id: " + id);
    }

    public static ObjectType fromLabel(String label) {
        ObjectType t = BY_LABEL.get(label);
        if (t == null) {
            throw new IllegalArgumentException("Unknown object type: " + label);
        }
        return t;
    }
}
