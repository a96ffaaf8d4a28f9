package com.terminaldesigner.designer.project;

import com.terminaldesigner.pool.*;
import com.terminaldesigner.pool.VtObjects.*;

import java.util.List;

/**
 * Fresh objects for the "add object" flow.
 *
 * Mandatory references (font, line attributes, active mask) start at {@link #UNASSIGNED}, which
 * no allocated object uses until the pool is full; the validator reports them as missing until
 * the user points them somewhere.
 */
public final class DefaultObjects {

    public static final ObjectId UNASSIGNED = ObjectId.of(ObjectId.MAX_VALUE);

    private static final NullableObjectId NONE = NullableObjectId.NONE;

    private DefaultObjects() {}

    public static VtObject create(ObjectType type, ObjectId id) {
        return switch (type) {
            case WORKING_SET -> new WorkingSet(id, 0, true, UNASSIGNED, List.of(), List.of(), List.of());
            case DATA_MASK -> new DataMask(id, 1, NONE, List.of(), List.of());
            case ALARM_MASK -> new AlarmMask(id, 1, NONE, 0, 0, List.of(), List.of());
            case CONTAINER -> new Container(id, 100, 100, false, List.of(), List.of());
            case SOFT_KEY_MASK -> new SoftKeyMask(id, 1, List.of(), List.of());
            case KEY -> new Key(id, 1, 0, List.of(), List.of());
            case BUTTON -> new Button(id, 100, 40, 1, 0, 0, 0, List.of(), List.of());
            case INPUT_BOOLEAN -> new InputBoolean(id, 1, 20, UNASSIGNED, NONE, false, true, List.of());
            case INPUT_STRING -> new InputString(id, 100, 20, 1, UNASSIGNED, NONE, 0, NONE, 0, "", true, List.of());
            case INPUT_NUMBER -> new InputNumber(id, 100, 20, 1, UNASSIGNED, 0, NONE, 0, 0, 100, 0, 1.0f, 0, 0, 0,
                    1, List.of());
            case INPUT_LIST -> new InputList(id, 100, 20, NONE, 0, 1, List.of(), List.of());
            case OUTPUT_STRING -> new OutputString(id, 100, 20, 1, UNASSIGNED, 0, NONE, 0, "Text", List.of());
            case OUTPUT_NUMBER -> new OutputNumber(id, 100, 20, 1, UNASSIGNED, 0, NONE, 0, 0, 1.0f, 0, 0, 0,
                    List.of());
            case OUTPUT_LINE -> new OutputLine(id, UNASSIGNED, 100, 1, 0, List.of());
            case OUTPUT_RECTANGLE -> new OutputRectangle(id, UNASSIGNED, 100, 50, 0, NONE, List.of());
            case OUTPUT_ELLIPSE -> new OutputEllipse(id, UNASSIGNED, 100, 50, 0, 0, 180, NONE, List.of());
            case OUTPUT_POLYGON -> new OutputPolygon(id, 100, 100, UNASSIGNED, NONE, 0,
                    List.of(new Point(0, 0), new Point(100, 0), new Point(50, 100)), List.of());
            case OUTPUT_METER -> new OutputMeter(id, 100, 0, 0, 0, 0, 5, 0, 180, 0, 100, NONE, 0, List.of());
            case OUTPUT_LINEAR_BAR_GRAPH -> new OutputLinearBarGraph(id, 100, 20, 0, 0, 0, 0, 0, 100, NONE, 0,
                    NONE, 0, List.of());
            case OUTPUT_ARCHED_BAR_GRAPH -> new OutputArchedBarGraph(id, 100, 100, 0, 0, 0, 0, 180, 10, 0, 100,
                    NONE, 0, NONE, 0, List.of());
            case PICTURE_GRAPHIC -> new PictureGraphic(id, 0, 0, 0, 0, 0, 0, new byte[0], List.of());
            case NUMBER_VARIABLE -> new NumberVariable(id, 0);
            case STRING_VARIABLE -> new StringVariable(id, "");
            case FONT_ATTRIBUTES -> new FontAttributes(id, 0, 0, 0, 0, List.of());
            case LINE_ATTRIBUTES -> new LineAttributes(id, 0, 1, 0xFFFF, List.of());
            case FILL_ATTRIBUTES -> new FillAttributes(id, 0, 0, NONE, List.of());
            case INPUT_ATTRIBUTES -> new InputAttributes(id, 0, "", List.of());
            case OBJECT_POINTER -> new ObjectPointer(id, NONE);
            case MACRO -> new Macro(id, new byte[0]);
            case AUXILIARY_FUNCTION_TYPE_1 -> new AuxiliaryFunctionType1(id, 0, 0, List.of());
            case AUXILIARY_INPUT_TYPE_1 -> new AuxiliaryInputType1(id, 0, 0, 1, List.of());
            case AUXILIARY_FUNCTION_TYPE_2 -> new AuxiliaryFunctionType2(id, 0, 0, List.of());
            case AUXILIARY_INPUT_TYPE_2 -> new AuxiliaryInputType2(id, 0, 0, List.of());
            case AUXILIARY_CONTROL_DESIGNATOR_TYPE_2 -> new AuxiliaryControlDesignatorType2(id, 0, NONE);
            case WINDOW_MASK -> new WindowMask(id, 1, 1, 0, 1, 0, NONE, NONE, NONE, List.of(), List.of(), List.of());
            case KEY_GROUP -> new KeyGroup(id, 0, NONE, NONE, List.of(), List.of());
            case GRAPHICS_CONTEXT -> new GraphicsContext(id, 100, 100, 0, 0, 100, 100, 1.0f, 0, 0, 0, 1,
                    NONE, NONE, NONE, 0, 0, 0);
            case OUTPUT_LIST -> new OutputList(id, 100, 20, NONE, 0, List.of(), List.of());
            case EXTENDED_INPUT_ATTRIBUTES -> new ExtendedInputAttributes(id, 0, List.of());
            case COLOUR_MAP -> new ColourMap(id, List.of());
            case OBJECT_LABEL_REFERENCE_LIST -> new ObjectLabelReferenceList(id, List.of());
            case EXTERNAL_OBJECT_DEFINITION -> new ExternalObjectDefinition(id, 0, 0, List.of());
            case EXTERNAL_REFERENCE_NAME -> new ExternalReferenceName(id, 0, 0);
            case EXTERNAL_OBJECT_POINTER -> new ExternalObjectPointer(id, NONE, NONE, NONE);
            case ANIMATION -> new Animation(id, 100, 100, 100, 0, true, 0, 0, 0, 0, List.of(), List.of());
            case COLOUR_PALETTE -> new ColourPalette(id, 0, List.of());
            case GRAPHIC_DATA -> new GraphicData(id, 0, new byte[0]);
            case WORKING_SET_SPECIAL_CONTROLS -> new WorkingSetSpecialControls(id, NONE, NONE, List.of());
            case SCALED_GRAPHIC -> new ScaledGraphic(id, 100, 100, 0, 0, NONE, List.of());
        };
    }
}
