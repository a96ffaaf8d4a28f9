package com.terminaldesigner.pool;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records for every ISO 11783-6 object kind.
 *
 * Conventions:
 * - component names follow the standard's attribute names in camelCase
 * - 8/16-bit attributes are {@code int}, 32-bit values are {@code long}
 * - list components are copied into unmodifiable lists, so a pool snapshot can share object instances
 * - a null {@link NullableObjectId} component is normalized to {@link NullableObjectId#NONE}
 */
public final class VtObjects {

    private VtObjects() {}

    static <T> List<T> frozen(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    static NullableObjectId orNone(NullableObjectId id) {
        return id == null ? NullableObjectId.NONE : id;
    }

    static byte[] copyOf(byte[] data) {
        return data == null ? new byte[0] : data.clone();
    }

    static List<ObjectId> idsOf(List<ObjectRef> refs) {
        return refs.stream().map(ObjectRef::id).collect(Collectors.toList());
    }

    /** Collects referenced ids in field order. */
    static final class Refs {
        private final List<ObjectId> ids = new ArrayList<>();

        Refs id(ObjectId id) {
            if (id != null) ids.add(id);
            return this;
        }

        Refs nullable(NullableObjectId id) {
            if (id != null && !id.isNone()) ids.add(id.id());
            return this;
        }

        Refs ids(List<ObjectId> list) {
            ids.addAll(list);
            return this;
        }

        Refs nullables(List<NullableObjectId> list) {
            for (NullableObjectId id : list) nullable(id);
            return this;
        }

        Refs objectRefs(List<ObjectRef> refs) {
            for (ObjectRef r : refs) ids.add(r.id());
            return this;
        }

        List<ObjectId> build() {
            return List.copyOf(ids);
        }
    }

    // -----------------------------------------------------------------------
    // Top level and masks
    // -----------------------------------------------------------------------

    public record WorkingSet(
            ObjectId id,
            int backgroundColour,
            boolean selectable,
            ObjectId activeMask,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs,
            List<String> languageCodes
    ) implements VtObject {
        public WorkingSet {
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
            languageCodes = frozen(languageCodes);
        }

        @Override public ObjectType type() { return ObjectType.WORKING_SET; }

        @Override public WorkingSet withId(ObjectId newId) {
            return new WorkingSet(newId, backgroundColour, selectable, activeMask, objectRefs, macroRefs, languageCodes);
        }

        public WorkingSet withActiveMask(ObjectId mask) {
            return new WorkingSet(id, backgroundColour, selectable, mask, objectRefs, macroRefs, languageCodes);
        }

        public WorkingSet withObjectRefs(List<ObjectRef> refs) {
            return new WorkingSet(id, backgroundColour, selectable, activeMask, refs, macroRefs, languageCodes);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(activeMask).objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record DataMask(
            ObjectId id,
            int backgroundColour,
            NullableObjectId softKeyMask,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public DataMask {
            softKeyMask = orNone(softKeyMask);
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.DATA_MASK; }

        @Override public DataMask withId(ObjectId newId) {
            return new DataMask(newId, backgroundColour, softKeyMask, objectRefs, macroRefs);
        }

        public DataMask withObjectRefs(List<ObjectRef> refs) {
            return new DataMask(id, backgroundColour, softKeyMask, refs, macroRefs);
        }

        public DataMask withSoftKeyMask(NullableObjectId mask) {
            return new DataMask(id, backgroundColour, mask, objectRefs, macroRefs);
        }

        public DataMask withMacroRefs(List<MacroRef> refs) {
            return new DataMask(id, backgroundColour, softKeyMask, objectRefs, refs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(softKeyMask).objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record AlarmMask(
            ObjectId id,
            int backgroundColour,
            NullableObjectId softKeyMask,
            int priority,
            int acousticSignal,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public AlarmMask {
            softKeyMask = orNone(softKeyMask);
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.ALARM_MASK; }

        @Override public AlarmMask withId(ObjectId newId) {
            return new AlarmMask(newId, backgroundColour, softKeyMask, priority, acousticSignal, objectRefs, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(softKeyMask).objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record Container(
            ObjectId id,
            int width,
            int height,
            boolean hidden,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public Container {
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.CONTAINER; }

        @Override public Container withId(ObjectId newId) {
            return new Container(newId, width, height, hidden, objectRefs, macroRefs);
        }

        public Container withObjectRefs(List<ObjectRef> refs) {
            return new Container(id, width, height, hidden, refs, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record SoftKeyMask(
            ObjectId id,
            int backgroundColour,
            List<ObjectId> objects,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public SoftKeyMask {
            objects = frozen(objects);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.SOFT_KEY_MASK; }

        @Override public SoftKeyMask withId(ObjectId newId) {
            return new SoftKeyMask(newId, backgroundColour, objects, macroRefs);
        }

        public SoftKeyMask withObjects(List<ObjectId> keys) {
            return new SoftKeyMask(id, backgroundColour, keys, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() { return objects; }

        @Override public List<ObjectId> childObjects() { return objects; }
    }

    public record Key(
            ObjectId id,
            int backgroundColour,
            int keyCode,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public Key {
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.KEY; }

        @Override public Key withId(ObjectId newId) {
            return new Key(newId, backgroundColour, keyCode, objectRefs, macroRefs);
        }

        public Key withObjectRefs(List<ObjectRef> refs) {
            return new Key(id, backgroundColour, keyCode, refs, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record Button(
            ObjectId id,
            int width,
            int height,
            int backgroundColour,
            int borderColour,
            int keyCode,
            int options,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public Button {
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.BUTTON; }

        @Override public Button withId(ObjectId newId) {
            return new Button(newId, width, height, backgroundColour, borderColour, keyCode, options, objectRefs, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    // -----------------------------------------------------------------------
    // Input fields
    // -----------------------------------------------------------------------

    public record InputBoolean(
            ObjectId id,
            int backgroundColour,
            int width,
            ObjectId foregroundColour,
            NullableObjectId variableReference,
            boolean value,
            boolean enabled,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public InputBoolean {
            variableReference = orNone(variableReference);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.INPUT_BOOLEAN; }

        /** Input booleans are square. */
        @Override public int height() { return width; }

        @Override public InputBoolean withId(ObjectId newId) {
            return new InputBoolean(newId, backgroundColour, width, foregroundColour, variableReference, value, enabled, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(foregroundColour).nullable(variableReference).build();
        }
    }

    public record InputString(
            ObjectId id,
            int width,
            int height,
            int backgroundColour,
            ObjectId fontAttributes,
            NullableObjectId inputAttributes,
            int options,
            NullableObjectId variableReference,
            int justification,
            String value,
            boolean enabled,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public InputString {
            inputAttributes = orNone(inputAttributes);
            variableReference = orNone(variableReference);
            if (value == null) value = "";
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.INPUT_STRING; }

        @Override public InputString withId(ObjectId newId) {
            return new InputString(newId, width, height, backgroundColour, fontAttributes, inputAttributes, options,
                    variableReference, justification, value, enabled, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(fontAttributes).nullable(inputAttributes).nullable(variableReference).build();
        }
    }

    public record InputNumber(
            ObjectId id,
            int width,
            int height,
            int backgroundColour,
            ObjectId fontAttributes,
            int options,
            NullableObjectId variableReference,
            long value,
            long minValue,
            long maxValue,
            int offset,
            float scale,
            int numberOfDecimals,
            int format,
            int justification,
            int options2,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public InputNumber {
            variableReference = orNone(variableReference);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.INPUT_NUMBER; }

        @Override public InputNumber withId(ObjectId newId) {
            return new InputNumber(newId, width, height, backgroundColour, fontAttributes, options, variableReference,
                    value, minValue, maxValue, offset, scale, numberOfDecimals, format, justification, options2, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(fontAttributes).nullable(variableReference).build();
        }
    }

    public record InputList(
            ObjectId id,
            int width,
            int height,
            NullableObjectId variableReference,
            int value,
            int options,
            List<NullableObjectId> listItems,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public InputList {
            variableReference = orNone(variableReference);
            listItems = frozen(listItems);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.INPUT_LIST; }

        @Override public InputList withId(ObjectId newId) {
            return new InputList(newId, width, height, variableReference, value, options, listItems, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(variableReference).nullables(listItems).build();
        }

        @Override public List<ObjectId> childObjects() {
            return new Refs().nullables(listItems).build();
        }
    }

    // -----------------------------------------------------------------------
    // Output fields and graphics primitives
    // -----------------------------------------------------------------------

    public record OutputString(
            ObjectId id,
            int width,
            int height,
            int backgroundColour,
            ObjectId fontAttributes,
            int options,
            NullableObjectId variableReference,
            int justification,
            String value,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputString {
            variableReference = orNone(variableReference);
            if (value == null) value = "";
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_STRING; }

        @Override public OutputString withId(ObjectId newId) {
            return new OutputString(newId, width, height, backgroundColour, fontAttributes, options,
                    variableReference, justification, value, macroRefs);
        }

        public OutputString withValue(String text) {
            return new OutputString(id, width, height, backgroundColour, fontAttributes, options,
                    variableReference, justification, text, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(fontAttributes).nullable(variableReference).build();
        }
    }

    public record OutputNumber(
            ObjectId id,
            int width,
            int height,
            int backgroundColour,
            ObjectId fontAttributes,
            int options,
            NullableObjectId variableReference,
            long value,
            int offset,
            float scale,
            int numberOfDecimals,
            int format,
            int justification,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputNumber {
            variableReference = orNone(variableReference);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_NUMBER; }

        @Override public OutputNumber withId(ObjectId newId) {
            return new OutputNumber(newId, width, height, backgroundColour, fontAttributes, options, variableReference,
                    value, offset, scale, numberOfDecimals, format, justification, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(fontAttributes).nullable(variableReference).build();
        }
    }

    public record OutputLine(
            ObjectId id,
            ObjectId lineAttributes,
            int width,
            int height,
            int lineDirection,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputLine {
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_LINE; }

        @Override public OutputLine withId(ObjectId newId) {
            return new OutputLine(newId, lineAttributes, width, height, lineDirection, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(lineAttributes).build();
        }
    }

    public record OutputRectangle(
            ObjectId id,
            ObjectId lineAttributes,
            int width,
            int height,
            int lineSuppression,
            NullableObjectId fillAttributes,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputRectangle {
            fillAttributes = orNone(fillAttributes);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_RECTANGLE; }

        @Override public OutputRectangle withId(ObjectId newId) {
            return new OutputRectangle(newId, lineAttributes, width, height, lineSuppression, fillAttributes, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(lineAttributes).nullable(fillAttributes).build();
        }
    }

    public record OutputEllipse(
            ObjectId id,
            ObjectId lineAttributes,
            int width,
            int height,
            int ellipseType,
            int startAngle,
            int endAngle,
            NullableObjectId fillAttributes,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputEllipse {
            fillAttributes = orNone(fillAttributes);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_ELLIPSE; }

        @Override public OutputEllipse withId(ObjectId newId) {
            return new OutputEllipse(newId, lineAttributes, width, height, ellipseType, startAngle, endAngle,
                    fillAttributes, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(lineAttributes).nullable(fillAttributes).build();
        }
    }

    public record OutputPolygon(
            ObjectId id,
            int width,
            int height,
            ObjectId lineAttributes,
            NullableObjectId fillAttributes,
            int polygonType,
            List<Point> points,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputPolygon {
            fillAttributes = orNone(fillAttributes);
            points = frozen(points);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_POLYGON; }

        @Override public OutputPolygon withId(ObjectId newId) {
            return new OutputPolygon(newId, width, height, lineAttributes, fillAttributes, polygonType, points, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().id(lineAttributes).nullable(fillAttributes).build();
        }
    }

    public record OutputMeter(
            ObjectId id,
            int width,
            int needleColour,
            int borderColour,
            int arcAndTickColour,
            int options,
            int nrOfTicks,
            int startAngle,
            int endAngle,
            long minValue,
            long maxValue,
            NullableObjectId variableReference,
            long value,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputMeter {
            variableReference = orNone(variableReference);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_METER; }

        /** Meters are drawn in a square. */
        @Override public int height() { return width; }

        @Override public OutputMeter withId(ObjectId newId) {
            return new OutputMeter(newId, width, needleColour, borderColour, arcAndTickColour, options, nrOfTicks,
                    startAngle, endAngle, minValue, maxValue, variableReference, value, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(variableReference).build();
        }
    }

    public record OutputLinearBarGraph(
            ObjectId id,
            int width,
            int height,
            int colour,
            int targetLineColour,
            int options,
            int nrOfTicks,
            long minValue,
            long maxValue,
            NullableObjectId variableReference,
            long value,
            NullableObjectId targetValueVariableReference,
            long targetValue,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputLinearBarGraph {
            variableReference = orNone(variableReference);
            targetValueVariableReference = orNone(targetValueVariableReference);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_LINEAR_BAR_GRAPH; }

        @Override public OutputLinearBarGraph withId(ObjectId newId) {
            return new OutputLinearBarGraph(newId, width, height, colour, targetLineColour, options, nrOfTicks,
                    minValue, maxValue, variableReference, value, targetValueVariableReference, targetValue, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(variableReference).nullable(targetValueVariableReference).build();
        }
    }

    public record OutputArchedBarGraph(
            ObjectId id,
            int width,
            int height,
            int colour,
            int targetLineColour,
            int options,
            int startAngle,
            int endAngle,
            int barGraphWidth,
            long minValue,
            long maxValue,
            NullableObjectId variableReference,
            long value,
            NullableObjectId targetValueVariableReference,
            long targetValue,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputArchedBarGraph {
            variableReference = orNone(variableReference);
            targetValueVariableReference = orNone(targetValueVariableReference);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_ARCHED_BAR_GRAPH; }

        @Override public OutputArchedBarGraph withId(ObjectId newId) {
            return new OutputArchedBarGraph(newId, width, height, colour, targetLineColour, options, startAngle,
                    endAngle, barGraphWidth, minValue, maxValue, variableReference, value,
                    targetValueVariableReference, targetValue, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(variableReference).nullable(targetValueVariableReference).build();
        }
    }

    /**
     * Bitmap object. {@code width} is the displayed width; the displayed height keeps the aspect
     * ratio of the raw image ({@code actualWidth} x {@code actualHeight}).
     */
    public record PictureGraphic(
            ObjectId id,
            int width,
            int actualWidth,
            int actualHeight,
            int format,
            int options,
            int transparencyColour,
            byte[] data,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public PictureGraphic {
            data = copyOf(data);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.PICTURE_GRAPHIC; }

        @Override public int height() {
            return actualWidth == 0 ? 0 : (int) ((long) actualHeight * width / actualWidth);
        }

        @Override public byte[] data() { return data.clone(); }

        @Override public PictureGraphic withId(ObjectId newId) {
            return new PictureGraphic(newId, width, actualWidth, actualHeight, format, options, transparencyColour,
                    data, macroRefs);
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PictureGraphic other)) return false;
            return id.equals(other.id) && width == other.width && actualWidth == other.actualWidth
                    && actualHeight == other.actualHeight && format == other.format && options == other.options
                    && transparencyColour == other.transparencyColour && Arrays.equals(data, other.data)
                    && macroRefs.equals(other.macroRefs);
        }

        @Override public int hashCode() {
            return 31 * id.hashCode() + Arrays.hashCode(data);
        }

        @Override public String toString() {
            return "PictureGraphic[id=" + id + ", width=" + width + ", actual=" + actualWidth + "x" + actualHeight
                    + ", bytes=" + data.length + "]";
        }
    }

    // -----------------------------------------------------------------------
    // Variables and attributes
    // -----------------------------------------------------------------------

    public record NumberVariable(ObjectId id, long value) implements VtObject {
        @Override public ObjectType type() { return ObjectType.NUMBER_VARIABLE; }

        @Override public NumberVariable withId(ObjectId newId) { return new NumberVariable(newId, value); }
    }

    public record StringVariable(ObjectId id, String value) implements VtObject {
        public StringVariable {
            if (value == null) value = "";
        }

        @Override public ObjectType type() { return ObjectType.STRING_VARIABLE; }

        @Override public StringVariable withId(ObjectId newId) { return new StringVariable(newId, value); }
    }

    public record FontAttributes(
            ObjectId id,
            int fontColour,
            int fontSize,
            int fontType,
            int fontStyle,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public FontAttributes {
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.FONT_ATTRIBUTES; }

        @Override public FontAttributes withId(ObjectId newId) {
            return new FontAttributes(newId, fontColour, fontSize, fontType, fontStyle, macroRefs);
        }
    }

    public record LineAttributes(
            ObjectId id,
            int lineColour,
            int lineWidth,
            int lineArt,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public LineAttributes {
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.LINE_ATTRIBUTES; }

        @Override public LineAttributes withId(ObjectId newId) {
            return new LineAttributes(newId, lineColour, lineWidth, lineArt, macroRefs);
        }
    }

    public record FillAttributes(
            ObjectId id,
            int fillType,
            int fillColour,
            NullableObjectId fillPattern,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public FillAttributes {
            fillPattern = orNone(fillPattern);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.FILL_ATTRIBUTES; }

        @Override public FillAttributes withId(ObjectId newId) {
            return new FillAttributes(newId, fillType, fillColour, fillPattern, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(fillPattern).build();
        }
    }

    public record InputAttributes(
            ObjectId id,
            int validationType,
            String validationString,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public InputAttributes {
            if (validationString == null) validationString = "";
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.INPUT_ATTRIBUTES; }

        @Override public InputAttributes withId(ObjectId newId) {
            return new InputAttributes(newId, validationType, validationString, macroRefs);
        }
    }

    public record ExtendedInputAttributes(
            ObjectId id,
            int validationType,
            List<Integer> codePlanes
    ) implements VtObject {
        public ExtendedInputAttributes {
            codePlanes = frozen(codePlanes);
        }

        @Override public ObjectType type() { return ObjectType.EXTENDED_INPUT_ATTRIBUTES; }

        @Override public ExtendedInputAttributes withId(ObjectId newId) {
            return new ExtendedInputAttributes(newId, validationType, codePlanes);
        }
    }

    // -----------------------------------------------------------------------
    // Pointers and macros
    // -----------------------------------------------------------------------

    public record ObjectPointer(ObjectId id, NullableObjectId value) implements VtObject {
        public ObjectPointer {
            value = orNone(value);
        }

        @Override public ObjectType type() { return ObjectType.OBJECT_POINTER; }

        @Override public ObjectPointer withId(ObjectId newId) { return new ObjectPointer(newId, value); }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(value).build();
        }
    }

    /** Macro object. {@code commands} holds the encoded VT command bytes. */
    public record Macro(ObjectId id, byte[] commands) implements VtObject {
        public Macro {
            commands = copyOf(commands);
        }

        @Override public ObjectType type() { return ObjectType.MACRO; }

        @Override public byte[] commands() { return commands.clone(); }

        @Override public Macro withId(ObjectId newId) { return new Macro(newId, commands); }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Macro other)) return false;
            return id.equals(other.id) && Arrays.equals(commands, other.commands);
        }

        @Override public int hashCode() {
            return 31 * id.hashCode() + Arrays.hashCode(commands);
        }

        @Override public String toString() {
            return "Macro[id=" + id + ", commands=" + Arrays.toString(commands) + "]";
        }
    }

    public record ExternalObjectPointer(
            ObjectId id,
            NullableObjectId defaultObjectId,
            NullableObjectId externalReferenceNameId,
            NullableObjectId externalObjectId
    ) implements VtObject {
        public ExternalObjectPointer {
            defaultObjectId = orNone(defaultObjectId);
            externalReferenceNameId = orNone(externalReferenceNameId);
            externalObjectId = orNone(externalObjectId);
        }

        @Override public ObjectType type() { return ObjectType.EXTERNAL_OBJECT_POINTER; }

        @Override public ExternalObjectPointer withId(ObjectId newId) {
            return new ExternalObjectPointer(newId, defaultObjectId, externalReferenceNameId, externalObjectId);
        }

        /** The external object id lives in another working set's pool and is not listed. */
        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(defaultObjectId).nullable(externalReferenceNameId).build();
        }
    }

    public record ExternalObjectDefinition(
            ObjectId id,
            int options,
            long name,
            List<NullableObjectId> objects
    ) implements VtObject {
        public ExternalObjectDefinition {
            objects = frozen(objects);
        }

        @Override public ObjectType type() { return ObjectType.EXTERNAL_OBJECT_DEFINITION; }

        @Override public ExternalObjectDefinition withId(ObjectId newId) {
            return new ExternalObjectDefinition(newId, options, name, objects);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullables(objects).build();
        }
    }

    public record ExternalReferenceName(ObjectId id, int options, long name) implements VtObject {
        @Override public ObjectType type() { return ObjectType.EXTERNAL_REFERENCE_NAME; }

        @Override public ExternalReferenceName withId(ObjectId newId) {
            return new ExternalReferenceName(newId, options, name);
        }
    }

    // -----------------------------------------------------------------------
    // Auxiliary control
    // -----------------------------------------------------------------------

    public record AuxiliaryFunctionType1(
            ObjectId id,
            int backgroundColour,
            int functionType,
            List<ObjectRef> objectRefs
    ) implements VtObject {
        public AuxiliaryFunctionType1 {
            objectRefs = frozen(objectRefs);
        }

        @Override public ObjectType type() { return ObjectType.AUXILIARY_FUNCTION_TYPE_1; }

        @Override public AuxiliaryFunctionType1 withId(ObjectId newId) {
            return new AuxiliaryFunctionType1(newId, backgroundColour, functionType, objectRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record AuxiliaryInputType1(
            ObjectId id,
            int backgroundColour,
            int functionType,
            int inputId,
            List<ObjectRef> objectRefs
    ) implements VtObject {
        public AuxiliaryInputType1 {
            objectRefs = frozen(objectRefs);
        }

        @Override public ObjectType type() { return ObjectType.AUXILIARY_INPUT_TYPE_1; }

        @Override public AuxiliaryInputType1 withId(ObjectId newId) {
            return new AuxiliaryInputType1(newId, backgroundColour, functionType, inputId, objectRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record AuxiliaryFunctionType2(
            ObjectId id,
            int backgroundColour,
            int functionAttributes,
            List<ObjectRef> objectRefs
    ) implements VtObject {
        public AuxiliaryFunctionType2 {
            objectRefs = frozen(objectRefs);
        }

        @Override public ObjectType type() { return ObjectType.AUXILIARY_FUNCTION_TYPE_2; }

        @Override public AuxiliaryFunctionType2 withId(ObjectId newId) {
            return new AuxiliaryFunctionType2(newId, backgroundColour, functionAttributes, objectRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record AuxiliaryInputType2(
            ObjectId id,
            int backgroundColour,
            int functionAttributes,
            List<ObjectRef> objectRefs
    ) implements VtObject {
        public AuxiliaryInputType2 {
            objectRefs = frozen(objectRefs);
        }

        @Override public ObjectType type() { return ObjectType.AUXILIARY_INPUT_TYPE_2; }

        @Override public AuxiliaryInputType2 withId(ObjectId newId) {
            return new AuxiliaryInputType2(newId, backgroundColour, functionAttributes, objectRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    /**
     * Pointer type 2 ("working set object of this pool") requires a null auxiliary object id.
     */
    public record AuxiliaryControlDesignatorType2(
            ObjectId id,
            int pointerType,
            NullableObjectId auxiliaryObjectId
    ) implements VtObject {
        public AuxiliaryControlDesignatorType2 {
            auxiliaryObjectId = pointerType == 2 ? NullableObjectId.NONE : orNone(auxiliaryObjectId);
        }

        @Override public ObjectType type() { return ObjectType.AUXILIARY_CONTROL_DESIGNATOR_TYPE_2; }

        @Override public AuxiliaryControlDesignatorType2 withId(ObjectId newId) {
            return new AuxiliaryControlDesignatorType2(newId, pointerType, auxiliaryObjectId);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(auxiliaryObjectId).build();
        }
    }

    // -----------------------------------------------------------------------
    // Version 4+ objects
    // -----------------------------------------------------------------------

    /** Window mask size is given in window cells, so it has no pixel extent of its own. */
    public record WindowMask(
            ObjectId id,
            int width,
            int height,
            int windowType,
            int backgroundColour,
            int options,
            NullableObjectId name,
            NullableObjectId windowTitle,
            NullableObjectId windowIcon,
            List<NullableObjectId> objects,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public WindowMask {
            name = orNone(name);
            windowTitle = orNone(windowTitle);
            windowIcon = orNone(windowIcon);
            objects = frozen(objects);
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.WINDOW_MASK; }

        @Override public WindowMask withId(ObjectId newId) {
            return new WindowMask(newId, width, height, windowType, backgroundColour, options, name, windowTitle,
                    windowIcon, objects, objectRefs, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(name).nullable(windowTitle).nullable(windowIcon)
                    .nullables(objects).objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() {
            return new Refs().nullables(objects).objectRefs(objectRefs).build();
        }
    }

    public record KeyGroup(
            ObjectId id,
            int options,
            NullableObjectId name,
            NullableObjectId keyGroupIcon,
            List<ObjectId> objects,
            List<MacroRef> macroRefs
    ) implements VtObject {
        public KeyGroup {
            name = orNone(name);
            keyGroupIcon = orNone(keyGroupIcon);
            objects = frozen(objects);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.KEY_GROUP; }

        @Override public KeyGroup withId(ObjectId newId) {
            return new KeyGroup(newId, options, name, keyGroupIcon, objects, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(name).nullable(keyGroupIcon).ids(objects).build();
        }

        @Override public List<ObjectId> childObjects() { return objects; }
    }

    public record GraphicsContext(
            ObjectId id,
            int viewportWidth,
            int viewportHeight,
            int viewportX,
            int viewportY,
            int canvasWidth,
            int canvasHeight,
            float viewportZoom,
            int graphicsCursorX,
            int graphicsCursorY,
            int foregroundColour,
            int backgroundColour,
            NullableObjectId fontAttributesObject,
            NullableObjectId lineAttributesObject,
            NullableObjectId fillAttributesObject,
            int format,
            int options,
            int transparencyColour
    ) implements VtObject, SizedObject {
        public GraphicsContext {
            fontAttributesObject = orNone(fontAttributesObject);
            lineAttributesObject = orNone(lineAttributesObject);
            fillAttributesObject = orNone(fillAttributesObject);
        }

        @Override public ObjectType type() { return ObjectType.GRAPHICS_CONTEXT; }

        @Override public int width() { return viewportWidth; }

        @Override public int height() { return viewportHeight; }

        @Override public GraphicsContext withId(ObjectId newId) {
            return new GraphicsContext(newId, viewportWidth, viewportHeight, viewportX, viewportY, canvasWidth,
                    canvasHeight, viewportZoom, graphicsCursorX, graphicsCursorY, foregroundColour, backgroundColour,
                    fontAttributesObject, lineAttributesObject, fillAttributesObject, format, options,
                    transparencyColour);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(fontAttributesObject).nullable(lineAttributesObject)
                    .nullable(fillAttributesObject).build();
        }
    }

    public record OutputList(
            ObjectId id,
            int width,
            int height,
            NullableObjectId variableReference,
            int value,
            List<NullableObjectId> listItems,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public OutputList {
            variableReference = orNone(variableReference);
            listItems = frozen(listItems);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.OUTPUT_LIST; }

        @Override public OutputList withId(ObjectId newId) {
            return new OutputList(newId, width, height, variableReference, value, listItems, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(variableReference).nullables(listItems).build();
        }

        @Override public List<ObjectId> childObjects() {
            return new Refs().nullables(listItems).build();
        }
    }

    public record ColourMap(ObjectId id, List<Integer> colourMap) implements VtObject {
        public ColourMap {
            colourMap = frozen(colourMap);
        }

        @Override public ObjectType type() { return ObjectType.COLOUR_MAP; }

        @Override public ColourMap withId(ObjectId newId) { return new ColourMap(newId, colourMap); }
    }

    /** One entry of an {@link ObjectLabelReferenceList}. */
    public record ObjectLabel(
            ObjectId id,
            NullableObjectId stringVariableReference,
            int fontType,
            NullableObjectId graphicRepresentation
    ) {
        public ObjectLabel {
            stringVariableReference = orNone(stringVariableReference);
            graphicRepresentation = orNone(graphicRepresentation);
        }
    }

    public record ObjectLabelReferenceList(ObjectId id, List<ObjectLabel> objectLabels) implements VtObject {
        public ObjectLabelReferenceList {
            objectLabels = frozen(objectLabels);
        }

        @Override public ObjectType type() { return ObjectType.OBJECT_LABEL_REFERENCE_LIST; }

        @Override public ObjectLabelReferenceList withId(ObjectId newId) {
            return new ObjectLabelReferenceList(newId, objectLabels);
        }

        @Override public List<ObjectId> referencedObjects() {
            Refs refs = new Refs();
            for (ObjectLabel label : objectLabels) {
                refs.id(label.id()).nullable(label.stringVariableReference()).nullable(label.graphicRepresentation());
            }
            return refs.build();
        }
    }

    public record Animation(
            ObjectId id,
            int width,
            int height,
            int refreshInterval,
            int value,
            boolean enabled,
            int firstChildIndex,
            int lastChildIndex,
            int defaultChildIndex,
            int options,
            List<ObjectRef> objectRefs,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public Animation {
            objectRefs = frozen(objectRefs);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.ANIMATION; }

        @Override public Animation withId(ObjectId newId) {
            return new Animation(newId, width, height, refreshInterval, value, enabled, firstChildIndex,
                    lastChildIndex, defaultChildIndex, options, objectRefs, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().objectRefs(objectRefs).build();
        }

        @Override public List<ObjectId> childObjects() { return idsOf(objectRefs); }
    }

    public record ColourPalette(ObjectId id, int options, List<Integer> colours) implements VtObject {
        public ColourPalette {
            colours = frozen(colours);
        }

        @Override public ObjectType type() { return ObjectType.COLOUR_PALETTE; }

        @Override public ColourPalette withId(ObjectId newId) { return new ColourPalette(newId, options, colours); }
    }

    public record GraphicData(ObjectId id, int format, byte[] data) implements VtObject {
        public GraphicData {
            data = copyOf(data);
        }

        @Override public ObjectType type() { return ObjectType.GRAPHIC_DATA; }

        @Override public byte[] data() { return data.clone(); }

        @Override public GraphicData withId(ObjectId newId) { return new GraphicData(newId, format, data); }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GraphicData other)) return false;
            return id.equals(other.id) && format == other.format && Arrays.equals(data, other.data);
        }

        @Override public int hashCode() {
            return 31 * id.hashCode() + Arrays.hashCode(data);
        }

        @Override public String toString() {
            return "GraphicData[id=" + id + ", format=" + format + ", bytes=" + data.length + "]";
        }
    }

    public record WorkingSetSpecialControls(
            ObjectId id,
            NullableObjectId idOfColourMap,
            NullableObjectId idOfColourPalette,
            List<String> languagePairs
    ) implements VtObject {
        public WorkingSetSpecialControls {
            idOfColourMap = orNone(idOfColourMap);
            idOfColourPalette = orNone(idOfColourPalette);
            languagePairs = frozen(languagePairs);
        }

        @Override public ObjectType type() { return ObjectType.WORKING_SET_SPECIAL_CONTROLS; }

        @Override public WorkingSetSpecialControls withId(ObjectId newId) {
            return new WorkingSetSpecialControls(newId, idOfColourMap, idOfColourPalette, languagePairs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(idOfColourMap).nullable(idOfColourPalette).build();
        }
    }

    public record ScaledGraphic(
            ObjectId id,
            int width,
            int height,
            int scaleType,
            int options,
            NullableObjectId value,
            List<MacroRef> macroRefs
    ) implements VtObject, SizedObject {
        public ScaledGraphic {
            value = orNone(value);
            macroRefs = frozen(macroRefs);
        }

        @Override public ObjectType type() { return ObjectType.SCALED_GRAPHIC; }

        @Override public ScaledGraphic withId(ObjectId newId) {
            return new ScaledGraphic(newId, width, height, scaleType, options, value, macroRefs);
        }

        @Override public List<ObjectId> referencedObjects() {
            return new Refs().nullable(value).build();
        }
    }
}
