package com.terminaldesigner.pool;

import com.google.gson.*;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of an object pool: an array of objects, each tagged with its kind label in a
 * {@code "type"} member. Object ids are plain numbers; a null reference is written as 65535.
 *
 * Decoding a pool then encoding it again yields the same JSON, and decoding an encoded pool
 * yields a pool equal to the original.
 */
public final class PoolJson {

    public static class PoolFormatException extends Exception {
        public PoolFormatException(String msg) { super(msg); }
        public PoolFormatException(String msg, Throwable cause) { super(msg, cause); }
    }

    static final String TYPE_MEMBER = "type";

    private static final Gson GSON = gsonBuilder().create();

    private PoolJson() {}

    /** Gson configured with the id adapters; other documents embedding pool data build on it. */
    public static GsonBuilder gsonBuilder() {
        return new GsonBuilder()
                .registerTypeAdapter(ObjectId.class, new ObjectIdAdapter().nullSafe())
                .registerTypeAdapter(NullableObjectId.class, new NullableObjectIdAdapter())
                .disableHtmlEscaping();
    }

    public static JsonArray toJsonTree(ObjectPool pool) {
        JsonArray array = new JsonArray();
        for (VtObject object : pool.objects()) {
            JsonObject tree = GSON.toJsonTree(object, object.getClass()).getAsJsonObject();
            JsonObject tagged = new JsonObject();
            tagged.addProperty(TYPE_MEMBER, object.type().label());
            for (var member : tree.entrySet()) {
                tagged.add(member.getKey(), member.getValue());
            }
            array.add(tagged);
        }
        return array;
    }

    public static String toJson(ObjectPool pool) {
        return gsonBuilder().setPrettyPrinting().create().toJson(toJsonTree(pool));
    }

    public static ObjectPool fromJson(String json) throws PoolFormatException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new PoolFormatException("Malformed pool JSON: " + e.getMessage(), e);
        }
        return fromJsonTree(root);
    }

    /**
     * Decodes a pool array. Objects with a duplicate id are skipped with a warning (first wins).
     */
    public static ObjectPool fromJsonTree(JsonElement root) throws PoolFormatException {
        if (root == null || !root.isJsonArray()) {
            throw new PoolFormatException("Object pool must be a JSON array");
        }
        List<VtObject> decoded = new ArrayList<>();
        int index = 0;
        for (JsonElement element : root.getAsJsonArray()) {
            decoded.add(decodeObject(element, index++));
        }
        return new ObjectPool(decoded);
    }

    private static VtObject decodeObject(JsonElement element, int index) throws PoolFormatException {
        if (!element.isJsonObject()) {
            throw new PoolFormatException("Pool entry " + index + " is not a JSON object");
        }
        JsonObject tree = element.getAsJsonObject().deepCopy();
        JsonElement label = tree.remove(TYPE_MEMBER);
        if (label == null || !label.isJsonPrimitive()) {
            throw new PoolFormatException("Pool entry " + index + " has no \"type\" member");
        }

        ObjectType type;
        try {
            type = ObjectType.fromLabel(label.getAsString());
        } catch (IllegalArgumentException e) {
            throw new PoolFormatException("Pool entry " + index + ": " + e.getMessage(), e);
        }

        VtObject object;
        try {
            object = GSON.fromJson(tree, type.objectClass());
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new PoolFormatException("Pool entry " + index + " (" + type.label() + "): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Gson reports a failing record constructor as a plain RuntimeException wrapping the cause
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PoolFormatException("Pool entry " + index + " (" + type.label() + "): invalid field value: "
                    + cause.getMessage(), e);
        }
        if (object == null || object.id() == null) {
            throw new PoolFormatException("Pool entry " + index + " (" + type.label() + ") has no id");
        }
        return object;
    }

    // --- adapters ---

    static final class ObjectIdAdapter extends TypeAdapter<ObjectId> {
        @Override
        public void write(JsonWriter out, ObjectId value) throws IOException {
            out.value(value.value());
        }

        @Override
        public ObjectId read(JsonReader in) throws IOException {
            int raw = in.nextInt();
            try {
                return ObjectId.of(raw);
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage(), e);
            }
        }
    }

    static final class NullableObjectIdAdapter extends TypeAdapter<NullableObjectId> {
        @Override
        public void write(JsonWriter out, NullableObjectId value) throws IOException {
            out.value(value == null ? ObjectId.NULL_VALUE : value.wireValue());
        }

        @Override
        public NullableObjectId read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return NullableObjectId.NONE;
            }
            int raw = in.nextInt();
            if (raw < 0 || raw > ObjectId.NULL_VALUE) {
                throw new JsonParseException("Object reference out of range: " + raw);
            }
            return NullableObjectId.of(raw);
        }
    }
}
