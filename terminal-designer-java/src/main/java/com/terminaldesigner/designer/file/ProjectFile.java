package com.terminaldesigner.designer.file;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.terminaldesigner.designer.config.DesignerConfig;
import com.terminaldesigner.designer.info.ObjectInfoTable;
import com.terminaldesigner.designer.project.EditorProject;
import com.terminaldesigner.pool.*;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Saved editor project: the pool, the object names, the VT version, the mask size and the last selection.
 *
 * The file is JSON:
 * <pre>
 * {
 *   "format_version": 1,
 *   "vt_version": 4,
 *   "object_pool": [ ...pool objects... ],
 *   "object_info": { "1000": "Main Screen" },
 *   "mask_size": 480,
 *   "last_selected_id": 1000
 * }
 * </pre>
 * Names are stored by numeric object id and re-attached to fresh unique ids on load.
 */
public class ProjectFile {

    public static final int FORMAT_VERSION = 1;

    public static class ProjectFileException extends Exception {
        public ProjectFileException(String msg) { super(msg); }
        public ProjectFileException(String msg, Throwable cause) { super(msg, cause); }
    }

    private static final Gson GSON = PoolJson.gsonBuilder().setPrettyPrinting().create();

    private final ObjectPool pool;
    private final VtVersion vtVersion;
    private final SortedMap<Integer, String> names;
    private final Integer maskSize;
    private final NullableObjectId lastSelected;

    public ProjectFile(ObjectPool pool, VtVersion vtVersion, Map<Integer, String> names, Integer maskSize,
                       NullableObjectId lastSelected) {
        this.pool = pool.copy();
        this.vtVersion = vtVersion;
        this.names = Collections.unmodifiableSortedMap(new TreeMap<>(names));
        this.maskSize = maskSize;
        this.lastSelected = lastSelected == null ? NullableObjectId.NONE : lastSelected;
    }

    public static ProjectFile fromProject(EditorProject project) {
        return new ProjectFile(project.pool(), project.vtVersion(), project.objectInfo().namesById(),
                project.maskSize(), project.selected());
    }

    /** A new project in the loaded state, without undo history. */
    public EditorProject toProject(DesignerConfig config) {
        EditorProject project = new EditorProject(pool, config.getPoolHistoryLimit(),
                config.getSelectionHistoryLimit());
        project.setObjectInfo(ObjectInfoTable.restore(pool, names));
        project.setVtVersion(vtVersion);
        if (maskSize != null) project.setMaskSize(maskSize);
        if (!lastSelected.isNone() && pool.contains(lastSelected.id())) {
            project.restoreSelection(lastSelected);
        }
        return project;
    }

    public EditorProject toProject() {
        return toProject(DesignerConfig.defaults());
    }

    // --- encoding ---

    public byte[] toBytes() {
        Document doc = new Document();
        doc.formatVersion = FORMAT_VERSION;
        doc.vtVersion = vtVersion.number();
        doc.objectPool = PoolJson.toJsonTree(pool);
        doc.objectInfo = new LinkedHashMap<>();
        names.forEach((id, name) -> doc.objectInfo.put(Integer.toString(id), name));
        doc.maskSize = maskSize;
        doc.lastSelectedId = lastSelected.isNone() ? null : lastSelected.id().value();
        return GSON.toJson(doc).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws ProjectFileException if the bytes are not a project document this version can read
     */
    public static ProjectFile fromBytes(byte[] content) throws ProjectFileException {
        Document doc;
        try {
            doc = GSON.fromJson(new String(content, StandardCharsets.UTF_8), Document.class);
        } catch (JsonParseException e) {
            throw new ProjectFileException("Project file is not valid JSON: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new ProjectFileException("Project file is empty");
        }
        if (doc.formatVersion == null) {
            throw new ProjectFileException("Project file has no format_version");
        }
        if (doc.formatVersion > FORMAT_VERSION) {
            throw new ProjectFileException("Unsupported project format version: " + doc.formatVersion);
        }

        VtVersion version;
        try {
            version = doc.vtVersion != null ? VtVersion.fromNumber(doc.vtVersion) : VtVersion.VERSION_3;
        } catch (IllegalArgumentException e) {
            throw new ProjectFileException(e.getMessage(), e);
        }

        ObjectPool pool;
        try {
            pool = PoolJson.fromJsonTree(doc.objectPool);
        } catch (PoolJson.PoolFormatException e) {
            throw new ProjectFileException("Invalid object pool: " + e.getMessage(), e);
        }

        Map<Integer, String> names = new TreeMap<>();
        if (doc.objectInfo != null) {
            for (var entry : doc.objectInfo.entrySet()) {
                try {
                    names.put(Integer.parseInt(entry.getKey()), entry.getValue());
                } catch (NumberFormatException e) {
                    throw new ProjectFileException("Invalid object id in object_info: " + entry.getKey(), e);
                }
            }
        }

        NullableObjectId selected = NullableObjectId.NONE;
        if (doc.lastSelectedId != null) {
            if (doc.lastSelectedId < 0 || doc.lastSelectedId > ObjectId.NULL_VALUE) {
                throw new ProjectFileException("Invalid last_selected_id: " + doc.lastSelectedId);
            }
            selected = NullableObjectId.of(doc.lastSelectedId);
        }
        return new ProjectFile(pool, version, names, doc.maskSize, selected);
    }

    public ObjectPool pool() { return pool.copy(); }
    public VtVersion vtVersion() { return vtVersion; }
    public Map<Integer, String> names() { return names; }
    public Optional<Integer> maskSize() { return Optional.ofNullable(maskSize); }
    public NullableObjectId lastSelected() { return lastSelected; }

    private static class Document {
        @SerializedName("format_version")
        Integer formatVersion;

        @SerializedName("vt_version")
        Integer vtVersion;

        @SerializedName("object_pool")
        JsonArray objectPool;

        @SerializedName("object_info")
        Map<String, String> objectInfo;

        @SerializedName("mask_size")
        Integer maskSize;

        @SerializedName("last_selected_id")
        Integer lastSelectedId;
    }
}
