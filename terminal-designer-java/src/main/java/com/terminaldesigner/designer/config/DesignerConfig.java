package com.terminaldesigner.designer.config;

import com.google.gson.annotations.SerializedName;
import com.terminaldesigner.designer.project.EditorProject;
import com.terminaldesigner.pool.VtVersion;

import java.util.OptionalInt;

/**
 * Deserialized form of designer.json. Every setting is optional; defaults are applied in the getters.
 */
public class DesignerConfig {

    /** Name all objects of an imported pool that have no name yet (default: true). */
    @SerializedName("smart_naming_on_import")
    private Boolean smartNamingOnImport;

    /** VT version used for schema checks when the project does not say (default: 3). */
    @SerializedName("vt_version")
    private Integer vtVersion;

    @SerializedName("pool_history_limit")
    private Integer poolHistoryLimit;

    @SerializedName("selection_history_limit")
    private Integer selectionHistoryLimit;

    /** Overrides the mask size computed from an imported pool. */
    @SerializedName("default_mask_size")
    private Integer defaultMaskSize;

    public static DesignerConfig defaults() {
        return new DesignerConfig();
    }

    public boolean isSmartNamingOnImport() { return smartNamingOnImport == null || smartNamingOnImport; }
    public VtVersion getVtVersion()         { return vtVersion != null ? VtVersion.fromNumber(vtVersion) : VtVersion.VERSION_3; }
    public int getPoolHistoryLimit() {
        return poolHistoryLimit != null ? poolHistoryLimit : EditorProject.DEFAULT_POOL_HISTORY_LIMIT;
    }
    public int getSelectionHistoryLimit() {
        return selectionHistoryLimit != null ? selectionHistoryLimit : EditorProject.DEFAULT_SELECTION_HISTORY_LIMIT;
    }
    public OptionalInt getDefaultMaskSize() {
        return defaultMaskSize != null ? OptionalInt.of(defaultMaskSize) : OptionalInt.empty();
    }
}
