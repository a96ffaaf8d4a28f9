package com.terminaldesigner.designer.session;

import com.terminaldesigner.designer.config.DesignerConfig;
import com.terminaldesigner.designer.file.FileRequestChannel;
import com.terminaldesigner.designer.file.ProjectFile;
import com.terminaldesigner.designer.project.EditorProject;
import com.terminaldesigner.pool.IopCodec;
import com.terminaldesigner.pool.ObjectPool;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * State behind the designer window: the open project (if any), pending file reads and the
 * import options. The host calls {@link #tick()} once per frame.
 */
public class DesignerSession {

    private final DesignerConfig config;
    private final FileRequestChannel files;
    private final IopCodec iopCodec;
    private EditorProject project;
    private boolean smartNamingOnImport;

    /**
     * @param iopCodec binary pool codec; may be null, in which case pool import and export are unavailable
     */
    public DesignerSession(DesignerConfig config, FileRequestChannel files, IopCodec iopCodec) {
        this.config = config;
        this.files = files;
        this.iopCodec = iopCodec;
        this.smartNamingOnImport = config.isSmartNamingOnImport();
    }

    public Optional<EditorProject> project() {
        return Optional.ofNullable(project);
    }

    public boolean isSmartNamingOnImport() {
        return smartNamingOnImport;
    }

    public void setSmartNamingOnImport(boolean enabled) {
        this.smartNamingOnImport = enabled;
    }

    public void requestFile(FileRequestChannel.Reason reason, Supplier<byte[]> reader) {
        files.submit(reason, reader);
    }

    /**
     * Handles a finished file read, then commits the open project's staged pool and selection.
     *
     * @return true if anything changed and the window should repaint
     */
    public boolean tick() {
        boolean changed = handleFileLoaded();
        if (project != null) {
            changed |= project.updatePool();
            changed |= project.updateSelected();
        }
        return changed;
    }

    private boolean handleFileLoaded() {
        Optional<FileRequestChannel.FileResult> pending = files.poll();
        if (pending.isEmpty()) return false;
        FileRequestChannel.FileResult result = pending.get();
        if (result.failed()) {
            System.err.println("[terminal-designer] ERROR: failed to read file: " + result.error().getMessage());
            return false;
        }

        switch (result.reason()) {
            case LOAD_POOL -> {
                if (iopCodec == null) {
                    System.err.println("[terminal-designer] ERROR: no pool codec available, import skipped");
                    return false;
                }
                try {
                    importPool(iopCodec.decode(result.content()));
                } catch (IopCodec.IopFormatException e) {
                    System.err.println("[terminal-designer] ERROR: failed to import pool: " + e.getMessage());
                    return false;
                }
            }
            case LOAD_PROJECT -> {
                try {
                    project = ProjectFile.fromBytes(result.content()).toProject(config);
                } catch (ProjectFile.ProjectFileException e) {
                    System.err.println("[terminal-designer] ERROR: failed to load project: " + e.getMessage());
                    return false;
                }
            }
        }
        return true;
    }

    /** Opens {@code pool} as a new project, naming its objects if smart naming on import is enabled. */
    public EditorProject importPool(ObjectPool pool) {
        EditorProject imported = new EditorProject(pool, config.getPoolHistoryLimit(),
                config.getSelectionHistoryLimit());
        imported.setVtVersion(config.getVtVersion());
        config.getDefaultMaskSize().ifPresent(imported::setMaskSize);
        if (smartNamingOnImport) {
            int named = imported.applySmartNaming(imported.stagedPool().objects());
            System.err.println("[terminal-designer] named " + named + " imported objects");
        }
        project = imported;
        return imported;
    }

    public Optional<byte[]> saveProject() {
        return project().map(p -> ProjectFile.fromProject(p).toBytes());
    }

    public Optional<byte[]> exportPool() {
        if (iopCodec == null) return Optional.empty();
        return project().map(p -> iopCodec.encode(p.pool()));
    }
}
