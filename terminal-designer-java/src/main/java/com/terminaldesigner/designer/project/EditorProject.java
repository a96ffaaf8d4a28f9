package com.terminaldesigner.designer.project;

import com.terminaldesigner.designer.info.ObjectInfo;
import com.terminaldesigner.designer.info.ObjectInfoTable;
import com.terminaldesigner.designer.naming.NamingEngine;
import com.terminaldesigner.pool.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Editing state of one object pool.
 *
 * Edits are made on a staged copy of the pool and a staged selection. Once per UI tick the host
 * calls {@link #updatePool()} and {@link #updateSelected()}, which commit whatever changed and
 * record the previous state for undo. Nothing is validated here: the staged pool accepts any edit.
 *
 * History:
 * - pool snapshots, bounded by {@code poolHistoryLimit} (10 by default)
 * - selections, bounded by {@code selectionHistoryLimit} (20 by default); deselecting is committed
 *   but not recorded
 *
 * Object names live in an {@link ObjectInfoTable} that is not part of the undo history, except that
 * undo and redo of a renumber move the name back and forth with the object.
 */
public class EditorProject {

    public static final int DEFAULT_POOL_HISTORY_LIMIT = 10;
    public static final int DEFAULT_SELECTION_HISTORY_LIMIT = 20;
    public static final int MIN_MASK_SIZE = 100;
    public static final int MAX_MASK_SIZE = 2000;

    public static class IdConflictException extends Exception {
        public IdConflictException(String msg) { super(msg); }
    }

    /** Name being typed for an object, not yet applied. */
    public record RenameState(ObjectId objectId, String name) {}

    private record Renumber(ObjectId from, ObjectId to) {}

    /** A committed pool and the renumbers that lead from it to its neighbour in history. */
    private record Revision(ObjectPool pool, List<Renumber> renumbers) {}

    private ObjectPool pool;
    private ObjectPool stagedPool;
    private final BoundedHistory<Revision> undoPoolHistory;
    private final BoundedHistory<Revision> redoPoolHistory;
    private final List<Renumber> stagedRenumbers = new ArrayList<>();

    private NullableObjectId selected = NullableObjectId.NONE;
    private NullableObjectId stagedSelected = NullableObjectId.NONE;
    private final BoundedHistory<NullableObjectId> undoSelectedHistory;
    private final BoundedHistory<NullableObjectId> redoSelectedHistory;

    private int maskSize;
    private final int softKeyWidth;
    private final int softKeyHeight;
    private VtVersion vtVersion = VtVersion.VERSION_3;

    private ObjectInfoTable objectInfo = new ObjectInfoTable();
    private final ObjectIdAllocator allocator = new ObjectIdAllocator();
    private RenameState renaming;

    public EditorProject(ObjectPool pool) {
        this(pool, DEFAULT_POOL_HISTORY_LIMIT, DEFAULT_SELECTION_HISTORY_LIMIT);
    }

    /** Starts a project on {@code pool}; the mask geometry is the smallest that fits the pool. */
    public EditorProject(ObjectPool pool, int poolHistoryLimit, int selectionHistoryLimit) {
        this.pool = pool.copy();
        this.stagedPool = pool.copy();
        this.undoPoolHistory = new BoundedHistory<>(poolHistoryLimit);
        this.redoPoolHistory = new BoundedHistory<>(poolHistoryLimit);
        this.undoSelectedHistory = new BoundedHistory<>(selectionHistoryLimit);
        this.redoSelectedHistory = new BoundedHistory<>(selectionHistoryLimit);

        MaskSizes sizes = pool.minimumMaskSizes();
        this.maskSize = clampMaskSize(sizes.maskSize());
        this.softKeyWidth = sizes.softKeyWidth();
        this.softKeyHeight = sizes.softKeyHeight();
        allocator.resync(pool);
    }

    // --- pool staging and history ---

    /** A copy of the committed pool. Edits go through {@link #editStagedPool}. */
    public ObjectPool pool() {
        return pool.copy();
    }

    public ObjectPool stagedPool() {
        return stagedPool;
    }

    public void editStagedPool(Consumer<ObjectPool> edit) {
        edit.accept(stagedPool);
    }

    /**
     * Commits the staged pool if it differs from the committed one.
     *
     * @return true if a change was committed
     */
    public boolean updatePool() {
        if (stagedPool.equals(pool)) return false;
        redoPoolHistory.clear();
        undoPoolHistory.push(new Revision(pool, List.copyOf(stagedRenumbers)));
        stagedRenumbers.clear();
        pool = stagedPool.copy();
        return true;
    }

    /**
     * Restores the previous pool; staged and committed are replaced together and uncommitted edits
     * are dropped. Names of renumbered objects move back to their old ids. No-op without history.
     */
    public void undo() {
        undoPoolHistory.pop().ifPresent(previous -> {
            revertRenumbers(stagedRenumbers);
            stagedRenumbers.clear();
            redoPoolHistory.push(new Revision(pool, previous.renumbers()));
            revertRenumbers(previous.renumbers());
            restorePool(previous.pool());
        });
    }

    public void redo() {
        redoPoolHistory.pop().ifPresent(next -> {
            revertRenumbers(stagedRenumbers);
            stagedRenumbers.clear();
            undoPoolHistory.push(new Revision(pool, next.renumbers()));
            for (Renumber renumber : next.renumbers()) {
                objectInfo.migrate(renumber.from(), renumber.to());
            }
            restorePool(next.pool());
        });
    }

    private void revertRenumbers(List<Renumber> renumbers) {
        for (int i = renumbers.size() - 1; i >= 0; i--) {
            objectInfo.migrate(renumbers.get(i).to(), renumbers.get(i).from());
        }
    }

    private void restorePool(ObjectPool snapshot) {
        pool = snapshot;
        stagedPool = snapshot.copy();
        allocator.resync(pool);
    }

    public boolean undoAvailable() {
        return !undoPoolHistory.isEmpty();
    }

    public boolean redoAvailable() {
        return !redoPoolHistory.isEmpty();
    }

    // --- selection staging and history ---

    public NullableObjectId selected() {
        return selected;
    }

    public NullableObjectId stagedSelected() {
        return stagedSelected;
    }

    public void setStagedSelection(NullableObjectId selection) {
        stagedSelected = selection == null ? NullableObjectId.NONE : selection;
    }

    /**
     * Commits the staged selection if it changed. Selecting an object records the previous
     * selection; clearing the selection does not.
     *
     * @return true if the selection changed
     */
    public boolean updateSelected() {
        if (stagedSelected.equals(selected)) return false;
        redoSelectedHistory.clear();
        if (!stagedSelected.isNone()) {
            undoSelectedHistory.push(selected);
        }
        selected = stagedSelected;
        return true;
    }

    public void previousSelected() {
        undoSelectedHistory.pop().ifPresent(previous -> {
            redoSelectedHistory.push(selected);
            selected = previous;
            stagedSelected = previous;
        });
    }

    public void nextSelected() {
        redoSelectedHistory.pop().ifPresent(next -> {
            undoSelectedHistory.push(selected);
            selected = next;
            stagedSelected = next;
        });
    }

    /** Sets the selection without recording history, as when a project is loaded. */
    public void restoreSelection(NullableObjectId selection) {
        selected = selection == null ? NullableObjectId.NONE : selection;
        stagedSelected = selected;
    }

    // --- object operations ---

    public ObjectId allocateObjectId() {
        return allocator.allocate(stagedPool);
    }

    /**
     * Adds a default object of {@code type} under a fresh id to the staged pool, names it and
     * stages it as the selection.
     */
    public VtObject createObject(ObjectType type, String name) {
        VtObject object = DefaultObjects.create(type, allocateObjectId());
        stagedPool.add(object);
        objectInfo.getOrCreate(object).setName(name);
        stagedSelected = NullableObjectId.of(object.id());
        return object;
    }

    /**
     * Renumbers an object in the staged pool. References to it held by other objects are not rewritten.
     *
     * @throws IdConflictException if {@code newId} already belongs to another object; nothing is changed
     */
    public void changeObjectId(ObjectId oldId, ObjectId newId) throws IdConflictException {
        if (oldId.equals(newId)) return;
        if (stagedPool.contains(newId)) {
            throw new IdConflictException("ID already in use: " + newId);
        }
        Optional<VtObject> object = stagedPool.objectById(oldId);
        if (object.isEmpty()) return;

        stagedPool.replace(oldId, object.get().withId(newId));
        objectInfo.migrate(oldId, newId);
        stagedRenumbers.add(new Renumber(oldId, newId));
        if (oldId.equals(stagedSelected.id())) {
            stagedSelected = NullableObjectId.of(newId);
        }
        if (renaming != null && renaming.objectId().equals(oldId)) {
            renaming = new RenameState(newId, renaming.name());
        }
    }

    /** Removes the object from the staged pool; references to it are left dangling. */
    public void removeObject(ObjectId id) {
        stagedPool.remove(id);
        if (id.equals(stagedSelected.id())) {
            stagedSelected = NullableObjectId.NONE;
        }
    }

    public void sortObjectsBy(Comparator<? super VtObject> comparator) {
        stagedPool.sortObjectsBy(comparator);
    }

    public void sortByType() {
        sortObjectsBy(Comparator.comparingInt(o -> o.type().id()));
    }

    public void sortByName() {
        sortObjectsBy(Comparator.comparing(this::displayName));
    }

    public void sortById() {
        sortObjectsBy(Comparator.comparing(VtObject::id));
    }

    // --- renaming ---

    public void beginRename(ObjectId id) {
        String current = stagedPool.objectById(id).map(this::displayName).orElse("");
        renaming = new RenameState(id, current);
    }

    public void updateRename(String name) {
        if (renaming != null) {
            renaming = new RenameState(renaming.objectId(), name);
        }
    }

    public Optional<RenameState> renaming() {
        return Optional.ofNullable(renaming);
    }

    /**
     * Ends the rename in progress. With {@code apply} the typed name is stored (an empty name is ignored).
     *
     * @return true if a rename was in progress
     */
    public boolean finishRename(boolean apply) {
        if (renaming == null) return false;
        if (apply) {
            objectInfo.rename(renaming.objectId(), renaming.name());
        }
        renaming = null;
        return true;
    }

    // --- names ---

    public ObjectInfo getObjectInfo(VtObject object) {
        return objectInfo.getOrCreate(object);
    }

    public String displayName(VtObject object) {
        return objectInfo.displayName(object);
    }

    public ObjectInfoTable objectInfo() {
        return objectInfo;
    }

    public void setObjectInfo(ObjectInfoTable table) {
        this.objectInfo = table;
    }

    public int applySmartNaming(List<? extends VtObject> objects) {
        return NamingEngine.applySmartNaming(objects, objectInfo, stagedPool);
    }

    public String generateSmartNameForNewObject(ObjectType type) {
        return NamingEngine.smartNameForNewObject(type, stagedPool, objectInfo.displayedNameCounts(stagedPool));
    }

    // --- geometry and version ---

    public int maskSize() {
        return maskSize;
    }

    public void setMaskSize(int size) {
        this.maskSize = clampMaskSize(size);
    }

    private static int clampMaskSize(int size) {
        return Math.max(MIN_MASK_SIZE, Math.min(MAX_MASK_SIZE, size));
    }

    public Size softKeySize() {
        return new Size(softKeyWidth, softKeyHeight);
    }

    public int softKeyWidth() {
        return softKeyWidth;
    }

    public int softKeyHeight() {
        return softKeyHeight;
    }

    public VtVersion vtVersion() {
        return vtVersion;
    }

    public void setVtVersion(VtVersion version) {
        this.vtVersion = version;
    }
}
