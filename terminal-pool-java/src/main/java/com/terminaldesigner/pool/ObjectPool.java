package com.terminaldesigner.pool;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Insertion-ordered set of objects keyed by id.
 *
 * The pool never validates references: removing an object leaves references to it dangling,
 * and readers treat an unresolved id as a missing object. Equality is structural and
 * order-sensitive, which is what change detection between staged and committed pools relies on.
 */
public class ObjectPool {

    /** Smallest data mask edge the designer offers. */
    public static final int MIN_MASK_SIZE = 200;
    public static final int MIN_SOFT_KEY_WIDTH = 60;
    public static final int MIN_SOFT_KEY_HEIGHT = 32;

    /** Bound for every recursive walk; pools may contain reference cycles. */
    static final int MAX_DEPTH = 32;

    private final LinkedHashMap<ObjectId, VtObject> objects = new LinkedHashMap<>();

    public ObjectPool() {}

    public ObjectPool(Collection<? extends VtObject> initial) {
        for (VtObject o : initial) {
            if (objects.containsKey(o.id())) {
                System.err.println("[terminal-pool] WARNING: duplicate object id ignored: " + o.id());
                continue;
            }
            objects.put(o.id(), o);
        }
    }

    // --- lookup ---

    public Optional<VtObject> objectById(ObjectId id) {
        return Optional.ofNullable(objects.get(id));
    }

    public Optional<VtObject> objectById(NullableObjectId id) {
        return id.isNone() ? Optional.empty() : objectById(id.id());
    }

    public boolean contains(ObjectId id) {
        return objects.containsKey(id);
    }

    public List<VtObject> objects() {
        return List.copyOf(objects.values());
    }

    public int size() {
        return objects.size();
    }

    public boolean isEmpty() {
        return objects.isEmpty();
    }

    public List<VtObject> objectsByType(ObjectType type) {
        return objects.values().stream()
                .filter(o -> o.type() == type)
                .collect(Collectors.toList());
    }

    public List<VtObject> objectsByTypes(ObjectType... types) {
        Set<ObjectType> wanted = EnumSet.noneOf(ObjectType.class);
        wanted.addAll(Arrays.asList(types));
        return objects.values().stream()
                .filter(o -> wanted.contains(o.type()))
                .collect(Collectors.toList());
    }

    /** Every object whose references include {@code id}, in pool order. */
    public List<VtObject> parentObjects(ObjectId id) {
        return objects.values().stream()
                .filter(o -> o.referencedObjects().contains(id))
                .collect(Collectors.toList());
    }

    public Optional<VtObjects.WorkingSet> workingSetObject() {
        for (VtObject o : objects.values()) {
            if (o instanceof VtObjects.WorkingSet ws) return Optional.of(ws);
        }
        return Optional.empty();
    }

    public Optional<ObjectId> maxObjectId() {
        return objects.keySet().stream().max(Comparator.naturalOrder());
    }

    // --- mutation ---

    /** Appends {@code object}; an object already stored under the same id is replaced in place. */
    public void add(VtObject object) {
        objects.put(object.id(), object);
    }

    /** Removes only the object with {@code id}. Returns the removed object, if any. */
    public Optional<VtObject> remove(ObjectId id) {
        return Optional.ofNullable(objects.remove(id));
    }

    /**
     * Replaces the object stored under {@code object.id()}, keeping its position.
     *
     * @return false if no object with that id exists (the pool is unchanged)
     */
    public boolean replace(VtObject object) {
        if (!objects.containsKey(object.id())) return false;
        objects.put(object.id(), object);
        return true;
    }

    /**
     * Replaces the object stored under {@code oldId} with {@code object}, which may carry a different id.
     * The new object takes the old one's position.
     *
     * @return false if {@code oldId} is absent, or if {@code object.id()} already belongs to another object
     */
    public boolean replace(ObjectId oldId, VtObject object) {
        if (!objects.containsKey(oldId)) return false;
        if (!oldId.equals(object.id()) && objects.containsKey(object.id())) return false;

        LinkedHashMap<ObjectId, VtObject> reordered = new LinkedHashMap<>();
        for (Map.Entry<ObjectId, VtObject> e : objects.entrySet()) {
            if (e.getKey().equals(oldId)) {
                reordered.put(object.id(), object);
            } else {
                reordered.put(e.getKey(), e.getValue());
            }
        }
        objects.clear();
        objects.putAll(reordered);
        return true;
    }

    public void sortObjectsBy(Comparator<? super VtObject> comparator) {
        List<VtObject> sorted = new ArrayList<>(objects.values());
        sorted.sort(comparator);
        objects.clear();
        for (VtObject o : sorted) objects.put(o.id(), o);
    }

    /** Independent copy; objects are immutable so they are shared. */
    public ObjectPool copy() {
        ObjectPool copy = new ObjectPool();
        copy.objects.putAll(objects);
        return copy;
    }

    // --- geometry ---

    /**
     * Pixel extent of {@code object}.
     * <ul>
     *   <li>objects with a declared size report it</li>
     *   <li>object pointers report their target's size</li>
     *   <li>layout parents without a declared size report the extent of their positioned children</li>
     *   <li>anything else, and any unresolved id, is (0,0)</li>
     * </ul>
     */
    public Size contentSize(VtObject object) {
        return contentSize(object, 0);
    }

    private Size contentSize(VtObject object, int depth) {
        if (depth > MAX_DEPTH) return Size.EMPTY;
        if (object instanceof SizedObject sized) {
            return new Size(sized.width(), sized.height());
        }
        if (object instanceof VtObjects.ObjectPointer pointer) {
            return objectById(pointer.value())
                    .map(target -> contentSize(target, depth + 1))
                    .orElse(Size.EMPTY);
        }
        return childExtent(object, depth);
    }

    private Size childExtent(VtObject parent, int depth) {
        Size extent = Size.EMPTY;
        for (ObjectRef ref : parent.objectRefs()) {
            Optional<VtObject> child = objectById(ref.id());
            if (child.isEmpty()) continue;
            extent = extent.union(ref.offset().x(), ref.offset().y(), contentSize(child.get(), depth + 1));
        }
        return extent;
    }

    /**
     * Smallest square mask that fits the children of every data, alarm and window mask, and the
     * smallest soft key designator that fits the children of every key, never below the floors.
     */
    public MaskSizes minimumMaskSizes() {
        int maskSize = MIN_MASK_SIZE;
        for (VtObject mask : objectsByTypes(ObjectType.DATA_MASK, ObjectType.ALARM_MASK, ObjectType.WINDOW_MASK)) {
            Size extent = childExtent(mask, 0);
            maskSize = Math.max(maskSize, Math.max(extent.width(), extent.height()));
        }

        int keyWidth = MIN_SOFT_KEY_WIDTH;
        int keyHeight = MIN_SOFT_KEY_HEIGHT;
        for (VtObject key : objectsByType(ObjectType.KEY)) {
            Size extent = childExtent(key, 0);
            keyWidth = Math.max(keyWidth, extent.width());
            keyHeight = Math.max(keyHeight, extent.height());
        }
        return new MaskSizes(maskSize, keyWidth, keyHeight);
    }

    // --- equality ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectPool other)) return false;
        return new ArrayList<>(objects.values()).equals(new ArrayList<>(other.objects.values()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(objects.values()).hashCode();
    }

    @Override
    public String toString() {
        return "ObjectPool[" + objects.size() + " objects]";
    }
}
