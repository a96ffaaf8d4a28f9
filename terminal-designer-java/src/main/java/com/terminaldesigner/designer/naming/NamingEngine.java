package com.terminaldesigner.designer.naming;

import com.terminaldesigner.designer.info.ObjectInfoTable;
import com.terminaldesigner.pool.ObjectPool;
import com.terminaldesigner.pool.ObjectType;
import com.terminaldesigner.pool.VtObject;
import com.terminaldesigner.pool.VtObjects;

import java.util.*;

/**
 * Generates readable object names.
 *
 * Names are checked against a multiset of the names currently displayed (name to number of
 * objects showing it), so every generated name is free at the time it is handed out.
 */
public final class NamingEngine {

    public static final int MAX_NAME_LENGTH = 100;

    /** Upper bound for numeric suffixes; a pool cannot hold more objects than this. */
    private static final int MAX_SUFFIX = 65535;

    private NamingEngine() {}

    // --- contextual names ---

    /**
     * A name derived from the object's own attributes, if its kind has one:
     * keys by key code, buttons by key code, containers by height.
     */
    public static Optional<String> contextualName(VtObject object) {
        if (object instanceof VtObjects.Key key) {
            int code = key.keyCode();
            if (code == 0) return Optional.of("ACK/Enter Key");
            if (code == 1) return Optional.of("ESC Key");
            if (code >= 2 && code <= 7) return Optional.of("Soft Key " + (code - 1));
            return Optional.empty();
        }
        if (object instanceof VtObjects.Button button) {
            return switch (button.keyCode()) {
                case 0 -> Optional.of("OK Button");
                case 1 -> Optional.of("Cancel Button");
                default -> Optional.empty();
            };
        }
        if (object instanceof VtObjects.Container container) {
            if (container.height() < 100) return Optional.of("Header Container");
            if (container.height() > 300) return Optional.of("Main Container");
        }
        return Optional.empty();
    }

    // --- default names ---

    /**
     * Default name for the next object of {@code type}, given that {@code sameTypeCount} objects of
     * that kind already exist. The first object keeps the bare label while it is free; later ones
     * are numbered from {@code sameTypeCount + 1} upwards until a free name is found.
     */
    public static String smartDefaultName(ObjectType type, int sameTypeCount, Map<String, Integer> existingNames) {
        String base = baseLabel(type, sameTypeCount);
        if (sameTypeCount == 0 && isFree(base, existingNames)) {
            return base;
        }
        for (int counter = sameTypeCount + 1; counter <= MAX_SUFFIX + sameTypeCount; counter++) {
            String candidate = base + " " + counter;
            if (isFree(candidate, existingNames)) return candidate;
        }
        throw new IllegalStateException("No free name for " + base);
    }

    public static String smartNameForNewObject(ObjectType type, ObjectPool pool, Map<String, Integer> existingNames) {
        return smartDefaultName(type, pool.objectsByType(type).size(), existingNames);
    }

    private static String baseLabel(ObjectType type, int sameTypeCount) {
        if (type == ObjectType.DATA_MASK) {
            return sameTypeCount == 0 ? "Main Screen" : "Data Screen";
        }
        return ObjectTypeNames.friendlyName(type);
    }

    // --- child suggestions ---

    /** A name for a {@code childType} object about to be added under {@code parent}, if the pairing has one. */
    public static Optional<String> suggestNameForChild(VtObject parent, ObjectType childType, ObjectPool pool) {
        ObjectType parentType = parent.type();
        if (parentType == ObjectType.SOFT_KEY_MASK && childType == ObjectType.KEY) {
            return Optional.of("F" + (countChildren(parent, ObjectType.KEY, pool) + 1) + " Key");
        }
        if (parentType == ObjectType.CONTAINER && childType == ObjectType.BUTTON) {
            return Optional.of("Container Button");
        }
        if (parentType == ObjectType.CONTAINER && childType == ObjectType.OUTPUT_STRING) {
            return Optional.of("Container Label");
        }
        if (parentType == ObjectType.DATA_MASK && childType == ObjectType.CONTAINER) {
            return switch (countChildren(parent, ObjectType.CONTAINER, pool)) {
                case 0 -> Optional.of("Header Container");
                case 1 -> Optional.of("Main Container");
                case 2 -> Optional.of("Footer Container");
                default -> Optional.empty();
            };
        }
        return Optional.empty();
    }

    private static int countChildren(VtObject parent, ObjectType type, ObjectPool pool) {
        return (int) parent.referencedObjects().stream()
                .map(pool::objectById)
                .flatMap(Optional::stream)
                .filter(o -> o.type() == type)
                .count();
    }

    // --- validation ---

    public static NameCheck validateName(String name, Map<String, Integer> existingNames) {
        if (name == null || name.isBlank()) {
            return NameCheck.rejected("Name cannot be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            return NameCheck.rejected("Name is too long (max " + MAX_NAME_LENGTH + " characters)");
        }
        if (!isFree(name, existingNames)) {
            for (int counter = 2; counter <= MAX_SUFFIX; counter++) {
                String suggestion = name + " " + counter;
                if (isFree(suggestion, existingNames)) {
                    return NameCheck.taken("Name '" + name + "' already exists. Try '" + suggestion + "'", suggestion);
                }
            }
            return NameCheck.rejected("Name '" + name + "' already exists and all numbered variations up to "
                    + MAX_SUFFIX + " are taken");
        }
        return NameCheck.ok();
    }

    // --- batch naming ---

    /**
     * Names every object of {@code objects} that has no custom name yet, in iteration order.
     * Contextual names win over default names; a contextual name that is already displayed gets
     * the first free numeric suffix. The displayed-name multiset is built once and updated after
     * each assignment, so no two objects of {@code pool} end up showing the same name.
     *
     * @return number of objects that were named
     */
    public static int applySmartNaming(List<? extends VtObject> objects, ObjectInfoTable table, ObjectPool pool) {
        Map<String, Integer> existing = new HashMap<>(table.displayedNameCounts(pool));
        Map<ObjectType, Integer> seenPerType = new EnumMap<>(ObjectType.class);
        int named = 0;

        for (VtObject object : objects) {
            int sameTypeCount = seenPerType.getOrDefault(object.type(), 0);
            seenPerType.put(object.type(), sameTypeCount + 1);
            if (table.hasCustomName(object.id())) continue;

            // The object's own default name no longer counts as taken once it is renamed
            existing.computeIfPresent(table.displayName(object), (k, n) -> n > 1 ? n - 1 : null);

            String name = contextualName(object)
                    .map(n -> firstFree(n, existing))
                    .orElseGet(() -> smartDefaultName(object.type(), sameTypeCount, existing));
            table.rename(object.id(), name);
            existing.merge(name, 1, Integer::sum);
            named++;
        }
        return named;
    }

    private static String firstFree(String name, Map<String, Integer> existingNames) {
        if (isFree(name, existingNames)) return name;
        for (int counter = 2; counter <= MAX_SUFFIX; counter++) {
            String candidate = name + " " + counter;
            if (isFree(candidate, existingNames)) return candidate;
        }
        throw new IllegalStateException("No free name for " + name);
    }

    private static boolean isFree(String name, Map<String, Integer> existingNames) {
        return existingNames.getOrDefault(name, 0) == 0;
    }
}
