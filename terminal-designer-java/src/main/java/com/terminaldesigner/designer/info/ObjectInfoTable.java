package com.terminaldesigner.designer.info;

import com.terminaldesigner.pool.ObjectId;
import com.terminaldesigner.pool.ObjectPool;
import com.terminaldesigner.pool.VtObject;

import java.util.*;

/**
 * Metadata for every object the editor has seen, keyed by object id.
 *
 * Entries are created lazily on first lookup. When an object is renumbered the entry is moved
 * with {@link #migrate}, so its unique id and name follow the object.
 */
public class ObjectInfoTable {

    private final Map<ObjectId, ObjectInfo> entries = new LinkedHashMap<>();

    public ObjectInfo getOrCreate(VtObject object) {
        return entries.computeIfAbsent(object.id(), id -> ObjectInfo.forObject(object));
    }

    public Optional<ObjectInfo> find(ObjectId id) {
        return Optional.ofNullable(entries.get(id));
    }

    public String displayName(VtObject object) {
        ObjectInfo info = entries.get(object.id());
        return info != null ? info.getName(object) : ObjectInfo.defaultName(object);
    }

    public boolean hasCustomName(ObjectId id) {
        ObjectInfo info = entries.get(id);
        return info != null && info.hasCustomName();
    }

    /** Sets the name of the object with {@code id}; empty names are ignored. */
    public void rename(ObjectId id, String name) {
        entries.computeIfAbsent(id, k -> new ObjectInfo()).setName(name);
    }

    /**
     * Moves the entry of {@code oldId} to {@code newId}. Any entry already stored under
     * {@code newId} is replaced.
     */
    public void migrate(ObjectId oldId, ObjectId newId) {
        if (oldId.equals(newId)) return;
        ObjectInfo info = entries.remove(oldId);
        if (info != null) {
            entries.put(newId, info);
        } else {
            entries.remove(newId);
        }
    }

    /** How many objects of {@code pool} display each name. */
    public Map<String, Integer> displayedNameCounts(ObjectPool pool) {
        Map<String, Integer> counts = new HashMap<>();
        for (VtObject object : pool.objects()) {
            counts.merge(displayName(object), 1, Integer::sum);
        }
        return counts;
    }

    /** Custom names by numeric id, in ascending id order. */
    public SortedMap<Integer, String> namesById() {
        SortedMap<Integer, String> names = new TreeMap<>();
        for (var e : entries.entrySet()) {
            e.getValue().customName().ifPresent(n -> names.put(e.getKey().value(), n));
        }
        return names;
    }

    /**
     * Rebuilds a table from saved names. Every object of {@code pool} gets a fresh unique id;
     * names whose id has no object in the pool are dropped.
     */
    public static ObjectInfoTable restore(ObjectPool pool, Map<Integer, String> namesById) {
        ObjectInfoTable table = new ObjectInfoTable();
        for (VtObject object : pool.objects()) {
            ObjectInfo info = table.getOrCreate(object);
            String name = namesById.get(object.id().value());
            if (name != null) info.setName(name);
        }
        return table;
    }

    public int size() {
        return entries.size();
    }
}
