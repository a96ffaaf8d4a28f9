package com.terminaldesigner.designer;

import com.terminaldesigner.designer.info.ObjectInfo;
import com.terminaldesigner.designer.info.ObjectInfoTable;
import com.terminaldesigner.pool.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ObjectInfoTableTest {

    private static VtObjects.DataMask dataMask(int id) {
        return new VtObjects.DataMask(ObjectId.of(id), 0, NullableObjectId.NONE, List.of(), List.of());
    }

    @Test
    void defaultNameIsIdAndKind() {
        ObjectInfo info = new ObjectInfo();
        assertEquals("5: DataMask", info.getName(dataMask(5)));
        assertFalse(info.hasCustomName());
    }

    @Test
    void emptyNameIsIgnored() {
        ObjectInfo info = new ObjectInfo();
        info.setName("Main Screen");
        info.setName("");
        info.setName(null);
        assertEquals("Main Screen", info.getName(dataMask(5)));
    }

    @Test
    void infosAreEqualOnlyByUniqueId() {
        ObjectInfo a = new ObjectInfo();
        ObjectInfo b = new ObjectInfo();
        a.setName("Same");
        b.setName("Same");
        assertNotEquals(a, b);
        assertEquals(a, a);
    }

    @Test
    void getOrCreateReturnsSameEntry() {
        ObjectInfoTable table = new ObjectInfoTable();
        VtObject mask = dataMask(5);

        ObjectInfo first = table.getOrCreate(mask);
        assertSame(first, table.getOrCreate(mask));
        assertEquals(1, table.size());
    }

    @Test
    void displayNameDoesNotCreateEntries() {
        ObjectInfoTable table = new ObjectInfoTable();
        assertEquals("5: DataMask", table.displayName(dataMask(5)));
        assertEquals(0, table.size());
    }

    @Test
    void migrateMovesNameAndUniqueId() {
        ObjectInfoTable table = new ObjectInfoTable();
        ObjectInfo info = table.getOrCreate(dataMask(10));
        info.setName("Main Screen");
        UUID uniqueId = info.uniqueId();

        table.migrate(ObjectId.of(10), ObjectId.of(20));

        assertTrue(table.find(ObjectId.of(10)).isEmpty());
        ObjectInfo moved = table.find(ObjectId.of(20)).orElseThrow();
        assertEquals(uniqueId, moved.uniqueId());
        assertEquals("Main Screen", table.displayName(dataMask(20)));
    }

    @Test
    void migrateWithoutEntryDropsStaleTarget() {
        ObjectInfoTable table = new ObjectInfoTable();
        table.rename(ObjectId.of(20), "Stale");

        table.migrate(ObjectId.of(10), ObjectId.of(20));

        assertFalse(table.hasCustomName(ObjectId.of(20)));
    }

    @Test
    void displayedNameCountsIncludeDefaults() {
        ObjectPool pool = new ObjectPool(List.of(dataMask(1), dataMask(2), dataMask(3)));
        ObjectInfoTable table = new ObjectInfoTable();
        table.rename(ObjectId.of(1), "Screen");
        table.rename(ObjectId.of(2), "Screen");

        Map<String, Integer> counts = table.displayedNameCounts(pool);

        assertEquals(2, counts.get("Screen"));
        assertEquals(1, counts.get("3: DataMask"));
    }

    @Test
    void restoreDropsNamesOfUnknownIds() {
        ObjectPool pool = new ObjectPool(List.of(dataMask(1), dataMask(2)));
        ObjectInfoTable table = ObjectInfoTable.restore(pool, Map.of(1, "Main Screen", 99, "Gone"));

        assertEquals(Map.of(1, "Main Screen"), table.namesById());
        assertEquals(2, table.size());
    }
}
