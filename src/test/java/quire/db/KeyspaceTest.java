package quire.db;

import quire.transaction.TouchNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeyspaceTest {

    // Records notifications as "db:key" and "flush:db".
    private static class RecordingNotifier implements TouchNotifier {
        final List<String> events = new ArrayList<>();

        @Override
        public void touch(int dbIndex, String key) {
            events.add(dbIndex + ":" + key);
        }

        @Override
        public void touchOnFlush(int dbIndex) {
            events.add("flush:" + dbIndex);
        }
    }

    private Keyspace keyspace;
    private RecordingNotifier notifier;

    @BeforeEach
    public void setup() {
        keyspace = new Keyspace(4);
        notifier = new RecordingNotifier();
        keyspace.setTouchNotifier(notifier);
    }

    private static ValueEntry str(String s) {
        return ValueEntry.string(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testPutAndRemoveSignal() {
        keyspace.put(1, "a", str("1"));
        assertNotNull(keyspace.remove(1, "a"));

        assertEquals(2, keyspace.getDirty());
        assertEquals(List.of("1:a", "1:a"), notifier.events);
    }

    @Test
    public void testRemovingMissingKeyIsSilent() {
        assertNull(keyspace.remove(0, "missing"));

        assertEquals(0, keyspace.getDirty());
        assertTrue(notifier.events.isEmpty());
    }

    @Test
    public void testReadsDoNotSignal() {
        keyspace.put(0, "a", str("1"));
        notifier.events.clear();

        keyspace.get(0, "a");
        keyspace.exists(0, "a");
        keyspace.getOrCreate(0, "list", DataType.LIST);

        assertEquals(1, keyspace.getDirty());
        assertTrue(notifier.events.isEmpty());
    }

    @Test
    public void testGetOrCreateRejectsOtherType() {
        keyspace.put(0, "s", str("x"));

        RuntimeException e = assertThrows(RuntimeException.class,
                () -> keyspace.getOrCreate(0, "s", DataType.SET));
        assertEquals(Keyspace.WRONGTYPE, e.getMessage());
    }

    @Test
    public void testEmptyAggregateIsRemoved() {
        ValueEntry list = keyspace.getOrCreate(0, "l", DataType.LIST);
        list.asList().add("x");
        keyspace.removeIfEmpty(0, "l");
        assertTrue(keyspace.exists(0, "l"));

        list.asList().clear();
        keyspace.removeIfEmpty(0, "l");
        assertFalse(keyspace.exists(0, "l"));
    }

    @Test
    public void testFlushNotifiesBeforeClearingAndCountsRemovedKeys() {
        keyspace.put(2, "a", str("1"));
        keyspace.put(2, "b", str("2"));
        keyspace.put(3, "c", str("3"));
        long before = keyspace.getDirty();

        keyspace.setTouchNotifier(new TouchNotifier() {
            @Override
            public void touch(int dbIndex, String key) {
            }

            @Override
            public void touchOnFlush(int dbIndex) {
                assertEquals(2, keyspace.size(dbIndex));
            }
        });

        assertEquals(2, keyspace.flush(2));
        assertEquals(before + 2, keyspace.getDirty());
        assertEquals(0, keyspace.size(2));
        assertEquals(1, keyspace.size(3));
    }

    @Test
    public void testFlushAllAlwaysCountsAsChange() {
        keyspace.flushAll();

        assertEquals(1, keyspace.getDirty());
        assertEquals(List.of("flush:" + TouchNotifier.ALL), notifier.events);
    }

    @Test
    public void testFlushAllClearsEveryDatabase() {
        keyspace.put(0, "a", str("1"));
        keyspace.put(3, "b", str("2"));

        assertEquals(2, keyspace.flushAll());
        assertEquals(0, keyspace.size());
    }

    @Test
    public void testDbIndexOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> keyspace.get(4, "a"));
        assertThrows(IllegalArgumentException.class, () -> keyspace.get(-1, "a"));
    }

    @Test
    public void testExpiredKeyIsRemovedOnAccessWithoutCountingAsChange() {
        List<String> expired = new ArrayList<>();
        keyspace.setExpiredKeyHandler((db, key) -> expired.add(db + ":" + key));
        keyspace.put(2, "k", str("v"));
        keyspace.getStore(2).get("k").expireAt = System.currentTimeMillis() - 1;
        long dirty = keyspace.getDirty();
        notifier.events.clear();

        assertNull(keyspace.get(2, "k"));
        assertFalse(keyspace.containsKey(2, "k"));
        assertEquals(dirty, keyspace.getDirty());
        assertEquals(List.of("2:k"), notifier.events);
        assertEquals(List.of("2:k"), expired);
        assertEquals(1, keyspace.getExpiredKeys());
    }

    @Test
    public void testNothingExpiresWhileLoading() {
        keyspace.put(0, "k", str("v"));
        keyspace.getStore(0).get("k").expireAt = System.currentTimeMillis() - 1;

        keyspace.setLoading(true);
        assertTrue(keyspace.exists(0, "k"));
        assertEquals(0, keyspace.activeExpireCycle(System.currentTimeMillis()));

        keyspace.setLoading(false);
        assertFalse(keyspace.exists(0, "k"));
    }

    @Test
    public void testActiveExpireCycleSweepsEveryDatabase() {
        long now = System.currentTimeMillis();
        keyspace.put(0, "a", str("1"));
        keyspace.put(3, "b", str("2"));
        keyspace.put(3, "c", str("3"));
        keyspace.getStore(0).get("a").expireAt = now - 10;
        keyspace.getStore(3).get("b").expireAt = now - 10;
        keyspace.getStore(3).get("c").expireAt = now + 60_000;

        assertEquals(2, keyspace.activeExpireCycle(now));
        assertEquals(0, keyspace.size(0));
        assertEquals(1, keyspace.size(3));
        assertTrue(keyspace.containsKey(3, "c"));
    }

    @Test
    public void testSetExpireAndPersistSignal() {
        keyspace.put(1, "k", str("v"));
        notifier.events.clear();
        long dirty = keyspace.getDirty();

        assertTrue(keyspace.setExpire(1, "k", System.currentTimeMillis() + 60_000));
        assertTrue(keyspace.persist(1, "k"));
        assertFalse(keyspace.persist(1, "k"));
        assertFalse(keyspace.setExpire(1, "missing", 1));

        assertEquals(-1, keyspace.getExpire(1, "k"));
        assertEquals(dirty + 2, keyspace.getDirty());
        assertEquals(List.of("1:k", "1:k"), notifier.events);
    }
}
