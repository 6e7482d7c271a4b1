package quire.commands.generic;

import quire.Config;
import quire.MockClientHandler;
import quire.Quire;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeyCommandsTest {

    private MockClientHandler client;

    @BeforeEach
    public void setup() {
        Quire.init(new Config());
        client = new MockClientHandler();
    }

    @Test
    public void testDelAndExists() {
        client.run("SET", "a", "1");
        client.run("SET", "b", "2");
        assertEquals(1L, client.run("EXISTS", "a"));
        assertEquals(2L, client.run("DEL", "a", "b", "c"));
        assertEquals(0L, client.run("EXISTS", "a"));
    }

    @Test
    public void testType() {
        client.run("SET", "str", "1");
        client.run("RPUSH", "list", "x");
        client.run("HSET", "hash", "f", "v");
        client.run("SADD", "set", "m");
        client.run("ZADD", "zset", "1", "m");

        assertEquals("zset", client.run("TYPE", "zset"));
        assertEquals("string", client.run("TYPE", "str"));
        assertEquals("list", client.run("TYPE", "list"));
        assertEquals("hash", client.run("TYPE", "hash"));
        assertEquals("set", client.run("TYPE", "set"));
        assertEquals("none", client.run("TYPE", "missing"));
    }

    @Test
    public void testRename() {
        client.run("SET", "a", "1");
        assertEquals("OK", client.run("RENAME", "a", "b"));
        assertFalse(Quire.keyspace.exists(0, "a"));
        assertEquals("1", client.run("GET", "b"));

        client.run("RENAME", "missing", "x");
        assertEquals("ERR no such key", client.lastError);
        client.run("RENAME", "b", "b");
        assertEquals("ERR source and destination objects are the same", client.lastError);
    }

    @Test
    public void testRenameInvalidatesBothWatchedKeys() {
        MockClientHandler watcherA = new MockClientHandler();
        MockClientHandler watcherB = new MockClientHandler();
        client.run("SET", "a", "1");
        watcherA.run("WATCH", "a");
        watcherB.run("WATCH", "b");

        client.run("RENAME", "a", "b");

        watcherA.run("MULTI");
        watcherA.run("PING");
        assertNull(watcherA.run("EXEC"));
        watcherB.run("MULTI");
        watcherB.run("PING");
        assertNull(watcherB.run("EXEC"));
    }

    @Test
    public void testRenameOfMissingKeyOntoItselfReportsSameObject() {
        client.run("RENAME", "missing", "missing");
        assertEquals("ERR source and destination objects are the same", client.lastError);
    }

    @Test
    public void testRenameNx() {
        client.run("SET", "a", "1");
        client.run("SET", "b", "2");
        assertEquals(0L, client.run("RENAMENX", "a", "b"));
        assertEquals("2", client.run("GET", "b"));
        assertEquals(1L, client.run("EXISTS", "a"));

        assertEquals(1L, client.run("RENAMENX", "a", "c"));
        assertEquals(0L, client.run("EXISTS", "a"));
        assertEquals("1", client.run("GET", "c"));

        client.run("RENAMENX", "missing", "d");
        assertEquals("ERR no such key", client.lastError);
    }

    @Test
    public void testRenameKeepsTimeToLive() {
        client.run("SET", "a", "1");
        client.run("EXPIRE", "a", "100");
        client.run("RENAME", "a", "b");
        assertTrue((Long) client.run("TTL", "b") > 0);
    }

    @Test
    public void testMove() {
        client.run("SET", "k", "v");
        client.run("EXPIRE", "k", "100");
        assertEquals(1L, client.run("MOVE", "k", "3"));
        assertEquals(0L, client.run("EXISTS", "k"));

        client.run("SELECT", "3");
        assertEquals("v", client.run("GET", "k"));
        assertTrue((Long) client.run("TTL", "k") > 0);

        assertEquals(0L, client.run("MOVE", "missing", "0"));
        client.run("MOVE", "k", "3");
        assertEquals("ERR source and destination objects are the same", client.lastError);
        client.run("MOVE", "k", "99");
        assertEquals("ERR index out of range", client.lastError);
        client.run("MOVE", "k", "x");
        assertEquals("ERR index out of range", client.lastError);
    }

    @Test
    public void testMoveRefusesExistingTarget() {
        client.run("SET", "k", "src");
        client.run("SELECT", "1");
        client.run("SET", "k", "dst");
        client.run("SELECT", "0");

        assertEquals(0L, client.run("MOVE", "k", "1"));
        assertEquals("src", client.run("GET", "k"));
    }

    @Test
    public void testMoveInvalidatesWatchersInBothDatabases() {
        MockClientHandler source = new MockClientHandler();
        MockClientHandler target = new MockClientHandler();
        client.run("SET", "k", "v");
        source.run("WATCH", "k");
        target.run("SELECT", "2");
        target.run("WATCH", "k");

        client.run("MOVE", "k", "2");

        source.run("MULTI");
        source.run("PING");
        assertNull(source.run("EXEC"));
        target.run("MULTI");
        target.run("PING");
        assertNull(target.run("EXEC"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testKeys() {
        client.run("MSET", "user:1", "a", "user:2", "b", "order:1", "c", "u", "d");

        assertEquals(new HashSet<>(Arrays.asList("user:1", "user:2", "order:1", "u")),
                new HashSet<>((List<Object>) client.run("KEYS", "*")));
        assertEquals(new HashSet<>(Arrays.asList("user:1", "user:2")),
                new HashSet<>((List<Object>) client.run("KEYS", "user:*")));
        assertEquals(Arrays.asList("order:1"), client.run("KEYS", "o?der:[0-9]"));
        assertTrue(((List<Object>) client.run("KEYS", "nothing*")).isEmpty());
    }

    @Test
    public void testKeysSkipsExpiredKeys() {
        client.run("SET", "a", "1");
        client.run("SET", "b", "2");
        Quire.keyspace.getStore(0).get("b").expireAt = System.currentTimeMillis() - 1000;

        assertEquals(Arrays.asList("a"), client.run("KEYS", "*"));
        assertFalse(Quire.keyspace.containsKey(0, "b"));
    }

    @Test
    public void testRandomKey() {
        assertNull(client.run("RANDOMKEY"));

        client.run("SET", "a", "1");
        client.run("SET", "b", "2");
        Object key = client.run("RANDOMKEY");
        assertTrue("a".equals(key) || "b".equals(key), String.valueOf(key));
    }

    @Test
    public void testRandomKeyNeverReturnsExpiredKey() {
        client.run("SET", "a", "1");
        client.run("SET", "b", "2");
        Quire.keyspace.getStore(0).get("a").expireAt = System.currentTimeMillis() - 1000;

        for (int i = 0; i < 20; i++) {
            assertEquals("b", client.run("RANDOMKEY"));
        }
        client.run("DEL", "b");
        assertNull(client.run("RANDOMKEY"));
    }
}
