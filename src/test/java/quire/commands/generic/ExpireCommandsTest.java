package quire.commands.generic;

import quire.Config;
import quire.MockClientHandler;
import quire.Quire;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExpireCommandsTest {

    private MockClientHandler client;

    @BeforeEach
    public void setup() {
        Quire.init(new Config());
        client = new MockClientHandler();
    }

    private void expireNow(String key) {
        Quire.keyspace.getStore(client.getDbIndex()).get(key).expireAt = System.currentTimeMillis() - 1000;
    }

    @Test
    public void testTtlOfMissingAndPersistentKeys() {
        assertEquals(-2L, client.run("TTL", "missing"));
        assertEquals(-2L, client.run("PTTL", "missing"));
        client.run("SET", "k", "v");
        assertEquals(-1L, client.run("TTL", "k"));
        assertEquals(-1L, client.run("PTTL", "k"));
    }

    @Test
    public void testExpireAndTtl() {
        client.run("SET", "k", "v");
        assertEquals(1L, client.run("EXPIRE", "k", "100"));

        long ttl = (Long) client.run("TTL", "k");
        assertTrue(ttl >= 99 && ttl <= 100, "ttl=" + ttl);
        long pttl = (Long) client.run("PTTL", "k");
        assertTrue(pttl > 99_000 && pttl <= 100_000, "pttl=" + pttl);
    }

    @Test
    public void testPexpireAndAbsoluteForms() {
        client.run("SET", "a", "1");
        client.run("SET", "b", "2");
        client.run("SET", "c", "3");
        long now = System.currentTimeMillis();

        assertEquals(1L, client.run("PEXPIRE", "a", "50000"));
        assertEquals(1L, client.run("EXPIREAT", "b", String.valueOf(now / 1000 + 100)));
        assertEquals(1L, client.run("PEXPIREAT", "c", String.valueOf(now + 30_000)));

        assertTrue((Long) client.run("PTTL", "a") <= 50_000);
        long ttlB = (Long) client.run("TTL", "b");
        assertTrue(ttlB >= 98 && ttlB <= 100, "ttl=" + ttlB);
        long pttlC = (Long) client.run("PTTL", "c");
        assertTrue(pttlC > 25_000 && pttlC <= 30_000, "pttl=" + pttlC);
    }

    @Test
    public void testExpireOnMissingKey() {
        assertEquals(0L, client.run("EXPIRE", "missing", "10"));
        assertFalse(Quire.keyspace.exists(0, "missing"));
    }

    @Test
    public void testExpireRejectsBadNumbers() {
        client.run("SET", "k", "v");
        client.run("EXPIRE", "k", "soon");
        assertEquals("ERR value is not an integer or out of range", client.lastError);
        client.run("EXPIRE", "k", String.valueOf(Long.MAX_VALUE));
        assertEquals("ERR value is not an integer or out of range", client.lastError);
        assertEquals(-1L, client.run("TTL", "k"));
    }

    @Test
    public void testNonPositiveExpireDeletesKey() {
        client.run("SET", "k", "v");
        assertEquals(1L, client.run("EXPIRE", "k", "0"));
        assertEquals(0L, client.run("EXISTS", "k"));

        client.run("SET", "j", "v");
        assertEquals(1L, client.run("PEXPIRE", "j", "-5"));
        assertNull(client.run("GET", "j"));
    }

    @Test
    public void testPersist() {
        client.run("SET", "k", "v");
        assertEquals(0L, client.run("PERSIST", "k"));
        client.run("EXPIRE", "k", "100");
        assertEquals(1L, client.run("PERSIST", "k"));
        assertEquals(-1L, client.run("TTL", "k"));
        assertEquals(0L, client.run("PERSIST", "missing"));
    }

    @Test
    public void testExpiredKeyIsGoneForEveryReader() {
        client.run("SET", "s", "v");
        client.run("RPUSH", "l", "x");
        client.run("SADD", "set", "m");
        expireNow("s");
        expireNow("l");
        expireNow("set");

        assertNull(client.run("GET", "s"));
        assertEquals(0L, client.run("LLEN", "l"));
        assertEquals("none", client.run("TYPE", "set"));
        assertEquals(0L, client.run("DBSIZE"));
        assertEquals(3, Quire.keyspace.getExpiredKeys());
    }

    @Test
    public void testWritesStartFreshOnExpiredKey() {
        client.run("SET", "n", "41");
        client.run("RPUSH", "l", "old");
        client.run("SET", "s", "abc");
        expireNow("n");
        expireNow("l");
        expireNow("s");

        assertEquals(1L, client.run("INCR", "n"));
        assertEquals(1L, client.run("RPUSH", "l", "new"));
        assertEquals(3L, client.run("APPEND", "s", "xyz"));
        assertEquals(-1L, client.run("TTL", "n"));
    }

    @Test
    public void testSetClearsTimeToLive() {
        client.run("SET", "k", "v");
        client.run("EXPIRE", "k", "100");
        client.run("SET", "k", "w");
        assertEquals(-1L, client.run("TTL", "k"));
    }

    @Test
    public void testInPlaceWritesKeepTimeToLive() {
        client.run("SET", "n", "1");
        client.run("EXPIRE", "n", "100");
        client.run("INCR", "n");
        client.run("INCRBYFLOAT", "n", "0.5");
        client.run("APPEND", "n", "0");

        assertEquals("2.50", client.run("GET", "n"));
        assertTrue((Long) client.run("TTL", "n") > 0);
    }

    @Test
    public void testSetWithExpiry() {
        assertEquals("OK", client.run("SET", "k", "v", "EX", "100"));
        long ttl = (Long) client.run("TTL", "k");
        assertTrue(ttl >= 99 && ttl <= 100, "ttl=" + ttl);

        assertEquals("OK", client.run("SET", "p", "v", "px", "5000"));
        assertTrue((Long) client.run("PTTL", "p") <= 5000);

        client.run("SET", "k", "v", "EX", "0");
        assertEquals("ERR invalid expire time in set", client.lastError);
        client.run("SET", "k", "v", "EX", "ten");
        assertEquals("ERR value is not an integer or out of range", client.lastError);
        client.run("SET", "k", "v", "EX");
        assertEquals("ERR syntax error", client.lastError);
    }

    @Test
    public void testDelOfExpiredKeyCountsNothing() {
        client.run("SET", "k", "v");
        expireNow("k");
        assertEquals(0L, client.run("DEL", "k"));
    }
}
